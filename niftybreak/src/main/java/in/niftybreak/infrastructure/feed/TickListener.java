package in.niftybreak.infrastructure.feed;

import in.niftybreak.domain.data.Tick;

/**
 * Receives ticks on the feed's thread. Must not block.
 */
@FunctionalInterface
public interface TickListener {
    void onTick(Tick tick);
}
