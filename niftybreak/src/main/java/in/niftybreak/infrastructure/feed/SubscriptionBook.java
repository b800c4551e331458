package in.niftybreak.infrastructure.feed;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Instrument tokens a feed should be subscribed to, in first-subscribed order.
 */
public final class SubscriptionBook {

    private final Set<String> tokens = new LinkedHashSet<>();

    /**
     * Add tokens.
     *
     * @return the tokens that were not already present
     */
    public synchronized List<String> add(Collection<String> requested) {
        List<String> added = new ArrayList<>();
        for (String token : requested) {
            if (token != null && !token.isBlank() && tokens.add(token)) {
                added.add(token);
            }
        }
        return added;
    }

    public synchronized boolean contains(String token) {
        return tokens.contains(token);
    }

    /**
     * Everything subscribed so far, for resubscription after a reconnect.
     */
    public synchronized List<String> all() {
        return new ArrayList<>(tokens);
    }

    public synchronized int size() {
        return tokens.size();
    }

    public synchronized void clear() {
        tokens.clear();
    }
}
