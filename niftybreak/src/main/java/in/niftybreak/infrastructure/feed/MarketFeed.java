package in.niftybreak.infrastructure.feed;

import java.util.Collection;

/**
 * Real-time market data feed keyed by instrument token.
 *
 * Lifecycle:
 * 1. connect() - start the connection (may complete asynchronously)
 * 2. subscribe() - any time; subscriptions made before the connection is up
 *    are sent once it is, and all subscriptions are re-sent after a reconnect
 * 3. disconnect() - stop and release resources
 */
public interface MarketFeed {

    void connect();

    void subscribe(Collection<String> tokens);

    void disconnect();

    boolean isConnected();
}
