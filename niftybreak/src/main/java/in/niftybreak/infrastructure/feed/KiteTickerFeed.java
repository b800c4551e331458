package in.niftybreak.infrastructure.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.niftybreak.config.ConnectionSettings;
import in.niftybreak.domain.data.Tick;
import in.niftybreak.infrastructure.common.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Kite Ticker market feed.
 *
 * WebSocket: wss://ws.kite.trade?api_key=..&access_token=..
 * Subscribe: {"a":"subscribe","v":[tokens]} then {"a":"mode","v":["quote",[tokens]]}
 *
 * Ticks arrive as binary frames; a 1-byte frame is a heartbeat. On close or
 * error the feed reconnects with RetryPolicy.forFeed() backoff and re-sends
 * every subscription in the SubscriptionBook.
 */
public final class KiteTickerFeed implements MarketFeed {
    private static final Logger log = LoggerFactory.getLogger(KiteTickerFeed.class);

    private static final String WS_URL = "wss://ws.kite.trade";
    private static final String MODE_QUOTE = "quote";
    private static final BigDecimal PAISE = BigDecimal.valueOf(100);

    private enum WsState {
        DISCONNECTED, CONNECTING, CONNECTED, RECONNECT_REQUIRED
    }

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String apiKey;
    private final String accessToken;
    private final TickListener listener;
    private final Clock clock;
    private final RetryPolicy retryPolicy = RetryPolicy.forFeed();
    private final SubscriptionBook subscriptions = new SubscriptionBook();
    private final AtomicReference<WebSocket> wsRef = new AtomicReference<>();

    private volatile WsState wsState = WsState.DISCONNECTED;
    private volatile boolean stopped = false;

    private final ScheduledExecutorService reconnectScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "kite-reconnect");
        t.setDaemon(true);
        return t;
    });

    public KiteTickerFeed(String apiKey, String accessToken, TickListener listener, Clock clock) {
        this.apiKey = apiKey;
        this.accessToken = accessToken;
        this.listener = listener;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public void connect() {
        if (wsState != WsState.DISCONNECTED) {
            return;
        }
        stopped = false;
        retryPolicy.reset();
        wsState = WsState.CONNECTING;
        log.info("[KITE] Connecting ticker with apiKey={}", ConnectionSettings.mask(apiKey));
        reconnectScheduler.submit(this::connectWithRetry);
    }

    @Override
    public void subscribe(Collection<String> tokens) {
        List<String> added = subscriptions.add(tokens);
        if (added.isEmpty()) {
            return;
        }
        if (wsState == WsState.CONNECTED) {
            sendSubscribe(added);
        } else {
            log.info("[KITE] {} token(s) queued until the ticker connects (state={})", added.size(), wsState);
        }
    }

    @Override
    public void disconnect() {
        log.info("[KITE] Disconnecting...");
        stopped = true;
        wsState = WsState.DISCONNECTED;
        WebSocket ws = wsRef.getAndSet(null);
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "Disconnect");
        }
        reconnectScheduler.shutdownNow();
    }

    @Override
    public boolean isConnected() {
        WebSocket ws = wsRef.get();
        return wsState == WsState.CONNECTED && ws != null && !ws.isOutputClosed() && !ws.isInputClosed();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Connection
    // ═══════════════════════════════════════════════════════════════════════

    private void connectWithRetry() {
        while (!stopped && wsState != WsState.CONNECTED && !Thread.currentThread().isInterrupted()) {
            if (openWebSocket()) {
                wsState = WsState.CONNECTED;
                retryPolicy.recordSuccess();
                List<String> all = subscriptions.all();
                if (!all.isEmpty()) {
                    log.info("[KITE] Connection established - subscribing {} token(s)", all.size());
                    sendSubscribe(all);
                }
                return;
            }

            retryPolicy.recordFailure();
            if (!retryPolicy.shouldRetry()) {
                log.error("[KITE] Ticker connection failed {} times, giving up", retryPolicy.getAttemptCount());
                wsState = WsState.DISCONNECTED;
                return;
            }
            Duration backoff = retryPolicy.getNextDelay();
            log.warn("[KITE] Retry #{} in {}ms", retryPolicy.getAttemptCount(), backoff.toMillis());
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private void scheduleReconnect() {
        if (stopped || wsState == WsState.RECONNECT_REQUIRED || wsState == WsState.CONNECTING) {
            return;
        }
        wsState = WsState.RECONNECT_REQUIRED;
        wsRef.set(null);
        long delayMs = retryPolicy.getNextDelay().toMillis();
        log.info("[KITE] Scheduling reconnect in {}ms", delayMs);
        reconnectScheduler.schedule(() -> {
            if (wsState == WsState.RECONNECT_REQUIRED) {
                wsState = WsState.CONNECTING;
                connectWithRetry();
            }
        }, delayMs, TimeUnit.MILLISECONDS);
    }

    private boolean openWebSocket() {
        String url = WS_URL + "?api_key=" + apiKey + "&access_token=" + accessToken;
        try {
            CompletableFuture<WebSocket> future = httpClient.newWebSocketBuilder()
                .buildAsync(URI.create(url), new TickerListener());
            wsRef.set(future.get(10, TimeUnit.SECONDS));
            log.info("[KITE] WebSocket handshake successful");
            return true;
        } catch (ExecutionException | TimeoutException e) {
            wsRef.set(null);
            log.error("[KITE] WebSocket connection error: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void sendSubscribe(List<String> tokens) {
        List<Long> numeric = new ArrayList<>();
        for (String token : tokens) {
            try {
                numeric.add(Long.parseLong(token));
            } catch (NumberFormatException e) {
                log.warn("[KITE] Token {} is not numeric, not subscribed", token);
            }
        }
        if (numeric.isEmpty()) {
            return;
        }
        try {
            ObjectNode subscribe = objectMapper.createObjectNode();
            subscribe.put("a", "subscribe");
            subscribe.set("v", objectMapper.valueToTree(numeric));
            send(objectMapper.writeValueAsString(subscribe));

            ObjectNode mode = objectMapper.createObjectNode();
            mode.put("a", "mode");
            mode.set("v", objectMapper.valueToTree(new Object[] { MODE_QUOTE, numeric }));
            send(objectMapper.writeValueAsString(mode));

            log.info("[KITE] Subscription sent for {} token(s) ({} mode)", numeric.size(), MODE_QUOTE);
        } catch (JsonProcessingException e) {
            log.error("[KITE] Failed to build subscription message", e);
        }
    }

    private void send(String json) {
        WebSocket ws = wsRef.get();
        if (ws == null) {
            log.warn("[KITE] Send skipped - socket not open (state={})", wsState);
            return;
        }
        ws.sendText(json, true).whenComplete((w, error) -> {
            if (error != null) {
                log.error("[KITE] Send failed: {}", error.getMessage());
                scheduleReconnect();
            }
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Binary packets
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Parse one binary frame.
     *
     * Format (big-endian):
     * - 2 bytes: number of packets
     * - per packet: 2 bytes length, then the packet; bytes 0-3 are the
     *   instrument token and bytes 4-7 the last price in paise
     *
     * Packet length identifies the mode (8 LTP, 28/32 index, 44 quote, 184 full);
     * only token and last price are used here.
     */
    static List<Tick> parseFrame(ByteBuffer buffer, Instant receivedAt) {
        buffer.order(ByteOrder.BIG_ENDIAN);
        List<Tick> ticks = new ArrayList<>();
        if (buffer.remaining() < 2) {
            return ticks;
        }

        int numPackets = buffer.getShort() & 0xFFFF;
        for (int i = 0; i < numPackets; i++) {
            if (buffer.remaining() < 2) {
                break;
            }
            int packetLength = buffer.getShort() & 0xFFFF;
            if (buffer.remaining() < packetLength) {
                log.warn("[KITE] Truncated packet: length {} with {} bytes left", packetLength, buffer.remaining());
                break;
            }
            int packetEnd = buffer.position() + packetLength;
            if (packetLength >= 8) {
                long token = buffer.getInt() & 0xFFFFFFFFL;
                BigDecimal lastPrice = BigDecimal.valueOf(buffer.getInt() & 0xFFFFFFFFL)
                    .divide(PAISE, 2, RoundingMode.HALF_UP);
                ticks.add(new Tick(Long.toString(token), lastPrice, receivedAt));
            }
            buffer.position(packetEnd);
        }
        return ticks;
    }

    private void dispatch(ByteBuffer frame) {
        if (frame.remaining() < 2) {
            log.trace("[KITE] Heartbeat");
            return;
        }
        for (Tick tick : parseFrame(frame, clock.instant())) {
            try {
                listener.onTick(tick);
            } catch (RuntimeException e) {
                log.warn("[KITE] Tick processing error for {}: {}", tick.instrumentId(), e.getMessage());
            }
        }
    }

    private final class TickerListener implements WebSocket.Listener {
        private final ByteBuffer binaryBuffer = ByteBuffer.allocate(65536);
        private boolean overflow = false;

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            if (last) {
                log.debug("[KITE] Control message: {}", data);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            if (overflow || binaryBuffer.remaining() < data.remaining()) {
                overflow = true;
            } else {
                binaryBuffer.put(data);
            }
            if (last) {
                if (overflow) {
                    log.warn("[KITE] Frame larger than {} bytes dropped", binaryBuffer.capacity());
                } else {
                    binaryBuffer.flip();
                    dispatch(binaryBuffer);
                }
                binaryBuffer.clear();
                overflow = false;
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.error("[KITE] WebSocket error: {}", error.getMessage());
            scheduleReconnect();
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info("[KITE] WebSocket closed: {} - {}", statusCode, reason);
            scheduleReconnect();
            return null;
        }
    }
}
