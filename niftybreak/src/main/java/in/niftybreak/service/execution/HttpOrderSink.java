package in.niftybreak.service.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.niftybreak.infrastructure.common.RetryPolicy;
import in.niftybreak.infrastructure.common.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Live order signals over HTTP.
 *
 * POST {baseUrl}/signals with a JSON body, bearer authentication and an
 * Idempotency-Key of tradeId-ENTRY / tradeId-EXIT, so a retried request is
 * never executed twice. Transport errors, HTTP 429 and 5xx are retried per
 * RetryPolicy.forOrders(); other HTTP errors fail at once.
 */
public final class HttpOrderSink implements OrderSink {
    private static final Logger log = LoggerFactory.getLogger(HttpOrderSink.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final Supplier<RetryPolicy> retryPolicies;
    private final Sleeper sleeper;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "order-sink");
        t.setDaemon(true);
        return t;
    });

    public HttpOrderSink(String baseUrl, String apiKey) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
            baseUrl, apiKey, RetryPolicy::forOrders, Sleeper.SYSTEM);
    }

    public HttpOrderSink(HttpClient httpClient, String baseUrl, String apiKey,
                         Supplier<RetryPolicy> retryPolicies, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.retryPolicies = retryPolicies;
        this.sleeper = sleeper;
    }

    @Override
    public CompletableFuture<OrderResult> placeEntry(OrderRequest request) {
        return CompletableFuture.supplyAsync(() -> send(request), executor);
    }

    @Override
    public CompletableFuture<OrderResult> placeExit(OrderRequest request) {
        return CompletableFuture.supplyAsync(() -> send(request), executor);
    }

    OrderResult send(OrderRequest request) {
        String payload = payload(request);
        RetryPolicy policy = retryPolicies.get();
        String lastError = "no attempt made";

        while (policy.shouldRetry()) {
            int attempt = policy.getAttemptCount() + 1;
            log.info("[ORDER] Sending {} {} (attempt {}/{})",
                request.signalType(), request.tradeId(), attempt, policy.getMaxAttempts());
            try {
                HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/signals"))
                    .timeout(Duration.ofSeconds(10))
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .header("Idempotency-Key", request.idempotencyKey())
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build();

                HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    policy.recordSuccess();
                    OrderResult result = parse(request, response.body());
                    log.info("[ORDER] {} {} accepted: orderId={}", request.signalType(), request.tradeId(), result.orderId());
                    return result;
                }

                lastError = "HTTP " + status + ": " + response.body();
                if (status != 429 && status < 500) {
                    log.error("[ORDER] {} {} rejected: {}", request.signalType(), request.tradeId(), lastError);
                    throw new OrderPlacementException(name(), request, lastError);
                }
                log.error("[ORDER] {} {} failed (attempt {}): {}", request.signalType(), request.tradeId(), attempt, lastError);
            } catch (IOException e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.error("[ORDER] {} {} transport error (attempt {}): {}",
                    request.signalType(), request.tradeId(), attempt, lastError);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OrderPlacementException(name(), request, "interrupted", e);
            }

            policy.recordFailure();
            if (!policy.shouldRetry()) {
                break;
            }
            Duration wait = policy.getNextDelay();
            log.info("[ORDER] Retrying {} in {} ms", request.tradeId(), wait.toMillis());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OrderPlacementException(name(), request, "interrupted", e);
            }
        }

        throw new OrderPlacementException(name(), request,
            "max retries (" + policy.getMaxAttempts() + ") exceeded, last error: " + lastError);
    }

    String payload(OrderRequest request) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("signal_type", request.signalType().name());
        node.put("trade_id", request.tradeId());
        node.put("symbol", request.symbol());
        node.put("qty", request.qty());
        node.put("side", request.side());
        node.put("order_type", "MARKET");
        node.put("price", request.price());
        if (request.exitReason() != null) {
            node.put("exit_reason", request.exitReason().name());
        }
        node.put("timestamp", request.timestamp().getEpochSecond());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (IOException e) {
            throw new OrderPlacementException(name(), request, "payload serialization failed", e);
        }
    }

    private OrderResult parse(OrderRequest request, String body) {
        if (body == null || body.isBlank()) {
            return new OrderResult(null, request.price(), request.qty(), "accepted");
        }
        try {
            JsonNode json = objectMapper.readTree(body);
            if (json.has("status") && "error".equalsIgnoreCase(json.get("status").asText())) {
                String message = json.has("message") ? json.get("message").asText() : "Unknown error";
                throw new OrderPlacementException(name(), request, message);
            }
            JsonNode data = json.has("data") ? json.get("data") : json;
            String orderId = data.has("order_id") ? data.get("order_id").asText()
                : data.has("id") ? data.get("id").asText() : null;
            BigDecimal avg = data.has("average_price") && data.get("average_price").isNumber()
                ? data.get("average_price").decimalValue()
                : request.price();
            int filled = data.has("filled_qty") ? data.get("filled_qty").asInt(request.qty()) : request.qty();
            String message = json.has("message") ? json.get("message").asText() : "accepted";
            return new OrderResult(orderId, avg, filled, message);
        } catch (IOException e) {
            log.warn("[ORDER] Unparseable response for {}: {}", request.tradeId(), e.getMessage());
            return new OrderResult(null, request.price(), request.qty(), "accepted (unparsed response)");
        }
    }

    public void shutdown() {
        executor.shutdown();
    }

    @Override
    public String name() {
        return "HTTP";
    }
}
