package in.niftybreak.service.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.niftybreak.domain.model.ExitReason;
import in.niftybreak.infrastructure.common.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for HttpOrderSink.
 *
 * Tests:
 * - Request headers and JSON payload
 * - Response parsing
 * - Retry on transport errors, 429 and 5xx
 * - Immediate failure on other 4xx and on an error status in the body
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HttpOrderSinkTest {

    private static final Instant AT = Instant.parse("2024-01-15T04:40:00Z");

    @Mock
    private HttpClient httpClient;

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<Duration> sleeps = new ArrayList<>();
    private HttpOrderSink sink;

    @BeforeEach
    void setUp() {
        sink = new HttpOrderSink(httpClient, "https://orders.example.test/v1/", "secret-key",
            RetryPolicy::forOrders, sleeps::add);
    }

    @AfterEach
    void tearDown() {
        sink.shutdown();
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    private static OrderRequest entry() {
        return OrderRequest.entry("CALL_20240115_101000_105", "NIFTY2411821300CE", 75, BigDecimal.valueOf(105), AT);
    }

    @Test
    void testAcceptedOrder() throws Exception {
        doReturn(response(200, "{\"status\":\"success\",\"data\":{\"order_id\":\"ORD-1\",\"average_price\":105.5}}"))
            .when(httpClient).send(any(), any());

        OrderResult result = sink.send(entry());

        assertEquals("ORD-1", result.orderId());
        assertEquals(0, result.averagePrice().compareTo(new BigDecimal("105.5")));
        assertEquals(75, result.filledQty());

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest sent = captor.getValue();
        assertEquals("https://orders.example.test/v1/signals", sent.uri().toString());
        assertEquals("POST", sent.method());
        assertEquals("Bearer secret-key", sent.headers().firstValue("Authorization").orElseThrow());
        assertEquals("CALL_20240115_101000_105-ENTRY", sent.headers().firstValue("Idempotency-Key").orElseThrow());
    }

    @Test
    void testEmptyBodyFillsAtRequestedPrice() throws Exception {
        doReturn(response(202, "")).when(httpClient).send(any(), any());

        OrderResult result = sink.send(entry());

        assertNull(result.orderId());
        assertEquals(0, result.averagePrice().compareTo(BigDecimal.valueOf(105)));
    }

    @Test
    void testPayload() throws IOException {
        OrderRequest exit = OrderRequest.exit("CALL_20240115_101000_105", "NIFTY2411821300CE", 75,
            BigDecimal.valueOf(80), ExitReason.SL_HIT, AT);

        JsonNode json = mapper.readTree(sink.payload(exit));

        assertEquals("EXIT", json.get("signal_type").asText());
        assertEquals("SELL", json.get("side").asText());
        assertEquals("MARKET", json.get("order_type").asText());
        assertEquals("SL_HIT", json.get("exit_reason").asText());
        assertEquals(75, json.get("qty").asInt());
        assertEquals(AT.getEpochSecond(), json.get("timestamp").asLong());
        assertFalse(mapper.readTree(sink.payload(entry())).has("exit_reason"));
    }

    @Test
    void testTransportErrorRetried() throws Exception {
        HttpResponse<String> ok = response(200, "{\"order_id\":\"ORD-2\"}");
        doThrow(new IOException("connection reset")).doReturn(ok).when(httpClient).send(any(), any());

        OrderResult result = sink.send(entry());

        assertEquals("ORD-2", result.orderId());
        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void testServerErrorsExhaustRetries() throws Exception {
        HttpResponse<String> busy = response(503, "unavailable");
        HttpResponse<String> limited = response(429, "slow down");
        doReturn(busy).doReturn(limited).doReturn(busy).when(httpClient).send(any(), any());

        OrderPlacementException e = assertThrows(OrderPlacementException.class, () -> sink.send(entry()));

        assertTrue(e.getMessage().contains("max retries (3)"), e.getMessage());
        verify(httpClient, times(3)).send(any(), any());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void testClientErrorNotRetried() throws Exception {
        doReturn(response(400, "bad symbol")).when(httpClient).send(any(), any());

        OrderPlacementException e = assertThrows(OrderPlacementException.class, () -> sink.send(entry()));

        assertTrue(e.getMessage().contains("HTTP 400"));
        assertEquals("HTTP", e.getSink());
        verify(httpClient, times(1)).send(any(), any());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testErrorStatusInBody() throws Exception {
        doReturn(response(200, "{\"status\":\"error\",\"message\":\"market closed\"}"))
            .when(httpClient).send(any(), any());

        OrderPlacementException e = assertThrows(OrderPlacementException.class, () -> sink.send(entry()));

        assertTrue(e.getMessage().contains("market closed"));
    }

    @Test
    void testAsyncPlacementCompletesExceptionally() throws Exception {
        doReturn(response(401, "unauthorized")).when(httpClient).send(any(), any());

        Exception e = assertThrows(Exception.class, () -> sink.placeEntry(entry()).join());

        assertInstanceOf(OrderPlacementException.class, e.getCause());
    }
}
