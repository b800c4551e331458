package in.niftybreak.infrastructure.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Kite Connect historical candles.
 *
 * GET /instruments/historical/{token}/{interval}?from=yyyy-MM-dd HH:mm:ss&to=...
 * Response: {"status":"success","data":{"candles":[["2024-01-15T09:15:00+0530",o,h,l,c,v],...]}}
 *
 * The endpoint's "to" is inclusive; bars at or after the requested end are
 * dropped here. Retries are the caller's concern.
 */
public final class KiteHistoricalProvider implements HistoricalDataProvider {
    private static final Logger log = LoggerFactory.getLogger(KiteHistoricalProvider.class);

    private static final String BASE_URL = "https://api.kite.trade";
    private static final DateTimeFormatter QUERY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter CANDLE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final String accessToken;
    private final ZoneId zone;

    public KiteHistoricalProvider(String apiKey, String accessToken, ZoneId zone) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
            BASE_URL, apiKey, accessToken, zone);
    }

    public KiteHistoricalProvider(HttpClient httpClient, String baseUrl, String apiKey, String accessToken, ZoneId zone) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.accessToken = accessToken;
        this.zone = zone;
    }

    @Override
    public CompletableFuture<List<Candle>> fetch(String instrumentId, Instant from, Instant to, TimeframeType timeframe) {
        String url = baseUrl + "/instruments/historical/" + instrumentId + "/" + interval(timeframe)
            + "?from=" + encode(QUERY_TIME.format(from.atZone(zone)))
            + "&to=" + encode(QUERY_TIME.format(to.atZone(zone)));

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(Duration.ofSeconds(15))
            .header("X-Kite-Version", "3")
            .header("Authorization", "token " + apiKey + ":" + accessToken)
            .GET()
            .build();

        log.info("[KITE] Fetching {} {} bars [{}, {})", instrumentId, timeframe.getLabel(), from, to);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .thenApply(response -> {
                if (response.statusCode() != 200) {
                    throw new CompletionException(new IOException(
                        "Historical API HTTP " + response.statusCode() + ": " + abbreviate(response.body())));
                }
                try {
                    return parseCandles(objectMapper.readTree(response.body()), instrumentId, timeframe, from, to);
                } catch (IOException e) {
                    throw new UncheckedIOException("Unparseable historical response", e);
                }
            });
    }

    static List<Candle> parseCandles(JsonNode root, String instrumentId, TimeframeType timeframe, Instant from, Instant to)
            throws IOException {
        if (!"success".equals(root.path("status").asText())) {
            throw new IOException("Historical API error: " + root.path("message").asText("unknown"));
        }
        List<Candle> candles = new ArrayList<>();
        for (JsonNode row : root.path("data").path("candles")) {
            if (row.size() < 5) {
                continue;
            }
            Instant ts;
            try {
                ts = OffsetDateTime.parse(row.get(0).asText(), CANDLE_TIME).toInstant();
            } catch (DateTimeParseException e) {
                log.warn("[KITE] Skipping candle with bad timestamp {}", row.get(0).asText());
                continue;
            }
            if (ts.isBefore(from) || !ts.isBefore(to)) {
                continue;
            }
            candles.add(new Candle(instrumentId, timeframe, ts,
                decimal(row.get(1)), decimal(row.get(2)), decimal(row.get(3)), decimal(row.get(4))));
        }
        return candles;
    }

    private static BigDecimal decimal(JsonNode node) {
        return node.decimalValue();
    }

    private static String interval(TimeframeType timeframe) {
        return timeframe == TimeframeType.MINUTE_1 ? "minute" : timeframe.getCandleMinutes() + "minute";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        return body == null ? "" : body.substring(0, Math.min(200, body.length()));
    }
}
