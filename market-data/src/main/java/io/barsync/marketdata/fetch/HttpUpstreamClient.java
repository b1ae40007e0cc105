package io.barsync.marketdata.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.barsync.marketdata.model.RawBar;
import io.barsync.marketdata.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Kite-style historical candles endpoint:
 * {@code GET {base}/instruments/historical/{token}/{interval}?from=yyyy-MM-dd HH:mm:ss&to=...&oi=1}.
 * Candles arrive as {@code [timestamp, open, high, low, close, volume(, oi)]} arrays.
 */
public class HttpUpstreamClient implements UpstreamClient {
    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamClient.class);
    private static final DateTimeFormatter QUERY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter CANDLE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private final HttpClient http;
    private final URI baseUrl;
    private final String authorization;
    private final InstrumentResolver instruments;
    private final Duration timeout;
    private final ObjectMapper mapper;

    public HttpUpstreamClient(URI baseUrl, String apiKey, String accessToken, InstrumentResolver instruments,
                              Duration timeout, ObjectMapper mapper) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.authorization = "token " + apiKey + ":" + accessToken;
        this.instruments = Objects.requireNonNull(instruments, "instruments");
        this.timeout = timeout;
        this.mapper = mapper;
        this.http = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public List<RawBar> fetchBars(SeriesKey key, long startEpochSecond, long endEpochSecond)
            throws TransientFetchException, PermanentFetchException, InterruptedException {
        String token = instruments.tokenFor(key)
                .orElseThrow(() -> new PermanentFetchException("no instrument token for " + key.exchange() + ":" + key.symbol()));
        ZoneId zone = key.exchange().zone();
        String url = String.format("%s/instruments/historical/%s/%s?from=%s&to=%s&oi=1",
                trimSlash(baseUrl.toString()), token, key.interval().code(),
                URLEncoder.encode(QUERY_TIME.format(Instant.ofEpochSecond(startEpochSecond).atZone(zone)), StandardCharsets.UTF_8),
                URLEncoder.encode(QUERY_TIME.format(Instant.ofEpochSecond(endEpochSecond).atZone(zone)), StandardCharsets.UTF_8));
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .header("X-Kite-Version", "3")
                .header("Authorization", authorization)
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientFetchException(TransientFetchException.Reason.TIMEOUT, key + " timed out", e);
        } catch (IOException e) {
            throw new TransientFetchException(TransientFetchException.Reason.NETWORK, key + ": " + e.getMessage(), e);
        }
        int status = resp.statusCode();
        if (status == 429) {
            throw new TransientFetchException(TransientFetchException.Reason.RATE_LIMITED, key + " throttled: " + errorMessage(resp.body()));
        }
        if (status >= 500) {
            throw new TransientFetchException(TransientFetchException.Reason.SERVER_ERROR, key + " HTTP " + status + ": " + errorMessage(resp.body()));
        }
        if (status != 200) {
            throw new PermanentFetchException(key + " rejected with HTTP " + status + ": " + errorMessage(resp.body()));
        }
        List<RawBar> bars = parseCandles(resp.body());
        log.debug("Fetched {} candle(s) for {} [{}, {}]", bars.size(), key, startEpochSecond, endEpochSecond);
        return bars;
    }

    List<RawBar> parseCandles(String body) throws PermanentFetchException {
        JsonNode candles;
        try {
            candles = mapper.readTree(body).path("data").path("candles");
        } catch (JsonProcessingException e) {
            throw new PermanentFetchException("malformed response: " + e.getOriginalMessage(), e);
        }
        if (!candles.isArray()) throw new PermanentFetchException("response has no data.candles array");
        List<RawBar> out = new ArrayList<>(candles.size());
        for (JsonNode c : candles) {
            if (!c.isArray() || c.size() < 6) throw new PermanentFetchException("malformed candle " + c);
            out.add(new RawBar(timestamp(c.get(0)), number(c.get(1)), number(c.get(2)), number(c.get(3)), number(c.get(4)),
                    integer(c.get(5)), c.size() > 6 ? integer(c.get(6)) : null));
        }
        return out;
    }

    private static Long timestamp(JsonNode n) throws PermanentFetchException {
        if (n == null || n.isNull()) return null;
        if (n.isNumber()) return n.asLong();
        try {
            return OffsetDateTime.parse(n.asText(), CANDLE_TIME).toEpochSecond();
        } catch (DateTimeParseException e) {
            throw new PermanentFetchException("unparseable candle timestamp " + n.asText(), e);
        }
    }

    private static Double number(JsonNode n) { return n == null || !n.isNumber() ? null : n.asDouble(); }

    private static Long integer(JsonNode n) { return n == null || !n.isNumber() ? null : n.asLong(); }

    private String errorMessage(String body) {
        try {
            JsonNode msg = mapper.readTree(body).path("message");
            return msg.isMissingNode() ? abbreviate(body) : msg.asText();
        } catch (JsonProcessingException e) {
            return abbreviate(body);
        }
    }

    private static String abbreviate(String s) { return s == null ? "" : s.length() > 200 ? s.substring(0, 200) + "..." : s; }

    private static String trimSlash(String s) { return s.endsWith("/") ? s.substring(0, s.length() - 1) : s; }
}
