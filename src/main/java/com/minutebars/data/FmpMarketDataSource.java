package com.minutebars.data;

import com.minutebars.config.BackfillSettings;
import com.minutebars.model.RawBar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Financial Modeling Prep 1-minute historical chart client.
 */
public final class FmpMarketDataSource implements MarketDataSource {
    private static final Logger log = LogManager.getLogger(FmpMarketDataSource.class);

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;

    public FmpMarketDataSource(BackfillSettings settings) {
        this(settings.apiBaseUrl, settings.apiKey, settings.requestTimeout);
    }

    public FmpMarketDataSource(String baseUrl, String apiKey, Duration timeout) {
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.apiKey = apiKey == null ? "" : apiKey;
        this.timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<RawBar> fetch(String symbol, LocalDate fromDate, LocalDate toDate) throws MarketDataException {
        String url = buildUrl(symbol, fromDate, toDate);
        log.debug("GET {}", maskApiKey(url));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", "minutebars/1.0")
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new MarketDataException("request timed out for " + symbol, MarketDataException.TIMEOUT, e);
        } catch (IOException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            throw new MarketDataException("request failed for " + symbol + ": " + message, classifyIo(message), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketDataException("request interrupted for " + symbol, MarketDataException.INTERRUPTED, e);
        }

        int status = response.statusCode();
        if (status / 100 != 2) {
            String category = status == 429 ? MarketDataException.RATE_LIMIT : MarketDataException.HTTP;
            throw new MarketDataException("http status=" + status + " symbol=" + symbol, category);
        }
        return parsePayload(symbol, response.body());
    }

    String buildUrl(String symbol, LocalDate fromDate, LocalDate toDate) {
        return String.format(
                "%s/historical-chart/1min/%s?from=%s&to=%s&apikey=%s",
                baseUrl,
                URLEncoder.encode(symbol, StandardCharsets.UTF_8),
                fromDate,
                toDate,
                URLEncoder.encode(apiKey, StandardCharsets.UTF_8)
        );
    }

    /**
     * Turns the chart payload into raw bars. Numeric fields keep their JSON text; nothing is validated here.
     */
    static List<RawBar> parsePayload(String symbol, String body) throws MarketDataException {
        if (body == null || body.trim().isEmpty()) {
            return List.of();
        }
        Object root;
        try {
            root = new JSONTokener(body.trim()).nextValue();
        } catch (JSONException e) {
            throw new MarketDataException("unparsable payload for " + symbol + ": " + sample(body),
                    MarketDataException.PAYLOAD, e);
        }
        if (root instanceof JSONObject) {
            JSONObject envelope = (JSONObject) root;
            String message = envelope.optString("Error Message", envelope.optString("message", sample(body)));
            throw new MarketDataException("provider error for " + symbol + ": " + message, MarketDataException.PAYLOAD);
        }
        if (!(root instanceof JSONArray)) {
            throw new MarketDataException("unexpected payload for " + symbol + ": " + sample(body),
                    MarketDataException.PAYLOAD);
        }

        JSONArray array = (JSONArray) root;
        List<RawBar> bars = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject row = array.optJSONObject(i);
            if (row == null) {
                bars.add(new RawBar(symbol, null, null, null, null, null, null));
                continue;
            }
            bars.add(new RawBar(
                    symbol,
                    text(row, "date"),
                    text(row, "open"),
                    text(row, "high"),
                    text(row, "low"),
                    text(row, "close"),
                    text(row, "volume")
            ));
        }
        return bars;
    }

    static String maskApiKey(String url) {
        return url == null ? "" : url.replaceAll("(?i)(apikey=)[^&]*", "$1***");
    }

    private static String text(JSONObject row, String key) {
        Object value = row.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        // Numbers keep their JSON text, exponent included; range checks belong to the quality filter.
        return value.toString();
    }

    private static String classifyIo(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("timed out") || msg.contains("timeout") || msg.contains("connection reset")) {
            return MarketDataException.TIMEOUT;
        }
        return MarketDataException.IO;
    }

    private static String sample(String body) {
        String text = body == null ? "" : body.trim();
        return text.length() > 120 ? text.substring(0, 120) : text;
    }

    private static String trimTrailingSlash(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
