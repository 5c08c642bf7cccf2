package com.stellarcast.media.apod;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stellarcast.common.result.ErrorKind;
import com.stellarcast.common.result.Outcome;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * NASA APOD HTTP client.
 * <ul>
 * <li>no params: today's entry (object)</li>
 * <li>{@code date}: one entry (object, or a singleton list on some mirrors)</li>
 * <li>{@code count=1}: one random entry (singleton list)</li>
 * </ul>
 */
@Slf4j
public class NasaApodClient implements ApodClient {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final HttpClient client;
    private final String apiUrl;
    private final String apiKey;
    private final Duration timeout;

    public NasaApodClient(HttpClient client, String apiUrl, String apiKey, Duration timeout) {
        this.client = client;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public Outcome<PictureOfDay> fetchToday() {
        return fetch(Map.of());
    }

    @Override
    public Outcome<PictureOfDay> fetchByDate(LocalDate date) {
        return fetch(Map.of("date", date.toString()));
    }

    @Override
    public Outcome<PictureOfDay> fetchRandom() {
        return fetch(Map.of("count", "1"));
    }

    private Outcome<PictureOfDay> fetch(Map<String, String> params) {
        URI uri = buildUri(apiUrl, apiKey, params);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.warn("apod: request {} returned status {}", params, response.statusCode());
                return Outcome.failed(ErrorKind.FETCH_FAILURE, "APOD status " + response.statusCode());
            }
            return parseBody(response.body());
        } catch (IOException e) {
            log.error("apod: request {} failed: {}", params, e.getMessage());
            return Outcome.failed(ErrorKind.FETCH_FAILURE, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failed(ErrorKind.FETCH_FAILURE, "interrupted");
        }
    }

    static Outcome<PictureOfDay> parseBody(String body) {
        try {
            JsonNode entry = normalizeEntry(MAPPER.readTree(body));
            if (entry == null) {
                return Outcome.failed(ErrorKind.FETCH_FAILURE, "APOD response holds no entry");
            }
            return Outcome.ok(MAPPER.treeToValue(entry, PictureOfDay.class));
        } catch (IOException e) {
            return Outcome.failed(ErrorKind.FETCH_FAILURE, "unparseable APOD response: " + e.getMessage());
        }
    }

    /**
     * Reduce an object-or-list response to a single entry object.
     */
    static JsonNode normalizeEntry(JsonNode body) {
        if (body == null) {
            return null;
        }
        if (body.isObject()) {
            return body;
        }
        if (body.isArray() && !body.isEmpty() && body.get(0).isObject()) {
            return body.get(0);
        }
        return null;
    }

    static URI buildUri(String apiUrl, String apiKey, Map<String, String> params) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("api_key", apiKey);
        query.putAll(params);
        StringBuilder sb = new StringBuilder(apiUrl);
        char sep = apiUrl.contains("?") ? '&' : '?';
        for (Map.Entry<String, String> e : query.entrySet()) {
            sb.append(sep)
                    .append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
            sep = '&';
        }
        return URI.create(sb.toString());
    }
}
