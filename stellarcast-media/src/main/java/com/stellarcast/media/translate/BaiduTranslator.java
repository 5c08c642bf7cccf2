package com.stellarcast.media.translate;

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
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Baidu general translation API. Requests are signed with
 * {@code md5(appid + q + salt + key)}.
 */
@Slf4j
public class BaiduTranslator implements Translator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client;
    private final String apiUrl;
    private final String appId;
    private final String apiKey;
    private final String targetLang;
    private final Duration timeout;

    public BaiduTranslator(HttpClient client, String apiUrl, String appId, String apiKey, String targetLang,
            Duration timeout) {
        this.client = client;
        this.apiUrl = apiUrl;
        this.appId = appId;
        this.apiKey = apiKey;
        this.targetLang = targetLang;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "baidu";
    }

    @Override
    public Outcome<String> translate(String text) {
        String salt = String.valueOf(ThreadLocalRandom.current().nextInt(32768, 65537));
        Map<String, String> form = new LinkedHashMap<>();
        form.put("appid", appId);
        form.put("q", text);
        form.put("from", "auto");
        form.put("to", targetLang);
        form.put("salt", salt);
        form.put("sign", sign(appId, text, salt, apiKey));
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.error("Baidu translation failed with status {}", response.statusCode());
                return Outcome.failed(ErrorKind.TRANSLATE_FAILURE, "Baidu status " + response.statusCode());
            }
            return parseResponse(response.body());
        } catch (IOException e) {
            log.error("Baidu translation failed: {}", e.getMessage());
            return Outcome.failed(ErrorKind.TRANSLATE_FAILURE, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failed(ErrorKind.TRANSLATE_FAILURE, "interrupted");
        }
    }

    static String sign(String appId, String query, String salt, String apiKey) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest((appId + query + salt + apiKey).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    /**
     * Join {@code trans_result[].dst} with newlines; {@code error_msg} is a
     * failure.
     */
    static Outcome<String> parseResponse(String body) {
        try {
            JsonNode root = MAPPER.readTree(body);
            JsonNode results = root.path("trans_result");
            if (!results.isArray()) {
                String error = root.path("error_msg").asText("unknown error");
                log.error("Baidu translation error: {}", error);
                return Outcome.failed(ErrorKind.TRANSLATE_FAILURE, error);
            }
            List<String> lines = new ArrayList<>();
            for (JsonNode item : results) {
                lines.add(item.path("dst").asText());
            }
            return Outcome.ok(String.join("\n", lines));
        } catch (IOException e) {
            return Outcome.failed(ErrorKind.TRANSLATE_FAILURE, "unparseable Baidu response");
        }
    }
}
