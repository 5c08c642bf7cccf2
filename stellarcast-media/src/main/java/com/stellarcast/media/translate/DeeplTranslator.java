package com.stellarcast.media.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stellarcast.common.result.ErrorKind;
import com.stellarcast.common.result.Outcome;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * DeepL v2 translate API.
 */
@Slf4j
public class DeeplTranslator implements Translator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client;
    private final String apiUrl;
    private final String apiKey;
    private final String targetLang;
    private final Duration timeout;

    public DeeplTranslator(HttpClient client, String apiUrl, String apiKey, String targetLang, Duration timeout) {
        this.client = client;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.targetLang = targetLang.toUpperCase(Locale.ROOT);
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "deepl";
    }

    @Override
    public Outcome<String> translate(String text) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(timeout)
                    .header("Authorization", "DeepL-Auth-Key " + apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildBody(text, targetLang)))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.error("DeepL translation failed with status {}", response.statusCode());
                return Outcome.failed(ErrorKind.TRANSLATE_FAILURE, "DeepL status " + response.statusCode());
            }
            return parseResponse(response.body());
        } catch (IOException e) {
            log.error("DeepL translation failed: {}", e.getMessage());
            return Outcome.failed(ErrorKind.TRANSLATE_FAILURE, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failed(ErrorKind.TRANSLATE_FAILURE, "interrupted");
        }
    }

    static String buildBody(String text, String targetLang) throws IOException {
        return MAPPER.writeValueAsString(Map.of(
                "text", List.of(text),
                "target_lang", targetLang));
    }

    static Outcome<String> parseResponse(String body) {
        try {
            JsonNode translations = MAPPER.readTree(body).path("translations");
            if (!translations.isArray() || translations.isEmpty()) {
                return Outcome.failed(ErrorKind.TRANSLATE_FAILURE, "DeepL response has no translations");
            }
            return Outcome.ok(translations.get(0).path("text").asText());
        } catch (IOException e) {
            return Outcome.failed(ErrorKind.TRANSLATE_FAILURE, "unparseable DeepL response");
        }
    }
}
