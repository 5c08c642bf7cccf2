package com.stellarcast.media.translate;

import com.stellarcast.common.config.StellarcastConfig;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Picks the translation back end from configuration: DeepL, then Baidu, then
 * identity. A back end with incomplete credentials is disabled with a warning.
 */
@Slf4j
public final class Translators {

    private Translators() {
    }

    public static Translator fromConfig(StellarcastConfig.TranslateConfig config, HttpClient client,
            Duration timeout) {
        StellarcastConfig.DeeplConfig deepl = config.getDeepl();
        if (deepl != null && Boolean.TRUE.equals(deepl.getEnabled())) {
            if (isBlank(deepl.getApiKey())) {
                log.warn("DeepL translation is enabled but 'translate.deepl.apiKey' is missing; DeepL disabled");
            } else {
                log.info("Explanation translation via DeepL ({})", config.getTargetLang());
                return new DeeplTranslator(client, deepl.getApiUrl(), deepl.getApiKey(),
                        config.getTargetLang(), timeout);
            }
        }
        StellarcastConfig.BaiduConfig baidu = config.getBaidu();
        if (baidu != null && Boolean.TRUE.equals(baidu.getEnabled())) {
            if (isBlank(baidu.getAppId()) || isBlank(baidu.getApiKey())) {
                log.warn("Baidu translation is enabled but appId/apiKey are incomplete; Baidu disabled");
            } else {
                log.info("Explanation translation via Baidu ({})", config.getTargetLang());
                return new BaiduTranslator(client, baidu.getApiUrl(), baidu.getAppId(), baidu.getApiKey(),
                        config.getTargetLang(), timeout);
            }
        }
        return new NoopTranslator();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
