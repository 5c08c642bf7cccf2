package com.stellarcast.common.config;

import lombok.Data;

/**
 * Root configuration type, bound from {@code config.json}.
 */
@Data
public class StellarcastConfig {

    /** Picture-of-the-day source and delivery style. */
    private ApodConfig apod;

    /** Translation back ends for the picture explanation. */
    private TranslateConfig translate;

    /** Delivery pipeline policies. */
    private DeliveryConfig delivery;

    /** Trigger engine settings. */
    private CronConfig cron;

    /** State directory override (defaults to ~/.stellarcast). */
    private String stateDir;

    // --- Nested config types ---

    @Data
    public static class ApodConfig {
        private String apiKey;
        private String apiUrl;
        /** Used when "start" carries no explicit time. */
        private String defaultSendTime;
        /** Attach the high-definition URL instead of the regular one. */
        private Boolean hdImage;
        /** Deliver a composed image instead of text + image. */
        private Boolean infopuzzle;
        private Boolean infopuzzleDarkMode;
        private Integer requestTimeoutSeconds;
    }

    @Data
    public static class TranslateConfig {
        private String targetLang;
        private DeeplConfig deepl;
        private BaiduConfig baidu;
    }

    @Data
    public static class DeeplConfig {
        private Boolean enabled;
        private String apiKey;
        private String apiUrl;
    }

    @Data
    public static class BaiduConfig {
        private Boolean enabled;
        private String appId;
        private String apiKey;
        private String apiUrl;
    }

    @Data
    public static class DeliveryConfig {
        /** Whether a scheduled send tells the destination that the fetch failed. */
        private Boolean notifyOnScheduledFetchFailure;
        /** Expiry of "explain"/"original" reply attachments. */
        private Integer replyMetadataTtlSeconds;
        /** Evict the composed image after a one-shot "today" command used it. */
        private Boolean consumeComposedOnCommand;
        private Integer sendTimeoutSeconds;
        private Integer maxTextLength;
    }

    @Data
    public static class CronConfig {
        /** Daily cache eviction time, HH:MM local. */
        private String janitorTime;
        private Integer poolSize;
    }

    /**
     * Whether the APOD feature can run at all.
     */
    public boolean isApodEnabled() {
        return apod != null && apod.getApiKey() != null && !apod.getApiKey().isBlank();
    }
}
