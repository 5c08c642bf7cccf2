package com.stellarcast.common.config;

/**
 * Fills unset configuration values with their defaults.
 */
public final class ConfigDefaults {

    private ConfigDefaults() {
    }

    public static final String DEFAULT_APOD_URL = "https://api.nasa.gov/planetary/apod";
    public static final String DEFAULT_SEND_TIME = "13:00";
    public static final String DEFAULT_JANITOR_TIME = "13:00";
    public static final String DEFAULT_DEEPL_URL = "https://api-free.deepl.com/v2/translate";
    public static final String DEFAULT_BAIDU_URL = "http://api.fanyi.baidu.com/api/trans/vip/translate";
    public static final String DEFAULT_TARGET_LANG = "zh";
    public static final int DEFAULT_REPLY_TTL_SECONDS = 360;

    public static StellarcastConfig apply(StellarcastConfig config) {
        if (config.getApod() == null) {
            config.setApod(new StellarcastConfig.ApodConfig());
        }
        StellarcastConfig.ApodConfig apod = config.getApod();
        if (apod.getApiUrl() == null) apod.setApiUrl(DEFAULT_APOD_URL);
        if (apod.getDefaultSendTime() == null) apod.setDefaultSendTime(DEFAULT_SEND_TIME);
        if (apod.getHdImage() == null) apod.setHdImage(false);
        if (apod.getInfopuzzle() == null) apod.setInfopuzzle(false);
        if (apod.getInfopuzzleDarkMode() == null) apod.setInfopuzzleDarkMode(false);
        if (apod.getRequestTimeoutSeconds() == null) apod.setRequestTimeoutSeconds(30);

        if (config.getTranslate() == null) {
            config.setTranslate(new StellarcastConfig.TranslateConfig());
        }
        StellarcastConfig.TranslateConfig translate = config.getTranslate();
        if (translate.getTargetLang() == null) translate.setTargetLang(DEFAULT_TARGET_LANG);
        if (translate.getDeepl() == null) translate.setDeepl(new StellarcastConfig.DeeplConfig());
        if (translate.getDeepl().getEnabled() == null) translate.getDeepl().setEnabled(false);
        if (translate.getDeepl().getApiUrl() == null) translate.getDeepl().setApiUrl(DEFAULT_DEEPL_URL);
        if (translate.getBaidu() == null) translate.setBaidu(new StellarcastConfig.BaiduConfig());
        if (translate.getBaidu().getEnabled() == null) translate.getBaidu().setEnabled(false);
        if (translate.getBaidu().getApiUrl() == null) translate.getBaidu().setApiUrl(DEFAULT_BAIDU_URL);

        if (config.getDelivery() == null) {
            config.setDelivery(new StellarcastConfig.DeliveryConfig());
        }
        StellarcastConfig.DeliveryConfig delivery = config.getDelivery();
        if (delivery.getNotifyOnScheduledFetchFailure() == null) delivery.setNotifyOnScheduledFetchFailure(true);
        if (delivery.getReplyMetadataTtlSeconds() == null) delivery.setReplyMetadataTtlSeconds(DEFAULT_REPLY_TTL_SECONDS);
        if (delivery.getConsumeComposedOnCommand() == null) delivery.setConsumeComposedOnCommand(true);
        if (delivery.getSendTimeoutSeconds() == null) delivery.setSendTimeoutSeconds(60);
        if (delivery.getMaxTextLength() == null) delivery.setMaxTextLength(4000);

        if (config.getCron() == null) {
            config.setCron(new StellarcastConfig.CronConfig());
        }
        StellarcastConfig.CronConfig cron = config.getCron();
        if (cron.getJanitorTime() == null) cron.setJanitorTime(DEFAULT_JANITOR_TIME);
        if (cron.getPoolSize() == null) cron.setPoolSize(4);
        return config;
    }
}
