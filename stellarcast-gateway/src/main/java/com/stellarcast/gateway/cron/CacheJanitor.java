package com.stellarcast.gateway.cron;

import com.stellarcast.common.config.ConfigDefaults;
import com.stellarcast.gateway.delivery.PictureCache;
import lombok.extern.slf4j.Slf4j;

/**
 * Daily eviction of the picture caches, so the next delivery fetches the new
 * day's picture.
 */
@Slf4j
public class CacheJanitor {

    public static final String JOB_ID = "apod_cache_janitor";

    private final JobScheduler scheduler;
    private final PictureCache cache;
    private final SendTime time;

    public CacheJanitor(JobScheduler scheduler, PictureCache cache, SendTime time) {
        this.scheduler = scheduler;
        this.cache = cache;
        this.time = time;
    }

    /**
     * Configured eviction time, or the default one when it is malformed.
     */
    public static SendTime resolveTime(String configured) {
        try {
            return SendTime.parse(configured);
        } catch (InvalidTimeFormatException e) {
            log.warn("cron: invalid cron.janitorTime '{}', using {}", configured,
                    ConfigDefaults.DEFAULT_JANITOR_TIME);
            return SendTime.parse(ConfigDefaults.DEFAULT_JANITOR_TIME);
        }
    }

    public void register() {
        scheduler.schedule(JOB_ID, time, this::evict);
    }

    void evict() {
        cache.evictAll();
        log.info("apod: daily picture cache cleared");
    }
}
