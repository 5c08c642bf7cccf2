package com.stellarcast.app.config;

import com.stellarcast.common.config.StellarcastConfig;
import com.stellarcast.gateway.cron.CacheJanitor;
import com.stellarcast.gateway.cron.ScheduleRecovery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Startup sequence for scheduled delivery: register the cache janitor, then
 * restore persisted schedules. Skipped entirely when no APOD API key is
 * configured.
 */
@Slf4j
@Component
public class SchedulingBootstrap {

    private final StellarcastConfig config;
    private final ScheduleRecovery recovery;
    private final CacheJanitor janitor;

    public SchedulingBootstrap(StellarcastConfig config, ScheduleRecovery recovery, CacheJanitor janitor) {
        this.config = config;
        this.recovery = recovery;
        this.janitor = janitor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!config.isApodEnabled()) {
            log.warn("apod: feature disabled, no schedules restored");
            return;
        }
        try {
            janitor.register();
        } catch (Exception e) {
            log.error("apod: failed to register cache janitor: {}", e.getMessage(), e);
        }
        try {
            ScheduleRecovery.RecoveryReport report = recovery.recover();
            log.info("Stellarcast ready: {} daily delivery schedule(s) active", report.registered());
        } catch (Exception e) {
            log.error("cron: schedule recovery failed: {}", e.getMessage(), e);
        }
    }
}
