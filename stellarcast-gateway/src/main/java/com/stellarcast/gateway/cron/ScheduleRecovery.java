package com.stellarcast.gateway.cron;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Re-registers persisted schedules with the scheduler, once per process.
 */
@Slf4j
public class ScheduleRecovery {

    private final ScheduleStore store;
    private final SchedulerService schedulerService;
    private final AtomicBoolean done = new AtomicBoolean();

    public record RecoveryReport(int registered, int skipped) {
    }

    public ScheduleRecovery(ScheduleStore store, SchedulerService schedulerService) {
        this.store = store;
        this.schedulerService = schedulerService;
    }

    /**
     * Register every stored entry. Entries that fail are logged and skipped.
     * Later calls do nothing.
     * <p>
     * Loading and registering run under the store lock, so a concurrent
     * {@code start} or {@code stop} lands either before the load or after
     * the last registration.
     */
    public RecoveryReport recover() {
        if (!done.compareAndSet(false, true)) {
            log.debug("cron: schedule recovery already ran");
            return new RecoveryReport(0, 0);
        }
        RecoveryReport report = store.withLock(() -> {
            List<ScheduleEntry> entries = store.loadLocked();
            int registered = 0;
            int skipped = 0;
            for (ScheduleEntry entry : entries) {
                try {
                    schedulerService.restore(entry);
                    registered++;
                } catch (RuntimeException e) {
                    skipped++;
                    log.error("cron: could not restore schedule for {}: {}",
                            entry.destination().label(), e.getMessage());
                }
            }
            return new RecoveryReport(registered, skipped);
        });
        log.info("cron: restored {} schedule(s), skipped {}", report.registered(), report.skipped());
        return report;
    }

    public boolean hasRun() {
        return done.get();
    }
}
