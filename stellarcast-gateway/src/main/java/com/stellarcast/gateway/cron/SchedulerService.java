package com.stellarcast.gateway.cron;

import com.stellarcast.channel.Destination;
import com.stellarcast.channel.TargetCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Start, stop and inspect per-destination daily deliveries. Keeps the live
 * job registrations and the persisted schedule in step.
 */
@Slf4j
public class SchedulerService {

    private final ScheduleStore store;
    private final JobScheduler scheduler;
    private final Consumer<Destination> deliveryTask;
    private final String defaultSendTime;

    public SchedulerService(ScheduleStore store, JobScheduler scheduler, Consumer<Destination> deliveryTask,
            String defaultSendTime) {
        this.store = store;
        this.scheduler = scheduler;
        this.deliveryTask = deliveryTask;
        this.defaultSendTime = defaultSendTime;
    }

    public String getDefaultSendTime() {
        return defaultSendTime;
    }

    /**
     * Schedule daily delivery to {@code destination}, replacing an existing
     * schedule for it. If the schedule cannot be persisted, the previous
     * registration is put back.
     *
     * @param time {@code HH:MM}; the default send time when empty
     * @return the effective send time
     * @throws InvalidTimeFormatException before anything is changed
     * @throws ScheduleStoreException     if the schedule could not be persisted
     */
    public SendTime start(Destination destination, Optional<String> time) {
        SendTime sendTime = SendTime.parse(time.orElse(defaultSendTime));
        String jobId = TargetCodec.jobId(destination);
        store.withLock(() -> {
            Optional<SendTime> previous = scheduler.scheduledTime(jobId);
            register(jobId, destination, sendTime);
            try {
                store.upsertLocked(new ScheduleEntry(destination, sendTime.format()));
            } catch (ScheduleStoreException e) {
                rollback(jobId, destination, previous);
                throw e;
            }
            return null;
        });
        log.info("cron: daily delivery to {} at {} ({})", destination.label(), sendTime, jobId);
        return sendTime;
    }

    /**
     * Stop daily delivery to {@code destination}. Stopping a destination
     * without a schedule is a no-op. The live job is cancelled only after the
     * entry is gone from the store.
     *
     * @return true if a job or a persisted entry was removed
     * @throws ScheduleStoreException if the store could not be rewritten; the
     *                                live job is left untouched
     */
    public boolean stop(Destination destination) {
        String jobId = TargetCodec.jobId(destination);
        return store.withLock(() -> {
            boolean removed = store.removeLocked(destination);
            boolean cancelled = scheduler.cancel(jobId);
            if (cancelled || removed) {
                log.info("cron: daily delivery to {} stopped", destination.label());
            }
            return cancelled || removed;
        });
    }

    public ScheduleStatus status(Destination destination) {
        String jobId = TargetCodec.jobId(destination);
        if (!scheduler.hasJob(jobId)) {
            return ScheduleStatus.notRunning();
        }
        return new ScheduleStatus(true, scheduler.nextFire(jobId));
    }

    /**
     * Register a persisted entry with the scheduler without rewriting the
     * store.
     *
     * @throws InvalidTimeFormatException if the stored time is malformed
     */
    void restore(ScheduleEntry entry) {
        SendTime sendTime = SendTime.parse(entry.sendTime());
        register(TargetCodec.jobId(entry.destination()), entry.destination(), sendTime);
    }

    private void rollback(String jobId, Destination destination, Optional<SendTime> previous) {
        if (previous.isPresent()) {
            register(jobId, destination, previous.get());
            log.warn("cron: schedule for {} not persisted, kept previous time {}",
                    destination.label(), previous.get());
        } else {
            scheduler.cancel(jobId);
            log.warn("cron: schedule for {} not persisted, job removed", destination.label());
        }
    }

    private void register(String jobId, Destination destination, SendTime sendTime) {
        scheduler.schedule(jobId, sendTime, () -> deliveryTask.accept(destination));
    }
}
