package com.stellarcast.gateway.cron;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daily cron registrations keyed by job id, on top of a Spring
 * {@link TaskScheduler}.
 * <p>
 * Scheduling an id that is already registered replaces it. A job id never
 * runs twice at once: a fire that arrives while the previous run of the same
 * id is still in progress is dropped, also when the job was replaced in
 * between.
 */
@Slf4j
public class JobScheduler {

    private final TaskScheduler taskScheduler;
    private final ZoneId zone;
    private final Clock clock;

    private final Map<String, Registration> jobs = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> running = new ConcurrentHashMap<>();

    private record Registration(ScheduledFuture<?> future, SendTime time, CronExpression expression) {
    }

    public JobScheduler(TaskScheduler taskScheduler, ZoneId zone) {
        this(taskScheduler, zone, Clock.system(zone));
    }

    public JobScheduler(TaskScheduler taskScheduler, ZoneId zone, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.zone = zone;
        this.clock = clock;
    }

    /**
     * Register {@code task} to run daily at {@code time}, replacing any job
     * with the same id.
     */
    public void schedule(String jobId, SendTime time, Runnable task) {
        String expression = time.cronExpression();
        CronTrigger trigger = new CronTrigger(expression, zone);
        Runnable guarded = guarded(jobId, task);
        jobs.compute(jobId, (id, existing) -> {
            if (existing != null && existing.future() != null) {
                existing.future().cancel(false);
                log.debug("cron: replacing job {}", id);
            }
            return new Registration(taskScheduler.schedule(guarded, trigger), time, CronExpression.parse(expression));
        });
        log.info("cron: job {} scheduled daily at {}", jobId, time);
    }

    public void schedule(String jobId, int hour, int minute, Runnable task) {
        schedule(jobId, new SendTime(hour, minute), task);
    }

    /**
     * Cancel a job. An in-flight run completes.
     *
     * @return false if no job had this id
     */
    public boolean cancel(String jobId) {
        Registration removed = jobs.remove(jobId);
        if (removed == null) {
            return false;
        }
        if (removed.future() != null) {
            removed.future().cancel(false);
        }
        log.info("cron: job {} cancelled", jobId);
        return true;
    }

    public boolean hasJob(String jobId) {
        return jobs.containsKey(jobId);
    }

    /**
     * Time of day a registered job fires at.
     */
    public Optional<SendTime> scheduledTime(String jobId) {
        Registration registration = jobs.get(jobId);
        return registration == null ? Optional.empty() : Optional.of(registration.time());
    }

    public int jobCount() {
        return jobs.size();
    }

    /**
     * Next fire time of a registered job, in the scheduler's zone.
     */
    public Optional<ZonedDateTime> nextFire(String jobId) {
        Registration registration = jobs.get(jobId);
        if (registration == null) {
            return Optional.empty();
        }
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);
        return Optional.ofNullable(registration.expression().next(now));
    }

    /**
     * Wrap {@code task} with the per-id overlap guard. The guard outlives
     * replacement of the registration.
     */
    Runnable guarded(String jobId, Runnable task) {
        AtomicBoolean flag = running.computeIfAbsent(jobId, id -> new AtomicBoolean());
        return () -> {
            if (!flag.compareAndSet(false, true)) {
                log.warn("cron: job {} is still running, skipping this fire", jobId);
                return;
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("cron: job {} failed: {}", jobId, e.getMessage(), e);
            } finally {
                flag.set(false);
            }
        };
    }
}
