package com.stellarcast.gateway.cron;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobSchedulerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-10T10:00:00Z"), ZoneOffset.UTC);

    private ThreadPoolTaskScheduler taskScheduler;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(2);
        taskScheduler.initialize();
        scheduler = new JobScheduler(taskScheduler, ZoneOffset.UTC, CLOCK);
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    void nextFire_laterToday() {
        scheduler.schedule("job-a", 13, 0, () -> {
        });

        Optional<ZonedDateTime> next = scheduler.nextFire("job-a");
        assertTrue(next.isPresent());
        assertEquals(Instant.parse("2024-03-10T13:00:00Z"), next.get().toInstant());
    }

    @Test
    void nextFire_alreadyPassedToday_isTomorrow() {
        scheduler.schedule("job-b", 9, 30, () -> {
        });

        assertEquals(Instant.parse("2024-03-11T09:30:00Z"), scheduler.nextFire("job-b").get().toInstant());
    }

    @Test
    void nextFire_unknownJob_isEmpty() {
        assertTrue(scheduler.nextFire("missing").isEmpty());
    }

    @Test
    void schedule_sameId_replaces() {
        scheduler.schedule("job-a", 8, 0, () -> {
        });
        scheduler.schedule("job-a", 20, 15, () -> {
        });

        assertEquals(1, scheduler.jobCount());
        assertEquals(Instant.parse("2024-03-10T20:15:00Z"), scheduler.nextFire("job-a").get().toInstant());
    }

    @Test
    void cancel_existingThenAbsent() {
        scheduler.schedule("job-a", 8, 0, () -> {
        });

        assertTrue(scheduler.cancel("job-a"));
        assertFalse(scheduler.hasJob("job-a"));
        assertFalse(scheduler.cancel("job-a"));
    }

    @Test
    void guarded_dropsOverlappingRun() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();

        Runnable slow = scheduler.guarded("job-a", () -> {
            runs.incrementAndGet();
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Thread first = new Thread(slow);
        first.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        // replacement registration of the same id shares the guard
        Runnable replacement = scheduler.guarded("job-a", runs::incrementAndGet);
        replacement.run();
        assertEquals(1, runs.get());

        release.countDown();
        first.join(5000);

        replacement.run();
        assertEquals(2, runs.get());
    }

    @Test
    void guarded_distinctIdsRunIndependently() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger otherRuns = new AtomicInteger();

        Thread first = new Thread(scheduler.guarded("job-a", () -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        first.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        scheduler.guarded("job-b", otherRuns::incrementAndGet).run();
        assertEquals(1, otherRuns.get());

        release.countDown();
        first.join(5000);
    }

    @Test
    void guarded_failingTask_releasesGuard() {
        AtomicInteger runs = new AtomicInteger();
        Runnable failing = scheduler.guarded("job-a", () -> {
            runs.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        assertDoesNotThrow(failing::run);
        assertDoesNotThrow(failing::run);
        assertEquals(2, runs.get());
    }
}
