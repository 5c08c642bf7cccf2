package com.stellarcast.gateway.cron;

import com.stellarcast.gateway.delivery.PictureCache;
import com.stellarcast.gateway.support.FakeApodClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CacheJanitorTest {

    @TempDir
    Path tempDir;

    private ThreadPoolTaskScheduler taskScheduler;
    private JobScheduler jobScheduler;
    private PictureCache cache;
    private CacheJanitor janitor;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.initialize();
        jobScheduler = new JobScheduler(taskScheduler, ZoneOffset.UTC);
        cache = new PictureCache(tempDir);
        janitor = new CacheJanitor(jobScheduler, cache, SendTime.parse("13:00"));
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    void register_addsFixedJobWithoutSchedules() {
        janitor.register();

        assertTrue(jobScheduler.hasJob(CacheJanitor.JOB_ID));
        assertEquals(13, jobScheduler.nextFire(CacheJanitor.JOB_ID).get().getHour());
    }

    @Test
    void evict_clearsBothCaches() {
        cache.storePicture(FakeApodClient.image("2024-03-10"), cache.generation());
        cache.storeComposed(new byte[] { 1, 2, 3 }, cache.generation());

        janitor.evict();

        assertTrue(cache.loadPicture().isEmpty());
        assertTrue(cache.loadComposed().isEmpty());
    }

    @Test
    void resolveTime_usesConfiguredTime() {
        assertEquals(new SendTime(4, 30), CacheJanitor.resolveTime("4:30"));
    }

    @Test
    void resolveTime_malformed_fallsBackToDefault() {
        assertEquals(new SendTime(13, 0), CacheJanitor.resolveTime("25:99"));
        assertEquals(new SendTime(13, 0), CacheJanitor.resolveTime("noon"));
        assertEquals(new SendTime(13, 0), CacheJanitor.resolveTime(null));
    }
}
