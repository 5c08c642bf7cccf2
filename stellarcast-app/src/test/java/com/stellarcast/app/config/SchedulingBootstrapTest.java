package com.stellarcast.app.config;

import com.stellarcast.channel.Destination;
import com.stellarcast.common.config.ConfigDefaults;
import com.stellarcast.common.config.StellarcastConfig;
import com.stellarcast.gateway.cron.CacheJanitor;
import com.stellarcast.gateway.cron.JobScheduler;
import com.stellarcast.gateway.cron.ScheduleEntry;
import com.stellarcast.gateway.cron.ScheduleRecovery;
import com.stellarcast.gateway.cron.ScheduleStore;
import com.stellarcast.gateway.cron.SchedulerService;
import com.stellarcast.gateway.cron.SendTime;
import com.stellarcast.gateway.delivery.PictureCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchedulingBootstrapTest {

    @TempDir
    Path tempDir;

    private ThreadPoolTaskScheduler taskScheduler;
    private JobScheduler jobScheduler;
    private ScheduleRecovery recovery;
    private CacheJanitor janitor;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.initialize();
        jobScheduler = new JobScheduler(taskScheduler, ZoneId.systemDefault());
        ScheduleStore store = new ScheduleStore(tempDir.resolve("apod_task_config.json"));
        store.replaceAll(List.of(new ScheduleEntry(Destination.group("qq", "1001", "bot-a"), "08:00")));
        SchedulerService service = new SchedulerService(store, jobScheduler, destination -> {
        }, "13:00");
        recovery = new ScheduleRecovery(store, service);
        janitor = new CacheJanitor(jobScheduler, new PictureCache(tempDir.resolve("cache")), SendTime.parse("13:00"));
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    private static StellarcastConfig config(String apiKey) {
        StellarcastConfig config = ConfigDefaults.apply(new StellarcastConfig());
        config.getApod().setApiKey(apiKey);
        return config;
    }

    @Test
    void onReady_registersJanitorAndRestoresSchedules() {
        new SchedulingBootstrap(config("DEMO_KEY"), recovery, janitor).onReady();

        assertTrue(recovery.hasRun());
        assertTrue(jobScheduler.hasJob(CacheJanitor.JOB_ID));
        assertEquals(2, jobScheduler.jobCount());
    }

    @Test
    void onReady_withoutApiKey_doesNothing() {
        new SchedulingBootstrap(config(null), recovery, janitor).onReady();

        assertFalse(recovery.hasRun());
        assertEquals(0, jobScheduler.jobCount());
    }
}
