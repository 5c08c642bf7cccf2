package com.stellarcast.gateway.command;

import com.stellarcast.channel.Destination;
import com.stellarcast.channel.delivery.MessageDeliveryService;
import com.stellarcast.channel.registry.BotRegistry;
import com.stellarcast.channel.reply.ReplyAttachment;
import com.stellarcast.channel.reply.ReplyMetadataStore;
import com.stellarcast.common.result.Outcome;
import com.stellarcast.gateway.cron.JobScheduler;
import com.stellarcast.gateway.cron.SchedulerService;
import com.stellarcast.gateway.delivery.DeliveryMessages;
import com.stellarcast.gateway.delivery.DeliveryPipeline;
import com.stellarcast.gateway.delivery.DeliverySettings;
import com.stellarcast.gateway.delivery.PictureCache;
import com.stellarcast.gateway.support.FakeApodClient;
import com.stellarcast.gateway.support.RecordingAdapter;
import com.stellarcast.gateway.support.ScriptedScheduleStore;
import com.stellarcast.media.translate.NoopTranslator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ApodCommandHandlerTest {

    @TempDir
    Path tempDir;

    private ThreadPoolTaskScheduler taskScheduler;
    private ReplyMetadataStore replyMetadata;
    private RecordingAdapter bot;
    private FakeApodClient apod;
    private ScriptedScheduleStore store;
    private SchedulerService schedulerService;
    private MessageDeliveryService delivery;
    private DeliveryPipeline pipeline;

    private final Destination destination = Destination.group("qq", "1001", "bot-a");

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.initialize();
        BotRegistry registry = new BotRegistry();
        bot = new RecordingAdapter("qq", "bot-a");
        registry.register(bot);
        replyMetadata = new ReplyMetadataStore();
        delivery = new MessageDeliveryService(registry, replyMetadata, 4000);
        apod = new FakeApodClient();
        pipeline = new DeliveryPipeline(delivery, apod, new NoopTranslator(), picture -> Outcome.ok(new byte[] { 1 }),
                new PictureCache(tempDir.resolve("cache")),
                new DeliverySettings(false, false, true, true, Duration.ofMinutes(6), Duration.ofSeconds(5)));
        store = new ScriptedScheduleStore(tempDir.resolve("data").resolve("apod_task_config.json"));
        schedulerService = new SchedulerService(store, new JobScheduler(taskScheduler, ZoneId.systemDefault()),
                pipeline::deliverScheduled, "13:00");
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    private ApodCommandHandler handler(boolean enabled) {
        return new ApodCommandHandler(schedulerService, pipeline, delivery, replyMetadata, enabled);
    }

    // =========================================================================
    // Schedule management
    // =========================================================================

    @Test
    void status_notRunning() {
        assertEquals(CommandMessages.NOT_RUNNING, handler(true).handle(new ApodCommand.Status(), destination));
    }

    @Test
    void start_withoutTime_confirmsDefault() {
        String reply = handler(true).handle(new ApodCommand.Start(Optional.empty()), destination);

        assertEquals(String.format(CommandMessages.STARTED_DEFAULT, "13:00"), reply);
        assertEquals(1, store.load().size());
    }

    @Test
    void start_withTime_thenStatusShowsNextSend() {
        ApodCommandHandler handler = handler(true);

        assertEquals(String.format(CommandMessages.STARTED, "07:05"),
                handler.handle(new ApodCommand.Start(Optional.of("7:05")), destination));

        String status = handler.handle(new ApodCommand.Status(), destination);
        assertTrue(status.matches(".*next send: \\d{4}-\\d{2}-\\d{2} 07:05:00"), status);
    }

    @Test
    void start_invalidTime_repliesWithFormatHint() {
        String reply = handler(true).handle(new ApodCommand.Start(Optional.of("7pm")), destination);

        assertEquals(CommandMessages.INVALID_TIME, reply);
        assertTrue(store.load().isEmpty());
    }

    @Test
    void stop_confirmsAndClears() {
        ApodCommandHandler handler = handler(true);
        handler.handle(new ApodCommand.Start(Optional.of("08:00")), destination);

        assertEquals(CommandMessages.STOPPED, handler.handle(new ApodCommand.Stop(), destination));
        assertEquals(CommandMessages.NOT_RUNNING, handler.handle(new ApodCommand.Status(), destination));
        assertTrue(store.load().isEmpty());
    }

    @Test
    void stop_persistFails_repliesFailureAndKeepsSchedule() {
        ApodCommandHandler handler = handler(true);
        handler.handle(new ApodCommand.Start(Optional.of("08:00")), destination);
        store.failWrites = true;

        assertEquals(CommandMessages.STOP_FAILED, handler.handle(new ApodCommand.Stop(), destination));

        assertTrue(handler.handle(new ApodCommand.Status(), destination).contains("next send"));
        assertEquals(1, store.load().size());
    }

    @Test
    void start_persistFails_repliesFailure() {
        store.failWrites = true;

        assertEquals(CommandMessages.START_FAILED,
                handler(true).handle(new ApodCommand.Start(Optional.of("08:00")), destination));
        assertEquals(CommandMessages.NOT_RUNNING, handler(true).handle(new ApodCommand.Status(), destination));
    }

    @Test
    void disabled_repliesNotConfigured() {
        ApodCommandHandler handler = handler(false);

        assertEquals(CommandMessages.NOT_CONFIGURED, handler.handle(new ApodCommand.Stop(), destination));
        assertEquals(Optional.of(CommandMessages.NOT_CONFIGURED),
                handler.handle(new PictureCommand.Today(), destination, "cmd-1"));
        assertTrue(bot.images.isEmpty());
    }

    // =========================================================================
    // Picture commands and reply keywords
    // =========================================================================

    @Test
    void today_success_hasNoReplyText() {
        assertEquals(Optional.empty(), handler(true).handle(new PictureCommand.Today(), destination, "cmd-1"));
        assertEquals(1, bot.images.size());
    }

    @Test
    void byDate_invalid_repliesWithNotice() {
        Optional<String> reply = handler(true).handle(new PictureCommand.ByDate("10/01/2023"), destination, "cmd-2");

        assertEquals(Optional.of(DeliveryMessages.INVALID_DATE), reply);
        assertEquals(0, apod.byDateCalls.get());
    }

    @Test
    void replyKeyword_sendsAttachmentBack() {
        ApodCommandHandler handler = handler(true);
        handler.handle(new PictureCommand.Random(), destination, "cmd-3");
        String pictureMessage = bot.lastMessageId();

        assertTrue(handler.handleReplyKeyword(destination, pictureMessage, " explain ", "reply-1"));

        assertEquals(1, bot.texts.size());
        assertEquals("Explanation for 2001-01-01", bot.texts.get(0).getText());
        assertEquals("reply-1", bot.texts.get(0).getReplyTo());
    }

    @Test
    void replyKeyword_imageAttachment_sendsImage() {
        replyMetadata.attach(destination, "msg-x", ReplyAttachment.imageUrl("original", "original",
                "https://apod.nasa.gov/full.jpg", Duration.ofMinutes(6)));

        assertTrue(handler(true).handleReplyKeyword(destination, "msg-x", "original", "reply-2"));

        assertEquals("https://apod.nasa.gov/full.jpg", bot.images.get(0).getImageUrl());
    }

    @Test
    void replyKeyword_unknown_isIgnored() {
        assertFalse(handler(true).handleReplyKeyword(destination, "msg-unknown", "explain", "reply-3"));
        assertTrue(bot.texts.isEmpty());
    }

    @Test
    void replyKeyword_fromAnotherChat_isIgnored() {
        ApodCommandHandler handler = handler(true);
        handler.handle(new PictureCommand.Random(), destination, "cmd-4");
        String pictureMessage = bot.lastMessageId();
        Destination otherGroup = Destination.group("qq", "2002", "bot-a");

        assertFalse(handler.handleReplyKeyword(otherGroup, pictureMessage, "explain", "reply-4"));
        assertTrue(bot.texts.isEmpty());
    }
}
