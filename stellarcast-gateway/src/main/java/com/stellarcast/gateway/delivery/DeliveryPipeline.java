package com.stellarcast.gateway.delivery;

import com.stellarcast.channel.Destination;
import com.stellarcast.channel.adapter.ChannelOutboundAdapter;
import com.stellarcast.channel.adapter.ChannelOutboundAdapter.OutboundImagePayload;
import com.stellarcast.channel.adapter.ChannelOutboundAdapter.SentMessage;
import com.stellarcast.channel.delivery.MessageDeliveryService;
import com.stellarcast.channel.reply.ReplyAttachment;
import com.stellarcast.common.result.ErrorKind;
import com.stellarcast.common.result.Outcome;
import com.stellarcast.media.apod.ApodClient;
import com.stellarcast.media.apod.ApodDates;
import com.stellarcast.media.apod.InvalidDateFormatException;
import com.stellarcast.media.apod.PictureOfDay;
import com.stellarcast.media.compose.ImageComposer;
import com.stellarcast.media.translate.Translator;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Delivers the astronomy picture to one destination:
 * resolve bot, ensure data, classify media, translate or compose, send,
 * attach reply metadata.
 * <p>
 * Scheduled runs send their own failure notices. Command runs leave the
 * notice in the returned {@link DeliveryReport} for the command front end to
 * reply with. Nothing thrown by a send escapes.
 */
@Slf4j
public class DeliveryPipeline {

    private final MessageDeliveryService delivery;
    private final ApodClient apodClient;
    private final Translator translator;
    private final ImageComposer composer;
    private final PictureCache cache;
    private final DeliverySettings settings;

    private final ReentrantLock fetchLock = new ReentrantLock();

    public DeliveryPipeline(MessageDeliveryService delivery, ApodClient apodClient, Translator translator,
            ImageComposer composer, PictureCache cache, DeliverySettings settings) {
        this.delivery = delivery;
        this.apodClient = apodClient;
        this.translator = translator;
        this.composer = composer;
        this.cache = cache;
        this.settings = settings;
    }

    // --- Entry points ---

    /**
     * Trigger callback for a destination's daily schedule.
     */
    public DeliveryReport deliverScheduled(Destination destination) {
        DeliveryReport report;
        try {
            report = deliverToday(destination, null, false);
        } catch (RuntimeException e) {
            log.error("apod: scheduled delivery to {} failed: {}", destination.label(), e.getMessage(), e);
            report = DeliveryReport.failed(DeliveryResult.SEND_FAILED, DeliveryStage.SEND,
                    DeliveryMessages.SEND_FAILED);
        }
        if (report.notice() != null && shouldNotify(report)) {
            sendNotice(destination, report.notice());
        }
        log.info("apod: scheduled delivery to {} ended with {} at {}",
                destination.label(), report.result(), report.stage());
        return report;
    }

    /** One-shot "today" command. */
    public DeliveryReport today(Destination destination, String replyTo) {
        return deliverToday(destination, replyTo, true);
    }

    /** One-shot "random" command. Bypasses the cache. */
    public DeliveryReport random(Destination destination, String replyTo) {
        Optional<ChannelOutboundAdapter> bot = resolveBot(destination);
        if (bot.isEmpty()) {
            return botOffline();
        }
        Outcome<PictureOfDay> data = apodClient.fetchRandom();
        if (!data.isOk()) {
            return fetchFailed(data, DeliveryMessages.FETCH_RANDOM_FAILED);
        }
        PictureOfDay picture = data.get();
        if (!picture.isDeliverableImage()) {
            return notAnImage(DeliveryMessages.VIDEO_RANDOM);
        }
        return sendPlain(bot.get(), destination, picture,
                DeliveryMessages.RANDOM_CAPTION + " (" + picture.getDate() + ")", replyTo);
    }

    /**
     * One-shot "by date" command. The date is validated before anything is
     * fetched.
     */
    public DeliveryReport byDate(Destination destination, String rawDate, String replyTo) {
        LocalDate date;
        try {
            date = ApodDates.parse(rawDate);
        } catch (InvalidDateFormatException e) {
            log.debug("apod: rejected date argument: {}", e.getMessage());
            return DeliveryReport.failed(DeliveryResult.INVALID_DATE, DeliveryStage.ENSURE_DATA,
                    DeliveryMessages.INVALID_DATE);
        }
        Optional<ChannelOutboundAdapter> bot = resolveBot(destination);
        if (bot.isEmpty()) {
            return botOffline();
        }
        Outcome<PictureOfDay> data = apodClient.fetchByDate(date);
        if (!data.isOk()) {
            return fetchFailed(data, DeliveryMessages.FETCH_BY_DATE_FAILED);
        }
        PictureOfDay picture = data.get();
        if (!picture.isDeliverableImage()) {
            return notAnImage(DeliveryMessages.VIDEO_BY_DATE);
        }
        return sendPlain(bot.get(), destination, picture, DeliveryMessages.BY_DATE_CAPTION + date, replyTo);
    }

    // --- Stages ---

    private DeliveryReport deliverToday(Destination destination, String replyTo, boolean command) {
        Optional<ChannelOutboundAdapter> bot = resolveBot(destination);
        if (bot.isEmpty()) {
            return botOffline();
        }

        long generation = cache.generation();
        Outcome<PictureOfDay> data = ensureToday(generation);
        if (!data.isOk()) {
            return fetchFailed(data, DeliveryMessages.FETCH_TODAY_FAILED);
        }

        PictureOfDay picture = data.get();
        if (!picture.isDeliverableImage()) {
            log.info("apod: today's entry is {}, not an image", picture.getMediaType());
            return notAnImage(DeliveryMessages.VIDEO_TODAY);
        }

        if (settings.puzzleMode()) {
            return sendComposed(bot.get(), destination, picture, generation, replyTo,
                    command && settings.consumeComposedOnCommand());
        }
        return sendPlain(bot.get(), destination, picture, DeliveryMessages.TODAY_CAPTION, replyTo);
    }

    private Optional<ChannelOutboundAdapter> resolveBot(Destination destination) {
        Optional<ChannelOutboundAdapter> bot = delivery.resolveBot(destination);
        if (bot.isEmpty()) {
            log.warn("apod: no live bot for {}, skipping delivery", destination.label());
        }
        return bot;
    }

    /**
     * Cached picture of the day, fetched and cached on a miss.
     *
     * @param generation cache generation read before this delivery started
     */
    Outcome<PictureOfDay> ensureToday(long generation) {
        fetchLock.lock();
        try {
            Optional<PictureOfDay> cached = cache.loadPicture();
            if (cached.isPresent()) {
                return Outcome.ok(cached.get());
            }
            Outcome<PictureOfDay> fetched = apodClient.fetchToday();
            if (fetched.isOk()) {
                cache.storePicture(fetched.get(), generation);
            }
            return fetched;
        } finally {
            fetchLock.unlock();
        }
    }

    private DeliveryReport sendPlain(ChannelOutboundAdapter bot, Destination destination, PictureOfDay picture,
            String caption, String replyTo) {
        log.debug("apod: {} -> {}", DeliveryStage.TRANSLATE, destination.label());
        String explanation = translator.translateOrOriginal(
                picture.getExplanation() == null ? "" : picture.getExplanation());

        OutboundImagePayload payload = OutboundImagePayload.builder()
                .target(destination)
                .caption(caption)
                .imageUrl(picture.getUrl())
                .replyTo(replyTo)
                .build();
        Outcome<SentMessage> sent = send(() -> delivery.deliverImage(bot, payload));
        if (!sent.isOk()) {
            return sendFailed(destination, sent);
        }

        delivery.attach(destination, sent.get(), ReplyAttachment.text("explanation",
                DeliveryMessages.KEYWORD_EXPLAIN, explanation, settings.replyTtl()));
        return DeliveryReport.done();
    }

    private DeliveryReport sendComposed(ChannelOutboundAdapter bot, Destination destination, PictureOfDay picture,
            long generation, String replyTo, boolean consume) {
        log.debug("apod: {} -> {}", DeliveryStage.COMPOSE, destination.label());
        Optional<byte[]> cached = cache.loadComposed();
        byte[] png;
        if (cached.isPresent()) {
            png = cached.get();
        } else {
            Outcome<byte[]> composed = composer.compose(picture);
            if (!composed.isOk()) {
                log.error("apod: composing {} failed: {}", picture.getDate(), composed.message());
                return DeliveryReport.failed(DeliveryResult.COMPOSE_FAILED, DeliveryStage.COMPOSE,
                        DeliveryMessages.COMPOSE_FAILED);
            }
            png = composed.get();
            cache.storeComposed(png, generation);
        }

        OutboundImagePayload payload = OutboundImagePayload.builder()
                .target(destination)
                .imageBytes(png)
                .replyTo(replyTo)
                .build();
        Outcome<SentMessage> sent = send(() -> delivery.deliverImage(bot, payload));
        if (!sent.isOk()) {
            return sendFailed(destination, sent);
        }

        delivery.attach(destination, sent.get(), ReplyAttachment.imageUrl("original",
                DeliveryMessages.KEYWORD_ORIGINAL, picture.originalUrl(settings.hdImage()), settings.replyTtl()));
        if (consume) {
            cache.evictComposed();
        }
        return DeliveryReport.done();
    }

    // --- Helpers ---

    private Outcome<SentMessage> send(Supplier<CompletableFuture<SentMessage>> action) {
        try {
            SentMessage sent = action.get().get(settings.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return Outcome.ok(sent);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return Outcome.failed(ErrorKind.SEND_FAILURE, cause.getMessage());
        } catch (TimeoutException e) {
            return Outcome.failed(ErrorKind.SEND_FAILURE, "timed out after " + settings.sendTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failed(ErrorKind.SEND_FAILURE, "interrupted");
        } catch (RuntimeException e) {
            return Outcome.failed(ErrorKind.SEND_FAILURE, e.getMessage());
        }
    }

    private void sendNotice(Destination destination, String notice) {
        Optional<ChannelOutboundAdapter> bot = delivery.resolveBot(destination);
        if (bot.isEmpty()) {
            return;
        }
        Outcome<SentMessage> sent = send(() -> delivery.deliverText(bot.get(), destination, notice, null));
        if (!sent.isOk()) {
            log.error("apod: failed to notify {}: {}", destination.label(), sent.message());
        }
    }

    private boolean shouldNotify(DeliveryReport report) {
        return report.result() != DeliveryResult.FETCH_FAILED || settings.notifyOnScheduledFetchFailure();
    }

    private static DeliveryReport botOffline() {
        return DeliveryReport.failed(DeliveryResult.BOT_OFFLINE, DeliveryStage.RESOLVE_BOT, null);
    }

    private static DeliveryReport fetchFailed(Outcome<?> outcome, String notice) {
        log.error("apod: fetch failed ({}): {}", outcome.errorKind(), outcome.message());
        return DeliveryReport.failed(DeliveryResult.FETCH_FAILED, DeliveryStage.ENSURE_DATA, notice);
    }

    private static DeliveryReport notAnImage(String notice) {
        return DeliveryReport.failed(DeliveryResult.NOT_AN_IMAGE, DeliveryStage.CLASSIFY_MEDIA, notice);
    }

    private static DeliveryReport sendFailed(Destination destination, Outcome<?> outcome) {
        log.error("apod: sending to {} failed: {}", destination.label(), outcome.message());
        return DeliveryReport.failed(DeliveryResult.SEND_FAILED, DeliveryStage.SEND, DeliveryMessages.SEND_FAILED);
    }
}
