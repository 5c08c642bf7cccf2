package com.stellarcast.gateway.command;

import com.stellarcast.channel.Destination;
import com.stellarcast.channel.adapter.ChannelOutboundAdapter;
import com.stellarcast.channel.adapter.ChannelOutboundAdapter.OutboundImagePayload;
import com.stellarcast.channel.adapter.ChannelOutboundAdapter.SentMessage;
import com.stellarcast.channel.delivery.MessageDeliveryService;
import com.stellarcast.channel.reply.ReplyAttachment;
import com.stellarcast.channel.reply.ReplyMetadataStore;
import com.stellarcast.gateway.cron.InvalidTimeFormatException;
import com.stellarcast.gateway.cron.ScheduleStatus;
import com.stellarcast.gateway.cron.SchedulerService;
import com.stellarcast.gateway.cron.SendTime;
import com.stellarcast.gateway.delivery.DeliveryPipeline;
import com.stellarcast.gateway.delivery.DeliveryReport;
import lombok.extern.slf4j.Slf4j;

import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for the command front end. Commands arrive decoded; replies
 * are returned as text for the front end to send back, while pictures go
 * straight to the destination.
 */
@Slf4j
public class ApodCommandHandler {

    private static final DateTimeFormatter NEXT_SEND_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final SchedulerService schedulerService;
    private final DeliveryPipeline pipeline;
    private final MessageDeliveryService delivery;
    private final ReplyMetadataStore replyMetadata;
    private final boolean enabled;

    public ApodCommandHandler(SchedulerService schedulerService, DeliveryPipeline pipeline,
            MessageDeliveryService delivery, ReplyMetadataStore replyMetadata, boolean enabled) {
        this.schedulerService = schedulerService;
        this.pipeline = pipeline;
        this.delivery = delivery;
        this.replyMetadata = replyMetadata;
        this.enabled = enabled;
    }

    /**
     * Handle a schedule-management command for the destination it was issued
     * in.
     *
     * @return reply text
     */
    public String handle(ApodCommand command, Destination destination) {
        if (!enabled) {
            return CommandMessages.NOT_CONFIGURED;
        }
        if (command instanceof ApodCommand.Status) {
            return status(destination);
        }
        if (command instanceof ApodCommand.Stop) {
            return stop(destination);
        }
        if (command instanceof ApodCommand.Start start) {
            return start(destination, start.time());
        }
        throw new IllegalArgumentException("Unknown command: " + command);
    }

    /**
     * Handle a one-shot picture request.
     *
     * @param messageId the command message, quoted by the picture
     * @return reply text when the request could not be served
     */
    public Optional<String> handle(PictureCommand command, Destination destination, String messageId) {
        if (!enabled) {
            return Optional.of(CommandMessages.NOT_CONFIGURED);
        }
        DeliveryReport report;
        if (command instanceof PictureCommand.Today) {
            report = pipeline.today(destination, messageId);
        } else if (command instanceof PictureCommand.Random) {
            report = pipeline.random(destination, messageId);
        } else if (command instanceof PictureCommand.ByDate byDate) {
            report = pipeline.byDate(destination, byDate.date(), messageId);
        } else {
            throw new IllegalArgumentException("Unknown command: " + command);
        }
        if (!report.isDone()) {
            log.info("apod: {} for {} ended with {}", command, destination.label(), report.result());
        }
        return Optional.ofNullable(report.notice());
    }

    /**
     * A message replying to {@code repliedMessageId} with {@code keyword}:
     * send back whatever was attached under that keyword.
     *
     * @return false if nothing (or nothing unexpired) was attached
     */
    public boolean handleReplyKeyword(Destination destination, String repliedMessageId, String keyword,
            String messageId) {
        Optional<ReplyAttachment> attachment = replyMetadata.lookup(destination, repliedMessageId, keyword);
        if (attachment.isEmpty()) {
            return false;
        }
        Optional<ChannelOutboundAdapter> bot = delivery.resolveBot(destination);
        if (bot.isEmpty()) {
            log.warn("apod: no live bot for {}, dropping '{}' reply", destination.label(), keyword);
            return false;
        }
        ReplyAttachment found = attachment.get();
        CompletableFuture<SentMessage> sent;
        try {
            sent = switch (found.kind()) {
                case TEXT -> delivery.deliverText(bot.get(), destination, found.content(), messageId);
                case IMAGE_URL -> delivery.deliverImage(bot.get(), OutboundImagePayload.builder()
                        .target(destination)
                        .imageUrl(found.content())
                        .replyTo(messageId)
                        .build());
            };
        } catch (RuntimeException e) {
            log.error("apod: failed to send '{}' to {}: {}", found.name(), destination.label(), e.getMessage());
            return false;
        }
        sent.whenComplete((message, error) -> {
            if (error != null) {
                log.error("apod: failed to send '{}' to {}: {}", found.name(), destination.label(),
                        error.getMessage());
            }
        });
        return true;
    }

    private String status(Destination destination) {
        ScheduleStatus status = schedulerService.status(destination);
        if (!status.running()) {
            return CommandMessages.NOT_RUNNING;
        }
        String next = status.nextFire().map(NEXT_SEND_FORMAT::format).orElse(CommandMessages.UNKNOWN);
        return String.format(CommandMessages.RUNNING, next);
    }

    private String stop(Destination destination) {
        try {
            schedulerService.stop(destination);
            return CommandMessages.STOPPED;
        } catch (RuntimeException e) {
            log.error("apod: failed to stop delivery to {}: {}", destination.label(), e.getMessage(), e);
            return CommandMessages.STOP_FAILED;
        }
    }

    private String start(Destination destination, Optional<String> time) {
        try {
            SendTime sendTime = schedulerService.start(destination, time);
            return time.isPresent()
                    ? String.format(CommandMessages.STARTED, sendTime)
                    : String.format(CommandMessages.STARTED_DEFAULT, sendTime);
        } catch (InvalidTimeFormatException e) {
            return CommandMessages.INVALID_TIME;
        } catch (RuntimeException e) {
            log.error("apod: failed to start delivery to {}: {}", destination.label(), e.getMessage(), e);
            return CommandMessages.START_FAILED;
        }
    }
}
