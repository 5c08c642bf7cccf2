package com.stellarcast.channel.adapter;

import com.stellarcast.channel.Destination;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound side of one live bot connection. Implemented by the messaging
 * front end for each platform account.
 */
public interface ChannelOutboundAdapter {

    /** Platform identifier (e.g. "telegram", "qq"). */
    String getPlatform();

    /** Account id of the bot behind this connection. */
    String getBotId();

    /** Send a text message. */
    CompletableFuture<SentMessage> sendText(OutboundTextPayload payload);

    /** Send an image, from a URL or raw bytes, with an optional caption. */
    CompletableFuture<SentMessage> sendImage(OutboundImagePayload payload);

    // --- Supporting types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class OutboundTextPayload {
        private Destination target;
        private String text;
        private String replyTo;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class OutboundImagePayload {
        private Destination target;
        private String caption;
        private String imageUrl;
        private byte[] imageBytes;
        private String replyTo;
    }

    /**
     * Handle of a message the platform accepted.
     */
    record SentMessage(String messageId) {
    }
}
