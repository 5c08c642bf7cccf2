package com.stellarcast.channel.delivery;

import com.stellarcast.channel.Destination;
import com.stellarcast.channel.adapter.ChannelOutboundAdapter;
import com.stellarcast.channel.adapter.ChannelOutboundAdapter.SentMessage;
import com.stellarcast.channel.registry.BotRegistry;
import com.stellarcast.channel.reply.ReplyAttachment;
import com.stellarcast.channel.reply.ReplyMetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Unified message delivery: bot resolution, text splitting, image sending and
 * reply-metadata attachment.
 */
@Slf4j
public class MessageDeliveryService {

    private final BotRegistry botRegistry;
    private final ReplyMetadataStore replyMetadata;
    private final int maxTextLength;

    public MessageDeliveryService(BotRegistry botRegistry, ReplyMetadataStore replyMetadata, int maxTextLength) {
        this.botRegistry = botRegistry;
        this.replyMetadata = replyMetadata;
        this.maxTextLength = maxTextLength;
    }

    public Optional<ChannelOutboundAdapter> resolveBot(Destination destination) {
        return botRegistry.resolve(destination);
    }

    /**
     * Deliver a text message, splitting if necessary. Completes with the last
     * chunk's handle.
     */
    public CompletableFuture<SentMessage> deliverText(ChannelOutboundAdapter adapter, Destination target,
            String text, String replyTo) {
        if (text.length() <= maxTextLength) {
            return adapter.sendText(textPayload(target, text, replyTo));
        }
        List<String> chunks = splitText(text, maxTextLength);
        log.debug("Splitting message into {} chunks for {}", chunks.size(), target.label());

        CompletableFuture<SentMessage> chain = CompletableFuture.completedFuture(null);
        for (int i = 0; i < chunks.size(); i++) {
            String chunk = chunks.get(i);
            // only the first chunk quotes the triggering message
            String quote = i == 0 ? replyTo : null;
            chain = chain.thenCompose(previous -> adapter.sendText(textPayload(target, chunk, quote)));
        }
        return chain;
    }

    /**
     * Deliver an image message.
     */
    public CompletableFuture<SentMessage> deliverImage(ChannelOutboundAdapter adapter,
            ChannelOutboundAdapter.OutboundImagePayload payload) {
        return adapter.sendImage(payload);
    }

    /**
     * Make {@code attachment} retrievable by replying to {@code sent} in
     * {@code destination}.
     */
    public void attach(Destination destination, SentMessage sent, ReplyAttachment attachment) {
        if (sent == null || sent.messageId() == null) {
            log.warn("Cannot attach '{}': platform returned no message id", attachment.name());
            return;
        }
        replyMetadata.attach(destination, sent.messageId(), attachment);
    }

    /**
     * Split text into chunks at natural boundaries (newlines, then spaces).
     */
    List<String> splitText(String text, int maxLen) {
        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLen >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            int end = start + maxLen;
            int breakAt = text.lastIndexOf('\n', end);
            if (breakAt <= start) {
                breakAt = text.lastIndexOf(' ', end);
            }
            if (breakAt <= start) {
                breakAt = end;
            }

            chunks.add(text.substring(start, breakAt));
            start = breakAt;
            if (start < text.length() && (text.charAt(start) == '\n' || text.charAt(start) == ' ')) {
                start++;
            }
        }
        return chunks;
    }

    private static ChannelOutboundAdapter.OutboundTextPayload textPayload(Destination target, String text,
            String replyTo) {
        return ChannelOutboundAdapter.OutboundTextPayload.builder()
                .target(target)
                .text(text)
                .replyTo(replyTo)
                .build();
    }
}
