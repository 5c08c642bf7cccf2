package com.stellarcast.channel.reply;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.stellarcast.channel.Destination;
import com.stellarcast.channel.TargetCodec;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Reply-metadata attached to delivered messages, each entry expiring after its
 * own TTL. Entries are scoped to the conversation the message was sent to,
 * since message ids are only unique per chat on some platforms.
 */
@Slf4j
public class ReplyMetadataStore {

    private static final int MAX_ENTRIES = 10_000;

    private final Cache<String, ReplyAttachment> cache;

    public ReplyMetadataStore() {
        this(Ticker.systemTicker());
    }

    public ReplyMetadataStore(Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .ticker(ticker)
                .maximumSize(MAX_ENTRIES)
                .expireAfter(new Expiry<String, ReplyAttachment>() {
                    @Override
                    public long expireAfterCreate(String key, ReplyAttachment value, long currentTime) {
                        return value.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, ReplyAttachment value, long currentTime,
                            long currentDuration) {
                        return value.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, ReplyAttachment value, long currentTime,
                            long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    public void attach(Destination destination, String messageId, ReplyAttachment attachment) {
        cache.put(key(destination, messageId, attachment.keyword()), attachment);
        log.debug("Attached '{}' to message {} in {} under '{}' for {}",
                attachment.name(), messageId, destination.label(), attachment.keyword(), attachment.ttl());
    }

    /**
     * Look up what a reply to {@code messageId} in {@code destination} with
     * {@code keyword} retrieves.
     */
    public Optional<ReplyAttachment> lookup(Destination destination, String messageId, String keyword) {
        if (destination == null || messageId == null || keyword == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(key(destination, messageId, keyword.trim())));
    }

    private static String key(Destination destination, String messageId, String keyword) {
        return TargetCodec.toCanonicalString(destination) + "\u0000" + messageId + "\u0000" + keyword;
    }
}
