package com.stellarcast.channel.reply;

import java.time.Duration;

/**
 * Side-channel content attached to a sent message, retrievable by replying to
 * that message with {@code keyword} until {@code ttl} elapses.
 *
 * @param name    attachment name, for logs
 * @param keyword command word that retrieves it ("explain", "original")
 * @param kind    how the content should be sent back
 * @param content text, or image URL for {@link Kind#IMAGE_URL}
 * @param ttl     expiry measured from attachment time
 */
public record ReplyAttachment(String name, String keyword, Kind kind, String content, Duration ttl) {

    public enum Kind {
        TEXT, IMAGE_URL
    }

    public static ReplyAttachment text(String name, String keyword, String text, Duration ttl) {
        return new ReplyAttachment(name, keyword, Kind.TEXT, text, ttl);
    }

    public static ReplyAttachment imageUrl(String name, String keyword, String url, Duration ttl) {
        return new ReplyAttachment(name, keyword, Kind.IMAGE_URL, url, ttl);
    }
}
