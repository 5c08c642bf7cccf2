package com.stellarcast.channel;

import java.util.Map;

/**
 * Where a message should be delivered: platform, chat id, and the bot that
 * sends it. The scheduling core treats this as opaque and relies only on value
 * equality and {@link TargetCodec#serialize(Destination)}.
 *
 * @param platform    adapter platform, e.g. "telegram", "qq"
 * @param id          user or group/channel id on that platform
 * @param parentId    guild/server id for nested channels, or null
 * @param channel     whether {@code id} names a channel inside {@code parentId}
 * @param privateChat whether this is a direct conversation with a user
 * @param selfId      id of the bot account that owns the conversation
 * @param extra       adapter-specific fields
 */
public record Destination(
        String platform,
        String id,
        String parentId,
        boolean channel,
        boolean privateChat,
        String selfId,
        Map<String, String> extra) {

    public Destination {
        if (platform == null || platform.isBlank()) {
            throw new IllegalArgumentException("platform is required");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public static Destination user(String platform, String userId, String selfId) {
        return new Destination(platform, userId, null, false, true, selfId, Map.of());
    }

    public static Destination group(String platform, String groupId, String selfId) {
        return new Destination(platform, groupId, null, false, false, selfId, Map.of());
    }

    public static Destination channel(String platform, String guildId, String channelId, String selfId) {
        return new Destination(platform, channelId, guildId, true, false, selfId, Map.of());
    }

    /**
     * Short human-readable label for logs.
     */
    public String label() {
        String scope = privateChat ? "user" : channel ? "channel" : "group";
        return platform + ":" + scope + ":" + (parentId != null ? parentId + "/" : "") + id;
    }
}
