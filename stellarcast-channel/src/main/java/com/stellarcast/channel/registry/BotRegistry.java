package com.stellarcast.channel.registry;

import com.stellarcast.channel.Destination;
import com.stellarcast.channel.adapter.ChannelOutboundAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live bot connections keyed by platform and bot account id.
 * Connections come and go as the front end connects; lookups never block.
 */
@Slf4j
public class BotRegistry {

    private final Map<String, ChannelOutboundAdapter> adapters = new ConcurrentHashMap<>();

    public void register(ChannelOutboundAdapter adapter) {
        adapters.put(key(adapter.getPlatform(), adapter.getBotId()), adapter);
        log.info("Registered bot connection: {}/{}", adapter.getPlatform(), adapter.getBotId());
    }

    public void unregister(String platform, String botId) {
        if (adapters.remove(key(platform, botId)) != null) {
            log.info("Unregistered bot connection: {}/{}", platform, botId);
        }
    }

    /**
     * Resolve the connection that can deliver to {@code destination}: the bot
     * named by its {@code selfId}, or any bot on the platform when the
     * destination does not name one.
     */
    public Optional<ChannelOutboundAdapter> resolve(Destination destination) {
        if (destination.selfId() != null) {
            return Optional.ofNullable(adapters.get(key(destination.platform(), destination.selfId())));
        }
        return adapters.values().stream()
                .filter(a -> destination.platform().equals(a.getPlatform()))
                .findFirst();
    }

    public int size() {
        return adapters.size();
    }

    private static String key(String platform, String botId) {
        return platform + "/" + botId;
    }
}
