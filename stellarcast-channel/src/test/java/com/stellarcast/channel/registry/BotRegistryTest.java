package com.stellarcast.channel.registry;

import com.stellarcast.channel.Destination;
import com.stellarcast.channel.adapter.ChannelOutboundAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class BotRegistryTest {

    private BotRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new BotRegistry();
    }

    @Test
    void resolve_bySelfId() {
        ChannelOutboundAdapter a = adapter("telegram", "bot-a");
        ChannelOutboundAdapter b = adapter("telegram", "bot-b");
        registry.register(a);
        registry.register(b);

        assertSame(b, registry.resolve(Destination.user("telegram", "1", "bot-b")).orElseThrow());
    }

    @Test
    void resolve_offlineBot_returnsEmpty() {
        registry.register(adapter("telegram", "bot-a"));

        assertTrue(registry.resolve(Destination.user("telegram", "1", "bot-z")).isEmpty());
        assertTrue(registry.resolve(Destination.user("qq", "1", "bot-a")).isEmpty());
    }

    @Test
    void resolve_withoutSelfId_usesAnyBotOnPlatform() {
        ChannelOutboundAdapter a = adapter("qq", "bot-a");
        registry.register(a);

        Destination anonymous = new Destination("qq", "1", null, false, false, null, null);
        assertSame(a, registry.resolve(anonymous).orElseThrow());
    }

    @Test
    void unregister_removesConnection() {
        registry.register(adapter("qq", "bot-a"));
        registry.unregister("qq", "bot-a");

        assertEquals(0, registry.size());
        assertTrue(registry.resolve(Destination.group("qq", "1", "bot-a")).isEmpty());
    }

    private static ChannelOutboundAdapter adapter(String platform, String botId) {
        return new ChannelOutboundAdapter() {
            @Override
            public String getPlatform() {
                return platform;
            }

            @Override
            public String getBotId() {
                return botId;
            }

            @Override
            public CompletableFuture<SentMessage> sendText(OutboundTextPayload payload) {
                return CompletableFuture.completedFuture(new SentMessage("t"));
            }

            @Override
            public CompletableFuture<SentMessage> sendImage(OutboundImagePayload payload) {
                return CompletableFuture.completedFuture(new SentMessage("i"));
            }
        };
    }
}
