package com.stellarcast.channel.reply;

import com.stellarcast.channel.Destination;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ReplyMetadataStoreTest {

    private static final Destination CHAT = Destination.user("telegram", "42", "bot-b");
    private static final Destination OTHER_CHAT = Destination.user("telegram", "43", "bot-b");

    private final AtomicLong nanos = new AtomicLong();
    private ReplyMetadataStore store;

    @BeforeEach
    void setUp() {
        store = new ReplyMetadataStore(nanos::get);
    }

    @Test
    void lookup_matchesMessageAndKeyword() {
        store.attach(CHAT, "m1", ReplyAttachment.text("explanation", "explain", "A galaxy", Duration.ofMinutes(2)));

        assertEquals("A galaxy", store.lookup(CHAT, "m1", "explain").orElseThrow().content());
        assertEquals("A galaxy", store.lookup(CHAT, "m1", " explain ").orElseThrow().content());
        assertTrue(store.lookup(CHAT, "m1", "original").isEmpty());
        assertTrue(store.lookup(CHAT, "m2", "explain").isEmpty());
        assertTrue(store.lookup(CHAT, null, "explain").isEmpty());
    }

    @Test
    void lookup_afterTtl_isEmpty() {
        store.attach(CHAT, "m1", ReplyAttachment.imageUrl("background", "original", "https://x/hd.jpg",
                Duration.ofMinutes(2)));

        nanos.addAndGet(Duration.ofSeconds(119).toNanos());
        assertTrue(store.lookup(CHAT, "m1", "original").isPresent());

        nanos.addAndGet(Duration.ofSeconds(2).toNanos());
        assertTrue(store.lookup(CHAT, "m1", "original").isEmpty());
    }

    @Test
    void attach_entriesExpireIndependently() {
        store.attach(CHAT, "m1", ReplyAttachment.text("short", "explain", "s", Duration.ofSeconds(10)));
        store.attach(CHAT, "m2", ReplyAttachment.text("long", "explain", "l", Duration.ofSeconds(60)));

        nanos.addAndGet(Duration.ofSeconds(30).toNanos());

        assertTrue(store.lookup(CHAT, "m1", "explain").isEmpty());
        assertEquals("l", store.lookup(CHAT, "m2", "explain").orElseThrow().content());
    }

    @Test
    void lookup_sameMessageIdInAnotherChat_isEmpty() {
        store.attach(CHAT, "17", ReplyAttachment.text("explanation", "explain", "mine", Duration.ofMinutes(2)));

        assertTrue(store.lookup(OTHER_CHAT, "17", "explain").isEmpty());
        assertEquals("mine", store.lookup(CHAT, "17", "explain").orElseThrow().content());
    }

    @Test
    void attach_sameMessageIdInTwoChats_keepsBoth() {
        store.attach(CHAT, "17", ReplyAttachment.text("explanation", "explain", "mine", Duration.ofMinutes(2)));
        store.attach(OTHER_CHAT, "17", ReplyAttachment.text("explanation", "explain", "theirs",
                Duration.ofMinutes(2)));

        assertEquals("mine", store.lookup(CHAT, "17", "explain").orElseThrow().content());
        assertEquals("theirs", store.lookup(OTHER_CHAT, "17", "explain").orElseThrow().content());
        assertTrue(store.lookup(null, "17", "explain").isEmpty());
    }
}
