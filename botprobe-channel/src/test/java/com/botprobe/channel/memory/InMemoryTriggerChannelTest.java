package com.botprobe.channel.memory;

import com.botprobe.channel.ChannelUnavailableException;
import com.botprobe.channel.RawMessage;
import com.botprobe.common.infra.ManualTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTriggerChannelTest {

    private ManualTicker ticker;
    private InMemoryTriggerChannel channel;

    @BeforeEach
    void setUp() {
        ticker = new ManualTicker(10_000);
        channel = new InMemoryTriggerChannel("owner/repo#7", "tester", ticker);
    }

    @Nested
    class PostAndList {
        @Test
        void post_assignsIncreasingIds() {
            long first = channel.post("one");
            long second = channel.post("two");
            assertEquals(1, first);
            assertEquals(2, second);
            assertEquals(channel.getPosterIdentity(), channel.snapshot().get(0).author());
        }

        @Test
        void listSince_isStrictlyAfterWatermark() {
            long trigger = channel.post("ping");
            long reply = channel.append("bot", "pong");
            List<RawMessage> listed = channel.listSince(trigger);
            assertEquals(1, listed.size());
            assertEquals(reply, listed.get(0).id());
        }

        @Test
        void listSince_ascendingOrder() {
            channel.append("a", "1");
            channel.append("b", "2");
            channel.append("c", "3");
            List<RawMessage> listed = channel.listSince(0);
            assertEquals(List.of(1L, 2L, 3L), listed.stream().map(RawMessage::id).toList());
        }

        @Test
        void defaultConstructor_postsAsProbe() {
            var plain = new InMemoryTriggerChannel("owner/repo#8");
            assertEquals("probe", plain.getPosterIdentity());
            assertEquals("probe", plain.listSince(plain.post("hi") - 1).get(0).author());
        }

        @Test
        void createdAt_followsTicker() {
            channel.post("ping");
            assertEquals(10_000, channel.snapshot().get(0).createdAt().toEpochMilli());
        }
    }

    @Nested
    class Delete {
        @Test
        void delete_existingReturnsTrue() {
            long id = channel.post("ping");
            assertTrue(channel.delete(id));
            assertFalse(channel.contains(id));
        }

        @Test
        void delete_missingReturnsFalse() {
            assertFalse(channel.delete(99));
            assertEquals(List.of(99L), channel.getDeleteRequests());
        }
    }

    @Nested
    class Scripting {
        @Test
        void responder_repliesAfterPost() {
            channel.addResponder((trigger, ch) -> ch.append("bot", "ack " + trigger.body()));
            long id = channel.post("run tests");
            List<RawMessage> listed = channel.listSince(id);
            assertEquals(1, listed.size());
            assertEquals("ack run tests", listed.get(0).body());
            assertTrue(listed.get(0).isAuthoredBy("bot"));
        }

        @Test
        void scheduledMessage_hiddenUntilDue() {
            long id = channel.post("ping");
            channel.scheduleMessage("bot", "late pong", 3_000);
            assertTrue(channel.listSince(id).isEmpty());

            ticker.advance(2_999);
            assertTrue(channel.listSince(id).isEmpty());

            ticker.advance(1);
            List<RawMessage> listed = channel.listSince(id);
            assertEquals(1, listed.size());
            assertEquals(id + 1, listed.get(0).id());
            assertEquals(13_000, listed.get(0).createdAt().toEpochMilli());
        }

        @Test
        void scheduledMessage_getsIdOnArrival() {
            channel.scheduleMessage("bot", "late", 1_000);
            long early = channel.append("other", "early");
            ticker.advance(1_000);
            List<RawMessage> listed = channel.listSince(early);
            assertEquals(early + 1, listed.get(0).id());
        }
    }

    @Nested
    class Faults {
        @Test
        void failNextPosts_thenRecovers() {
            channel.failNextPosts(2);
            assertThrows(ChannelUnavailableException.class, () -> channel.post("a"));
            var err = assertThrows(ChannelUnavailableException.class, () -> channel.post("b"));
            assertEquals("owner/repo#7", err.getChannelId());
            assertEquals(1, channel.post("c"));
            assertEquals(3, channel.getPostCalls());
        }

        @Test
        void failNextLists() {
            channel.failNextLists(1);
            assertThrows(ChannelUnavailableException.class, () -> channel.listSince(0));
            assertTrue(channel.listSince(0).isEmpty());
            assertEquals(2, channel.getListCalls());
        }

        @Test
        void failNextDeletes_keepsMessage() {
            long id = channel.post("ping");
            channel.failNextDeletes(1);
            assertThrows(ChannelUnavailableException.class, () -> channel.delete(id));
            assertTrue(channel.contains(id));
        }

        @Test
        void failedPost_doesNotNotifyResponders() {
            channel.addResponder((trigger, ch) -> fail("responder must not run"));
            channel.failNextPosts(1);
            assertThrows(ChannelUnavailableException.class, () -> channel.post("a"));
        }
    }

    @Test
    void rawMessage_nullBodyBecomesEmpty() {
        var msg = new RawMessage(1, "bot", null, java.time.Instant.EPOCH);
        assertEquals("", msg.body());
    }
}
