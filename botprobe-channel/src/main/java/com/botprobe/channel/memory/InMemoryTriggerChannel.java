package com.botprobe.channel.memory;

import com.botprobe.channel.ChannelUnavailableException;
import com.botprobe.channel.RawMessage;
import com.botprobe.channel.TriggerChannel;
import com.botprobe.common.infra.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe in-memory {@link TriggerChannel}.
 * <p>
 * Messages get monotonically increasing ids starting at 1. Replies can be
 * scripted with a {@link Responder} that runs after every post, and delayed
 * with {@link #scheduleMessage(String, String, long)}: a scheduled message
 * is assigned its id and becomes visible once the channel's {@link Ticker}
 * reaches its due time. Fault injection makes the next N posts, lists or
 * deletes fail with {@link ChannelUnavailableException}.
 */
@Slf4j
public class InMemoryTriggerChannel implements TriggerChannel {

    /**
     * Callback invoked after each successful post, outside the channel lock.
     */
    @FunctionalInterface
    public interface Responder {
        void onTrigger(RawMessage trigger, InMemoryTriggerChannel channel);
    }

    private record Pending(long dueAtMs, long sequence, String author, String body) {
    }

    private final String channelId;
    private final String posterIdentity;
    private final Ticker ticker;

    private final TreeMap<Long, RawMessage> messages = new TreeMap<>();
    private final List<Pending> pending = new ArrayList<>();
    private final List<Responder> responders = new CopyOnWriteArrayList<>();
    private final List<Long> deleteRequests = new CopyOnWriteArrayList<>();
    private long nextId = 1;
    private long pendingSequence = 0;

    private final AtomicInteger postCalls = new AtomicInteger();
    private final AtomicInteger listCalls = new AtomicInteger();
    private final AtomicInteger failPosts = new AtomicInteger();
    private final AtomicInteger failLists = new AtomicInteger();
    private final AtomicInteger failDeletes = new AtomicInteger();

    public InMemoryTriggerChannel(String channelId, String posterIdentity, Ticker ticker) {
        this.channelId = channelId;
        this.posterIdentity = posterIdentity;
        this.ticker = ticker != null ? ticker : Ticker.SYSTEM;
    }

    public InMemoryTriggerChannel(String channelId) {
        this(channelId, "probe", Ticker.SYSTEM);
    }

    // =========================================================================
    // TriggerChannel
    // =========================================================================

    @Override
    public String getChannelId() {
        return channelId;
    }

    @Override
    public long post(String body) {
        postCalls.incrementAndGet();
        if (consumeFault(failPosts)) {
            throw new ChannelUnavailableException(channelId, "post rejected: channel unavailable");
        }
        RawMessage trigger;
        synchronized (this) {
            flushDue();
            trigger = store(posterIdentity, body);
        }
        log.debug("[{}] posted #{} by {}", channelId, trigger.id(), posterIdentity);
        for (Responder responder : responders) {
            responder.onTrigger(trigger, this);
        }
        return trigger.id();
    }

    @Override
    public List<RawMessage> listSince(long watermark) {
        listCalls.incrementAndGet();
        if (consumeFault(failLists)) {
            throw new ChannelUnavailableException(channelId, "list failed: channel unavailable");
        }
        synchronized (this) {
            flushDue();
            return List.copyOf(messages.tailMap(watermark, false).values());
        }
    }

    @Override
    public boolean delete(long messageId) {
        deleteRequests.add(messageId);
        if (consumeFault(failDeletes)) {
            throw new ChannelUnavailableException(channelId, "delete failed: channel unavailable");
        }
        synchronized (this) {
            flushDue();
            return messages.remove(messageId) != null;
        }
    }

    // =========================================================================
    // Scripting
    // =========================================================================

    public void addResponder(Responder responder) {
        responders.add(responder);
    }

    /**
     * Append a message immediately, as another actor on the channel.
     *
     * @return the new message id
     */
    public synchronized long append(String author, String body) {
        flushDue();
        return store(author, body).id();
    }

    /**
     * Append a message that becomes visible {@code delayMs} after now, measured
     * on this channel's ticker. Its id is assigned when it becomes visible.
     */
    public synchronized void scheduleMessage(String author, String body, long delayMs) {
        pending.add(new Pending(ticker.nowMillis() + Math.max(0, delayMs), pendingSequence++, author, body));
    }

    public void failNextPosts(int count) {
        failPosts.set(Math.max(0, count));
    }

    public void failNextLists(int count) {
        failLists.set(Math.max(0, count));
    }

    public void failNextDeletes(int count) {
        failDeletes.set(Math.max(0, count));
    }

    // =========================================================================
    // Inspection
    // =========================================================================

    public synchronized List<RawMessage> snapshot() {
        flushDue();
        return List.copyOf(messages.values());
    }

    public synchronized boolean contains(long messageId) {
        flushDue();
        return messages.containsKey(messageId);
    }

    public int getPostCalls() {
        return postCalls.get();
    }

    public int getListCalls() {
        return listCalls.get();
    }

    /** Ids passed to {@link #delete(long)}, in call order, including failed calls. */
    public List<Long> getDeleteRequests() {
        return List.copyOf(deleteRequests);
    }

    public String getPosterIdentity() {
        return posterIdentity;
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private RawMessage store(String author, String body) {
        long id = nextId++;
        RawMessage message = new RawMessage(id, author, body, Instant.ofEpochMilli(ticker.nowMillis()));
        messages.put(id, message);
        return message;
    }

    private void flushDue() {
        if (pending.isEmpty()) {
            return;
        }
        long now = ticker.nowMillis();
        List<Pending> due = new ArrayList<>();
        for (Pending p : pending) {
            if (p.dueAtMs() <= now) {
                due.add(p);
            }
        }
        if (due.isEmpty()) {
            return;
        }
        pending.removeAll(due);
        due.sort(Comparator.comparingLong(Pending::dueAtMs).thenComparingLong(Pending::sequence));
        for (Pending p : due) {
            store(p.author(), p.body());
        }
    }

    private static boolean consumeFault(AtomicInteger counter) {
        return counter.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    @Override
    public synchronized String toString() {
        return "InMemoryTriggerChannel{" + channelId + ", messages=" + messages.size() + ", pending=" + pending.size() + "}";
    }
}
