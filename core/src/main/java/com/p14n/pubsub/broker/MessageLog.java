package com.p14n.pubsub.broker;

import java.time.Instant;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

import com.p14n.pubsub.data.Message;

/**
 * Append-only log of the messages published to one topic.
 *
 * <p>
 * Message ids are the decimal rendering of a per-log sequence, so they are
 * unique within the topic and increase in publish order. A logged message
 * stays in the log while any subscription still holds it in its backlog or
 * lease table; the last holder to let go removes it.
 * </p>
 */
public class MessageLog {

    private final String topic;
    private final AtomicLong sequence = new AtomicLong();
    private final ConcurrentSkipListMap<Long, LoggedMessage> retained = new ConcurrentSkipListMap<>();

    public MessageLog(String topic) {
        this.topic = topic;
    }

    /**
     * Appends a message to the log.
     *
     * @param unpublished The message as supplied by the publisher
     * @param holders     The number of subscriptions the message is fanned out to
     * @param now         The publish time
     * @return The logged message
     */
    public LoggedMessage append(Message unpublished, int holders, Instant now) {
        long seq = sequence.incrementAndGet();
        var message = unpublished.published(Long.toString(seq), topic, now);
        var logged = new LoggedMessage(this, seq, message, holders);
        if (holders > 0) {
            retained.put(seq, logged);
        }
        return logged;
    }

    /**
     * @return The number of messages still held by at least one subscription
     */
    public int size() {
        return retained.size();
    }

    /**
     * @return The number of messages ever appended
     */
    public long published() {
        return sequence.get();
    }

    void remove(LoggedMessage message) {
        retained.remove(message.sequence(), message);
    }

    public String topic() {
        return topic;
    }
}
