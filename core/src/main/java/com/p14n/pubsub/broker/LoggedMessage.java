package com.p14n.pubsub.broker;

import java.util.concurrent.atomic.AtomicInteger;

import com.p14n.pubsub.data.Message;

/**
 * A message in a {@link MessageLog}, counting the subscriptions that still
 * hold a reference to it.
 */
public final class LoggedMessage {

    private final MessageLog log;
    private final long sequence;
    private final Message message;
    private final AtomicInteger holders;

    LoggedMessage(MessageLog log, long sequence, Message message, int holders) {
        this.log = log;
        this.sequence = sequence;
        this.message = message;
        this.holders = new AtomicInteger(holders);
    }

    public Message message() {
        return message;
    }

    long sequence() {
        return sequence;
    }

    public int holders() {
        return holders.get();
    }

    /**
     * Called once by each holding subscription when it acknowledges the
     * message or is deleted.
     */
    void release() {
        if (holders.decrementAndGet() == 0) {
            log.remove(this);
        }
    }
}
