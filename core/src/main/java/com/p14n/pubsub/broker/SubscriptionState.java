package com.p14n.pubsub.broker;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.p14n.pubsub.PubsubException;
import com.p14n.pubsub.data.PushConfig;
import com.p14n.pubsub.data.ReceivedMessage;
import com.p14n.pubsub.data.SubscriptionInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backlog and lease table of one subscription.
 *
 * <p>
 * Every mutation of the backlog or the lease table (enqueue, lease, ack,
 * expire, deadline change, discard) happens under this subscription's lock,
 * so a message is either in the backlog or in exactly one lease, never both.
 * Waiting pulls park on a condition of the same lock, which releases it while
 * they wait.
 * </p>
 */
public class SubscriptionState {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionState.class);

    public static final String DELETED_TOPIC = "_deleted-topic_";

    private final String name;
    private final int ackDeadlineSeconds;
    private final Clock clock;
    private final Semaphore pullPermits;
    private volatile String topic;
    private volatile PushConfig pushConfig;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition arrivals = lock.newCondition();
    private final Backlog backlog = new Backlog();
    private final LeaseTable leases = new LeaseTable();
    private boolean deleted;

    public SubscriptionState(String name, String topic, PushConfig pushConfig, int ackDeadlineSeconds,
            int maxConcurrentPulls, Clock clock) {
        this.name = name;
        this.topic = topic;
        this.pushConfig = pushConfig == null ? PushConfig.PULL : pushConfig;
        this.ackDeadlineSeconds = ackDeadlineSeconds;
        this.pullPermits = new Semaphore(maxConcurrentPulls);
        this.clock = clock;
    }

    public String name() {
        return name;
    }

    /**
     * The bound topic, or {@link #DELETED_TOPIC} once that topic is deleted.
     */
    public String topic() {
        return topic;
    }

    public int ackDeadlineSeconds() {
        return ackDeadlineSeconds;
    }

    /**
     * The current push configuration; {@link PushConfig#isPull()} when the
     * subscription is pulled.
     */
    public PushConfig pushConfig() {
        return pushConfig;
    }

    public SubscriptionInfo info() {
        return new SubscriptionInfo(name, topic, pushConfig, ackDeadlineSeconds);
    }

    void pushConfig(PushConfig pushConfig) {
        this.pushConfig = pushConfig;
    }

    void detachFromTopic() {
        this.topic = DELETED_TOPIC;
    }

    boolean tryAdmitPull() {
        return pullPermits.tryAcquire();
    }

    void releasePull() {
        pullPermits.release();
    }

    /**
     * Adds a newly published message to the end of the backlog and wakes any
     * waiting pulls. A message arriving after deletion is released instead.
     */
    void enqueue(LoggedMessage message) {
        lock.lock();
        try {
            if (deleted) {
                message.release();
                return;
            }
            backlog.add(BacklogEntry.firstDelivery(message));
            arrivals.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Leases up to {@code max} messages from the front of the backlog without
     * waiting.
     */
    public List<ReceivedMessage> lease(int max) {
        lock.lock();
        try {
            ensureLive();
            return leaseLocked(max);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Leases up to {@code max} messages, waiting for some to arrive when the
     * backlog is empty and {@code returnImmediately} is false.
     *
     * <p>
     * The wait ends when a message arrives, the cancellation fires, the
     * subscription is deleted, or {@code maxWait} elapses. Nothing is leased
     * once the cancellation has been observed; messages leased before that are
     * returned even if the caller cancels concurrently.
     * </p>
     *
     * @return The leased messages, possibly empty
     * @throws PubsubException CANCELLED when cancelled before anything was
     *                         leased, NOT_FOUND when the subscription
     *                         is deleted
     */
    public List<ReceivedMessage> awaitLease(int max, boolean returnImmediately, Duration maxWait,
            PullCancellation cancellation) {
        long remaining = maxWait.toNanos();
        lock.lock();
        try {
            while (true) {
                ensureLive();
                if (cancellation.isCancelled()) {
                    throw new PubsubException(PubsubException.ErrorCode.CANCELLED,
                            "Pull cancelled on subscription: " + name);
                }
                var leased = leaseLocked(max);
                if (!leased.isEmpty() || returnImmediately) {
                    return leased;
                }
                if (remaining <= 0L) {
                    return leased;
                }
                remaining = arrivals.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PubsubException(PubsubException.ErrorCode.CANCELLED,
                    "Pull interrupted on subscription: " + name, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the leases matching the given ack ids. Unknown ids are ignored.
     *
     * @return The number of leases removed
     */
    public int acknowledge(Collection<String> ackIds) {
        int acked = 0;
        lock.lock();
        try {
            for (var ackId : ackIds) {
                var lease = leases.remove(ackId);
                if (lease != null) {
                    lease.entry().message().release();
                    acked++;
                }
            }
        } finally {
            lock.unlock();
        }
        return acked;
    }

    /**
     * Sets the expiry of the leases matching the given ack ids to now plus
     * {@code seconds}. Unknown ids are ignored.
     *
     * @return The number of leases changed
     */
    public int modifyAckDeadline(Collection<String> ackIds, int seconds) {
        if (seconds < 0) {
            throw PubsubException.invalidArgument("ack deadline must not be negative: " + seconds);
        }
        int modified = 0;
        lock.lock();
        try {
            var expiry = clock.instant().plusSeconds(seconds);
            for (var ackId : ackIds) {
                if (leases.extend(ackId, expiry)) {
                    modified++;
                }
            }
        } finally {
            lock.unlock();
        }
        return modified;
    }

    /**
     * Moves every lease whose deadline has passed back to the end of the
     * backlog, keeping its delivery count.
     *
     * @return The number of leases requeued
     */
    public int expire() {
        lock.lock();
        try {
            if (deleted) {
                return 0;
            }
            var expired = leases.removeExpired(clock.instant());
            for (var lease : expired) {
                backlog.add(lease.entry());
            }
            if (!expired.isEmpty()) {
                logger.atDebug()
                        .addArgument(expired.size())
                        .addArgument(name)
                        .log("Requeued {} expired leases on {}");
                arrivals.signalAll();
            }
            return expired.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the backlog and all leases in one step and ends any waits.
     */
    void discard() {
        lock.lock();
        try {
            if (deleted) {
                return;
            }
            deleted = true;
            for (var entry : backlog.clear()) {
                entry.message().release();
            }
            for (var lease : leases.clear()) {
                lease.entry().message().release();
            }
            arrivals.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes every waiter so it re-checks its cancellation and the backlog.
     */
    public void wakeWaiters() {
        lock.lock();
        try {
            arrivals.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The number of messages waiting to be leased
     */
    public int backlogSize() {
        lock.lock();
        try {
            return backlog.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The number of leases neither acknowledged nor expired
     */
    public int outstandingLeases() {
        lock.lock();
        try {
            return leases.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes a consistent view of the message ids held by this subscription.
     */
    public Holdings holdings() {
        lock.lock();
        try {
            var queued = new ArrayList<String>();
            for (var entry : backlog.snapshot()) {
                queued.add(entry.message().message().id());
            }
            var leased = new ArrayList<String>();
            for (var lease : leases.snapshot()) {
                leased.add(lease.entry().message().message().id());
            }
            return new Holdings(queued, leased);
        } finally {
            lock.unlock();
        }
    }

    public boolean isDeleted() {
        lock.lock();
        try {
            return deleted;
        } finally {
            lock.unlock();
        }
    }

    private List<ReceivedMessage> leaseLocked(int max) {
        var entries = backlog.take(max);
        if (entries.isEmpty()) {
            return List.of();
        }
        var expiry = clock.instant().plusSeconds(ackDeadlineSeconds);
        var received = new ArrayList<ReceivedMessage>(entries.size());
        for (var entry : entries) {
            var ackId = UUID.randomUUID().toString();
            leases.put(new Lease(ackId, name, entry.nextAttempt(), expiry));
            received.add(new ReceivedMessage(ackId, entry.message().message(), entry.deliveryAttempt()));
        }
        return received;
    }

    private void ensureLive() {
        if (deleted) {
            throw PubsubException.notFound("Subscription", name);
        }
    }

    /**
     * Message ids in the backlog and in the lease table at one instant.
     */
    public record Holdings(List<String> backlog, List<String> leased) {
    }
}
