package com.p14n.pubsub.broker;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.pubsub.data.BrokerConfig;
import com.p14n.pubsub.data.Message;
import com.p14n.pubsub.data.ReceivedMessage;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives one broker from several threads at once and checks the delivery
 * guarantees still hold.
 */
@Timeout(value = 60, unit = TimeUnit.SECONDS)
class ConcurrentDeliveryTest {

    private static final String TOPIC = "projects/p/topics/stress";

    private DefaultExecutor executor;
    private MutableClock clock;
    private DefaultPubsubBroker broker;
    private final ConcurrentLinkedQueue<Throwable> failures = new ConcurrentLinkedQueue<>();

    @BeforeEach
    void setUp() {
        executor = new DefaultExecutor(1);
        clock = new MutableClock();
        broker = new DefaultPubsubBroker(new BrokerConfig(16, Duration.ofMillis(100), Duration.ofMillis(100), 10),
                executor, null, OpenTelemetry.noop(), clock);
        broker.createTopic(TOPIC);
    }

    @AfterEach
    void tearDown() throws Exception {
        broker.close();
        executor.close();
    }

    private static Message message(int n) {
        return Message.create(Integer.toString(n).getBytes(StandardCharsets.UTF_8), Map.of());
    }

    private Thread worker(String name, CountDownLatch start, Runnable body) {
        var thread = new Thread(() -> {
            try {
                start.await();
                body.run();
            } catch (Throwable t) {
                failures.add(t);
            }
        }, name);
        thread.start();
        return thread;
    }

    private List<ReceivedMessage> drain(String subscription) {
        var all = new ArrayList<ReceivedMessage>();
        List<ReceivedMessage> batch;
        while (!(batch = broker.pull(subscription, 100, true, PullCancellation.none())).isEmpty()) {
            var ackIds = new ArrayList<String>();
            for (var received : batch) {
                ackIds.add(received.ackId());
            }
            assertEquals(batch.size(), broker.acknowledge(subscription, ackIds));
            all.addAll(batch);
        }
        return all;
    }

    @Test
    void subscriptionsCreatedDuringPublishingSeeExactlyTheLaterMessages() throws Exception {
        int publishers = 4;
        int batchesEach = 250;
        int total = publishers * batchesEach * 2;
        var start = new CountDownLatch(1);

        var threads = new ArrayList<Thread>();
        for (int p = 0; p < publishers; p++) {
            threads.add(worker("publisher-" + p, start, () -> {
                for (int b = 0; b < batchesEach; b++) {
                    broker.publish(TOPIC, List.of(message(b), message(b)));
                }
            }));
        }

        var subscriptions = new ArrayList<String>();
        start.countDown();
        for (int s = 0; s < 10; s++) {
            var name = "projects/p/subscriptions/s" + s;
            broker.createSubscription(name, TOPIC, null, 600);
            subscriptions.add(name);
            Thread.sleep(2);
        }
        for (var thread : threads) {
            thread.join();
        }
        assertTrue(failures.isEmpty(), () -> "worker failed: " + failures);

        for (var subscription : subscriptions) {
            var ids = new ArrayList<Long>();
            for (var received : drain(subscription)) {
                assertEquals(0, received.deliveryAttempt());
                ids.add(Long.parseLong(received.message().id()));
            }
            var distinct = new HashSet<>(ids);
            assertEquals(ids.size(), distinct.size(), subscription + " got a message twice");
            if (distinct.isEmpty()) {
                continue;
            }
            long first = total - distinct.size() + 1;
            for (long id = first; id <= total; id++) {
                assertTrue(distinct.contains(id), subscription + " missed message " + id);
            }
            assertEquals(0, (first - 1) % 2, subscription + " saw half of a publish batch");
        }
    }

    @Test
    void concurrentPullAckAndSweepKeepEachMessageInOnePlace() throws Exception {
        var subscription = "projects/p/subscriptions/workers";
        broker.createSubscription(subscription, TOPIC, null, 1);
        var state = broker.subscriptionState(subscription);
        int total = 600;

        var published = ConcurrentHashMap.<String>newKeySet();
        var acknowledged = ConcurrentHashMap.<String>newKeySet();
        var done = new AtomicBoolean(false);
        var start = new CountDownLatch(1);
        var threads = new ArrayList<Thread>();

        threads.add(worker("publisher", start, () -> {
            for (int n = 0; n < total; n += 5) {
                var batch = new ArrayList<Message>();
                for (int i = 0; i < 5; i++) {
                    batch.add(message(n + i));
                }
                published.addAll(broker.publish(TOPIC, batch));
            }
        }));
        for (int c = 0; c < 4; c++) {
            var random = new Random(c);
            threads.add(worker("consumer-" + c, start, () -> {
                while (!done.get()) {
                    for (var received : broker.pull(subscription, 1 + random.nextInt(10), true,
                            PullCancellation.none())) {
                        int choice = random.nextInt(10);
                        if (choice < 7) {
                            if (broker.acknowledge(subscription, List.of(received.ackId())) == 1) {
                                assertTrue(acknowledged.add(received.message().id()),
                                        "acknowledged twice: " + received.message().id());
                            }
                        } else if (choice < 8) {
                            broker.modifyAckDeadline(subscription, List.of(received.ackId()), 0);
                        }
                    }
                    if (acknowledged.size() == total) {
                        done.set(true);
                    }
                }
            }));
        }
        threads.add(worker("sweeper", start, () -> {
            while (!done.get()) {
                clock.advance(Duration.ofMillis(500));
                broker.sweepExpiredLeases();
                Thread.yield();
            }
        }));

        start.countDown();
        try {
            while (!done.get() && failures.isEmpty()) {
                assertDisjoint(state.holdings());
                Thread.sleep(1);
            }
        } finally {
            done.set(true);
            for (var thread : threads) {
                thread.join();
            }
        }

        assertTrue(failures.isEmpty(), () -> "worker failed: " + failures);
        assertEquals(published, acknowledged);
        var holdings = state.holdings();
        assertTrue(holdings.backlog().isEmpty());
        assertTrue(holdings.leased().isEmpty());
    }

    private static void assertDisjoint(SubscriptionState.Holdings holdings) {
        Set<String> backlog = new HashSet<>(holdings.backlog());
        assertEquals(holdings.backlog().size(), backlog.size(), "duplicate backlog entry");
        for (var leased : holdings.leased()) {
            assertFalse(backlog.contains(leased), "in backlog and leased: " + leased);
        }
        assertEquals(holdings.leased().size(), new HashSet<>(holdings.leased()).size(), "message leased twice");
    }
}
