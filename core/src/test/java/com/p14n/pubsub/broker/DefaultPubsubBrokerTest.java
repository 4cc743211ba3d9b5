package com.p14n.pubsub.broker;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.p14n.pubsub.PubsubException;
import com.p14n.pubsub.PubsubException.ErrorCode;
import com.p14n.pubsub.data.BrokerConfig;
import com.p14n.pubsub.data.Message;
import com.p14n.pubsub.data.PushConfig;
import com.p14n.pubsub.data.ReceivedMessage;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class DefaultPubsubBrokerTest {

    private static final String TOPIC = "projects/p/topics/orders";
    private static final String SUB = "projects/p/subscriptions/audit";

    private DefaultExecutor executor;
    private MutableClock clock;
    private volatile DefaultPubsubBroker broker;

    @BeforeEach
    void setUp() {
        executor = new DefaultExecutor(1);
        clock = new MutableClock();
        broker = new DefaultPubsubBroker(new BrokerConfig(1, Duration.ofMillis(300), Duration.ofMillis(100), 10),
                executor, null, OpenTelemetry.noop(), clock);
        broker.createTopic(TOPIC);
        broker.createSubscription(SUB, TOPIC, null, 60);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (broker != null) {
            broker.close();
            broker = null;
        }
        executor.close();
    }

    private static Message message(String body) {
        return Message.create(body.getBytes(StandardCharsets.UTF_8), Map.of("k", body));
    }

    private static String body(ReceivedMessage received) {
        return new String(received.message().data(), StandardCharsets.UTF_8);
    }

    private static List<String> ackIds(List<ReceivedMessage> received) {
        var ids = new ArrayList<String>();
        for (var r : received) {
            ids.add(r.ackId());
        }
        return ids;
    }

    private static void assertCode(ErrorCode code, Executable executable) {
        var e = assertThrows(PubsubException.class, executable);
        assertEquals(code, e.code());
    }

    private static ErrorCode codeOf(ExecutionException e) {
        return assertInstanceOf(PubsubException.class, e.getCause()).code();
    }

    @Test
    void publishedMessagesArePulledThenAcknowledged() {
        var ids = broker.publish(TOPIC, List.of(message("a"), message("b"), message("c")));
        assertEquals(List.of("1", "2", "3"), ids);

        var received = broker.pull(SUB, 3, true, PullCancellation.none());
        var bodies = new HashSet<String>();
        for (var r : received) {
            bodies.add(body(r));
        }
        assertEquals(Set.of("a", "b", "c"), bodies);

        assertEquals(3, broker.acknowledge(SUB, ackIds(received)));
        assertTrue(broker.pull(SUB, 3, true, PullCancellation.none()).isEmpty());
    }

    @Test
    void publishStampsIdentityAndKeepsAttributes() {
        broker.publish(TOPIC, List.of(message("a")));

        var m = broker.pull(SUB, 1, true, PullCancellation.none()).get(0).message();

        assertEquals("1", m.id());
        assertEquals(TOPIC, m.topic());
        assertEquals(clock.instant(), m.publishTime());
        assertEquals(Map.of("k", "a"), m.attributes());
    }

    @Test
    void publishAcceptsImmutableListsAndRejectsNullElements() {
        assertEquals(List.of("1"), broker.publish(TOPIC, List.of(message("a"))));
        assertEquals(List.of("2", "3"), broker.publish(TOPIC, List.of(message("b"), message("c"))));

        assertCode(ErrorCode.INVALID_ARGUMENT, () -> broker.publish(TOPIC, Arrays.asList(message("d"), null)));
        assertCode(ErrorCode.INVALID_ARGUMENT, () -> broker.publish(TOPIC, null));
        assertEquals(3, broker.subscriptionState(SUB).backlogSize());
    }

    @Test
    void publishedPayloadCannotBeChangedByPublisherOrConsumers() {
        var other = "projects/p/subscriptions/billing";
        broker.createSubscription(other, TOPIC, null, 0);
        var payload = "abc".getBytes(StandardCharsets.UTF_8);

        broker.publish(TOPIC, List.of(Message.create(payload, Map.of())));
        payload[0] = 'X';
        var first = broker.pull(SUB, 1, true, PullCancellation.none()).get(0);
        first.message().data()[1] = 'Y';

        assertEquals("abc", body(first));
        assertEquals("abc", body(broker.pull(other, 1, true, PullCancellation.none()).get(0)));
    }

    @Test
    void everyBoundSubscriptionGetsEveryMessage() {
        var other = "projects/p/subscriptions/billing";
        broker.createSubscription(other, TOPIC, null, 0);

        broker.publish(TOPIC, List.of(message("a"), message("b")));

        assertEquals(2, broker.subscriptionState(SUB).backlogSize());
        assertEquals(2, broker.subscriptionState(other).backlogSize());
    }

    @Test
    void subscriptionCreatedAfterPublishSeesNothingEarlier() {
        broker.publish(TOPIC, List.of(message("early")));
        var late = "projects/p/subscriptions/late";
        broker.createSubscription(late, TOPIC, null, 0);

        assertTrue(broker.pull(late, 10, true, PullCancellation.none()).isEmpty());

        broker.publish(TOPIC, List.of(message("later")));
        var received = broker.pull(late, 10, true, PullCancellation.none());
        assertEquals(1, received.size());
        assertEquals("later", body(received.get(0)));
    }

    @Test
    void blockingPullReturnsWhenMessageArrives() throws Exception {
        var slowConfig = new BrokerConfig(1, Duration.ofSeconds(5), Duration.ofMillis(100), 10);
        try (var waitingBroker = new DefaultPubsubBroker(slowConfig, executor, null, OpenTelemetry.noop(), clock)) {
            waitingBroker.createTopic(TOPIC);
            waitingBroker.createSubscription(SUB, TOPIC, null, 60);

            var pending = CompletableFuture.supplyAsync(
                    () -> waitingBroker.pull(SUB, 1, false, PullCancellation.none()));
            Thread.sleep(100);
            assertFalse(pending.isDone());

            waitingBroker.publish(TOPIC, List.of(message("x")));

            var received = pending.get(2, TimeUnit.SECONDS);
            assertEquals(1, received.size());
            assertEquals("x", body(received.get(0)));
        }
    }

    @Test
    void blockingPullReturnsEmptyAfterMaxWait() {
        var received = broker.pull(SUB, 1, false, PullCancellation.none());
        assertTrue(received.isEmpty());
    }

    @Test
    void pullsOverTheAdmissionCapAreRejected() throws Exception {
        var slowConfig = new BrokerConfig(1, Duration.ofSeconds(5), Duration.ofMillis(100), 10);
        try (var cappedBroker = new DefaultPubsubBroker(slowConfig, executor, null, OpenTelemetry.noop(), clock)) {
            cappedBroker.createTopic(TOPIC);
            cappedBroker.createSubscription(SUB, TOPIC, null, 60);

            var cancellation = new PullCancellation();
            var pending = CompletableFuture.supplyAsync(() -> cappedBroker.pull(SUB, 1, false, cancellation));
            Thread.sleep(100);

            assertCode(ErrorCode.UNAVAILABLE, () -> cappedBroker.pull(SUB, 1, true, PullCancellation.none()));

            cancellation.cancel();
            var e = assertThrows(ExecutionException.class, () -> pending.get(2, TimeUnit.SECONDS));
            assertEquals(ErrorCode.CANCELLED, codeOf(e));

            assertTrue(cappedBroker.pull(SUB, 1, true, PullCancellation.none()).isEmpty());
        }
    }

    @Test
    void deletingSubscriptionEndsWaitingPullWithNotFound() throws Exception {
        var slowConfig = new BrokerConfig(1, Duration.ofSeconds(5), Duration.ofMillis(100), 10);
        try (var waitingBroker = new DefaultPubsubBroker(slowConfig, executor, null, OpenTelemetry.noop(), clock)) {
            waitingBroker.createTopic(TOPIC);
            waitingBroker.createSubscription(SUB, TOPIC, null, 60);

            var pending = CompletableFuture.supplyAsync(
                    () -> waitingBroker.pull(SUB, 1, false, PullCancellation.none()));
            Thread.sleep(100);

            waitingBroker.deleteSubscription(SUB);

            var e = assertThrows(ExecutionException.class, () -> pending.get(2, TimeUnit.SECONDS));
            assertEquals(ErrorCode.NOT_FOUND, codeOf(e));
        }
    }

    @Test
    void unacknowledgedMessageIsRedeliveredAfterDeadline() {
        broker.publish(TOPIC, List.of(message("a")));
        var first = broker.pull(SUB, 1, true, PullCancellation.none()).get(0);
        assertEquals(0, first.deliveryAttempt());

        clock.advance(Duration.ofSeconds(59));
        assertEquals(0, broker.sweepExpiredLeases());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, broker.sweepExpiredLeases());

        var second = broker.pull(SUB, 1, true, PullCancellation.none()).get(0);
        assertEquals(first.message().id(), second.message().id());
        assertNotEquals(first.ackId(), second.ackId());
        assertEquals(1, second.deliveryAttempt());
    }

    @Test
    void staleAckIdNeverAcknowledgesTheRedelivery() {
        broker.publish(TOPIC, List.of(message("a")));
        var first = broker.pull(SUB, 1, true, PullCancellation.none()).get(0);
        clock.advance(Duration.ofSeconds(60));
        broker.sweepExpiredLeases();
        var second = broker.pull(SUB, 1, true, PullCancellation.none()).get(0);

        assertEquals(0, broker.acknowledge(SUB, List.of(first.ackId())));
        assertEquals(1, broker.subscriptionState(SUB).outstandingLeases());
        assertEquals(1, broker.acknowledge(SUB, List.of(second.ackId())));
        assertEquals(0, broker.acknowledge(SUB, List.of(second.ackId())));
    }

    @Test
    void zeroAckDeadlineMakesMessageEligibleOnNextSweep() {
        broker.publish(TOPIC, List.of(message("a")));
        var first = broker.pull(SUB, 1, true, PullCancellation.none()).get(0);

        assertEquals(1, broker.modifyAckDeadline(SUB, List.of(first.ackId()), 0));
        broker.sweepExpiredLeases();

        var again = broker.pull(SUB, 1, true, PullCancellation.none()).get(0);
        assertEquals(first.message().id(), again.message().id());
        assertNotEquals(first.ackId(), again.ackId());
        assertEquals(1, again.deliveryAttempt());
    }

    @Test
    void scheduledSweeperRedeliversExpiredLeases() throws Exception {
        broker.start();
        broker.publish(TOPIC, List.of(message("a")));
        broker.pull(SUB, 1, true, PullCancellation.none());
        clock.advance(Duration.ofSeconds(61));

        List<ReceivedMessage> again = List.of();
        for (int i = 0; i < 50 && again.isEmpty(); i++) {
            Thread.sleep(50);
            again = broker.pull(SUB, 1, true, PullCancellation.none());
        }
        assertEquals(1, again.size());
    }

    @Test
    void deletingTopicDetachesItsSubscriptions() {
        broker.publish(TOPIC, List.of(message("a")));

        broker.deleteTopic(TOPIC);

        assertEquals(SubscriptionState.DELETED_TOPIC, broker.getSubscription(SUB).topic());
        assertCode(ErrorCode.NOT_FOUND, () -> broker.publish(TOPIC, List.of(message("b"))));
        var received = broker.pull(SUB, 1, true, PullCancellation.none());
        assertEquals(1, received.size());
        assertEquals(1, broker.acknowledge(SUB, ackIds(received)));

        broker.createTopic(TOPIC);
        assertTrue(broker.listTopicSubscriptions(TOPIC, 0, "").items().isEmpty());
    }

    @Test
    void recreatedSubscriptionStartsEmpty() {
        broker.publish(TOPIC, List.of(message("a")));
        broker.deleteSubscription(SUB);
        broker.createSubscription(SUB, TOPIC, null, 0);

        assertTrue(broker.pull(SUB, 10, true, PullCancellation.none()).isEmpty());
        assertEquals(60, broker.getSubscription(SUB).ackDeadlineSeconds());
    }

    @Test
    void emptySubscriptionNameIsGenerated() {
        var info = broker.createSubscription("", TOPIC, null, 0);

        assertTrue(info.name().startsWith("projects/p/subscriptions/sub-"));
        assertTrue(broker.listTopicSubscriptions(TOPIC, 0, "").items().contains(info.name()));
    }

    @Test
    void pushConfigGetsDefaultVersionAndKeepsItOnModify() {
        var push = "projects/p/subscriptions/push";
        var info = broker.createSubscription(push, TOPIC, new PushConfig("http://localhost:1/push", Map.of()), 0);
        assertEquals("v1", info.pushConfig().attributes().get(PushConfig.VERSION_ATTRIBUTE));

        broker.modifyPushConfig(push, new PushConfig("http://localhost:1/push",
                Map.of(PushConfig.VERSION_ATTRIBUTE, "v1beta1")));
        broker.modifyPushConfig(push, new PushConfig("http://localhost:2/push", Map.of()));

        var modified = broker.getSubscription(push).pushConfig();
        assertEquals("http://localhost:2/push", modified.endpoint());
        assertEquals("v1beta1", modified.version());

        broker.modifyPushConfig(push, null);
        assertTrue(broker.getSubscription(push).pushConfig().isPull());
    }

    @Test
    void listingPagesThroughTopicsInNameOrder() {
        for (int i = 0; i < 5; i++) {
            broker.createTopic("projects/p/topics/t" + i);
        }
        broker.createTopic("projects/other/topics/x");

        var first = broker.listTopics("projects/p", 4, "");
        assertEquals(4, first.items().size());
        assertEquals("projects/p/topics/orders", first.items().get(0).name());
        assertTrue(first.hasNextPage());

        var second = broker.listTopics("projects/p", 4, first.nextPageToken());
        assertEquals(2, second.items().size());
        assertEquals("projects/p/topics/t4", second.items().get(1).name());
        assertFalse(second.hasNextPage());

        assertEquals(7, broker.listTopics("", 0, "").items().size());
        assertEquals(1, broker.listSubscriptions("projects/p", 0, "").items().size());
    }

    @Test
    void invalidRequestsAreRejected() {
        assertCode(ErrorCode.ALREADY_EXISTS, () -> broker.createTopic(TOPIC));
        assertCode(ErrorCode.INVALID_ARGUMENT, () -> broker.createTopic(""));
        assertCode(ErrorCode.ALREADY_EXISTS, () -> broker.createSubscription(SUB, TOPIC, null, 0));
        assertCode(ErrorCode.NOT_FOUND, () -> broker.createSubscription("s2", "projects/p/topics/none", null, 0));
        assertCode(ErrorCode.INVALID_ARGUMENT, () -> broker.createSubscription("s2", TOPIC, null, -1));
        assertCode(ErrorCode.INVALID_ARGUMENT, () -> broker.publish(TOPIC, List.of()));
        assertCode(ErrorCode.NOT_FOUND, () -> broker.publish("projects/p/topics/none", List.of(message("a"))));
        assertCode(ErrorCode.INVALID_ARGUMENT, () -> broker.pull(SUB, 0, true, PullCancellation.none()));
        assertCode(ErrorCode.NOT_FOUND, () -> broker.pull("nope", 1, true, PullCancellation.none()));
        assertCode(ErrorCode.INVALID_ARGUMENT, () -> broker.acknowledge(SUB, List.of()));
        assertCode(ErrorCode.NOT_FOUND, () -> broker.acknowledge("nope", List.of("x")));
        assertCode(ErrorCode.INVALID_ARGUMENT, () -> broker.modifyAckDeadline(SUB, List.of("x"), -5));
        assertCode(ErrorCode.NOT_FOUND, () -> broker.deleteSubscription("nope"));
        assertCode(ErrorCode.NOT_FOUND, () -> broker.deleteTopic("nope"));
        assertCode(ErrorCode.NOT_FOUND, () -> broker.getTopic("nope"));
        assertCode(ErrorCode.NOT_FOUND, () -> broker.modifyPushConfig("nope", null));
        assertCode(ErrorCode.INVALID_ARGUMENT, () -> broker.listTopics("", 10, "!!not-a-token!!"));
    }

    @Test
    void unknownAckIdsAreIgnored() {
        assertEquals(0, broker.acknowledge(SUB, List.of("never-issued")));
        assertEquals(0, broker.modifyAckDeadline(SUB, List.of("never-issued"), 30));
    }

    @Test
    void closedBrokerRefusesWork() {
        broker.close();

        assertThrows(IllegalStateException.class, () -> broker.publish(TOPIC, List.of(message("a"))));
    }
}
