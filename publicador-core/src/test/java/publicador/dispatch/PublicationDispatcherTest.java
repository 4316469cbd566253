package publicador.dispatch;

import org.junit.jupiter.api.Test;
import publicador.gateway.GatewayException;
import publicador.model.Post;
import publicador.shutdown.ShutdownCoordinator;
import publicador.spi.MetricsExporter;
import publicador.model.PublicationStatus;
import publicador.testing.InMemoryPublicationStore;
import publicador.testing.ScriptedGateway;
import publicador.testing.StubConnections;
import publicador.testing.TestData;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PublicationDispatcherTest {

    @Test
    void builderRejectsNullStore() {
        assertThrows(NullPointerException.class, () -> PublicationDispatcher.builder()
                .connectionProvider(new StubConnections())
                .gateway(new ScriptedGateway())
                .build());
    }

    @Test
    void builderRejectsNegativeRetryAttempts() {
        assertThrows(IllegalArgumentException.class, () -> PublicationDispatcher.builder()
                .connectionProvider(new StubConnections())
                .store(new InMemoryPublicationStore())
                .gateway(new ScriptedGateway())
                .retryAttempts(-1)
                .build());
    }

    @Test
    void builderRejectsZeroPostTimeout() {
        assertThrows(IllegalArgumentException.class, () -> PublicationDispatcher.builder()
                .connectionProvider(new StubConnections())
                .store(new InMemoryPublicationStore())
                .gateway(new ScriptedGateway())
                .postProcessingTimeout(Duration.ZERO)
                .build());
    }

    @Test
    void busySenderThreadsFailLaterPostsWithoutQueueing() {
        InMemoryPublicationStore store = new InMemoryPublicationStore();
        store.add(TestData.publication("pub", "text"));
        store.add(TestData.siteChannel("c1")).add(TestData.siteChannel("c2"));
        Post stuck = TestData.post("p1", "pub", "c1", 0);
        Post next = TestData.post("p2", "pub", "c2", 1);
        store.add(stuck).add(next);
        CountDownLatch release = new CountDownLatch(1);
        ScriptedGateway gateway = new ScriptedGateway();
        gateway.script("c1", request -> {
            // ignores interrupts, like a client stuck in a blocking read
            while (release.getCount() > 0) {
                try {
                    release.await();
                } catch (InterruptedException ignored) {
                }
            }
            return ScriptedGateway.ok().respond(request);
        });

        try (PublicationDispatcher dispatcher = PublicationDispatcher.builder()
                .connectionProvider(new StubConnections())
                .store(store)
                .gateway(gateway)
                .senderThreads(1)
                .postProcessingTimeout(Duration.ofMillis(200))
                .build()) {
            List<DispatchOutcome> outcomes = dispatcher.dispatch(store.publication("pub"), List.of(stuck, next), false);

            assertEquals(FailureKind.TIMEOUT, outcomes.get(0).failureKind());
            assertEquals(FailureKind.INTERNAL, outcomes.get(1).failureKind());
            assertEquals(PublicationDispatcher.SENDERS_BUSY_MESSAGE, store.post("p2").errorMessage());
            assertEquals(0, gateway.sendsTo("c2"));
            release.countDown();
        } finally {
            release.countDown();
        }
    }

    @Test
    void builderRejectsZeroSenderThreads() {
        assertThrows(IllegalArgumentException.class, () -> PublicationDispatcher.builder()
                .connectionProvider(new StubConnections())
                .store(new InMemoryPublicationStore())
                .gateway(new ScriptedGateway())
                .senderThreads(0)
                .build());
    }

    @Test
    void timeoutFormatUsesSecondsWhenWhole() {
        assertEquals("1s", PublicationDispatcher.formatTimeout(1000));
        assertEquals("60s", PublicationDispatcher.formatTimeout(60_000));
        assertEquals("1500ms", PublicationDispatcher.formatTimeout(1500));
    }

    @Test
    void eachOutcomeIsPersistedBeforeTheNextPostStarts() {
        InMemoryPublicationStore store = new InMemoryPublicationStore();
        store.add(TestData.publication("pub", "text"));
        store.add(TestData.siteChannel("c1")).add(TestData.siteChannel("c2"));
        Post first = TestData.post("p1", "pub", "c1", 0);
        Post second = TestData.post("p2", "pub", "c2", 1);
        store.add(first).add(second);
        ScriptedGateway gateway = new ScriptedGateway();
        List<String> firstStatusSeenBySecond = new ArrayList<>();
        gateway.script("c2", request -> {
            firstStatusSeenBySecond.add(store.post("p1").status().name());
            return ScriptedGateway.ok().respond(request);
        });

        try (PublicationDispatcher dispatcher = PublicationDispatcher.builder()
                .connectionProvider(new StubConnections())
                .store(store)
                .gateway(gateway)
                .build()) {
            List<DispatchOutcome> seen = new ArrayList<>();
            List<DispatchOutcome> outcomes = dispatcher.dispatch(store.publication("pub"),
                    List.of(first, second), false, seen::add);

            assertEquals(outcomes, seen);
        }
        assertEquals(List.of("PUBLISHED"), firstStatusSeenBySecond);
    }

    @Test
    void retriesStopOnceShutdownBegins() {
        InMemoryPublicationStore store = new InMemoryPublicationStore();
        store.add(TestData.publication("pub", "text"));
        store.add(TestData.siteChannel("c1"));
        Post post = TestData.post("p1", "pub", "c1", 0);
        store.add(post);
        ShutdownCoordinator shutdown = new ShutdownCoordinator();
        ScriptedGateway gateway = new ScriptedGateway();
        gateway.script("c1", request -> {
            shutdown.beginShutdown("test");
            throw new GatewayException(GatewayException.Kind.RETRYABLE, 503, "unavailable");
        });

        try (PublicationDispatcher dispatcher = PublicationDispatcher.builder()
                .connectionProvider(new StubConnections())
                .store(store)
                .gateway(gateway)
                .shutdownCoordinator(shutdown)
                .retryPolicy(n -> 1L)
                .retryAttempts(5)
                .build()) {
            List<DispatchOutcome> outcomes = dispatcher.dispatch(store.publication("pub"), List.of(post), false);

            assertEquals(1, gateway.sendsTo("c1"));
            assertEquals(FailureKind.RETRIES_EXHAUSTED, outcomes.get(0).failureKind());
        }
    }

    @Test
    void metricsRecordRetriesAndFailures() {
        InMemoryPublicationStore store = new InMemoryPublicationStore();
        store.add(TestData.publication("pub", "text"));
        store.add(TestData.siteChannel("c1"));
        Post post = TestData.post("p1", "pub", "c1", 0);
        store.add(post);
        ScriptedGateway gateway = new ScriptedGateway()
                .script("c1", ScriptedGateway.fail(GatewayException.Kind.TIMEOUT, "read timed out"));
        AtomicInteger retries = new AtomicInteger();
        List<FailureKind> failures = new ArrayList<>();
        MetricsExporter metrics = new MetricsExporter() {
            @Override public void incrementLockContended() {}
            @Override public void incrementPostPublished() {}
            @Override public void incrementPostFailed(FailureKind kind) { failures.add(kind); }
            @Override public void incrementGatewayRetry() { retries.incrementAndGet(); }
            @Override public void incrementPublicationFinalized(PublicationStatus status) {}
        };

        try (PublicationDispatcher dispatcher = PublicationDispatcher.builder()
                .connectionProvider(new StubConnections())
                .store(store)
                .gateway(gateway)
                .retryPolicy(n -> 1L)
                .retryAttempts(2)
                .metrics(metrics)
                .build()) {
            dispatcher.dispatch(store.publication("pub"), List.of(post), false);
        }

        assertEquals(2, retries.get());
        assertEquals(List.of(FailureKind.RETRIES_EXHAUSTED), failures);
        assertTrue(store.post("p1").errorMessage().contains("read timed out"));
    }
}
