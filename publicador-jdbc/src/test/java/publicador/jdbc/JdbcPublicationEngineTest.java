package publicador.jdbc;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import publicador.PublicationEngine;
import publicador.PublishOptions;
import publicador.PublishResult;
import publicador.gateway.GatewayException;
import publicador.gateway.PostRequest;
import publicador.gateway.PostingGateway;
import publicador.gateway.PreviewResult;
import publicador.gateway.PublishReceipt;
import publicador.model.Post;
import publicador.model.PostStatus;
import publicador.model.Publication;
import publicador.model.PublicationStatus;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the engine against H2 through {@link JdbcPublicationStore}.
 */
class JdbcPublicationEngineTest {

    private static final Instant PUBLISHED_AT = Instant.parse("2026-03-01T12:00:00Z");

    private H2Fixtures db;
    private JdbcPublicationStore store;
    private RecordingGateway gateway;
    private PublicationEngine engine;

    @BeforeEach
    void setUp() throws SQLException {
        db = new H2Fixtures();
        store = new JdbcPublicationStore();
        gateway = new RecordingGateway(Set.of("broken"));
        engine = PublicationEngine.builder()
                .connectionProvider(new DataSourceConnectionProvider(db.dataSource))
                .store(store)
                .gateway(gateway)
                .retryPolicy(failedCalls -> 1L)
                .retryAttempts(1)
                .requestTimeout(Duration.ofSeconds(5))
                .postProcessingTimeout(Duration.ofSeconds(10))
                .build();

        db.project("p1", null);
        db.channel("c1", "p1", "SITE", "blog", "{\"apiKey\":\"k1\"}", null, true);
        db.channel("c2", "p1", "SITE", "broken", "{\"apiKey\":\"k2\"}", null, true);
        db.channel("c3", "p1", "SITE", "off", "{\"apiKey\":\"k3\"}", null, false);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void publishesEveryPostAndReleasesLock() throws SQLException {
        db.publication("pub", "READY", "Hello", null);
        db.post("p1", "pub", "c1", "PENDING", 0);

        PublishResult result = engine.publish("pub");

        assertTrue(result.success());
        assertEquals(1, gateway.sent.size());
        assertEquals("k1", gateway.sent.get(0).apiKey());
        try (Connection conn = db.connection()) {
            Publication publication = store.findPublication(conn, "pub").orElseThrow();
            assertEquals(PublicationStatus.PUBLISHED, publication.status());
            assertNull(publication.processingStartedAt());
            Post post = store.findPost(conn, "p1").orElseThrow();
            assertEquals(PostStatus.PUBLISHED, post.status());
            assertEquals(PUBLISHED_AT, post.publishedAt());
        }
    }

    @Test
    void mixedOutcomesArePersistedAsPartial() throws SQLException {
        db.publication("pub", "READY", "Hello", null);
        db.post("p1", "pub", "c1", "PENDING", 0);
        db.post("p2", "pub", "c2", "PENDING", 1);
        db.post("p3", "pub", "c3", "PENDING", 2);

        PublishResult result = engine.publish("pub");

        assertEquals(PublicationStatus.PARTIAL, result.status());
        assertEquals(1, result.publishedCount());
        assertEquals(2, result.failedCount());
        try (Connection conn = db.connection()) {
            assertEquals(PublicationStatus.PARTIAL, store.findPublication(conn, "pub").orElseThrow().status());
            Post broken = store.findPost(conn, "p2").orElseThrow();
            assertEquals(PostStatus.FAILED, broken.status());
            assertEquals("Upstream unavailable", broken.errorMessage());
            assertEquals("Channel is not active", store.findPost(conn, "p3").orElseThrow().errorMessage());
        }
        // one call plus one retry for the broken channel
        assertEquals(2, gateway.sent.stream().filter(r -> r.channelIdentifier().equals("broken")).count());
    }

    @Test
    void lockedPublicationIsLeftAlone() throws SQLException {
        db.publication("pub", "PROCESSING", "Hello", null);
        db.post("p1", "pub", "c1", "PENDING", 0);

        PublishResult result = engine.publish("pub");

        assertEquals(false, result.acquired());
        assertTrue(gateway.sent.isEmpty());
        try (Connection conn = db.connection()) {
            assertEquals(PostStatus.PENDING, store.findPost(conn, "p1").orElseThrow().status());
        }
    }

    @Test
    void republishSkipsAlreadyPublishedUnlessForced() throws SQLException {
        db.publication("pub", "PARTIAL", "Hello", null);
        db.post("p1", "pub", "c1", "PUBLISHED", 0);

        assertEquals(PublicationStatus.PUBLISHED, engine.publish("pub").status());
        assertTrue(gateway.sent.isEmpty());

        engine.publish("pub", PublishOptions.forced());
        assertEquals(1, gateway.sent.size());
    }

    private static final class RecordingGateway implements PostingGateway {
        final List<PostRequest> sent = new CopyOnWriteArrayList<>();
        private final Set<String> failing;

        RecordingGateway(Set<String> failing) {
            this.failing = failing;
        }

        @Override
        public PublishReceipt send(PostRequest request, long timeoutMs) throws GatewayException {
            sent.add(request);
            if (failing.contains(request.channelIdentifier())) {
                throw new GatewayException(GatewayException.Kind.RETRYABLE, 503, "Upstream unavailable");
            }
            return new PublishReceipt("https://example.test/" + request.channelIdentifier(), PUBLISHED_AT);
        }

        @Override
        public PreviewResult preview(PostRequest request, long timeoutMs) {
            return new PreviewResult(true, null);
        }
    }
}
