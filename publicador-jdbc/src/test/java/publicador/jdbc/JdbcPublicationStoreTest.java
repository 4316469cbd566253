package publicador.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import publicador.PublicationStoreException;
import publicador.model.Channel;
import publicador.model.MediaType;
import publicador.model.Post;
import publicador.model.PostStatus;
import publicador.model.Publication;
import publicador.model.PublicationStatus;
import publicador.model.SocialMedia;
import publicador.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcPublicationStoreTest {

    private H2Fixtures db;
    private JdbcPublicationStore store;

    @BeforeEach
    void setUp() {
        db = new H2Fixtures();
        store = new JdbcPublicationStore();
    }

    @Test
    void findPublicationLoadsMediaInOrder() throws SQLException {
        db.publication("pub", "READY", "Hello", null);
        db.media("pub", "m2", "VIDEO", "b.mp4", 1);
        db.media("pub", "m1", "IMAGE", "a.png", 0);

        try (Connection conn = db.connection()) {
            Publication publication = store.findPublication(conn, "pub").orElseThrow();

            assertEquals(PublicationStatus.READY, publication.status());
            assertEquals("Hello", publication.content());
            assertEquals("u1", publication.createdBy());
            assertEquals(List.of("m1", "m2"), publication.media().stream().map(m -> m.mediaId()).toList());
            assertEquals(MediaType.IMAGE, publication.media().get(0).type());
        }
    }

    @Test
    void unknownRowsAreEmpty() throws SQLException {
        try (Connection conn = db.connection()) {
            assertTrue(store.findPublication(conn, "x").isEmpty());
            assertTrue(store.findPost(conn, "x").isEmpty());
            assertTrue(store.findChannel(conn, "x").isEmpty());
        }
    }

    @Test
    void postsComeBackInCreationOrder() throws SQLException {
        db.publication("pub", "READY", "Hello", null);
        db.post("p-b", "pub", "c1", "PENDING", 2);
        db.post("p-a", "pub", "c1", "PENDING", 1);
        db.post("p-c", "pub", "c1", "PENDING", 2);

        try (Connection conn = db.connection()) {
            List<Post> posts = store.findPosts(conn, "pub");

            assertEquals(List.of("p-a", "p-b", "p-c"), posts.stream().map(Post::id).toList());
        }
    }

    @Test
    void channelDecodesCredentialsAndProjectArchive() throws SQLException {
        db.project("p1", Instant.parse("2026-01-01T00:00:00Z"));
        db.channel("c1", "p1", "TELEGRAM", "@news",
                "{\"telegramBotToken\":\"123:abc\",\"telegramChannelId\":-100}", "{\"includeTitle\":true}", true);

        try (Connection conn = db.connection()) {
            Channel channel = store.findChannel(conn, "c1").orElseThrow();

            assertEquals(SocialMedia.TELEGRAM, channel.socialMedia());
            assertEquals("-100", channel.credentials().get("telegramChannelId"));
            assertEquals("true", channel.preferences().get("includeTitle"));
            assertTrue(channel.active());
            assertTrue(channel.projectArchived());
        }
    }

    @Test
    void unreadableCredentialsBecomeNull() throws SQLException {
        db.channel("c1", null, "SITE", "blog", "not json", null, true);

        try (Connection conn = db.connection()) {
            Channel channel = store.findChannel(conn, "c1").orElseThrow();

            assertNull(channel.credentials());
            assertFalse(channel.projectArchived());
        }
    }

    @Test
    void markProcessingIsConditional() throws SQLException {
        db.publication("pub", "READY", "Hello", null);

        try (Connection conn = db.connection()) {
            assertEquals(1, store.markProcessing(conn, "pub", H2Fixtures.T0));
            assertEquals(0, store.markProcessing(conn, "pub", H2Fixtures.T0.plusSeconds(5)));

            Publication locked = store.findPublication(conn, "pub").orElseThrow();
            assertEquals(PublicationStatus.PROCESSING, locked.status());
            assertEquals(H2Fixtures.T0, locked.processingStartedAt());
        }
    }

    @Test
    void scheduledLockOnlyTakesScheduledPublications() throws SQLException {
        db.publication("scheduled", "SCHEDULED", "Hello", H2Fixtures.T0);
        db.publication("draft", "DRAFT", "Hello", H2Fixtures.T0);
        db.publication("failed", "FAILED", "Hello", H2Fixtures.T0);

        try (Connection conn = db.connection()) {
            assertEquals(1, store.markProcessingIfScheduled(conn, "scheduled", H2Fixtures.T0));
            assertEquals(0, store.markProcessingIfScheduled(conn, "scheduled", H2Fixtures.T0));
            assertEquals(0, store.markProcessingIfScheduled(conn, "draft", H2Fixtures.T0));
            assertEquals(0, store.markProcessingIfScheduled(conn, "failed", H2Fixtures.T0));

            Publication locked = store.findPublication(conn, "scheduled").orElseThrow();
            assertEquals(PublicationStatus.PROCESSING, locked.status());
            assertEquals(H2Fixtures.T0, locked.processingStartedAt());
            assertEquals(PublicationStatus.DRAFT, store.findPublication(conn, "draft").orElseThrow().status());
            assertEquals(PublicationStatus.FAILED, store.findPublication(conn, "failed").orElseThrow().status());
        }
    }

    @Test
    void concurrentLockAttemptsHaveOneWinner() throws Exception {
        db.publication("pub", "READY", "Hello", null);
        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try (Connection conn = db.connection()) {
                        conn.setAutoCommit(true);
                        return store.markProcessing(conn, "pub", Instant.now());
                    }
                }));
            }
            start.countDown();
            List<Integer> updated = new ArrayList<>();
            for (Future<Integer> f : futures) {
                updated.add(f.get());
            }
            assertEquals(1, Collections.frequency(updated, 1));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void releaseClearsProcessingMarkerForEveryFinalStatus() throws SQLException {
        for (PublicationStatus status : List.of(PublicationStatus.PUBLISHED, PublicationStatus.PARTIAL,
                PublicationStatus.FAILED)) {
            String id = "pub-" + status;
            db.publication(id, "READY", "Hello", null);
            try (Connection conn = db.connection()) {
                store.markProcessing(conn, id, H2Fixtures.T0);

                assertEquals(1, store.release(conn, id, status));

                Publication released = store.findPublication(conn, id).orElseThrow();
                assertEquals(status, released.status());
                assertNull(released.processingStartedAt());
            }
        }
    }

    @Test
    void postOutcomesAreWritten() throws SQLException {
        db.publication("pub", "PROCESSING", "Hello", null);
        db.post("ok", "pub", "c1", "FAILED", 0);
        db.post("bad", "pub", "c2", "PENDING", 1);
        Instant publishedAt = Instant.parse("2026-03-01T12:00:00Z");

        try (Connection conn = db.connection()) {
            store.markPostFailed(conn, "ok", "old error");
            assertEquals(1, store.markPostPublished(conn, "ok", publishedAt));
            assertEquals(1, store.markPostFailed(conn, "bad", "x".repeat(5000)));

            Post ok = store.findPost(conn, "ok").orElseThrow();
            assertEquals(PostStatus.PUBLISHED, ok.status());
            assertEquals(publishedAt, ok.publishedAt());
            assertNull(ok.errorMessage());

            Post bad = store.findPost(conn, "bad").orElseThrow();
            assertEquals(PostStatus.FAILED, bad.status());
            assertEquals(4000, bad.errorMessage().length());
        }
    }

    @Test
    void dueScheduledAreOldestFirstAndLimited() throws SQLException {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        db.publication("late", "SCHEDULED", "x", now.minusSeconds(10));
        db.publication("early", "SCHEDULED", "x", now.minusSeconds(100));
        db.publication("future", "SCHEDULED", "x", now.plusSeconds(10));
        db.publication("ready", "READY", "x", now.minusSeconds(50));

        try (Connection conn = db.connection()) {
            assertEquals(List.of("early", "late"),
                    store.findDueScheduled(conn, now, 10).stream().map(Publication::id).toList());
            assertEquals(List.of("early"),
                    store.findDueScheduled(conn, now, 1).stream().map(Publication::id).toList());
        }
    }

    @Test
    void duePostMakesItsPublicationDue() throws SQLException {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        db.publication("via-post", "SCHEDULED", "x", now.plusSeconds(3600));
        db.scheduledPost("early-post", "via-post", "c1", now.minusSeconds(5));
        db.publication("all-future", "SCHEDULED", "x", now.plusSeconds(3600));
        db.scheduledPost("future-post", "all-future", "c1", now.plusSeconds(60));
        db.publication("no-date", "SCHEDULED", "x", null);
        db.scheduledPost("no-date-post", "no-date", "c1", now.minusSeconds(5));

        try (Connection conn = db.connection()) {
            assertEquals(List.of("no-date", "via-post"),
                    store.findDueScheduled(conn, now, 10).stream().map(Publication::id).toList());
        }
    }

    @Test
    void markExpiredOnlyTouchesScheduled() throws SQLException {
        db.publication("s", "SCHEDULED", "x", H2Fixtures.T0);
        db.publication("p", "PROCESSING", "x", H2Fixtures.T0);

        try (Connection conn = db.connection()) {
            assertEquals(1, store.markExpired(conn, "s"));
            assertEquals(0, store.markExpired(conn, "p"));
            assertEquals(PublicationStatus.EXPIRED, store.findPublication(conn, "s").orElseThrow().status());
            assertEquals(PublicationStatus.PROCESSING, store.findPublication(conn, "p").orElseThrow().status());
        }
    }

    @Test
    void sqlErrorsSurfaceAsStoreException() throws SQLException {
        JdbcPublicationStore prefixed = new JdbcPublicationStore("missing_", JsonCodec.getDefault());

        try (Connection conn = db.connection()) {
            assertThrows(PublicationStoreException.class, () -> prefixed.findPost(conn, "x"));
        }
    }

    @Test
    void rejectsInvalidTablePrefix() {
        assertThrows(IllegalArgumentException.class,
                () -> new JdbcPublicationStore("bad;drop", JsonCodec.getDefault()));
    }
}
