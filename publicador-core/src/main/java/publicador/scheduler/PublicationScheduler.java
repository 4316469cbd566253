package publicador.scheduler;

import publicador.PublicationEngine;
import publicador.PublishResult;
import publicador.model.Post;
import publicador.model.PostStatus;
import publicador.model.Publication;
import publicador.shutdown.ShutdownCoordinator;
import publicador.spi.ConnectionProvider;
import publicador.spi.PublicationStore;
import publicador.util.StoreCalls;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically dispatches SCHEDULED publications that have come due.
 *
 * <p>Each post is due at its own {@code scheduledAt}, falling back to the publication's. A
 * post whose due time is older than the configured window is marked FAILED with
 * {@value publicador.model.Post#EXPIRED_ERROR} and is not sent. When at least one PENDING or
 * FAILED post is due inside the window the publication goes through
 * {@link PublicationEngine#publishScheduled}, which locks it only while it is still
 * SCHEDULED. When every post has expired the publication moves to EXPIRED. A publication
 * without posts follows its own {@code scheduledAt} the same way.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()} are
 * synchronized.
 */
public final class PublicationScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PublicationScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final PublicationStore store;
  private final PublicationEngine engine;
  private final ShutdownCoordinator shutdown;
  private final Duration interval;
  private final Duration window;
  private final int batchSize;
  private final Clock clock;

  private ScheduledExecutorService executor;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private PublicationScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.engine = Objects.requireNonNull(builder.engine, "engine");
    this.shutdown = builder.shutdown != null ? builder.shutdown : engine.shutdownCoordinator();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    if (builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    if (builder.window.isNegative()) {
      throw new IllegalArgumentException("window must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.interval = builder.interval;
    this.window = builder.window;
    this.batchSize = builder.batchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the polling loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PublicationScheduler has been closed");
    }
    if (pollTask != null) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "publicador-scheduler");
      thread.setDaemon(true);
      return thread;
    });
    long intervalMs = interval.toMillis();
    pollTask = executor.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    logger.info("Publication scheduler started with interval " + interval.toSeconds()
        + "s and window " + window.toMinutes() + "m");
  }

  /**
   * Runs one cycle. Called by the scheduler thread; tests may call it directly.
   */
  public void poll() {
    if (closed || shutdown.isShutdownInProgress()) {
      return;
    }
    try {
      Instant now = clock.instant();
      Instant windowStart = now.minus(window);
      List<Publication> due = StoreCalls.withConnection(connectionProvider, "fetch due publications",
          conn -> store.findDueScheduled(conn, now, batchSize));
      for (Publication publication : due) {
        if (shutdown.isShutdownInProgress()) {
          return;
        }
        process(publication, now, windowStart);
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Scheduler cycle failed", t);
    }
  }

  private void process(Publication publication, Instant now, Instant windowStart) {
    String id = publication.id();
    try {
      List<Post> posts = StoreCalls.withConnection(connectionProvider, "load posts of " + id,
          conn -> store.findPosts(conn, id));
      if (posts.isEmpty()) {
        processWithoutPosts(publication, now, windowStart);
        return;
      }

      boolean hasPostsToPublish = false;
      boolean allExpired = true;
      for (Post post : posts) {
        Instant effective = post.scheduledAt() != null ? post.scheduledAt() : publication.scheduledAt();
        if (effective == null) {
          allExpired = false;
        } else if (effective.isBefore(windowStart)) {
          expirePost(post);
        } else if (!effective.isAfter(now)) {
          allExpired = false;
          if (post.status() == PostStatus.PENDING || post.status() == PostStatus.FAILED) {
            hasPostsToPublish = true;
          }
        } else {
          allExpired = false;
        }
      }

      if (hasPostsToPublish) {
        trigger(id);
      } else if (allExpired) {
        expirePublication(id, "all posts expired");
      }
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Scheduled dispatch of publication " + id + " failed", e);
    }
  }

  private void processWithoutPosts(Publication publication, Instant now, Instant windowStart) {
    Instant scheduledAt = publication.scheduledAt();
    if (scheduledAt == null) {
      return;
    }
    if (scheduledAt.isBefore(windowStart)) {
      expirePublication(publication.id(), "scheduled " + scheduledAt + " is before window start " + windowStart);
    } else if (!scheduledAt.isAfter(now)) {
      trigger(publication.id());
    }
  }

  private void expirePost(Post post) {
    if (post.isExpired()) {
      return;
    }
    StoreCalls.withConnection(connectionProvider, "expire post " + post.id(),
        conn -> store.markPostFailed(conn, post.id(), Post.EXPIRED_ERROR));
    logger.info("Post " + post.id() + " marked EXPIRED");
  }

  private void expirePublication(String id, String reason) {
    int updated = StoreCalls.withConnection(connectionProvider, "expire publication " + id,
        conn -> store.markExpired(conn, id));
    if (updated == 1) {
      logger.info("Publication " + id + " marked EXPIRED (" + reason + ")");
    }
  }

  private void trigger(String id) {
    PublishResult result = engine.publishScheduled(id);
    if (result.acquired()) {
      logger.info("Scheduled publication " + id + " dispatched: " + result.message());
    }
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
    }
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  /** Builder for {@link PublicationScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private PublicationStore store;
    private PublicationEngine engine;
    private ShutdownCoordinator shutdown;
    private Duration interval = Duration.ofSeconds(60);
    private Duration window = Duration.ofMinutes(10);
    private int batchSize = 100;
    private Clock clock;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder store(PublicationStore store) {
      this.store = store;
      return this;
    }

    /** <b>Required.</b> */
    public Builder engine(PublicationEngine engine) {
      this.engine = engine;
      return this;
    }

    /**
     * Optional. Defaults to the engine's coordinator.
     */
    public Builder shutdownCoordinator(ShutdownCoordinator shutdown) {
      this.shutdown = shutdown;
      return this;
    }

    /**
     * Delay between the end of one cycle and the start of the next. Defaults to 60 seconds.
     */
    public Builder interval(Duration interval) {
      this.interval = Objects.requireNonNull(interval, "interval");
      return this;
    }

    /**
     * How late a scheduled publication may still be sent. Defaults to 10 minutes.
     */
    public Builder window(Duration window) {
      this.window = Objects.requireNonNull(window, "window");
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public PublicationScheduler build() {
      return new PublicationScheduler(this);
    }
  }
}
