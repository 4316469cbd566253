package publicador.dispatch;

import publicador.channel.ChannelValidator;
import publicador.channel.PlatformParams;
import publicador.channel.ValidationResult;
import publicador.format.DefaultBodyFormatter;
import publicador.format.PostRequestFactory;
import publicador.gateway.GatewayException;
import publicador.gateway.PostRequest;
import publicador.gateway.PostingGateway;
import publicador.gateway.PublishReceipt;
import publicador.model.Channel;
import publicador.model.Post;
import publicador.model.PostStatus;
import publicador.model.Publication;
import publicador.shutdown.ShutdownCoordinator;
import publicador.spi.ConnectionProvider;
import publicador.spi.MetricsExporter;
import publicador.spi.PublicationStore;
import publicador.util.StoreCalls;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends the posts of a locked publication one after another and records each outcome.
 *
 * <p>For every post, in the order given:
 * <ol>
 *   <li>a post already PUBLISHED is skipped unless {@code force} is set, and so is a post the
 *       scheduler marked expired;
 *   <li>if shutdown is in progress the post is recorded as aborted without a gateway call;
 *   <li>the channel is validated; a failure is recorded with the validator's reasons;
 *   <li>the payload is sent, repeating retryable gateway errors with backoff, all within the
 *       per-post processing timeout.
 * </ol>
 * Each terminal post status is written before the next post starts. Per-post errors never
 * escape {@link #dispatch}; only storage failures do.
 *
 * <p>Sends run on a bounded pool of daemon threads so that a call exceeding the per-post
 * timeout can be abandoned. {@code dispatch} waits for at most one send at a time, but an
 * abandoned send keeps its thread until the gateway returns or honours the interrupt. When
 * every sender thread is held that way, further posts fail without a gateway call instead of
 * queueing.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe; concurrent
 * {@code dispatch} calls must target different publications.
 */
public final class PublicationDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PublicationDispatcher.class.getName());

  public static final String ABORTED_MESSAGE = "Publication aborted due to system shutdown";
  static final String SENDERS_BUSY_MESSAGE = "All sender threads are busy with abandoned sends";

  private final ConnectionProvider connectionProvider;
  private final PublicationStore store;
  private final PostingGateway gateway;
  private final ChannelValidator channelValidator;
  private final PostRequestFactory requestFactory;
  private final ShutdownCoordinator shutdown;
  private final RetryPolicy retryPolicy;
  private final int retryAttempts;
  private final long requestTimeoutMs;
  private final long postProcessingTimeoutMs;
  private final MetricsExporter metrics;
  private final ExecutorService sender;

  private PublicationDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.gateway = Objects.requireNonNull(builder.gateway, "gateway");
    this.channelValidator = builder.channelValidator != null ? builder.channelValidator : new ChannelValidator();
    this.requestFactory = builder.requestFactory != null
        ? builder.requestFactory : new PostRequestFactory(new DefaultBodyFormatter(), null);
    this.shutdown = builder.shutdown != null ? builder.shutdown : new ShutdownCoordinator();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1000, 30_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.retryAttempts < 0) {
      throw new IllegalArgumentException("retryAttempts must be >= 0");
    }
    if (builder.requestTimeout.isNegative() || builder.requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be > 0");
    }
    if (builder.postProcessingTimeout.isNegative() || builder.postProcessingTimeout.isZero()) {
      throw new IllegalArgumentException("postProcessingTimeout must be > 0");
    }
    if (builder.senderThreads <= 0) {
      throw new IllegalArgumentException("senderThreads must be > 0");
    }
    this.retryAttempts = builder.retryAttempts;
    this.requestTimeoutMs = builder.requestTimeout.toMillis();
    this.postProcessingTimeoutMs = builder.postProcessingTimeout.toMillis();
    AtomicInteger senderCount = new AtomicInteger();
    this.sender = new ThreadPoolExecutor(0, builder.senderThreads, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(),
        runnable -> {
          Thread thread = new Thread(runnable, "publicador-sender-" + senderCount.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<DispatchOutcome> dispatch(Publication publication, List<Post> posts, boolean force) {
    return dispatch(publication, posts, force, outcome -> { });
  }

  /**
   * Dispatches {@code posts} in order.
   *
   * @param publication the locked publication the posts belong to
   * @param posts       posts to attempt, already in dispatch order
   * @param force       resend posts that are already PUBLISHED
   * @param listener    receives each outcome right after it has been persisted
   * @return one outcome per post, in the same order
   * @throws publicador.PublicationStoreException if a channel cannot be read or an outcome
   *     cannot be written; outcomes already persisted stay persisted
   */
  public List<DispatchOutcome> dispatch(Publication publication, List<Post> posts, boolean force,
      Consumer<DispatchOutcome> listener) {
    Objects.requireNonNull(publication, "publication");
    Objects.requireNonNull(posts, "posts");
    Objects.requireNonNull(listener, "listener");
    List<DispatchOutcome> outcomes = new ArrayList<>(posts.size());
    for (Post post : posts) {
      DispatchOutcome outcome = dispatchPost(publication, post, force);
      outcomes.add(outcome);
      listener.accept(outcome);
    }
    return outcomes;
  }

  private DispatchOutcome dispatchPost(Publication publication, Post post, boolean force) {
    if (!force && post.status() == PostStatus.PUBLISHED) {
      logger.fine("Post " + post.id() + " already published; not sending again");
      return DispatchOutcome.alreadyPublished(post.id(), post.channelId(), post.publishedAt());
    }
    if (!force && post.isExpired()) {
      logger.fine("Post " + post.id() + " expired before it was sent; not sending");
      return DispatchOutcome.expired(post.id(), post.channelId());
    }

    long startNanos = System.nanoTime();
    DispatchOutcome outcome;
    if (shutdown.isShutdownInProgress()) {
      logger.warning("Post " + post.id() + " of publication " + publication.id() + " aborted: shutdown in progress");
      outcome = DispatchOutcome.failed(post.id(), post.channelId(), FailureKind.ABORTED, ABORTED_MESSAGE, 0);
    } else {
      outcome = attempt(publication, post);
    }

    persist(outcome);
    metrics.recordPostDurationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    if (outcome.success()) {
      metrics.incrementPostPublished();
      logger.info("Post " + post.id() + " published to channel " + post.channelId()
          + (outcome.url() != null ? " at " + outcome.url() : ""));
    } else {
      metrics.incrementPostFailed(outcome.failureKind());
      if (outcome.failureKind() != FailureKind.ABORTED) {
        logger.warning("Post " + post.id() + " failed (" + outcome.failureKind() + "): " + outcome.errorMessage());
      }
    }
    return outcome;
  }

  private DispatchOutcome attempt(Publication publication, Post post) {
    Channel channel = StoreCalls.withConnection(connectionProvider, "load channel " + post.channelId(),
        conn -> store.findChannel(conn, post.channelId())).orElse(null);
    ValidationResult validation = channelValidator.validate(channel);
    if (!validation.isValid()) {
      return DispatchOutcome.failed(post.id(), post.channelId(), FailureKind.VALIDATION, validation.message(), 0);
    }

    PostRequest request;
    try {
      request = requestFactory.create(publication, post, channel, PlatformParams.resolve(channel));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to build request for post " + post.id(), e);
      return DispatchOutcome.failed(post.id(), post.channelId(), FailureKind.INTERNAL, messageOf(e), 0);
    }
    return send(post, request);
  }

  private DispatchOutcome send(Post post, PostRequest request) {
    AtomicInteger calls = new AtomicInteger();
    Future<PublishReceipt> future;
    try {
      future = sender.submit(() -> sendWithRetries(post.id(), request, calls));
    } catch (RejectedExecutionException e) {
      if (sender.isShutdown()) {
        return DispatchOutcome.failed(post.id(), post.channelId(), FailureKind.ABORTED, ABORTED_MESSAGE, 0);
      }
      return DispatchOutcome.failed(post.id(), post.channelId(), FailureKind.INTERNAL, SENDERS_BUSY_MESSAGE, 0);
    }
    try {
      PublishReceipt receipt = future.get(postProcessingTimeoutMs, TimeUnit.MILLISECONDS);
      return DispatchOutcome.published(post.id(), post.channelId(), receipt.url(), receipt.publishedAt(), calls.get());
    } catch (TimeoutException e) {
      // The in-flight call is abandoned, not awaited; cancel interrupts a pending backoff.
      future.cancel(true);
      return DispatchOutcome.failed(post.id(), post.channelId(), FailureKind.TIMEOUT,
          "Timeout reached (" + formatTimeout(postProcessingTimeoutMs) + ")", calls.get());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof DeliveryFailure) {
        DeliveryFailure failure = (DeliveryFailure) cause;
        return DispatchOutcome.failed(post.id(), post.channelId(), failure.kind, failure.getMessage(), calls.get());
      }
      logger.log(Level.WARNING, "Unexpected error sending post " + post.id(), cause);
      return DispatchOutcome.failed(post.id(), post.channelId(), FailureKind.INTERNAL, messageOf(cause), calls.get());
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return DispatchOutcome.failed(post.id(), post.channelId(), FailureKind.ABORTED, "Dispatch interrupted", calls.get());
    }
  }

  private PublishReceipt sendWithRetries(String postId, PostRequest request, AtomicInteger calls)
      throws DeliveryFailure, InterruptedException {
    while (true) {
      int call = calls.incrementAndGet();
      try {
        return gateway.send(request, requestTimeoutMs);
      } catch (GatewayException e) {
        String message = messageOf(e);
        if (!e.isRetryable()) {
          throw new DeliveryFailure(FailureKind.GATEWAY_TERMINAL, message);
        }
        if (call > retryAttempts || shutdown.isShutdownInProgress()) {
          throw new DeliveryFailure(FailureKind.RETRIES_EXHAUSTED, message);
        }
        long delayMs = retryPolicy.computeDelayMs(call);
        logger.warning("Gateway call " + call + " for post " + postId + " failed (" + e.kind() + "): "
            + message + "; retrying in " + delayMs + "ms");
        metrics.incrementGatewayRetry();
        Thread.sleep(delayMs);
      }
    }
  }

  private void persist(DispatchOutcome outcome) {
    String postId = outcome.postId();
    StoreCalls.withConnection(connectionProvider, "record outcome of post " + postId, conn -> outcome.success()
        ? store.markPostPublished(conn, postId, outcome.publishedAt())
        : store.markPostFailed(conn, postId, outcome.errorMessage()));
  }

  static String formatTimeout(long timeoutMs) {
    return timeoutMs % 1000 == 0 ? (timeoutMs / 1000) + "s" : timeoutMs + "ms";
  }

  private static String messageOf(Throwable t) {
    return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
  }

  /**
   * Stops the sender threads. A send still in flight is given a few seconds to finish.
   */
  @Override
  public void close() {
    sender.shutdown();
    try {
      if (!sender.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warning("Sender did not stop in time; interrupting in-flight sends");
        sender.shutdownNow();
      }
    } catch (InterruptedException e) {
      sender.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class DeliveryFailure extends Exception {
    private final FailureKind kind;

    DeliveryFailure(FailureKind kind, String message) {
      super(message, null, false, false);
      this.kind = kind;
    }
  }

  /** Builder for {@link PublicationDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private PublicationStore store;
    private PostingGateway gateway;
    private ChannelValidator channelValidator;
    private PostRequestFactory requestFactory;
    private ShutdownCoordinator shutdown;
    private RetryPolicy retryPolicy;
    private int retryAttempts = 3;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration postProcessingTimeout = Duration.ofSeconds(60);
    private int senderThreads = 16;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b> Used to read channels and to write post outcomes.
     */
    public Builder store(PublicationStore store) {
      this.store = store;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder gateway(PostingGateway gateway) {
      this.gateway = gateway;
      return this;
    }

    public Builder channelValidator(ChannelValidator channelValidator) {
      this.channelValidator = channelValidator;
      return this;
    }

    /**
     * Optional. Defaults to a factory using {@link DefaultBodyFormatter} and no media base URL.
     */
    public Builder requestFactory(PostRequestFactory requestFactory) {
      this.requestFactory = requestFactory;
      return this;
    }

    /**
     * Optional. Share the engine's coordinator so that shutdown aborts remaining posts.
     */
    public Builder shutdownCoordinator(ShutdownCoordinator shutdown) {
      this.shutdown = shutdown;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with 1s base, 30s cap.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Number of repeats after the first call on retryable errors. Defaults to {@code 3}.
     */
    public Builder retryAttempts(int retryAttempts) {
      this.retryAttempts = retryAttempts;
      return this;
    }

    /**
     * Timeout of a single gateway call. Defaults to 30 seconds.
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
      return this;
    }

    /**
     * Wall-clock bound for one post, every retry included. Defaults to 60 seconds.
     */
    public Builder postProcessingTimeout(Duration postProcessingTimeout) {
      this.postProcessingTimeout = Objects.requireNonNull(postProcessingTimeout, "postProcessingTimeout");
      return this;
    }

    /**
     * Upper bound on sender threads, abandoned sends included. Defaults to {@code 16}.
     */
    public Builder senderThreads(int senderThreads) {
      this.senderThreads = senderThreads;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public PublicationDispatcher build() {
      return new PublicationDispatcher(this);
    }
  }
}
