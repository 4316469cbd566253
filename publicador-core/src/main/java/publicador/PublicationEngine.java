package publicador;

import publicador.channel.ChannelTestResult;
import publicador.channel.ChannelTester;
import publicador.channel.ChannelValidator;
import publicador.dispatch.DispatchOutcome;
import publicador.dispatch.PublicationDispatcher;
import publicador.dispatch.ResultAggregator;
import publicador.dispatch.RetryPolicy;
import publicador.format.BodyFormatter;
import publicador.format.DefaultBodyFormatter;
import publicador.format.PostRequestFactory;
import publicador.gateway.PostingGateway;
import publicador.lock.PublicationLock;
import publicador.lock.StorePublicationLock;
import publicador.model.Post;
import publicador.model.PostStatus;
import publicador.model.Publication;
import publicador.model.PublicationStatus;
import publicador.shutdown.ShutdownCoordinator;
import publicador.spi.ConnectionProvider;
import publicador.spi.MetricsExporter;
import publicador.spi.Notifier;
import publicador.spi.PublicationStore;
import publicador.util.StoreCalls;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for dispatching publications to their channels.
 *
 * <p>Every dispatch takes the publication lock, sends the posts through the
 * {@link PublicationDispatcher} and hands the outcomes to the {@link ResultAggregator}, which
 * releases the lock. If anything throws after the lock was taken, the lock is still released
 * (PARTIAL when a post had already succeeded, FAILED otherwise) before the exception
 * propagates.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable}: closing begins shutdown, so running dispatches abort their remaining
 * posts.
 *
 * @see PublicationEngine.Builder
 */
public final class PublicationEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PublicationEngine.class.getName());

  private final ConnectionProvider connectionProvider;
  private final PublicationStore store;
  private final PublicationLock lock;
  private final PublicationDispatcher dispatcher;
  private final ResultAggregator aggregator;
  private final ChannelTester channelTester;
  private final ShutdownCoordinator shutdown;
  private final MetricsExporter metrics;

  private PublicationEngine(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    PostingGateway gateway = Objects.requireNonNull(builder.gateway, "gateway");
    this.shutdown = builder.shutdown != null ? builder.shutdown : new ShutdownCoordinator();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.lock = builder.lock != null ? builder.lock : new StorePublicationLock(connectionProvider, store);

    ChannelValidator validator = new ChannelValidator();
    BodyFormatter bodyFormatter = builder.bodyFormatter != null ? builder.bodyFormatter : new DefaultBodyFormatter();
    this.dispatcher = PublicationDispatcher.builder()
        .connectionProvider(connectionProvider)
        .store(store)
        .gateway(gateway)
        .channelValidator(validator)
        .requestFactory(new PostRequestFactory(bodyFormatter, builder.mediaBaseUrl))
        .shutdownCoordinator(shutdown)
        .retryPolicy(builder.retryPolicy)
        .retryAttempts(builder.retryAttempts)
        .requestTimeout(builder.requestTimeout)
        .postProcessingTimeout(builder.postProcessingTimeout)
        .metrics(metrics)
        .build();
    this.aggregator = new ResultAggregator(lock, builder.notifier, metrics);
    this.channelTester = new ChannelTester(connectionProvider, store, validator, gateway,
        builder.requestTimeout.toMillis());
  }

  public static Builder builder() {
    return new Builder();
  }

  public PublishResult publish(String publicationId) {
    return publish(publicationId, PublishOptions.DEFAULT);
  }

  /**
   * Dispatches every post of a publication.
   *
   * @throws InvalidDispatchRequestException if the publication does not exist or has neither
   *     content nor media; raised before the lock is taken
   * @throws PublicationStoreException       if storage fails; the lock is released first
   *     whenever it was taken
   */
  public PublishResult publish(String publicationId, PublishOptions options) {
    Objects.requireNonNull(publicationId, "publicationId");
    Objects.requireNonNull(options, "options");
    Publication publication = loadPublication(publicationId);
    if (!publication.hasContentOrMedia()) {
      throw new InvalidDispatchRequestException("Publication must have content or at least one media file");
    }
    if (!tryLock(publicationId)) {
      return PublishResult.alreadyProcessing(publicationId);
    }
    logger.info("Dispatching publication " + publicationId + (options.force() ? " (force)" : ""));
    return dispatchLocked(publication, options.force());
  }

  /**
   * Dispatches a publication on behalf of the scheduler. The lock is taken only while the
   * publication is still SCHEDULED, so one that was unscheduled, archived or already
   * dispatched since it was read is left untouched.
   *
   * @throws InvalidDispatchRequestException if the publication does not exist or has neither
   *     content nor media; raised before the lock is taken
   */
  public PublishResult publishScheduled(String publicationId) {
    Objects.requireNonNull(publicationId, "publicationId");
    Publication publication = loadPublication(publicationId);
    if (!publication.hasContentOrMedia()) {
      throw new InvalidDispatchRequestException("Publication must have content or at least one media file");
    }
    if (!lock.tryAcquireScheduled(publicationId)) {
      logger.fine("Publication " + publicationId + " is no longer SCHEDULED; skipping");
      return PublishResult.notScheduled(publicationId, publication.status());
    }
    logger.info("Dispatching scheduled publication " + publicationId);
    return dispatchLocked(publication, false);
  }

  private PublishResult dispatchLocked(Publication publication, boolean force) {
    String publicationId = publication.id();
    List<DispatchOutcome> outcomes = new ArrayList<>();
    try {
      List<Post> posts = StoreCalls.withConnection(connectionProvider, "load posts of " + publicationId,
          conn -> store.findPosts(conn, publicationId));
      dispatcher.dispatch(publication, posts, force, outcomes::add);
    } catch (RuntimeException | Error e) {
      releaseAfterFailure(publicationId, outcomes, e);
      throw e;
    }
    PublicationStatus status = aggregator.finalize(publication, outcomes);
    return PublishResult.of(publicationId, status, outcomes);
  }

  /**
   * Sends a single post again, whatever its current status, then sets the publication status
   * from the stored status of all of its posts.
   *
   * @throws InvalidDispatchRequestException if the post or its publication does not exist
   */
  public PublishResult publishPost(String postId) {
    Objects.requireNonNull(postId, "postId");
    Post post = StoreCalls.withConnection(connectionProvider, "load post " + postId,
        conn -> store.findPost(conn, postId))
        .orElseThrow(() -> new InvalidDispatchRequestException("Post not found"));
    Publication publication = loadPublication(post.publicationId());
    if (!tryLock(publication.id())) {
      return PublishResult.alreadyProcessing(publication.id());
    }
    logger.info("Dispatching post " + postId + " of publication " + publication.id());

    List<DispatchOutcome> outcomes = new ArrayList<>();
    List<Post> persisted;
    try {
      dispatcher.dispatch(publication, List.of(post), true, outcomes::add);
      persisted = StoreCalls.withConnection(connectionProvider, "load posts of " + publication.id(),
          conn -> store.findPosts(conn, publication.id()));
    } catch (RuntimeException | Error e) {
      releaseAfterFailure(publication.id(), outcomes, e);
      throw e;
    }
    PublicationStatus status = ResultAggregator.aggregatePersisted(persisted);
    aggregator.complete(publication, status, persisted.stream()
        .filter(p -> p.status() == PostStatus.FAILED)
        .map(Post::channelId)
        .toList());
    return PublishResult.of(publication.id(), status, outcomes);
  }

  /**
   * Checks a channel's readiness and credentials through the gateway's preview verb.
   *
   * @throws publicador.channel.ChannelValidationException if the channel does not exist
   */
  public ChannelTestResult testChannel(String channelId) {
    return channelTester.testChannel(channelId);
  }

  public ShutdownCoordinator shutdownCoordinator() {
    return shutdown;
  }

  private Publication loadPublication(String publicationId) {
    return StoreCalls.withConnection(connectionProvider, "load publication " + publicationId,
        conn -> store.findPublication(conn, publicationId))
        .orElseThrow(() -> new InvalidDispatchRequestException("Publication not found"));
  }

  private boolean tryLock(String publicationId) {
    if (lock.tryAcquire(publicationId)) {
      return true;
    }
    metrics.incrementLockContended();
    logger.warning("Publication " + publicationId + " is already being processed; skipping");
    return false;
  }

  private void releaseAfterFailure(String publicationId, List<DispatchOutcome> outcomes, Throwable failure) {
    PublicationStatus status = outcomes.stream().anyMatch(DispatchOutcome::success)
        ? PublicationStatus.PARTIAL : PublicationStatus.FAILED;
    logger.log(Level.SEVERE, "Dispatch of publication " + publicationId + " failed; releasing as " + status, failure);
    try {
      lock.release(publicationId, status);
      metrics.incrementPublicationFinalized(status);
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
    }
  }

  /**
   * Begins shutdown, so dispatches in progress abort their remaining posts, and stops the
   * sender threads.
   */
  @Override
  public void close() {
    shutdown.beginShutdown("engine closed");
    dispatcher.close();
  }

  /** Builder for {@link PublicationEngine}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private PublicationStore store;
    private PostingGateway gateway;
    private PublicationLock lock;
    private ShutdownCoordinator shutdown;
    private Notifier notifier;
    private MetricsExporter metrics;
    private BodyFormatter bodyFormatter;
    private RetryPolicy retryPolicy;
    private String mediaBaseUrl;
    private int retryAttempts = 3;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration postProcessingTimeout = Duration.ofSeconds(60);

    private Builder() {}

    /**
     * Sets the connection provider used for every status read and write.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the persistence backend for publications, posts and channels.
     *
     * <p><b>Required.</b>
     *
     * @param store the store
     * @return this builder
     */
    public Builder store(PublicationStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the posting gateway.
     *
     * <p><b>Required.</b>
     *
     * @param gateway the gateway client
     * @return this builder
     */
    public Builder gateway(PostingGateway gateway) {
      this.gateway = gateway;
      return this;
    }

    /**
     * Optional. Defaults to {@link StorePublicationLock} over the configured store.
     */
    public Builder lock(PublicationLock lock) {
      this.lock = lock;
      return this;
    }

    /**
     * Optional. Pass a coordinator owned by the application lifecycle to abort dispatches on
     * shutdown; defaults to a private coordinator flipped by {@link #close()}.
     */
    public Builder shutdownCoordinator(ShutdownCoordinator shutdown) {
      this.shutdown = shutdown;
      return this;
    }

    public Builder notifier(Notifier notifier) {
      this.notifier = notifier;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@link DefaultBodyFormatter}.
     */
    public Builder bodyFormatter(BodyFormatter bodyFormatter) {
      this.bodyFormatter = bodyFormatter;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Base URL of the media storage; relative media paths resolve to
     * {@code {mediaBaseUrl}/files/{path}/download}.
     */
    public Builder mediaBaseUrl(String mediaBaseUrl) {
      this.mediaBaseUrl = mediaBaseUrl;
      return this;
    }

    /**
     * Optional. Defaults to {@code 3}. Must be &ge; 0.
     */
    public Builder retryAttempts(int retryAttempts) {
      this.retryAttempts = retryAttempts;
      return this;
    }

    /**
     * Optional. Timeout of one gateway call, previews included. Defaults to 30 seconds.
     */
    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
      return this;
    }

    /**
     * Optional. Bound for one post, retries included. Defaults to 60 seconds.
     */
    public Builder postProcessingTimeout(Duration postProcessingTimeout) {
      this.postProcessingTimeout = Objects.requireNonNull(postProcessingTimeout, "postProcessingTimeout");
      return this;
    }

    public PublicationEngine build() {
      return new PublicationEngine(this);
    }
  }
}
