package publicador.spi;

import publicador.model.Channel;
import publicador.model.Post;
import publicador.model.Publication;
import publicador.model.PublicationStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the rows the dispatch engine reads and the few columns it
 * writes: {@code Publication.status}, {@code Publication.processingStartedAt},
 * {@code Post.status}, {@code Post.publishedAt} and {@code Post.errorMessage}.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations throw
 * {@link publicador.PublicationStoreException} when the database cannot be reached or a
 * statement fails. Implementations live in the {@code publicador-jdbc} module.
 *
 * @see publicador.jdbc.JdbcPublicationStore
 */
public interface PublicationStore {

  /**
   * Loads a publication together with its media, ordered by media order.
   */
  Optional<Publication> findPublication(Connection conn, String publicationId);

  /**
   * Loads every post of a publication in creation order (id as tie-break).
   */
  List<Post> findPosts(Connection conn, String publicationId);

  Optional<Post> findPost(Connection conn, String postId);

  Optional<Channel> findChannel(Connection conn, String channelId);

  /**
   * Atomically moves a publication to PROCESSING and sets {@code processingStartedAt},
   * but only if its current status is not already PROCESSING. The condition must be part
   * of the single UPDATE statement; no read precedes it.
   *
   * @param conn          the JDBC connection
   * @param publicationId publication to lock
   * @param startedAt     lock timestamp to store
   * @return the number of rows updated (0 or 1); 1 means the caller now holds the lock
   */
  int markProcessing(Connection conn, String publicationId, Instant startedAt);

  /**
   * Same as {@link #markProcessing}, but only moves a publication that is still SCHEDULED.
   * Used by the scheduler so that a publication the author unscheduled, or one that was
   * already dispatched by hand, is not picked up from a stale read.
   *
   * @return the number of rows updated (0 or 1); 1 means the caller now holds the lock
   */
  int markProcessingIfScheduled(Connection conn, String publicationId, Instant startedAt);

  /**
   * Sets the final status and clears {@code processingStartedAt} in one write.
   *
   * @return the number of rows updated (0 or 1)
   */
  int release(Connection conn, String publicationId, PublicationStatus finalStatus);

  /**
   * Marks a post PUBLISHED, stores its publish time and clears any previous error.
   *
   * @return the number of rows updated (0 or 1)
   */
  int markPostPublished(Connection conn, String postId, Instant publishedAt);

  /**
   * Marks a post FAILED with the given error message.
   *
   * @return the number of rows updated (0 or 1)
   */
  int markPostFailed(Connection conn, String postId, String error);

  /**
   * Returns SCHEDULED publications that have something due at or before {@code now}: their
   * own {@code scheduledAt}, or the {@code scheduledAt} of at least one of their posts.
   * Oldest first. Media are not loaded.
   */
  default List<Publication> findDueScheduled(Connection conn, Instant now, int limit) {
    return List.of();
  }

  /**
   * Moves a publication from SCHEDULED to EXPIRED. Publications in any other status are
   * left untouched.
   *
   * @return the number of rows updated (0 or 1)
   */
  default int markExpired(Connection conn, String publicationId) {
    return 0;
  }
}
