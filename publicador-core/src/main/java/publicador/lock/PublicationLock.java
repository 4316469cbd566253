package publicador.lock;

import publicador.model.PublicationStatus;

/**
 * Exclusive processing lock on a publication.
 *
 * <p>A held lock is visible in storage as status PROCESSING with a non-null
 * {@code processingStartedAt}. Releasing always writes a final status and clears the marker.
 *
 * @see StorePublicationLock
 */
public interface PublicationLock {

  /**
   * Attempts to move the publication to PROCESSING.
   *
   * @param publicationId the publication to lock
   * @return {@code true} if this caller now holds the lock, {@code false} if another
   *     attempt already holds it (or the publication no longer exists)
   */
  boolean tryAcquire(String publicationId);

  /**
   * Attempts to move the publication to PROCESSING only if it is currently SCHEDULED.
   *
   * @return {@code true} if this caller now holds the lock; {@code false} if the publication
   *     is no longer SCHEDULED
   */
  boolean tryAcquireScheduled(String publicationId);

  /**
   * Sets the final status and clears {@code processingStartedAt} in one write.
   *
   * @param publicationId the publication to release
   * @param finalStatus   status to store; never PROCESSING
   */
  void release(String publicationId, PublicationStatus finalStatus);
}
