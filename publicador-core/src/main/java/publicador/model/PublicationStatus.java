package publicador.model;

/**
 * Lifecycle status of a {@link Publication}.
 *
 * <p>The dispatch engine only moves a publication out of READY/SCHEDULED into
 * PROCESSING and from PROCESSING into one of {@link #PUBLISHED}, {@link #FAILED} or
 * {@link #PARTIAL}. The scheduler may additionally move SCHEDULED to {@link #EXPIRED}.
 */
public enum PublicationStatus {
  DRAFT,
  READY,
  SCHEDULED,
  PROCESSING,
  PUBLISHED,
  FAILED,
  PARTIAL,
  EXPIRED,
  ARCHIVED;

  /**
   * @return {@code true} for the statuses a dispatch attempt can end in
   */
  public boolean isDispatchResult() {
    return this == PUBLISHED || this == FAILED || this == PARTIAL;
  }
}
