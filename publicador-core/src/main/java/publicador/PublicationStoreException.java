package publicador;

/**
 * Thrown when a publication or post row cannot be read or written.
 *
 * <p>Unlike per-post delivery errors, storage failures always propagate out of the
 * engine: there is no safe partial state to record.
 */
public class PublicationStoreException extends RuntimeException {

  public PublicationStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public PublicationStoreException(String message) {
    super(message);
  }
}
