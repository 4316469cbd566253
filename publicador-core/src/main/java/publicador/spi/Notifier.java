package publicador.spi;

import java.util.Map;

/**
 * User-facing alert sink for publications that did not fully succeed.
 *
 * <p>Implementations bridge into the notification subsystem. Failures thrown from
 * {@link #notify} are logged by the engine and never affect the recorded outcome.
 */
@FunctionalInterface
public interface Notifier {

  /**
   * No-op instance.
   */
  Notifier NOOP = (userId, kind, context) -> { };

  /**
   * @param userId  the user to alert (the publication's author; may be {@code null})
   * @param kind    alert kind
   * @param context details such as {@code publicationId} and {@code failedChannelIds}
   */
  void notify(String userId, NotificationKind kind, Map<String, Object> context);
}
