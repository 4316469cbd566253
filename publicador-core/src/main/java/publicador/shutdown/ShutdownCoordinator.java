package publicador.shutdown;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Process-wide "shutting down" flag.
 *
 * <p>The flag is flipped once by the surrounding lifecycle (a JVM shutdown hook, a Spring
 * context close) and is read by the dispatcher before every post. It never flips back.
 *
 * <p>This class is thread-safe.
 */
public final class ShutdownCoordinator {
  private static final Logger logger = Logger.getLogger(ShutdownCoordinator.class.getName());

  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  /**
   * Flips the flag.
   *
   * @param reason free text for the log line
   * @return {@code true} if this call started the shutdown, {@code false} if it was already
   *     in progress
   */
  public boolean beginShutdown(String reason) {
    if (shuttingDown.compareAndSet(false, true)) {
      logger.info("Shutdown started: " + reason + "; remaining posts will be aborted");
      return true;
    }
    return false;
  }

  public boolean isShutdownInProgress() {
    return shuttingDown.get();
  }
}
