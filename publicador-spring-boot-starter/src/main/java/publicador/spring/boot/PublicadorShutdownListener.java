package publicador.spring.boot;

import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import publicador.shutdown.ShutdownCoordinator;

import java.util.logging.Logger;

/**
 * Flips the {@link ShutdownCoordinator} as soon as the application context starts closing,
 * before any bean is destroyed, so dispatches in progress stop taking new posts.
 */
public class PublicadorShutdownListener implements ApplicationListener<ContextClosedEvent> {
  private static final Logger logger = Logger.getLogger(PublicadorShutdownListener.class.getName());

  private final ShutdownCoordinator shutdown;

  public PublicadorShutdownListener(ShutdownCoordinator shutdown) {
    this.shutdown = shutdown;
  }

  @Override
  public void onApplicationEvent(ContextClosedEvent event) {
    if (shutdown.beginShutdown("application context closing")) {
      logger.info("Application context closing; aborting remaining dispatch work");
    }
  }
}
