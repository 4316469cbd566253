package publicador.lock;

import publicador.model.PublicationStatus;
import publicador.spi.ConnectionProvider;
import publicador.spi.PublicationStore;
import publicador.util.StoreCalls;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link PublicationLock} backed by the conditional UPDATE of
 * {@link PublicationStore#markProcessing}. There is no in-process mutex: the row is the lock.
 */
public final class StorePublicationLock implements PublicationLock {
  private static final Logger logger = Logger.getLogger(StorePublicationLock.class.getName());

  private final ConnectionProvider connectionProvider;
  private final PublicationStore store;
  private final Clock clock;

  public StorePublicationLock(ConnectionProvider connectionProvider, PublicationStore store) {
    this(connectionProvider, store, Clock.systemUTC());
  }

  public StorePublicationLock(ConnectionProvider connectionProvider, PublicationStore store, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public boolean tryAcquire(String publicationId) {
    Objects.requireNonNull(publicationId, "publicationId");
    int updated = StoreCalls.withConnection(connectionProvider, "lock publication " + publicationId,
        conn -> store.markProcessing(conn, publicationId, clock.instant()));
    if (updated == 1) {
      logger.fine("Lock acquired for publication " + publicationId);
      return true;
    }
    return false;
  }

  @Override
  public boolean tryAcquireScheduled(String publicationId) {
    Objects.requireNonNull(publicationId, "publicationId");
    int updated = StoreCalls.withConnection(connectionProvider, "lock scheduled publication " + publicationId,
        conn -> store.markProcessingIfScheduled(conn, publicationId, clock.instant()));
    if (updated == 1) {
      logger.fine("Lock acquired for scheduled publication " + publicationId);
      return true;
    }
    return false;
  }

  @Override
  public void release(String publicationId, PublicationStatus finalStatus) {
    Objects.requireNonNull(publicationId, "publicationId");
    Objects.requireNonNull(finalStatus, "finalStatus");
    if (finalStatus == PublicationStatus.PROCESSING) {
      throw new IllegalArgumentException("Cannot release a publication into PROCESSING");
    }
    int updated = StoreCalls.withConnection(connectionProvider, "release publication " + publicationId,
        conn -> store.release(conn, publicationId, finalStatus));
    if (updated == 0) {
      logger.warning("Release of publication " + publicationId + " updated no rows");
    }
  }
}
