package publicador.util;

import publicador.PublicationStoreException;
import publicador.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs a single auto-committed store operation on a fresh connection.
 */
public final class StoreCalls {

  @FunctionalInterface
  public interface StoreCall<T> {
    T execute(Connection conn);
  }

  /**
   * Obtains a connection, switches it to auto-commit, runs {@code call} and closes the
   * connection. A failure to obtain or close the connection surfaces as a
   * {@link PublicationStoreException} naming {@code action}.
   */
  public static <T> T withConnection(ConnectionProvider connectionProvider, String action, StoreCall<T> call) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return call.execute(conn);
    } catch (SQLException e) {
      throw new PublicationStoreException("Failed to " + action, e);
    }
  }

  private StoreCalls() {}
}
