package publicador.util;

import org.junit.jupiter.api.Test;
import publicador.PublicationStoreException;
import publicador.testing.StubConnections;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class StoreCallsTest {

  @Test
  void returnsCallResult() {
    StubConnections connections = new StubConnections();

    int result = StoreCalls.withConnection(connections, "count", conn -> 42);

    assertEquals(42, result);
    assertEquals(1, connections.opened.get());
  }

  @Test
  void wrapsConnectionFailure() {
    PublicationStoreException e = assertThrows(PublicationStoreException.class,
        () -> StoreCalls.withConnection(() -> {
          throw new SQLException("pool exhausted");
        }, "load publication p1", conn -> 1));

    assertEquals("Failed to load publication p1", e.getMessage());
    assertInstanceOf(SQLException.class, e.getCause());
  }
}
