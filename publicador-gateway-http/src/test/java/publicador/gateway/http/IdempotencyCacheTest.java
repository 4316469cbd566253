package publicador.gateway.http;

import org.junit.jupiter.api.Test;
import publicador.gateway.PublishReceipt;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class IdempotencyCacheTest {

  private static final PublishReceipt RECEIPT = new PublishReceipt("u", Instant.EPOCH);

  /** Clock that only moves when told to. */
  private static final class MutableClock extends Clock {
    private Instant now = Instant.parse("2026-03-01T00:00:00Z");

    void advance(Duration d) {
      now = now.plus(d);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  @Test
  void entryLivesForTtl() {
    MutableClock clock = new MutableClock();
    IdempotencyCache cache = new IdempotencyCache(Duration.ofMinutes(10), clock);

    cache.put("k", RECEIPT);
    clock.advance(Duration.ofMinutes(9));
    assertSame(RECEIPT, cache.get("k"));

    clock.advance(Duration.ofMinutes(1));
    assertNull(cache.get("k"));
    assertEquals(0, cache.size());
  }

  @Test
  void zeroTtlDisablesCaching() {
    IdempotencyCache cache = new IdempotencyCache(Duration.ZERO, new MutableClock());

    cache.put("k", RECEIPT);

    assertNull(cache.get("k"));
    assertEquals(0, cache.size());
  }

  @Test
  void nullKeyIsNeverCached() {
    IdempotencyCache cache = new IdempotencyCache(Duration.ofMinutes(1), new MutableClock());

    cache.put(null, RECEIPT);

    assertNull(cache.get(null));
  }

  @Test
  void expiredEntriesAreReclaimedOnWrite() {
    MutableClock clock = new MutableClock();
    IdempotencyCache cache = new IdempotencyCache(Duration.ofSeconds(1), clock);
    for (int i = 0; i < 10; i++) {
      cache.put("old-" + i, RECEIPT);
    }
    clock.advance(Duration.ofSeconds(5));

    for (int i = 0; i < 256; i++) {
      cache.put("new-" + i, RECEIPT);
    }

    assertEquals(256, cache.size());
  }
}
