package publicador.gateway.http;

import publicador.gateway.PublishReceipt;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Remembers successful receipts by idempotency key for a fixed time-to-live.
 *
 * <p>Expired entries are ignored on lookup and reclaimed lazily every few hundred writes.
 * A zero TTL disables the cache.
 *
 * <p>This class is thread-safe.
 */
final class IdempotencyCache {
  private final Map<String, Entry> receipts = new ConcurrentHashMap<>();
  private final long ttlMs;
  private final Clock clock;
  private final AtomicInteger evictCounter = new AtomicInteger();

  IdempotencyCache(Duration ttl, Clock clock) {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must not be negative");
    }
    this.ttlMs = ttl.toMillis();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  PublishReceipt get(String key) {
    if (ttlMs == 0 || key == null) {
      return null;
    }
    Entry entry = receipts.get(key);
    if (entry == null) {
      return null;
    }
    if (entry.expiresAtMs <= clock.millis()) {
      receipts.remove(key, entry);
      return null;
    }
    return entry.receipt;
  }

  void put(String key, PublishReceipt receipt) {
    if (ttlMs == 0 || key == null) {
      return;
    }
    long now = clock.millis();
    receipts.put(key, new Entry(receipt, now + ttlMs));
    maybeEvictExpired(now);
  }

  int size() {
    return receipts.size();
  }

  private void maybeEvictExpired(long now) {
    if ((evictCounter.incrementAndGet() & 0xFF) != 0) return;
    receipts.values().removeIf(e -> e.expiresAtMs <= now);
  }

  private record Entry(PublishReceipt receipt, long expiresAtMs) {
  }
}
