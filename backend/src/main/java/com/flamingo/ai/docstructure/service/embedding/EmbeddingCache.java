package com.flamingo.ai.docstructure.service.embedding;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL cache of embedding vectors keyed by the embedded text.
 *
 * <p>Owned by whoever creates it and handed to the enricher explicitly; there is no shared
 * instance. Safe for concurrent use by the embedding fan-out. Expired entries are dropped on read
 * and by {@link #evictExpired()}.
 */
public class EmbeddingCache {

  private record Entry(float[] vector, Instant expiresAt) {}

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  public EmbeddingCache(Duration ttl, Clock clock) {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("Cache TTL must be positive, got " + ttl);
    }
    this.ttl = ttl;
    this.clock = clock;
  }

  public Optional<float[]> get(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (!clock.instant().isBefore(entry.expiresAt())) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry.vector());
  }

  public void put(String key, float[] vector) {
    entries.put(key, new Entry(vector, clock.instant().plus(ttl)));
  }

  /**
   * Removes every expired entry.
   *
   * @return number of entries removed
   */
  public int evictExpired() {
    Instant now = clock.instant();
    int before = entries.size();
    entries.values().removeIf(entry -> !now.isBefore(entry.expiresAt()));
    return before - entries.size();
  }

  public int size() {
    return entries.size();
  }

  public void clear() {
    entries.clear();
  }
}
