package com.flamingo.ai.docstructure.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EmbeddingCache Tests")
class EmbeddingCacheTest {

  /** Clock that only moves when told to. */
  private static final class MutableClock extends Clock {
    private Instant now = Instant.parse("2024-01-01T00:00:00Z");

    void advance(Duration duration) {
      now = now.plus(duration);
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

  private MutableClock clock;
  private EmbeddingCache cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    cache = new EmbeddingCache(Duration.ofMinutes(10), clock);
  }

  @Test
  @DisplayName("should return a stored vector before it expires")
  void shouldReturnVector_beforeExpiry() {
    float[] vector = {0.1f, 0.2f};
    cache.put("text:chair", vector);
    clock.advance(Duration.ofMinutes(9));

    assertThat(cache.get("text:chair")).containsSame(vector);
  }

  @Test
  @DisplayName("should drop an entry once its TTL has elapsed")
  void shouldDropEntry_afterTtl() {
    cache.put("text:chair", new float[] {1f});
    clock.advance(Duration.ofMinutes(10));

    assertThat(cache.get("text:chair")).isEmpty();
    assertThat(cache.size()).isZero();
  }

  @Test
  @DisplayName("should evict only expired entries")
  void shouldEvictOnlyExpiredEntries() {
    cache.put("old", new float[] {1f});
    clock.advance(Duration.ofMinutes(6));
    cache.put("new", new float[] {2f});
    clock.advance(Duration.ofMinutes(5));

    assertThat(cache.evictExpired()).isEqualTo(1);
    assertThat(cache.get("old")).isEmpty();
    assertThat(cache.get("new")).isPresent();
  }

  @Test
  @DisplayName("should return empty for an unknown key")
  void shouldReturnEmpty_forUnknownKey() {
    assertThat(cache.get("missing")).isEmpty();
  }

  @Test
  @DisplayName("should reject a non-positive TTL")
  void shouldRejectNonPositiveTtl() {
    assertThatThrownBy(() -> new EmbeddingCache(Duration.ZERO, clock))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new EmbeddingCache(Duration.ofSeconds(-1), clock))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
