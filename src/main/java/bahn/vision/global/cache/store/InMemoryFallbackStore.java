package bahn.vision.global.cache.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * 원격 저장소 장애 시 사용하는 프로세스 로컬 저장소
 *
 * <h4>동작 규칙</h4>
 *
 * <ul>
 *   <li>모든 엔트리는 (value, 절대 만료 시각 | 없음) 쌍으로 저장
 *   <li>읽기 시점에 만료된 엔트리를 즉시 제거 (Lazy Eviction)
 *   <li>쓰기 시 만료 엔트리 일괄 정리. 최대 sweepInterval당 1회 (나머지는 스케줄러의 {@link #cleanupExpired()})
 *   <li>모든 연산은 단일 {@link ReentrantLock} 아래에서 실행
 * </ul>
 *
 * <p>크기 제한은 없습니다. 키 카디널리티가 유한한 경우에만 메모리 사용량이 유계입니다.
 */
@Slf4j
public class InMemoryFallbackStore implements KeyValueStore {

  static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(10);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Entry> entries = new HashMap<>();
  private final Clock clock;
  private final Duration sweepInterval;
  private Instant nextSweepAt;

  public InMemoryFallbackStore() {
    this(Clock.systemUTC());
  }

  public InMemoryFallbackStore(Clock clock) {
    this(clock, DEFAULT_SWEEP_INTERVAL);
  }

  public InMemoryFallbackStore(Clock clock, Duration sweepInterval) {
    this.clock = clock;
    this.sweepInterval = sweepInterval;
    this.nextSweepAt = clock.instant().plus(sweepInterval);
  }

  @Override
  public CompletableFuture<Optional<String>> get(String key) {
    return CompletableFuture.completedFuture(read(key));
  }

  @Override
  public CompletableFuture<Void> set(String key, String value, Duration ttl) {
    lock.lock();
    try {
      entries.put(key, new Entry(value, expiryOf(ttl)));
      Instant now = clock.instant();
      if (!now.isBefore(nextSweepAt)) {
        removeExpired(now);
      }
    } finally {
      lock.unlock();
    }
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public CompletableFuture<Boolean> setIfAbsent(String key, String value, Duration ttl) {
    lock.lock();
    try {
      Entry current = entries.get(key);
      if (current != null && !current.isExpired(clock.instant())) {
        return CompletableFuture.completedFuture(false);
      }
      entries.put(key, new Entry(value, expiryOf(ttl)));
      return CompletableFuture.completedFuture(true);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public CompletableFuture<Boolean> compareAndDelete(String key, String expected) {
    lock.lock();
    try {
      Entry current = entries.get(key);
      if (current == null
          || current.isExpired(clock.instant())
          || !Objects.equals(current.value(), expected)) {
        return CompletableFuture.completedFuture(false);
      }
      entries.remove(key);
      return CompletableFuture.completedFuture(true);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public CompletableFuture<Void> delete(String key) {
    lock.lock();
    try {
      entries.remove(key);
    } finally {
      lock.unlock();
    }
    return CompletableFuture.completedFuture(null);
  }

  /**
   * 만료된 엔트리 일괄 정리
   *
   * @return 제거된 엔트리 수
   */
  public int cleanupExpired() {
    lock.lock();
    try {
      int removed = removeExpired(clock.instant());
      if (removed > 0) {
        log.debug("[FallbackStore] Expired entries removed: {}", removed);
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  /** 현재 보관 중인 엔트리 수 (만료 대기 엔트리 포함) */
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  private Optional<String> read(String key) {
    lock.lock();
    try {
      Entry entry = entries.get(key);
      if (entry == null) {
        return Optional.empty();
      }
      if (entry.isExpired(clock.instant())) {
        entries.remove(key);
        return Optional.empty();
      }
      return Optional.of(entry.value());
    } finally {
      lock.unlock();
    }
  }

  private int removeExpired(Instant now) {
    nextSweepAt = now.plus(sweepInterval);
    int before = entries.size();
    entries.values().removeIf(entry -> entry.isExpired(now));
    return before - entries.size();
  }

  private Instant expiryOf(Duration ttl) {
    return KeyValueStore.expires(ttl) ? clock.instant().plus(ttl) : null;
  }

  private record Entry(String value, Instant expiresAt) {

    boolean isExpired(Instant now) {
      return expiresAt != null && !now.isBefore(expiresAt);
    }
  }
}
