package bahn.vision.global.lock;

import bahn.vision.global.cache.store.KeyValueStore;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * 저장소 SET NX 기반 singleflight 락
 *
 * <h4>락 구조</h4>
 *
 * <ul>
 *   <li>락 키: {@code key + ":lock"}
 *   <li>값: 소유자 토큰 (UUID)
 *   <li>TTL: {@code max(1초, maxHold)}. 소유자가 갱신 도중 죽어도 TTL 경과 후 자동 해제 (deadman switch)
 * </ul>
 *
 * <p>해제는 compare-and-delete로 수행하므로 TTL 만료 후 다른 소유자가 획득한 락을 지우지 않습니다.
 *
 * <p>SET NX 호출 자체가 실패하면 락을 획득한 것으로 간주합니다.
 */
@Slf4j
public class StoreBackedSingleFlightLock implements SingleFlightLock {

  public static final String LOCK_SUFFIX = ":lock";

  private static final Duration MIN_HOLD = Duration.ofSeconds(1);

  private final KeyValueStore store;
  private final Duration maxHold;

  public StoreBackedSingleFlightLock(KeyValueStore store, Duration maxHold) {
    this.store = store;
    this.maxHold = maxHold.compareTo(MIN_HOLD) < 0 ? MIN_HOLD : maxHold;
  }

  public static String lockKey(String key) {
    return key + LOCK_SUFFIX;
  }

  @Override
  public CompletableFuture<Optional<LockToken>> tryAcquire(String key) {
    LockToken token = new LockToken(key, lockKey(key), UUID.randomUUID().toString());
    return store
        .setIfAbsent(token.lockKey(), token.holder(), maxHold)
        .exceptionally(
            e -> {
              log.warn(
                  "[SingleFlightLock] SET NX failed, proceeding as holder: {} ({})",
                  token.lockKey(),
                  e.toString());
              return true;
            })
        .thenApply(acquired -> onAttempt(token, acquired));
  }

  @Override
  public CompletableFuture<Boolean> release(LockToken token) {
    return store
        .compareAndDelete(token.lockKey(), token.holder())
        .thenApply(
            released -> {
              if (!released) {
                log.debug(
                    "[SingleFlightLock] Lock already expired or taken over: {}", token.lockKey());
              }
              return released;
            })
        .exceptionally(
            e -> {
              log.warn(
                  "[SingleFlightLock] Release failed, lock expires by TTL: {} ({})",
                  token.lockKey(),
                  e.toString());
              return false;
            });
  }

  public Duration getMaxHold() {
    return maxHold;
  }

  private Optional<LockToken> onAttempt(LockToken token, boolean acquired) {
    if (!acquired) {
      return Optional.empty();
    }
    log.debug("[SingleFlightLock] Acquired: {}", token.lockKey());
    return Optional.of(token);
  }
}
