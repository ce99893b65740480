package bahn.vision.global.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

import bahn.vision.global.cache.store.InMemoryFallbackStore;
import bahn.vision.global.cache.store.KeyValueStore;
import bahn.vision.support.MutableClock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

@Tag("unit")
class StoreBackedSingleFlightLockTest {

  private MutableClock clock;
  private InMemoryFallbackStore store;
  private StoreBackedSingleFlightLock lock;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingNow();
    store = new InMemoryFallbackStore(clock);
    lock = new StoreBackedSingleFlightLock(store, Duration.ofSeconds(5));
  }

  @Test
  @DisplayName("락 키는 캐시 키 + \":lock\"")
  void lockKeyUsesSuffix() {
    LockToken token = lock.tryAcquire("mvg:stations:all").join().orElseThrow();

    assertThat(token.lockKey()).isEqualTo("mvg:stations:all:lock");
    assertThat(store.get("mvg:stations:all:lock").join()).contains(token.holder());
  }

  @Test
  @DisplayName("보유 중인 락은 다른 호출자가 획득할 수 없음")
  void heldLockIsExclusive() {
    Optional<LockToken> first = lock.tryAcquire("k").join();
    Optional<LockToken> second = lock.tryAcquire("k").join();

    assertThat(first).isPresent();
    assertThat(second).isEmpty();
  }

  @Test
  @DisplayName("해제 후 재획득 가능")
  void releasedLockCanBeReacquired() {
    LockToken token = lock.tryAcquire("k").join().orElseThrow();

    assertThat(lock.release(token).join()).isTrue();
    assertThat(lock.tryAcquire("k").join()).isPresent();
  }

  @Test
  @DisplayName("소유자가 해제하지 않아도 최대 보유 시간 후 자동 해제")
  void lockExpiresAfterMaxHold() {
    lock.tryAcquire("k").join();

    clock.advance(Duration.ofSeconds(5));

    assertThat(lock.tryAcquire("k").join()).isPresent();
  }

  @Test
  @DisplayName("만료 후 다른 소유자가 잡은 락은 이전 소유자가 지우지 않음")
  void staleHolderCannotReleaseNewOwnersLock() {
    LockToken expired = lock.tryAcquire("k").join().orElseThrow();
    clock.advance(Duration.ofSeconds(5));
    LockToken current = lock.tryAcquire("k").join().orElseThrow();

    assertThat(lock.release(expired).join()).isFalse();
    assertThat(store.get(current.lockKey()).join()).contains(current.holder());
  }

  @Test
  @DisplayName("최대 보유 시간은 최소 1초")
  void maxHoldHasLowerBound() {
    StoreBackedSingleFlightLock shortLock =
        new StoreBackedSingleFlightLock(store, Duration.ofMillis(100));

    assertThat(shortLock.getMaxHold()).isEqualTo(Duration.ofSeconds(1));
  }

  @Test
  @DisplayName("SET NX 호출 자체가 실패하면 획득한 것으로 간주")
  void setIfAbsentFailureProceedsAsHolder() {
    KeyValueStore broken = Mockito.mock(KeyValueStore.class);
    given(broken.setIfAbsent(anyString(), anyString(), any()))
        .willReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
    given(broken.compareAndDelete(anyString(), anyString()))
        .willReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
    StoreBackedSingleFlightLock brokenLock =
        new StoreBackedSingleFlightLock(broken, Duration.ofSeconds(5));

    Optional<LockToken> token = brokenLock.tryAcquire("k").join();

    assertThat(token).isPresent();
    assertThat(brokenLock.release(token.get()).join()).isFalse();
  }
}
