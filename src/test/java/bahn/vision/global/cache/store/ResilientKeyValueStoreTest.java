package bahn.vision.global.cache.store;

import static org.assertj.core.api.Assertions.assertThat;

import bahn.vision.global.cache.CacheCircuitBreaker;
import bahn.vision.support.FailingKeyValueStore;
import bahn.vision.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ResilientKeyValueStoreTest {

  private static final Duration TTL = Duration.ofSeconds(30);

  private MutableClock clock;
  private InMemoryFallbackStore remote;
  private InMemoryFallbackStore fallback;
  private CacheCircuitBreaker breaker;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingNow();
    remote = new InMemoryFallbackStore(clock);
    fallback = new InMemoryFallbackStore(clock);
    breaker = new CacheCircuitBreaker("remote-cache", Duration.ofSeconds(2), clock);
  }

  @Nested
  @DisplayName("원격 저장소 정상")
  class HealthyRemoteTest {

    @Test
    @DisplayName("쓰기는 원격과 fallback 양쪽에 기록")
    void shouldMirrorWritesToFallback() {
      ResilientKeyValueStore store = new ResilientKeyValueStore(remote, fallback, breaker);

      store.set("k", "v", TTL).join();

      assertThat(remote.get("k").join()).contains("v");
      assertThat(fallback.get("k").join()).contains("v");
    }

    @Test
    @DisplayName("원격에 없으면 fallback 값 반환")
    void shouldReadFallbackWhenRemoteMisses() {
      ResilientKeyValueStore store = new ResilientKeyValueStore(remote, fallback, breaker);
      fallback.set("k", "local", TTL).join();

      assertThat(store.get("k").join()).contains("local");
    }

    @Test
    @DisplayName("SET NX는 원격에서만 판정")
    void setIfAbsentShouldUseRemoteOnly() {
      ResilientKeyValueStore store = new ResilientKeyValueStore(remote, fallback, breaker);

      assertThat(store.setIfAbsent("lock", "a", TTL).join()).isTrue();
      assertThat(store.setIfAbsent("lock", "b", TTL).join()).isFalse();
      assertThat(fallback.get("lock").join()).isEmpty();
    }

    @Test
    @DisplayName("삭제는 양쪽 모두에서 수행")
    void deleteShouldRemoveFromBoth() {
      ResilientKeyValueStore store = new ResilientKeyValueStore(remote, fallback, breaker);
      store.set("k", "v", TTL).join();

      store.delete("k").join();

      assertThat(remote.get("k").join()).isEmpty();
      assertThat(fallback.get("k").join()).isEmpty();
    }
  }

  @Nested
  @DisplayName("원격 저장소 장애")
  class FailingRemoteTest {

    @Test
    @DisplayName("원격 장애 중에도 직전에 기록한 값을 fallback에서 제공")
    void shouldServeFromFallbackDuringOutage() {
      FailingKeyValueStore failing = new FailingKeyValueStore(false);
      ResilientKeyValueStore store = new ResilientKeyValueStore(failing, fallback, breaker);

      store.set("k", "v", TTL).join();

      assertThat(store.get("k").join()).contains("v");
      assertThat(breaker.isOpen()).isTrue();
    }

    @Test
    @DisplayName("동기 예외를 던지는 원격도 예외 없이 흡수")
    void shouldAbsorbSynchronousFailures() {
      FailingKeyValueStore failing = new FailingKeyValueStore(true);
      ResilientKeyValueStore store = new ResilientKeyValueStore(failing, fallback, breaker);

      store.set("k", "v", TTL).join();
      store.delete("missing").join();

      assertThat(store.get("k").join()).contains("v");
    }

    @Test
    @DisplayName("원격 장애 시 SET NX는 fallback에서 로컬 상호 배제")
    void setIfAbsentShouldFallBackToLocalStore() {
      ResilientKeyValueStore store =
          new ResilientKeyValueStore(new FailingKeyValueStore(false), fallback, breaker);

      assertThat(store.setIfAbsent("lock", "a", TTL).join()).isTrue();
      assertThat(store.setIfAbsent("lock", "b", TTL).join()).isFalse();
      assertThat(store.compareAndDelete("lock", "a").join()).isTrue();
    }
  }
}
