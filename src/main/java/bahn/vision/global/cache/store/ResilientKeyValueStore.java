package bahn.vision.global.cache.store;

import static java.util.concurrent.CompletableFuture.completedFuture;

import bahn.vision.global.cache.CacheCircuitBreaker;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;

/**
 * 원격 저장소 + 로컬 Fallback 2-Tier 저장소
 *
 * <h4>읽기</h4>
 *
 * <p>원격 저장소(Circuit Breaker 보호) → 없거나 장애면 로컬 Fallback
 *
 * <h4>쓰기</h4>
 *
 * <p>원격 저장소(Circuit Breaker 보호)에 기록하고 로컬 Fallback에도 항상 미러링합니다. 원격 장애 중에도 직전에 기록된 데이터를 계속 제공하기
 * 위함입니다.
 *
 * <h4>SET NX</h4>
 *
 * <p>원격이 정상이면 원격에서만 판정하고, Open 상태이거나 호출이 실패하면 로컬 Fallback에서 판정합니다. 이 경우 단일 프로세스 안에서만 상호 배제가
 * 보장됩니다.
 *
 * <p>백엔드 장애는 모두 Circuit Breaker가 흡수하므로 이 저장소의 Future는 예외로 완료되지 않습니다.
 */
@RequiredArgsConstructor
public class ResilientKeyValueStore implements KeyValueStore {

  private final KeyValueStore remote;
  private final InMemoryFallbackStore fallback;
  private final CacheCircuitBreaker circuitBreaker;

  @Override
  public CompletableFuture<Optional<String>> get(String key) {
    return circuitBreaker
        .execute("get", () -> remote.get(key), CacheFutures::emptyValue)
        .thenCompose(value -> value.isPresent() ? completedFuture(value) : fallback.get(key));
  }

  @Override
  public CompletableFuture<Void> set(String key, String value, Duration ttl) {
    return circuitBreaker
        .execute("set", () -> remote.set(key, value, ttl), CacheFutures::done)
        .thenCompose(ignored -> fallback.set(key, value, ttl));
  }

  @Override
  public CompletableFuture<Boolean> setIfAbsent(String key, String value, Duration ttl) {
    return circuitBreaker.execute(
        "setIfAbsent",
        () -> remote.setIfAbsent(key, value, ttl),
        () -> fallback.setIfAbsent(key, value, ttl));
  }

  @Override
  public CompletableFuture<Boolean> compareAndDelete(String key, String expected) {
    CompletableFuture<Boolean> remoteResult =
        circuitBreaker.execute(
            "compareAndDelete",
            () -> remote.compareAndDelete(key, expected),
            () -> completedFuture(false));
    return remoteResult.thenCombine(
        fallback.compareAndDelete(key, expected),
        (remoteDeleted, localDeleted) -> remoteDeleted || localDeleted);
  }

  @Override
  public CompletableFuture<Void> delete(String key) {
    return circuitBreaker
        .execute("delete", () -> remote.delete(key), CacheFutures::done)
        .thenCompose(ignored -> fallback.delete(key));
  }
}
