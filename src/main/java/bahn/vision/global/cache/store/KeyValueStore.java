package bahn.vision.global.cache.store;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 비동기 문자열 Key-Value 저장소 추상화
 *
 * <p>"키 없음"은 예외가 아니라 {@link Optional#empty()}로 표현합니다. 반환된 Future가 예외로 완료되는 경우는 전송 계층 장애뿐이며, 호출자({@link
 * bahn.vision.global.cache.CacheCircuitBreaker})는 이를 장애 신호로 해석합니다.
 *
 * <h4>TTL 규칙</h4>
 *
 * <ul>
 *   <li>{@code null} 또는 0 이하: 만료 없음
 *   <li>양수: 해당 기간 후 저장소가 자동 만료
 * </ul>
 */
public interface KeyValueStore {

  CompletableFuture<Optional<String>> get(String key);

  CompletableFuture<Void> set(String key, String value, Duration ttl);

  /**
   * 키가 없을 때만 저장 (SET NX)
   *
   * @return 저장에 성공하면 true
   */
  CompletableFuture<Boolean> setIfAbsent(String key, String value, Duration ttl);

  /**
   * 현재 값이 expected와 같을 때만 삭제
   *
   * @return 삭제에 성공하면 true
   */
  CompletableFuture<Boolean> compareAndDelete(String key, String expected);

  CompletableFuture<Void> delete(String key);

  /** 만료 기간이 양수인지 확인 */
  static boolean expires(Duration ttl) {
    return ttl != null && !ttl.isZero() && !ttl.isNegative();
  }
}
