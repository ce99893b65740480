package bahn.vision.service.cache;

import bahn.vision.global.cache.CacheEntryStore;
import bahn.vision.global.cache.CacheTtlConfig;
import java.util.concurrent.CompletableFuture;

/**
 * 리소스 유형별 캐시 갱신 전략
 *
 * <p>오케스트레이터는 이 인터페이스에만 의존합니다. 구현체는 락이나 Circuit Breaker를 직접 다루지 않습니다.
 *
 * <ul>
 *   <li>{@link #fetch}: 업스트림/DB 호출. 실패는 예외로 완료된 Future로 표현
 *   <li>{@link #store}: fresh + stale 엔트리 기록 (필요 시 저장소 write-through)
 *   <li>{@link #cacheName}: 메트릭 라벨, TTL 설정 키
 *   <li>{@link #resultType}: 캐시 적중 값 검증용 타입 (배포 후 스키마 변경 감지)
 * </ul>
 *
 * @param <P> 요청 파라미터 타입
 * @param <T> 캐시 값 타입
 */
public interface CacheRefreshProtocol<P, T> {

  String cacheName();

  Class<T> resultType();

  /**
   * 요청 파라미터로 캐시 키 생성
   *
   * <p>의미가 같은 요청은 항상 바이트 단위로 동일한 키를 생성해야 합니다.
   */
  String cacheKey(P params);

  CompletableFuture<T> fetch(P params);

  default CompletableFuture<Void> store(
      CacheEntryStore entries, String key, T value, CacheTtlConfig ttlConfig) {
    return entries.write(key, value, ttlConfig.resolve(cacheName()));
  }
}
