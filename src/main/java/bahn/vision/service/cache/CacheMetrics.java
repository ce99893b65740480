package bahn.vision.service.cache;

import java.time.Duration;

/**
 * 캐시 메트릭 수집 포트
 *
 * <p>hit/miss/stale/error 전이마다 {@link #recordEvent}, 갱신(fetch + store) 소요 시간마다 {@link #observeLatency}가
 * 호출됩니다.
 */
public interface CacheMetrics {

  void recordEvent(String cacheName, CacheEvent event);

  void observeLatency(String cacheName, Duration elapsed);
}
