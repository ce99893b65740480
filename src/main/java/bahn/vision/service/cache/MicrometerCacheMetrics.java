package bahn.vision.service.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import lombok.RequiredArgsConstructor;

/**
 * Micrometer 기반 캐시 메트릭
 *
 * <ul>
 *   <li>{@code bahnvision.cache.events{cache, event}} - Counter
 *   <li>{@code bahnvision.cache.refresh{cache}} - Timer
 * </ul>
 *
 * <p>태그는 캐시 이름과 고정 이벤트 집합만 사용합니다 (캐시 키는 태그에 넣지 않음).
 */
@RequiredArgsConstructor
public class MicrometerCacheMetrics implements CacheMetrics {

  static final String EVENTS_METRIC = "bahnvision.cache.events";
  static final String REFRESH_METRIC = "bahnvision.cache.refresh";

  private final MeterRegistry meterRegistry;

  @Override
  public void recordEvent(String cacheName, CacheEvent event) {
    Counter.builder(EVENTS_METRIC)
        .description("Cache events by cache name")
        .tag("cache", cacheName)
        .tag("event", event.value())
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void observeLatency(String cacheName, Duration elapsed) {
    Timer.builder(REFRESH_METRIC)
        .description("Cache refresh duration (fetch + store)")
        .tag("cache", cacheName)
        .register(meterRegistry)
        .record(elapsed);
  }
}
