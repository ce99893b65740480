package bahn.vision.service.cache;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class MicrometerCacheMetricsTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final MicrometerCacheMetrics metrics = new MicrometerCacheMetrics(registry);

  @Test
  @DisplayName("이벤트는 cache/event 태그 카운터로 누적")
  void recordEventCountsByTags() {
    metrics.recordEvent("mvg_departures", CacheEvent.STALE_RETURN);
    metrics.recordEvent("mvg_departures", CacheEvent.STALE_RETURN);
    metrics.recordEvent("mvg_route", CacheEvent.STALE_RETURN);

    assertThat(
            registry
                .get(MicrometerCacheMetrics.EVENTS_METRIC)
                .tags("cache", "mvg_departures", "event", "stale_return")
                .counter()
                .count())
        .isEqualTo(2);
  }

  @Test
  @DisplayName("갱신 지연은 캐시별 타이머로 기록")
  void observeLatencyRecordsTimer() {
    metrics.observeLatency("mvg_departures", Duration.ofMillis(250));

    assertThat(
            registry
                .get(MicrometerCacheMetrics.REFRESH_METRIC)
                .tag("cache", "mvg_departures")
                .timer()
                .totalTime(TimeUnit.MILLISECONDS))
        .isEqualTo(250.0);
  }
}
