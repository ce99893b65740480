package bahn.vision.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfig {

  /** 업스트림 fetch 시간 상한 (초과 시 TimeoutException → TIMEOUT 분류) */
  @Bean
  public TimeLimiter upstreamFetchTimeLimiter(CacheProperties cacheProperties) {
    TimeLimiterConfig config =
        TimeLimiterConfig.custom()
            .timeoutDuration(cacheProperties.getFetchTimeout())
            .cancelRunningFuture(true)
            .build();

    TimeLimiterRegistry registry = TimeLimiterRegistry.of(config);
    return registry.timeLimiter("upstreamFetch");
  }
}
