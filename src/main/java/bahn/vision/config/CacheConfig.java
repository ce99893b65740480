package bahn.vision.config;

import bahn.vision.global.cache.CacheCircuitBreaker;
import bahn.vision.global.cache.CacheEntryStore;
import bahn.vision.global.cache.CacheTtl;
import bahn.vision.global.cache.CacheTtlConfig;
import bahn.vision.global.cache.store.InMemoryFallbackStore;
import bahn.vision.global.cache.store.KeyValueStore;
import bahn.vision.global.cache.store.RedisKeyValueStore;
import bahn.vision.global.cache.store.RedissonConnector;
import bahn.vision.global.cache.store.ResilientKeyValueStore;
import bahn.vision.global.executor.LogicExecutor;
import bahn.vision.global.lock.SingleFlightLock;
import bahn.vision.global.lock.StoreBackedSingleFlightLock;
import bahn.vision.service.cache.BackgroundRefreshScheduler;
import bahn.vision.service.cache.CacheMetrics;
import bahn.vision.service.cache.CacheOrchestrator;
import bahn.vision.service.cache.MicrometerCacheMetrics;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 캐시 오케스트레이션 빈 구성
 *
 * <h4>저장소 계층</h4>
 *
 * <pre>
 * CacheEntryStore ─▶ ResilientKeyValueStore ─┬─▶ CacheCircuitBreaker ─▶ RedisKeyValueStore
 *                                            └─▶ InMemoryFallbackStore
 * </pre>
 *
 * <p>오케스트레이터는 명시적으로 주입되는 단일 인스턴스이며, 컨텍스트 종료 시 {@link CacheOrchestrator#shutdown()}이 호출됩니다.
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfig {

  static final String REMOTE_BREAKER_NAME = "remote-cache";

  @Bean
  public InMemoryFallbackStore inMemoryFallbackStore() {
    return new InMemoryFallbackStore();
  }

  @Bean
  public CacheCircuitBreaker remoteCacheCircuitBreaker(CacheProperties cacheProperties) {
    return new CacheCircuitBreaker(
        REMOTE_BREAKER_NAME, cacheProperties.getCircuitBreakerCooldown());
  }

  @Bean
  public KeyValueStore cacheKeyValueStore(
      RedissonConnector redissonConnector,
      InMemoryFallbackStore inMemoryFallbackStore,
      CacheCircuitBreaker remoteCacheCircuitBreaker) {
    return new ResilientKeyValueStore(
        new RedisKeyValueStore(redissonConnector),
        inMemoryFallbackStore,
        remoteCacheCircuitBreaker);
  }

  /** 스키마 불일치 엔트리를 미스로 취급하기 위해 알 수 없는 필드를 거부하는 전용 ObjectMapper 사용 */
  @Bean
  public CacheEntryStore cacheEntryStore(
      KeyValueStore cacheKeyValueStore, ObjectMapper objectMapper, LogicExecutor logicExecutor) {
    ObjectMapper cacheMapper =
        objectMapper.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    return new CacheEntryStore(cacheKeyValueStore, cacheMapper, logicExecutor);
  }

  @Bean
  public SingleFlightLock singleFlightLock(
      KeyValueStore cacheKeyValueStore, CacheProperties cacheProperties) {
    return new StoreBackedSingleFlightLock(
        cacheKeyValueStore, cacheProperties.getSingleflight().getLockTtl());
  }

  @Bean
  public CacheTtlConfig cacheTtlConfig(CacheProperties cacheProperties) {
    return toTtlConfig(cacheProperties);
  }

  @Bean
  public CacheMetrics cacheMetrics(MeterRegistry meterRegistry) {
    return new MicrometerCacheMetrics(meterRegistry);
  }

  @Bean
  public BackgroundRefreshScheduler backgroundRefreshScheduler(
      @Qualifier("cacheRefreshExecutor") ThreadPoolTaskExecutor cacheRefreshExecutor,
      CacheMetrics cacheMetrics) {
    return new BackgroundRefreshScheduler(cacheRefreshExecutor, cacheMetrics);
  }

  @Bean(destroyMethod = "shutdown")
  public CacheOrchestrator cacheOrchestrator(
      CacheEntryStore cacheEntryStore,
      SingleFlightLock singleFlightLock,
      BackgroundRefreshScheduler backgroundRefreshScheduler,
      CacheTtlConfig cacheTtlConfig,
      CacheMetrics cacheMetrics,
      TimeLimiter upstreamFetchTimeLimiter,
      @Qualifier("cacheScheduler") ScheduledExecutorService cacheScheduler,
      CacheProperties cacheProperties) {
    return CacheOrchestrator.builder()
        .entryStore(cacheEntryStore)
        .lock(singleFlightLock)
        .backgroundScheduler(backgroundRefreshScheduler)
        .ttlConfig(cacheTtlConfig)
        .metrics(cacheMetrics)
        .fetchTimeLimiter(upstreamFetchTimeLimiter)
        .scheduler(cacheScheduler)
        .lockWait(cacheProperties.getSingleflight().getLockWait())
        .retryDelay(cacheProperties.getSingleflight().getRetryDelay())
        .build();
  }

  static CacheTtlConfig toTtlConfig(CacheProperties cacheProperties) {
    Map<String, CacheTtl> resources = new HashMap<>();
    cacheProperties
        .getResources()
        .forEach(
            (name, resource) ->
                resources.put(name, new CacheTtl(resource.getTtl(), resource.getStaleTtl())));
    return new CacheTtlConfig(
        cacheProperties.getDefaultTtl(), cacheProperties.getNotFoundTtl(), resources);
  }
}
