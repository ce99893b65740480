package bahn.vision.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 캐시 오케스트레이션 외부 설정 프로퍼티
 *
 * <h4>TTL 규칙</h4>
 *
 * <ul>
 *   <li>0: 만료 없음 (음수는 기동 시 거부)
 *   <li>리소스별 ttl 미설정: {@code default-ttl}
 *   <li>리소스별 stale-ttl 미설정: stale 사본을 기록하지 않음
 * </ul>
 *
 * <p>{@code @ConfigurationProperties} + {@code @Validated}로 타입 안전 바인딩
 *
 * @see CacheConfig
 */
@Validated
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

  /** 원격 저장소 접속 URI (예: redis://localhost:6379/0) */
  @NotBlank private String remoteUri = "redis://localhost:6379/0";

  @NotNull private Duration defaultTtl = Duration.ofSeconds(30);

  /** 네거티브 캐시(not-found) TTL */
  @NotNull private Duration notFoundTtl = Duration.ofSeconds(15);

  /** Circuit Breaker Open 유지 시간 */
  @NotNull private Duration circuitBreakerCooldown = Duration.ofSeconds(2);

  /** 업스트림 fetch 최대 소요 시간. {@code singleflight.lock-ttl}보다 짧아야 함 */
  @NotNull private Duration fetchTimeout = Duration.ofSeconds(10);

  /** Fallback 저장소 만료 엔트리 정리 주기 */
  @NotNull private Duration fallbackSweepInterval = Duration.ofSeconds(60);

  @NotNull @Valid private Singleflight singleflight = new Singleflight();

  /**
   * 리소스별 TTL 설정
   *
   * <p>key: 캐시 이름 (mvg_departures, mvg_station_search, mvg_station_list, mvg_route)
   */
  @NotNull @Valid private Map<String, ResourceTtl> resources = new HashMap<>();

  @NotNull @Valid private RefreshExecutor refreshExecutor = new RefreshExecutor();

  @NotNull @Valid private Warmup warmup = new Warmup();

  public String getRemoteUri() {
    return remoteUri;
  }

  public void setRemoteUri(String remoteUri) {
    this.remoteUri = remoteUri;
  }

  public Duration getDefaultTtl() {
    return defaultTtl;
  }

  public void setDefaultTtl(Duration defaultTtl) {
    this.defaultTtl = defaultTtl;
  }

  public Duration getNotFoundTtl() {
    return notFoundTtl;
  }

  public void setNotFoundTtl(Duration notFoundTtl) {
    this.notFoundTtl = notFoundTtl;
  }

  public Duration getCircuitBreakerCooldown() {
    return circuitBreakerCooldown;
  }

  public void setCircuitBreakerCooldown(Duration circuitBreakerCooldown) {
    this.circuitBreakerCooldown = circuitBreakerCooldown;
  }

  public Duration getFetchTimeout() {
    return fetchTimeout;
  }

  public void setFetchTimeout(Duration fetchTimeout) {
    this.fetchTimeout = fetchTimeout;
  }

  public Duration getFallbackSweepInterval() {
    return fallbackSweepInterval;
  }

  public void setFallbackSweepInterval(Duration fallbackSweepInterval) {
    this.fallbackSweepInterval = fallbackSweepInterval;
  }

  public Singleflight getSingleflight() {
    return singleflight;
  }

  public void setSingleflight(Singleflight singleflight) {
    this.singleflight = singleflight;
  }

  /**
   * fetch 타임아웃이 락 TTL 안에 들어오는지 검증
   *
   * <p>락 TTL이 먼저 만료되면 진행 중인 fetch가 있는 상태에서 follower가 락을 재획득해 같은 키를 한 번 더 갱신합니다.
   */
  @AssertTrue(message = "cache.fetch-timeout must be shorter than cache.singleflight.lock-ttl")
  public boolean isFetchTimeoutWithinLockTtl() {
    if (fetchTimeout == null || singleflight == null || singleflight.getLockTtl() == null) {
      return true;
    }
    return fetchTimeout.compareTo(singleflight.getLockTtl()) < 0;
  }

  public Map<String, ResourceTtl> getResources() {
    return resources;
  }

  public void setResources(Map<String, ResourceTtl> resources) {
    this.resources = resources;
  }

  public RefreshExecutor getRefreshExecutor() {
    return refreshExecutor;
  }

  public void setRefreshExecutor(RefreshExecutor refreshExecutor) {
    this.refreshExecutor = refreshExecutor;
  }

  public Warmup getWarmup() {
    return warmup;
  }

  public void setWarmup(Warmup warmup) {
    this.warmup = warmup;
  }

  /** 리소스별 fresh / stale TTL */
  public static class ResourceTtl {

    private Duration ttl;

    private Duration staleTtl;

    public Duration getTtl() {
      return ttl;
    }

    public void setTtl(Duration ttl) {
      this.ttl = ttl;
    }

    public Duration getStaleTtl() {
      return staleTtl;
    }

    public void setStaleTtl(Duration staleTtl) {
      this.staleTtl = staleTtl;
    }
  }

  /**
   * Singleflight (분산 락) 설정
   *
   * <ul>
   *   <li>lockTtl: 락 최대 보유 시간 (holder 장애 시 deadman switch). fetch-timeout보다 길어야 함
   *   <li>lockWait: follower 최대 대기 시간
   *   <li>retryDelay: follower 폴링 간격
   * </ul>
   */
  public static class Singleflight {

    @NotNull private Duration lockTtl = Duration.ofSeconds(15);

    @NotNull private Duration lockWait = Duration.ofSeconds(5);

    @NotNull private Duration retryDelay = Duration.ofMillis(50);

    public Duration getLockTtl() {
      return lockTtl;
    }

    public void setLockTtl(Duration lockTtl) {
      this.lockTtl = lockTtl;
    }

    public Duration getLockWait() {
      return lockWait;
    }

    public void setLockWait(Duration lockWait) {
      this.lockWait = lockWait;
    }

    public Duration getRetryDelay() {
      return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
      this.retryDelay = retryDelay;
    }
  }

  /** 백그라운드 갱신 워커 풀 크기 */
  public static class RefreshExecutor {

    @Min(1)
    @Max(64)
    private int corePoolSize = 2;

    @Min(1)
    @Max(128)
    private int maxPoolSize = 4;

    @Min(0)
    @Max(10000)
    private int queueCapacity = 100;

    public int getCorePoolSize() {
      return corePoolSize;
    }

    public void setCorePoolSize(int corePoolSize) {
      this.corePoolSize = corePoolSize;
    }

    public int getMaxPoolSize() {
      return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }
  }

  /** 기동 시 캐시 워밍업 설정 */
  public static class Warmup {

    private boolean enabled = false;

    @NotNull private List<String> departureStations = new ArrayList<>();

    @Min(1)
    @Max(100)
    private int departureLimit = 10;

    @Min(0)
    private int departureOffset = 0;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public List<String> getDepartureStations() {
      return departureStations;
    }

    public void setDepartureStations(List<String> departureStations) {
      this.departureStations = departureStations;
    }

    public int getDepartureLimit() {
      return departureLimit;
    }

    public void setDepartureLimit(int departureLimit) {
      this.departureLimit = departureLimit;
    }

    public int getDepartureOffset() {
      return departureOffset;
    }

    public void setDepartureOffset(int departureOffset) {
      this.departureOffset = departureOffset;
    }
  }
}
