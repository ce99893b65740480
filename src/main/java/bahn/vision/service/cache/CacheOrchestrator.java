package bahn.vision.service.cache;

import bahn.vision.global.cache.CacheEntryStore;
import bahn.vision.global.cache.CacheTtlConfig;
import bahn.vision.global.cache.CachedPayload;
import bahn.vision.global.error.exception.InternalSystemException;
import bahn.vision.global.error.exception.base.BaseException;
import bahn.vision.global.lock.LockToken;
import bahn.vision.global.lock.SingleFlightLock;
import io.github.resilience4j.timelimiter.TimeLimiter;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Stale-While-Revalidate 캐시 오케스트레이터
 *
 * <h3>조회 흐름</h3>
 *
 * <ol>
 *   <li><b>Fresh 확인</b>: fresh 엔트리가 있고 기대 타입으로 변환되면 즉시 HIT (락/업스트림 호출 없음)
 *   <li><b>Stale 확인</b>: stale 사본이 있으면 백그라운드 갱신을 1회 예약하고 즉시 STALE_REFRESH
 *   <li><b>동기 갱신</b>: 둘 다 없으면 singleflight 락 획득 시도
 *       <ul>
 *         <li>Leader: fetch → store → 락 해제 → HIT
 *         <li>Follower: retryDelay 간격으로 폴링하며 fresh 엔트리 출현 또는 락 해제(재획득)를 대기.
 *             lockWait 초과 시 stale 재확인 후 MISS
 *       </ul>
 *   <li><b>실패 처리</b>:
 *       <ul>
 *         <li>NOT_FOUND: notFoundTtl 동안 네거티브 캐싱 후 NOT_FOUND
 *         <li>UPSTREAM_ERROR / TIMEOUT: stale 사본이 있으면 STALE, 없으면 ERROR
 *         <li>저장소 장애: Circuit Breaker가 흡수하여 빈 캐시처럼 동작
 *         <li>분류되지 않은 예외만 {@link InternalSystemException}으로 Future를 실패시킴
 *       </ul>
 * </ol>
 *
 * <h4>락 해제 보장</h4>
 *
 * <p>락 보유 구간({@link #withLock})은 성공/실패/네거티브 캐싱 모든 경로에서 결과를 반환하기 전에 락을 해제합니다. 동기 갱신과 백그라운드 갱신 모두 같은 락을
 * 사용합니다.
 */
@Slf4j
public class CacheOrchestrator {

  private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  private final CacheEntryStore entryStore;
  private final SingleFlightLock lock;
  private final BackgroundRefreshScheduler backgroundScheduler;
  private final CacheTtlConfig ttlConfig;
  private final CacheMetrics metrics;
  private final TimeLimiter fetchTimeLimiter;
  private final ScheduledExecutorService scheduler;
  private final RefreshFailureClassifier classifier;
  private final Duration lockWait;
  private final Duration retryDelay;

  @Builder
  public CacheOrchestrator(
      CacheEntryStore entryStore,
      SingleFlightLock lock,
      BackgroundRefreshScheduler backgroundScheduler,
      CacheTtlConfig ttlConfig,
      CacheMetrics metrics,
      TimeLimiter fetchTimeLimiter,
      ScheduledExecutorService scheduler,
      RefreshFailureClassifier classifier,
      Duration lockWait,
      Duration retryDelay) {
    this.entryStore = entryStore;
    this.lock = lock;
    this.backgroundScheduler = backgroundScheduler;
    this.ttlConfig = ttlConfig;
    this.metrics = metrics;
    this.fetchTimeLimiter = fetchTimeLimiter;
    this.scheduler = scheduler;
    this.classifier = classifier != null ? classifier : new RefreshFailureClassifier();
    this.lockWait = lockWait;
    this.retryDelay = retryDelay;
  }

  /** 프로토콜이 생성한 캐시 키로 조회 */
  public <P, T> CompletableFuture<CacheResult<T>> getCachedData(
      CacheRefreshProtocol<P, T> protocol, P params) {
    return getCachedData(protocol.cacheKey(params), protocol, params);
  }

  public <P, T> CompletableFuture<CacheResult<T>> getCachedData(
      String key, CacheRefreshProtocol<P, T> protocol, P params) {
    return getCachedData(key, protocol, params, true);
  }

  /**
   * 캐시 조회
   *
   * @param key 캐시 키
   * @param protocol 리소스 갱신 전략
   * @param params fetch 파라미터
   * @param allowStale false면 stale 사본을 반환하지 않고 바로 동기 갱신 (실패 시 stale 대체는 허용)
   * @return 결과. 분류되지 않은 내부 장애일 때만 예외로 완료
   */
  public <P, T> CompletableFuture<CacheResult<T>> getCachedData(
      String key, CacheRefreshProtocol<P, T> protocol, P params, boolean allowStale) {
    return entryStore
        .readFresh(key)
        .thenCompose(
            fresh -> {
              Optional<CacheResult<T>> cached =
                  fresh.flatMap(payload -> toCachedResult(payload, protocol));
              if (cached.isPresent()) {
                metrics.recordEvent(protocol.cacheName(), CacheEvent.HIT);
                return CompletableFuture.completedFuture(cached.get());
              }
              if (!allowStale) {
                metrics.recordEvent(protocol.cacheName(), CacheEvent.MISS);
                return refreshOnMiss(key, protocol, params);
              }
              return serveStaleOrRefresh(key, protocol, params);
            });
  }

  /**
   * 캐시 상태와 무관하게 락을 잡고 갱신 (워밍업용)
   *
   * <p>락을 다른 호출자가 보유 중이면 일반 미스 경로와 동일하게 대기합니다.
   */
  public <P, T> CompletableFuture<CacheResult<T>> refresh(
      String key, CacheRefreshProtocol<P, T> protocol, P params) {
    return acquireOrWait(key, protocol, params, deadlineAfter(lockWait), true);
  }

  /** 신규 백그라운드 갱신을 중단하고 진행 중인 갱신 완료를 대기 */
  public void shutdown() {
    shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
  }

  public boolean shutdown(Duration timeout) {
    boolean drained = backgroundScheduler.shutdown(timeout);
    log.info("[CacheOrchestrator] Shutdown complete (drained={})", drained);
    return drained;
  }

  // ==================== Stale-While-Revalidate ====================

  private <P, T> CompletableFuture<CacheResult<T>> serveStaleOrRefresh(
      String key, CacheRefreshProtocol<P, T> protocol, P params) {
    return readStaleValue(key, protocol)
        .thenCompose(
            stale -> {
              if (stale.isPresent()) {
                metrics.recordEvent(protocol.cacheName(), CacheEvent.STALE_RETURN);
                backgroundScheduler.schedule(
                    key, protocol.cacheName(), () -> backgroundRefresh(key, protocol, params));
                return CompletableFuture.completedFuture(CacheResult.staleRefresh(stale.get()));
              }
              metrics.recordEvent(protocol.cacheName(), CacheEvent.MISS);
              return refreshOnMiss(key, protocol, params);
            });
  }

  /** 백그라운드 갱신: 락을 1회만 시도하고, 다른 갱신이 진행 중이면 건너뜀 */
  private <P, T> CompletableFuture<Void> backgroundRefresh(
      String key, CacheRefreshProtocol<P, T> protocol, P params) {
    return lock.tryAcquire(key)
        .thenCompose(
            token -> {
              if (token.isEmpty()) {
                metrics.recordEvent(protocol.cacheName(), CacheEvent.BACKGROUND_LOCK_BUSY);
                log.debug("[CacheOrchestrator] Refresh already in progress: {}", maskKey(key));
                return CompletableFuture.<Void>completedFuture(null);
              }
              return refreshUnderLock(token.get(), key, protocol, params, false)
                  .thenAccept(outcome -> recordBackgroundOutcome(key, protocol, outcome));
            });
  }

  private <T> void recordBackgroundOutcome(
      String key, CacheRefreshProtocol<?, T> protocol, RefreshOutcome<T> outcome) {
    CacheResult<T> result = outcome.result();
    String cacheName = protocol.cacheName();
    if (result.status() == CacheStatus.NOT_FOUND) {
      metrics.recordEvent(cacheName, CacheEvent.BACKGROUND_NOT_FOUND);
      return;
    }
    if (result.status() != CacheStatus.ERROR) {
      return;
    }
    switch (result.failure()) {
      case TIMEOUT -> {
        metrics.recordEvent(cacheName, CacheEvent.BACKGROUND_TIMEOUT);
        log.warn(
            "[CacheOrchestrator] Background refresh timed out: {} ({})", cacheName, maskKey(key));
      }
      case UNEXPECTED -> {
        metrics.recordEvent(cacheName, CacheEvent.BACKGROUND_UNEXPECTED_ERROR);
        log.error(
            "[CacheOrchestrator] Unexpected error while refreshing {} cache ({})",
            cacheName,
            maskKey(key),
            outcome.cause());
      }
      default -> {
        metrics.recordEvent(cacheName, CacheEvent.BACKGROUND_ERROR);
        log.warn(
            "[CacheOrchestrator] Upstream error while refreshing {} cache: {}",
            cacheName,
            result.detail());
      }
    }
  }

  // ==================== Singleflight ====================

  private <P, T> CompletableFuture<CacheResult<T>> refreshOnMiss(
      String key, CacheRefreshProtocol<P, T> protocol, P params) {
    return acquireOrWait(key, protocol, params, deadlineAfter(lockWait), false);
  }

  /**
   * 락 획득 시 Leader로 갱신, 실패 시 Follower로 대기
   *
   * @param forceFetch true면 락 획득 후 fresh 재확인 없이 fetch
   */
  private <P, T> CompletableFuture<CacheResult<T>> acquireOrWait(
      String key,
      CacheRefreshProtocol<P, T> protocol,
      P params,
      long deadline,
      boolean forceFetch) {
    return lock.tryAcquire(key)
        .thenCompose(
            token -> {
              if (token.isPresent()) {
                return refreshUnderLock(token.get(), key, protocol, params, forceFetch)
                    .thenCompose(outcome -> completeSynchronousRefresh(key, protocol, outcome));
              }
              return waitForLeader(key, protocol, params, deadline, forceFetch);
            });
  }

  /** Follower 폴링: fresh 엔트리 출현 → HIT, 락 해제 → 재획득 시도, 대기 초과 → stale 또는 MISS */
  private <P, T> CompletableFuture<CacheResult<T>> waitForLeader(
      String key,
      CacheRefreshProtocol<P, T> protocol,
      P params,
      long deadline,
      boolean forceFetch) {
    if (System.nanoTime() >= deadline) {
      return onLockWaitExhausted(key, protocol);
    }
    return delay(retryDelay)
        .thenCompose(ignored -> entryStore.readFresh(key))
        .thenCompose(
            fresh -> {
              Optional<CacheResult<T>> cached =
                  fresh.flatMap(payload -> toCachedResult(payload, protocol));
              if (cached.isPresent()) {
                metrics.recordEvent(protocol.cacheName(), CacheEvent.HIT);
                return CompletableFuture.completedFuture(cached.get());
              }
              return acquireOrWait(key, protocol, params, deadline, forceFetch);
            });
  }

  private <P, T> CompletableFuture<CacheResult<T>> onLockWaitExhausted(
      String key, CacheRefreshProtocol<P, T> protocol) {
    metrics.recordEvent(protocol.cacheName(), CacheEvent.LOCK_TIMEOUT);
    log.warn(
        "[CacheOrchestrator] Lock wait exceeded {}ms: {}", lockWait.toMillis(), maskKey(key));
    return readStaleValue(key, protocol)
        .thenApply(
            stale -> {
              if (stale.isPresent()) {
                metrics.recordEvent(protocol.cacheName(), CacheEvent.STALE_RETURN);
                return CacheResult.stale(stale.get(), FailureKind.TIMEOUT);
              }
              return CacheResult.<T>miss();
            });
  }

  // ==================== Refresh Under Lock ====================

  /**
   * 락 보유 상태에서 갱신
   *
   * <p>락 획득 직후 fresh 엔트리를 다시 확인합니다. 다른 인스턴스가 직전에 갱신을 끝냈다면 fetch 없이 그 값을 사용합니다.
   */
  private <P, T> CompletableFuture<RefreshOutcome<T>> refreshUnderLock(
      LockToken token,
      String key,
      CacheRefreshProtocol<P, T> protocol,
      P params,
      boolean forceFetch) {
    return withLock(
        token,
        () -> {
          if (forceFetch) {
            return fetchAndStore(key, protocol, params);
          }
          return entryStore
              .readFresh(key)
              .thenCompose(
                  fresh -> {
                    Optional<RefreshOutcome<T>> existing =
                        fresh.flatMap(payload -> toRefreshSkip(payload, protocol));
                    if (existing.isPresent()) {
                      return CompletableFuture.completedFuture(existing.get());
                    }
                    return fetchAndStore(key, protocol, params);
                  });
        });
  }

  private <T> Optional<RefreshOutcome<T>> toRefreshSkip(
      CachedPayload payload, CacheRefreshProtocol<?, T> protocol) {
    if (payload.isNotFound()) {
      metrics.recordEvent(protocol.cacheName(), CacheEvent.REFRESH_CACHED_NOT_FOUND);
      return Optional.of(
          RefreshOutcome.of(
              CacheResult.<T>notFound(payload.notFoundDetail(), CacheResult.HEADER_HIT)));
    }
    return entryStore
        .decode(payload, protocol.resultType())
        .map(
            value -> {
              metrics.recordEvent(protocol.cacheName(), CacheEvent.REFRESH_SKIP_HIT);
              return RefreshOutcome.of(CacheResult.hit(value));
            });
  }

  private <P, T> CompletableFuture<RefreshOutcome<T>> fetchAndStore(
      String key, CacheRefreshProtocol<P, T> protocol, P params) {
    long start = System.nanoTime();
    return invoke(() -> fetchWithTimeout(protocol, params))
        .thenCompose(
            value ->
                invoke(() -> protocol.store(entryStore, key, value, ttlConfig))
                    .thenApply(ignored -> value))
        .handle(
            (value, error) -> {
              if (error == null) {
                metrics.observeLatency(
                    protocol.cacheName(), Duration.ofNanos(System.nanoTime() - start));
                metrics.recordEvent(protocol.cacheName(), CacheEvent.REFRESH_SUCCESS);
                return CompletableFuture.completedFuture(
                    RefreshOutcome.of(CacheResult.refreshed(value)));
              }
              return onRefreshFailure(key, protocol, RefreshFailureClassifier.unwrap(error));
            })
        .thenCompose(Function.identity());
  }

  private <P, T> CompletableFuture<T> fetchWithTimeout(
      CacheRefreshProtocol<P, T> protocol, P params) {
    return fetchTimeLimiter
        .executeCompletionStage(scheduler, () -> protocol.fetch(params))
        .toCompletableFuture();
  }

  private <P, T> CompletableFuture<RefreshOutcome<T>> onRefreshFailure(
      String key, CacheRefreshProtocol<P, T> protocol, Throwable error) {
    FailureKind kind = classifier.classify(error);
    String detail = error.getMessage();

    if (kind == FailureKind.NOT_FOUND) {
      metrics.recordEvent(protocol.cacheName(), CacheEvent.REFRESH_NOT_FOUND);
      return entryStore
          .writeNotFound(key, detail, ttlConfig.getNotFoundTtl())
          .handle(
              (ignored, writeError) -> {
                if (writeError != null) {
                  log.warn(
                      "[CacheOrchestrator] Negative cache write failed: {} ({})",
                      maskKey(key),
                      writeError.toString());
                }
                return RefreshOutcome.of(CacheResult.<T>notFound(detail, CacheResult.HEADER_MISS));
              });
    }

    metrics.recordEvent(protocol.cacheName(), CacheEvent.REFRESH_ERROR);
    if (kind != FailureKind.UNEXPECTED) {
      log.warn(
          "[CacheOrchestrator] Refresh failed ({}) for {}: {}",
          kind,
          maskKey(key),
          error.toString());
    }
    return CompletableFuture.completedFuture(
        new RefreshOutcome<T>(CacheResult.<T>error(kind, detail), error));
  }

  /** 동기 갱신 결과 마무리: 업스트림 장애/타임아웃은 stale 대체, 분류되지 않은 예외는 Future 실패 */
  private <P, T> CompletableFuture<CacheResult<T>> completeSynchronousRefresh(
      String key, CacheRefreshProtocol<P, T> protocol, RefreshOutcome<T> outcome) {
    CacheResult<T> result = outcome.result();
    if (result.status() == CacheStatus.NOT_FOUND) {
      metrics.recordEvent(protocol.cacheName(), CacheEvent.NOT_FOUND);
      return CompletableFuture.completedFuture(result);
    }
    if (result.status() != CacheStatus.ERROR) {
      return CompletableFuture.completedFuture(result);
    }
    if (result.failure() == FailureKind.UNEXPECTED) {
      return CompletableFuture.failedFuture(toSystemException(outcome.cause()));
    }
    return readStaleValue(key, protocol)
        .thenApply(
            stale -> {
              if (stale.isPresent()) {
                metrics.recordEvent(protocol.cacheName(), CacheEvent.STALE_RETURN);
                return CacheResult.stale(stale.get(), result.failure());
              }
              return result;
            });
  }

  // ==================== Helpers ====================

  /** 본문 결과와 관계없이 락을 해제한 뒤 결과를 전달 */
  private <R> CompletableFuture<R> withLock(LockToken token, Supplier<CompletableFuture<R>> body) {
    return invoke(body)
        .handle(
            (value, error) ->
                lock.release(token)
                    .thenCompose(
                        released ->
                            error == null
                                ? CompletableFuture.completedFuture(value)
                                : CompletableFuture.<R>failedFuture(
                                    RefreshFailureClassifier.unwrap(error))))
        .thenCompose(Function.identity());
  }

  /** fresh 엔트리 → 결과 변환. 변환 실패(스키마 불일치)는 미스로 취급 */
  private <T> Optional<CacheResult<T>> toCachedResult(
      CachedPayload payload, CacheRefreshProtocol<?, T> protocol) {
    if (payload.isNotFound()) {
      return Optional.of(CacheResult.notFound(payload.notFoundDetail(), CacheResult.HEADER_HIT));
    }
    return entryStore.decode(payload, protocol.resultType()).map(CacheResult::hit);
  }

  private <T> CompletableFuture<Optional<T>> readStaleValue(
      String key, CacheRefreshProtocol<?, T> protocol) {
    return entryStore
        .readStale(key)
        .thenApply(
            stale -> stale.flatMap(payload -> entryStore.decode(payload, protocol.resultType())));
  }

  private CompletableFuture<Void> delay(Duration duration) {
    CompletableFuture<Void> elapsed = new CompletableFuture<>();
    scheduler.schedule(() -> elapsed.complete(null), duration.toMillis(), TimeUnit.MILLISECONDS);
    return elapsed;
  }

  private static <R> CompletableFuture<R> invoke(Supplier<CompletableFuture<R>> call) {
    try {
      return call.get();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static RuntimeException toSystemException(Throwable cause) {
    if (cause instanceof BaseException base) {
      return base;
    }
    return new InternalSystemException("CacheOrchestrator:refresh", cause);
  }

  private static long deadlineAfter(Duration wait) {
    return System.nanoTime() + wait.toNanos();
  }

  /** 캐시 키 마스킹 (로그 노출 최소화) */
  static String maskKey(String key) {
    if (key == null || key.length() <= 24) {
      return key;
    }
    return key.substring(0, 24) + "***";
  }

  /** 락 보유 구간의 결과 (UNEXPECTED 실패의 원인 예외 보존) */
  private record RefreshOutcome<T>(CacheResult<T> result, Throwable cause) {

    static <T> RefreshOutcome<T> of(CacheResult<T> result) {
      return new RefreshOutcome<>(result, null);
    }
  }
}
