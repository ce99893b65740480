package bahn.vision.service.cache;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * stale-while-revalidate 백그라운드 갱신 스케줄러
 *
 * <h4>핵심 계약</h4>
 *
 * <ul>
 *   <li>요청 스레드를 블로킹하지 않음 (fire-and-forget)
 *   <li>같은 캐시 키에 대해 프로세스 안에서 동시에 하나만 예약 (in-flight 맵)
 *   <li>제한된 워커 풀에서 실행. 큐 포화 시 예약을 드롭하고 WARN 로그
 *   <li>작업 실패는 여기서 로그/메트릭으로 마무리하며 요청 쪽으로 전파하지 않음
 * </ul>
 *
 * <p>프로세스 간 중복 방지는 작업 내부의 singleflight 락이 담당합니다.
 */
@Slf4j
public class BackgroundRefreshScheduler {

  private final Executor executor;
  private final CacheMetrics metrics;
  private final ConcurrentMap<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();
  private volatile boolean accepting = true;

  public BackgroundRefreshScheduler(Executor executor, CacheMetrics metrics) {
    this.executor = executor;
    this.metrics = metrics;
  }

  /**
   * 백그라운드 갱신 예약
   *
   * @param key 캐시 키 (중복 예약 판정 기준)
   * @param cacheName 메트릭 라벨
   * @param task 갱신 작업
   * @return 새로 예약했으면 true
   */
  public boolean schedule(String key, String cacheName, Supplier<CompletableFuture<Void>> task) {
    if (!accepting) {
      log.debug("[BackgroundRefresh] Shutting down, refresh skipped: {}", key);
      return false;
    }

    CompletableFuture<Void> completion = new CompletableFuture<>();
    if (inFlight.putIfAbsent(key, completion) != null) {
      metrics.recordEvent(cacheName, CacheEvent.BACKGROUND_SKIP_INFLIGHT);
      return false;
    }

    try {
      executor.execute(() -> run(key, cacheName, task, completion));
    } catch (RejectedExecutionException e) {
      finish(key, completion);
      metrics.recordEvent(cacheName, CacheEvent.BACKGROUND_REJECTED);
      log.warn("[BackgroundRefresh] Task rejected for {}: {}", key, e.getMessage());
      return false;
    }

    metrics.recordEvent(cacheName, CacheEvent.BACKGROUND_SCHEDULED);
    return true;
  }

  /** 현재 실행 중이거나 대기 중인 갱신 수 */
  public int inFlightCount() {
    return inFlight.size();
  }

  /**
   * 신규 예약 중단 후 진행 중인 갱신 완료 대기
   *
   * @return timeout 안에 모두 끝났으면 true
   */
  public boolean shutdown(Duration timeout) {
    accepting = false;
    CompletableFuture<?>[] pending = inFlight.values().toArray(new CompletableFuture<?>[0]);
    if (pending.length == 0) {
      return true;
    }

    log.info("[BackgroundRefresh] Waiting for {} in-flight refreshes", pending.length);
    try {
      CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      log.warn("[BackgroundRefresh] Shutdown timed out with {} refreshes pending", inFlight.size());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[BackgroundRefresh] Shutdown interrupted");
      return false;
    } catch (ExecutionException e) {
      log.warn("[BackgroundRefresh] Shutdown wait failed: {}", e.getMessage());
      return false;
    }
  }

  private void run(
      String key,
      String cacheName,
      Supplier<CompletableFuture<Void>> task,
      CompletableFuture<Void> completion) {
    try {
      task.get().join();
    } catch (RuntimeException e) {
      metrics.recordEvent(cacheName, CacheEvent.BACKGROUND_UNEXPECTED_ERROR);
      log.error(
          "[BackgroundRefresh] Unexpected error while refreshing {} ({})",
          cacheName,
          key,
          RefreshFailureClassifier.unwrap(e));
    } finally {
      finish(key, completion);
    }
  }

  private void finish(String key, CompletableFuture<Void> completion) {
    inFlight.remove(key, completion);
    completion.complete(null);
  }
}
