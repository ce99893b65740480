package bahn.vision.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import java.util.Collections;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
public class ExecutorConfig {

  /** 로그 샘플링 간격: 1초에 1회만 WARN 로그 (log storm 방지) */
  private static final long REJECT_LOG_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);

  private static final AtomicLong lastRejectLogNanos = new AtomicLong(0);
  private static final AtomicLong rejectedSinceLastLog = new AtomicLong(0);

  /**
   * 백그라운드 갱신용 AbortPolicy
   *
   * <h4>핵심 계약</h4>
   *
   * <ul>
   *   <li><b>드롭 허용</b>: stale 값을 이미 응답했으므로 큐 포화 시 갱신을 건너뜀
   *   <li><b>즉시 거부</b>: RejectedExecutionException을 던져 호출자가 in-flight 등록을 정리하도록 함
   *   <li><b>샘플링</b>: 1초에 1회만 WARN 로그
   *   <li><b>Shutdown</b>: 종료 중 거절은 로그 없이 throw
   * </ul>
   */
  static final RejectedExecutionHandler LOGGING_ABORT_POLICY =
      (r, executor) -> {
        if (executor.isShutdown() || executor.isTerminating()) {
          throw new RejectedExecutionException("CacheRefreshExecutor rejected (shutdown in progress)");
        }

        long dropped = rejectedSinceLastLog.incrementAndGet();
        long now = System.nanoTime();
        long prev = lastRejectLogNanos.get();

        if (now - prev >= REJECT_LOG_INTERVAL_NANOS
            && lastRejectLogNanos.compareAndSet(prev, now)) {
          long count = rejectedSinceLastLog.getAndSet(0);
          log.warn(
              "[CacheRefreshExecutor] Task rejected (queue full). droppedInLastWindow={}, poolSize={}, activeCount={}, queueSize={}",
              count,
              executor.getPoolSize(),
              executor.getActiveCount(),
              executor.getQueue().size());
        }

        throw new RejectedExecutionException(
            "CacheRefreshExecutor queue full (dropped=" + dropped + ")");
      };

  /**
   * stale-while-revalidate 백그라운드 갱신 전용 Executor
   *
   * <ul>
   *   <li>크기: {@code cache.refresh-executor.*}
   *   <li>RejectedExecution: AbortPolicy + 샘플링 로깅 + rejected 메트릭
   *   <li>Shutdown: 진행 중인 갱신 완료 대기
   * </ul>
   */
  @Bean(name = "cacheRefreshExecutor")
  public ThreadPoolTaskExecutor cacheRefreshExecutor(
      CacheProperties cacheProperties, MeterRegistry meterRegistry) {
    CacheProperties.RefreshExecutor props = cacheProperties.getRefreshExecutor();

    Counter rejectedCounter =
        Counter.builder("executor.rejected")
            .tag("name", "cache.refresh")
            .description("Number of tasks rejected due to queue full")
            .register(meterRegistry);

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(props.getCorePoolSize());
    executor.setMaxPoolSize(Math.max(props.getCorePoolSize(), props.getMaxPoolSize()));
    executor.setQueueCapacity(props.getQueueCapacity());
    executor.setThreadNamePrefix("cache-refresh-");
    executor.setRejectedExecutionHandler(
        (r, e) -> {
          rejectedCounter.increment();
          LOGGING_ABORT_POLICY.rejectedExecution(r, e);
        });
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();

    new ExecutorServiceMetrics(
            executor.getThreadPoolExecutor(), "cache.refresh", Collections.emptyList())
        .bindTo(meterRegistry);

    return executor;
  }

  /** follower 폴링 지연 및 fetch 타임아웃 전용 스케줄러 */
  @Bean(name = "cacheScheduler", destroyMethod = "shutdownNow")
  public ScheduledExecutorService cacheScheduler() {
    AtomicInteger sequence = new AtomicInteger();
    return Executors.newScheduledThreadPool(
        2,
        runnable -> {
          Thread thread = new Thread(runnable, "cache-scheduler-" + sequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }
}
