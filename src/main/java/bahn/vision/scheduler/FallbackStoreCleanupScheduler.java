package bahn.vision.scheduler;

import bahn.vision.global.cache.store.InMemoryFallbackStore;
import bahn.vision.global.executor.LogicExecutor;
import bahn.vision.global.executor.TaskContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fallback 저장소 만료 엔트리 정리 스케줄러
 *
 * <p>쓰기 시점의 기회적 정리와 별개로, 읽기만 발생하는 키도 주기적으로 회수합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackStoreCleanupScheduler {

  private final InMemoryFallbackStore fallbackStore;
  private final LogicExecutor executor;

  @Scheduled(
      fixedDelayString = "${cache.fallback-sweep-interval:PT60S}",
      initialDelayString = "${cache.fallback-sweep-interval:PT60S}")
  public void sweep() {
    executor.executeVoid(
        () -> {
          int removed = fallbackStore.cleanupExpired();
          if (removed > 0) {
            log.debug(
                "[FallbackSweep] Removed {} expired entries, {} remaining",
                removed,
                fallbackStore.size());
          }
        },
        TaskContext.of("Scheduler", "FallbackSweep"));
  }
}
