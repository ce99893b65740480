package bahn.vision.service.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class BackgroundRefreshSchedulerTest {

  private static final String CACHE_NAME = "test_resource";

  private ExecutorService executor;
  private CacheMetrics metrics;
  private BackgroundRefreshScheduler scheduler;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    metrics = mock(CacheMetrics.class);
    scheduler = new BackgroundRefreshScheduler(executor, metrics);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  @DisplayName("같은 키는 진행 중인 갱신이 끝날 때까지 한 번만 예약")
  void shouldDeduplicateInFlightKey() throws InterruptedException {
    // given
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger runs = new AtomicInteger();

    // when
    boolean first = scheduler.schedule("k", CACHE_NAME, () -> blockingTask(release, runs));
    boolean second = scheduler.schedule("k", CACHE_NAME, () -> blockingTask(release, runs));
    release.countDown();

    // then
    assertThat(first).isTrue();
    assertThat(second).isFalse();
    await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.inFlightCount() == 0);
    assertThat(runs).hasValue(1);
    then(metrics).should().recordEvent(CACHE_NAME, CacheEvent.BACKGROUND_SKIP_INFLIGHT);
  }

  @Test
  @DisplayName("완료 후에는 같은 키를 다시 예약 가능")
  void keyIsReleasedAfterCompletion() {
    scheduler.schedule("k", CACHE_NAME, () -> CompletableFuture.completedFuture(null));
    await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.inFlightCount() == 0);

    assertThat(scheduler.schedule("k", CACHE_NAME, () -> CompletableFuture.completedFuture(null)))
        .isTrue();
  }

  @Test
  @DisplayName("작업 예외는 메트릭으로 기록하고 in-flight 정리")
  void failingTaskIsContained() {
    scheduler.schedule(
        "k",
        CACHE_NAME,
        () -> {
          throw new IllegalStateException("bug");
        });

    await().atMost(Duration.ofSeconds(2)).until(() -> scheduler.inFlightCount() == 0);
    then(metrics).should().recordEvent(CACHE_NAME, CacheEvent.BACKGROUND_UNEXPECTED_ERROR);
  }

  @Test
  @DisplayName("워커 풀이 거절하면 예약 실패로 처리하고 in-flight 정리")
  void rejectedTaskIsDropped() {
    BackgroundRefreshScheduler rejecting =
        new BackgroundRefreshScheduler(
            command -> {
              throw new RejectedExecutionException("queue full");
            },
            metrics);

    boolean scheduled =
        rejecting.schedule("k", CACHE_NAME, () -> CompletableFuture.completedFuture(null));

    assertThat(scheduled).isFalse();
    assertThat(rejecting.inFlightCount()).isZero();
    then(metrics).should().recordEvent(CACHE_NAME, CacheEvent.BACKGROUND_REJECTED);
    then(metrics).should(never()).recordEvent(CACHE_NAME, CacheEvent.BACKGROUND_SCHEDULED);
  }

  @Test
  @DisplayName("shutdown은 진행 중인 갱신 완료를 대기하고 이후 예약 거부")
  void shutdownDrainsInFlight() {
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger runs = new AtomicInteger();
    scheduler.schedule("k", CACHE_NAME, () -> blockingTask(release, runs));
    executor.execute(
        () -> {
          sleepQuietly(100);
          release.countDown();
        });

    boolean drained = scheduler.shutdown(Duration.ofSeconds(2));

    assertThat(drained).isTrue();
    assertThat(runs).hasValue(1);
    boolean acceptedAfterShutdown =
        scheduler.schedule("other", CACHE_NAME, () -> CompletableFuture.completedFuture(null));
    assertThat(acceptedAfterShutdown).isFalse();
  }

  @Test
  @DisplayName("shutdown 대기 시간을 넘기면 false")
  void shutdownTimesOut() {
    CountDownLatch never = new CountDownLatch(1);
    scheduler.schedule("k", CACHE_NAME, () -> blockingTask(never, new AtomicInteger()));

    assertThat(scheduler.shutdown(Duration.ofMillis(100))).isFalse();
    never.countDown();
  }

  private static CompletableFuture<Void> blockingTask(CountDownLatch release, AtomicInteger runs) {
    runs.incrementAndGet();
    try {
      release.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return CompletableFuture.completedFuture(null);
  }

  private static void sleepQuietly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
