package bahn.vision.global.cache.store;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisConnectionException;

/**
 * Redisson 클라이언트 지연 접속 관리
 *
 * <h4>동작 규칙</h4>
 *
 * <ul>
 *   <li>기동 시 {@link #connect()}로 1회 동기 접속. 실패해도 예외 없이 fallback 전용 모드로 기동
 *   <li>미접속 상태의 {@link #client()} 호출은 {@link RedisConnectionException}을 던지고, retryInterval 경과 시 재접속을
 *       executor에 예약
 *   <li>재접속 시도는 동시에 하나만 실행
 * </ul>
 *
 * <p>{@link RedisKeyValueStore}가 던지는 예외는 {@code CacheCircuitBreaker}가 흡수하므로 미접속 기간의 요청은 fallback 저장소로
 * 처리됩니다.
 */
@Slf4j
public class RedissonConnector {

  private final Supplier<RedissonClient> factory;
  private final Executor executor;
  private final Duration retryInterval;
  private final Clock clock;

  private final AtomicReference<RedissonClient> client = new AtomicReference<>();
  private final AtomicBoolean connecting = new AtomicBoolean();
  private final AtomicLong nextAttemptMillis = new AtomicLong();
  private volatile boolean shutdown;

  public RedissonConnector(
      Supplier<RedissonClient> factory, Executor executor, Duration retryInterval) {
    this(factory, executor, retryInterval, Clock.systemUTC());
  }

  public RedissonConnector(
      Supplier<RedissonClient> factory, Executor executor, Duration retryInterval, Clock clock) {
    this.factory = factory;
    this.executor = executor;
    this.retryInterval = retryInterval;
    this.clock = clock;
  }

  /**
   * 동기 접속 1회 시도
   *
   * @return 접속 상태면 true
   */
  public boolean connect() {
    if (client.get() != null) {
      return true;
    }
    if (!connecting.compareAndSet(false, true)) {
      return false;
    }
    try {
      return attempt();
    } finally {
      connecting.set(false);
    }
  }

  /**
   * 접속된 클라이언트
   *
   * @throws RedisConnectionException 아직 접속되지 않은 경우
   */
  public RedissonClient client() {
    RedissonClient current = client.get();
    if (current != null) {
      return current;
    }
    scheduleReconnect();
    throw new RedisConnectionException("Remote cache is not connected");
  }

  public boolean isConnected() {
    return client.get() != null;
  }

  public void shutdown() {
    shutdown = true;
    RedissonClient current = client.getAndSet(null);
    if (current != null) {
      current.shutdown();
    }
  }

  private void scheduleReconnect() {
    if (shutdown || clock.millis() < nextAttemptMillis.get()) {
      return;
    }
    if (!connecting.compareAndSet(false, true)) {
      return;
    }
    try {
      executor.execute(
          () -> {
            try {
              attempt();
            } finally {
              connecting.set(false);
            }
          });
    } catch (RejectedExecutionException e) {
      connecting.set(false);
      nextAttemptMillis.set(clock.millis() + retryInterval.toMillis());
      log.warn("[RedissonConnector] Reconnect attempt rejected: {}", e.toString());
    }
  }

  private boolean attempt() {
    try {
      RedissonClient created = factory.get();
      if (shutdown) {
        created.shutdown();
        return false;
      }
      client.set(created);
      log.info("[RedissonConnector] Connected to remote cache");
      return true;
    } catch (RuntimeException e) {
      nextAttemptMillis.set(clock.millis() + retryInterval.toMillis());
      log.warn(
          "[RedissonConnector] Remote cache unreachable, fallback only (retry in {}ms): {}",
          retryInterval.toMillis(),
          e.toString());
      return false;
    }
  }
}
