package bahn.vision.global.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * 원격 캐시 백엔드 보호용 Circuit Breaker (Closed / Open 2-상태)
 *
 * <h4>상태 전이</h4>
 *
 * <ul>
 *   <li>Closed → Open: 보호 대상 호출이 예외로 끝나면 즉시 ({@code openUntil = now + cooldown})
 *   <li>Open → Closed: {@code now >= openUntil} 이 되는 첫 호출에서 자동 전환
 * </ul>
 *
 * <p>Half-Open 프로빙은 없습니다. 쿨다운 이후 첫 호출은 일반 Closed 호출로 취급되며, 다시 실패하면 재차 Open 됩니다.
 *
 * <p>상태는 {@link AtomicLong} 타임스탬프 하나뿐이므로 별도 락 없이 다수 스레드에서 동시에 호출할 수 있습니다. 동시에 여러 번 Open 되어도 같은 쿨다운
 * 윈도우를 갱신할 뿐입니다.
 *
 * <p>Resilience4j CircuitBreaker는 Half-Open 상태와 실패율 윈도우를 전제로 하므로 이 컴포넌트에는 사용하지 않습니다.
 */
@Slf4j
public class CacheCircuitBreaker {

  private static final long CLOSED = 0L;

  private final String name;
  private final Duration cooldown;
  private final Clock clock;
  private final AtomicLong openUntilMillis = new AtomicLong(CLOSED);

  public CacheCircuitBreaker(String name, Duration cooldown) {
    this(name, cooldown, Clock.systemUTC());
  }

  public CacheCircuitBreaker(String name, Duration cooldown, Clock clock) {
    this.name = name;
    this.cooldown = cooldown;
    this.clock = clock;
  }

  /**
   * 보호 대상 비동기 호출 실행
   *
   * <p>Open 상태면 {@code call}을 호출하지 않고 즉시 {@code fallback}을 반환합니다. {@code call}이 동기 예외를 던지거나 반환한 Future가
   * 예외로 완료되면 breaker를 Open 하고 {@code fallback}으로 대체합니다. 예외는 호출자에게 전파되지 않습니다.
   *
   * @param operation 로그용 작업 이름 (예: "get", "set")
   * @param call 보호 대상 호출
   * @param fallback 안전한 기본값 공급자
   */
  public <T> CompletableFuture<T> execute(
      String operation,
      Supplier<CompletableFuture<T>> call,
      Supplier<CompletableFuture<T>> fallback) {
    if (isOpen()) {
      return fallback.get();
    }

    CompletableFuture<T> future;
    try {
      future = call.get();
    } catch (RuntimeException e) {
      recordFailure(operation, e);
      return fallback.get();
    }

    return future
        .handle(
            (value, error) -> {
              if (error == null) {
                return CompletableFuture.completedFuture(value);
              }
              recordFailure(operation, unwrap(error));
              return fallback.get();
            })
        .thenCompose(Function.identity());
  }

  /** 현재 Open 상태인지 확인 (쿨다운이 지났으면 이 시점에 Closed 로 전환) */
  public boolean isOpen() {
    long until = openUntilMillis.get();
    if (until == CLOSED) {
      return false;
    }
    if (clock.millis() >= until) {
      if (openUntilMillis.compareAndSet(until, CLOSED)) {
        log.info("[CircuitBreaker] {} closed after cooldown", name);
      }
      return false;
    }
    return true;
  }

  /** 강제로 Open (쿨다운 윈도우 재시작) */
  public void open() {
    openUntilMillis.set(clock.millis() + cooldown.toMillis());
  }

  public void close() {
    openUntilMillis.set(CLOSED);
  }

  public String getName() {
    return name;
  }

  private void recordFailure(String operation, Throwable error) {
    open();
    log.warn(
        "[CircuitBreaker] {} opened for {}ms after {} failure: {}",
        name,
        cooldown.toMillis(),
        operation,
        error.toString());
  }

  private static Throwable unwrap(Throwable error) {
    if ((error instanceof CompletionException || error instanceof ExecutionException)
        && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
