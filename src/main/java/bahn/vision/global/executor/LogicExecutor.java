package bahn.vision.global.executor;

import bahn.vision.global.common.function.ThrowingSupplier;
import bahn.vision.global.executor.function.ThrowingRunnable;
import bahn.vision.global.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 동기 실행기
 *
 * <p>비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code this::method})를 활용하세요.
 *
 * <h3>지원 패턴</h3>
 *
 * <ol>
 *   <li><b>try-catch-throw</b> (예외 변환 후 재전파) - {@link #execute}
 *   <li><b>try-catch-return</b> (기본값 반환) - {@link #executeOrDefault}
 *   <li><b>try-catch-log</b> (로그만 기록) - {@link #executeVoid}
 *   <li><b>다중 catch</b> (ExceptionTranslator 사용) - {@link #executeWithTranslation}
 * </ol>
 *
 * <h3>사용 예시</h3>
 *
 * <pre>{@code
 * String json = executor.executeWithTranslation(
 *     () -> objectMapper.writeValueAsString(value),
 *     ExceptionTranslator.forJson(),
 *     TaskContext.of("CacheEntry", "serialize", key));
 * }</pre>
 *
 * @see TaskContext
 * @see ExceptionTranslator
 */
public interface LogicExecutor {

  /**
   * 예외를 RuntimeException으로 변환하여 전파
   *
   * @param task 실행할 작업
   * @param context 작업 컨텍스트 (로깅/메트릭용)
   * @return 작업 결과
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /**
   * 예외 발생 시 기본값 반환
   *
   * @param task 실행할 작업
   * @param defaultValue 예외 발생 시 반환할 값
   * @param context 작업 컨텍스트
   * @return 작업 결과 또는 기본값
   */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /** 반환값 없는 작업 실행 (예외는 변환 후 전파) */
  void executeVoid(ThrowingRunnable task, TaskContext context);

  /**
   * ExceptionTranslator로 예외를 도메인 예외로 변환하여 전파
   *
   * @param task 실행할 작업
   * @param translator 예외 변환기
   * @param context 작업 컨텍스트
   * @return 작업 결과
   */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
