package bahn.vision.global.executor;

import bahn.vision.global.common.function.ThrowingSupplier;
import bahn.vision.global.error.exception.InternalSystemException;
import bahn.vision.global.error.exception.base.BaseException;
import bahn.vision.global.executor.function.ThrowingRunnable;
import bahn.vision.global.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → Runtime Exception 자동 변환
 *   <li>Micrometer 타이머 {@code logic.executor} 자동 수집
 *   <li><b>Error 격리</b> - Error(OOM 등)는 캐치하지 않고 상위로 전파
 *   <li><b>메트릭 카디널리티 통제</b> - dynamicValue는 로그에만 기록
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithMetrics(task, context, null);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    try {
      return executeWithMetrics(task, context, null);
    } catch (RuntimeException e) {
      log.debug("[{}] 예외 발생, 기본값 반환: {}", context.toTaskName(), e.getMessage());
      return defaultValue;
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    return executeWithMetrics(task, context, translator);
  }

  private <T> T executeWithMetrics(
      ThrowingSupplier<T> task, TaskContext context, ExceptionTranslator translator) {
    Timer.Sample sample = Timer.start(meterRegistry);

    try {
      T result = task.get();
      record(sample, context, "success", null);
      return result;
    } catch (Throwable t) {
      if (t instanceof Error error) {
        throw error;
      }
      record(sample, context, "failure", t);
      log.warn("[{}] 실행 중 예외 발생: {}", context.toTaskName(), t.toString());
      throw translate(t, context, translator);
    }
  }

  private void record(Timer.Sample sample, TaskContext context, String result, Throwable error) {
    Timer.Builder builder =
        Timer.builder("logic.executor")
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", result);
    if (error != null) {
      builder.tag("exception", error.getClass().getSimpleName());
    }
    sample.stop(builder.register(meterRegistry));
  }

  private RuntimeException translate(
      Throwable e, TaskContext context, ExceptionTranslator translator) {
    if (translator != null) {
      return translator.translate(e);
    }
    if (e instanceof BaseException base) {
      return base;
    }
    return new InternalSystemException(context.toTaskName(), e);
  }
}
