package bahn.vision.global.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import bahn.vision.global.error.exception.CacheSerializationException;
import bahn.vision.global.error.exception.InternalSystemException;
import bahn.vision.global.error.exception.StationNotFoundException;
import bahn.vision.global.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class DefaultLogicExecutorTest {

  private SimpleMeterRegistry meterRegistry;
  private DefaultLogicExecutor executor;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = new DefaultLogicExecutor(meterRegistry);
  }

  @Nested
  @DisplayName("execute")
  class ExecuteTest {

    @Test
    @DisplayName("성공 시 결과 반환 및 success 타이머 기록")
    void shouldRecordSuccessTimer() {
      String result = executor.execute(() -> "ok", TaskContext.of("Test", "run"));

      assertThat(result).isEqualTo("ok");
      Timer timer =
          meterRegistry
              .find("logic.executor")
              .tags("component", "Test", "operation", "run", "result", "success")
              .timer();
      assertThat(timer).isNotNull();
      assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Checked 예외는 InternalSystemException으로 변환")
    void shouldWrapCheckedException() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new IOException("disk");
                      },
                      TaskContext.of("Test", "io", "file")))
          .isInstanceOf(InternalSystemException.class)
          .hasCauseInstanceOf(IOException.class)
          .satisfies(
              e -> assertThat(((InternalSystemException) e).getTaskName()).contains("Test:io"));
    }

    @Test
    @DisplayName("비즈니스 예외는 그대로 전파")
    void shouldPropagateBaseException() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new StationNotFoundException("nowhere");
                      },
                      TaskContext.of("Test", "lookup")))
          .isInstanceOf(StationNotFoundException.class);
    }

    @Test
    @DisplayName("Error는 변환하지 않고 전파")
    void shouldNotWrapErrors() {
      assertThatThrownBy(
              () ->
                  executor.execute(
                      () -> {
                        throw new AssertionError("fatal");
                      },
                      TaskContext.of("Test", "error")))
          .isInstanceOf(AssertionError.class);
    }
  }

  @Test
  @DisplayName("executeOrDefault는 실패 시 기본값 반환")
  void executeOrDefaultShouldReturnDefault() {
    String result =
        executor.executeOrDefault(
            () -> {
              throw new IllegalStateException("boom");
            },
            "fallback",
            TaskContext.of("Test", "default"));

    assertThat(result).isEqualTo("fallback");
  }

  @Test
  @DisplayName("executeVoid는 작업 실행")
  void executeVoidShouldRunTask() {
    AtomicBoolean ran = new AtomicBoolean();

    executor.executeVoid(() -> ran.set(true), TaskContext.of("Test", "void"));

    assertThat(ran).isTrue();
  }

  @Test
  @DisplayName("JSON 번역기는 IOException을 CacheSerializationException으로 변환")
  void jsonTranslatorShouldMapIoException() {
    assertThatThrownBy(
            () ->
                executor.executeWithTranslation(
                    () -> {
                      throw new IOException("broken json");
                    },
                    ExceptionTranslator.forJson(),
                    TaskContext.of("Test", "json")))
        .isInstanceOf(CacheSerializationException.class);
  }
}
