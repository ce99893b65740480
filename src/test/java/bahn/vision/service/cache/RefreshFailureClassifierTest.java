package bahn.vision.service.cache;

import static org.assertj.core.api.Assertions.assertThat;

import bahn.vision.global.error.exception.RouteNotFoundException;
import bahn.vision.global.error.exception.StationNotFoundException;
import bahn.vision.global.error.exception.UpstreamServiceException;
import bahn.vision.global.error.exception.UpstreamTimeoutException;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class RefreshFailureClassifierTest {

  private final RefreshFailureClassifier classifier = new RefreshFailureClassifier();

  @Test
  @DisplayName("리소스 부재 예외는 NOT_FOUND")
  void notFound() {
    assertThat(classifier.classify(new StationNotFoundException("x")))
        .isEqualTo(FailureKind.NOT_FOUND);
    assertThat(classifier.classify(new RouteNotFoundException("a", "b")))
        .isEqualTo(FailureKind.NOT_FOUND);
  }

  @Test
  @DisplayName("타임아웃 계열은 TIMEOUT")
  void timeout() {
    assertThat(classifier.classify(new TimeoutException())).isEqualTo(FailureKind.TIMEOUT);
    assertThat(classifier.classify(new UpstreamTimeoutException("departures")))
        .isEqualTo(FailureKind.TIMEOUT);
  }

  @Test
  @DisplayName("업스트림 / I/O 장애는 UPSTREAM_ERROR")
  void upstreamError() {
    assertThat(classifier.classify(new UpstreamServiceException("mvg")))
        .isEqualTo(FailureKind.UPSTREAM_ERROR);
    assertThat(classifier.classify(new IOException("reset"))).isEqualTo(FailureKind.UPSTREAM_ERROR);
  }

  @Test
  @DisplayName("비동기 래핑은 벗겨서 분류")
  void unwrapsAsyncWrappers() {
    Throwable wrapped =
        new CompletionException(
            new ExecutionException(new StationNotFoundException("nested")));

    assertThat(classifier.classify(wrapped)).isEqualTo(FailureKind.NOT_FOUND);
  }

  @Test
  @DisplayName("그 외 예외는 UNEXPECTED")
  void unexpected() {
    assertThat(classifier.classify(new IllegalStateException())).isEqualTo(FailureKind.UNEXPECTED);
  }
}
