package bahn.vision.service.cache;

import bahn.vision.global.error.exception.ResourceNotFoundException;
import bahn.vision.global.error.exception.UpstreamServiceException;
import bahn.vision.global.error.exception.UpstreamTimeoutException;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 갱신 실패 예외 분류기
 *
 * <ul>
 *   <li>{@link ResourceNotFoundException} → NOT_FOUND
 *   <li>{@link TimeoutException}, {@link UpstreamTimeoutException} → TIMEOUT
 *   <li>{@link UpstreamServiceException}, {@link IOException} → UPSTREAM_ERROR
 *   <li>기타 → UNEXPECTED
 * </ul>
 */
public class RefreshFailureClassifier {

  public FailureKind classify(Throwable error) {
    Throwable cause = unwrap(error);
    if (cause instanceof ResourceNotFoundException) {
      return FailureKind.NOT_FOUND;
    }
    if (cause instanceof TimeoutException || cause instanceof UpstreamTimeoutException) {
      return FailureKind.TIMEOUT;
    }
    if (cause instanceof UpstreamServiceException || cause instanceof IOException) {
      return FailureKind.UPSTREAM_ERROR;
    }
    return FailureKind.UNEXPECTED;
  }

  /** CompletionException / ExecutionException 래핑 해제 */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
