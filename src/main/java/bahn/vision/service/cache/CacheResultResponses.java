package bahn.vision.service.cache;

import bahn.vision.global.error.CommonErrorCode;
import bahn.vision.global.error.ErrorCode;
import bahn.vision.global.error.dto.ErrorResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

/**
 * {@link CacheResult} → HTTP 응답 변환
 *
 * <ul>
 *   <li>HIT / STALE / STALE_REFRESH: 200 + 값
 *   <li>NOT_FOUND: 404 {@link ErrorResponse}
 *   <li>MISS / ERROR: 503 {@link ErrorResponse} + Retry-After
 * </ul>
 *
 * <p>모든 응답에 {@value CacheResult#CACHE_STATUS_HEADER} 헤더를 전파합니다.
 */
public final class CacheResultResponses {

  static final String RETRY_AFTER_SECONDS = "1";

  private static final String UNKNOWN_DETAIL = "-";

  private CacheResultResponses() {}

  public static ResponseEntity<?> toResponseEntity(CacheResult<?> result) {
    HttpHeaders headers = new HttpHeaders();
    result.headers().forEach(headers::add);

    return switch (result.status()) {
      case HIT, STALE, STALE_REFRESH -> ResponseEntity.ok().headers(headers).body(result.value());
      case NOT_FOUND -> error(CommonErrorCode.RESOURCE_NOT_FOUND, result.detail(), headers);
      case MISS -> retryable(CommonErrorCode.CACHE_REFRESH_PENDING, null, headers);
      case ERROR -> retryable(errorCodeOf(result.failure()), result.detail(), headers);
    };
  }

  private static ErrorCode errorCodeOf(FailureKind failure) {
    if (failure == FailureKind.TIMEOUT) {
      return CommonErrorCode.UPSTREAM_TIMEOUT;
    }
    if (failure == FailureKind.UPSTREAM_ERROR) {
      return CommonErrorCode.UPSTREAM_UNAVAILABLE;
    }
    return CommonErrorCode.INTERNAL_SERVER_ERROR;
  }

  private static ResponseEntity<ErrorResponse> retryable(
      ErrorCode errorCode, String detail, HttpHeaders headers) {
    headers.set(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
    return error(errorCode, detail, headers);
  }

  private static ResponseEntity<ErrorResponse> error(
      ErrorCode errorCode, String detail, HttpHeaders headers) {
    String message =
        detail != null ? detail : String.format(errorCode.getMessage(), UNKNOWN_DETAIL);
    return ResponseEntity.status(errorCode.getStatus())
        .headers(headers)
        .body(ErrorResponse.of(errorCode, message));
  }
}
