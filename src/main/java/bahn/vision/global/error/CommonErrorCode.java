package bahn.vision.global.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  RESOURCE_NOT_FOUND("C002", "요청한 리소스를 찾을 수 없습니다: %s", HttpStatus.NOT_FOUND),
  STATION_NOT_FOUND("C003", "존재하지 않는 역입니다 (query: %s)", HttpStatus.NOT_FOUND),
  ROUTE_NOT_FOUND("C004", "경로를 찾을 수 없습니다 (%s)", HttpStatus.NOT_FOUND),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  CACHE_SERIALIZATION_ERROR("S002", "캐시 직렬화 실패 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  UPSTREAM_UNAVAILABLE("S003", "외부 API 호출 실패 (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  UPSTREAM_TIMEOUT("S004", "외부 API 응답 시간 초과 (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  CACHE_REFRESH_PENDING(
      "S005", "데이터를 준비 중입니다. 잠시 후 다시 시도해주세요.", HttpStatus.SERVICE_UNAVAILABLE);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
