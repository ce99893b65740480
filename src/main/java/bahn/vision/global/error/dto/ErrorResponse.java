package bahn.vision.global.error.dto;

import bahn.vision.global.error.ErrorCode;
import bahn.vision.global.error.exception.base.BaseException;
import java.time.LocalDateTime;
import lombok.Builder;

public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  @Builder
  public ErrorResponse {}

  /** 비즈니스 예외: 동적으로 가공된 메시지(예: 어떤 역이 없는지)를 그대로 전달합니다. */
  public static ErrorResponse from(BaseException e) {
    return of(e.getErrorCode(), e.getMessage());
  }

  /** ErrorCode에 정의된 기본 메시지를 사용합니다. 내부 상세 정보는 노출하지 않습니다. */
  public static ErrorResponse from(ErrorCode errorCode) {
    return of(errorCode, errorCode.getMessage());
  }

  public static ErrorResponse of(ErrorCode errorCode, String message) {
    return ErrorResponse.builder()
        .status(errorCode.getStatus().value())
        .code(errorCode.getCode())
        .message(message)
        .timestamp(LocalDateTime.now())
        .build();
  }
}
