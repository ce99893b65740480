package bahn.vision.global.error.exception.base;

import bahn.vision.global.error.ErrorCode;

/**
 * ServerBaseException: 외부 API 장애나 시스템 내부 오류로 발생하는 5xx 계열의 '서버 예외'를 처리하며, 장애 회고를 위한 상세 로그를 남기는 것이
 * 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)를 포함하여 디버깅 정보 확보
  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
