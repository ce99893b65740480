package bahn.vision.global.error.exception.base;

import bahn.vision.global.error.ErrorCode;

/** ClientBaseException: 잘못된 요청이나 존재하지 않는 리소스 등 4xx 계열의 '클라이언트 예외'를 처리합니다. */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
