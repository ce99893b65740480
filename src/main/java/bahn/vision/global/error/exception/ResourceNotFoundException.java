package bahn.vision.global.error.exception;

import bahn.vision.global.error.CommonErrorCode;
import bahn.vision.global.error.ErrorCode;
import bahn.vision.global.error.exception.base.ClientBaseException;

/** 업스트림에 리소스가 존재하지 않는 경우. 재시도 대상이 아니며 짧은 TTL로 네거티브 캐싱됩니다. */
public class ResourceNotFoundException extends ClientBaseException {

  public ResourceNotFoundException(String detail) {
    super(CommonErrorCode.RESOURCE_NOT_FOUND, detail);
  }

  protected ResourceNotFoundException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
