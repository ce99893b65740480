package bahn.vision.global.error.exception;

import bahn.vision.global.error.CommonErrorCode;
import bahn.vision.global.error.exception.base.ServerBaseException;

public class UpstreamServiceException extends ServerBaseException {

  // 대상 서비스 이름(예: MVG API)을 인자로 받아 메시지를 구성합니다.
  public UpstreamServiceException(String serviceName) {
    super(CommonErrorCode.UPSTREAM_UNAVAILABLE, serviceName);
  }

  public UpstreamServiceException(String serviceName, Throwable cause) {
    super(CommonErrorCode.UPSTREAM_UNAVAILABLE, cause, serviceName);
  }
}
