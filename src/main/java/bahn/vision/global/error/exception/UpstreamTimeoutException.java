package bahn.vision.global.error.exception;

import bahn.vision.global.error.CommonErrorCode;
import bahn.vision.global.error.exception.base.ServerBaseException;

public class UpstreamTimeoutException extends ServerBaseException {

  public UpstreamTimeoutException(String operation) {
    super(CommonErrorCode.UPSTREAM_TIMEOUT, operation);
  }

  public UpstreamTimeoutException(String operation, Throwable cause) {
    super(CommonErrorCode.UPSTREAM_TIMEOUT, cause, operation);
  }
}
