package bahn.vision.global.error.exception;

import bahn.vision.global.error.CommonErrorCode;
import bahn.vision.global.error.exception.base.ServerBaseException;

/** 관리되지 않은 예외를 규격화하는 최종 래퍼. 작업 이름을 보존하여 장애 추적에 사용합니다. */
public class InternalSystemException extends ServerBaseException {

  private final String taskName;

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause);
    this.taskName = taskName;
  }

  public String getTaskName() {
    return taskName;
  }
}
