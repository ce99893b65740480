package bahn.vision.global.error.exception;

import bahn.vision.global.error.CommonErrorCode;
import bahn.vision.global.error.exception.base.ServerBaseException;

public class CacheSerializationException extends ServerBaseException {

  public CacheSerializationException(String detail, Throwable cause) {
    super(CommonErrorCode.CACHE_SERIALIZATION_ERROR, cause, detail);
  }
}
