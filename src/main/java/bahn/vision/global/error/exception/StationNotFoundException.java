package bahn.vision.global.error.exception;

import bahn.vision.global.error.CommonErrorCode;

public class StationNotFoundException extends ResourceNotFoundException {

  public StationNotFoundException(String query) {
    super(CommonErrorCode.STATION_NOT_FOUND, query);
  }
}
