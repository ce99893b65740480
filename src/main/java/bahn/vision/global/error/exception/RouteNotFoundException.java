package bahn.vision.global.error.exception;

import bahn.vision.global.error.CommonErrorCode;

public class RouteNotFoundException extends ResourceNotFoundException {

  public RouteNotFoundException(String origin, String destination) {
    super(CommonErrorCode.ROUTE_NOT_FOUND, origin + " → " + destination);
  }
}
