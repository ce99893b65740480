package bahn.vision.service.cache;

/** 갱신 실패 분류 */
public enum FailureKind {
  NOT_FOUND,
  UPSTREAM_ERROR,
  TIMEOUT,
  UNEXPECTED
}
