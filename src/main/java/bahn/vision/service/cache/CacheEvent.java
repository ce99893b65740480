package bahn.vision.service.cache;

/**
 * 캐시 메트릭 이벤트
 *
 * <p>메트릭 태그 값은 {@link #value()} (snake_case)를 사용합니다.
 */
public enum CacheEvent {
  HIT("hit"),
  MISS("miss"),
  STALE_RETURN("stale_return"),
  LOCK_TIMEOUT("lock_timeout"),
  NOT_FOUND("not_found"),
  REFRESH_SKIP_HIT("refresh_skip_hit"),
  REFRESH_CACHED_NOT_FOUND("refresh_cached_not_found"),
  REFRESH_SUCCESS("refresh_success"),
  REFRESH_NOT_FOUND("refresh_not_found"),
  REFRESH_ERROR("refresh_error"),
  BACKGROUND_SCHEDULED("background_scheduled"),
  BACKGROUND_SKIP_INFLIGHT("background_skip_inflight"),
  BACKGROUND_REJECTED("background_rejected"),
  BACKGROUND_LOCK_BUSY("background_lock_busy"),
  BACKGROUND_NOT_FOUND("background_not_found"),
  BACKGROUND_ERROR("background_error"),
  BACKGROUND_TIMEOUT("background_timeout"),
  BACKGROUND_UNEXPECTED_ERROR("background_unexpected_error");

  private final String value;

  CacheEvent(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
