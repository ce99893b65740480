package bahn.vision.service.cache;

import java.util.Map;
import java.util.Optional;

/**
 * 캐시 조회 결과 (Tagged Result)
 *
 * <p>not-found, 업스트림 장애, 타임아웃은 예외가 아니라 {@link CacheStatus}와 {@link FailureKind}로 표현합니다. 예외는 분류되지 않은
 * 내부 장애에만 사용합니다.
 *
 * <p>{@code headers}에는 최소한 {@value #CACHE_STATUS_HEADER} 진단 헤더가 포함됩니다.
 *
 * @param status 결과 상태
 * @param value 반환 값 (없으면 null)
 * @param failure 실패 분류 (성공이면 null)
 * @param detail 실패 상세 메시지 (성공이면 null)
 * @param headers 진단 헤더
 */
public record CacheResult<T>(
    CacheStatus status, T value, FailureKind failure, String detail, Map<String, String> headers) {

  public static final String CACHE_STATUS_HEADER = "X-Cache-Status";

  public static final String HEADER_HIT = "hit";
  public static final String HEADER_MISS = "miss";
  public static final String HEADER_STALE = "stale";
  public static final String HEADER_STALE_REFRESH = "stale-refresh";

  public CacheResult {
    headers = Map.copyOf(headers);
  }

  /** fresh 엔트리 적중 */
  public static <T> CacheResult<T> hit(T value) {
    return new CacheResult<>(CacheStatus.HIT, value, null, null, header(HEADER_HIT));
  }

  /** 캐시 미스 후 동기 갱신으로 얻은 값 */
  public static <T> CacheResult<T> refreshed(T value) {
    return new CacheResult<>(CacheStatus.HIT, value, null, null, header(HEADER_MISS));
  }

  public static <T> CacheResult<T> staleRefresh(T value) {
    return new CacheResult<>(
        CacheStatus.STALE_REFRESH, value, null, null, header(HEADER_STALE_REFRESH));
  }

  /** 갱신 실패(failure)로 stale 사본 반환 */
  public static <T> CacheResult<T> stale(T value, FailureKind failure) {
    return new CacheResult<>(CacheStatus.STALE, value, failure, null, header(HEADER_STALE));
  }

  /** 락 대기 초과. 확정적 not-found와 구분되는 "잠시 후 재시도" 신호 */
  public static <T> CacheResult<T> miss() {
    return new CacheResult<>(
        CacheStatus.MISS, null, FailureKind.TIMEOUT, null, header(HEADER_MISS));
  }

  /**
   * 확정적 not-found
   *
   * @param cacheStatusHeader 네거티브 캐시 적중이면 hit, 새로 판정했으면 miss
   */
  public static <T> CacheResult<T> notFound(String detail, String cacheStatusHeader) {
    return new CacheResult<>(
        CacheStatus.NOT_FOUND, null, FailureKind.NOT_FOUND, detail, header(cacheStatusHeader));
  }

  public static <T> CacheResult<T> error(FailureKind failure, String detail) {
    return new CacheResult<>(CacheStatus.ERROR, null, failure, detail, header(HEADER_MISS));
  }

  public boolean hasValue() {
    return value != null;
  }

  public Optional<T> valueOptional() {
    return Optional.ofNullable(value);
  }

  public String cacheStatusHeader() {
    return headers.get(CACHE_STATUS_HEADER);
  }

  private static Map<String, String> header(String cacheStatus) {
    return Map.of(CACHE_STATUS_HEADER, cacheStatus);
  }
}
