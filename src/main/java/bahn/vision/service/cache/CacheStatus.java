package bahn.vision.service.cache;

/** 캐시 조회 결과 상태 */
public enum CacheStatus {
  /** fresh 엔트리 적중 또는 동기 갱신 성공 */
  HIT,
  /** 갱신 실패로 stale 사본 반환 */
  STALE,
  /** stale 사본 반환 + 백그라운드 갱신 예약 */
  STALE_REFRESH,
  /** 락 대기 시간 초과. 잠시 후 재시도 */
  MISS,
  /** 리소스가 업스트림에 존재하지 않음 (확정적 부정 결과) */
  NOT_FOUND,
  /** 갱신 실패, 대체할 stale 사본 없음 */
  ERROR
}
