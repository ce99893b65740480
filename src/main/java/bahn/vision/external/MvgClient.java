package bahn.vision.external;

import bahn.vision.external.dto.RouteSearch;
import bahn.vision.external.dto.Station;
import bahn.vision.external.dto.StationDepartures;
import bahn.vision.external.dto.TransportType;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * MVG 업스트림 API 클라이언트 계약
 *
 * <p>구현체는 실패를 다음 예외로 완료된 Future로 표현해야 합니다.
 *
 * <ul>
 *   <li>역/경로 해석 실패: {@link bahn.vision.global.error.exception.StationNotFoundException}, {@link
 *       bahn.vision.global.error.exception.RouteNotFoundException}
 *   <li>업스트림 장애: {@link bahn.vision.global.error.exception.UpstreamServiceException}
 * </ul>
 */
public interface MvgClient {

  /**
   * 역 이름 또는 ID로 출발 정보 조회
   *
   * @param transportTypes 빈 집합이면 전체
   */
  CompletableFuture<StationDepartures> getDepartures(
      String stationQuery, int limit, int offset, Set<TransportType> transportTypes);

  CompletableFuture<List<Station>> getAllStations();

  /**
   * 경로 탐색
   *
   * @param departureTime 출발 시각 (null 가능)
   * @param arrivalTime 도착 시각 (null 가능, departureTime이 우선)
   */
  CompletableFuture<RouteSearch> planRoute(
      String originQuery,
      String destinationQuery,
      Instant departureTime,
      Instant arrivalTime,
      Set<TransportType> transportTypes);
}
