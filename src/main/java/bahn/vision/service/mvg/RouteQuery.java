package bahn.vision.service.mvg;

import bahn.vision.external.dto.TransportType;
import java.time.Instant;
import java.util.Set;

/**
 * 경로 탐색 파라미터
 *
 * <p>departureTime과 arrivalTime이 모두 있으면 departureTime이 우선합니다. 둘 다 없으면 현재 시각 기준입니다.
 */
public record RouteQuery(
    String origin,
    String destination,
    Instant departureTime,
    Instant arrivalTime,
    Set<TransportType> transportTypes) {

  public RouteQuery {
    transportTypes = transportTypes == null ? Set.of() : Set.copyOf(transportTypes);
  }
}
