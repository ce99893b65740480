package bahn.vision.service.mvg;

import bahn.vision.external.dto.TransportType;
import java.util.Set;

/**
 * 출발 정보 조회 파라미터
 *
 * @param station 역 이름 또는 ID
 * @param limit 최대 출발 건수
 * @param offset 현재 시각 기준 오프셋 (분)
 * @param transportTypes 교통수단 필터 (빈 집합이면 전체)
 */
public record DeparturesQuery(
    String station, int limit, int offset, Set<TransportType> transportTypes) {

  public DeparturesQuery {
    transportTypes = transportTypes == null ? Set.of() : Set.copyOf(transportTypes);
  }
}
