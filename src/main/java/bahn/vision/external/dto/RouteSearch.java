package bahn.vision.external.dto;

import java.util.List;

/** 출발/도착 역 해석 결과와 경로 후보 */
public record RouteSearch(Station origin, Station destination, List<RoutePlan> plans) {}
