package bahn.vision.external.dto;

import java.util.List;

/** 역 조회 결과와 해당 역의 출발 목록 */
public record StationDepartures(Station station, List<Departure> departures) {}
