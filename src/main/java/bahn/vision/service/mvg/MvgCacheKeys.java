package bahn.vision.service.mvg;

import bahn.vision.external.dto.TransportType;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * MVG 리소스 캐시 키 생성
 *
 * <h4>정규화 규칙</h4>
 *
 * <ul>
 *   <li>역/검색어: 앞뒤 공백 제거 + 소문자
 *   <li>교통수단 필터: 중복 제거 후 이름순 정렬, "-"로 연결. 비어 있으면 "all"
 *   <li>경로 시각: {@code dep:<epoch초>} | {@code arr:<epoch초>} | {@code now}
 * </ul>
 *
 * <p>의미가 같은 요청은 항상 같은 키를 생성합니다.
 */
public final class MvgCacheKeys {

  public static final String STATION_LIST_KEY = "mvg:stations:all";

  private static final String ALL_TYPES = "all";

  private MvgCacheKeys() {}

  public static String departures(
      String station, int limit, int offset, Collection<TransportType> transportTypes) {
    return "mvg:departures:"
        + normalize(station)
        + ":"
        + limit
        + ":"
        + offset
        + ":"
        + typeSegment(transportTypes);
  }

  public static String stationSearch(String query, int limit) {
    return "mvg:stations:search:" + normalize(query) + ":" + limit;
  }

  public static String stationList() {
    return STATION_LIST_KEY;
  }

  public static String route(
      String origin,
      String destination,
      Instant departureTime,
      Instant arrivalTime,
      Collection<TransportType> transportTypes) {
    return "mvg:route:"
        + normalize(origin)
        + ":"
        + normalize(destination)
        + ":"
        + timeSegment(departureTime, arrivalTime)
        + ":"
        + typeSegment(transportTypes);
  }

  private static String normalize(String value) {
    return value.strip().toLowerCase(Locale.ROOT);
  }

  private static String timeSegment(Instant departureTime, Instant arrivalTime) {
    if (departureTime != null) {
      return "dep:" + departureTime.getEpochSecond();
    }
    if (arrivalTime != null) {
      return "arr:" + arrivalTime.getEpochSecond();
    }
    return "now";
  }

  private static String typeSegment(Collection<TransportType> transportTypes) {
    if (transportTypes == null || transportTypes.isEmpty()) {
      return ALL_TYPES;
    }
    return transportTypes.stream()
        .map(TransportType::name)
        .distinct()
        .sorted()
        .collect(Collectors.joining("-"));
  }
}
