package bahn.vision.service.mvg;

import bahn.vision.dto.mvg.StationSearchResponse;
import bahn.vision.external.MvgClient;
import bahn.vision.external.dto.Station;
import bahn.vision.global.error.exception.StationNotFoundException;
import bahn.vision.service.cache.CacheRefreshProtocol;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;

/**
 * 역 검색 캐시 갱신
 *
 * <p>전체 역 목록에서 이름 또는 지역(place)에 검색어가 포함된 역을 목록 순서대로 최대 limit개 반환합니다. 결과가 없으면 {@link
 * StationNotFoundException}으로 실패하여 네거티브 캐싱됩니다.
 */
@RequiredArgsConstructor
public class StationSearchRefreshProtocol
    implements CacheRefreshProtocol<StationSearchQuery, StationSearchResponse> {

  public static final String CACHE_NAME = "mvg_station_search";

  private final MvgClient mvgClient;

  @Override
  public String cacheName() {
    return CACHE_NAME;
  }

  @Override
  public Class<StationSearchResponse> resultType() {
    return StationSearchResponse.class;
  }

  @Override
  public String cacheKey(StationSearchQuery params) {
    return MvgCacheKeys.stationSearch(params.query(), params.limit());
  }

  @Override
  public CompletableFuture<StationSearchResponse> fetch(StationSearchQuery params) {
    return mvgClient.getAllStations().thenApply(stations -> search(stations, params));
  }

  private StationSearchResponse search(List<Station> stations, StationSearchQuery params) {
    String needle = params.query().strip().toLowerCase(Locale.ROOT);
    List<Station> matches =
        stations.stream()
            .filter(station -> matches(station, needle))
            .limit(params.limit())
            .toList();
    if (matches.isEmpty()) {
      throw new StationNotFoundException(params.query());
    }
    return new StationSearchResponse(params.query(), matches);
  }

  private static boolean matches(Station station, String needle) {
    return contains(station.name(), needle) || contains(station.place(), needle);
  }

  private static boolean contains(String value, String needle) {
    return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
  }
}
