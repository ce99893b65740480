package bahn.vision.service.mvg;

import bahn.vision.domain.repository.StationRepository;
import bahn.vision.dto.mvg.StationListResponse;
import bahn.vision.external.MvgClient;
import bahn.vision.global.cache.CacheEntryStore;
import bahn.vision.global.cache.CacheTtlConfig;
import bahn.vision.service.cache.CacheRefreshProtocol;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 전체 역 목록 캐시 갱신
 *
 * <p>캐시 기록 전에 역 카탈로그를 {@link StationRepository}에 write-through 합니다. 저장소 기록이 실패하면 캐시도 기록하지 않으므로 부분
 * 적용 상태가 남지 않습니다.
 */
@Slf4j
@RequiredArgsConstructor
public class StationListRefreshProtocol implements CacheRefreshProtocol<Void, StationListResponse> {

  public static final String CACHE_NAME = "mvg_station_list";

  private final MvgClient mvgClient;
  private final StationRepository stationRepository;

  @Override
  public String cacheName() {
    return CACHE_NAME;
  }

  @Override
  public Class<StationListResponse> resultType() {
    return StationListResponse.class;
  }

  @Override
  public String cacheKey(Void params) {
    return MvgCacheKeys.stationList();
  }

  @Override
  public CompletableFuture<StationListResponse> fetch(Void params) {
    return mvgClient
        .getAllStations()
        .thenApply(stations -> new StationListResponse(stations == null ? List.of() : stations));
  }

  @Override
  public CompletableFuture<Void> store(
      CacheEntryStore entries, String key, StationListResponse value, CacheTtlConfig ttlConfig) {
    return stationRepository
        .upsertStations(value.stations())
        .thenCompose(
            upserted -> {
              log.debug("[StationList] Stations upserted: {}", upserted);
              return entries.write(key, value, ttlConfig.resolve(cacheName()));
            });
  }
}
