package bahn.vision.service.mvg;

import bahn.vision.dto.mvg.DeparturesResponse;
import bahn.vision.external.MvgClient;
import bahn.vision.service.cache.CacheRefreshProtocol;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class DeparturesRefreshProtocol
    implements CacheRefreshProtocol<DeparturesQuery, DeparturesResponse> {

  public static final String CACHE_NAME = "mvg_departures";

  private final MvgClient mvgClient;

  @Override
  public String cacheName() {
    return CACHE_NAME;
  }

  @Override
  public Class<DeparturesResponse> resultType() {
    return DeparturesResponse.class;
  }

  @Override
  public String cacheKey(DeparturesQuery params) {
    return MvgCacheKeys.departures(
        params.station(), params.limit(), params.offset(), params.transportTypes());
  }

  @Override
  public CompletableFuture<DeparturesResponse> fetch(DeparturesQuery params) {
    return mvgClient
        .getDepartures(params.station(), params.limit(), params.offset(), params.transportTypes())
        .thenApply(result -> new DeparturesResponse(result.station(), result.departures()));
  }
}
