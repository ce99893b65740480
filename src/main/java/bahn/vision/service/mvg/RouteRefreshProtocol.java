package bahn.vision.service.mvg;

import bahn.vision.dto.mvg.RouteResponse;
import bahn.vision.external.MvgClient;
import bahn.vision.external.dto.RouteSearch;
import bahn.vision.global.error.exception.RouteNotFoundException;
import bahn.vision.service.cache.CacheRefreshProtocol;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;

/** 경로 탐색 캐시 갱신. 경로 후보가 하나도 없으면 {@link RouteNotFoundException}으로 실패합니다. */
@RequiredArgsConstructor
public class RouteRefreshProtocol implements CacheRefreshProtocol<RouteQuery, RouteResponse> {

  public static final String CACHE_NAME = "mvg_route";

  private final MvgClient mvgClient;

  @Override
  public String cacheName() {
    return CACHE_NAME;
  }

  @Override
  public Class<RouteResponse> resultType() {
    return RouteResponse.class;
  }

  @Override
  public String cacheKey(RouteQuery params) {
    return MvgCacheKeys.route(
        params.origin(),
        params.destination(),
        params.departureTime(),
        params.arrivalTime(),
        params.transportTypes());
  }

  @Override
  public CompletableFuture<RouteResponse> fetch(RouteQuery params) {
    return mvgClient
        .planRoute(
            params.origin(),
            params.destination(),
            params.departureTime(),
            params.arrivalTime(),
            params.transportTypes())
        .thenApply(search -> toResponse(params, search));
  }

  private RouteResponse toResponse(RouteQuery params, RouteSearch search) {
    if (search.plans() == null || search.plans().isEmpty()) {
      throw new RouteNotFoundException(params.origin(), params.destination());
    }
    return new RouteResponse(search.origin(), search.destination(), search.plans());
  }
}
