package bahn.vision.scheduler;

import bahn.vision.config.CacheProperties;
import bahn.vision.dto.mvg.DeparturesResponse;
import bahn.vision.dto.mvg.StationListResponse;
import bahn.vision.global.executor.LogicExecutor;
import bahn.vision.global.executor.TaskContext;
import bahn.vision.service.cache.CacheOrchestrator;
import bahn.vision.service.cache.CacheRefreshProtocol;
import bahn.vision.service.cache.CacheResult;
import bahn.vision.service.cache.CacheStatus;
import bahn.vision.service.mvg.DeparturesQuery;
import bahn.vision.service.mvg.DeparturesRefreshProtocol;
import bahn.vision.service.mvg.StationListRefreshProtocol;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * 기동 시 캐시 워밍업
 *
 * <h4>대상</h4>
 *
 * <ul>
 *   <li>전체 역 목록 (역 저장소 write-through 포함)
 *   <li>{@code cache.warmup.departure-stations}에 설정된 역의 출발 정보
 * </ul>
 *
 * <p>캐시 상태와 무관하게 {@link CacheOrchestrator#refresh}로 강제 갱신합니다. 개별 실패는 요약에 기록하고 다음 대상으로 진행합니다.
 */
@Slf4j
public class CacheWarmupJob {

  static final String STATION_LIST_TARGET = "station-list";

  private final CacheOrchestrator orchestrator;
  private final StationListRefreshProtocol stationListProtocol;
  private final DeparturesRefreshProtocol departuresProtocol;
  private final CacheProperties.Warmup warmup;
  private final LogicExecutor logicExecutor;

  public CacheWarmupJob(
      CacheOrchestrator orchestrator,
      StationListRefreshProtocol stationListProtocol,
      DeparturesRefreshProtocol departuresProtocol,
      CacheProperties.Warmup warmup,
      LogicExecutor logicExecutor) {
    this.orchestrator = orchestrator;
    this.stationListProtocol = stationListProtocol;
    this.departuresProtocol = departuresProtocol;
    this.warmup = warmup;
    this.logicExecutor = logicExecutor;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    WarmupSummary summary = warmup();
    log.info(
        "[CacheWarmup] Completed: stationsCached={}, departuresWarmed={}, errors={}",
        summary.stationsCached(),
        summary.departuresWarmed(),
        summary.errors().size());
  }

  public WarmupSummary warmup() {
    List<String> errors = new ArrayList<>();

    int stationsCached = 0;
    CacheResult<StationListResponse> stations =
        refresh(stationListProtocol, null, STATION_LIST_TARGET);
    if (isRefreshed(stations)) {
      stationsCached = stations.value().stations().size();
    } else {
      errors.add(STATION_LIST_TARGET + ": " + describe(stations));
    }

    int departuresWarmed = 0;
    for (String station : warmup.getDepartureStations()) {
      DeparturesQuery query =
          new DeparturesQuery(
              station, warmup.getDepartureLimit(), warmup.getDepartureOffset(), Set.of());
      CacheResult<DeparturesResponse> departures = refresh(departuresProtocol, query, station);
      if (isRefreshed(departures)) {
        departuresWarmed++;
      } else {
        errors.add(station + ": " + describe(departures));
      }
    }

    return new WarmupSummary(stationsCached, departuresWarmed, List.copyOf(errors));
  }

  private <P, T> CacheResult<T> refresh(
      CacheRefreshProtocol<P, T> protocol, P params, String target) {
    return logicExecutor.executeOrDefault(
        () -> orchestrator.refresh(protocol.cacheKey(params), protocol, params).join(),
        null,
        TaskContext.of("CacheWarmup", protocol.cacheName(), target));
  }

  private static boolean isRefreshed(CacheResult<?> result) {
    return result != null && result.status() == CacheStatus.HIT && result.hasValue();
  }

  private static String describe(CacheResult<?> result) {
    if (result == null) {
      return "unexpected failure";
    }
    return result.detail() != null
        ? result.status() + " (" + result.detail() + ")"
        : result.status().toString();
  }

  /**
   * 워밍업 결과 요약
   *
   * @param stationsCached 캐시된 역 수
   * @param departuresWarmed 워밍업에 성공한 출발 정보 역 수
   * @param errors 실패 대상별 사유
   */
  public record WarmupSummary(int stationsCached, int departuresWarmed, List<String> errors) {}
}
