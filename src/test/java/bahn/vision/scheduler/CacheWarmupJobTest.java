package bahn.vision.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import bahn.vision.config.CacheProperties;
import bahn.vision.domain.repository.StationRepository;
import bahn.vision.dto.mvg.DeparturesResponse;
import bahn.vision.dto.mvg.StationListResponse;
import bahn.vision.external.MvgClient;
import bahn.vision.external.dto.Station;
import bahn.vision.global.executor.DefaultLogicExecutor;
import bahn.vision.service.cache.CacheOrchestrator;
import bahn.vision.service.cache.CacheResult;
import bahn.vision.service.cache.FailureKind;
import bahn.vision.service.mvg.DeparturesQuery;
import bahn.vision.service.mvg.DeparturesRefreshProtocol;
import bahn.vision.service.mvg.StationListRefreshProtocol;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class CacheWarmupJobTest {

  private static final Station MARIENPLATZ =
      new Station("de:09162:2", "Marienplatz", "München", 48.137, 11.575);

  @Mock private CacheOrchestrator orchestrator;
  @Mock private MvgClient mvgClient;
  @Mock private StationRepository stationRepository;

  private StationListRefreshProtocol stationListProtocol;
  private DeparturesRefreshProtocol departuresProtocol;
  private CacheProperties.Warmup warmup;
  private CacheWarmupJob job;

  @BeforeEach
  void setUp() {
    stationListProtocol = new StationListRefreshProtocol(mvgClient, stationRepository);
    departuresProtocol = new DeparturesRefreshProtocol(mvgClient);
    warmup = new CacheProperties.Warmup();
    warmup.setEnabled(true);
    warmup.setDepartureStations(List.of("Marienplatz", "Atlantis"));
    warmup.setDepartureLimit(20);
    warmup.setDepartureOffset(2);
    job =
        new CacheWarmupJob(
            orchestrator,
            stationListProtocol,
            departuresProtocol,
            warmup,
            new DefaultLogicExecutor(new SimpleMeterRegistry()));
  }

  @Test
  @DisplayName("역 목록과 설정된 역의 출발 정보를 강제 갱신하고 결과 요약")
  void shouldRefreshStationListAndDepartures() {
    // given
    given(orchestrator.refresh(eq("mvg:stations:all"), eq(stationListProtocol), any()))
        .willReturn(
            CompletableFuture.completedFuture(
                CacheResult.refreshed(new StationListResponse(List.of(MARIENPLATZ)))));
    DeparturesQuery marienplatz = new DeparturesQuery("Marienplatz", 20, 2, Set.of());
    given(
            orchestrator.refresh(
                "mvg:departures:marienplatz:20:2:all", departuresProtocol, marienplatz))
        .willReturn(
            CompletableFuture.completedFuture(
                CacheResult.refreshed(new DeparturesResponse(MARIENPLATZ, List.of()))));
    DeparturesQuery atlantis = new DeparturesQuery("Atlantis", 20, 2, Set.of());
    given(orchestrator.refresh("mvg:departures:atlantis:20:2:all", departuresProtocol, atlantis))
        .willReturn(
            CompletableFuture.completedFuture(
                CacheResult.<DeparturesResponse>notFound("no such station", "miss")));

    // when
    CacheWarmupJob.WarmupSummary summary = job.warmup();

    // then
    assertThat(summary.stationsCached()).isEqualTo(1);
    assertThat(summary.departuresWarmed()).isEqualTo(1);
    assertThat(summary.errors()).singleElement().asString().startsWith("Atlantis");
  }

  @Test
  @DisplayName("역 목록 갱신이 실패해도 출발 정보 워밍업은 계속 진행")
  void stationListFailureDoesNotStopDepartures() {
    warmup.setDepartureStations(List.of("Marienplatz"));
    given(orchestrator.refresh(eq("mvg:stations:all"), eq(stationListProtocol), any()))
        .willReturn(CompletableFuture.failedFuture(new IllegalStateException("bug")));
    given(orchestrator.refresh(eq("mvg:departures:marienplatz:20:2:all"), any(), any()))
        .willReturn(
            CompletableFuture.completedFuture(
                CacheResult.<Object>error(FailureKind.UPSTREAM_ERROR, "mvg down")));

    CacheWarmupJob.WarmupSummary summary = job.warmup();

    assertThat(summary.stationsCached()).isZero();
    assertThat(summary.departuresWarmed()).isZero();
    assertThat(summary.errors()).hasSize(2);
    then(orchestrator).should().refresh(eq("mvg:departures:marienplatz:20:2:all"), any(), any());
  }
}
