package bahn.vision.config;

import bahn.vision.domain.repository.StationRepository;
import bahn.vision.external.MvgClient;
import bahn.vision.global.executor.LogicExecutor;
import bahn.vision.scheduler.CacheWarmupJob;
import bahn.vision.service.cache.CacheOrchestrator;
import bahn.vision.service.mvg.DeparturesRefreshProtocol;
import bahn.vision.service.mvg.RouteRefreshProtocol;
import bahn.vision.service.mvg.StationListRefreshProtocol;
import bahn.vision.service.mvg.StationSearchRefreshProtocol;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MVG 리소스별 갱신 프로토콜 구성
 *
 * <p>업스트림 클라이언트({@link MvgClient})와 역 저장소({@link StationRepository}) 구현이 등록된 경우에만 활성화됩니다.
 */
@Configuration
@ConditionalOnBean({MvgClient.class, StationRepository.class})
public class MvgCacheConfig {

  @Bean
  public DeparturesRefreshProtocol departuresRefreshProtocol(MvgClient mvgClient) {
    return new DeparturesRefreshProtocol(mvgClient);
  }

  @Bean
  public StationSearchRefreshProtocol stationSearchRefreshProtocol(MvgClient mvgClient) {
    return new StationSearchRefreshProtocol(mvgClient);
  }

  @Bean
  public StationListRefreshProtocol stationListRefreshProtocol(
      MvgClient mvgClient, StationRepository stationRepository) {
    return new StationListRefreshProtocol(mvgClient, stationRepository);
  }

  @Bean
  public RouteRefreshProtocol routeRefreshProtocol(MvgClient mvgClient) {
    return new RouteRefreshProtocol(mvgClient);
  }

  @Bean
  @ConditionalOnProperty(prefix = "cache.warmup", name = "enabled", havingValue = "true")
  public CacheWarmupJob cacheWarmupJob(
      CacheOrchestrator cacheOrchestrator,
      StationListRefreshProtocol stationListRefreshProtocol,
      DeparturesRefreshProtocol departuresRefreshProtocol,
      CacheProperties cacheProperties,
      LogicExecutor logicExecutor) {
    return new CacheWarmupJob(
        cacheOrchestrator,
        stationListRefreshProtocol,
        departuresRefreshProtocol,
        cacheProperties.getWarmup(),
        logicExecutor);
  }
}
