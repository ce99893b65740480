package bahn.vision.domain.repository;

import bahn.vision.external.dto.Station;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;

/** 역 카탈로그 영속 저장소 (역 목록 캐시 갱신 시 write-through 대상) */
public interface StationRepository {

  /**
   * 역 정보 일괄 upsert (ID 기준)
   *
   * @return upsert된 역 수
   */
  CompletableFuture<Integer> upsertStations(Collection<Station> stations);
}
