package bahn.vision.global.cache;

import bahn.vision.global.cache.store.KeyValueStore;
import bahn.vision.global.executor.LogicExecutor;
import bahn.vision.global.executor.TaskContext;
import bahn.vision.global.executor.strategy.ExceptionTranslator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * fresh / stale 2-사본 캐시 엔트리 저장소
 *
 * <h4>키 구조</h4>
 *
 * <ul>
 *   <li>fresh: {@code key} (리소스 TTL)
 *   <li>stale: {@code key + "::stale"} (stale TTL, 항상 fresh TTL 이상)
 * </ul>
 *
 * <h4>쓰기 순서</h4>
 *
 * <p>stale 사본을 먼저 기록하고 fresh 사본을 마지막에 기록합니다. fresh 사본이 보이는 시점에는 stale 사본도 이미 같은 값으로 갱신되어 있으므로, 후속
 * 독자는 갱신 전 상태 또는 갱신 후 상태만 관찰합니다.
 *
 * <p>JSON 파싱에 실패한 엔트리는 없는 것으로 취급합니다.
 */
@Slf4j
public class CacheEntryStore {

  public static final String STALE_SUFFIX = "::stale";

  private final KeyValueStore store;
  private final ObjectMapper objectMapper;
  private final LogicExecutor logicExecutor;

  public CacheEntryStore(
      KeyValueStore store, ObjectMapper objectMapper, LogicExecutor logicExecutor) {
    this.store = store;
    this.objectMapper = objectMapper;
    this.logicExecutor = logicExecutor;
  }

  public static String staleKey(String key) {
    return key + STALE_SUFFIX;
  }

  public CompletableFuture<Optional<CachedPayload>> readFresh(String key) {
    return read(key);
  }

  public CompletableFuture<Optional<CachedPayload>> readStale(String key) {
    return read(staleKey(key));
  }

  /**
   * 값 직렬화 후 stale → fresh 순서로 기록
   *
   * @param key 캐시 키
   * @param value 직렬화 대상
   * @param ttl fresh / stale TTL
   */
  public CompletableFuture<Void> write(String key, Object value, CacheTtl ttl) {
    String json = serialize(key, value);
    if (!ttl.hasStale()) {
      return store.set(key, json, ttl.ttl());
    }
    return store
        .set(staleKey(key), json, ttl.staleTtl())
        .thenCompose(ignored -> store.set(key, json, ttl.ttl()));
  }

  /** 네거티브 캐시 마커 기록 (fresh 사본만, stale 사본은 건드리지 않음) */
  public CompletableFuture<Void> writeNotFound(String key, String detail, Duration ttl) {
    ObjectNode marker = objectMapper.createObjectNode();
    marker.put(CachedPayload.STATUS_FIELD, CachedPayload.NOT_FOUND_STATUS);
    marker.put(CachedPayload.DETAIL_FIELD, detail);
    return store.set(key, marker.toString(), ttl);
  }

  public CompletableFuture<Void> delete(String key, boolean includeStale) {
    CompletableFuture<Void> fresh = store.delete(key);
    if (!includeStale) {
      return fresh;
    }
    return fresh.thenCompose(ignored -> store.delete(staleKey(key)));
  }

  /**
   * 페이로드를 기대 타입으로 변환
   *
   * <p>배포 후 스키마가 바뀐 엔트리는 변환에 실패하며, 이 경우 캐시 미스로 취급하도록 빈 값을 반환합니다.
   */
  public <T> Optional<T> decode(CachedPayload payload, Class<T> type) {
    if (payload.isNotFound()) {
      return Optional.empty();
    }
    return Optional.ofNullable(
        logicExecutor.executeOrDefault(
            () -> objectMapper.treeToValue(payload.node(), type),
            null,
            TaskContext.of("CacheEntry", "decode", type.getSimpleName())));
  }

  private CompletableFuture<Optional<CachedPayload>> read(String key) {
    return store.get(key).thenApply(raw -> raw.flatMap(json -> parse(key, json)));
  }

  private Optional<CachedPayload> parse(String key, String json) {
    JsonNode node =
        logicExecutor.executeOrDefault(
            () -> objectMapper.readTree(json), null, TaskContext.of("CacheEntry", "parse", key));
    if (node == null || node.isMissingNode()) {
      log.debug("[CacheEntry] Unreadable entry ignored: {}", key);
      return Optional.empty();
    }
    return Optional.of(new CachedPayload(node));
  }

  private String serialize(String key, Object value) {
    return logicExecutor.executeWithTranslation(
        () -> objectMapper.writeValueAsString(value),
        ExceptionTranslator.forJson(),
        TaskContext.of("CacheEntry", "serialize", key));
  }
}
