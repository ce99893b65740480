package bahn.vision.global.cache.store;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RBucket;
import org.redisson.client.codec.StringCodec;

/**
 * Redisson 기반 원격 저장소
 *
 * <p>모든 연산은 Redisson Async API({@code RFuture})를 사용하며 호출 스레드를 블로킹하지 않습니다. 값은 JSON 문자열 그대로 저장되도록
 * {@link StringCodec}을 사용합니다.
 *
 * <p>클라이언트는 호출마다 {@link RedissonConnector}에서 얻으며, 미접속 상태면 동기 예외가 발생합니다.
 */
@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

  private final RedissonConnector connector;

  @Override
  public CompletableFuture<Optional<String>> get(String key) {
    return bucket(key).getAsync().toCompletableFuture().thenApply(Optional::ofNullable);
  }

  @Override
  public CompletableFuture<Void> set(String key, String value, Duration ttl) {
    RBucket<String> bucket = bucket(key);
    if (!KeyValueStore.expires(ttl)) {
      return bucket.setAsync(value).toCompletableFuture();
    }
    return bucket.setAsync(value, ttl.toMillis(), TimeUnit.MILLISECONDS).toCompletableFuture();
  }

  @Override
  public CompletableFuture<Boolean> setIfAbsent(String key, String value, Duration ttl) {
    RBucket<String> bucket = bucket(key);
    if (!KeyValueStore.expires(ttl)) {
      return bucket.trySetAsync(value).toCompletableFuture();
    }
    return bucket.trySetAsync(value, ttl.toMillis(), TimeUnit.MILLISECONDS).toCompletableFuture();
  }

  @Override
  public CompletableFuture<Boolean> compareAndDelete(String key, String expected) {
    // update=null → 값이 일치하면 키 삭제 (원자적)
    return bucket(key).compareAndSetAsync(expected, null).toCompletableFuture();
  }

  @Override
  public CompletableFuture<Void> delete(String key) {
    return bucket(key).deleteAsync().toCompletableFuture().thenApply(deleted -> null);
  }

  private RBucket<String> bucket(String key) {
    return connector.client().getBucket(key, StringCodec.INSTANCE);
  }
}
