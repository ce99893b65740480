package bahn.vision.global.lock;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 캐시 키 단위 상호 배제 락
 *
 * <p>동일 키에 대해 동시에 하나의 갱신(fetch + store)만 실행되도록 보장합니다. 대기와 재시도는 호출자가 담당하며, 락 자체는 즉시 판정만 합니다.
 *
 * @see StoreBackedSingleFlightLock
 */
public interface SingleFlightLock {

  /**
   * 락 획득 1회 시도 (대기 없음)
   *
   * @return 획득 시 토큰, 이미 다른 소유자가 있으면 빈 값
   */
  CompletableFuture<Optional<LockToken>> tryAcquire(String key);

  /**
   * 락 해제. 소유자가 바뀐 경우(TTL 만료 후 재획득 등) 삭제하지 않습니다.
   *
   * @return 실제로 해제했으면 true
   */
  CompletableFuture<Boolean> release(LockToken token);
}
