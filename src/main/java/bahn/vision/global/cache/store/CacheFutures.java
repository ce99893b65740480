package bahn.vision.global.cache.store;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/** 저장소 Fallback 기본값 공급용 헬퍼 */
final class CacheFutures {

  private CacheFutures() {}

  static CompletableFuture<Optional<String>> emptyValue() {
    return CompletableFuture.completedFuture(Optional.empty());
  }

  static CompletableFuture<Void> done() {
    return CompletableFuture.completedFuture(null);
  }
}
