package bahn.vision.global.cache;

import java.time.Duration;

/**
 * fresh / stale TTL 쌍
 *
 * <p>stale TTL이 fresh TTL보다 짧게 설정되면 fresh TTL로 끌어올립니다. fresh TTL이 만료 없음(0 이하)이면 stale 사본도 만료 없음으로
 * 기록합니다.
 *
 * @param ttl fresh 엔트리 TTL (0 이하: 만료 없음)
 * @param staleTtl stale 엔트리 TTL ({@code null}: stale 사본 없음)
 */
public record CacheTtl(Duration ttl, Duration staleTtl) {

  public CacheTtl {
    if (ttl != null && staleTtl != null && !isForever(staleTtl)) {
      if (isForever(ttl)) {
        staleTtl = ttl;
      } else if (staleTtl.compareTo(ttl) < 0) {
        staleTtl = ttl;
      }
    }
  }

  public static CacheTtl of(Duration ttl) {
    return new CacheTtl(ttl, null);
  }

  public boolean hasStale() {
    return staleTtl != null;
  }

  private static boolean isForever(Duration duration) {
    return duration.isZero() || duration.isNegative();
  }
}
