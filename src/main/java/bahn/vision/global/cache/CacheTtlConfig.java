package bahn.vision.global.cache;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * 캐시 이름별 TTL 해석기
 *
 * <ul>
 *   <li>리소스별 설정이 있으면 해당 TTL 사용
 *   <li>fresh TTL 미설정 시 기본 TTL
 *   <li>stale TTL 미설정 시 stale 사본 없음
 * </ul>
 *
 * <p>음수 기간은 생성 시점에 거부합니다. 0은 만료 없음입니다.
 */
public class CacheTtlConfig {

  private final Duration defaultTtl;
  private final Duration notFoundTtl;
  private final Map<String, CacheTtl> resources;

  public CacheTtlConfig(
      Duration defaultTtl, Duration notFoundTtl, Map<String, CacheTtl> resources) {
    this.defaultTtl = requireNonNegative("defaultTtl", defaultTtl);
    this.notFoundTtl = requireNonNegative("notFoundTtl", notFoundTtl);
    resources.forEach(
        (name, ttl) -> {
          if (ttl.ttl() != null) {
            requireNonNegative(name + ".ttl", ttl.ttl());
          }
          if (ttl.staleTtl() != null) {
            requireNonNegative(name + ".staleTtl", ttl.staleTtl());
          }
        });
    this.resources = Map.copyOf(resources);
  }

  /** 캐시 이름에 해당하는 fresh / stale TTL */
  public CacheTtl resolve(String cacheName) {
    CacheTtl configured = resources.get(cacheName);
    if (configured == null) {
      return CacheTtl.of(defaultTtl);
    }
    Duration ttl = configured.ttl() != null ? configured.ttl() : defaultTtl;
    return new CacheTtl(ttl, configured.staleTtl());
  }

  public Duration getDefaultTtl() {
    return defaultTtl;
  }

  public Duration getNotFoundTtl() {
    return notFoundTtl;
  }

  private static Duration requireNonNegative(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) {
      throw new IllegalArgumentException(name + " must not be negative: " + value);
    }
    return value;
  }
}
