package bahn.vision.config;

import bahn.vision.global.cache.store.RedissonConnector;
import java.net.URI;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import lombok.RequiredArgsConstructor;
import org.redisson.Redisson;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 원격 캐시 저장소(Redis) 클라이언트 설정
 *
 * <p>{@code cache.remote-uri} 형식: {@code redis[s]://[user:password@]host[:port][/db]}
 *
 * <p>기동 시 Redis에 접속할 수 없어도 컨텍스트는 정상 기동하며, 접속 전까지 모든 요청은 fallback 저장소로 처리됩니다. 재접속은
 * Circuit Breaker 쿨다운 간격으로 시도합니다.
 */
@Configuration
@RequiredArgsConstructor
public class RedissonConfig {

  private static final String DEFAULT_SCHEME = "redis";
  private static final Set<String> SUPPORTED_SCHEMES = Set.of("redis", "rediss");
  private static final int DEFAULT_PORT = 6379;

  private final CacheProperties cacheProperties;

  @Bean(destroyMethod = "shutdown")
  public RedissonConnector redissonConnector(
      @Qualifier("cacheScheduler") ScheduledExecutorService cacheScheduler) {
    Config config = new Config();
    configureSingleServer(config, URI.create(cacheProperties.getRemoteUri()));
    RedissonConnector connector =
        new RedissonConnector(
            () -> Redisson.create(config),
            cacheScheduler,
            cacheProperties.getCircuitBreakerCooldown());
    connector.connect();
    return connector;
  }

  static SingleServerConfig configureSingleServer(Config config, URI uri) {
    int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
    SingleServerConfig server =
        config
            .useSingleServer()
            .setAddress(schemeOf(uri) + "://" + uri.getHost() + ":" + port)
            .setDatabase(parseDatabase(uri.getPath()))
            .setRetryAttempts(1)
            .setRetryInterval(500)
            .setTimeout(3000)
            .setConnectTimeout(2000)
            .setConnectionPoolSize(32)
            .setConnectionMinimumIdleSize(8);

    String userInfo = uri.getUserInfo();
    if (userInfo != null && !userInfo.isEmpty()) {
      int separator = userInfo.indexOf(':');
      if (separator < 0) {
        server.setPassword(userInfo);
      } else {
        if (separator > 0) {
          server.setUsername(userInfo.substring(0, separator));
        }
        server.setPassword(userInfo.substring(separator + 1));
      }
    }
    return server;
  }

  static String schemeOf(URI uri) {
    String scheme = uri.getScheme();
    if (scheme == null) {
      return DEFAULT_SCHEME;
    }
    String normalized = scheme.toLowerCase();
    if (!SUPPORTED_SCHEMES.contains(normalized)) {
      throw new IllegalArgumentException("Unsupported cache.remote-uri scheme: " + scheme);
    }
    return normalized;
  }

  static int parseDatabase(String path) {
    if (path == null || path.length() <= 1) {
      return 0;
    }
    return Integer.parseInt(path.substring(1));
  }
}
