package bahn.vision.global.executor.strategy;

import bahn.vision.global.error.exception.CacheSerializationException;
import bahn.vision.global.error.exception.InternalSystemException;
import bahn.vision.global.error.exception.base.BaseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;

/**
 * 특정 예외를 도메인 예외로 변환하는 전략
 *
 * <h3>Error 격리</h3>
 *
 * <ul>
 *   <li>{@link Error}는 변환하지 않고 그대로 throw
 *   <li>{@link BaseException}은 비즈니스 예외이므로 그대로 pass-through
 *   <li>원본 예외를 cause로 보존
 * </ul>
 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e);

  /**
   * JSON 처리 예외 변환기
   *
   * <ul>
   *   <li>{@link JsonProcessingException}, {@link IOException} → {@link
   *       CacheSerializationException}
   *   <li>{@link BaseException} → 그대로 재전파
   *   <li>기타 → {@link InternalSystemException}
   * </ul>
   */
  static ExceptionTranslator forJson() {
    return e -> {
      if (e instanceof Error error) {
        throw error;
      }
      if (e instanceof IOException) {
        return new CacheSerializationException(e.getMessage(), e);
      }
      if (e instanceof BaseException base) {
        return base;
      }
      return new InternalSystemException("json-processing", e);
    };
  }
}
