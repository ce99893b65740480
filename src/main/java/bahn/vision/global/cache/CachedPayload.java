package bahn.vision.global.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 캐시에서 읽은 JSON 페이로드
 *
 * <p>네거티브 캐시 마커({@code {"__status":"not_found","detail":...}})인지 여부를 함께 판별합니다.
 *
 * @param node 파싱된 JSON
 */
public record CachedPayload(JsonNode node) {

  public static final String STATUS_FIELD = "__status";
  public static final String DETAIL_FIELD = "detail";
  public static final String NOT_FOUND_STATUS = "not_found";

  public boolean isNotFound() {
    return node.isObject() && NOT_FOUND_STATUS.equals(node.path(STATUS_FIELD).asText(null));
  }

  /** 네거티브 캐시 마커의 상세 메시지 (마커가 아니면 null) */
  public String notFoundDetail() {
    if (!isNotFound()) {
      return null;
    }
    JsonNode detail = node.get(DETAIL_FIELD);
    return detail == null || detail.isNull() ? null : detail.asText();
  }
}
