package bahn.vision.external.dto;

/** MVG 교통수단 유형. 캐시 키에는 {@link #name()}을 사용합니다. */
public enum TransportType {
  BAHN,
  SBAHN,
  UBAHN,
  TRAM,
  BUS,
  REGIONAL_BUS,
  SEV,
  SCHIFF
}
