package bahn.vision.service.mvg;

import static org.assertj.core.api.Assertions.assertThat;

import bahn.vision.external.dto.TransportType;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class MvgCacheKeysTest {

  @Test
  @DisplayName("출발 정보 키: 역 이름 정규화, 교통수단 정렬")
  void departuresKey() {
    String key =
        MvgCacheKeys.departures(
            "  Marienplatz ", 10, 5, List.of(TransportType.UBAHN, TransportType.BUS));

    assertThat(key).isEqualTo("mvg:departures:marienplatz:10:5:BUS-UBAHN");
  }

  @Test
  @DisplayName("의미가 같은 요청은 같은 키")
  void equivalentRequestsShareKey() {
    String a =
        MvgCacheKeys.departures(
            "Marienplatz",
            10,
            0,
            List.of(TransportType.SBAHN, TransportType.UBAHN, TransportType.SBAHN));
    String b =
        MvgCacheKeys.departures(
            "marienplatz", 10, 0, Set.of(TransportType.UBAHN, TransportType.SBAHN));

    assertThat(a).isEqualTo(b);
  }

  @Test
  @DisplayName("교통수단 필터가 없으면 all")
  void emptyTypesBecomeAll() {
    assertThat(MvgCacheKeys.departures("x", 10, 0, Set.of())).endsWith(":all");
    assertThat(MvgCacheKeys.departures("x", 10, 0, null)).endsWith(":all");
  }

  @Test
  @DisplayName("역 검색 / 전체 목록 키")
  void stationKeys() {
    assertThat(MvgCacheKeys.stationSearch(" Hauptbahnhof", 8))
        .isEqualTo("mvg:stations:search:hauptbahnhof:8");
    assertThat(MvgCacheKeys.stationList()).isEqualTo("mvg:stations:all");
  }

  @Test
  @DisplayName("경로 키: 출발 시각 우선, 없으면 도착 시각, 둘 다 없으면 now")
  void routeKeyTimeSegment() {
    Instant departure = Instant.ofEpochSecond(1_700_000_000L);
    Instant arrival = Instant.ofEpochSecond(1_700_003_600L);

    assertThat(MvgCacheKeys.route("A", "B", departure, arrival, Set.of()))
        .isEqualTo("mvg:route:a:b:dep:1700000000:all");
    assertThat(MvgCacheKeys.route("A", "B", null, arrival, Set.of(TransportType.TRAM)))
        .isEqualTo("mvg:route:a:b:arr:1700003600:TRAM");
    assertThat(MvgCacheKeys.route("A", "B", null, null, Set.of()))
        .isEqualTo("mvg:route:a:b:now:all");
  }
}
