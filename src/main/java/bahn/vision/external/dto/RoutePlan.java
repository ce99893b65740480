package bahn.vision.external.dto;

import java.time.Instant;
import java.util.List;

public record RoutePlan(
    Integer durationMinutes,
    Integer transfers,
    Instant departure,
    Instant arrival,
    List<RouteLeg> legs) {}
