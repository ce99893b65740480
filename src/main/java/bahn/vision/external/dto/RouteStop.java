package bahn.vision.external.dto;

import java.time.Instant;

public record RouteStop(
    String id,
    String name,
    String place,
    Double latitude,
    Double longitude,
    Instant plannedTime,
    Instant realtimeTime,
    String platform) {}
