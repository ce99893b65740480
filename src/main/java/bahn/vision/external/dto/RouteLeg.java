package bahn.vision.external.dto;

import java.util.List;

public record RouteLeg(
    RouteStop origin,
    RouteStop destination,
    TransportType transportType,
    String line,
    String direction,
    Integer durationMinutes,
    Integer distanceMeters,
    List<RouteStop> intermediateStops) {}
