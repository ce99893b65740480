package bahn.vision.external.dto;

import java.time.Instant;
import java.util.List;

public record Departure(
    Instant plannedTime,
    Instant realtimeTime,
    int delayMinutes,
    String platform,
    boolean realtime,
    String line,
    String destination,
    TransportType transportType,
    String icon,
    boolean cancelled,
    List<String> messages) {}
