package bahn.vision.service.mvg;

public record StationSearchQuery(String query, int limit) {}
