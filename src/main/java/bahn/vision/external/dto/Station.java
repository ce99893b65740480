package bahn.vision.external.dto;

public record Station(String id, String name, String place, double latitude, double longitude) {}
