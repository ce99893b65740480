package bahn.vision.dto.mvg;

import bahn.vision.external.dto.Station;
import java.util.List;

public record StationSearchResponse(String query, List<Station> results) {}
