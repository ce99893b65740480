package bahn.vision.dto.mvg;

import bahn.vision.external.dto.Departure;
import bahn.vision.external.dto.Station;
import java.util.List;

public record DeparturesResponse(Station station, List<Departure> departures) {}
