package bahn.vision.dto.mvg;

import bahn.vision.external.dto.RoutePlan;
import bahn.vision.external.dto.Station;
import java.util.List;

public record RouteResponse(Station origin, Station destination, List<RoutePlan> plans) {}
