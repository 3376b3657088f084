package com.polarroute.route.service;

import com.polarroute.route.entity.Route;
import com.polarroute.shared.util.H3Util;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Near-miss lookup over stored routes.
 *
 * A route qualifies only if its start is strictly closer than the tolerance to the requested
 * start AND its end is strictly closer than the tolerance to the requested end. Among
 * qualifiers the smallest sum of the two distances wins; equal sums go to the lowest id.
 */
@Slf4j
@Component
public class ToleranceRanker {

    private final double defaultToleranceNm;

    public ToleranceRanker(@Value("${route.waypoint-tolerance-nm:1.0}") double defaultToleranceNm) {
        this.defaultToleranceNm = defaultToleranceNm;
    }

    public Optional<Route> closestWithinTolerance(List<Route> routes,
                                                  double startLat, double startLon,
                                                  double endLat, double endLon) {
        return closestWithinTolerance(routes, startLat, startLon, endLat, endLon, defaultToleranceNm);
    }

    public Optional<Route> closestWithinTolerance(List<Route> routes,
                                                  double startLat, double startLon,
                                                  double endLat, double endLon,
                                                  double toleranceNm) {
        Route best = null;
        double bestSum = Double.POSITIVE_INFINITY;

        for (Route route : routes) {
            double startNm = H3Util.distanceNauticalMiles(startLat, startLon, route.getStartLat(), route.getStartLon());
            double endNm = H3Util.distanceNauticalMiles(endLat, endLon, route.getEndLat(), route.getEndLon());
            if (startNm >= toleranceNm || endNm >= toleranceNm) {
                continue;
            }

            double sum = startNm + endNm;
            if (best == null || sum < bestSum || (sum == bestSum && route.getId() < best.getId())) {
                best = route;
                bestSum = sum;
            }
        }

        if (best != null) {
            log.info("Route {} matched within {} nm (combined endpoint distance {} nm)",
                    best.getId(), toleranceNm, String.format("%.3f", bestSum));
        }
        return Optional.ofNullable(best);
    }
}
