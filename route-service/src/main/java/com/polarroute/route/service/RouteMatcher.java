package com.polarroute.route.service;

import com.polarroute.route.entity.Mesh;
import com.polarroute.route.entity.Route;
import com.polarroute.route.repository.RouteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Looks for a stored route that already answers a request.
 *
 * The first candidate mesh (in selector order) holding any route decides on its own: an exact
 * endpoint match wins (lowest id when several), otherwise the tolerance ranker picks among that
 * mesh's routes. Later meshes are never consulted once one with routes has been found.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteMatcher {

    private final RouteRepository routeRepository;
    private final ToleranceRanker toleranceRanker;

    public Optional<Route> findExistingRoute(List<Mesh> meshes,
                                             double startLat, double startLon,
                                             double endLat, double endLon) {
        for (Mesh mesh : meshes) {
            List<Route> routes = routeRepository.findByMeshIdOrderByIdAsc(mesh.getId());
            if (routes.isEmpty()) {
                continue;
            }

            Optional<Route> exact = routes.stream()
                    .filter(r -> r.hasEndpoints(startLat, startLon, endLat, endLon))
                    .min(Comparator.comparing(Route::getId));
            if (exact.isPresent()) {
                log.info("Exact route match {} on mesh {}", exact.get().getId(), mesh.getId());
                return exact;
            }

            return toleranceRanker.closestWithinTolerance(routes, startLat, startLon, endLat, endLon);
        }
        return Optional.empty();
    }
}
