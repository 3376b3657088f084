package com.polarroute.route.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polarroute.route.entity.Mesh;
import com.polarroute.route.entity.Route;
import com.polarroute.route.model.CalculationOutcome;
import com.polarroute.route.model.Waypoint;
import com.polarroute.route.repository.MeshRepository;
import com.polarroute.route.repository.RouteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Runs one route calculation.
 *
 * Stages:
 *  1. Load the mesh, from the store by id or from a JSON (optionally gzipped) file
 *  2. Build the Start/End waypoints from the stored route
 *  3. Compute the unsmoothed path and save it with calculatedAt + planner version (checkpoint)
 *  4. Smooth it and save the final geometry, refreshing calculatedAt + version
 *
 * Any failure in 1-4 is written to Route.info and returned as a FAILURE outcome. The checkpoint
 * saved in stage 3 stays in place when stage 4 fails. Nothing is rethrown, and a failed
 * calculation is never retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteCalculationWorker {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final RouteRepository routeRepository;
    private final MeshRepository meshRepository;
    private final RoutePlanner routePlanner;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CalculationOutcome calculate(Long routeId, Long meshId, String meshPath) {
        Route route = routeRepository.findById(routeId).orElse(null);
        if (route == null) {
            log.warn("Route {} not found, nothing to calculate", routeId);
            return CalculationOutcome.failure("Route " + routeId + " not found");
        }

        try {
            Map<String, Object> mesh = loadMesh(meshId, meshPath);
            List<Waypoint> waypoints = List.of(
                    new Waypoint(Waypoint.START, route.getStartLat(), route.getStartLon()),
                    new Waypoint(Waypoint.END, route.getEndLat(), route.getEndLon()));

            Map<String, Object> unsmoothed = routePlanner.computeUnsmoothed(mesh, waypoints);
            route.setJsonUnsmoothed(unsmoothed);
            route.setCalculatedAt(clock.instant());
            route.setPolarRouteVersion(routePlanner.version());
            route = routeRepository.save(route);
            log.info("Route {} unsmoothed path saved", routeId);

            Map<String, Object> smoothed = routePlanner.smooth(mesh, unsmoothed);
            route.setJson(smoothed);
            route.setCalculatedAt(clock.instant());
            route.setPolarRouteVersion(routePlanner.version());
            route = routeRepository.save(route);
            log.info("Route {} smoothed path saved", routeId);

            return CalculationOutcome.success(smoothed);

        } catch (Exception e) {
            String message = describe(e);
            log.error("Route {} calculation failed: {}", routeId, message, e);
            route.setInfo(message);
            routeRepository.save(route);
            return CalculationOutcome.failure(message);
        }
    }

    Map<String, Object> loadMesh(Long meshId, String meshPath) throws IOException {
        if (meshId != null) {
            return meshRepository.findById(meshId)
                    .map(Mesh::getJson)
                    .orElseThrow(() -> new IllegalStateException("Mesh " + meshId + " not found"));
        }
        if (meshPath == null || meshPath.isBlank()) {
            throw new IllegalStateException("No mesh id or mesh path supplied");
        }
        Path path = Path.of(meshPath);
        try (InputStream in = openMesh(path)) {
            return objectMapper.readValue(in, JSON_OBJECT);
        }
    }

    private InputStream openMesh(Path path) throws IOException {
        InputStream raw = Files.newInputStream(path);
        return path.getFileName().toString().endsWith(".gz") ? new GZIPInputStream(raw) : raw;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
