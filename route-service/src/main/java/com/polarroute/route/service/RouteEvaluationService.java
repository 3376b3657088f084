package com.polarroute.route.service;

import com.polarroute.route.entity.Mesh;
import com.polarroute.route.model.EvaluationResult;
import com.polarroute.shared.enums.JobState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Travel time and fuel estimate for a route the caller already has.
 * The mesh is the one the selector would pick for the route's bounding box, so every point of
 * the route lies inside it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteEvaluationService {

    private final MeshSelector meshSelector;
    private final RoutePlanner routePlanner;

    public EvaluationResult evaluate(Map<String, Object> route) {
        List<List<Double>> coordinates;
        try {
            coordinates = GeoJson.coordinates(route);
        } catch (IllegalArgumentException | ClassCastException e) {
            return EvaluationResult.failure("Invalid route: " + e.getMessage());
        }

        double latMin = Double.POSITIVE_INFINITY, latMax = Double.NEGATIVE_INFINITY;
        double lonMin = Double.POSITIVE_INFINITY, lonMax = Double.NEGATIVE_INFINITY;
        for (List<Double> c : coordinates) {
            lonMin = Math.min(lonMin, c.get(0));
            lonMax = Math.max(lonMax, c.get(0));
            latMin = Math.min(latMin, c.get(1));
            latMax = Math.max(latMax, c.get(1));
        }

        List<Mesh> meshes = meshSelector.selectMesh(latMin, lonMin, latMax, lonMax);
        if (meshes.isEmpty()) {
            return EvaluationResult.failure("No suitable mesh available.");
        }
        Mesh mesh = meshes.get(0);

        try {
            Map<String, Object> evaluated = routePlanner.evaluate(mesh.getJson(), route);
            double timeDays = GeoJson.lastValue(evaluated, "traveltime");
            double fuel = GeoJson.lastValue(evaluated, "fuel");
            log.info("Evaluated {}-point route on mesh {}: {} days, {} t fuel",
                    coordinates.size(), mesh.getId(), timeDays, fuel);

            return EvaluationResult.builder()
                    .status(JobState.SUCCESS)
                    .meshId(mesh.getId())
                    .route(evaluated)
                    .timeDays(timeDays)
                    .timeStr(formatDays(timeDays))
                    .fuelTonnes(Math.round(fuel * 100.0) / 100.0)
                    .build();

        } catch (RuntimeException e) {
            log.error("Route evaluation failed on mesh {}: {}", mesh.getId(), e.getMessage(), e);
            return EvaluationResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /** Decimal days as "D days H hours M minutes". */
    static String formatDays(double decimalDays) {
        long totalMinutes = Math.round(decimalDays * 24 * 60);
        long days = totalMinutes / (24 * 60);
        long hours = (totalMinutes % (24 * 60)) / 60;
        long minutes = totalMinutes % 60;
        return days + " days " + hours + " hours " + minutes + " minutes";
    }
}
