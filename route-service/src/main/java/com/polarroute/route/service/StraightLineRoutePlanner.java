package com.polarroute.route.service;

import com.polarroute.route.model.Waypoint;
import com.polarroute.shared.util.H3Util;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stub route planner.
 * In production this would hand the mesh to the PolarRoute optimiser (Dijkstra search over
 * the mesh cells, then smoothing). Here the unsmoothed path is the straight line between the
 * waypoints, smoothing interpolates it, and travel time / fuel follow from the vessel speed
 * in the mesh config ({@code config.vessel_info.max_speed}, km/h) at a constant burn rate.
 */
@Slf4j
@Component
public class StraightLineRoutePlanner implements RoutePlanner {

    static final String VERSION = "straight-line-0.1";
    static final double DEFAULT_SPEED_KMH = 26.5;
    static final double FUEL_TONNES_PER_DAY = 20.0;
    private static final int SMOOTHING_SEGMENTS = 8;

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public Map<String, Object> computeUnsmoothed(Map<String, Object> mesh, List<Waypoint> waypoints) {
        if (waypoints.size() < 2) {
            throw new IllegalArgumentException("At least two waypoints are required, got " + waypoints.size());
        }
        List<List<Double>> coordinates = new ArrayList<>();
        for (Waypoint wp : waypoints) {
            coordinates.add(List.of(wp.lon(), wp.lat()));
        }
        log.info("Planning {} -> {} over {} waypoint(s)", waypoints.get(0).name(),
                waypoints.get(waypoints.size() - 1).name(), waypoints.size());
        return featureCollection(coordinates, waypoints.get(0).name(),
                waypoints.get(waypoints.size() - 1).name(), speedKmh(mesh));
    }

    @Override
    public Map<String, Object> smooth(Map<String, Object> mesh, Map<String, Object> unsmoothed) {
        List<List<Double>> path = GeoJson.coordinates(unsmoothed);
        List<List<Double>> smoothed = new ArrayList<>();
        for (int i = 0; i < path.size() - 1; i++) {
            List<Double> a = path.get(i);
            List<Double> b = path.get(i + 1);
            for (int s = 0; s < SMOOTHING_SEGMENTS; s++) {
                double f = (double) s / SMOOTHING_SEGMENTS;
                smoothed.add(List.of(a.get(0) + (b.get(0) - a.get(0)) * f, a.get(1) + (b.get(1) - a.get(1)) * f));
            }
        }
        smoothed.add(path.get(path.size() - 1));
        Map<String, Object> props = GeoJson.properties(unsmoothed);
        return featureCollection(smoothed, (String) props.get("from"), (String) props.get("to"), speedKmh(mesh));
    }

    @Override
    public Map<String, Object> evaluate(Map<String, Object> mesh, Map<String, Object> route) {
        Map<String, Object> props = GeoJson.properties(route);
        String from = props.get("from") != null ? props.get("from").toString() : Waypoint.START;
        String to = props.get("to") != null ? props.get("to").toString() : Waypoint.END;
        return featureCollection(GeoJson.coordinates(route), from, to, speedKmh(mesh));
    }

    private Map<String, Object> featureCollection(List<List<Double>> coordinates, String from, String to, double speedKmh) {
        List<Double> distance = new ArrayList<>();
        List<Double> traveltime = new ArrayList<>();
        List<Double> fuel = new ArrayList<>();
        double totalKm = 0;
        for (int i = 0; i < coordinates.size(); i++) {
            if (i > 0) {
                List<Double> p = coordinates.get(i - 1);
                List<Double> c = coordinates.get(i);
                totalKm += H3Util.distanceKm(p.get(1), p.get(0), c.get(1), c.get(0));
            }
            double days = totalKm / speedKmh / 24.0;
            distance.add(totalKm * 1000.0);
            traveltime.add(days);
            fuel.add(days * FUEL_TONNES_PER_DAY);
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("from", from);
        properties.put("to", to);
        properties.put("distance", distance);
        properties.put("traveltime", traveltime);
        properties.put("fuel", fuel);

        Map<String, Object> feature = new LinkedHashMap<>();
        feature.put("type", "Feature");
        feature.put("geometry", Map.of("type", "LineString", "coordinates", coordinates));
        feature.put("properties", properties);

        Map<String, Object> collection = new LinkedHashMap<>();
        collection.put("type", "FeatureCollection");
        collection.put("features", List.of(feature));
        return collection;
    }

    private double speedKmh(Map<String, Object> mesh) {
        Object config = mesh == null ? null : mesh.get("config");
        Object vessel = config instanceof Map ? ((Map<?, ?>) config).get("vessel_info") : null;
        Object speed = vessel instanceof Map ? ((Map<?, ?>) vessel).get("max_speed") : null;
        if (speed instanceof Number && ((Number) speed).doubleValue() > 0) {
            return ((Number) speed).doubleValue();
        }
        return DEFAULT_SPEED_KMH;
    }
}
