package com.polarroute.route.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.polarroute.route.entity.Route;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Stored fields of a route as returned to callers, including a checkpointed unsmoothed
 * geometry while smoothing is still outstanding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteSnapshot {

    private Long routeId;
    private Long meshId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant requestedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant calculatedAt;

    private String file;
    private String info;
    private double startLat;
    private double startLon;
    private double endLat;
    private double endLon;
    private String startName;
    private String endName;
    private Map<String, Object> jsonUnsmoothed;
    private Map<String, Object> json;
    private String polarRouteVersion;

    public static RouteSnapshot from(Route route) {
        return RouteSnapshot.builder()
                .routeId(route.getId())
                .meshId(route.getMesh() != null ? route.getMesh().getId() : null)
                .requestedAt(route.getRequestedAt())
                .calculatedAt(route.getCalculatedAt())
                .file(route.getFile())
                .info(route.getInfo())
                .startLat(route.getStartLat())
                .startLon(route.getStartLon())
                .endLat(route.getEndLat())
                .endLon(route.getEndLon())
                .startName(route.getStartName())
                .endName(route.getEndName())
                .jsonUnsmoothed(route.getJsonUnsmoothed())
                .json(route.getJson())
                .polarRouteVersion(route.getPolarRouteVersion())
                .build();
    }
}
