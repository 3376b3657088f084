package com.polarroute.route.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationRequest {

    /** GeoJSON FeatureCollection; the first feature's LineString is evaluated. */
    @NotNull
    private Map<String, Object> route;
}
