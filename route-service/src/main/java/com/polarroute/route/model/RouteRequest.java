package com.polarroute.route.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteRequest {

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double startLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double startLon;

    @NotNull
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double endLat;

    @NotNull
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double endLon;

    @Size(max = 255)
    private String startName;

    @Size(max = 255)
    private String endName;

    @Builder.Default
    private boolean forceRecalculate = false;
}
