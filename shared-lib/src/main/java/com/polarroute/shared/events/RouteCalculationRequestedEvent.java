package com.polarroute.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteCalculationRequestedEvent {

    private String jobId;
    private Long routeId;

    /** Mesh to load from the store; null means fall back to {@link #meshPath}. */
    private Long meshId;
    private String meshPath;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant requestedAt;
}
