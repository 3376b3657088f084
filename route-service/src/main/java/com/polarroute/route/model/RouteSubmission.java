package com.polarroute.route.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.polarroute.shared.enums.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Outcome of a route request: a freshly dispatched job, a stored route that already answers
 * the request, or a FAILURE when no mesh covers both waypoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteSubmission {

    public static final String NO_SUITABLE_MESH = "No suitable mesh available.";
    public static final String EXISTING_ROUTE_INFO =
            "Pre-existing route found and returned. To force new calculation, "
                    + "include 'forceRecalculate': true in POST request.";

    private UUID id;
    private String statusUrl;
    private JobState status;
    private String info;
    private String error;

    @JsonUnwrapped
    private RouteSnapshot route;

    @JsonIgnore
    public boolean isNoSuitableMesh() {
        return status == JobState.FAILURE && route == null && id == null;
    }

    public static RouteSubmission noSuitableMesh() {
        return RouteSubmission.builder()
                .status(JobState.FAILURE)
                .error(NO_SUITABLE_MESH)
                .build();
    }

    public static RouteSubmission existing(RouteSnapshot route, UUID latestJobId, JobState state) {
        return RouteSubmission.builder()
                .id(latestJobId)
                .status(state)
                .info(EXISTING_ROUTE_INFO)
                .route(route)
                .build();
    }

    public static RouteSubmission dispatched(UUID jobId) {
        return RouteSubmission.builder()
                .id(jobId)
                .status(JobState.PENDING)
                .build();
    }
}
