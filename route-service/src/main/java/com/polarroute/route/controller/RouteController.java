package com.polarroute.route.controller;

import com.polarroute.route.model.JobStatusResponse;
import com.polarroute.route.model.RouteRequest;
import com.polarroute.route.model.RouteSubmission;
import com.polarroute.route.service.JobLifecycleTracker;
import com.polarroute.route.service.RouteRequestService;
import com.polarroute.shared.dto.ApiResponse;
import com.polarroute.shared.enums.JobState;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/routes")
@RequiredArgsConstructor
public class RouteController {

    private final RouteRequestService routeRequestService;
    private final JobLifecycleTracker jobLifecycleTracker;

    /**
     * 202 with a job id for new or existing routes; 200 with status FAILURE when no mesh covers
     * both waypoints.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<RouteSubmission>> requestRoute(@Valid @RequestBody RouteRequest request) {
        RouteSubmission submission = routeRequestService.submit(request);
        if (submission.isNoSuitableMesh()) {
            return ResponseEntity.ok(ApiResponse.ok(submission));
        }
        if (submission.getId() != null) {
            submission.setStatusUrl(statusUrl(submission.getId()));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok(submission));
    }

    @GetMapping("/recent")
    public ResponseEntity<ApiResponse<List<JobStatusResponse>>> recentRoutes() {
        return ResponseEntity.ok(ApiResponse.ok(jobLifecycleTracker.listRecent()));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<ApiResponse<JobStatusResponse>> getStatus(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(ApiResponse.ok(jobLifecycleTracker.getStatus(jobId)));
    }

    /** Best effort: only a job that has not started can be stopped. */
    @DeleteMapping("/{jobId}")
    public ResponseEntity<ApiResponse<Map<String, JobState>>> cancel(@PathVariable("jobId") UUID jobId) {
        JobState state = jobLifecycleTracker.cancel(jobId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok(Map.of("status", state)));
    }

    private String statusUrl(UUID jobId) {
        return ServletUriComponentsBuilder.fromCurrentContextPath()
                .path("/api/v1/routes/{jobId}")
                .buildAndExpand(jobId)
                .toUriString();
    }
}
