package com.polarroute.route.service;

import com.polarroute.route.entity.Job;
import com.polarroute.route.entity.Route;
import com.polarroute.route.exception.RouteException;
import com.polarroute.route.metrics.RouteMetrics;
import com.polarroute.route.model.JobStatusResponse;
import com.polarroute.route.model.RouteSnapshot;
import com.polarroute.route.repository.JobRepository;
import com.polarroute.route.repository.RouteRepository;
import com.polarroute.shared.enums.JobState;
import com.polarroute.shared.events.RouteCalculationRequestedEvent;
import com.polarroute.shared.util.KafkaTopics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates and reports on route calculation jobs.
 *
 * Dispatch persists the Job row first, then publishes a route.calculation.requested event
 * keyed by route id; the worker consumes it on its own threads, so dispatch never waits on a
 * calculation. A publish that fails marks the job FAILURE and notes the error on the Route, so
 * a request that never reached the queue does not read PENDING forever.
 *
 * Status is never stored on the Job: it is read live from the JobStateProvider and merged with
 * whatever the Route currently holds (including a checkpoint).
 *
 * Cancellation is best effort. A job that has not started will be skipped by the worker; a
 * running calculation cannot be interrupted.
 */
@Slf4j
@Service
public class JobLifecycleTracker {

    static final String DISPATCH_FAILED = "Calculation request could not be queued: ";

    private final JobRepository jobRepository;
    private final RouteRepository routeRepository;
    private final JobStateProvider jobStateProvider;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final RouteMetrics metrics;
    private final Clock clock;
    private final String defaultMeshPath;

    public JobLifecycleTracker(JobRepository jobRepository,
                               RouteRepository routeRepository,
                               JobStateProvider jobStateProvider,
                               KafkaTemplate<String, Object> kafkaTemplate,
                               RouteMetrics metrics,
                               Clock clock,
                               @Value("${route.mesh.default-path:}") String defaultMeshPath) {
        this.jobRepository    = jobRepository;
        this.routeRepository  = routeRepository;
        this.jobStateProvider = jobStateProvider;
        this.kafkaTemplate    = kafkaTemplate;
        this.metrics          = metrics;
        this.clock            = clock;
        this.defaultMeshPath  = defaultMeshPath;
    }

    public Job dispatch(Route route) {
        Job job = jobRepository.save(Job.builder()
                .id(UUID.randomUUID())
                .route(route)
                .build());

        Long meshId = route.getMesh() != null ? route.getMesh().getId() : null;
        RouteCalculationRequestedEvent event = RouteCalculationRequestedEvent.builder()
                .jobId(job.getId().toString())
                .routeId(route.getId())
                .meshId(meshId)
                .meshPath(meshId == null ? defaultMeshPath : null)
                .requestedAt(clock.instant())
                .build();

        try {
            kafkaTemplate.send(KafkaTopics.ROUTE_CALCULATION_REQUESTED, route.getId().toString(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            markDispatchFailed(job, route, ex);
                        }
                    });
        } catch (RuntimeException e) {
            markDispatchFailed(job, route, e);
        }

        metrics.recordDispatched();
        log.info("Dispatched job {} for route {} (mesh {})", job.getId(), route.getId(), meshId);
        return job;
    }

    private void markDispatchFailed(Job job, Route route, Throwable ex) {
        log.error("Failed to publish calculation request for job {}: {}", job.getId(), ex.getMessage(), ex);
        try {
            jobStateProvider.markFailed(job.getId());
            route.setInfo(DISPATCH_FAILED + ex.getMessage());
            routeRepository.save(route);
        } catch (RuntimeException e) {
            log.error("Could not record dispatch failure for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    public JobStatusResponse getStatus(UUID jobId) {
        Job job = jobRepository.findById(jobId)
                .orElseThrow(() -> new RouteException("JOB_NOT_FOUND", "Job " + jobId + " not found", HttpStatus.NOT_FOUND));
        return toStatus(job);
    }

    public JobState cancel(UUID jobId) {
        JobState state = jobStateProvider.revoke(jobId);
        log.info("Cancel requested for job {}, state now {}", jobId, state);
        return state;
    }

    /** Every route requested today (UTC), each with its latest job. */
    public List<JobStatusResponse> listRecent() {
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);
        Instant from = today.atStartOfDay(zone).toInstant();
        Instant to = today.plusDays(1).atStartOfDay(zone).toInstant();

        return routeRepository.findByRequestedAtGreaterThanEqualAndRequestedAtLessThanOrderByIdAsc(from, to)
                .stream()
                .map(this::latestStatus)
                .flatMap(Optional::stream)
                .toList();
    }

    public Optional<Job> latestJob(Route route) {
        return jobRepository.findFirstByRouteIdOrderByCreatedAtDesc(route.getId());
    }

    private Optional<JobStatusResponse> latestStatus(Route route) {
        Optional<Job> latest = latestJob(route);
        if (latest.isEmpty()) {
            log.debug("Route {} has no job yet", route.getId());
        }
        return latest.map(this::toStatus);
    }

    private JobStatusResponse toStatus(Job job) {
        JobState state = jobStateProvider.query(job.getId());
        Route route = job.getRoute();
        return JobStatusResponse.builder()
                .id(job.getId())
                .status(state)
                .error(state == JobState.FAILURE ? route.getInfo() : null)
                .route(RouteSnapshot.from(route))
                .build();
    }
}
