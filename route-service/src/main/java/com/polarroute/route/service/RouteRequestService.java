package com.polarroute.route.service;

import com.polarroute.route.entity.Job;
import com.polarroute.route.entity.Mesh;
import com.polarroute.route.entity.Route;
import com.polarroute.route.exception.RouteException;
import com.polarroute.route.metrics.RouteMetrics;
import com.polarroute.route.model.RouteRequest;
import com.polarroute.route.model.RouteSnapshot;
import com.polarroute.route.model.RouteSubmission;
import com.polarroute.route.repository.RouteRepository;
import com.polarroute.shared.enums.JobState;
import com.polarroute.shared.util.H3Util;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for route requests.
 *
 * Request flow:
 *  1. Select candidate meshes; none → FAILURE payload (not an error)
 *  2. Take the advisory lock for the (start cell, end cell) bucket
 *  3. Look for a stored route answering the request; return it unless recalculation is forced
 *  4. Otherwise create a new Route on the most specific mesh and dispatch a job
 *
 * A matched route that never got a job (its dispatch was lost between the two writes) is
 * dispatched as it stands rather than returned without a job id.
 *
 * The lock narrows the window in which two identical requests both dispatch. If it cannot be
 * taken in time the request carries on unlocked, so duplicate dispatch stays possible under
 * heavy contention.
 */
@Slf4j
@Service
public class RouteRequestService {

    private static final String LOCK_PREFIX = "lock:route:";

    private final MeshSelector meshSelector;
    private final RouteMatcher routeMatcher;
    private final RouteRepository routeRepository;
    private final JobLifecycleTracker jobLifecycleTracker;
    private final JobStateProvider jobStateProvider;
    private final RedissonClient redissonClient;
    private final RouteMetrics metrics;
    private final int lockResolution;
    private final long lockWaitMs;
    private final long lockLeaseMs;

    public RouteRequestService(MeshSelector meshSelector,
                               RouteMatcher routeMatcher,
                               RouteRepository routeRepository,
                               JobLifecycleTracker jobLifecycleTracker,
                               JobStateProvider jobStateProvider,
                               RedissonClient redissonClient,
                               RouteMetrics metrics,
                               @Value("${route.lock.h3-resolution:" + H3Util.LOCK_RESOLUTION + "}") int lockResolution,
                               @Value("${route.lock.wait-ms:2000}") long lockWaitMs,
                               @Value("${route.lock.lease-ms:5000}") long lockLeaseMs) {
        this.meshSelector        = meshSelector;
        this.routeMatcher        = routeMatcher;
        this.routeRepository     = routeRepository;
        this.jobLifecycleTracker = jobLifecycleTracker;
        this.jobStateProvider    = jobStateProvider;
        this.redissonClient      = redissonClient;
        this.metrics             = metrics;
        this.lockResolution      = lockResolution;
        this.lockWaitMs          = lockWaitMs;
        this.lockLeaseMs         = lockLeaseMs;
    }

    public RouteSubmission submit(RouteRequest req) {
        List<Mesh> meshes = meshSelector.selectMesh(req.getStartLat(), req.getStartLon(), req.getEndLat(), req.getEndLon());
        if (meshes.isEmpty()) {
            metrics.recordNoSuitableMesh();
            return RouteSubmission.noSuitableMesh();
        }

        RLock lock = redissonClient.getLock(lockKey(req));
        try {
            boolean acquired = lock.tryLock(lockWaitMs, lockLeaseMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                metrics.recordLockContention();
                log.warn("Could not acquire route lock {} in {}ms, continuing unlocked", lock.getName(), lockWaitMs);
            }
            return resolve(req, meshes);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while acquiring route lock {}", lock.getName(), e);
            throw new RouteException("REQUEST_INTERRUPTED", "Route request was interrupted", HttpStatus.SERVICE_UNAVAILABLE);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    private RouteSubmission resolve(RouteRequest req, List<Mesh> meshes) {
        Optional<Route> existing = routeMatcher.findExistingRoute(
                meshes, req.getStartLat(), req.getStartLon(), req.getEndLat(), req.getEndLon());

        if (existing.isPresent() && !req.isForceRecalculate()) {
            Route route = existing.get();
            Optional<Job> latest = jobLifecycleTracker.latestJob(route);
            if (latest.isEmpty()) {
                log.warn("Matched route {} has no job, dispatching one for it", route.getId());
                return RouteSubmission.dispatched(jobLifecycleTracker.dispatch(route).getId());
            }
            UUID jobId = latest.get().getId();
            JobState state = jobStateProvider.query(jobId);

            metrics.recordExistingRoute();
            log.info("Returning existing route {} (job {}, {})", route.getId(), jobId, state);
            return RouteSubmission.existing(RouteSnapshot.from(route), jobId, state);
        }

        if (existing.isPresent()) {
            log.info("Recalculation forced, route {} left untouched", existing.get().getId());
        }

        Route route = routeRepository.save(Route.builder()
                .mesh(meshes.get(0))
                .startLat(req.getStartLat())
                .startLon(req.getStartLon())
                .endLat(req.getEndLat())
                .endLon(req.getEndLon())
                .startName(req.getStartName())
                .endName(req.getEndName())
                .build());

        Job job = jobLifecycleTracker.dispatch(route);
        return RouteSubmission.dispatched(job.getId());
    }

    String lockKey(RouteRequest req) {
        return LOCK_PREFIX
                + H3Util.latLngToCell(req.getStartLat(), req.getStartLon(), lockResolution) + ":"
                + H3Util.latLngToCell(req.getEndLat(), req.getEndLon(), lockResolution);
    }
}
