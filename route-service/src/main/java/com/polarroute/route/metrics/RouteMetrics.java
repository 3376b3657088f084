package com.polarroute.route.metrics;

import com.polarroute.shared.enums.JobState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Custom Micrometer metrics for the Route Service.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   route_requests_total{outcome="dispatched|existing|no_mesh"}
 *   route_lock_contention_total
 *   route_calculation_total{state="success|failure|revoked"}
 *   route_calculation_seconds{quantile="0.5|0.95|0.99"}
 *   route_mesh_imported_total
 */
@Component
public class RouteMetrics {

    private final Counter dispatchedCounter;
    private final Counter existingCounter;
    private final Counter noMeshCounter;
    private final Counter lockContentionCounter;
    private final Counter calculationSuccessCounter;
    private final Counter calculationFailureCounter;
    private final Counter calculationRevokedCounter;
    private final Counter meshImportedCounter;
    private final Timer   calculationTimer;

    public RouteMetrics(MeterRegistry registry) {
        this.dispatchedCounter = Counter.builder("route.requests")
                .tag("outcome", "dispatched")
                .description("Route requests that dispatched a new calculation")
                .register(registry);

        this.existingCounter = Counter.builder("route.requests")
                .tag("outcome", "existing")
                .description("Route requests answered with a stored route")
                .register(registry);

        this.noMeshCounter = Counter.builder("route.requests")
                .tag("outcome", "no_mesh")
                .description("Route requests with no mesh covering both waypoints")
                .register(registry);

        this.lockContentionCounter = Counter.builder("route.lock.contention")
                .description("Requests that proceeded without the advisory dispatch lock")
                .register(registry);

        this.calculationSuccessCounter = Counter.builder("route.calculation")
                .tag("state", "success")
                .register(registry);

        this.calculationFailureCounter = Counter.builder("route.calculation")
                .tag("state", "failure")
                .register(registry);

        this.calculationRevokedCounter = Counter.builder("route.calculation")
                .tag("state", "revoked")
                .description("Calculations skipped because the job was revoked before it started")
                .register(registry);

        this.meshImportedCounter = Counter.builder("route.mesh.imported")
                .description("Meshes added by the import job")
                .register(registry);

        this.calculationTimer = Timer.builder("route.calculation.duration")
                .description("Wall time of a route calculation, unsmoothed and smoothed stages together")
                .publishPercentiles(0.5, 0.95, 0.99)
                .minimumExpectedValue(Duration.ofSeconds(1))
                .maximumExpectedValue(Duration.ofHours(1))
                .register(registry);
    }

    public void recordDispatched()      { dispatchedCounter.increment(); }
    public void recordExistingRoute()   { existingCounter.increment(); }
    public void recordNoSuitableMesh()  { noMeshCounter.increment(); }
    public void recordLockContention()  { lockContentionCounter.increment(); }
    public void recordMeshesImported(int count) { meshImportedCounter.increment(count); }
    public Timer getCalculationTimer()  { return calculationTimer; }

    public void recordCalculation(JobState state) {
        switch (state) {
            case SUCCESS -> calculationSuccessCounter.increment();
            case FAILURE -> calculationFailureCounter.increment();
            case REVOKED -> calculationRevokedCounter.increment();
            default -> { }
        }
    }
}
