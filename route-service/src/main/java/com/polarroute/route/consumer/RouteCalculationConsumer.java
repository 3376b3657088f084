package com.polarroute.route.consumer;

import com.polarroute.route.metrics.RouteMetrics;
import com.polarroute.route.model.CalculationOutcome;
import com.polarroute.route.service.RedisJobStateStore;
import com.polarroute.route.service.RouteCalculationWorker;
import com.polarroute.shared.enums.JobState;
import com.polarroute.shared.events.RouteCalculationRequestedEvent;
import com.polarroute.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Worker side of the calculation queue. Each record is claimed (PENDING → RUNNING) before any
 * work; a revoked or already claimed job is acknowledged and skipped. Records are always
 * acknowledged so a failed calculation is never redelivered; an error escaping the calculation
 * or the state store still leaves the claimed job FAILURE, never RUNNING.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RouteCalculationConsumer {

    private final RouteCalculationWorker worker;
    private final RedisJobStateStore jobStateStore;
    private final RouteMetrics metrics;

    @KafkaListener(
            topics = KafkaTopics.ROUTE_CALCULATION_REQUESTED,
            groupId = "route-worker",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(RouteCalculationRequestedEvent event, Acknowledgment ack) {
        UUID jobId = null;
        boolean claimed = false;
        try {
            jobId = UUID.fromString(event.getJobId());
            claimed = jobStateStore.claim(jobId);
            if (!claimed) {
                JobState current = jobStateStore.query(jobId);
                log.info("Job {} not started, state is {}", jobId, current);
                if (current == JobState.REVOKED) {
                    metrics.recordCalculation(JobState.REVOKED);
                }
                ack.acknowledge();
                return;
            }

            log.info("Job {} started for route {}", jobId, event.getRouteId());
            CalculationOutcome outcome = metrics.getCalculationTimer().record(
                    () -> worker.calculate(event.getRouteId(), event.getMeshId(), event.getMeshPath()));

            jobStateStore.complete(jobId, outcome.state());
            metrics.recordCalculation(outcome.state());
            log.info("Job {} finished with {}", jobId, outcome.state());
            ack.acknowledge();

        } catch (Exception e) {
            log.error("Unrecoverable error running job {}: {}", event.getJobId(), e.getMessage(), e);
            if (claimed) {
                markFailed(jobId);
            }
            ack.acknowledge(); // DLQ handling would go here in production
        }
    }

    private void markFailed(UUID jobId) {
        try {
            jobStateStore.complete(jobId, JobState.FAILURE);
            metrics.recordCalculation(JobState.FAILURE);
        } catch (RuntimeException e) {
            log.error("Could not record FAILURE for job {}, it stays RUNNING until its state expires: {}",
                    jobId, e.getMessage(), e);
        }
    }
}
