package com.polarroute.route.model;

import com.polarroute.shared.enums.JobState;

import java.util.Map;

/**
 * Terminal result of one route calculation: the final geometry on success, the failure text
 * otherwise. Failures are reported through this value and never rethrown.
 */
public record CalculationOutcome(JobState state, Map<String, Object> route, String error) {

    public static CalculationOutcome success(Map<String, Object> route) {
        return new CalculationOutcome(JobState.SUCCESS, route, null);
    }

    public static CalculationOutcome failure(String error) {
        return new CalculationOutcome(JobState.FAILURE, null, error);
    }
}
