package com.polarroute.route.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.polarroute.shared.enums.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluationResult {

    private JobState status;
    private Long meshId;
    private Map<String, Object> route;
    private Double timeDays;
    private String timeStr;
    private Double fuelTonnes;
    private String error;

    public static EvaluationResult failure(String error) {
        return EvaluationResult.builder()
                .status(JobState.FAILURE)
                .error(error)
                .build();
    }
}
