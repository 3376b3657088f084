package com.polarroute.route.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.polarroute.shared.enums.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

    private UUID id;
    private JobState status;

    /** Stored failure text, only present when status is FAILURE. */
    private String error;

    @JsonUnwrapped
    private RouteSnapshot route;
}
