package com.polarroute.route.controller;

import com.polarroute.route.exception.RouteException;
import com.polarroute.route.model.JobStatusResponse;
import com.polarroute.route.model.RouteSnapshot;
import com.polarroute.route.model.RouteSubmission;
import com.polarroute.route.service.JobLifecycleTracker;
import com.polarroute.route.service.RouteEvaluationService;
import com.polarroute.route.service.RouteRequestService;
import com.polarroute.shared.enums.JobState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {RouteController.class, RouteEvaluationController.class})
class RouteControllerTest {

    private static final String VALID_REQUEST =
            "{\"startLat\": -65.0, \"startLon\": -65.0, \"endLat\": -61.0, \"endLon\": -61.0}";

    @Autowired private MockMvc mockMvc;

    @MockBean private RouteRequestService routeRequestService;
    @MockBean private JobLifecycleTracker jobLifecycleTracker;
    @MockBean private RouteEvaluationService routeEvaluationService;

    @Test
    @DisplayName("No suitable mesh is a normal 200 response with status FAILURE")
    void noMeshIsOk() throws Exception {
        when(routeRequestService.submit(any())).thenReturn(RouteSubmission.noSuitableMesh());

        mockMvc.perform(post("/api/v1/routes").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("FAILURE"))
                .andExpect(jsonPath("$.data.error").value("No suitable mesh available."));
    }

    @Test
    @DisplayName("A dispatched job is accepted with its id and status URL")
    void dispatchedIsAccepted() throws Exception {
        UUID jobId = UUID.fromString("8b0d5f4e-1111-4222-8333-444455556666");
        when(routeRequestService.submit(any())).thenReturn(RouteSubmission.dispatched(jobId));

        mockMvc.perform(post("/api/v1/routes").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.id").value(jobId.toString()))
                .andExpect(jsonPath("$.data.statusUrl").value("http://localhost/api/v1/routes/" + jobId));
    }

    @Test
    @DisplayName("Out of range latitude is rejected with VALIDATION_FAILED")
    void invalidLatitude() throws Exception {
        String body = "{\"startLat\": 95.0, \"startLon\": -65.0, \"endLat\": -61.0, \"endLon\": -61.0}";

        mockMvc.perform(post("/api/v1/routes").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
        verify(routeRequestService, never()).submit(any());
    }

    @Test
    @DisplayName("Missing coordinates are rejected with VALIDATION_FAILED")
    void missingCoordinate() throws Exception {
        mockMvc.perform(post("/api/v1/routes").contentType(MediaType.APPLICATION_JSON).content("{\"startLat\": -65.0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("Status of a finished job includes the route fields")
    void statusIncludesRoute() throws Exception {
        UUID jobId = UUID.randomUUID();
        JobStatusResponse response = JobStatusResponse.builder()
                .id(jobId)
                .status(JobState.SUCCESS)
                .route(RouteSnapshot.builder().routeId(4L).startLat(-65).startLon(-65).endLat(-61).endLon(-61).build())
                .build();
        when(jobLifecycleTracker.getStatus(jobId)).thenReturn(response);

        mockMvc.perform(get("/api/v1/routes/{id}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("SUCCESS"))
                .andExpect(jsonPath("$.data.routeId").value(4))
                .andExpect(jsonPath("$.data.startLat").value(-65.0));
    }

    @Test
    @DisplayName("Unknown job id gives 404 JOB_NOT_FOUND")
    void unknownJob() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobLifecycleTracker.getStatus(jobId))
                .thenThrow(new RouteException("JOB_NOT_FOUND", "Job " + jobId + " not found", HttpStatus.NOT_FOUND));

        mockMvc.perform(get("/api/v1/routes/{id}", jobId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("JOB_NOT_FOUND"));
    }

    @Test
    @DisplayName("A job id that is not a UUID is a 400")
    void malformedJobId() throws Exception {
        mockMvc.perform(get("/api/v1/routes/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("Cancel is always acknowledged with 202")
    void cancelAccepted() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobLifecycleTracker.cancel(jobId)).thenReturn(JobState.REVOKED);

        mockMvc.perform(delete("/api/v1/routes/{id}", jobId))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.status").value("REVOKED"));
    }

    @Test
    @DisplayName("Recent routes are listed")
    void recent() throws Exception {
        when(jobLifecycleTracker.listRecent()).thenReturn(List.of(
                JobStatusResponse.builder().id(UUID.randomUUID()).status(JobState.PENDING)
                        .route(RouteSnapshot.builder().routeId(1L).build()).build()));

        mockMvc.perform(get("/api/v1/routes/recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].status").value("PENDING"))
                .andExpect(jsonPath("$.data[0].routeId").value(1));
    }

    @Test
    @DisplayName("Route evaluation without a route body is rejected")
    void evaluationNeedsRoute() throws Exception {
        mockMvc.perform(post("/api/v1/evaluate-route").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
    }
}
