package com.polarroute.route.controller;

import com.polarroute.route.model.EvaluationRequest;
import com.polarroute.route.model.EvaluationResult;
import com.polarroute.route.service.RouteEvaluationService;
import com.polarroute.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/evaluate-route")
@RequiredArgsConstructor
public class RouteEvaluationController {

    private final RouteEvaluationService routeEvaluationService;

    @PostMapping
    public ResponseEntity<ApiResponse<EvaluationResult>> evaluate(@Valid @RequestBody EvaluationRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(routeEvaluationService.evaluate(request.getRoute())));
    }
}
