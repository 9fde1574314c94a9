package com.company.reliability.controller;

import com.company.reliability.domain.GateCheckResult;
import com.company.reliability.dto.request.GateCheckRequest;
import com.company.reliability.service.DeploymentGate;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/gates")
@Tag(name = "Deployment Gate", description = "Error budget based deployment decisions")
@RequiredArgsConstructor
@Slf4j
public class DeploymentGateController {

    private final DeploymentGate deploymentGate;

    @PostMapping("/check")
    @Operation(summary = "Check a deployment",
            description = "Returns APPROVED, WARNING or BLOCKED with the matching exit code")
    public ResponseEntity<GateCheckResult> check(@Valid @RequestBody GateCheckRequest request) {
        log.debug("Gate check requested for {} (tier {})", request.getService(), request.getTier());
        return ResponseEntity.ok(deploymentGate.checkDeployment(request));
    }
}
