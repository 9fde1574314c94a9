package com.company.reliability.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordDeploymentRequest {

    @NotBlank(message = "Service is required")
    private String service;

    @NotBlank(message = "Commit SHA is required")
    private String commitSha;

    @Builder.Default
    private String environment = "production";

    private Instant deployedAt;

    private String author;

    private Integer prNumber;
}
