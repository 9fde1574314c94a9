package com.company.reliability.exception;

public class DeploymentNotFoundException extends RuntimeException {
    public DeploymentNotFoundException(String deploymentId) {
        super("Deployment not found: " + deploymentId);
    }
}
