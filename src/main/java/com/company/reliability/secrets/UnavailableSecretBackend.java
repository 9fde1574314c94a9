package com.company.reliability.secrets;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Stand-in for a backend with no adapter in this deployment. Lookups come
 * back empty; writes are refused.
 */
public class UnavailableSecretBackend implements SecretBackend {

    private final SecretBackendType type;
    private final String reason;

    public UnavailableSecretBackend(SecretBackendType type, String reason) {
        this.type = type;
        this.reason = reason;
    }

    @Override
    public SecretBackendType getType() {
        return type;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public Optional<String> getSecret(String path) {
        return Optional.empty();
    }

    @Override
    public void setSecret(String path, String value) {
        throw new UnsupportedOperationException("Secret backend " + type + " is unavailable: " + reason);
    }

    @Override
    public List<String> listSecrets(String prefix) {
        return Collections.emptyList();
    }

    @Override
    public boolean supportsWrite() {
        return false;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
