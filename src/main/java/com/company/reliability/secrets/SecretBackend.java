package com.company.reliability.secrets;

import java.util.List;
import java.util.Optional;

public interface SecretBackend {

    SecretBackendType getType();

    Optional<String> getSecret(String path);

    void setSecret(String path, String value);

    List<String> listSecrets(String prefix);

    boolean supportsWrite();

    default boolean isAvailable() {
        return true;
    }
}
