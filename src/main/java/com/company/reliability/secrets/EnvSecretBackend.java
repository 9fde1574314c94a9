package com.company.reliability.secrets;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Reads secrets from environment variables. {@code slack/webhook-url} maps to
 * {@code RELIABILITY_SLACK_WEBHOOK_URL}, falling back to the unprefixed name.
 */
public class EnvSecretBackend implements SecretBackend {

    static final String PREFIX = "RELIABILITY_";

    private final Supplier<Map<String, String>> environment;

    public EnvSecretBackend() {
        this(System::getenv);
    }

    public EnvSecretBackend(Supplier<Map<String, String>> environment) {
        this.environment = environment;
    }

    @Override
    public SecretBackendType getType() {
        return SecretBackendType.ENV;
    }

    @Override
    public Optional<String> getSecret(String path) {
        Map<String, String> env = environment.get();
        String name = toVariableName(path);
        String value = env.get(PREFIX + name);
        if (value == null) {
            value = env.get(name);
        }
        return Optional.ofNullable(value);
    }

    @Override
    public void setSecret(String path, String value) {
        throw new UnsupportedOperationException("Environment secrets are read-only");
    }

    @Override
    public List<String> listSecrets(String prefix) {
        String wanted = PREFIX + (prefix == null ? "" : toVariableName(prefix));
        return environment.get().keySet().stream()
                .filter(key -> key.startsWith(wanted))
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public boolean supportsWrite() {
        return false;
    }

    static String toVariableName(String path) {
        return path.trim()
                .replace('/', '_')
                .replace('-', '_')
                .replace('.', '_')
                .toUpperCase(Locale.ROOT);
    }
}
