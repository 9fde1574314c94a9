package com.company.reliability.secrets;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks secrets up in a primary backend, then in the fallbacks, caching hits
 * until {@link #clear()}. Also expands {@code ${backend:path}} and
 * {@code ${backend:path|default:value}} references inside strings.
 */
@Slf4j
public class SecretResolver {

    private static final Pattern REFERENCE = Pattern.compile("\\$\\{(\\w+):([^}|]+)(?:\\|(\\w+):([^}]+))?\\}");

    private final Map<SecretBackendType, SecretBackend> backends;
    private final SecretBackendType primary;
    private final List<SecretBackendType> fallbacks;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public SecretResolver(List<SecretBackend> backends, SecretBackendType primary,
                          List<SecretBackendType> fallbacks) {
        this.backends = new EnumMap<>(SecretBackendType.class);
        for (SecretBackendType type : SecretBackendType.values()) {
            this.backends.put(type, new UnavailableSecretBackend(type, "no adapter configured"));
        }
        for (SecretBackend backend : backends) {
            this.backends.put(backend.getType(), backend);
        }
        this.primary = primary;
        this.fallbacks = fallbacks != null ? new ArrayList<>(fallbacks) : new ArrayList<>();
    }

    public SecretBackend getBackend(SecretBackendType type) {
        return backends.get(type);
    }

    public Optional<String> getSecret(String path) {
        String cached = cache.get(path);
        if (cached != null) {
            return Optional.of(cached);
        }

        List<SecretBackendType> order = new ArrayList<>();
        order.add(primary);
        order.addAll(fallbacks);

        for (SecretBackendType type : order) {
            Optional<String> value = lookup(type, path);
            if (value.isPresent()) {
                cache.put(path, value.get());
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Replaces every secret reference in {@code text}. A reference that
     * cannot be resolved and has no default is left as written.
     */
    public String resolveReferences(String text) {
        if (text == null || !text.contains("${")) {
            return text;
        }

        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            SecretBackendType type = SecretBackendType.fromString(matcher.group(1));
            String path = matcher.group(2).trim();
            String defaultValue = "default".equals(matcher.group(3)) ? matcher.group(4) : null;

            Optional<String> value = type != null ? lookupCached(type, path) : Optional.empty();
            String replacement = value.orElse(defaultValue != null ? defaultValue : matcher.group());
            if (value.isEmpty() && defaultValue == null) {
                log.warn("Unresolved secret reference {}:{}", matcher.group(1), path);
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    public void clear() {
        cache.clear();
    }

    int cacheSize() {
        return cache.size();
    }

    private Optional<String> lookupCached(SecretBackendType type, String path) {
        String key = type.name() + ":" + path;
        String cached = cache.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<String> value = lookup(type, path);
        value.ifPresent(v -> cache.put(key, v));
        return value;
    }

    private Optional<String> lookup(SecretBackendType type, String path) {
        SecretBackend backend = backends.get(type);
        if (backend == null || !backend.isAvailable()) {
            return Optional.empty();
        }
        try {
            return backend.getSecret(path);
        } catch (RuntimeException e) {
            log.warn("Secret backend {} failed for {}: {}", type, path, e.getMessage());
            return Optional.empty();
        }
    }
}
