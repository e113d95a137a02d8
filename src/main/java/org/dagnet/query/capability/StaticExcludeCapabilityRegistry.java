package org.dagnet.query.capability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable capability table keyed by connection name and provider name.
 *
 * <p>A connection entry wins over a provider entry; anything unknown is treated as
 * unsupported.</p>
 */
public final class StaticExcludeCapabilityRegistry implements ExcludeCapabilityResolver {
    private static final StaticExcludeCapabilityRegistry EMPTY = builder().build();

    private final Map<String, Boolean> connections;
    private final Map<String, Boolean> providers;

    private StaticExcludeCapabilityRegistry(Map<String, Boolean> connections, Map<String, Boolean> providers) {
        this.connections = Map.copyOf(connections);
        this.providers = Map.copyOf(providers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a registry that answers {@code false} for everything.
     */
    public static StaticExcludeCapabilityRegistry empty() {
        return EMPTY;
    }

    @Override
    public boolean supportsNativeExclude(String connectionName, String providerName) {
        String connection = normalize(connectionName);
        if (connection != null && connections.containsKey(connection)) {
            return connections.get(connection);
        }
        String provider = normalize(providerName);
        if (provider != null && providers.containsKey(provider)) {
            return providers.get(provider);
        }
        return false;
    }

    public Set<String> connectionNames() {
        return connections.keySet();
    }

    public Set<String> providerNames() {
        return providers.keySet();
    }

    private static String normalize(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String normalizeRequired(String name, String fieldName) {
        String normalized = normalize(Objects.requireNonNull(name, fieldName));
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return normalized;
    }

    /**
     * Collects entries; a later entry for the same name replaces the earlier one.
     */
    public static final class Builder {
        private final Map<String, Boolean> connections = new LinkedHashMap<>();
        private final Map<String, Boolean> providers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder connection(String connectionName, boolean supportsNativeExclude) {
            connections.put(normalizeRequired(connectionName, "connectionName"), supportsNativeExclude);
            return this;
        }

        public Builder provider(String providerName, boolean supportsNativeExclude) {
            providers.put(normalizeRequired(providerName, "providerName"), supportsNativeExclude);
            return this;
        }

        public StaticExcludeCapabilityRegistry build() {
            return new StaticExcludeCapabilityRegistry(connections, providers);
        }
    }
}
