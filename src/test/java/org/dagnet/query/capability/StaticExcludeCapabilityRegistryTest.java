package org.dagnet.query.capability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("StaticExcludeCapabilityRegistry Tests")
class StaticExcludeCapabilityRegistryTest {

    @Test
    @DisplayName("Connection entry wins over provider entry")
    void testConnectionOverridesProvider() {
        StaticExcludeCapabilityRegistry registry = StaticExcludeCapabilityRegistry.builder()
                .provider("amplitude", false)
                .connection("amplitude-prod", true)
                .connection("warehouse-legacy", false)
                .provider("warehouse", true)
                .build();

        assertTrue(registry.supportsNativeExclude("amplitude-prod", "amplitude"));
        assertFalse(registry.supportsNativeExclude("amplitude-dev", "amplitude"));
        assertFalse(registry.supportsNativeExclude("warehouse-legacy", "warehouse"));
        assertTrue(registry.supportsNativeExclude(null, "warehouse"));
    }

    @Test
    @DisplayName("Unknown or missing names are unsupported")
    void testUnknownIsUnsupported() {
        StaticExcludeCapabilityRegistry registry = StaticExcludeCapabilityRegistry.builder()
                .provider("warehouse", true)
                .build();

        assertFalse(registry.supportsNativeExclude("other", "other"));
        assertFalse(registry.supportsNativeExclude(null, null));
        assertFalse(registry.supportsNativeExclude("  ", "  "));
        assertFalse(StaticExcludeCapabilityRegistry.empty().supportsNativeExclude("any", "warehouse"));
    }

    @Test
    @DisplayName("Names are trimmed; blank names are rejected")
    void testNameNormalization() {
        StaticExcludeCapabilityRegistry registry = StaticExcludeCapabilityRegistry.builder()
                .connection(" sheets ", true)
                .build();

        assertTrue(registry.supportsNativeExclude("sheets", null));
        assertTrue(registry.supportsNativeExclude(" sheets", null));
        assertEquals(Set.of("sheets"), registry.connectionNames());
        assertTrue(registry.providerNames().isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> StaticExcludeCapabilityRegistry.builder().provider(" ", true));
        assertThrows(NullPointerException.class,
                () -> StaticExcludeCapabilityRegistry.builder().connection(null, true));
    }

    @Test
    @DisplayName("Any lambda can act as resolver")
    void testFunctionalResolver() {
        ExcludeCapabilityResolver resolver = (connection, provider) -> "statsig".equals(provider);

        assertTrue(resolver.supportsNativeExclude(null, "statsig"));
        assertFalse(resolver.supportsNativeExclude(null, "amplitude"));
    }
}
