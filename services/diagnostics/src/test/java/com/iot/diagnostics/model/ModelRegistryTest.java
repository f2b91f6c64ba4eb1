package com.iot.diagnostics.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelRegistryTest {

    private static ModelDescriptor descriptor(String name) {
        return ModelDescriptor.of(name, List.of("temperature_one"), features -> 1.0);
    }

    @Test
    void keepsDeclarationOrder() {
        ModelRegistry registry = ModelRegistry.of(descriptor("b"), descriptor("a"), descriptor("c"));

        assertEquals(List.of("b", "a", "c"), registry.names());
        assertEquals(3, registry.size());
        assertTrue(registry.find("a").isPresent());
        assertTrue(registry.find("z").isEmpty());
    }

    @Test
    void rejectsDuplicateNames() {
        assertThrows(IllegalArgumentException.class, () -> ModelRegistry.of(descriptor("a"), descriptor("a")));
    }

    @Test
    void descriptorRequiresFeatures() {
        assertThrows(IllegalArgumentException.class, () -> ModelDescriptor.of("a", List.of(), features -> 1.0));
    }
}
