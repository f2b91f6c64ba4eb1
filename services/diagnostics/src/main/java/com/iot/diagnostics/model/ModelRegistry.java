package com.iot.diagnostics.model;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only set of models consulted for every record, in declaration order.
 * Built once at startup and shared by all batches.
 */
public final class ModelRegistry implements Iterable<ModelDescriptor> {

    private final Map<String, ModelDescriptor> models;

    public ModelRegistry(List<ModelDescriptor> descriptors) {
        Map<String, ModelDescriptor> byName = new LinkedHashMap<>();
        for (ModelDescriptor descriptor : descriptors) {
            if (byName.putIfAbsent(descriptor.name(), descriptor) != null) {
                throw new IllegalArgumentException("Duplicate model name: " + descriptor.name());
            }
        }
        this.models = Collections.unmodifiableMap(byName);
    }

    public static ModelRegistry of(ModelDescriptor... descriptors) {
        return new ModelRegistry(List.of(descriptors));
    }

    public List<String> names() {
        return List.copyOf(models.keySet());
    }

    public List<ModelDescriptor> descriptors() {
        return List.copyOf(models.values());
    }

    public Optional<ModelDescriptor> find(String name) {
        return Optional.ofNullable(models.get(name));
    }

    public int size() {
        return models.size();
    }

    @Override
    public Iterator<ModelDescriptor> iterator() {
        return models.values().iterator();
    }
}
