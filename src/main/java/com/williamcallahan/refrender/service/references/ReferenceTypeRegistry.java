package com.williamcallahan.refrender.service.references;

import com.williamcallahan.refrender.domain.references.ReferenceType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of the reference types a document is rewritten for. Types are applied in
 * registration order.
 */
public final class ReferenceTypeRegistry {

    private final Map<String, ReferenceType> typesByName;

    public ReferenceTypeRegistry(List<ReferenceType> types) {
        Map<String, ReferenceType> indexed = new LinkedHashMap<>();
        for (ReferenceType type : types) {
            if (indexed.putIfAbsent(type.objectName(), type) != null) {
                throw new ReferenceConfigurationException("Reference type registered twice: " + type.objectName());
            }
        }
        this.typesByName = Collections.unmodifiableMap(indexed);
    }

    public List<ReferenceType> types() {
        return List.copyOf(typesByName.values());
    }

    public Optional<ReferenceType> find(String objectName) {
        return Optional.ofNullable(objectName).map(typesByName::get);
    }

    public boolean isEmpty() {
        return typesByName.isEmpty();
    }
}
