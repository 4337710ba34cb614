package com.williamcallahan.refrender.domain.references;

import java.util.Objects;
import java.util.Optional;

/**
 * A reference read back from rendered markup. Holds only what the link recorded; the object
 * itself is fetched on demand.
 *
 * @param type reference type that rendered the link
 * @param objectId store id from the type's data attribute
 * @param projectId project id from {@code data-project}
 * @param original text the link replaced, from {@code data-original}
 */
public record LazyReference(ReferenceType type, long objectId, long projectId, String original) {

    public LazyReference {
        Objects.requireNonNull(type, "Reference type cannot be null");
        original = original == null ? "" : original;
    }

    /**
     * @return the referenced object, or empty when the store no longer has it
     */
    public Optional<ReferableObject> load() {
        return type.source().findById(objectId);
    }
}
