package com.williamcallahan.refrender.domain.references;

import java.util.List;
import java.util.Objects;

/**
 * Result of rendering one document with references linked.
 *
 * @param html rendered HTML body
 * @param references references present in the output, in document order
 * @param processingTimeMs time taken to render
 */
public record RenderedDocument(String html, List<LazyReference> references, long processingTimeMs) {

    public RenderedDocument {
        Objects.requireNonNull(html, "HTML content cannot be null");
        references = List.copyOf(references);
    }

    /**
     * @return true when at least one reference was linked
     */
    public boolean hasReferences() {
        return !references.isEmpty();
    }
}
