package com.williamcallahan.refrender.web;

import com.williamcallahan.refrender.domain.references.LazyReference;
import com.williamcallahan.refrender.domain.references.RenderedDocument;

import java.util.List;

/**
 * Response body for reference rendering.
 *
 * @param html rendered HTML
 * @param references references linked in the HTML
 * @param processingTimeMs time taken to render
 */
public record ReferenceRenderResponse(String html, List<ReferenceView> references, long processingTimeMs) {

    public ReferenceRenderResponse {
        references = List.copyOf(references);
    }

    static ReferenceRenderResponse from(RenderedDocument document) {
        return new ReferenceRenderResponse(
            document.html(),
            document.references().stream().map(ReferenceView::from).toList(),
            document.processingTimeMs()
        );
    }

    /**
     * One linked reference.
     *
     * @param type object name, e.g. {@code issue}
     * @param objectId store id of the object
     * @param projectId id of the project the object belongs to
     * @param original text that was replaced
     */
    public record ReferenceView(String type, long objectId, long projectId, String original) {

        static ReferenceView from(LazyReference reference) {
            return new ReferenceView(
                reference.type().objectName(), reference.objectId(), reference.projectId(), reference.original());
        }
    }
}
