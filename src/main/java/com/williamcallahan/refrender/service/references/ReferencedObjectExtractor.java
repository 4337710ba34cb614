package com.williamcallahan.refrender.service.references;

import com.williamcallahan.refrender.domain.references.LazyReference;
import com.williamcallahan.refrender.domain.references.ReferenceType;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads rendered reference links back out of a document, using the data attributes written by
 * {@link ReferenceLinkRenderer}.
 */
public class ReferencedObjectExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ReferencedObjectExtractor.class);

    private static final String RENDERED_LINK_QUERY =
        "a." + ReferenceType.REFERENCE_CLASS + "[data-" + ReferenceLinkRenderer.REFERENCE_TYPE_KEY + "]";

    private final ReferenceTypeRegistry registry;

    public ReferencedObjectExtractor(ReferenceTypeRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param root document or element to search
     * @return references in document order; links of unregistered types are skipped
     */
    public List<LazyReference> extract(Element root) {
        if (root == null) {
            return List.of();
        }
        List<LazyReference> references = new ArrayList<>();
        for (Element link : root.select(RENDERED_LINK_QUERY)) {
            referencedBy(link).ifPresent(references::add);
        }
        return references;
    }

    /**
     * Reads the reference recorded on one rendered link.
     *
     * @param link rendered {@code <a>} element
     * @return the reference, or empty when the link lacks a registered type or a numeric id
     */
    public Optional<LazyReference> referencedBy(Element link) {
        Optional<ReferenceType> type = registry.find(link.attr("data-" + ReferenceLinkRenderer.REFERENCE_TYPE_KEY));
        if (type.isEmpty()) {
            return Optional.empty();
        }
        Long objectId = parseLong(link.attr("data-" + type.get().dataKey()));
        Long projectId = parseLong(link.attr("data-" + ReferenceLinkRenderer.PROJECT_KEY));
        if (objectId == null || projectId == null) {
            logger.debug("Skipping {} link without numeric ids", type.get().objectName());
            return Optional.empty();
        }
        return Optional.of(new LazyReference(
            type.get(), objectId, projectId, link.attr("data-" + ReferenceLinkRenderer.ORIGINAL_KEY)));
    }

    private static Long parseLong(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException notNumeric) {
            return null;
        }
    }
}
