package com.williamcallahan.refrender.domain.references;

import com.williamcallahan.refrender.support.AsciiTextNormalizer;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Static description of one referable object type and the grammars that recognize it.
 *
 * @param objectName snake case name, e.g. {@code merge_request}
 * @param displayName title-cased name used in link titles, e.g. {@code Merge Request}
 * @param shortPattern grammar for in-text references such as {@code !42}; null disables text matching
 * @param linkPattern grammar for full URLs to the same kind of object; null disables URL matching
 * @param source store operations for this type
 */
public record ReferenceType(
    String objectName,
    String displayName,
    Pattern shortPattern,
    Pattern linkPattern,
    ReferenceObjectSource source
) {

    /** Class shared by every rendered reference, whatever its type. */
    public static final String REFERENCE_CLASS = "gfm";

    public ReferenceType {
        Objects.requireNonNull(objectName, "Object name cannot be null");
        Objects.requireNonNull(displayName, "Display name cannot be null");
        Objects.requireNonNull(source, "Object source cannot be null");
        if (objectName.isBlank()) {
            throw new IllegalArgumentException("Object name must not be blank");
        }
    }

    /**
     * @return name of the regex group that captures the object number, e.g. {@code mergeRequest}
     */
    public String idGroupName() {
        return AsciiTextNormalizer.toCamelCase(objectName);
    }

    /**
     * @return type-specific CSS class, e.g. {@code gfm-merge_request}
     */
    public String cssClass() {
        return REFERENCE_CLASS + "-" + objectName;
    }

    /**
     * @return data attribute key without the {@code data-} prefix, e.g. {@code merge-request}
     */
    public String dataKey() {
        return AsciiTextNormalizer.toDashed(objectName);
    }
}
