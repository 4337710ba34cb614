package com.williamcallahan.refrender.domain.references;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One occurrence of a reference grammar within a string.
 *
 * @param text full matched text
 * @param start inclusive start offset in the scanned string
 * @param end exclusive end offset in the scanned string
 * @param objectId number captured by the type's id group
 * @param projectToken foreign-project token, null for the ambient project
 * @param anchor fragment captured by an {@code anchor} group, e.g. {@code #note_7}
 * @param url explicit URL captured by a {@code url} group
 * @param captures every other named group the grammar declares, with its captured value
 */
public record ReferenceMatch(
    String text,
    int start,
    int end,
    long objectId,
    String projectToken,
    String anchor,
    String url,
    Map<String, String> captures
) {

    public ReferenceMatch {
        Objects.requireNonNull(text, "Matched text cannot be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid match span: " + start + ".." + end);
        }
        captures = captures == null ? Map.of() : Map.copyOf(captures);
    }

    public Optional<String> project() {
        return Optional.ofNullable(projectToken);
    }

    public Optional<String> anchorFragment() {
        return Optional.ofNullable(anchor);
    }

    /**
     * @return the explicit URL when the grammar captured a non-empty one
     */
    public Optional<String> explicitUrl() {
        return Optional.ofNullable(url).filter(capturedUrl -> !capturedUrl.isEmpty());
    }
}
