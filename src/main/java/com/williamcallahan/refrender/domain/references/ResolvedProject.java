package com.williamcallahan.refrender.domain.references;

import java.util.Objects;

/**
 * Identifies a project that references are resolved against.
 *
 * @param id stable project identifier, used as cache and data attribute key
 * @param fullPath namespaced path such as {@code group/project}
 */
public record ResolvedProject(long id, String fullPath) {

    public ResolvedProject {
        Objects.requireNonNull(fullPath, "Project path cannot be null");
    }
}
