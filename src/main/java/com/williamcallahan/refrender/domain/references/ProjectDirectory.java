package com.williamcallahan.refrender.domain.references;

import java.util.Optional;

/**
 * Looks up projects named by a reference's foreign-project token.
 */
public interface ProjectDirectory {

    /**
     * Resolves a foreign-project token such as {@code group/project}. Callers handle an absent
     * token themselves as the ambient project and never pass it here.
     *
     * @param projectToken token captured by the reference grammar
     * @return the project, or empty when no project matches
     */
    Optional<ResolvedProject> findByReference(String projectToken);

    /**
     * Resolves the project a document is rendered for.
     *
     * @param fullPath full project path
     * @return the project, or empty when no project matches
     */
    default Optional<ResolvedProject> findByFullPath(String fullPath) {
        return findByReference(fullPath);
    }
}
