package com.williamcallahan.refrender.service.references;

import com.williamcallahan.refrender.domain.references.ReferableObject;
import com.williamcallahan.refrender.domain.references.ReferenceType;
import com.williamcallahan.refrender.domain.references.ResolvedProject;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Memoizes the lookups made while rendering one document. Each lookup takes the loader that
 * performs the real call; an implementation decides whether to call it.
 */
public interface ReferenceCache {

    /**
     * @param projectToken raw foreign-project token
     * @param loader directory lookup for the token
     * @return the project, or empty when the token names no project
     */
    Optional<ResolvedProject> projectFor(String projectToken, Supplier<Optional<ResolvedProject>> loader);

    /**
     * @param type object type
     * @param projectId project the reference is scoped to
     * @param referenceId number captured from the reference
     * @param loader store lookup for the object
     * @return the object, or empty when it does not exist
     */
    Optional<ReferableObject> objectFor(
        ReferenceType type, long projectId, long referenceId, Supplier<Optional<ReferableObject>> loader);

    /**
     * @param type object type
     * @param projectId project the URL is built for
     * @param objectId store id of the resolved object
     * @param loader URL builder
     * @return the URL
     */
    String urlFor(ReferenceType type, long projectId, long objectId, Supplier<String> loader);

    /**
     * Returns a cache that never stores anything, for rendering outside a request.
     *
     * @return pass-through cache
     */
    static ReferenceCache disabled() {
        return DisabledReferenceCache.INSTANCE;
    }

    /**
     * Pass-through implementation: every lookup calls its loader.
     */
    enum DisabledReferenceCache implements ReferenceCache {
        INSTANCE;

        @Override
        public Optional<ResolvedProject> projectFor(String projectToken, Supplier<Optional<ResolvedProject>> loader) {
            return loader.get();
        }

        @Override
        public Optional<ReferableObject> objectFor(
            ReferenceType type, long projectId, long referenceId, Supplier<Optional<ReferableObject>> loader) {
            return loader.get();
        }

        @Override
        public String urlFor(ReferenceType type, long projectId, long objectId, Supplier<String> loader) {
            return loader.get();
        }
    }
}
