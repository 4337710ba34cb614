package com.williamcallahan.refrender.domain.references;

import java.util.Optional;

/**
 * Store-side operations for one object type. Implementations are registered as beans and bound
 * to a configured {@link ReferenceType} by {@link #objectName()}.
 */
public interface ReferenceObjectSource {

    /**
     * @return snake case object name this source serves, e.g. {@code merge_request}
     */
    String objectName();

    /**
     * Finds an object by the number used in references within a project.
     *
     * @param project project the reference is scoped to
     * @param referenceId number captured from the reference, e.g. {@code 42} for {@code !42}
     * @return the object, or empty when it does not exist
     */
    Optional<ReferableObject> findObject(ResolvedProject project, long referenceId);

    /**
     * Builds the canonical URL of an object as seen from a project.
     *
     * @param object resolved object
     * @param project project the object was resolved in
     * @return absolute or root-relative URL
     */
    String urlFor(ReferableObject object, ResolvedProject project);

    /**
     * Builds the link text of an object, shortened relative to the ambient project
     * (e.g. {@code !42} locally, {@code group/other!42} across projects).
     *
     * @param object resolved object
     * @param ambientProject project the document is rendered for
     * @return canonical reference text
     */
    String displayText(ReferableObject object, ResolvedProject ambientProject);

    /**
     * Finds an object by its store id, as recorded in rendered markup. Sources that cannot look
     * objects up this way keep the default.
     *
     * @param objectId store id
     * @return the object, or empty when unknown
     */
    default Optional<ReferableObject> findById(long objectId) {
        return Optional.empty();
    }
}
