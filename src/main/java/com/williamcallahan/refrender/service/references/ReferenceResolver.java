package com.williamcallahan.refrender.service.references;

import com.williamcallahan.refrender.domain.references.ProjectDirectory;
import com.williamcallahan.refrender.domain.references.ReferableObject;
import com.williamcallahan.refrender.domain.references.ReferenceMatch;
import com.williamcallahan.refrender.domain.references.ReferenceType;
import com.williamcallahan.refrender.domain.references.ResolvedProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns a matched reference into the project and object it points at. A reference that names an
 * unknown project or object resolves to empty; store failures propagate to the caller.
 */
public class ReferenceResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

    private final ProjectDirectory projectDirectory;

    public ReferenceResolver(ProjectDirectory projectDirectory) {
        this.projectDirectory = Objects.requireNonNull(projectDirectory, "Project directory cannot be null");
    }

    /**
     * Resolves a reference through the request cache.
     *
     * @param match matched reference
     * @param type object type the match belongs to
     * @param ambientProject project the document is rendered for
     * @param cache request cache
     * @return the resolved project and object, or empty when either is unknown
     */
    public Optional<Resolution> resolve(
        ReferenceMatch match, ReferenceType type, ResolvedProject ambientProject, ReferenceCache cache) {
        Optional<ResolvedProject> project = resolveProject(match.projectToken(), ambientProject, cache);
        if (project.isEmpty()) {
            logger.debug("No project for reference token '{}'", match.projectToken());
            return Optional.empty();
        }

        ResolvedProject targetProject = project.get();
        Optional<ReferableObject> object = cache.objectFor(
            type,
            targetProject.id(),
            match.objectId(),
            () -> type.source().findObject(targetProject, match.objectId())
        );
        if (object.isEmpty()) {
            logger.debug("No {} {} in project {}", type.objectName(), match.objectId(), targetProject.fullPath());
            return Optional.empty();
        }
        return Optional.of(new Resolution(type, targetProject, object.get()));
    }

    /**
     * Resolves a foreign-project token. A null token means the ambient project and never reaches
     * the directory.
     */
    Optional<ResolvedProject> resolveProject(String projectToken, ResolvedProject ambientProject, ReferenceCache cache) {
        if (projectToken == null) {
            return Optional.ofNullable(ambientProject);
        }
        return cache.projectFor(projectToken, () -> projectDirectory.findByReference(projectToken));
    }

    /**
     * A successfully resolved reference.
     *
     * @param type object type
     * @param project project the object belongs to
     * @param object resolved object
     */
    public record Resolution(ReferenceType type, ResolvedProject project, ReferableObject object) {

        public Resolution {
            Objects.requireNonNull(type, "Reference type cannot be null");
            Objects.requireNonNull(project, "Project cannot be null");
            Objects.requireNonNull(object, "Object cannot be null");
        }
    }
}
