package com.williamcallahan.refrender.testsupport;

import com.williamcallahan.refrender.domain.references.ProjectDirectory;
import com.williamcallahan.refrender.domain.references.ReferableObject;
import com.williamcallahan.refrender.domain.references.ReferenceObjectSource;
import com.williamcallahan.refrender.domain.references.ReferenceType;
import com.williamcallahan.refrender.domain.references.ResolvedProject;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Project directory and object sources backed by maps, with call counters for cache assertions.
 */
public final class InMemoryReferenceStore implements ProjectDirectory {

    public static final String HOST = "https://git.example.com";

    /** {@code group/project#12}, optionally followed by {@code #note_N}. */
    public static final Pattern ISSUE_SHORT =
        Pattern.compile("(?<![\\w/#])(?:(?<project>[\\w.-]+/[\\w.-]+))?#(?<issue>\\d+)(?<anchor>#note_\\d+)?");
    public static final Pattern ISSUE_LINK = Pattern.compile(
        "https://git\\.example\\.com/(?<project>[\\w.-]+(?:/[\\w.-]+)*?)/issues/(?<issue>\\d+)(?<anchor>#note_\\d+)?");
    public static final Pattern MERGE_REQUEST_SHORT =
        Pattern.compile("(?<![\\w/!])(?:(?<project>[\\w.-]+/[\\w.-]+))?!(?<mergeRequest>\\d+)(?<anchor>#note_\\d+)?");
    public static final Pattern MERGE_REQUEST_LINK = Pattern.compile(
        "https://git\\.example\\.com/(?<project>[\\w.-]+(?:/[\\w.-]+)*?)/merge_requests/(?<mergeRequest>\\d+)");

    private final Map<String, ResolvedProject> projectsByPath = new LinkedHashMap<>();
    private final AtomicInteger projectLookups = new AtomicInteger();

    public ResolvedProject addProject(long id, String fullPath) {
        ResolvedProject project = new ResolvedProject(id, fullPath);
        projectsByPath.put(fullPath, project);
        return project;
    }

    public void removeProject(String fullPath) {
        projectsByPath.remove(fullPath);
    }

    @Override
    public Optional<ResolvedProject> findByReference(String projectToken) {
        projectLookups.incrementAndGet();
        return Optional.ofNullable(projectsByPath.get(projectToken));
    }

    public int projectLookups() {
        return projectLookups.get();
    }

    public ObjectSource source(String objectName, String symbol, String pathSegment) {
        return new ObjectSource(objectName, symbol, pathSegment);
    }

    public static ReferenceType issueType(ObjectSource source) {
        return new ReferenceType("issue", "Issue", ISSUE_SHORT, ISSUE_LINK, source);
    }

    public static ReferenceType mergeRequestType(ObjectSource source) {
        return new ReferenceType("merge_request", "Merge Request", MERGE_REQUEST_SHORT, MERGE_REQUEST_LINK, source);
    }

    /**
     * Stored object; {@code id} is store-wide, {@code referenceId} is the number used in references.
     */
    public record StoredObject(long id, long referenceId, ResolvedProject project, String title)
        implements ReferableObject {}

    public static final class ObjectSource implements ReferenceObjectSource {
        private final String objectName;
        private final String symbol;
        private final String pathSegment;
        private final Map<Long, Map<Long, StoredObject>> objectsByProject = new HashMap<>();
        private final Map<Long, StoredObject> objectsById = new HashMap<>();
        private final AtomicInteger findCalls = new AtomicInteger();
        private final AtomicInteger urlCalls = new AtomicInteger();
        private long nextId = 1000;
        private RuntimeException failure;

        private ObjectSource(String objectName, String symbol, String pathSegment) {
            this.objectName = objectName;
            this.symbol = symbol;
            this.pathSegment = pathSegment;
        }

        public StoredObject add(ResolvedProject project, long referenceId, String title) {
            StoredObject object = new StoredObject(nextId++, referenceId, project, title);
            objectsByProject.computeIfAbsent(project.id(), id -> new HashMap<>()).put(referenceId, object);
            objectsById.put(object.id(), object);
            return object;
        }

        public void remove(ResolvedProject project, long referenceId) {
            StoredObject removed = objectsByProject.getOrDefault(project.id(), Map.of()).get(referenceId);
            if (removed != null) {
                objectsByProject.get(project.id()).remove(referenceId);
                objectsById.remove(removed.id());
            }
        }

        public void failWith(RuntimeException failure) {
            this.failure = failure;
        }

        public int findCalls() {
            return findCalls.get();
        }

        public int urlCalls() {
            return urlCalls.get();
        }

        @Override
        public String objectName() {
            return objectName;
        }

        @Override
        public Optional<ReferableObject> findObject(ResolvedProject project, long referenceId) {
            findCalls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return Optional.ofNullable(objectsByProject.getOrDefault(project.id(), Map.of()).get(referenceId));
        }

        @Override
        public String urlFor(ReferableObject object, ResolvedProject project) {
            urlCalls.incrementAndGet();
            StoredObject stored = (StoredObject) object;
            return HOST + "/" + stored.project().fullPath() + "/" + pathSegment + "/" + stored.referenceId();
        }

        @Override
        public String displayText(ReferableObject object, ResolvedProject ambientProject) {
            StoredObject stored = (StoredObject) object;
            String prefix = stored.project().id() == ambientProject.id() ? "" : stored.project().fullPath();
            return prefix + symbol + stored.referenceId();
        }

        @Override
        public Optional<ReferableObject> findById(long objectId) {
            return Optional.ofNullable(objectsById.get(objectId));
        }
    }
}
