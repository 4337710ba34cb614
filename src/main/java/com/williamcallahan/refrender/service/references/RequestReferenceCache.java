package com.williamcallahan.refrender.service.references;

import com.williamcallahan.refrender.domain.references.ReferableObject;
import com.williamcallahan.refrender.domain.references.ReferenceType;
import com.williamcallahan.refrender.domain.references.ResolvedProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Cache for a single rendering request. Entries never expire, and absent results are stored too,
 * so a failing lookup is made only once. Not thread-safe: one instance belongs to one request
 * and is used from the thread rendering it.
 */
public final class RequestReferenceCache implements ReferenceCache, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RequestReferenceCache.class);

    private final Map<String, Optional<ResolvedProject>> projectsByToken = new HashMap<>();
    // object name -> project id -> reference id
    private final Map<String, Map<Long, Map<Long, Optional<ReferableObject>>>> objects = new HashMap<>();
    // object name -> project id -> object id
    private final Map<String, Map<Long, Map<Long, String>>> urls = new HashMap<>();

    private int loads;
    private int hits;

    @Override
    public Optional<ResolvedProject> projectFor(String projectToken, Supplier<Optional<ResolvedProject>> loader) {
        return getOrLoad(projectsByToken, projectToken, loader);
    }

    @Override
    public Optional<ReferableObject> objectFor(
        ReferenceType type, long projectId, long referenceId, Supplier<Optional<ReferableObject>> loader) {
        return getOrLoad(scope(objects, type, projectId), referenceId, loader);
    }

    @Override
    public String urlFor(ReferenceType type, long projectId, long objectId, Supplier<String> loader) {
        return getOrLoad(scope(urls, type, projectId), objectId, loader);
    }

    /**
     * @return number of lookups that reached a loader
     */
    public int loads() {
        return loads;
    }

    /**
     * @return number of lookups answered from the cache
     */
    public int hits() {
        return hits;
    }

    @Override
    public void close() {
        logger.debug("Closing reference cache: {} loads, {} hits", loads, hits);
        projectsByToken.clear();
        objects.clear();
        urls.clear();
    }

    private static <V> Map<Long, V> scope(Map<String, Map<Long, Map<Long, V>>> table, ReferenceType type, long projectId) {
        return table
            .computeIfAbsent(type.objectName(), objectName -> new HashMap<>())
            .computeIfAbsent(projectId, id -> new HashMap<>());
    }

    // containsKey rather than computeIfAbsent: the loader may be re-entrant into this cache
    private <K, V> V getOrLoad(Map<K, V> cache, K key, Supplier<V> loader) {
        if (cache.containsKey(key)) {
            hits++;
            return cache.get(key);
        }
        V loaded = loader.get();
        loads++;
        cache.put(key, loaded);
        return loaded;
    }
}
