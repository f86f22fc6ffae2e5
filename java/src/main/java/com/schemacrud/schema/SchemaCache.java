package com.schemacrud.schema;

import com.schemacrud.metadata.SchemaDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Process-wide cache of bound schema documents, keyed by
 * {@code model:namespace} ({@code default} when no namespace is given).
 *
 * The in-memory map is always consulted first. When a Spring {@link Cache}
 * is configured it is used as a second level shared between instances;
 * its failures are logged and the request continues from the loader.
 */
public class SchemaCache {

    private static final Logger log = LoggerFactory.getLogger(SchemaCache.class);

    static final String KEY_PREFIX = "schemacrud_schema_";
    static final String DEFAULT_NAMESPACE = "default";

    private final Map<String, SchemaDocument> entries = new ConcurrentHashMap<>();
    private final Map<String, Long> generations = new ConcurrentHashMap<>();
    private final AtomicLong epoch = new AtomicLong();
    private final Cache backing;

    public SchemaCache() {
        this(null);
    }

    public SchemaCache(Cache backing) {
        this.backing = backing;
    }

    public static String cacheKey(String model, String namespace) {
        return model + ":" + (namespace != null ? namespace : DEFAULT_NAMESPACE);
    }

    /**
     * Cached document for {@code (model, namespace)}, loading it on a miss.
     * The loader runs outside any lock: resolving one schema may need others.
     * A load that overlaps an invalidation of its key is returned to its
     * caller but not cached.
     */
    public SchemaDocument getOrLoad(String model, String namespace, Supplier<SchemaDocument> loader) {
        var key = cacheKey(model, namespace);

        var cached = entries.get(key);
        if (cached != null) {
            log.debug("Schema cache hit (memory): {}", key);
            return cached;
        }

        var stamp = stamp(key);
        var shared = readBacking(key);
        if (shared != null) {
            log.debug("Schema cache hit (persistent): {}", key);
            storeIfCurrent(key, stamp, shared);
            return shared;
        }

        var loaded = loader.get();
        if (storeIfCurrent(key, stamp, loaded)) {
            writeBacking(key, loaded);
        } else {
            log.debug("Schema {} invalidated while loading, not caching the result", key);
        }
        return loaded;
    }

    public boolean contains(String model, String namespace) {
        return entries.containsKey(cacheKey(model, namespace));
    }

    public int size() {
        return entries.size();
    }

    public void invalidate(String model, String namespace) {
        var key = cacheKey(model, namespace);
        entries.compute(key, (k, current) -> {
            generations.merge(k, 1L, Long::sum);
            return null;
        });
        if (backing != null) {
            try {
                backing.evict(KEY_PREFIX + key);
            } catch (RuntimeException e) {
                log.warn("Failed to evict {} from persistent schema cache: {}", key, e.getMessage());
            }
        }
        log.debug("Invalidated schema cache entry {}", key);
    }

    public void invalidateAll() {
        epoch.incrementAndGet();
        entries.clear();
        if (backing != null) {
            try {
                backing.clear();
            } catch (RuntimeException e) {
                log.warn("Failed to clear persistent schema cache: {}", e.getMessage());
            }
        }
        log.debug("Cleared schema cache");
    }

    /** Invalidation state of a key: the global epoch and the key's own generation. */
    private record Stamp(long epoch, long generation) {}

    private Stamp stamp(String key) {
        return new Stamp(epoch.get(), generations.getOrDefault(key, 0L));
    }

    /** Stores {@code schema} unless the key was invalidated since {@code stamp} was taken. */
    private boolean storeIfCurrent(String key, Stamp stamp, SchemaDocument schema) {
        var result = entries.compute(key, (k, current) -> stamp.equals(stamp(k)) ? schema : current);
        return result == schema;
    }

    private SchemaDocument readBacking(String key) {
        if (backing == null) return null;
        try {
            return backing.get(KEY_PREFIX + key, SchemaDocument.class);
        } catch (RuntimeException e) {
            log.warn("Persistent schema cache read failed for {}: {}", key, e.getMessage());
            return null;
        }
    }

    private void writeBacking(String key, SchemaDocument schema) {
        if (backing == null) return;
        try {
            backing.put(KEY_PREFIX + key, schema);
        } catch (RuntimeException e) {
            log.warn("Persistent schema cache write failed for {}: {}", key, e.getMessage());
        }
    }
}
