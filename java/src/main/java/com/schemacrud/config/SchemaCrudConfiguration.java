package com.schemacrud.config;

import com.schemacrud.schema.SchemaCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans the engine needs that are not plain components: the schema cache,
 * optionally backed by a Spring {@link CacheManager}.
 */
@Configuration
public class SchemaCrudConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SchemaCrudConfiguration.class);

    @Bean
    public SchemaCache schemaCache(
        ObjectProvider<CacheManager> cacheManagers,
        @Value("${schemacrud.cache.persistent:false}") boolean persistent,
        @Value("${schemacrud.cache.name:schemacrud-schemas}") String cacheName
    ) {
        if (!persistent) {
            return new SchemaCache();
        }
        var manager = cacheManagers.getIfAvailable(() -> new ConcurrentMapCacheManager(cacheName));
        var cache = manager.getCache(cacheName);
        if (cache == null) {
            log.warn("Cache '{}' not provided by {}, using in-memory schema cache only",
                cacheName, manager.getClass().getSimpleName());
            return new SchemaCache();
        }
        log.info("Schema cache backed by '{}' ({})", cacheName, manager.getClass().getSimpleName());
        return new SchemaCache(cache);
    }
}
