package com.schemacrud.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Service;

/**
 * Loads every schema document on startup when
 * {@code schemacrud.schema.preload} is set, so a broken document stops the
 * application instead of failing its first request.
 */
@Service
public class SchemaPreloader implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SchemaPreloader.class);

    private final SchemaLoader loader;
    private final SchemaService schemaService;
    private final boolean enabled;

    public SchemaPreloader(
        SchemaLoader loader,
        SchemaService schemaService,
        @Value("${schemacrud.schema.preload:false}") boolean enabled
    ) {
        this.loader = loader;
        this.schemaService = schemaService;
        this.enabled = enabled;
    }

    @Override
    public void run(String... args) {
        if (!enabled) {
            log.debug("Schema preloading disabled");
            return;
        }
        preload();
    }

    /** Validates and caches all documents under the schema path; returns how many were loaded. */
    int preload() {
        var models = loader.availableModels();
        log.info("Preloading {} schema documents", models.size());
        for (var model : models) {
            log.debug("Preloading: {}", model);
            schemaService.getSchema(model);
        }
        log.info("Schema preload complete");
        return models.size();
    }
}
