package com.schemacrud.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemacrud.error.InvalidSchemaException;
import com.schemacrud.error.SchemaNotFoundException;
import com.schemacrud.metadata.SchemaJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads raw schema documents from {@code schemacrud.schema.path}.
 *
 * Lookup order for {@code (model, namespace)}:
 * <ol>
 *   <li>{@code <path>/<namespace>/<model>.json} when a namespace is given</li>
 *   <li>{@code <path>/<model>.json}</li>
 * </ol>
 * A document found in the namespaced location gets {@code connection} set to
 * the namespace unless it declares one itself.
 */
@Service
public class SchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);

    /** Model and namespace names map straight to file names, so nothing path-like is accepted. */
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final ResourceLoader resourceLoader;
    private final String schemaPath;

    public SchemaLoader(
        ResourceLoader resourceLoader,
        @Value("${schemacrud.schema.path:classpath:schema/}") String schemaPath
    ) {
        this.resourceLoader = resourceLoader;
        this.schemaPath = schemaPath.endsWith("/") ? schemaPath : schemaPath + "/";
    }

    public String schemaLocation(String model, String namespace) {
        return namespace == null
            ? schemaPath + model + ".json"
            : schemaPath + namespace + "/" + model + ".json";
    }

    /**
     * Load the raw document for a model.
     *
     * @throws SchemaNotFoundException when no document exists (or the name is not a plain name)
     * @throws InvalidSchemaException  when the document is not a JSON object
     */
    public ObjectNode load(String model, String namespace) {
        if (!isSafeName(model) || (namespace != null && !isSafeName(namespace))) {
            throw new SchemaNotFoundException(model, namespace);
        }

        if (namespace != null) {
            var scoped = read(model, schemaLocation(model, namespace));
            if (scoped != null) {
                if (!scoped.hasNonNull("connection")) {
                    scoped.put("connection", namespace);
                }
                return scoped;
            }
            log.debug("No namespaced schema for '{}' in '{}', falling back to default location", model, namespace);
        }

        var schema = read(model, schemaLocation(model, null));
        if (schema == null) {
            throw new SchemaNotFoundException(model, namespace);
        }
        return schema;
    }

    /** Model names of every document directly under the schema path. */
    public List<String> availableModels() {
        var resolver = ResourcePatternUtils.getResourcePatternResolver(resourceLoader);
        var models = new ArrayList<String>();
        try {
            for (Resource resource : resolver.getResources(schemaPath + "*.json")) {
                var filename = resource.getFilename();
                if (filename != null) {
                    models.add(filename.substring(0, filename.length() - ".json".length()));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list schema documents under " + schemaPath, e);
        }
        models.sort(null);
        return models;
    }

    static boolean isSafeName(String name) {
        return name != null && SAFE_NAME.matcher(name).matches();
    }

    private ObjectNode read(String model, String location) {
        var resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            return null;
        }

        JsonNode node;
        try (InputStream in = resource.getInputStream()) {
            node = SchemaJson.mapper().readTree(in);
        } catch (IOException e) {
            throw new InvalidSchemaException(model, "$", "unreadable document at " + location, e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidSchemaException(model, "$", "document at " + location + " is not a JSON object");
        }
        log.info("Loaded schema '{}' from {}", model, location);
        return (ObjectNode) node;
    }
}
