package com.schemacrud.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemacrud.error.InvalidSchemaException;
import com.schemacrud.metadata.ActionDefinition;
import com.schemacrud.metadata.ModelBinding;
import com.schemacrud.metadata.SchemaDocument;
import com.schemacrud.metadata.SchemaJson;
import com.schemacrud.view.ActionManager;
import com.schemacrud.view.ContextFilter;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Entry point to schema documents: load → validate → normalize → bind →
 * default actions, cached per {@code (model, namespace)}.
 */
@Service
public class SchemaService {

    private final SchemaLoader loader;
    private final SchemaValidator validator;
    private final SchemaNormalizer normalizer;
    private final SchemaCache cache;
    private final ActionManager actionManager;
    private final ContextFilter contextFilter;

    public SchemaService(
        SchemaLoader loader,
        SchemaValidator validator,
        SchemaNormalizer normalizer,
        SchemaCache cache,
        ActionManager actionManager,
        ContextFilter contextFilter
    ) {
        this.loader = loader;
        this.validator = validator;
        this.normalizer = normalizer;
        this.cache = cache;
        this.actionManager = actionManager;
        this.contextFilter = contextFilter;
    }

    public SchemaDocument getSchema(String model) {
        return getSchema(model, null);
    }

    public SchemaDocument getSchema(String model, String namespace) {
        return cache.getOrLoad(model, namespace, () -> build(model, namespace));
    }

    public ModelBinding getBinding(String model) {
        return ModelBinding.of(getSchema(model));
    }

    /** View of a schema for one or more contexts, e.g. {@code ["list", "form"]}. */
    public ObjectNode getContextSchema(String model, List<String> contexts) {
        return contextFilter.filter(getSchema(model), contexts);
    }

    /** Same as {@link #getContextSchema(String, List)} with a comma-joined context list. */
    public ObjectNode getContextSchema(String model, String contexts) {
        var list = contexts == null
            ? List.<String>of()
            : Arrays.stream(contexts.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        return getContextSchema(model, list);
    }

    public List<ActionDefinition> getActionsForScope(String model, String scope) {
        return actionManager.actionsFor(getSchema(model), scope);
    }

    public void invalidate(String model) {
        cache.invalidate(model, null);
    }

    public void invalidate(String model, String namespace) {
        cache.invalidate(model, namespace);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    SchemaDocument build(String model, String namespace) {
        var raw = loader.load(model, namespace);
        validator.validate(raw, model);
        var schema = bind(model, normalizer.normalize(raw));
        return actionManager.prepare(schema);
    }

    static SchemaDocument bind(String model, ObjectNode normalized) {
        try {
            return SchemaJson.mapper().treeToValue(normalized, SchemaDocument.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidSchemaException(model, "$", "cannot bind document: " + e.getMessage(), e);
        }
    }
}
