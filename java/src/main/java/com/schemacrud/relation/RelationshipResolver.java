package com.schemacrud.relation;

import com.schemacrud.error.InvalidSchemaException;
import com.schemacrud.error.MissingRelationshipConfigException;
import com.schemacrud.metadata.DetailDefinition;
import com.schemacrud.metadata.RelationshipDefinition;
import com.schemacrud.metadata.RelationshipType;
import com.schemacrud.metadata.SchemaDocument;
import com.schemacrud.schema.SchemaService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a detail declaration into a {@link RelationPlan}.
 *
 * <ul>
 *   <li>detail with {@code foreign_key}: direct plan on the child table</li>
 *   <li>{@code has_many}: direct plan on the relationship's {@code foreign_key}</li>
 *   <li>{@code many_to_many}: one pivot hop</li>
 *   <li>{@code belongs_to_many_through}: the hops of its {@code through}
 *       relationship followed by its own hop</li>
 * </ul>
 *
 * A through relationship without pivot keys borrows them from the
 * intermediate model's relationship of the same name, e.g.
 * users.permissions through roles uses roles.permissions. Chains longer than
 * {@code schemacrud.relations.max-hops}, and cycles, are schema errors, as
 * is a {@code foreign_key} on a detail backed by a pivot relationship.
 * Column names are never guessed.
 */
@Component
public class RelationshipResolver {

    private static final Logger log = LoggerFactory.getLogger(RelationshipResolver.class);

    private final SchemaService schemas;
    private final int maxHops;

    public RelationshipResolver(
        SchemaService schemas,
        @Value("${schemacrud.relations.max-hops:2}") int maxHops
    ) {
        this.schemas = schemas;
        this.maxHops = maxHops;
    }

    public RelationPlan resolve(SchemaDocument parent, String relationName) {
        DetailDefinition detail = parent.detail(relationName)
            .orElseThrow(() -> new MissingRelationshipConfigException(parent.model(), relationName,
                "no detail declared for this relation"));

        var declared = parent.relationship(relationName);
        if (detail.isDirect()) {
            if (declared.map(r -> r.type().isPivot()).orElse(false)) {
                throw new InvalidSchemaException(parent.model(), "details." + relationName + ".foreign_key",
                    "detail '" + relationName + "' is a " + declared.get().type().wire()
                        + " relationship and must not declare a foreign_key");
            }
            log.debug("Relation {}.{}: direct on '{}'", parent.model(), relationName, detail.foreignKey());
            return RelationPlan.direct(relationName, related(parent, detail), detail.foreignKey(), detail.listFields());
        }

        var relationship = declared
            .orElseThrow(() -> new MissingRelationshipConfigException(parent.model(), relationName,
                "detail has no foreign_key and no relationship of the same name is declared"));

        if (relationship.type() == RelationshipType.HAS_MANY) {
            log.debug("Relation {}.{}: has_many on '{}'", parent.model(), relationName, relationship.foreignKey());
            return RelationPlan.direct(relationName, related(parent, detail), relationship.foreignKey(), detail.listFields());
        }

        var hops = pivotHops(parent, relationship, new LinkedHashSet<>());
        log.debug("Relation {}.{}: {} pivot hop(s) {}", parent.model(), relationName, hops.size(), hops);
        return RelationPlan.pivot(relationName, related(parent, detail), hops, detail.listFields());
    }

    private SchemaDocument related(SchemaDocument parent, DetailDefinition detail) {
        return schemas.getSchema(detail.model(), parent.connection());
    }

    private List<PivotHop> pivotHops(SchemaDocument owner, RelationshipDefinition relationship, Set<String> visiting) {
        var name = relationship.name();
        if (!visiting.add(name)) {
            throw new InvalidSchemaException(owner.model(), "relationships." + name,
                "relationship chain " + visiting + " loops back to '" + name + "'");
        }

        var hops = switch (relationship.type()) {
            case MANY_TO_MANY -> List.of(PivotHop.of(relationship));
            case BELONGS_TO_MANY_THROUGH -> throughHops(owner, relationship, visiting);
            case HAS_MANY -> throw new InvalidSchemaException(owner.model(), "relationships." + name,
                "has_many relationship cannot be part of a pivot chain");
        };

        if (hops.size() > maxHops) {
            throw new InvalidSchemaException(owner.model(), "relationships." + name,
                "pivot chain of " + hops.size() + " hops exceeds the limit of " + maxHops);
        }
        return hops;
    }

    private List<PivotHop> throughHops(SchemaDocument owner, RelationshipDefinition relationship, Set<String> visiting) {
        var throughName = relationship.through();
        var through = owner.relationship(throughName)
            .orElseThrow(() -> new MissingRelationshipConfigException(owner.model(), relationship.name(),
                "through relationship '" + throughName + "' is not declared"));

        var hops = new ArrayList<>(pivotHops(owner, through, visiting));
        if (relationship.hasPivotKeys()) {
            hops.add(PivotHop.of(relationship));
            return hops;
        }

        // Last hop is declared on the intermediate model
        var intermediate = schemas.getSchema(throughName, owner.connection());
        var onward = intermediate.relationship(relationship.name())
            .filter(r -> r.type() == RelationshipType.MANY_TO_MANY && r.hasPivotKeys())
            .orElseThrow(() -> new MissingRelationshipConfigException(owner.model(), relationship.name(),
                "no pivot keys declared and '" + throughName + "' has no many_to_many relationship '"
                    + relationship.name() + "'"));
        hops.add(PivotHop.of(onward));
        return hops;
    }
}
