package com.schemacrud.relation;

import com.schemacrud.metadata.SchemaDocument;

import java.util.List;

/**
 * How rows of a related model are reached from one parent row.
 *
 * A direct plan filters the related table on {@code foreignKey}; a pivot
 * plan walks {@code hops} in order, from the pivot holding the parent key
 * to the pivot holding the related key.
 */
public record RelationPlan(
    String relation,
    SchemaDocument related,
    String foreignKey,
    List<PivotHop> hops,
    List<String> listFields
) {
    public RelationPlan {
        hops = hops != null ? List.copyOf(hops) : List.of();
        listFields = listFields != null ? List.copyOf(listFields) : List.of();
    }

    public static RelationPlan direct(String relation, SchemaDocument related, String foreignKey, List<String> listFields) {
        return new RelationPlan(relation, related, foreignKey, List.of(), listFields);
    }

    public static RelationPlan pivot(String relation, SchemaDocument related, List<PivotHop> hops, List<String> listFields) {
        return new RelationPlan(relation, related, null, hops, listFields);
    }

    public boolean isDirect() {
        return foreignKey != null;
    }
}
