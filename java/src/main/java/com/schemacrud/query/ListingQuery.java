package com.schemacrud.query;

import com.schemacrud.metadata.ModelBinding;
import com.schemacrud.relation.PivotHop;
import com.schemacrud.relation.RelationPlan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import static com.schemacrud.query.SqlIdentifiers.column;
import static com.schemacrud.query.SqlIdentifiers.escapeLike;
import static com.schemacrud.query.SqlIdentifiers.quote;

/**
 * SQL for one listing page of a model, built from its binding and a caller
 * request.
 *
 * Only names from the binding reach SQL text; every caller value is a bound
 * parameter. Sorts, filters and searches outside the opt-in sets are left
 * out and reported in {@link #rejected()}. Soft-deleted rows never match,
 * and the primary key is always the last sort key so pages are stable.
 */
public record ListingQuery(
    SqlStatement count,
    SqlStatement countFiltered,
    SqlStatement rows,
    List<String> columns,
    List<String> rejected
) {
    static final String ALIAS = "t";
    private static final String LIKE = "LOWER(%s) LIKE LOWER(?) ESCAPE '\\'";

    public ListingQuery {
        columns = List.copyOf(columns);
        rejected = List.copyOf(rejected);
    }

    public static ListingQuery build(ModelBinding binding, ListingRequest request, int size) {
        return build(binding, request, size, null);
    }

    /**
     * @param scope extra condition every row must meet (e.g. a relation to a parent row), or {@code null}
     */
    public static ListingQuery build(ModelBinding binding, ListingRequest request, int size, SqlStatement scope) {
        var rejected = new ArrayList<String>();
        var from = " FROM " + quote(binding.table()) + " " + quote(ALIAS);

        // Base: soft delete and scope
        var base = new ArrayList<String>();
        var baseParams = new ArrayList<Object>();
        binding.softDelete().ifPresent(col -> base.add(column(ALIAS, col) + " IS NULL"));
        if (scope != null) {
            base.add(scope.sql());
            baseParams.addAll(scope.params());
        }

        // Filters and search
        var conditions = new ArrayList<>(base);
        var params = new ArrayList<Object>(baseParams);
        addFilters(binding, request.filters(), conditions, params, rejected);
        addSearch(binding, request.search(), conditions, params, rejected);

        // Projection: primary key plus listable fields
        var columns = new ArrayList<String>();
        columns.add(binding.primaryKey());
        binding.listableFields().stream()
            .filter(name -> !name.equals(binding.primaryKey()))
            .forEach(columns::add);
        var select = new StringJoiner(", ");
        columns.forEach(name -> select.add(column(ALIAS, name)));

        var orderBy = orderBy(binding, request.sorts(), rejected);

        var rowParams = new ArrayList<Object>(params);
        rowParams.add(size);
        rowParams.add((long) request.page() * size);

        return new ListingQuery(
            new SqlStatement("SELECT COUNT(*)" + from + where(base), baseParams),
            new SqlStatement("SELECT COUNT(*)" + from + where(conditions), params),
            new SqlStatement("SELECT " + select + from + where(conditions)
                + " ORDER BY " + orderBy + " LIMIT ? OFFSET ?", rowParams),
            columns,
            rejected);
    }

    /**
     * Condition restricting the listed table to rows related to one parent
     * row. Direct plans compare the foreign key; pivot plans select related
     * keys through the chain of pivot tables.
     */
    public static SqlStatement relationScope(RelationPlan plan, Object parentId) {
        if (plan.isDirect()) {
            return new SqlStatement(column(ALIAS, plan.foreignKey()) + " = ?", List.of(parentId));
        }

        var hops = plan.hops();
        var sql = new StringBuilder();
        var last = "p" + hops.size();
        sql.append(column(ALIAS, plan.related().primaryKey()))
            .append(" IN (SELECT ").append(column(last, hops.get(hops.size() - 1).relatedKey()));
        for (int i = 0; i < hops.size(); i++) {
            PivotHop hop = hops.get(i);
            var alias = "p" + (i + 1);
            if (i == 0) {
                sql.append(" FROM ").append(quote(hop.pivotTable())).append(' ').append(quote(alias));
            } else {
                var previous = "p" + i;
                sql.append(" JOIN ").append(quote(hop.pivotTable())).append(' ').append(quote(alias))
                    .append(" ON ").append(column(alias, hop.foreignKey()))
                    .append(" = ").append(column(previous, hops.get(i - 1).relatedKey()));
            }
        }
        sql.append(" WHERE ").append(column("p1", hops.get(0).foreignKey())).append(" = ?)");
        return new SqlStatement(sql.toString(), List.of(parentId));
    }

    // -----------------------------------------------------------------------
    // Clauses
    // -----------------------------------------------------------------------

    private static void addFilters(
        ModelBinding binding,
        Map<String, String> filters,
        List<String> conditions,
        List<Object> params,
        List<String> rejected
    ) {
        var filterable = binding.filterableFields();
        filters.forEach((field, value) -> {
            if (value == null || value.isBlank()) return;
            if (!filterable.contains(field)) {
                rejected.add("filters." + field);
                return;
            }
            var type = binding.fieldType(field);
            if (type.isTextLike()) {
                conditions.add(LIKE.formatted(column(ALIAS, field)));
                params.add("%" + escapeLike(value) + "%");
                return;
            }
            type.coerce(value).ifPresentOrElse(
                typed -> {
                    conditions.add(column(ALIAS, field) + " = ?");
                    params.add(typed);
                },
                () -> rejected.add("filters." + field));
        });
    }

    private static void addSearch(
        ModelBinding binding,
        String search,
        List<String> conditions,
        List<Object> params,
        List<String> rejected
    ) {
        if (search == null || search.isBlank()) return;
        var filterable = binding.filterableFields();
        if (filterable.isEmpty()) {
            rejected.add("search");
            return;
        }
        var pattern = "%" + escapeLike(search.trim()) + "%";
        var any = new StringJoiner(" OR ", "(", ")");
        for (var field : filterable) {
            any.add(LIKE.formatted("CAST(" + column(ALIAS, field) + " AS VARCHAR)"));
            params.add(pattern);
        }
        conditions.add(any.toString());
    }

    private static String orderBy(ModelBinding binding, Map<String, String> sorts, List<String> rejected) {
        var sortable = binding.sortableFields();
        var order = new LinkedHashMap<String, SortDirection>();
        sorts.forEach((field, direction) -> {
            var parsed = SortDirection.parse(direction);
            if (!sortable.contains(field) || parsed.isEmpty()) {
                rejected.add("sorts." + field);
                return;
            }
            order.putIfAbsent(field, parsed.get());
        });

        // Schema default sort when the caller gave none usable
        if (order.isEmpty()) {
            binding.defaultSort().forEach((field, direction) -> {
                if (binding.isColumn(field)) {
                    SortDirection.parse(direction).ifPresent(d -> order.putIfAbsent(field, d));
                }
            });
        }
        order.putIfAbsent(binding.primaryKey(), SortDirection.ASC);

        var clause = new StringJoiner(", ");
        order.forEach((field, direction) -> clause.add(column(ALIAS, field) + " " + direction.name()));
        return clause.toString();
    }

    private static String where(List<String> conditions) {
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }
}
