package com.schemacrud.query;

import java.util.List;

/** SQL text with its positional {@code ?} parameters. */
public record SqlStatement(String sql, List<Object> params) {

    public SqlStatement {
        params = params != null ? List.copyOf(params) : List.of();
    }

    public Object[] paramArray() {
        return params.toArray();
    }
}
