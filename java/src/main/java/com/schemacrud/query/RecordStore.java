package com.schemacrud.query;

import java.util.List;
import java.util.Map;

/**
 * Executes statements built by the listing engine. Store errors propagate
 * to the caller as they are.
 */
public interface RecordStore {

    long count(SqlStatement statement);

    List<Map<String, Object>> query(SqlStatement statement);
}
