package com.schemacrud.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class JdbcRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRecordStore.class);

    private final JdbcTemplate jdbc;

    public JdbcRecordStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public long count(SqlStatement statement) {
        log.debug("Executing: {} {}", statement.sql(), statement.params());
        var count = jdbc.queryForObject(statement.sql(), Long.class, statement.paramArray());
        return count != null ? count : 0L;
    }

    @Override
    public List<Map<String, Object>> query(SqlStatement statement) {
        log.debug("Executing: {} {}", statement.sql(), statement.params());
        return jdbc.queryForList(statement.sql(), statement.paramArray());
    }
}
