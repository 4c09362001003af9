package com.example.datalake.fieldcheck.dao;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * Single row returned by a {@link RecordQuery}. Field access follows the lookup semantics of
 * the backing map, which is case-insensitive for rows read through JDBC.
 */
public final class RecordRow {

    private final Map<String, Object> values;
    private final String idColumn;

    public RecordRow(Map<String, Object> values, String idColumn) {
        this.values = Objects.requireNonNull(values, "values");
        this.idColumn = Objects.requireNonNull(idColumn, "idColumn");
    }

    public Object get(String field) {
        return values.get(field);
    }

    public Object getId() {
        return values.get(idColumn);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordRow other)) {
            return false;
        }
        return values.equals(other.values) && idColumn.equals(other.idColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, idColumn);
    }

    @Override
    public String toString() {
        return "RecordRow" + values;
    }
}
