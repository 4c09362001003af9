package com.example.datalake.fieldcheck.dao;

import java.util.Objects;

public record RecordColumn(String table, String name) {

    public RecordColumn {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(name, "name");
    }

    public Condition eq(Object value) {
        return new Condition(this, value);
    }
}
