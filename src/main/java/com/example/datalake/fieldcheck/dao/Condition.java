package com.example.datalake.fieldcheck.dao;

import java.util.Objects;

/** Equality predicate {@code column = value}; a null value matches SQL NULL. */
public record Condition(RecordColumn column, Object value) {

    public Condition {
        Objects.requireNonNull(column, "column");
    }
}
