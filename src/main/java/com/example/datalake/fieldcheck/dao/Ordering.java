package com.example.datalake.fieldcheck.dao;

import java.util.Objects;

public record Ordering(RecordColumn column, boolean ascending) {

    public Ordering {
        Objects.requireNonNull(column, "column");
    }

    public static Ordering asc(RecordColumn column) {
        return new Ordering(column, true);
    }

    public static Ordering desc(RecordColumn column) {
        return new Ordering(column, false);
    }
}
