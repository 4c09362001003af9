package com.example.datalake.fieldcheck.dao;

import java.util.Optional;

public interface RecordTable {

    String getName();

    /**
     * Name of the column that identifies a row.
     */
    String getIdColumn();

    /**
     * Resolve a column of this table.
     *
     * @throws UnknownColumnException when the table has no such column
     */
    RecordColumn column(String name);

    /**
     * Optional {@code {field}} template used to render a row as a display label.
     */
    Optional<String> getDisplayFormat();
}
