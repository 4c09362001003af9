package com.example.datalake.fieldcheck.dao;

/** Raised when a table is asked for a column it does not define. */
public class UnknownColumnException extends IllegalArgumentException {

    public UnknownColumnException(String table, String column) {
        super("Unknown column " + column + " in table " + table);
    }
}
