package com.example.datalake.fieldcheck.dao;

/** Raised when a store is asked for a table it does not hold. */
public class UnknownTableException extends IllegalArgumentException {

    public UnknownTableException(String table) {
        super("Unknown table: " + table);
    }

    public UnknownTableException(String table, Throwable cause) {
        super("Unknown table: " + table, cause);
    }
}
