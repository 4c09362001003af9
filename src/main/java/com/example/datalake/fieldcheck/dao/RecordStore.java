package com.example.datalake.fieldcheck.dao;

/**
 * Read-only view over a backing data store, narrowed to what the record validators need.
 */
public interface RecordStore {

    /**
     * Resolve a table by name.
     *
     * @throws UnknownTableException when the store has no such table
     */
    RecordTable table(String name);

    /**
     * Query selecting every row of the given table.
     */
    RecordQuery query(RecordTable table);
}
