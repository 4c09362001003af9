package com.example.datalake.fieldcheck.dao;

import java.util.List;
import java.util.Optional;

/**
 * Filtered, immutable view over the rows of one table. {@link #where(Condition)} returns a new
 * query and leaves this one untouched.
 */
public interface RecordQuery {

    RecordQuery where(Condition condition);

    /**
     * Fetch matching rows.
     *
     * @param orderBy optional ordering, may be {@code null}
     * @param limit optional maximum number of rows, may be {@code null}
     */
    List<RecordRow> select(Ordering orderBy, Integer limit);

    long count();

    default List<RecordRow> select() {
        return select(null, null);
    }

    default Optional<RecordRow> first() {
        return select(null, 1).stream().findFirst();
    }
}
