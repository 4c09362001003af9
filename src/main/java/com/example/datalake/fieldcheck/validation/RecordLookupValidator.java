package com.example.datalake.fieldcheck.validation;

import com.example.datalake.fieldcheck.dao.RecordColumn;
import com.example.datalake.fieldcheck.dao.RecordQuery;
import com.example.datalake.fieldcheck.dao.RecordStore;
import com.example.datalake.fieldcheck.dao.RecordTable;

import java.util.Objects;
import java.util.function.Function;

/**
 * Base for validators that look values up in a {@link RecordStore}. The table, the query and
 * the compared column are resolved on first use and kept for the lifetime of the instance.
 *
 * <p>First access is not synchronized: share an instance across threads only after it has been
 * used once, or build one per request.
 */
public abstract class RecordLookupValidator implements FieldValidator {

  public static final String DEFAULT_FIELD = "id";

  protected final RecordStore store;
  protected final String tableName;
  protected final String fieldName;
  protected final String message;
  private final Function<RecordStore, RecordQuery> queryFactory;

  private RecordTable table;
  private RecordQuery query;
  private RecordColumn field;

  protected RecordLookupValidator(
      RecordStore store,
      String tableName,
      String fieldName,
      Function<RecordStore, RecordQuery> queryFactory,
      String message) {
    this.store = Objects.requireNonNull(store, "store");
    if (tableName == null || tableName.isBlank()) {
      throw new IllegalArgumentException("tableName must not be blank");
    }
    this.tableName = tableName;
    this.fieldName = fieldName == null || fieldName.isBlank() ? DEFAULT_FIELD : fieldName;
    this.queryFactory = queryFactory;
    this.message = message;
  }

  public RecordTable table() {
    if (table == null) {
      table = store.table(tableName);
    }
    return table;
  }

  /** Rows the lookup runs against: the custom query if one was supplied, else the whole table. */
  public RecordQuery query() {
    if (query == null) {
      query = queryFactory != null ? queryFactory.apply(store) : store.query(table());
    }
    return query;
  }

  public RecordColumn field() {
    if (field == null) {
      field = table().column(fieldName);
    }
    return field;
  }

  protected ValidationResult fail(Object value, ValidationContext context) {
    return ValidationResult.invalid(value, context.translate(message));
  }
}
