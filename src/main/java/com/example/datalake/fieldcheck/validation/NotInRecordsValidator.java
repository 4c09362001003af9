package com.example.datalake.fieldcheck.validation;

import com.example.datalake.fieldcheck.dao.RecordQuery;
import com.example.datalake.fieldcheck.dao.RecordRow;
import com.example.datalake.fieldcheck.dao.RecordStore;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Function;

/**
 * Checks that no row already holds the value, which makes the field unique. The row currently
 * being edited, named by {@link ValidationContext#getEditingRecordId()}, does not count as a
 * clash.
 */
@Slf4j
public class NotInRecordsValidator extends RecordLookupValidator {

  @Builder
  private NotInRecordsValidator(
      RecordStore store,
      String tableName,
      String fieldName,
      Function<RecordStore, RecordQuery> queryFactory,
      String message) {
    super(store, tableName, fieldName, queryFactory, message);
  }

  public static NotInRecordsValidator of(RecordStore store, String tableName, String fieldName) {
    return builder().store(store).tableName(tableName).fieldName(fieldName).build();
  }

  @Override
  public ValidationResult validate(Object value, ValidationContext context) {
    Optional<RecordRow> existing = query().where(field().eq(value)).first();
    if (existing.isEmpty()) {
      return ValidationResult.valid(value);
    }
    Object rowId = existing.get().getId();
    if (sameId(rowId, context.getEditingRecordId())) {
      return ValidationResult.valid(value);
    }
    log.debug("[not-in-records] {} already used by {} {}", value, tableName, rowId);
    return fail(value, context);
  }

  // ids arrive as strings from forms and as numbers from JDBC
  private static boolean sameId(Object rowId, Object editingId) {
    if (rowId == null || editingId == null) {
      return false;
    }
    return String.valueOf(rowId).equals(String.valueOf(editingId));
  }
}
