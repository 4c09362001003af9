package com.example.datalake.fieldcheck.validation;

import com.example.datalake.fieldcheck.dao.Ordering;
import com.example.datalake.fieldcheck.dao.RecordQuery;
import com.example.datalake.fieldcheck.dao.RecordRow;
import com.example.datalake.fieldcheck.dao.RecordStore;
import com.example.datalake.fieldcheck.util.RowFormatUtils;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Checks that a value references an existing row. In multiple mode every value of a list must
 * match the id of one of the rows of the lookup query.
 */
@Slf4j
public class InRecordsValidator extends RecordLookupValidator {

  private final String labelField;
  private final boolean multiple;
  private final OrderBy orderBy;
  private final String zero;

  private boolean sortingResolved;
  private Ordering sorting;

  @Builder
  private InRecordsValidator(
      RecordStore store,
      String tableName,
      String fieldName,
      Function<RecordStore, RecordQuery> queryFactory,
      String labelField,
      boolean multiple,
      OrderBy orderBy,
      String zero,
      String message) {
    super(store, tableName, fieldName, queryFactory, message);
    this.labelField = labelField;
    this.multiple = multiple;
    this.orderBy = orderBy;
    this.zero = zero;
  }

  public static InRecordsValidator of(RecordStore store, String tableName) {
    return builder().store(store).tableName(tableName).build();
  }

  public static InRecordsValidator of(RecordStore store, String tableName, String fieldName) {
    return builder().store(store).tableName(tableName).fieldName(fieldName).build();
  }

  /** Ordering applied to option rows; resolved once against the table. */
  public Ordering sorting() {
    if (!sortingResolved) {
      sorting = orderBy == null ? null : orderBy.resolve(table());
      sortingResolved = true;
    }
    return sorting;
  }

  public List<SelectOption> options(boolean includeZero) {
    Optional<String> format = table().getDisplayFormat();
    List<SelectOption> items = new ArrayList<>();
    for (RecordRow row : rows()) {
      Object id = row.getId();
      String label;
      if (labelField != null) {
        label = String.valueOf(row.get(labelField));
      } else if (format.isPresent()) {
        label = RowFormatUtils.format(format.get(), row);
      } else {
        label = String.valueOf(id);
      }
      items.add(new SelectOption(id, label));
    }
    if (includeZero && zero != null && !multiple) {
      items.add(0, new SelectOption("", zero));
    }
    return items;
  }

  public List<SelectOption> options() {
    return options(true);
  }

  @Override
  public ValidationResult validate(Object value, ValidationContext context) {
    if (multiple) {
      List<?> values = InSetValidator.elements(value);
      Set<String> ids = new HashSet<>();
      for (RecordRow row : rows()) {
        ids.add(String.valueOf(row.getId()));
      }
      for (Object item : values) {
        if (!ids.contains(String.valueOf(item))) {
          log.debug("[in-records] {} not found in {}", item, tableName);
          return fail(value, context);
        }
      }
      return ValidationResult.valid(values);
    }
    if (query().where(field().eq(value)).count() > 0) {
      return ValidationResult.valid(value);
    }
    log.debug("[in-records] {} not found in {}.{}", value, tableName, fieldName);
    return fail(value, context);
  }

  private List<RecordRow> rows() {
    return query().select(sorting(), null);
  }
}
