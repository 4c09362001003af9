package com.example.datalake.fieldcheck.validation;

import com.example.datalake.fieldcheck.dao.Ordering;
import com.example.datalake.fieldcheck.dao.RecordTable;

import java.util.Objects;
import java.util.function.Function;

/** Ordering of option rows, fixed up front or derived from the resolved table. */
public interface OrderBy {

  Ordering resolve(RecordTable table);

  static OrderBy of(Ordering ordering) {
    return new Fixed(ordering);
  }

  static OrderBy from(Function<RecordTable, Ordering> factory) {
    return new Derived(factory);
  }

  /** Order by the named column of the resolved table, ascending. */
  static OrderBy column(String name) {
    return from(table -> Ordering.asc(table.column(name)));
  }

  record Fixed(Ordering ordering) implements OrderBy {

    @Override
    public Ordering resolve(RecordTable table) {
      return ordering;
    }
  }

  record Derived(Function<RecordTable, Ordering> factory) implements OrderBy {

    public Derived {
      Objects.requireNonNull(factory, "factory");
    }

    @Override
    public Ordering resolve(RecordTable table) {
      return factory.apply(table);
    }
  }
}
