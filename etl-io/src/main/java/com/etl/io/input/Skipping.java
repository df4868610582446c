package com.etl.io.input;

import com.etl.core.Options;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Leading rows to ignore before the column names: a fixed count, or every row until {@code until}
 * accepts one. The accepted row is kept. Rows are handed to the predicate as maps from 0-based
 * column index to cell value.
 */
record Skipping(int rows, Predicate<Map<Integer, Object>> until) {

  Skipping {
    if (rows < 0) throw new IllegalArgumentException("skipping must be >= 0");
  }

  @SuppressWarnings("unchecked")
  static Skipping from(Map<String, ?> options) {
    Object value = options.get("skipping");
    if (value instanceof Predicate<?> predicate) return new Skipping(0, (Predicate<Map<Integer, Object>>) predicate);
    return new Skipping(Options.integer(options, "skipping", 0), null);
  }

  /** Whether the row at {@code index} (0-based, counted from the first row read) is skipped. */
  boolean skips(int index, Map<Integer, Object> row) {
    return until != null ? !until.test(row) : index < rows;
  }
}
