package com.etl.io.input;

import com.etl.core.AliasRegistry;
import com.etl.core.Locator;
import com.etl.core.Options;
import com.etl.core.Pipeline;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Comma separated (or otherwise delimited) text, one record per row.
 *
 * <p>Records are maps from 0-based column index to cell text. Column letters ({@code A}, {@code B},
 * ...) and, unless {@code noColumnNames} is set, the trimmed header cells become input aliases
 * for those indexes. Options beyond the file criteria: {@code separator} (default {@code ,}),
 * {@code skipping} (a row count, or a {@code Predicate<Map<Integer, Object>>} that rows are
 * dropped until it accepts one; applied before the header), {@code noColumnNames}.
 */
public final class DelimitedTextInput extends FileInput {
  private static final CsvMapper CSV = CsvMapper.builder()
      .enable(CsvParser.Feature.WRAP_AS_ARRAY)
      .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
      .build();

  private final char separator;
  private final Skipping skipping;
  private final boolean noColumnNames;
  private MappingIterator<String[]> rows;
  private String[] pending;
  private int lettered;

  public DelimitedTextInput(Map<String, Object> options) {
    super(options, null);
    String sep = Options.string(options, "separator", ",");
    if (sep.length() != 1) throw new IllegalArgumentException("separator must be a single character: '" + sep + "'");
    this.separator = sep.charAt(0);
    this.skipping = Skipping.from(options);
    this.noColumnNames = Options.bool(options, "noColumnNames", false);
  }

  @Override
  protected void open(Pipeline pipeline, Path file) throws IOException {
    CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);
    rows = CSV.readerFor(String[].class)
        .with(schema)
        .readValues(Files.newBufferedReader(file, StandardCharsets.UTF_8));

    lettered = 0;
    pending = null;
    for (int i = 0; rows.hasNextValue(); i++) {
      String[] row = rows.nextValue();
      if (!skipping.skips(i, cells(row))) {
        pending = row;
        break;
      }
    }

    if (!noColumnNames && pending != null) {
      String[] header = pending;
      pending = null;
      for (int i = 0; i < header.length; i++) {
        String name = header[i] == null ? "" : header[i].strip();
        if (!name.isEmpty()) pipeline.registerAlias(name, Locator.key(i), AliasRegistry.Origin.INPUT);
      }
      letters(pipeline, header.length);
    }
  }

  @Override
  public void run(Pipeline pipeline) throws IOException {
    if (pending != null) {
      emit(pipeline, pending);
      pending = null;
    }
    while (rows.hasNextValue()) emit(pipeline, rows.nextValue());
  }

  private void emit(Pipeline pipeline, String[] row) {
    if (isBlank(row)) return;
    letters(pipeline, row.length);
    pipeline.record(cells(row));
  }

  @Override
  public void finish(Pipeline pipeline) throws IOException {
    if (rows != null) {
      rows.close();
      rows = null;
    }
  }

  // letter aliases grow with the widest row seen so far
  private void letters(Pipeline pipeline, int columns) {
    for (int i = lettered; i < columns; i++) {
      pipeline.registerAlias(ColumnLetters.of(i), Locator.key(i), AliasRegistry.Origin.INPUT);
    }
    lettered = Math.max(lettered, columns);
  }

  private static Map<Integer, Object> cells(String[] row) {
    Map<Integer, Object> record = new LinkedHashMap<>();
    for (int i = 0; i < row.length; i++) record.put(i, row[i]);
    return record;
  }

  private static boolean isBlank(String[] row) {
    for (String cell : row) {
      if (cell != null && !cell.isBlank()) return false;
    }
    return true;
  }
}
