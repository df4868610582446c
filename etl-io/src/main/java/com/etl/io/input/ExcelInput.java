package com.etl.io.input;

import com.etl.core.AliasRegistry;
import com.etl.core.Locator;
import com.etl.core.Options;
import com.etl.core.Pipeline;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * One worksheet of an Excel workbook (XLSX or XLS), one record per row.
 *
 * <p>Records map the 0-based column index to the cell text as Excel displays it; empty cells are
 * {@code null} and rows without any value are skipped. Column letters become input aliases first,
 * then, unless {@code noColumnNames} is set, the trimmed header cells.
 *
 * <p>Options beyond the file criteria: {@code worksheet} (an exact sheet name, or a {@link Pattern}
 * for the first sheet whose name it finds; default the first sheet), {@code password} (encrypted
 * files), {@code skipping} (as for {@link DelimitedTextInput}), {@code noColumnNames}.
 */
public final class ExcelInput extends FileInput {
  private static final Logger log = LoggerFactory.getLogger(ExcelInput.class);

  private final Object worksheet;
  private final String password;
  private final Skipping skipping;
  private final boolean noColumnNames;
  private final DataFormatter formatter = new DataFormatter();

  private Workbook workbook;
  private Sheet sheet;
  private FormulaEvaluator evaluator;
  private int firstColumn;
  private int lastColumn;
  private int nextRow;

  public ExcelInput(Map<String, Object> options) {
    super(options, "*.xls*");
    Object name = options.get("worksheet");
    if (name != null && !(name instanceof Pattern) && !(name instanceof String)) {
      throw new IllegalArgumentException("Option 'worksheet' must be a name or a Pattern, got " + name.getClass().getSimpleName());
    }
    this.worksheet = name;
    this.password = Options.string(options, "password", null);
    this.skipping = Skipping.from(options);
    this.noColumnNames = Options.bool(options, "noColumnNames", false);
  }

  @Override
  protected void open(Pipeline pipeline, Path file) throws IOException {
    try {
      workbook = WorkbookFactory.create(file.toFile(), password, true);
    } catch (EncryptedDocumentException e) {
      throw new IOException("Unable to open the Excel file '" + file + "': " + e.getMessage(), e);
    }
    try {
      sheet = findSheet(file);
    } catch (IOException e) {
      closeWorkbook(e);
      throw e;
    }
    evaluator = workbook.getCreationHelper().createFormulaEvaluator();
    log.debug("[{}] reading worksheet '{}' of {}", pipeline.name(), sheet.getSheetName(), file.getFileName());

    firstColumn = Integer.MAX_VALUE;
    lastColumn = -1;
    for (Row row : sheet) {
      if (row.getFirstCellNum() < 0) continue;
      firstColumn = Math.min(firstColumn, row.getFirstCellNum());
      lastColumn = Math.max(lastColumn, row.getLastCellNum() - 1);
    }
    if (lastColumn < 0) {
      nextRow = 0;
      return;
    }

    for (int c = firstColumn; c <= lastColumn; c++) {
      pipeline.registerAlias(ColumnLetters.of(c), Locator.key(c), AliasRegistry.Origin.INPUT);
    }

    int last = sheet.getLastRowNum();
    nextRow = sheet.getFirstRowNum();
    for (int i = 0; nextRow <= last && skipping.skips(i, cells(nextRow)); i++) nextRow++;

    if (!noColumnNames && nextRow <= last) {
      Map<Integer, Object> header = cells(nextRow++);
      header.forEach((column, value) -> {
        String name = value == null ? "" : value.toString().strip();
        if (!name.isEmpty()) pipeline.registerAlias(name, Locator.key(column), AliasRegistry.Origin.INPUT);
      });
    }
  }

  @Override
  public void run(Pipeline pipeline) throws IOException {
    if (lastColumn < 0) return;
    int last = sheet.getLastRowNum();
    for (int r = nextRow; r <= last; r++) {
      Map<Integer, Object> record = cells(r);
      if (record.values().stream().allMatch(v -> v == null)) continue;
      pipeline.record(record);
    }
  }

  @Override
  public void finish(Pipeline pipeline) throws IOException {
    if (workbook == null) return;
    try {
      workbook.close();
    } finally {
      workbook = null;
      sheet = null;
      evaluator = null;
    }
  }

  private Sheet findSheet(Path file) throws IOException {
    if (worksheet == null) {
      if (workbook.getNumberOfSheets() == 0) throw new IOException("'" + file + "' has no worksheets");
      return workbook.getSheetAt(0);
    }
    if (worksheet instanceof Pattern pattern) {
      for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
        if (pattern.matcher(workbook.getSheetName(i)).find()) return workbook.getSheetAt(i);
      }
    } else {
      Sheet named = workbook.getSheet((String) worksheet);
      if (named != null) return named;
    }
    throw new IOException("No worksheets match '" + worksheet + "' in '" + file + "'");
  }

  private Map<Integer, Object> cells(int rowIndex) {
    Row row = sheet.getRow(rowIndex);
    Map<Integer, Object> record = new LinkedHashMap<>();
    for (int c = firstColumn; c <= lastColumn; c++) {
      Cell cell = row == null ? null : row.getCell(c);
      String text = cell == null ? "" : formatter.formatCellValue(cell, evaluator);
      record.put(c, text.isEmpty() ? null : text);
    }
    return record;
  }

  private void closeWorkbook(IOException failure) {
    try {
      workbook.close();
    } catch (IOException e) {
      failure.addSuppressed(e);
    } finally {
      workbook = null;
    }
  }
}
