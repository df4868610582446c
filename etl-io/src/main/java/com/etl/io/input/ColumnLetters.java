package com.etl.io.input;

/** Spreadsheet-style column names: 0 is {@code A}, 25 is {@code Z}, 26 is {@code AA}. */
public final class ColumnLetters {
  private ColumnLetters() {}

  public static String of(int index) {
    if (index < 0) throw new IllegalArgumentException("index must be >= 0: " + index);
    StringBuilder letters = new StringBuilder();
    int n = index + 1;
    while (n > 0) {
      int rem = (n - 1) % 26;
      letters.append((char) ('A' + rem));
      n = (n - 1) / 26;
    }
    return letters.reverse().toString();
  }
}
