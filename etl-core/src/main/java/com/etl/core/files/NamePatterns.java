package com.etl.core.files;

import java.util.Objects;
import java.util.regex.Pattern;

/** Shell-style globs ({@code *}, {@code ?}, {@code [abc]}) as case-insensitive regular expressions. */
public final class NamePatterns {
  private NamePatterns() {}

  /** Matches whole file names, ignoring case, like {@code find -iname}. */
  public static Pattern iname(String glob) {
    Objects.requireNonNull(glob, "glob");
    StringBuilder regex = new StringBuilder(glob.length() + 8);
    boolean inClass = false;
    for (int i = 0; i < glob.length(); i++) {
      char c = glob.charAt(i);
      if (inClass) {
        if (c == ']') inClass = false;
        if (c == '\\') regex.append('\\');
        regex.append(c);
        continue;
      }
      switch (c) {
        case '*' -> regex.append(".*");
        case '?' -> regex.append('.');
        case '[' -> {
          inClass = true;
          regex.append('[');
          if (i + 1 < glob.length() && glob.charAt(i + 1) == '!') {
            regex.append('^');
            i++;
          }
        }
        default -> {
          if ("\\.^$+(){}|".indexOf(c) >= 0) regex.append('\\');
          regex.append(c);
        }
      }
    }
    if (inClass) throw new IllegalArgumentException("Unclosed '[' in pattern: " + glob);
    return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  /** True when the whole {@code name} matches. */
  public static boolean matches(Pattern pattern, String name) {
    return pattern.matcher(name).matches();
  }
}
