package com.etl.io.input;

import com.etl.core.Options;
import com.etl.core.files.FileFinder;
import com.etl.core.files.NamePatterns;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Which files under the data directory an input reads.
 *
 * <p>Options: {@code file} (explicit path, relative to the data directory), {@code iname}
 * (case-insensitive glob on the file name), {@code regex} (regular expression searched in the file
 * name), {@code matching} (a {@code Predicate<Path>} that inspects candidates). Name tests combine
 * with AND; {@code matching} runs last.
 */
public record FileCriteria(String file, Pattern iname, Pattern regex, Predicate<Path> matching) {

  /** Options consumed here; inputs pass the rest on to their own settings. */
  public static final List<String> OPTION_NAMES = List.of("file", "iname", "regex", "matching");

  public static FileCriteria from(Map<String, ?> options, String defaultIname) {
    String file = Options.string(options, "file", null);
    String iname = Options.string(options, "iname", file == null && options.get("regex") == null ? defaultIname : null);
    String regex = Options.string(options, "regex", null);
    @SuppressWarnings("unchecked")
    Predicate<Path> matching = (Predicate<Path>) Options.get(options, "matching", Predicate.class);
    return new FileCriteria(
        file,
        iname == null ? null : NamePatterns.iname(iname),
        regex == null ? null : Pattern.compile(regex),
        matching);
  }

  public boolean accepts(Path candidate) {
    String name = candidate.getFileName().toString();
    if (iname != null && !NamePatterns.matches(iname, name)) return false;
    if (regex != null && !regex.matcher(name).find()) return false;
    return matching == null || matching.test(candidate);
  }

  /** Every accepted file below {@code dataIn}, shallowest first, then by name. */
  public List<Path> findAll(Path dataIn) throws IOException {
    if (file != null) return List.of(findOne(dataIn));
    return FileFinder.files(dataIn, this::accepts);
  }

  /** The explicit file, or the first accepted one. */
  public Path findOne(Path dataIn) throws IOException {
    if (file != null) {
      Path explicit = dataIn.resolve(file);
      if (!Files.isRegularFile(explicit)) throw new NoSuchFileException(explicit.toString());
      return explicit;
    }
    List<Path> found = FileFinder.files(dataIn, this::accepts);
    if (found.isEmpty()) throw new NoSuchFileException(dataIn.toString(), null, "No files matched " + describe());
    return found.get(0);
  }

  public String describe() {
    StringBuilder b = new StringBuilder();
    if (file != null) b.append("file=").append(file);
    if (iname != null) b.append(b.length() > 0 ? ", " : "").append("iname=").append(iname.pattern());
    if (regex != null) b.append(b.length() > 0 ? ", " : "").append("regex=").append(regex.pattern());
    if (matching != null) b.append(b.length() > 0 ? ", " : "").append("matching");
    return b.length() == 0 ? "any file" : b.toString();
  }
}
