package com.etl.core.files;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory searches. Results are deterministic: shallower paths first, then lexical order.
 */
public final class FileFinder {
  private FileFinder() {}

  private static Comparator<Path> byDepthThenName(Path root) {
    return Comparator.<Path>comparingInt(p -> root.relativize(p).getNameCount())
        .thenComparing(Path::toString);
  }

  /**
   * The first directory below {@code root}, between {@code minDepth} and {@code maxDepth} levels
   * deep, whose name matches {@code namePattern} in full.
   */
  public static Optional<Path> firstDirectory(Path root, Pattern namePattern, int minDepth, int maxDepth)
      throws IOException {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(namePattern, "namePattern");
    if (!Files.isDirectory(root)) throw new IOException("Not a directory: " + root);
    try (Stream<Path> walk = Files.walk(root, maxDepth)) {
      return walk
          .filter(p -> root.relativize(p).getNameCount() >= minDepth && !p.equals(root))
          .filter(Files::isDirectory)
          .filter(p -> NamePatterns.matches(namePattern, p.getFileName().toString()))
          .min(byDepthThenName(root));
    }
  }

  /** Regular files anywhere below {@code root} accepted by {@code filter}. */
  public static List<Path> files(Path root, Predicate<Path> filter) throws IOException {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(filter, "filter");
    if (!Files.isDirectory(root)) throw new IOException("Not a directory: " + root);
    try (Stream<Path> walk = Files.walk(root)) {
      return walk
          .filter(Files::isRegularFile)
          .filter(filter)
          .sorted(byDepthThenName(root))
          .collect(Collectors.toList());
    }
  }

  /** Files and directories directly or indirectly below {@code root} accepted by {@code filter}. */
  public static List<Path> entries(Path root, Predicate<Path> filter) throws IOException {
    Objects.requireNonNull(root, "root");
    if (!Files.isDirectory(root)) throw new IOException("Not a directory: " + root);
    try (Stream<Path> walk = Files.walk(root)) {
      return walk
          .filter(p -> !p.equals(root))
          .filter(filter)
          .sorted(byDepthThenName(root))
          .collect(Collectors.toList());
    }
  }
}
