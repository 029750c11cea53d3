package dev.librarian.classification;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Classification hints derived from where a file lives and what it is called.
 *
 * @param keywords lowercase words from directory names and the filename stem, deduplicated
 * @param years 4-digit years found in directory names and the filename stem
 * @param context lowercase, space-joined directory names and filename stem
 */
public record PathHints(Set<String> keywords, Set<String> years, String context) {

  private static final PathHints EMPTY = new PathHints(Set.of(), Set.of(), "");

  public PathHints {
    keywords =
        keywords == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
    years = years == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(years));
    context = context == null ? "" : context;
  }

  public static PathHints empty() {
    return EMPTY;
  }

  public boolean hasContext() {
    return !context.isBlank();
  }
}
