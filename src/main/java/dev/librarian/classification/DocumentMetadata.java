package dev.librarian.classification;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Facts pulled from a document's extracted text.
 *
 * @param years up to three distinct years, most recently appearing last
 * @param amounts up to five currency strings from the start of the text
 * @param formTypes form identifiers such as {@code 1040}, {@code W-2}, {@code 1099-INT}
 */
public record DocumentMetadata(List<String> years, List<String> amounts, List<String> formTypes) {

  static final int MAX_YEARS = 3;

  public DocumentMetadata {
    years = years == null ? List.of() : List.copyOf(years);
    amounts = amounts == null ? List.of() : List.copyOf(amounts);
    formTypes = formTypes == null ? List.of() : List.copyOf(formTypes);
  }

  public static DocumentMetadata empty() {
    return new DocumentMetadata(List.of(), List.of(), List.of());
  }

  /** The year that appeared last in the text, if any. */
  public Optional<String> mostRecentYear() {
    return years.isEmpty() ? Optional.empty() : Optional.of(years.get(years.size() - 1));
  }

  /**
   * Merges years found elsewhere (e.g. in the file path) ahead of the content years, so a year
   * taken from the text still counts as the most recent one. Only the last three years of the
   * merged list are kept.
   *
   * @param additional extra years, duplicates of content years are ignored
   * @return metadata with the merged year list
   */
  public DocumentMetadata withAdditionalYears(Collection<String> additional) {
    if (additional == null || additional.isEmpty()) {
      return this;
    }
    List<String> merged = new ArrayList<>();
    for (String year : additional) {
      if (!years.contains(year) && !merged.contains(year)) {
        merged.add(year);
      }
    }
    merged.addAll(years);
    int from = Math.max(0, merged.size() - MAX_YEARS);
    return new DocumentMetadata(merged.subList(from, merged.size()), amounts, formTypes);
  }
}
