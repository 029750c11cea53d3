package dev.librarian.classification;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Finds 19xx/20xx year tokens not embedded in a longer digit run. */
final class YearPattern {

  private static final Pattern YEAR = Pattern.compile("(?<!\\d)(?:19|20)\\d{2}(?!\\d)");

  private YearPattern() {
    // utility class
  }

  /** All year matches in order of appearance, duplicates included. */
  static List<String> findAll(String text) {
    List<String> years = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return years;
    }
    Matcher matcher = YEAR.matcher(text);
    while (matcher.find()) {
      years.add(matcher.group());
    }
    return years;
  }
}
