package dev.librarian.classification;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Derives keyword and year hints from a file's original location.
 *
 * <p>Works on the path string only: the file does not have to exist, and both {@code /} and
 * {@code \} are accepted as separators so paths recorded on another OS still decompose.
 */
@Component
public class PathHintExtractor {

  private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]+");
  private static final Pattern PUNCTUATION =
      Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Extracts hints from the directory components of {@code originalPath} and the stem of {@code
   * originalFilename}.
   *
   * @param originalPath full path of the file including its name; blank yields empty hints
   * @param originalFilename the file name, e.g. {@code W2_2023.pdf}
   * @return keywords, years and lowercase context
   */
  public PathHints extract(String originalPath, String originalFilename) {
    if (originalPath == null || originalPath.isBlank()) {
      return PathHints.empty();
    }

    List<String> directories = directoryComponents(originalPath);
    String stem = stem(originalFilename == null ? "" : originalFilename);

    Set<String> keywords = new LinkedHashSet<>();
    Set<String> years = new LinkedHashSet<>();
    for (String directory : directories) {
      keywords.addAll(words(directory));
      years.addAll(YearPattern.findAll(directory));
    }
    keywords.addAll(words(stem));
    years.addAll(YearPattern.findAll(stem));

    List<String> contextParts = new ArrayList<>(directories);
    if (!stem.isEmpty()) {
      contextParts.add(stem);
    }
    String context = String.join(" ", contextParts).toLowerCase(Locale.ROOT);

    return new PathHints(keywords, years, context);
  }

  private static List<String> directoryComponents(String originalPath) {
    String[] parts = SEPARATORS.split(originalPath.trim());
    List<String> directories = new ArrayList<>();
    // last element is the file itself
    for (int i = 0; i < parts.length - 1; i++) {
      if (!parts[i].isBlank()) {
        directories.add(parts[i]);
      }
    }
    return directories;
  }

  static String stem(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  private static List<String> words(String component) {
    String cleaned = PUNCTUATION.matcher(component).replaceAll(" ").toLowerCase(Locale.ROOT).trim();
    if (cleaned.isEmpty()) {
      return List.of();
    }
    return List.of(WHITESPACE.split(cleaned));
  }
}
