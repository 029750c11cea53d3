package dev.librarian.classification;

import java.util.regex.Pattern;

/**
 * Reduces a filename to word characters, hyphens and underscores.
 *
 * <p>Every other character becomes {@code _}, then runs of {@code _} and runs of {@code -} are
 * collapsed to one. Applying it twice gives the same result as applying it once.
 */
public final class FilenameSanitizer {

  private static final Pattern ILLEGAL = Pattern.compile("[^\\w-]");
  private static final Pattern UNDERSCORES = Pattern.compile("_+");
  private static final Pattern HYPHENS = Pattern.compile("-+");

  private FilenameSanitizer() {
    // utility class
  }

  public static String sanitize(String filename) {
    if (filename == null) {
      return "";
    }
    String cleaned = ILLEGAL.matcher(filename).replaceAll("_");
    cleaned = UNDERSCORES.matcher(cleaned).replaceAll("_");
    return HYPHENS.matcher(cleaned).replaceAll("-");
  }
}
