package dev.librarian.session;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Scan session settings bound from {@code librarian.session.*}.
 *
 * @param preferencesFile JSON file remembering the last input and output paths
 * @param maxTextBytes upper bound of bytes read from a single file for classification
 */
@ConfigurationProperties(prefix = "librarian.session")
public record SessionProperties(String preferencesFile, int maxTextBytes) {

  public SessionProperties {
    if (preferencesFile == null || preferencesFile.isBlank()) {
      preferencesFile = System.getProperty("user.home") + "/.librarian/preferences.json";
    }
    maxTextBytes = maxTextBytes <= 0 ? 1_048_576 : maxTextBytes;
  }
}
