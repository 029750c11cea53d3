package dev.librarian.classification;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Classification limits bound from {@code librarian.classification.*}.
 *
 * <ul>
 *   <li>{@code excerpt-chars} - characters of document text embedded in the prompt (default 4000)
 *   <li>{@code stored-text-chars} - characters of extracted text kept on each item (default 1000)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "librarian.classification")
public class ClassificationProperties {

  private int excerptChars = 4000;
  private int storedTextChars = 1000;

  @PostConstruct
  void validate() {
    if (excerptChars < 200) {
      throw new IllegalStateException(
          "librarian.classification.excerpt-chars must be at least 200, got: " + excerptChars);
    }
    if (storedTextChars < 0 || storedTextChars > 1000) {
      throw new IllegalStateException(
          "librarian.classification.stored-text-chars must be in [0, 1000], got: "
              + storedTextChars);
    }
  }

  public int getExcerptChars() {
    return excerptChars;
  }

  public void setExcerptChars(int excerptChars) {
    this.excerptChars = excerptChars;
  }

  public int getStoredTextChars() {
    return storedTextChars;
  }

  public void setStoredTextChars(int storedTextChars) {
    this.storedTextChars = storedTextChars;
  }
}
