package dev.librarian.classification;

import dev.librarian.taxonomy.NamingTemplate;
import dev.librarian.taxonomy.Workspace;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves a workspace's {@link NamingTemplate} into a concrete filename.
 *
 * <p>Component tokens fall in three groups:
 *
 * <ul>
 *   <li>date tokens ({@code year}, {@code date}, {@code period}) take the most recent year, or
 *       {@code Unknown}
 *   <li>free-text tokens (document type or entity roles) consume, in template order, the first
 *       three words of the suggested name; once those run out they reuse the first word, or
 *       {@code Unknown} when the suggestion had no words
 *   <li>anything else resolves to {@code Unknown}
 * </ul>
 *
 * <p>Output depends only on the arguments.
 */
@Component
public class FilenameGenerator {

  private static final Logger log = LoggerFactory.getLogger(FilenameGenerator.class);

  static final String UNKNOWN = "Unknown";
  static final String DEFAULT_NAME = "Document";
  static final int MAX_NAME_WORDS = 3;

  static final Set<String> DATE_TOKENS = Set.of("year", "date", "period");

  static final Set<String> FREE_TEXT_TOKENS =
      Set.of(
          "doc_type",
          "type",
          "matter",
          "topic",
          "jurisdiction",
          "institution",
          "provider",
          "employer",
          "lender",
          "service",
          "account",
          "property_nickname",
          "vehicle_name",
          "entity_name",
          "person",
          "ticker_or_topic");

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]*)}");
  private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Builds the filename (without extension) for a document filed in {@code workspace}.
   *
   * @param workspace target workspace
   * @param metadata extracted metadata, the most recent year fills date tokens
   * @param originalFilename original name of the file
   * @param suggestedName model-suggested descriptive name, may be blank
   * @return sanitized filename
   */
  public String generate(
      Workspace workspace,
      DocumentMetadata metadata,
      String originalFilename,
      String suggestedName) {
    NamingTemplate template = workspace.naming();
    List<String> words = nameWords(suggestedName);
    String cleanName = words.isEmpty() ? DEFAULT_NAME : String.join("_", words);

    Map<String, String> values = new HashMap<>();
    values.put("prefix", template.prefix());

    String year = metadata == null ? UNKNOWN : metadata.mostRecentYear().orElse(UNKNOWN);
    int nextWord = 0;
    for (String component : template.components()) {
      if (values.containsKey(component)) {
        continue;
      }
      if (DATE_TOKENS.contains(component)) {
        values.put(component, year);
      } else if (FREE_TEXT_TOKENS.contains(component)) {
        if (nextWord < words.size()) {
          values.put(component, words.get(nextWord++));
        } else {
          values.put(component, words.isEmpty() ? UNKNOWN : words.get(0));
        }
      } else {
        values.put(component, UNKNOWN);
      }
    }

    String filename = substitute(template.format(), values);
    if (filename == null) {
      log.debug(
          "Template {} of {} has unresolved tokens, using fallback name for {}",
          template.format(),
          workspace.id(),
          originalFilename);
      filename = template.prefix() + "-" + cleanName;
    }
    return FilenameSanitizer.sanitize(filename);
  }

  /** Up to three words of the suggested name with punctuation removed. */
  static List<String> nameWords(String suggestedName) {
    if (suggestedName == null) {
      return List.of();
    }
    String cleaned = NON_WORD.matcher(suggestedName).replaceAll("").trim();
    if (cleaned.isEmpty()) {
      return List.of();
    }
    List<String> words = new ArrayList<>(Arrays.asList(WHITESPACE.split(cleaned)));
    return words.subList(0, Math.min(MAX_NAME_WORDS, words.size()));
  }

  /** Replaces every placeholder, or returns null if one has no value. */
  private static String substitute(String format, Map<String, String> values) {
    if (format == null) {
      return null;
    }
    Matcher matcher = PLACEHOLDER.matcher(format);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String value = values.get(matcher.group(1));
      if (value == null) {
        return null;
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}
