package dev.librarian.classification;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Extracts years, dollar amounts and tax/payroll form identifiers from document text. */
@Component
public class MetadataExtractor {

  static final int MAX_YEARS = DocumentMetadata.MAX_YEARS;
  static final int MAX_AMOUNTS = 5;
  static final int AMOUNT_SCAN_CHARS = 2000;

  private static final Pattern AMOUNT = Pattern.compile("\\$[\\d,]+(?:\\.\\d{2})?");

  // Order matters: matches are reported pattern by pattern.
  private static final List<Pattern> FORM_PATTERNS =
      List.of(
          Pattern.compile("Form\\s+(\\d+\\w*)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\b(W-?\\d+)\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\b(1099[-\\w]*)\\b", Pattern.CASE_INSENSITIVE));

  public DocumentMetadata extract(String text) {
    if (text == null || text.isEmpty()) {
      return DocumentMetadata.empty();
    }
    return new DocumentMetadata(years(text), amounts(text), formTypes(text));
  }

  private static List<String> years(String text) {
    // re-inserting moves a repeated year to the end, so order follows last appearance
    LinkedHashSet<String> byLastAppearance = new LinkedHashSet<>();
    for (String year : YearPattern.findAll(text)) {
      byLastAppearance.remove(year);
      byLastAppearance.add(year);
    }
    List<String> ordered = new ArrayList<>(byLastAppearance);
    int from = Math.max(0, ordered.size() - MAX_YEARS);
    return ordered.subList(from, ordered.size());
  }

  private static List<String> amounts(String text) {
    String head = text.length() > AMOUNT_SCAN_CHARS ? text.substring(0, AMOUNT_SCAN_CHARS) : text;
    List<String> amounts = new ArrayList<>();
    Matcher matcher = AMOUNT.matcher(head);
    while (matcher.find() && amounts.size() < MAX_AMOUNTS) {
      amounts.add(matcher.group());
    }
    return amounts;
  }

  private static List<String> formTypes(String text) {
    List<String> forms = new ArrayList<>();
    for (Pattern pattern : FORM_PATTERNS) {
      Matcher matcher = pattern.matcher(text);
      while (matcher.find()) {
        forms.add(matcher.group(1));
      }
    }
    return forms;
  }
}
