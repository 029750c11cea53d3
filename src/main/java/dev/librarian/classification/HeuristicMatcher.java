package dev.librarian.classification;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-match keyword classifier over an ordered {@link HeuristicRule} table.
 *
 * <p>The text searched is the lowercased document text, the lowercased filename and the path
 * context, joined by spaces. Rules are evaluated in list order and evaluation stops at the first
 * rule that fires.
 *
 * @see HeuristicRules#defaults()
 */
public class HeuristicMatcher {

  private static final Logger log = LoggerFactory.getLogger(HeuristicMatcher.class);

  private final List<HeuristicRule> rules;

  public HeuristicMatcher(List<HeuristicRule> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * Returns the candidate of the first rule whose trigger terms occur in the combined text.
   *
   * @param text extracted document text, may be empty
   * @param filename original filename
   * @param pathHints hints from the original location; keywords drive path confirmation
   * @return the first matching candidate, or empty when no rule fires
   */
  public Optional<HeuristicCandidate> match(String text, String filename, PathHints pathHints) {
    PathHints hints = pathHints == null ? PathHints.empty() : pathHints;
    String combined = combine(text, filename, hints);

    for (HeuristicRule rule : rules) {
      if (!rule.triggers(combined)) {
        continue;
      }
      int boost = rule.baseBoost();
      String reason = rule.reason();
      if (rule.confirmedBy(hints.keywords())) {
        boost += 1;
        reason += " (path confirms)";
      }
      log.debug("Heuristic match for {}: {} -> {} (+{})", filename, reason, rule.workspaceId(), boost);
      return Optional.of(new HeuristicCandidate(rule.workspaceId(), boost, reason));
    }
    return Optional.empty();
  }

  public List<HeuristicRule> rules() {
    return rules;
  }

  private static String combine(String text, String filename, PathHints hints) {
    StringBuilder combined = new StringBuilder();
    combined.append(text == null ? "" : text.toLowerCase(Locale.ROOT));
    combined.append(' ').append(filename == null ? "" : filename.toLowerCase(Locale.ROOT));
    if (hints.hasContext()) {
      combined.append(' ').append(hints.context());
    }
    return combined.toString();
  }
}
