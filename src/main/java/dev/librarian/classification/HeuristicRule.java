package dev.librarian.classification;

import java.util.List;
import java.util.Set;

/**
 * One entry of the heuristic rule table.
 *
 * @param triggerTerms lowercase terms; the rule fires when any occurs in the combined text
 * @param workspaceId workspace suggested when the rule fires
 * @param reason explanation reported with the candidate
 * @param baseBoost confidence boost before path confirmation (0..2)
 * @param pathConfirmations path keywords that add one to the boost
 */
public record HeuristicRule(
    List<String> triggerTerms,
    String workspaceId,
    String reason,
    int baseBoost,
    Set<String> pathConfirmations) {

  public HeuristicRule {
    if (triggerTerms == null || triggerTerms.isEmpty()) {
      throw new IllegalArgumentException("Rule for " + workspaceId + " has no trigger terms");
    }
    if (baseBoost < 0 || baseBoost > 2) {
      throw new IllegalArgumentException("baseBoost must be in [0, 2], got: " + baseBoost);
    }
    triggerTerms = List.copyOf(triggerTerms);
    pathConfirmations = pathConfirmations == null ? Set.of() : Set.copyOf(pathConfirmations);
  }

  /** Whether any trigger term occurs in {@code combined}. */
  boolean triggers(String combined) {
    for (String term : triggerTerms) {
      if (combined.contains(term)) {
        return true;
      }
    }
    return false;
  }

  boolean confirmedBy(Set<String> pathKeywords) {
    for (String keyword : pathKeywords) {
      if (pathConfirmations.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
