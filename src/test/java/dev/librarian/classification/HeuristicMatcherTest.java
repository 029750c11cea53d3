package dev.librarian.classification;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class HeuristicMatcherTest {

  private final HeuristicMatcher matcher = new HeuristicMatcher(HeuristicRules.defaults());
  private final PathHintExtractor pathHints = new PathHintExtractor();

  @Test
  void taxFormWithoutPathHintsGetsBaseBoost() {
    HeuristicCandidate candidate =
        matcher.match("IRS Form 1040 for tax year 2024", "taxes.pdf", PathHints.empty()).orElseThrow();

    assertThat(candidate.workspaceId()).isEqualTo("KB.Finance.Taxes");
    assertThat(candidate.confidenceBoost()).isEqualTo(2);
    assertThat(candidate.reason()).isEqualTo("Tax form detected");
  }

  @Test
  void pathConfirmationAddsOne() {
    PathHints hints = pathHints.extract("/docs/Taxes/2024/return.pdf", "return.pdf");

    HeuristicCandidate candidate =
        matcher.match("IRS Form 1040", "return.pdf", hints).orElseThrow();

    assertThat(candidate.confidenceBoost()).isEqualTo(3);
    assertThat(candidate.reason()).isEqualTo("Tax form detected (path confirms)");
  }

  @Test
  void paystubWinsOverTaxTerms() {
    HeuristicCandidate candidate =
        matcher
            .match("Earnings statement. Federal income tax withheld: $412.00", "stub.pdf", PathHints.empty())
            .orElseThrow();

    assertThat(candidate.workspaceId()).isEqualTo("KB.Finance.Income");
  }

  @Test
  void filenameAloneCanTrigger() {
    assertThat(matcher.match("", "mortgage_statement.pdf", PathHints.empty()))
        .hasValueSatisfying(c -> assertThat(c.workspaceId()).isEqualTo("KB.Assets.RealEstate"));
  }

  @Test
  void noRuleFiresForUnrelatedText() {
    assertThat(matcher.match("grocery list: apples", "notes.md", PathHints.empty())).isEmpty();
  }

  @Test
  void earlierRuleWinsWhenTwoMatch() {
    HeuristicRule first =
        new HeuristicRule(List.of("shared"), "KB.First", "first", 1, Set.of());
    HeuristicRule second =
        new HeuristicRule(List.of("shared"), "KB.Second", "second", 2, Set.of());

    HeuristicMatcher ordered = new HeuristicMatcher(List.of(first, second));
    HeuristicMatcher reversed = new HeuristicMatcher(List.of(second, first));

    assertThat(ordered.match("shared term", "f.txt", PathHints.empty()))
        .hasValueSatisfying(c -> assertThat(c.workspaceId()).isEqualTo("KB.First"));
    assertThat(reversed.match("shared term", "f.txt", PathHints.empty()))
        .hasValueSatisfying(c -> assertThat(c.workspaceId()).isEqualTo("KB.Second"));
  }

  @Test
  void defaultRuleOrderIsStable() {
    assertThat(HeuristicRules.defaults())
        .extracting(HeuristicRule::workspaceId)
        .containsExactly(
            "KB.Finance.Income",
            "KB.Finance.Taxes",
            "KB.Assets.RealEstate",
            "KB.Finance.Insurance",
            "KB.Personal.Identity",
            "KB.Personal.Estate",
            "KB.Work.Employment",
            "KB.Finance.Banking",
            "KB.Finance.Investments",
            "KB.Personal.Health",
            "KB.Assets.Vehicles");
  }
}
