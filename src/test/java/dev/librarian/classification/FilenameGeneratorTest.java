package dev.librarian.classification;

import static org.assertj.core.api.Assertions.assertThat;

import dev.librarian.fixture.Taxonomies;
import dev.librarian.taxonomy.NamingTemplate;
import dev.librarian.taxonomy.TaxonomyRegistry;
import dev.librarian.taxonomy.Workspace;
import java.util.List;
import org.junit.jupiter.api.Test;

class FilenameGeneratorTest {

  private final FilenameGenerator generator = new FilenameGenerator();
  private final TaxonomyRegistry taxonomy = Taxonomies.standard();

  private Workspace workspace(String id) {
    return taxonomy.resolve(id).orElseThrow();
  }

  private static DocumentMetadata years(String... years) {
    return new DocumentMetadata(List.of(years), List.of(), List.of());
  }

  @Test
  void taxFilenameUsesMostRecentYearAndFirstWord() {
    String name =
        generator.generate(
            workspace("KB.Finance.Taxes"),
            years("2023", "2024"),
            "scan001.pdf",
            "federal return draft");

    assertThat(name).isEqualTo("TAX-2024-federal");
  }

  @Test
  void wordsAreConsumedInTemplateOrder() {
    String name =
        generator.generate(
            workspace("KB.Finance.Banking"), years("2022"), "stmt.pdf", "Chase checking");

    assertThat(name).isEqualTo("BANK-Chase-2022-checking");
  }

  @Test
  void exhaustedWordsReuseTheFirstWord() {
    String name =
        generator.generate(workspace("KB.Finance.Banking"), years(), "stmt.pdf", "Chase");

    assertThat(name).isEqualTo("BANK-Chase-Unknown-Chase");
  }

  @Test
  void missingNameAndYearBecomeUnknown() {
    String name =
        generator.generate(
            workspace("KB.Finance.Insurance"), DocumentMetadata.empty(), "policy.pdf", "");

    assertThat(name).isEqualTo("INS-Unknown-Unknown-Unknown");
  }

  @Test
  void punctuationInSuggestedNameIsDropped() {
    String name =
        generator.generate(
            workspace("KB.Personal.Misc"), DocumentMetadata.empty(), "x.txt", "Mom's recipes!");

    assertThat(name).isEqualTo("MISC-Moms");
  }

  @Test
  void unresolvablePlaceholderFallsBackToPrefixAndCleanName() {
    Workspace odd =
        new Workspace(
            "KB.Odd", "odd", new NamingTemplate("ODD", List.of("year"), "{prefix}-{missing}"));

    String name = generator.generate(odd, years("2020"), "a.pdf", "spring cleaning list extra");

    assertThat(name).isEqualTo("ODD-spring_cleaning_list");
  }

  @Test
  void fallbackWithoutSuggestionUsesDefaultName() {
    Workspace odd =
        new Workspace("KB.Odd", "odd", new NamingTemplate("ODD", List.of(), "{prefix}-{who}"));

    assertThat(generator.generate(odd, DocumentMetadata.empty(), "a.pdf", null))
        .isEqualTo("ODD-Document");
  }

  @Test
  void nameWordsKeepsAtMostThree() {
    assertThat(FilenameGenerator.nameWords("one two three four"))
        .containsExactly("one", "two", "three");
    assertThat(FilenameGenerator.nameWords("  ")).isEmpty();
  }

  @Test
  void sanitizerCollapsesRuns() {
    assertThat(FilenameSanitizer.sanitize("a  b//c--d__e")).isEqualTo("a_b_c-d_e");
    assertThat(FilenameSanitizer.sanitize("tax return 2024.final")).isEqualTo("tax_return_2024_final");
  }
}
