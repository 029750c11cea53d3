package dev.librarian.taxonomy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class TaxonomyRegistryTest {

  private static final Workspace TAXES =
      new Workspace(
          "KB.Finance.Taxes",
          "Tax returns",
          new NamingTemplate("TAX", List.of("year", "doc_type"), "{prefix}-{year}-{doc_type}"));
  private static final Workspace MISC = new Workspace("KB.Personal.Misc", "Everything else", null);

  private final TaxonomyRegistry registry =
      new TaxonomyRegistry(List.of(TAXES, MISC), "KB.Personal.Misc");

  @Test
  void resolvesKnownWorkspace() {
    assertThat(registry.resolve("KB.Finance.Taxes")).contains(TAXES);
    assertThat(registry.contains("KB.Finance.Taxes")).isTrue();
  }

  @Test
  void unknownAndNullIdsAreAbsent() {
    assertThat(registry.resolve("KB.Bogus.Category")).isEmpty();
    assertThat(registry.resolve(null)).isEmpty();
    assertThat(registry.contains(null)).isFalse();
  }

  @Test
  void miscWorkspaceIsKnown() {
    assertThat(registry.misc()).isEqualTo(MISC);
    assertThat(registry.contains(registry.misc().id())).isTrue();
  }

  @Test
  void allIsUnmodifiable() {
    assertThatThrownBy(() -> registry.all().add(MISC))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void placeholdersAreListedInOrder() {
    assertThat(TAXES.naming().placeholders()).containsExactly("prefix", "year", "doc_type");
  }
}
