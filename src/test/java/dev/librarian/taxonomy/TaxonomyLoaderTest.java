package dev.librarian.taxonomy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class TaxonomyLoaderTest {

  private final TaxonomyLoader loader = new TaxonomyLoader();

  private TaxonomyRegistry load(String yaml) {
    return loader.load(
        new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yaml");
  }

  @Test
  void bundledTaxonomyLoads() throws Exception {
    try (InputStream in = getClass().getResourceAsStream("/taxonomy.yaml")) {
      TaxonomyRegistry registry = loader.load(in, "taxonomy.yaml");

      assertThat(registry.size()).isGreaterThanOrEqualTo(10);
      assertThat(registry.misc().id()).isEqualTo("KB.Personal.Misc");
      assertThat(registry.resolve("KB.Finance.Taxes"))
          .hasValueSatisfying(
              ws -> {
                assertThat(ws.naming().prefix()).isEqualTo("TAX");
                assertThat(ws.naming().components()).containsExactly("year", "doc_type");
                assertThat(ws.naming().format()).isEqualTo("{prefix}-{year}-{doc_type}");
              });
    }
  }

  @Test
  void workspaceWithoutNamingGetsDefaultTemplate() {
    TaxonomyRegistry registry =
        load(
            """
            workspaces:
              - id: KB.Personal.Misc
                description: Everything else
            """);

    assertThat(registry.misc().naming()).isEqualTo(NamingTemplate.DEFAULT);
  }

  @Test
  void declarationOrderIsPreserved() {
    TaxonomyRegistry registry =
        load(
            """
            workspaces:
              - id: KB.B
                description: second letter
              - id: KB.A
                description: first letter
              - id: KB.Personal.Misc
                description: Everything else
            """);

    assertThat(registry.all())
        .extracting(Workspace::id)
        .containsExactly("KB.B", "KB.A", "KB.Personal.Misc");
  }

  @Test
  void customMiscWorkspaceIsHonoured() {
    TaxonomyRegistry registry =
        load(
            """
            defaults:
              misc_workspace: KB.Inbox
            workspaces:
              - id: KB.Inbox
                description: Unsorted
            """);

    assertThat(registry.misc().id()).isEqualTo("KB.Inbox");
  }

  @Test
  void missingMiscWorkspaceFails() {
    assertThatThrownBy(
            () ->
                load(
                    """
                    workspaces:
                      - id: KB.Finance.Taxes
                        description: Taxes
                    """))
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessageContaining("KB.Personal.Misc");
  }

  @Test
  void duplicateIdsFail() {
    assertThatThrownBy(
            () ->
                load(
                    """
                    workspaces:
                      - id: KB.Personal.Misc
                        description: one
                      - id: KB.Personal.Misc
                        description: two
                    """))
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessageContaining("Duplicate");
  }

  @Test
  void formatReferencingUndeclaredComponentFails() {
    assertThatThrownBy(
            () ->
                load(
                    """
                    workspaces:
                      - id: KB.Personal.Misc
                        description: Everything else
                        naming:
                          prefix: MISC
                          components: [topic]
                          format: "{prefix}-{year}-{topic}"
                    """))
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessageContaining("{year}");
  }

  @Test
  void missingPrefixFails() {
    assertThatThrownBy(
            () ->
                load(
                    """
                    workspaces:
                      - id: KB.Personal.Misc
                        description: Everything else
                        naming:
                          components: [topic]
                          format: "{topic}"
                    """))
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessageContaining("prefix");
  }

  @Test
  void workspaceWithoutIdFails() {
    assertThatThrownBy(
            () ->
                load(
                    """
                    workspaces:
                      - description: nameless
                    """))
        .isInstanceOf(TaxonomyLoadException.class);
  }

  @Test
  void emptyDefinitionFails() {
    assertThatThrownBy(() -> load("workspaces: []\n"))
        .isInstanceOf(TaxonomyLoadException.class)
        .hasMessageContaining("no workspaces");
  }

  @Test
  void malformedYamlFails() {
    assertThatThrownBy(() -> load("workspaces: [ {id: \n"))
        .isInstanceOf(TaxonomyLoadException.class);
  }
}
