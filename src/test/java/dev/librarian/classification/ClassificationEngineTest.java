package dev.librarian.classification;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.librarian.fixture.Taxonomies;
import dev.librarian.llm.LanguageModelBackend;
import dev.librarian.llm.LanguageModelException;
import dev.librarian.taxonomy.TaxonomyRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClassificationEngineTest {

  private final TaxonomyRegistry taxonomy = Taxonomies.standard();

  private ClassificationEngine engine(LanguageModelBackend backend) {
    return new ClassificationEngine(
        new PathHintExtractor(),
        new MetadataExtractor(),
        new HeuristicMatcher(HeuristicRules.defaults()),
        new LlmClassifier(backend, taxonomy, new ObjectMapper(), 4000),
        new FilenameGenerator(),
        taxonomy);
  }

  @Test
  void agreementWithPathConfirmedHeuristicReachesFullConfidence() {
    StubBackend backend =
        new StubBackend(
            "{\"workspace\": \"KB.Finance.Taxes\", \"subpath\": \"Federal\", "
                + "\"description\": \"2024 federal return\", \"confidence\": 3, "
                + "\"suggested_name\": \"federal return\"}");

    ClassificationResult result =
        engine(backend)
            .classify(
                new ClassificationRequest(
                    "/docs/Taxes/2023/return.pdf", "return.pdf", "Form 1040 for 2024"));

    assertThat(result.workspaceId()).isEqualTo("KB.Finance.Taxes");
    assertThat(result.subpath()).isEqualTo("Federal");
    assertThat(result.confidence()).isEqualTo(5);
    assertThat(result.filename()).isEqualTo("TAX-2024-federal");
    assertThat(result.description()).isEqualTo("2024 federal return");
    assertThat(backend.prompts.get(0))
        .contains("Years in path: 2023")
        .contains("Years mentioned: 2023, 2024")
        .contains("Heuristic hint: Tax form detected (path confirms) suggests KB.Finance.Taxes");
  }

  @Test
  void pathYearNamesDocumentWhenTextHasNone() {
    StubBackend backend =
        new StubBackend(
            "{\"workspace\": \"KB.Finance.Taxes\", \"confidence\": 4, "
                + "\"suggested_name\": \"state return\"}");

    ClassificationResult result =
        engine(backend)
            .classify(new ClassificationRequest("/docs/2021/scan.pdf", "scan.pdf", ""));

    assertThat(result.filename()).isEqualTo("TAX-2021-state");
  }

  @Test
  void backendFailureWithoutHeuristicGoesToMisc() {
    LanguageModelBackend failing =
        new LanguageModelBackend() {
          @Override
          public String complete(String prompt) {
            throw new LanguageModelException("connection refused");
          }

          @Override
          public String name() {
            return "failing";
          }
        };

    ClassificationResult result =
        engine(failing).classify(new ClassificationRequest("/q/q.txt", "q.txt", "xyz"));

    assertThat(result.workspaceId()).isEqualTo("KB.Personal.Misc");
    assertThat(result.confidence()).isEqualTo(1);
    assertThat(result.description()).isEqualTo("Classification failed");
    assertThat(result.filename()).isEqualTo("MISC-Unknown");
  }

  @Test
  void unparseableReplyUsesHeuristicCandidate() {
    ClassificationResult result =
        engine(new StubBackend("sorry, I cannot help"))
            .classify(new ClassificationRequest("/in/scan1.pdf", "scan1.pdf", "Warranty deed"));

    assertThat(result.workspaceId()).isEqualTo("KB.Assets.RealEstate");
    assertThat(result.confidence()).isEqualTo(3);
    assertThat(result.description()).isEqualTo("Real estate document detected");
  }

  private static final class StubBackend implements LanguageModelBackend {

    private final String reply;
    private final List<String> prompts = new ArrayList<>();

    StubBackend(String reply) {
      this.reply = reply;
    }

    @Override
    public String complete(String prompt) {
      prompts.add(prompt);
      return reply;
    }

    @Override
    public String name() {
      return "stub";
    }
  }
}
