package dev.librarian.classification;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.librarian.llm.LanguageModelBackend;
import dev.librarian.taxonomy.TaxonomyRegistry;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies a document with a language model and reconciles the answer with the heuristic hint.
 *
 * <p>Reconciliation of a parsed reply:
 *
 * <ol>
 *   <li>an unknown workspace is replaced by the Misc workspace and loses 2 confidence points
 *   <li>agreement with the heuristic candidate adds the candidate's boost
 *   <li>the result is truncated and clamped to [0, 5]
 * </ol>
 *
 * <p>When the reply cannot be parsed, or the backend fails, the heuristic candidate is returned
 * with confidence 3; without a candidate the document goes to Misc with confidence 1. This method
 * never throws.
 */
public class LlmClassifier {

  private static final Logger log = LoggerFactory.getLogger(LlmClassifier.class);

  static final int UNKNOWN_WORKSPACE_PENALTY = 2;
  static final int HEURISTIC_FALLBACK_CONFIDENCE = 3;
  static final int MISC_FALLBACK_CONFIDENCE = 1;
  static final String UNCERTAIN_DESCRIPTION = "Classification uncertain";
  static final String FAILED_DESCRIPTION = "Classification failed";

  private final LanguageModelBackend backend;
  private final TaxonomyRegistry taxonomy;
  private final ClassificationPromptBuilder promptBuilder;
  private final LlmReplyParser replyParser;

  public LlmClassifier(
      LanguageModelBackend backend,
      TaxonomyRegistry taxonomy,
      ObjectMapper objectMapper,
      int excerptChars) {
    this.backend = backend;
    this.taxonomy = taxonomy;
    this.promptBuilder = new ClassificationPromptBuilder(taxonomy, excerptChars);
    this.replyParser = new LlmReplyParser(objectMapper);
  }

  public LlmClassification classify(
      String text,
      String filename,
      DocumentMetadata metadata,
      PathHints pathHints,
      @Nullable HeuristicCandidate candidate) {
    String prompt;
    String reply;
    try {
      prompt =
          promptBuilder.build(
              text,
              filename,
              metadata == null ? DocumentMetadata.empty() : metadata,
              pathHints == null ? PathHints.empty() : pathHints,
              candidate);
      reply = backend.complete(prompt);
    } catch (RuntimeException e) {
      log.warn("Language model {} failed for {}: {}", backend.name(), filename, e.getMessage());
      return fallback(candidate, FAILED_DESCRIPTION);
    }

    Optional<LlmVerdict> verdict = replyParser.parse(reply);
    if (verdict.isEmpty()) {
      log.warn("Unparseable classification reply for {}", filename);
      return fallback(candidate, UNCERTAIN_DESCRIPTION);
    }
    return reconcile(verdict.get(), candidate, filename);
  }

  private LlmClassification reconcile(
      LlmVerdict verdict, @Nullable HeuristicCandidate candidate, String filename) {
    String workspace = verdict.workspace();
    double confidence = verdict.confidence();

    if (!taxonomy.contains(workspace)) {
      log.warn(
          "Model chose unknown workspace '{}' for {}, remapping to {}",
          workspace,
          filename,
          taxonomy.misc().id());
      workspace = taxonomy.misc().id();
      confidence = Math.max(0, confidence - UNKNOWN_WORKSPACE_PENALTY);
    }

    if (candidate != null && workspace.equals(candidate.workspaceId())) {
      confidence = Math.min(Confidence.MAX, confidence + candidate.confidenceBoost());
    }

    return new LlmClassification(
        workspace,
        verdict.subpath(),
        verdict.description(),
        Confidence.clamp(confidence),
        verdict.suggestedName());
  }

  private LlmClassification fallback(@Nullable HeuristicCandidate candidate, String description) {
    if (candidate != null && taxonomy.contains(candidate.workspaceId())) {
      return new LlmClassification(
          candidate.workspaceId(), "", candidate.reason(), HEURISTIC_FALLBACK_CONFIDENCE, "");
    }
    return new LlmClassification(
        taxonomy.misc().id(), "", description, MISC_FALLBACK_CONFIDENCE, "");
  }
}
