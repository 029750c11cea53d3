package dev.librarian.classification;

import dev.librarian.taxonomy.TaxonomyRegistry;
import dev.librarian.taxonomy.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes path hints, metadata, heuristics, the model and the naming template into one {@link
 * ClassificationResult} per file.
 *
 * <p>Years found in the path are merged into the content metadata before naming. Every step is
 * total, so {@link #classify} always yields a result in a known workspace.
 */
public class ClassificationEngine {

  private static final Logger log = LoggerFactory.getLogger(ClassificationEngine.class);

  private final PathHintExtractor pathHintExtractor;
  private final MetadataExtractor metadataExtractor;
  private final HeuristicMatcher heuristicMatcher;
  private final LlmClassifier llmClassifier;
  private final FilenameGenerator filenameGenerator;
  private final TaxonomyRegistry taxonomy;

  public ClassificationEngine(
      PathHintExtractor pathHintExtractor,
      MetadataExtractor metadataExtractor,
      HeuristicMatcher heuristicMatcher,
      LlmClassifier llmClassifier,
      FilenameGenerator filenameGenerator,
      TaxonomyRegistry taxonomy) {
    this.pathHintExtractor = pathHintExtractor;
    this.metadataExtractor = metadataExtractor;
    this.heuristicMatcher = heuristicMatcher;
    this.llmClassifier = llmClassifier;
    this.filenameGenerator = filenameGenerator;
    this.taxonomy = taxonomy;
  }

  public ClassificationResult classify(ClassificationRequest request) {
    String filename = request.originalFilename();
    String text = request.extractedText();

    PathHints pathHints = pathHintExtractor.extract(request.sourcePath(), filename);
    HeuristicCandidate candidate = heuristicMatcher.match(text, filename, pathHints).orElse(null);
    DocumentMetadata metadata =
        metadataExtractor.extract(text).withAdditionalYears(pathHints.years());

    LlmClassification assignment =
        llmClassifier.classify(text, filename, metadata, pathHints, candidate);

    Workspace workspace = taxonomy.resolve(assignment.workspaceId()).orElse(taxonomy.misc());
    String proposedName =
        filenameGenerator.generate(workspace, metadata, filename, assignment.suggestedName());

    log.debug(
        "Classified {} -> {}/{} as {} ({}/5)",
        filename,
        workspace.id(),
        assignment.subpath(),
        proposedName,
        assignment.confidence());
    return new ClassificationResult(
        workspace.id(),
        assignment.subpath(),
        proposedName,
        assignment.confidence(),
        assignment.description());
  }
}
