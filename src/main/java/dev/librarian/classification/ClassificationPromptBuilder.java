package dev.librarian.classification;

import dev.librarian.taxonomy.TaxonomyRegistry;
import dev.librarian.taxonomy.Workspace;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Renders the classification prompt.
 *
 * <p>The prompt lists every workspace id with its description in taxonomy order, then the
 * document facts (filename, location, years, forms, heuristic hint) and finally the text excerpt
 * between triple quotes, followed by the required JSON reply shape.
 */
class ClassificationPromptBuilder {

  static final int MAX_FORMS_IN_PROMPT = 3;

  private final TaxonomyRegistry taxonomy;
  private final int excerptChars;

  ClassificationPromptBuilder(TaxonomyRegistry taxonomy, int excerptChars) {
    this.taxonomy = taxonomy;
    this.excerptChars = excerptChars;
  }

  String build(
      String text,
      String filename,
      DocumentMetadata metadata,
      PathHints pathHints,
      @Nullable HeuristicCandidate hint) {
    StringBuilder prompt = new StringBuilder();
    prompt
        .append("You are a document classifier for personal financial and legal documents.\n\n")
        .append("Classify this document into exactly ONE workspace from the taxonomy below.\n\n")
        .append("TAXONOMY (choose one):\n");
    for (Workspace workspace : taxonomy.all()) {
      prompt.append("- ").append(workspace.id()).append(": ").append(workspace.description());
      prompt.append('\n');
    }

    prompt.append("\nDOCUMENT INFO:\nFilename: ").append(filename);
    if (pathHints.hasContext()) {
      prompt.append("\nOriginal location: ").append(pathHints.context());
      if (!pathHints.years().isEmpty()) {
        prompt.append("\nYears in path: ").append(String.join(", ", pathHints.years()));
      }
    }
    if (!metadata.years().isEmpty()) {
      prompt.append("\nYears mentioned: ").append(String.join(", ", metadata.years()));
    }
    if (!metadata.formTypes().isEmpty()) {
      List<String> forms =
          metadata.formTypes().subList(0, Math.min(MAX_FORMS_IN_PROMPT, metadata.formTypes().size()));
      prompt.append("\nForms detected: ").append(String.join(", ", forms));
    }
    if (hint != null) {
      prompt
          .append("\n\nHeuristic hint: ")
          .append(hint.reason())
          .append(" suggests ")
          .append(hint.workspaceId());
    }

    prompt
        .append("\n\nDOCUMENT EXCERPT:\n\"\"\"\n")
        .append(excerpt(text))
        .append("\n\"\"\"\n\n")
        .append("Choose the MOST APPROPRIATE workspace based on the document content.\n")
        .append("Also provide:\n")
        .append("1. An optional subfolder path inside the workspace (e.g. \"Federal/2024\"),")
        .append(" or an empty string\n")
        .append("2. A one-sentence description of the document\n")
        .append("3. A confidence score from 0 (none) to 5 (very high)\n")
        .append("4. A brief descriptive name without prefix\n\n")
        .append("Respond with ONLY this JSON object and no other text:\n")
        .append("{\n")
        .append("  \"workspace\": \"KB.Domain.Scope\",\n")
        .append("  \"subpath\": \"optional/subfolder/path\",\n")
        .append("  \"description\": \"Brief description\",\n")
        .append("  \"confidence\": 4,\n")
        .append("  \"suggested_name\": \"brief descriptive name\"\n")
        .append("}");
    return prompt.toString();
  }

  private String excerpt(String text) {
    if (text == null) {
      return "";
    }
    return text.length() > excerptChars ? text.substring(0, excerptChars) : text;
  }
}
