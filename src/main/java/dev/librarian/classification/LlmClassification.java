package dev.librarian.classification;

/**
 * Workspace assignment produced by {@link LlmClassifier}, before a filename is generated.
 *
 * @param workspaceId a workspace known to the taxonomy
 * @param subpath optional folder inside the workspace, empty when none
 * @param description one-sentence description of the document
 * @param confidence 0..5, clamped on construction
 * @param suggestedName short descriptive name proposed by the model, empty when none
 */
public record LlmClassification(
    String workspaceId, String subpath, String description, int confidence, String suggestedName) {

  public LlmClassification {
    subpath = subpath == null ? "" : subpath;
    description = description == null ? "" : description;
    suggestedName = suggestedName == null ? "" : suggestedName;
    confidence = Confidence.clamp(confidence);
  }
}
