package dev.librarian.classification;

/**
 * Final proposal for one file: where it goes and what it is called.
 *
 * @param workspaceId always a workspace known to the taxonomy
 * @param subpath optional folder inside the workspace
 * @param filename generated filename without extension, already sanitized
 * @param confidence 0..5, clamped on construction
 * @param description one-sentence description
 */
public record ClassificationResult(
    String workspaceId, String subpath, String filename, int confidence, String description) {

  public ClassificationResult {
    if (workspaceId == null || workspaceId.isBlank()) {
      throw new IllegalArgumentException("workspaceId must not be blank");
    }
    subpath = subpath == null ? "" : subpath;
    filename = filename == null ? "" : filename;
    description = description == null ? "" : description;
    confidence = Confidence.clamp(confidence);
  }
}
