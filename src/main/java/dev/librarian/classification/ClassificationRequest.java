package dev.librarian.classification;

/**
 * Input of a single classification.
 *
 * @param sourcePath full path of the file as scanned
 * @param originalFilename the file's name
 * @param extractedText best-effort plain text, empty when nothing could be extracted
 */
public record ClassificationRequest(String sourcePath, String originalFilename, String extractedText) {

  public ClassificationRequest {
    sourcePath = sourcePath == null ? "" : sourcePath;
    originalFilename = originalFilename == null ? "" : originalFilename;
    extractedText = extractedText == null ? "" : extractedText;
  }
}
