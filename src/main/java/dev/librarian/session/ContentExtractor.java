package dev.librarian.session;

import java.nio.file.Path;

/** Turns a file into plain text for classification. */
public interface ContentExtractor {

  /**
   * Text content of {@code file}.
   *
   * @return the text, or an empty string when the file has no extractable text or cannot be read
   */
  String extract(Path file);
}
