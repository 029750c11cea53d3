package dev.librarian.taxonomy;

/** Thrown when the taxonomy definition cannot be read or fails validation. */
public class TaxonomyLoadException extends RuntimeException {

  public TaxonomyLoadException(String message) {
    super(message);
  }

  public TaxonomyLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
