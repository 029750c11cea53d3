package dev.librarian.llm;

/** Failure to obtain a completion from a {@link LanguageModelBackend}. */
public class LanguageModelException extends RuntimeException {

  public LanguageModelException(String message) {
    super(message);
  }

  public LanguageModelException(String message, Throwable cause) {
    super(message, cause);
  }
}
