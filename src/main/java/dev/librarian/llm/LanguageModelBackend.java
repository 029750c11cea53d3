package dev.librarian.llm;

/**
 * Text-in, text-out access to a language model.
 *
 * <p>Implementations make a single bounded call: no retries, and a timeout is reported as a
 * {@link LanguageModelException} like any other failure. Replies are untrusted and are validated
 * by the caller.
 */
public interface LanguageModelBackend {

  /**
   * Sends {@code prompt} and returns the raw completion.
   *
   * @param prompt the full prompt
   * @return the model's reply text, never null
   * @throws LanguageModelException if the backend is unreachable, times out or returns nothing
   */
  String complete(String prompt);

  /** Short label for logs, e.g. {@code ollama:llama3.1:8b}. */
  String name();
}
