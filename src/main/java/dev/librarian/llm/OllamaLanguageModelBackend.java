package dev.librarian.llm;

import dev.langchain4j.model.chat.ChatModel;

/**
 * Local model backend: a LangChain4j {@link ChatModel} talking to an Ollama server.
 *
 * <p>The request timeout is configured on the chat model itself (see {@link LlmConfig}).
 */
public class OllamaLanguageModelBackend implements LanguageModelBackend {

  private final ChatModel chatModel;
  private final String modelName;

  public OllamaLanguageModelBackend(ChatModel chatModel, String modelName) {
    this.chatModel = chatModel;
    this.modelName = modelName;
  }

  @Override
  public String complete(String prompt) {
    String reply;
    try {
      reply = chatModel.chat(prompt);
    } catch (RuntimeException e) {
      throw new LanguageModelException(
          "Ollama model " + modelName + " failed: " + e.getMessage(), e);
    }
    if (reply == null) {
      throw new LanguageModelException("Ollama model " + modelName + " returned no text");
    }
    return reply;
  }

  @Override
  public String name() {
    return "ollama:" + modelName;
  }
}
