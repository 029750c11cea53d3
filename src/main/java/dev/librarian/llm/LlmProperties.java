package dev.librarian.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Language model settings bound from {@code librarian.llm.*}.
 *
 * @param provider {@code ollama} (local) or {@code anything-llm} (remote workspace)
 * @param timeoutMs upper bound of a single completion call
 * @param ollama local model settings
 * @param anythingLlm remote workspace settings
 */
@ConfigurationProperties(prefix = "librarian.llm")
public record LlmProperties(
    String provider, int timeoutMs, Ollama ollama, AnythingLlm anythingLlm) {

  public LlmProperties {
    provider = provider == null ? "ollama" : provider;
    timeoutMs = timeoutMs <= 0 ? 60_000 : timeoutMs;
    ollama = ollama == null ? new Ollama(null, null, 0.0) : ollama;
    anythingLlm = anythingLlm == null ? new AnythingLlm(null, null, null) : anythingLlm;
  }

  public record Ollama(String baseUrl, String modelName, double temperature) {
    public Ollama {
      baseUrl = baseUrl == null ? "http://localhost:11434" : baseUrl;
      modelName = modelName == null ? "llama3.1:8b" : modelName;
    }
  }

  public record AnythingLlm(String baseUrl, String apiKey, String workspaceSlug) {
    public AnythingLlm {
      baseUrl = baseUrl == null ? "http://localhost:3001" : baseUrl;
      workspaceSlug = workspaceSlug == null ? "librarian-core" : workspaceSlug;
    }
  }
}
