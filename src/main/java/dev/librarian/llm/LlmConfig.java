package dev.librarian.llm;

import dev.langchain4j.model.ollama.OllamaChatModel;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Chooses the {@link LanguageModelBackend} from {@code librarian.llm.provider}.
 *
 * <p>Both backends share {@code librarian.llm.timeout-ms} as their single-call bound.
 */
@Configuration
public class LlmConfig {

  private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

  @Bean
  @ConditionalOnProperty(
      prefix = "librarian.llm",
      name = "provider",
      havingValue = "ollama",
      matchIfMissing = true)
  public LanguageModelBackend ollamaBackend(LlmProperties properties) {
    LlmProperties.Ollama ollama = properties.ollama();
    OllamaChatModel chatModel =
        OllamaChatModel.builder()
            .baseUrl(ollama.baseUrl())
            .modelName(ollama.modelName())
            .temperature(ollama.temperature())
            .timeout(Duration.ofMillis(properties.timeoutMs()))
            .build();
    log.info("Using local Ollama model {} at {}", ollama.modelName(), ollama.baseUrl());
    return new OllamaLanguageModelBackend(chatModel, ollama.modelName());
  }

  @Bean
  @ConditionalOnProperty(prefix = "librarian.llm", name = "provider", havingValue = "anything-llm")
  public LanguageModelBackend anythingLlmBackend(
      RestClient.Builder builder, LlmProperties properties) {
    LlmProperties.AnythingLlm remote = properties.anythingLlm();
    if (remote.apiKey() == null || remote.apiKey().isBlank()) {
      throw new IllegalStateException(
          "librarian.llm.anything-llm.api-key is required when provider is anything-llm");
    }

    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(Math.min(properties.timeoutMs(), 10_000)));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.timeoutMs()));

    RestClient restClient =
        builder
            .baseUrl(remote.baseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + remote.apiKey())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
    log.info("Using AnythingLLM workspace {} at {}", remote.workspaceSlug(), remote.baseUrl());
    return new AnythingLlmClient(restClient, remote.workspaceSlug());
  }
}
