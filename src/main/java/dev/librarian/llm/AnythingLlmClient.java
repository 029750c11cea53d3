package dev.librarian.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Remote backend: chats with a hosted AnythingLLM workspace over its developer API.
 *
 * <p>Each prompt is one {@code POST /api/v1/workspace/{slug}/chat} call in {@code chat} mode, so
 * the workspace's embedded documents are available to the model as retrieval context.
 */
public class AnythingLlmClient implements LanguageModelBackend {

  private static final Logger log = LoggerFactory.getLogger(AnythingLlmClient.class);

  private final RestClient restClient;
  private final String workspaceSlug;

  public AnythingLlmClient(RestClient restClient, String workspaceSlug) {
    this.restClient = restClient;
    this.workspaceSlug = workspaceSlug;
  }

  @Override
  public String complete(String prompt) {
    AnythingLlmChatResponse response;
    try {
      response =
          restClient
              .post()
              .uri("/api/v1/workspace/{slug}/chat", workspaceSlug)
              .body(new AnythingLlmChatRequest(prompt, "chat"))
              .retrieve()
              .body(AnythingLlmChatResponse.class);
    } catch (RestClientException e) {
      log.debug("AnythingLLM call to workspace {} failed", workspaceSlug, e);
      throw new LanguageModelException(
          "AnythingLLM workspace " + workspaceSlug + " unavailable: " + e.getMessage(), e);
    }

    if (response == null) {
      throw new LanguageModelException("AnythingLLM returned an empty body");
    }
    if (response.error() != null && !response.error().isBlank()) {
      throw new LanguageModelException("AnythingLLM reported an error: " + response.error());
    }
    if (response.textResponse() == null) {
      throw new LanguageModelException("AnythingLLM reply has no textResponse");
    }
    return response.textResponse();
  }

  @Override
  public String name() {
    return "anything-llm:" + workspaceSlug;
  }
}
