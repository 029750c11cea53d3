package dev.librarian.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

@ExtendWith(MockitoExtension.class)
class AnythingLlmClientTest {

  private static final String SLUG = "librarian-core";

  @Mock private RestClient restClient;

  @Mock private RestClient.RequestBodyUriSpec requestBodyUriSpec;

  @Mock private RestClient.RequestBodySpec requestBodySpec;

  @Mock private RestClient.ResponseSpec responseSpec;

  private AnythingLlmClient client;

  @BeforeEach
  void setUp() {
    client = new AnythingLlmClient(restClient, SLUG);
  }

  private void stubRestClientChain() {
    when(restClient.post()).thenReturn(requestBodyUriSpec);
    when(requestBodyUriSpec.uri("/api/v1/workspace/{slug}/chat", SLUG))
        .thenReturn(requestBodySpec);
    when(requestBodySpec.body(any(AnythingLlmChatRequest.class))).thenReturn(requestBodySpec);
    when(requestBodySpec.retrieve()).thenReturn(responseSpec);
  }

  @Test
  void completeReturnsTextResponse() {
    stubRestClientChain();
    when(responseSpec.body(AnythingLlmChatResponse.class))
        .thenReturn(
            new AnythingLlmChatResponse("1", "textResponse", "{\"workspace\": \"x\"}", null));

    assertThat(client.complete("classify me")).isEqualTo("{\"workspace\": \"x\"}");
    verify(requestBodySpec).body(new AnythingLlmChatRequest("classify me", "chat"));
  }

  @Test
  void transportFailureBecomesLanguageModelException() {
    stubRestClientChain();
    when(responseSpec.body(AnythingLlmChatResponse.class))
        .thenThrow(new ResourceAccessException("Read timed out"));

    assertThatThrownBy(() -> client.complete("p"))
        .isInstanceOf(LanguageModelException.class)
        .hasMessageContaining(SLUG)
        .hasMessageContaining("Read timed out");
  }

  @Test
  void reportedErrorBecomesLanguageModelException() {
    stubRestClientChain();
    when(responseSpec.body(AnythingLlmChatResponse.class))
        .thenReturn(new AnythingLlmChatResponse("1", "abort", null, "No workspace found"));

    assertThatThrownBy(() -> client.complete("p"))
        .isInstanceOf(LanguageModelException.class)
        .hasMessageContaining("No workspace found");
  }

  @Test
  void emptyBodyBecomesLanguageModelException() {
    stubRestClientChain();
    when(responseSpec.body(AnythingLlmChatResponse.class)).thenReturn(null);

    assertThatThrownBy(() -> client.complete("p")).isInstanceOf(LanguageModelException.class);
  }

  @Test
  void missingTextResponseBecomesLanguageModelException() {
    stubRestClientChain();
    when(responseSpec.body(AnythingLlmChatResponse.class))
        .thenReturn(new AnythingLlmChatResponse("1", "textResponse", null, null));

    assertThatThrownBy(() -> client.complete("p"))
        .isInstanceOf(LanguageModelException.class)
        .hasMessageContaining("textResponse");
  }

  @Test
  void nameIncludesWorkspaceSlug() {
    assertThat(client.name()).isEqualTo("anything-llm:librarian-core");
  }
}
