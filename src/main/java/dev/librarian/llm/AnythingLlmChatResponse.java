package dev.librarian.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** Subset of the AnythingLLM chat reply used by the classifier. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnythingLlmChatResponse(
    @Nullable String id,
    @Nullable String type,
    @Nullable String textResponse,
    @Nullable String error) {}
