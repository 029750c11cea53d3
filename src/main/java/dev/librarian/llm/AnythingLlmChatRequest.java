package dev.librarian.llm;

/** Request body of the AnythingLLM workspace chat endpoint. */
public record AnythingLlmChatRequest(String message, String mode) {}
