package dev.librarian.api;

import java.util.UUID;

public record PreviewResponse(UUID id, String type, String preview, boolean fullTextAvailable) {}
