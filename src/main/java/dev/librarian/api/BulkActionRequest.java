package dev.librarian.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.UUID;

public record BulkActionRequest(
    @NotEmpty List<UUID> itemIds, @NotBlank String action, String workspace) {}
