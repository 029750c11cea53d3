package dev.librarian.api;

import dev.librarian.item.DocumentItem;
import java.time.Instant;
import java.util.UUID;

/** JSON view of a {@link DocumentItem}. Status uses its lowercase wire value. */
public record ItemResponse(
    UUID id,
    String sourcePath,
    String originalFilename,
    String proposedWorkspace,
    String proposedSubpath,
    String proposedFilename,
    int confidence,
    String description,
    String status,
    Long fileSize,
    String fileExtension,
    String migratedPath,
    Instant migratedAt,
    Instant createdAt) {

  static ItemResponse from(DocumentItem item) {
    return new ItemResponse(
        item.getId(),
        item.getSourcePath(),
        item.getOriginalFilename(),
        item.getProposedWorkspace(),
        item.getProposedSubpath(),
        item.getProposedFilename(),
        item.getConfidence(),
        item.getDescription(),
        item.getStatus().value(),
        item.getFileSize(),
        item.getFileExtension(),
        item.getMigratedPath(),
        item.getMigratedAt(),
        item.getCreatedAt());
  }
}
