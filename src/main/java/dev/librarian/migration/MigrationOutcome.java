package dev.librarian.migration;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * One row of the migration report.
 *
 * @param itemId the migrated item
 * @param originalFilename name of the source file
 * @param destination computed destination path
 * @param status what happened
 * @param error failure detail, null on success
 */
public record MigrationOutcome(
    UUID itemId,
    String originalFilename,
    String destination,
    MigrationStatus status,
    @Nullable String error) {

  public boolean succeeded() {
    return status == MigrationStatus.MIGRATED;
  }
}
