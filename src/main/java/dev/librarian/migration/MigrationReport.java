package dev.librarian.migration;

import java.nio.file.Path;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Summary of one migration batch.
 *
 * @param migratedCount items that reached {@code MIGRATED}
 * @param outcomes one entry per approved item considered, in processing order
 * @param reportPath the written Markdown report, null if nothing was considered or the report
 *     could not be written
 */
public record MigrationReport(
    int migratedCount, List<MigrationOutcome> outcomes, @Nullable Path reportPath) {

  public MigrationReport {
    outcomes = List.copyOf(outcomes);
  }

  public int failedCount() {
    return outcomes.size() - migratedCount;
  }

  static MigrationReport empty() {
    return new MigrationReport(0, List.of(), null);
  }
}
