package dev.librarian.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MigrationReportWriterTest {

  @TempDir Path tempDir;

  private final MigrationReportWriter writer =
      new MigrationReportWriter(
          Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));

  @Test
  void writesTimestampedMarkdownFile() throws IOException {
    List<MigrationOutcome> outcomes =
        List.of(
            new MigrationOutcome(
                UUID.randomUUID(), "a.pdf", "/out/A/a.pdf", MigrationStatus.MIGRATED, null));

    Path report = writer.write(tempDir, outcomes);

    assertThat(report.getFileName().toString()).isEqualTo("migration_report_20260301_101530.md");
    assertThat(Files.readString(report))
        .startsWith("# Migration Report\n")
        .contains("Generated: 2026-03-01 10:15:30")
        .contains("| Original Filename | Destination | Status |")
        .contains("| a.pdf | /out/A/a.pdf | MIGRATED |");
  }

  @Test
  void failureRowCarriesErrorAndEscapesPipes() {
    String markdown =
        MigrationReportWriter.render(
            List.of(
                new MigrationOutcome(
                    UUID.randomUUID(),
                    "odd|name.pdf",
                    "/out/x.pdf",
                    MigrationStatus.DESTINATION_ERROR,
                    "destination exists with different content")),
            "now");

    assertThat(markdown)
        .contains("Migrated 0 of 1 approved items.")
        .contains(
            "| odd\\|name.pdf | /out/x.pdf | DESTINATION_ERROR: destination exists with different"
                + " content |");
  }
}
