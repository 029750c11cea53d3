package dev.librarian.migration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Writes the Markdown migration report into the output root.
 *
 * <p>File name: {@code migration_report_<yyyyMMdd_HHmmss>.md}. One table row per considered
 * item.
 */
@Component
public class MigrationReportWriter {

  private static final DateTimeFormatter FILE_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
  private static final DateTimeFormatter HEADER_STAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final Clock clock;

  public MigrationReportWriter(Clock clock) {
    this.clock = clock;
  }

  /**
   * Writes the report and returns its path.
   *
   * @throws IOException if the file cannot be written
   */
  public Path write(Path outputRoot, List<MigrationOutcome> outcomes) throws IOException {
    ZonedDateTime now = clock.instant().atZone(clock.getZone());
    Path target = outputRoot.resolve("migration_report_" + FILE_STAMP.format(now) + ".md");
    Files.createDirectories(outputRoot);
    Files.writeString(target, render(outcomes, HEADER_STAMP.format(now)), StandardCharsets.UTF_8);
    return target;
  }

  static String render(List<MigrationOutcome> outcomes, String generatedAt) {
    long migrated = outcomes.stream().filter(MigrationOutcome::succeeded).count();
    StringBuilder sb = new StringBuilder();
    sb.append("# Migration Report\n\n");
    sb.append("Generated: ").append(generatedAt).append("\n\n");
    sb.append("Migrated ")
        .append(migrated)
        .append(" of ")
        .append(outcomes.size())
        .append(" approved items.\n\n");
    sb.append("| Original Filename | Destination | Status |\n");
    sb.append("|---|---|---|\n");
    for (MigrationOutcome outcome : outcomes) {
      sb.append("| ")
          .append(cell(outcome.originalFilename()))
          .append(" | ")
          .append(cell(outcome.destination()))
          .append(" | ")
          .append(outcome.status().name());
      if (outcome.error() != null) {
        sb.append(": ").append(cell(outcome.error()));
      }
      sb.append(" |\n");
    }
    return sb.toString();
  }

  private static String cell(String value) {
    return value.replace("|", "\\|").replace('\n', ' ');
  }
}
