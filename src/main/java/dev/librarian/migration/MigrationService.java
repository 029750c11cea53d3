package dev.librarian.migration;

import dev.librarian.files.FileHasher;
import dev.librarian.files.FileTransfer;
import dev.librarian.item.DocumentItem;
import dev.librarian.item.ItemLifecycleService;
import dev.librarian.item.LifecycleResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Copies every approved item into the organized tree under an output root.
 *
 * <p>Destination: {@code <outputRoot>/<workspace>[/<subpath>]/<filename><extension>}. Files are
 * copied, never moved, with their attributes. A failure is recorded against its item only and the
 * batch continues; failed items stay approved so a later run can retry them. A destination that
 * already holds identical content counts as migrated.
 */
@Service
public class MigrationService {

  private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

  private final ItemLifecycleService lifecycleService;
  private final FileTransfer fileTransfer;
  private final FileHasher fileHasher;
  private final MigrationReportWriter reportWriter;

  public MigrationService(
      ItemLifecycleService lifecycleService,
      FileTransfer fileTransfer,
      FileHasher fileHasher,
      MigrationReportWriter reportWriter) {
    this.lifecycleService = lifecycleService;
    this.fileTransfer = fileTransfer;
    this.fileHasher = fileHasher;
    this.reportWriter = reportWriter;
  }

  /**
   * Migrates all approved items.
   *
   * @param outputRoot root of the organized tree, created if absent
   * @return counts, per-item outcomes and the written report
   */
  public MigrationReport migrate(Path outputRoot) {
    if (outputRoot == null) {
      throw new IllegalArgumentException("Output path must not be empty");
    }
    Path root = outputRoot.toAbsolutePath().normalize();
    List<DocumentItem> approved = lifecycleService.listApproved();
    if (approved.isEmpty()) {
      log.info("No approved items to migrate");
      return MigrationReport.empty();
    }

    log.info("Migrating {} approved items to {}", approved.size(), root);
    List<MigrationOutcome> outcomes = new ArrayList<>(approved.size());
    int migrated = 0;
    for (DocumentItem item : approved) {
      MigrationOutcome outcome = migrateOne(item, root);
      outcomes.add(outcome);
      if (outcome.succeeded()) {
        migrated++;
      } else {
        log.warn(
            "Migration of {} failed ({}): {}",
            item.getOriginalFilename(),
            outcome.status(),
            outcome.error());
      }
    }

    Path reportPath = writeReport(root, outcomes);
    log.info(
        "Migration finished: {} migrated, {} failed, report {}",
        migrated,
        outcomes.size() - migrated,
        reportPath);
    return new MigrationReport(migrated, outcomes, reportPath);
  }

  /** Destination of {@code item} under {@code outputRoot}. */
  static Path destinationOf(DocumentItem item, Path outputRoot) {
    Path directory = outputRoot.resolve(item.getProposedWorkspace());
    String subpath = item.getProposedSubpath();
    if (subpath != null && !subpath.isBlank()) {
      directory = directory.resolve(subpath.strip());
    }
    String extension = item.getFileExtension() != null ? item.getFileExtension() : "";
    return directory.resolve(item.getProposedFilename() + extension).normalize();
  }

  private MigrationOutcome migrateOne(DocumentItem item, Path root) {
    Path destination;
    try {
      destination = destinationOf(item, root);
    } catch (RuntimeException e) {
      return failure(item, "(invalid)", MigrationStatus.DESTINATION_ERROR, e.getMessage());
    }
    if (!destination.startsWith(root) || destination.equals(root)) {
      return failure(
          item,
          destination.toString(),
          MigrationStatus.DESTINATION_ERROR,
          "destination escapes the output root");
    }

    Path source = Path.of(item.getSourcePath());
    if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
      return failure(
          item, destination.toString(), MigrationStatus.SOURCE_MISSING, "source file missing");
    }

    try {
      if (fileTransfer.exists(destination)) {
        if (!fileHasher.hash(source).equals(fileHasher.hash(destination))) {
          return failure(
              item,
              destination.toString(),
              MigrationStatus.DESTINATION_ERROR,
              "destination exists with different content");
        }
        log.debug("Identical file already at {}", destination);
      } else {
        fileTransfer.copy(source, destination);
      }
    } catch (NoSuchFileException e) {
      return failure(item, destination.toString(), MigrationStatus.SOURCE_MISSING, e.getMessage());
    } catch (IOException e) {
      return failure(
          item, destination.toString(), MigrationStatus.DESTINATION_ERROR, e.toString());
    }

    LifecycleResult result = lifecycleService.markMigrated(item.getId(), destination);
    if (!result.isUpdated()) {
      return failure(
          item, destination.toString(), MigrationStatus.DESTINATION_ERROR, result.message());
    }
    return new MigrationOutcome(
        item.getId(),
        item.getOriginalFilename(),
        destination.toString(),
        MigrationStatus.MIGRATED,
        null);
  }

  private @Nullable Path writeReport(Path root, List<MigrationOutcome> outcomes) {
    try {
      return reportWriter.write(root, outcomes);
    } catch (IOException e) {
      log.warn("Could not write migration report to {}: {}", root, e.getMessage());
      return null;
    }
  }

  private static MigrationOutcome failure(
      DocumentItem item, String destination, MigrationStatus status, @Nullable String error) {
    return new MigrationOutcome(
        item.getId(), item.getOriginalFilename(), destination, status, error);
  }
}
