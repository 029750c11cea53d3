package dev.librarian.mcp;

import dev.librarian.item.BulkTransitionResult;
import dev.librarian.item.DocumentItem;
import dev.librarian.item.ItemFilter;
import dev.librarian.item.ItemLifecycleService;
import dev.librarian.item.ItemStatistics;
import dev.librarian.item.ItemStatus;
import dev.librarian.item.ItemUpdate;
import dev.librarian.item.LifecycleResult;
import dev.librarian.item.ReviewAction;
import dev.librarian.migration.MigrationOutcome;
import dev.librarian.migration.MigrationReport;
import dev.librarian.migration.MigrationService;
import dev.librarian.session.BatchClassificationService;
import dev.librarian.session.ClassificationProgress;
import dev.librarian.session.ReviewService;
import dev.librarian.session.ScanSession;
import dev.librarian.session.ScanSessionService;
import dev.librarian.taxonomy.TaxonomyRegistry;
import dev.librarian.taxonomy.Workspace;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the review workflow as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Workflow: {@code scan_directory}, {@code start_classification}, {@code
 * classification_status}, {@code list_items} / {@code preview_item}, {@code review_items} / {@code
 * update_item}, {@code migrate_approved}. Supporting tools: {@code list_workspaces}, {@code
 * review_statistics}, {@code clear_session}.
 */
@Service
public class McpToolService {

  static final int DEFAULT_PAGE_SIZE = 50;
  private static final int PREVIEW_CHARS = 1000;

  private final ScanSessionService sessionService;
  private final BatchClassificationService batchService;
  private final ItemLifecycleService lifecycleService;
  private final ReviewService reviewService;
  private final MigrationService migrationService;
  private final TaxonomyRegistry taxonomy;

  public McpToolService(
      ScanSessionService sessionService,
      BatchClassificationService batchService,
      ItemLifecycleService lifecycleService,
      ReviewService reviewService,
      MigrationService migrationService,
      TaxonomyRegistry taxonomy) {
    this.sessionService = sessionService;
    this.batchService = batchService;
    this.lifecycleService = lifecycleService;
    this.reviewService = reviewService;
    this.migrationService = migrationService;
    this.taxonomy = taxonomy;
  }

  @Tool(
      name = "scan_directory",
      description =
          "Scan a directory of documents to organize. Clears the previous review session. "
              + "The output directory defaults to 'organized_folder' next to the input directory.")
  public String scanDirectory(
      @ToolParam(description = "Absolute path of the directory to organize") @Nullable
          String inputPath,
      @ToolParam(description = "Root of the organized tree", required = false) @Nullable
          String outputPath) {
    try {
      if (inputPath == null || inputPath.isBlank()) {
        return "Error: Input path must not be empty. Provide a directory path.";
      }
      ScanSession session = sessionService.scan(inputPath, outputPath);
      StringBuilder sb = new StringBuilder();
      sb.append(String.format("Scanned %s: %d files%n", session.inputRoot(), session.fileCount()));
      sb.append(String.format("Output: %s%n", session.outputRoot()));
      session.files().stream()
          .limit(20)
          .forEach(f -> sb.append(String.format("  - %s%n", session.inputRoot().relativize(f))));
      if (session.fileCount() > 20) {
        sb.append(String.format("  ... and %d more%n", session.fileCount() - 20));
      }
      sb.append("Run start_classification to classify them.");
      return sb.toString();
    } catch (Exception e) {
      return "Error scanning directory: " + e.getMessage();
    }
  }

  @Tool(
      name = "start_classification",
      description =
          "Classify every scanned file in the background. Poll classification_status for progress.")
  public String startClassification() {
    try {
      ClassificationProgress progress = batchService.start();
      return "Classification started for %d files. Check progress with classification_status."
          .formatted(progress.total());
    } catch (Exception e) {
      return "Error starting classification: " + e.getMessage();
    }
  }

  @Tool(name = "classification_status", description = "Progress of the classification run.")
  public String classificationStatus() {
    try {
      ClassificationProgress p = batchService.progress();
      if (p.status() == ClassificationProgress.Status.IDLE) {
        return "No classification has run in this session.";
      }
      return "Status: %s%nProgress: %d/%d files (%d%%), %d failed"
          .formatted(p.status(), p.handled(), p.total(), p.percent(), p.failed());
    } catch (Exception e) {
      return "Error checking classification status: " + e.getMessage();
    }
  }

  @Tool(
      name = "list_items",
      description =
          "List classified items, least confident first. Filter by status "
              + "(pending, approved, ignored, rejected, migrated), workspace and confidence range.")
  public String listItems(
      @ToolParam(description = "Status filter", required = false) @Nullable String status,
      @ToolParam(description = "Workspace id filter", required = false) @Nullable
          String workspace,
      @ToolParam(description = "Only items at or above this confidence (0-5)", required = false)
          @Nullable Integer minConfidence,
      @ToolParam(description = "Only items at or below this confidence (0-5)", required = false)
          @Nullable Integer maxConfidence,
      @ToolParam(description = "Zero-based page (default 0)", required = false) @Nullable
          Integer page,
      @ToolParam(description = "Page size (default 50)", required = false) @Nullable
          Integer size) {
    try {
      ItemStatus statusFilter = null;
      if (status != null && !status.isBlank()) {
        Optional<ItemStatus> parsed = ItemStatus.fromValue(status);
        if (parsed.isEmpty()) {
          return "Error: Unknown status '%s'.".formatted(status);
        }
        statusFilter = parsed.get();
      }
      Page<DocumentItem> items =
          lifecycleService.list(
              new ItemFilter(statusFilter, workspace, minConfidence, maxConfidence),
              page != null ? page : 0,
              size != null ? size : DEFAULT_PAGE_SIZE);
      if (items.isEmpty()) {
        return "No items found.";
      }
      StringBuilder sb = new StringBuilder();
      for (DocumentItem item : items) {
        sb.append(formatItem(item));
      }
      sb.append(
          String.format(
              "Page %d of %d (%d items)",
              items.getNumber() + 1, items.getTotalPages(), items.getTotalElements()));
      return sb.toString();
    } catch (Exception e) {
      return "Error listing items: " + e.getMessage();
    }
  }

  @Tool(name = "preview_item", description = "Show the stored text excerpt of an item.")
  public String previewItem(@ToolParam(description = "Item id") String itemId) {
    try {
      UUID id = parseUuid(itemId);
      Optional<DocumentItem> found = lifecycleService.get(id);
      if (found.isEmpty()) {
        return "Error: Item %s not found.".formatted(itemId);
      }
      DocumentItem item = found.get();
      String text = item.getExtractedText() == null ? "" : item.getExtractedText();
      if (text.isBlank()) {
        return "No text extracted from %s.".formatted(item.getOriginalFilename());
      }
      return "%s:%n%s"
          .formatted(
              item.getOriginalFilename(),
              text.length() > PREVIEW_CHARS ? text.substring(0, PREVIEW_CHARS) : text);
    } catch (IllegalArgumentException e) {
      return "Error: Invalid item ID format. Provide a valid UUID.";
    } catch (Exception e) {
      return "Error previewing item: " + e.getMessage();
    }
  }

  @Tool(
      name = "review_items",
      description =
          "Apply a review action to items: approve, ignore, reject, reject_and_move "
              + "(moves the files to a _Rejected folder next to the scanned directory), "
              + "reset (back to pending) or set_workspace.")
  public String reviewItems(
      @ToolParam(description = "Comma-separated item ids") @Nullable String itemIds,
      @ToolParam(description = "Action to apply") @Nullable String action,
      @ToolParam(description = "Workspace id for set_workspace", required = false) @Nullable
          String workspace) {
    try {
      Optional<ReviewAction> parsed = ReviewAction.fromValue(action);
      if (parsed.isEmpty()) {
        return ("Error: Unknown action '%s'. Use approve, ignore, reject, reject_and_move, "
                + "reset or set_workspace.")
            .formatted(action);
      }
      List<UUID> ids = parseUuids(itemIds);
      BulkTransitionResult result = reviewService.apply(parsed.get(), ids, workspace);
      return "%s: %d of %d items updated%s"
          .formatted(
              parsed.get().value(),
              result.updated(),
              result.requested(),
              result.skipped().isEmpty() ? "." : ", skipped: " + result.skipped());
    } catch (Exception e) {
      return "Error reviewing items: " + e.getMessage();
    }
  }

  @Tool(
      name = "update_item",
      description =
          "Edit an item's proposed workspace, subpath or filename, or change its status.")
  public String updateItem(
      @ToolParam(description = "Item id") String itemId,
      @ToolParam(description = "New workspace id", required = false) @Nullable String workspace,
      @ToolParam(description = "New subpath inside the workspace", required = false) @Nullable
          String subpath,
      @ToolParam(description = "New filename without extension", required = false) @Nullable
          String filename,
      @ToolParam(description = "New status", required = false) @Nullable String status) {
    UUID id;
    try {
      id = parseUuid(itemId);
    } catch (IllegalArgumentException e) {
      return "Error: Invalid item ID format. Provide a valid UUID.";
    }
    try {
      ItemStatus target = null;
      if (status != null && !status.isBlank()) {
        Optional<ItemStatus> parsed = ItemStatus.fromValue(status);
        if (parsed.isEmpty()) {
          return "Error: Unknown status '%s'.".formatted(status);
        }
        target = parsed.get();
      }
      LifecycleResult result =
          lifecycleService.updateFields(id, new ItemUpdate(workspace, subpath, filename, target));
      return switch (result.outcome()) {
        case UPDATED -> "Updated:%n%s".formatted(formatItem(result.item()));
        case NOT_FOUND -> "Error: Item %s not found.".formatted(itemId);
        case NOT_ELIGIBLE -> "Error: " + result.message();
      };
    } catch (Exception e) {
      return "Error updating item: " + e.getMessage();
    }
  }

  @Tool(
      name = "migrate_approved",
      description =
          "Copy every approved file into the organized tree and write a migration report. "
              + "Uses the session output directory unless one is given.")
  public String migrateApproved(
      @ToolParam(description = "Root of the organized tree", required = false) @Nullable
          String outputPath) {
    try {
      Path output;
      if (outputPath != null && !outputPath.isBlank()) {
        output = Path.of(outputPath.strip());
      } else {
        Optional<ScanSession> session = sessionService.current();
        if (session.isEmpty()) {
          return "Error: No output path specified and no directory scanned.";
        }
        output = session.get().outputRoot();
      }
      MigrationReport report = migrationService.migrate(output);
      if (report.outcomes().isEmpty()) {
        return "No approved items to migrate.";
      }
      StringBuilder sb = new StringBuilder();
      sb.append(
          String.format(
              "Migrated %d of %d approved items.%n",
              report.migratedCount(), report.outcomes().size()));
      for (MigrationOutcome outcome : report.outcomes()) {
        if (!outcome.succeeded()) {
          sb.append(
              String.format(
                  "  - %s: %s (%s)%n",
                  outcome.originalFilename(), outcome.status(), outcome.error()));
        }
      }
      sb.append("Report: ").append(report.reportPath() != null ? report.reportPath() : "not written");
      return sb.toString();
    } catch (Exception e) {
      return "Error migrating files: " + e.getMessage();
    }
  }

  @Tool(name = "list_workspaces", description = "List the workspaces files can be filed into.")
  public String listWorkspaces() {
    try {
      StringBuilder sb = new StringBuilder();
      for (Workspace workspace : taxonomy.all()) {
        sb.append(
            String.format(
                "- %s: %s (name: %s)%n",
                workspace.id(), workspace.description(), workspace.naming().format()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error listing workspaces: " + e.getMessage();
    }
  }

  @Tool(
      name = "review_statistics",
      description = "Counts of items per status and per workspace, and average confidence.")
  public String reviewStatistics() {
    try {
      ItemStatistics stats = lifecycleService.statistics();
      StringBuilder sb = new StringBuilder();
      sb.append(String.format("Review Statistics:%n- Total items: %d%n", stats.total()));
      for (Map.Entry<ItemStatus, Long> entry : stats.byStatus().entrySet()) {
        sb.append(String.format("- %s: %d%n", entry.getKey().value(), entry.getValue()));
      }
      sb.append(
          String.format(Locale.ROOT, "- Average confidence: %.1f%n", stats.averageConfidence()));
      if (!stats.byWorkspace().isEmpty()) {
        sb.append(String.format("By workspace:%n"));
        stats.byWorkspace()
            .forEach((ws, count) -> sb.append(String.format("  - %s: %d%n", ws, count)));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error retrieving statistics: " + e.getMessage();
    }
  }

  @Tool(
      name = "clear_session",
      description = "Forget the scanned directory and delete all items. Files are not touched.")
  public String clearSession() {
    try {
      long deleted = sessionService.clear();
      return "Session cleared (%d items deleted).".formatted(deleted);
    } catch (Exception e) {
      return "Error clearing session: " + e.getMessage();
    }
  }

  private static String formatItem(DocumentItem item) {
    String subpath =
        item.getProposedSubpath() == null || item.getProposedSubpath().isBlank()
            ? ""
            : "/" + item.getProposedSubpath();
    return String.format(
        "- [%s] %s -> %s%s/%s%s | %s | confidence %d/5 | %s%n",
        item.getId(),
        item.getOriginalFilename(),
        item.getProposedWorkspace(),
        subpath,
        item.getProposedFilename(),
        item.getFileExtension() != null ? item.getFileExtension() : "",
        item.getStatus().value(),
        item.getConfidence(),
        item.getDescription());
  }

  private static UUID parseUuid(@Nullable String value) {
    if (value == null) {
      throw new IllegalArgumentException("Item id must not be empty");
    }
    return UUID.fromString(value.strip());
  }

  private static List<UUID> parseUuids(@Nullable String values) {
    if (values == null || values.isBlank()) {
      throw new IllegalArgumentException("No items specified");
    }
    List<UUID> ids = new ArrayList<>();
    for (String part : values.split(",")) {
      if (!part.isBlank()) {
        try {
          ids.add(UUID.fromString(part.strip()));
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Invalid item id '" + part.strip() + "'", e);
        }
      }
    }
    return ids;
  }
}
