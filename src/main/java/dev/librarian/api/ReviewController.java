package dev.librarian.api;

import dev.librarian.item.BulkTransitionResult;
import dev.librarian.item.DocumentItem;
import dev.librarian.item.ItemFilter;
import dev.librarian.item.ItemLifecycleService;
import dev.librarian.item.ItemStatistics;
import dev.librarian.item.ItemStatus;
import dev.librarian.item.ItemUpdate;
import dev.librarian.item.LifecycleResult;
import dev.librarian.item.ReviewAction;
import dev.librarian.migration.MigrationReport;
import dev.librarian.migration.MigrationService;
import dev.librarian.session.BatchClassificationService;
import dev.librarian.session.ClassificationProgress;
import dev.librarian.session.PathPreferences;
import dev.librarian.session.ReviewService;
import dev.librarian.session.ScanSession;
import dev.librarian.session.ScanSessionService;
import dev.librarian.taxonomy.TaxonomyRegistry;
import dev.librarian.taxonomy.Workspace;
import jakarta.validation.Valid;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter for the review UI: scan, classify, review, migrate.
 *
 * <p>Bad input is reported by the services as {@link IllegalArgumentException} (400) and wrong
 * session state as {@link IllegalStateException} (409), see {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class ReviewController {

  private static final int SCAN_LISTING_LIMIT = 100;
  private static final int PREVIEW_CHARS = 1000;

  private final ScanSessionService sessionService;
  private final BatchClassificationService batchService;
  private final ItemLifecycleService lifecycleService;
  private final ReviewService reviewService;
  private final MigrationService migrationService;
  private final TaxonomyRegistry taxonomy;

  public ReviewController(
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

  @PostMapping("/scan")
  public ScanResponse scan(@Valid @RequestBody ScanRequest request) {
    ScanSession session = sessionService.scan(request.inputPath(), request.outputPath());
    List<ScanResponse.FileEntry> files =
        session.files().stream()
            .limit(SCAN_LISTING_LIMIT)
            .map(f -> new ScanResponse.FileEntry(f.toString(), f.getFileName().toString()))
            .toList();
    return new ScanResponse(
        session.inputRoot().toString(),
        session.outputRoot().toString(),
        session.fileCount(),
        files);
  }

  @PostMapping("/classify")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public ClassificationProgress classify() {
    return batchService.start();
  }

  @GetMapping("/classify/status")
  public ClassificationProgress classificationStatus() {
    return batchService.progress();
  }

  @GetMapping("/items")
  public ItemPageResponse items(
      @RequestParam(required = false) String status,
      @RequestParam(required = false) String workspace,
      @RequestParam(required = false) Integer minConfidence,
      @RequestParam(required = false) Integer maxConfidence,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "100") int size) {
    ItemStatus statusFilter = null;
    if (status != null && !status.isBlank()) {
      statusFilter =
          ItemStatus.fromValue(status)
              .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + status));
    }
    Page<DocumentItem> result =
        lifecycleService.list(
            new ItemFilter(statusFilter, workspace, minConfidence, maxConfidence), page, size);
    return new ItemPageResponse(
        result.map(ItemResponse::from).getContent(),
        result.getNumber(),
        result.getSize(),
        result.getTotalElements(),
        result.getTotalPages());
  }

  @GetMapping("/items/{id}")
  public ResponseEntity<ItemResponse> item(@PathVariable UUID id) {
    return ResponseEntity.of(lifecycleService.get(id).map(ItemResponse::from));
  }

  @PatchMapping("/items/{id}")
  public ResponseEntity<?> updateItem(
      @PathVariable UUID id, @RequestBody ItemUpdateRequest request) {
    ItemStatus target = null;
    if (request.status() != null) {
      target =
          ItemStatus.fromValue(request.status())
              .orElseThrow(
                  () -> new IllegalArgumentException("Unknown status: " + request.status()));
    }
    LifecycleResult result =
        lifecycleService.updateFields(
            id,
            new ItemUpdate(
                request.proposedWorkspace(),
                request.proposedSubpath(),
                request.proposedFilename(),
                target));
    return switch (result.outcome()) {
      case UPDATED -> ResponseEntity.ok(ItemResponse.from(result.item()));
      case NOT_FOUND -> ResponseEntity.notFound().build();
      case NOT_ELIGIBLE ->
          ResponseEntity.status(HttpStatus.CONFLICT)
              .body(ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, result.message()));
    };
  }

  @PostMapping("/items/bulk-action")
  public BulkTransitionResult bulkAction(@Valid @RequestBody BulkActionRequest request) {
    ReviewAction action =
        ReviewAction.fromValue(request.action())
            .orElseThrow(() -> new IllegalArgumentException("Invalid action: " + request.action()));
    return reviewService.apply(action, request.itemIds(), request.workspace());
  }

  @PostMapping("/migrate")
  public MigrationReport migrate(@RequestBody(required = false) MigrateRequest request) {
    Path output;
    if (request != null && request.outputPath() != null && !request.outputPath().isBlank()) {
      output = Path.of(request.outputPath().strip());
    } else {
      output =
          sessionService
              .current()
              .map(ScanSession::outputRoot)
              .orElseThrow(() -> new IllegalArgumentException("No output path specified"));
    }
    return migrationService.migrate(output);
  }

  @GetMapping("/taxonomy")
  public List<Workspace> taxonomy() {
    return taxonomy.all();
  }

  @GetMapping("/statistics")
  public ItemStatistics statistics() {
    return lifecycleService.statistics();
  }

  @GetMapping("/preview/{id}")
  public ResponseEntity<PreviewResponse> preview(@PathVariable UUID id) {
    return ResponseEntity.of(lifecycleService.get(id).map(ReviewController::toPreview));
  }

  @DeleteMapping("/session")
  public Map<String, Object> clearSession() {
    long deleted = sessionService.clear();
    return Map.of("message", "Session cleared", "deleted", deleted);
  }

  @GetMapping("/config/paths")
  public PathPreferences lastPaths() {
    return sessionService.lastPaths();
  }

  @PostMapping("/config/paths")
  public Map<String, Object> savePaths(@RequestBody SavePathsRequest request) {
    boolean saved = sessionService.rememberPaths(request.inputPath(), request.outputPath());
    return Map.of("success", saved, "message", saved ? "Paths saved" : "Failed to save paths");
  }

  private static PreviewResponse toPreview(DocumentItem item) {
    String text = item.getExtractedText() == null ? "" : item.getExtractedText();
    return new PreviewResponse(
        item.getId(),
        item.getFileExtension(),
        text.length() > PREVIEW_CHARS ? text.substring(0, PREVIEW_CHARS) : text,
        text.length() > PREVIEW_CHARS);
  }
}
