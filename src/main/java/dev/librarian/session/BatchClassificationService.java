package dev.librarian.session;

import dev.librarian.classification.ClassificationEngine;
import dev.librarian.classification.ClassificationRequest;
import dev.librarian.classification.ClassificationResult;
import dev.librarian.files.FileHasher;
import dev.librarian.item.DocumentItem;
import dev.librarian.item.ItemLifecycleService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Classifies every file of the current scan session in the background.
 *
 * <p>Files are handled one at a time in scan order. Each file becomes one pending item, stored as
 * soon as it is classified, so an abandoned run leaves valid items behind. A file that cannot be
 * read or stored counts as a failure and the run moves on.
 */
@Service
public class BatchClassificationService {

  private static final Logger log = LoggerFactory.getLogger(BatchClassificationService.class);

  private final ScanSessionService sessionService;
  private final ClassificationEngine engine;
  private final ContentExtractor contentExtractor;
  private final ItemLifecycleService lifecycleService;
  private final FileHasher fileHasher;
  private final ClassificationProgressTracker progressTracker;
  private final Executor executor;

  public BatchClassificationService(
      ScanSessionService sessionService,
      ClassificationEngine engine,
      ContentExtractor contentExtractor,
      ItemLifecycleService lifecycleService,
      FileHasher fileHasher,
      ClassificationProgressTracker progressTracker,
      @Qualifier("classificationExecutor") Executor executor) {
    this.sessionService = sessionService;
    this.engine = engine;
    this.contentExtractor = contentExtractor;
    this.lifecycleService = lifecycleService;
    this.fileHasher = fileHasher;
    this.progressTracker = progressTracker;
    this.executor = executor;
  }

  /**
   * Starts classifying the current session's files.
   *
   * @return progress right after the start
   * @throws IllegalStateException if nothing was scanned or a run is already in progress
   */
  public ClassificationProgress start() {
    ScanSession session =
        sessionService
            .current()
            .orElseThrow(() -> new IllegalStateException("No directory scanned, scan first"));
    OptionalLong runId = progressTracker.tryStart(session.fileCount());
    if (runId.isEmpty()) {
      throw new IllegalStateException("Classification already in progress");
    }
    try {
      executor.execute(() -> run(session, runId.getAsLong()));
    } catch (RejectedExecutionException e) {
      progressTracker.fail(runId.getAsLong());
      throw new IllegalStateException("Classification could not be scheduled", e);
    }
    log.info("Classification of {} files started", session.fileCount());
    return progressTracker.current();
  }

  public ClassificationProgress progress() {
    return progressTracker.current();
  }

  /** Works through the session's files for as long as run {@code runId} stays current. */
  void run(ScanSession session, long runId) {
    try {
      for (Path file : session.files()) {
        if (!progressTracker.isActive(runId)) {
          log.info("Classification run abandoned");
          return;
        }
        if (classifyOne(file, runId)) {
          progressTracker.recordProcessed(runId);
        } else {
          progressTracker.recordFailure(runId);
        }
      }
      progressTracker.complete(runId);
      ClassificationProgress done = progressTracker.current();
      log.info(
          "Classification finished: {} processed, {} failed", done.processed(), done.failed());
    } catch (RuntimeException e) {
      log.error("Classification run failed", e);
      progressTracker.fail(runId);
    }
  }

  private boolean classifyOne(Path file, long runId) {
    String filename = file.getFileName().toString();
    try {
      String text = contentExtractor.extract(file);
      ClassificationResult result =
          engine.classify(new ClassificationRequest(file.toString(), filename, text));

      DocumentItem item =
          new DocumentItem(
              file.toString(),
              filename,
              result.workspaceId(),
              result.subpath(),
              result.filename(),
              result.confidence(),
              result.description());
      item.setExtractedText(text);
      item.setFileSize(Files.size(file));
      item.setFileExtension(extensionOf(filename));
      item.setContentHash(fileHasher.hash(file));
      if (!progressTracker.isActive(runId)) {
        // session was cleared while this file was classified
        return false;
      }
      lifecycleService.create(item);
      log.debug(
          "Classified {} -> {} ({}/5)", filename, result.workspaceId(), result.confidence());
      return true;
    } catch (IOException | RuntimeException e) {
      log.warn("Could not classify {}: {}", file, e.getMessage());
      return false;
    }
  }

  /** Extension including the dot, as it appears in the original filename. */
  static String extensionOf(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(dot) : "";
  }
}
