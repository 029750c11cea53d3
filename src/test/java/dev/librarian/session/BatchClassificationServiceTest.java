package dev.librarian.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.librarian.classification.ClassificationEngine;
import dev.librarian.classification.ClassificationResult;
import dev.librarian.files.FileHasher;
import dev.librarian.item.DocumentItem;
import dev.librarian.item.ItemLifecycleService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BatchClassificationServiceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

  private static final ClassificationResult TAX_RESULT =
      new ClassificationResult("KB.Finance.Taxes", "Federal", "TAX-2024-federal", 4, "1040");

  @Mock ScanSessionService sessionService;
  @Mock ClassificationEngine engine;
  @Mock ContentExtractor contentExtractor;
  @Mock ItemLifecycleService lifecycleService;

  @Captor ArgumentCaptor<DocumentItem> itemCaptor;

  @TempDir Path inbox;

  ClassificationProgressTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new ClassificationProgressTracker(CLOCK);
  }

  private BatchClassificationService service(Executor executor) {
    return new BatchClassificationService(
        sessionService,
        engine,
        contentExtractor,
        lifecycleService,
        new FileHasher(),
        tracker,
        executor);
  }

  private ScanSession session(Path... files) {
    ScanSession session =
        new ScanSession(
            inbox, inbox.resolveSibling("organized_folder"), List.of(files), CLOCK.instant());
    given(sessionService.current()).willReturn(Optional.of(session));
    return session;
  }

  @Test
  void createsOnePendingItemPerFile() throws IOException {
    Path file = Files.writeString(inbox.resolve("return.txt"), "Form 1040");
    session(file);
    given(contentExtractor.extract(file)).willReturn("Form 1040");
    given(engine.classify(any())).willReturn(TAX_RESULT);

    ClassificationProgress progress = service(Runnable::run).start();

    verify(lifecycleService).create(itemCaptor.capture());
    DocumentItem item = itemCaptor.getValue();
    assertThat(item.getSourcePath()).isEqualTo(file.toString());
    assertThat(item.getOriginalFilename()).isEqualTo("return.txt");
    assertThat(item.getProposedWorkspace()).isEqualTo("KB.Finance.Taxes");
    assertThat(item.getProposedFilename()).isEqualTo("TAX-2024-federal");
    assertThat(item.getConfidence()).isEqualTo(4);
    assertThat(item.getFileExtension()).isEqualTo(".txt");
    assertThat(item.getFileSize()).isEqualTo(9L);
    assertThat(item.getContentHash()).hasSize(64);
    assertThat(item.getExtractedText()).isEqualTo("Form 1040");
    assertThat(progress.status()).isEqualTo(ClassificationProgress.Status.COMPLETED);
    assertThat(progress.processed()).isEqualTo(1);
  }

  @Test
  void unreadableFileCountsAsFailureAndRunContinues() throws IOException {
    Path missing = inbox.resolve("gone.pdf");
    Path present = Files.writeString(inbox.resolve("deed.pdf"), "deed");
    session(missing, present);
    given(contentExtractor.extract(any())).willReturn("");
    given(engine.classify(any())).willReturn(TAX_RESULT);

    ClassificationProgress progress = service(Runnable::run).start();

    assertThat(progress.processed()).isEqualTo(1);
    assertThat(progress.failed()).isEqualTo(1);
    assertThat(progress.status()).isEqualTo(ClassificationProgress.Status.COMPLETED);
    verify(lifecycleService).create(argThat(i -> i.getOriginalFilename().equals("deed.pdf")));
  }

  @Test
  void resetAbandonsRunBeforeNextFile() throws IOException {
    Path first = Files.writeString(inbox.resolve("a.txt"), "a");
    Path second = Files.writeString(inbox.resolve("b.txt"), "b");
    session(first, second);
    given(contentExtractor.extract(any())).willReturn("");
    given(engine.classify(any()))
        .willAnswer(
            inv -> {
              tracker.reset();
              return TAX_RESULT;
            });

    service(Runnable::run).start();

    verify(engine, times(1)).classify(any());
    verify(lifecycleService, never()).create(any());
    assertThat(tracker.current()).isEqualTo(ClassificationProgress.idle());
  }

  @Test
  void runLeftOverFromClearedSessionDoesNotFeedNewRun() throws IOException {
    Path first = Files.writeString(inbox.resolve("a.txt"), "a");
    Path second = Files.writeString(inbox.resolve("b.txt"), "b");
    Path third = Files.writeString(inbox.resolve("c.txt"), "c");
    session(first, second, third);
    given(contentExtractor.extract(any())).willReturn("");
    given(engine.classify(any()))
        .willAnswer(
            inv -> {
              tracker.reset();
              tracker.tryStart(7);
              return TAX_RESULT;
            });

    service(Runnable::run).start();

    verify(engine, times(1)).classify(any());
    verify(lifecycleService, never()).create(any());
    ClassificationProgress newRun = tracker.current();
    assertThat(newRun.status()).isEqualTo(ClassificationProgress.Status.RUNNING);
    assertThat(newRun.handled()).isZero();
    assertThat(newRun.total()).isEqualTo(7);
  }

  @Test
  void startWithoutSessionFails() {
    given(sessionService.current()).willReturn(Optional.empty());

    assertThatThrownBy(() -> service(Runnable::run).start())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("scan first");
  }

  @Test
  void secondStartWhileRunningFails() {
    session();
    tracker.tryStart(1);

    assertThatThrownBy(() -> service(Runnable::run).start())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("already in progress");
    verifyNoInteractions(engine);
  }

  @Test
  void rejectedScheduleMarksRunFailed() {
    session();
    Executor rejecting =
        task -> {
          throw new RejectedExecutionException("full");
        };

    assertThatThrownBy(() -> service(rejecting).start()).isInstanceOf(IllegalStateException.class);
    assertThat(tracker.current().status()).isEqualTo(ClassificationProgress.Status.FAILED);
  }

  @Test
  void extensionKeepsDot() {
    assertThat(BatchClassificationService.extensionOf("W2_2023.PDF")).isEqualTo(".PDF");
    assertThat(BatchClassificationService.extensionOf("README")).isEmpty();
    assertThat(BatchClassificationService.extensionOf(".bashrc")).isEmpty();
  }
}
