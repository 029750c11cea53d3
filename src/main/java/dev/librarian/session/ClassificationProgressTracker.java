package dev.librarian.session;

import java.time.Clock;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/**
 * Thread-safe holder of the current {@link ClassificationProgress}.
 *
 * <p>Each update atomically replaces the snapshot with a new immutable record. Every started run
 * gets its own id and updates carry it, so a worker left over from a reset run can never touch a
 * newer one. Progress is in-memory only and lost on restart; the items themselves are stored as
 * they are produced.
 */
@Component
public class ClassificationProgressTracker {

  private static final long NO_RUN = 0L;

  private record Run(long id, ClassificationProgress progress) {}

  private final AtomicReference<Run> current =
      new AtomicReference<>(new Run(NO_RUN, ClassificationProgress.idle()));
  private final AtomicLong runIds = new AtomicLong();
  private final Clock clock;

  public ClassificationProgressTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Starts a run unless one is already running.
   *
   * @param total number of files in the batch
   * @return the id of the started run, empty if another run is in progress
   */
  public OptionalLong tryStart(int total) {
    Run running =
        new Run(
            runIds.incrementAndGet(),
            new ClassificationProgress(
                ClassificationProgress.Status.RUNNING, 0, 0, total, clock.instant(), null));
    while (true) {
      Run previous = current.get();
      if (previous.progress().isRunning()) {
        return OptionalLong.empty();
      }
      if (current.compareAndSet(previous, running)) {
        return OptionalLong.of(running.id());
      }
    }
  }

  /** True while run {@code runId} is the current run and still running. */
  public boolean isActive(long runId) {
    Run run = current.get();
    return run.id() == runId && run.progress().isRunning();
  }

  public void recordProcessed(long runId) {
    update(
        runId,
        p ->
            new ClassificationProgress(
                p.status(), p.processed() + 1, p.failed(), p.total(), p.startedAt(), null));
  }

  public void recordFailure(long runId) {
    update(
        runId,
        p ->
            new ClassificationProgress(
                p.status(), p.processed(), p.failed() + 1, p.total(), p.startedAt(), null));
  }

  public void complete(long runId) {
    finish(runId, ClassificationProgress.Status.COMPLETED);
  }

  public void fail(long runId) {
    finish(runId, ClassificationProgress.Status.FAILED);
  }

  /** Drops the current run. A run still in flight stops before its next file. */
  public void reset() {
    current.set(new Run(NO_RUN, ClassificationProgress.idle()));
  }

  public ClassificationProgress current() {
    return current.get().progress();
  }

  private void finish(long runId, ClassificationProgress.Status status) {
    update(
        runId,
        p ->
            new ClassificationProgress(
                status, p.processed(), p.failed(), p.total(), p.startedAt(), clock.instant()));
  }

  private void update(long runId, UnaryOperator<ClassificationProgress> change) {
    current.updateAndGet(
        run ->
            run.id() == runId && run.progress().isRunning()
                ? new Run(runId, change.apply(run.progress()))
                : run);
  }
}
