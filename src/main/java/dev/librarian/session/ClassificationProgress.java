package dev.librarian.session;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Immutable snapshot of the batch classification run.
 *
 * <p>Advisory only: callers poll it to display progress, nothing synchronizes on it.
 *
 * @param status current run status
 * @param processed files turned into items
 * @param failed files that could not be classified or stored
 * @param total files in the batch
 * @param startedAt when the run started, null while idle
 * @param finishedAt when the run ended, null while idle or running
 */
public record ClassificationProgress(
    Status status,
    int processed,
    int failed,
    int total,
    @Nullable Instant startedAt,
    @Nullable Instant finishedAt) {

  public enum Status {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
  }

  public static ClassificationProgress idle() {
    return new ClassificationProgress(Status.IDLE, 0, 0, 0, null, null);
  }

  public boolean isRunning() {
    return status == Status.RUNNING;
  }

  /** Files handled so far, successful or not. */
  public int handled() {
    return processed + failed;
  }

  /** Percentage of files handled, 100 for an empty or completed batch. */
  public int percent() {
    if (status == Status.IDLE) {
      return 0;
    }
    if (status == Status.COMPLETED || total == 0) {
      return 100;
    }
    return (int) Math.min(100, (handled() * 100L) / total);
  }
}
