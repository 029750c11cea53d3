package dev.librarian.item;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a single-item lifecycle operation.
 *
 * @param id the requested item id
 * @param outcome what happened
 * @param item the item after the operation, null when not found
 * @param message human readable reason when not updated
 */
public record LifecycleResult(
    UUID id, Outcome outcome, @Nullable DocumentItem item, @Nullable String message) {

  public enum Outcome {
    UPDATED,
    NOT_FOUND,
    NOT_ELIGIBLE
  }

  static LifecycleResult updated(DocumentItem item) {
    return new LifecycleResult(item.getId(), Outcome.UPDATED, item, null);
  }

  static LifecycleResult notFound(UUID id) {
    return new LifecycleResult(id, Outcome.NOT_FOUND, null, "Item not found: " + id);
  }

  static LifecycleResult notEligible(DocumentItem item, String message) {
    return new LifecycleResult(item.getId(), Outcome.NOT_ELIGIBLE, item, message);
  }

  public boolean isUpdated() {
    return outcome == Outcome.UPDATED;
  }
}
