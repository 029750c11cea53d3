package dev.librarian.item;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a bulk operation. Unknown ids and ineligible items are skipped, never fatal.
 *
 * @param requested number of ids supplied
 * @param updated number of items actually changed
 * @param skipped ids that were not changed
 */
public record BulkTransitionResult(int requested, int updated, List<UUID> skipped) {

  public BulkTransitionResult {
    skipped = List.copyOf(skipped);
  }

  public static BulkTransitionResult none(int requested, List<UUID> skipped) {
    return new BulkTransitionResult(requested, 0, skipped);
  }
}
