package dev.librarian.item;

import org.jspecify.annotations.Nullable;

/**
 * Optional criteria for listing items. Null fields do not constrain the result.
 *
 * @param status only items in this status
 * @param workspaceId only items proposed for this workspace
 * @param minConfidence only items at or above this confidence
 * @param maxConfidence only items at or below this confidence
 */
public record ItemFilter(
    @Nullable ItemStatus status,
    @Nullable String workspaceId,
    @Nullable Integer minConfidence,
    @Nullable Integer maxConfidence) {

  public static ItemFilter all() {
    return new ItemFilter(null, null, null, null);
  }

  public static ItemFilter byStatus(ItemStatus status) {
    return new ItemFilter(status, null, null, null);
  }
}
