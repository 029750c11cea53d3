package dev.librarian.item;

import org.jspecify.annotations.Nullable;

/**
 * Partial edit of an item. Null fields are left unchanged.
 *
 * @param workspaceId new proposed workspace, must be known to the taxonomy
 * @param subpath new proposed subpath
 * @param filename new proposed filename
 * @param status target status, subject to the transition table
 */
public record ItemUpdate(
    @Nullable String workspaceId,
    @Nullable String subpath,
    @Nullable String filename,
    @Nullable ItemStatus status) {

  public boolean touchesProposal() {
    return workspaceId != null || subpath != null || filename != null;
  }

  public static ItemUpdate status(ItemStatus status) {
    return new ItemUpdate(null, null, null, status);
  }
}
