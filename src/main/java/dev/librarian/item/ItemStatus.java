package dev.librarian.item;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Review lifecycle of a {@link DocumentItem}.
 *
 * <p>Normal flow: {@code PENDING → APPROVED → MIGRATED}. A pending item may instead be ignored or
 * rejected; an approved item may go back to pending, or be ignored or rejected before migration.
 * {@code MIGRATED}, {@code IGNORED} and {@code REJECTED} are terminal. {@code MIGRATED} is only
 * reachable from {@code APPROVED}.
 */
public enum ItemStatus {
  /** Proposal created by classification, awaiting review. */
  PENDING,
  /** Accepted by the reviewer, eligible for migration. */
  APPROVED,
  /** Reviewer chose to leave the file where it is. */
  IGNORED,
  /** Reviewer rejected the proposal; the file may have been moved out of the scan root. */
  REJECTED,
  /** Copied into the organized tree. */
  MIGRATED;

  /** Statuses this one may move to. */
  public Set<ItemStatus> allowedTargets() {
    return switch (this) {
      case PENDING -> EnumSet.of(APPROVED, IGNORED, REJECTED);
      case APPROVED -> EnumSet.of(MIGRATED, PENDING, IGNORED, REJECTED);
      case IGNORED, REJECTED, MIGRATED -> EnumSet.noneOf(ItemStatus.class);
    };
  }

  public boolean canTransitionTo(ItemStatus target) {
    return target != null && allowedTargets().contains(target);
  }

  /** Whether the proposed workspace, subpath and filename may still be edited. */
  public boolean isProposalMutable() {
    return this == PENDING || this == APPROVED;
  }

  public boolean isTerminal() {
    return allowedTargets().isEmpty();
  }

  /** Lowercase wire value, e.g. {@code "approved"}. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire value case-insensitively.
   *
   * @param value e.g. {@code "approved"}
   * @return the status, or empty if {@code value} names none
   */
  public static Optional<ItemStatus> fromValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (ItemStatus status : values()) {
      if (status.name().equals(normalized)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
