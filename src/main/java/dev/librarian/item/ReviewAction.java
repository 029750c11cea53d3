package dev.librarian.item;

import java.util.Locale;
import java.util.Optional;

/** Bulk review actions offered to reviewers. */
public enum ReviewAction {
  APPROVE("approve"),
  IGNORE("ignore"),
  REJECT("reject"),
  /** Rejects and moves the files out of the scan root. */
  REJECT_AND_MOVE("reject_and_move"),
  /** Sends approved items back to review. */
  RESET("reset"),
  /** Reassigns the proposed workspace; requires a workspace id. */
  SET_WORKSPACE("set_workspace");

  private final String value;

  ReviewAction(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static Optional<ReviewAction> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.strip().toLowerCase(Locale.ROOT).replace('-', '_');
    for (ReviewAction action : values()) {
      if (action.value.equals(normalized)) {
        return Optional.of(action);
      }
    }
    return Optional.empty();
  }
}
