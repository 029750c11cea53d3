package dev.librarian.session;

import dev.librarian.item.BulkTransitionResult;
import dev.librarian.item.ItemLifecycleService;
import dev.librarian.item.ItemStatus;
import dev.librarian.item.ReviewAction;
import java.util.Collection;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;

/** Applies a {@link ReviewAction} to a set of items of the current session. */
@Service
public class ReviewService {

  private final ItemLifecycleService lifecycleService;
  private final ScanSessionService sessionService;

  public ReviewService(ItemLifecycleService lifecycleService, ScanSessionService sessionService) {
    this.lifecycleService = lifecycleService;
    this.sessionService = sessionService;
  }

  /**
   * @param workspaceId target workspace, required for {@link ReviewAction#SET_WORKSPACE}
   * @throws IllegalArgumentException if no ids are given or a required workspace is missing
   * @throws IllegalStateException for {@link ReviewAction#REJECT_AND_MOVE} without a scan session
   */
  public BulkTransitionResult apply(
      ReviewAction action, Collection<UUID> ids, @Nullable String workspaceId) {
    if (ids == null || ids.isEmpty()) {
      throw new IllegalArgumentException("No items specified");
    }
    return switch (action) {
      case APPROVE -> lifecycleService.bulkTransition(ids, ItemStatus.APPROVED);
      case IGNORE -> lifecycleService.bulkTransition(ids, ItemStatus.IGNORED);
      case REJECT -> lifecycleService.bulkTransition(ids, ItemStatus.REJECTED);
      case RESET -> lifecycleService.bulkTransition(ids, ItemStatus.PENDING);
      case SET_WORKSPACE -> {
        if (workspaceId == null || workspaceId.isBlank()) {
          throw new IllegalArgumentException("Workspace is required for set_workspace");
        }
        yield lifecycleService.bulkReassignWorkspace(ids, workspaceId.strip());
      }
      case REJECT_AND_MOVE -> {
        ScanSession session =
            sessionService
                .current()
                .orElseThrow(
                    () -> new IllegalStateException("No directory scanned, nothing to move"));
        yield lifecycleService.rejectAndMove(ids, session.inputRoot());
      }
    };
  }
}
