package dev.librarian.item;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;

/** Spring Data repository for {@link DocumentItem} entities. */
public interface DocumentItemRepository
    extends JpaRepository<DocumentItem, UUID>, JpaSpecificationExecutor<DocumentItem> {

  /** Items in {@code status}, least confident first. */
  List<DocumentItem> findAllByStatusOrderByConfidenceAscOriginalFilenameAsc(ItemStatus status);

  /**
   * Item counts grouped by status.
   *
   * @return rows of {@code [ItemStatus, Long]}
   */
  @Query("SELECT d.status, COUNT(d) FROM DocumentItem d GROUP BY d.status")
  List<Object[]> countByStatus();

  /**
   * Item counts grouped by proposed workspace.
   *
   * @return rows of {@code [String, Long]}
   */
  @Query(
      "SELECT d.proposedWorkspace, COUNT(d) FROM DocumentItem d "
          + "GROUP BY d.proposedWorkspace ORDER BY d.proposedWorkspace")
  List<Object[]> countByWorkspace();

  /**
   * Average confidence across all items.
   *
   * @return the average, or null when there are no items
   */
  @Query("SELECT AVG(d.confidence) FROM DocumentItem d")
  Double averageConfidence();
}
