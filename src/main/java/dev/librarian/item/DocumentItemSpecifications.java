package dev.librarian.item;

import org.springframework.data.jpa.domain.Specification;

/** JPA criteria for {@link ItemFilter}. */
final class DocumentItemSpecifications {

  private DocumentItemSpecifications() {}

  static Specification<DocumentItem> matching(ItemFilter filter) {
    Specification<DocumentItem> spec = Specification.where(null);
    if (filter.status() != null) {
      ItemStatus status = filter.status();
      spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), status));
    }
    if (filter.workspaceId() != null && !filter.workspaceId().isBlank()) {
      String workspaceId = filter.workspaceId();
      spec = spec.and((root, query, cb) -> cb.equal(root.get("proposedWorkspace"), workspaceId));
    }
    if (filter.minConfidence() != null) {
      Integer minConfidence = filter.minConfidence();
      spec =
          spec.and(
              (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("confidence"), minConfidence));
    }
    if (filter.maxConfidence() != null) {
      Integer maxConfidence = filter.maxConfidence();
      spec =
          spec.and(
              (root, query, cb) -> cb.lessThanOrEqualTo(root.get("confidence"), maxConfidence));
    }
    return spec;
  }
}
