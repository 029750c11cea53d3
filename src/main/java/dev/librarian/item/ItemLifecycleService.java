package dev.librarian.item;

import dev.librarian.classification.ClassificationProperties;
import dev.librarian.files.FileTransfer;
import dev.librarian.taxonomy.TaxonomyRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns every state change of a {@link DocumentItem}.
 *
 * <p>Operations never throw for unknown ids or illegal transitions; they report the outcome
 * through {@link LifecycleResult} or {@link BulkTransitionResult}. {@link ItemStatus#MIGRATED} can
 * only be reached through {@link #markMigrated}, which the migration flow calls after a
 * successful copy.
 */
@Service
public class ItemLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(ItemLifecycleService.class);

  /** Folder created next to the scan root that receives rejected files. */
  public static final String REJECTED_FOLDER = "_Rejected";

  static final int MAX_PAGE_SIZE = 500;

  private static final Sort LISTING_ORDER =
      Sort.by(Sort.Order.asc("confidence"), Sort.Order.asc("originalFilename"));

  private final DocumentItemRepository repository;
  private final TaxonomyRegistry taxonomy;
  private final FileTransfer fileTransfer;
  private final ClassificationProperties classificationProperties;
  private final Clock clock;

  public ItemLifecycleService(
      DocumentItemRepository repository,
      TaxonomyRegistry taxonomy,
      FileTransfer fileTransfer,
      ClassificationProperties classificationProperties,
      Clock clock) {
    this.repository = repository;
    this.taxonomy = taxonomy;
    this.fileTransfer = fileTransfer;
    this.classificationProperties = classificationProperties;
    this.clock = clock;
  }

  /**
   * Stores a new proposal. Whatever status the item carries, it is stored as {@code PENDING}.
   *
   * @return the stored item with its id assigned
   */
  @Transactional
  public DocumentItem create(DocumentItem item) {
    item.prepareForCreate(classificationProperties.getStoredTextChars());
    return repository.save(item);
  }

  @Transactional(readOnly = true)
  public Optional<DocumentItem> get(UUID id) {
    return repository.findById(id);
  }

  /**
   * Lists items matching {@code filter}, least confident first.
   *
   * @param page zero-based page index
   * @param size page size, capped at {@value #MAX_PAGE_SIZE}
   */
  @Transactional(readOnly = true)
  public Page<DocumentItem> list(ItemFilter filter, int page, int size) {
    if (page < 0) {
      throw new IllegalArgumentException("page must be >= 0, got: " + page);
    }
    if (size < 1) {
      throw new IllegalArgumentException("size must be >= 1, got: " + size);
    }
    PageRequest pageRequest = PageRequest.of(page, Math.min(size, MAX_PAGE_SIZE), LISTING_ORDER);
    return repository.findAll(DocumentItemSpecifications.matching(filter), pageRequest);
  }

  /** Approved items in migration order. */
  @Transactional(readOnly = true)
  public List<DocumentItem> listApproved() {
    return repository.findAllByStatusOrderByConfidenceAscOriginalFilenameAsc(ItemStatus.APPROVED);
  }

  /**
   * Applies a partial edit. Proposal fields may only change while the item is pending or
   * approved, and a new workspace must be known to the taxonomy. A status in the update is
   * applied through the transition table; {@code MIGRATED} is never accepted here. Nothing is
   * changed unless the whole update is valid.
   */
  @Transactional
  public LifecycleResult updateFields(UUID id, ItemUpdate update) {
    Optional<DocumentItem> found = repository.findById(id);
    if (found.isEmpty()) {
      return LifecycleResult.notFound(id);
    }
    DocumentItem item = found.get();

    if (update.touchesProposal() && !item.getStatus().isProposalMutable()) {
      return LifecycleResult.notEligible(
          item, "Proposal of a " + item.getStatus().value() + " item cannot be edited");
    }
    if (update.workspaceId() != null && !taxonomy.contains(update.workspaceId())) {
      return LifecycleResult.notEligible(item, "Unknown workspace: " + update.workspaceId());
    }
    if (update.filename() != null && update.filename().isBlank()) {
      return LifecycleResult.notEligible(item, "Filename must not be blank");
    }
    ItemStatus target = update.status();
    boolean statusChange = target != null && target != item.getStatus();
    if (statusChange && (target == ItemStatus.MIGRATED || !item.getStatus().canTransitionTo(target))) {
      return LifecycleResult.notEligible(
          item, "Cannot move from " + item.getStatus().value() + " to " + target.value());
    }

    if (update.workspaceId() != null) {
      item.setProposedWorkspace(update.workspaceId());
    }
    if (update.subpath() != null) {
      item.setProposedSubpath(update.subpath().strip());
    }
    if (update.filename() != null) {
      item.setProposedFilename(update.filename().strip());
    }
    if (statusChange) {
      item.transitionTo(target);
    }
    return LifecycleResult.updated(repository.save(item));
  }

  /**
   * Moves every listed item to {@code target}. Unknown ids, items already in {@code target} and
   * items whose transition is not allowed are skipped.
   *
   * @return how many items actually changed
   */
  @Transactional
  public BulkTransitionResult bulkTransition(Collection<UUID> ids, ItemStatus target) {
    List<UUID> requested = distinct(ids);
    if (target == ItemStatus.MIGRATED) {
      return BulkTransitionResult.none(requested.size(), requested);
    }
    List<UUID> skipped = new ArrayList<>();
    int updated = 0;
    for (UUID id : requested) {
      Optional<DocumentItem> found = repository.findById(id);
      if (found.isPresent() && found.get().transitionTo(target)) {
        repository.save(found.get());
        updated++;
      } else {
        skipped.add(id);
      }
    }
    log.info("Bulk transition to {}: {} of {} updated", target.value(), updated, requested.size());
    return new BulkTransitionResult(requested.size(), updated, skipped);
  }

  /**
   * Reassigns the proposed workspace of every listed pending or approved item. An unknown
   * workspace updates nothing.
   */
  @Transactional
  public BulkTransitionResult bulkReassignWorkspace(Collection<UUID> ids, String workspaceId) {
    List<UUID> requested = distinct(ids);
    if (workspaceId == null || !taxonomy.contains(workspaceId)) {
      log.warn("Bulk reassignment to unknown workspace '{}' ignored", workspaceId);
      return BulkTransitionResult.none(requested.size(), requested);
    }
    List<UUID> skipped = new ArrayList<>();
    int updated = 0;
    for (UUID id : requested) {
      Optional<DocumentItem> found = repository.findById(id);
      if (found.isPresent() && found.get().getStatus().isProposalMutable()) {
        DocumentItem item = found.get();
        item.setProposedWorkspace(workspaceId);
        repository.save(item);
        updated++;
      } else {
        skipped.add(id);
      }
    }
    return new BulkTransitionResult(requested.size(), updated, skipped);
  }

  /**
   * Rejects the listed items and moves their files to {@value #REJECTED_FOLDER} next to the
   * scan root, keeping the path relative to the scan root. The item's source path follows the
   * file. An item whose file cannot be moved keeps its status and path.
   *
   * @param scanRoot directory the items were scanned from
   */
  @Transactional
  public BulkTransitionResult rejectAndMove(Collection<UUID> ids, Path scanRoot) {
    List<UUID> requested = distinct(ids);
    Path root = scanRoot.toAbsolutePath().normalize();
    Path rejectedRoot =
        root.getParent() != null
            ? root.getParent().resolve(REJECTED_FOLDER)
            : root.resolve(REJECTED_FOLDER);

    List<UUID> skipped = new ArrayList<>();
    int updated = 0;
    for (UUID id : requested) {
      Optional<DocumentItem> found = repository.findById(id);
      if (found.isEmpty() || !canBeRejected(found.get())) {
        skipped.add(id);
        continue;
      }
      DocumentItem item = found.get();
      Path source = Path.of(item.getSourcePath()).toAbsolutePath().normalize();
      Path relative =
          source.startsWith(root) ? root.relativize(source) : source.getFileName();
      Path destination = fileTransfer.firstFreeName(rejectedRoot.resolve(relative));
      try {
        fileTransfer.move(source, destination);
      } catch (IOException e) {
        log.warn("Could not move rejected file {}: {}", source, e.getMessage());
        skipped.add(id);
        continue;
      }
      item.transitionTo(ItemStatus.REJECTED);
      item.relocateTo(destination.toString());
      repository.save(item);
      updated++;
      log.debug("Rejected {} moved to {}", item.getOriginalFilename(), destination);
    }
    log.info("Reject and move: {} of {} moved to {}", updated, requested.size(), rejectedRoot);
    return new BulkTransitionResult(requested.size(), updated, skipped);
  }

  /**
   * Marks an approved item as migrated and stamps the destination and time. Any other status
   * is not eligible.
   */
  @Transactional
  public LifecycleResult markMigrated(UUID id, Path destination) {
    Optional<DocumentItem> found = repository.findById(id);
    if (found.isEmpty()) {
      return LifecycleResult.notFound(id);
    }
    DocumentItem item = found.get();
    if (item.getStatus() != ItemStatus.APPROVED || !item.transitionTo(ItemStatus.MIGRATED)) {
      return LifecycleResult.notEligible(
          item, "Only approved items can be migrated, item is " + item.getStatus().value());
    }
    item.recordMigration(destination.toString(), clock.instant());
    return LifecycleResult.updated(repository.save(item));
  }

  @Transactional(readOnly = true)
  public ItemStatistics statistics() {
    Map<ItemStatus, Long> byStatus = new HashMap<>();
    long total = 0;
    for (Object[] row : repository.countByStatus()) {
      long count = ((Number) row[1]).longValue();
      byStatus.put((ItemStatus) row[0], count);
      total += count;
    }
    Map<String, Long> byWorkspace = new HashMap<>();
    for (Object[] row : repository.countByWorkspace()) {
      byWorkspace.put((String) row[0], ((Number) row[1]).longValue());
    }
    Double average = repository.averageConfidence();
    return new ItemStatistics(total, byStatus, byWorkspace, average != null ? average : 0.0);
  }

  /** Deletes every item. Files on disk are untouched. */
  @Transactional
  public long clearAll() {
    long count = repository.count();
    repository.deleteAllInBatch();
    log.info("Cleared {} items", count);
    return count;
  }

  private static boolean canBeRejected(DocumentItem item) {
    return item.getStatus() == ItemStatus.REJECTED
        || item.getStatus().canTransitionTo(ItemStatus.REJECTED);
  }

  private static List<UUID> distinct(Collection<UUID> ids) {
    if (ids == null) {
      return List.of();
    }
    LinkedHashSet<UUID> unique = new LinkedHashSet<>();
    for (UUID id : ids) {
      if (id != null) {
        unique.add(id);
      }
    }
    return new ArrayList<>(unique);
  }
}
