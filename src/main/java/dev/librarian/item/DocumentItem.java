package dev.librarian.item;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A classification proposal for one scanned file, reviewed by a human before migration.
 *
 * <p>The item points at the original file through {@code sourcePath} but never owns it. The path
 * only changes when the file is moved out of the scan root by a reject-and-move. Status changes go
 * through {@link ItemLifecycleService}, which enforces the {@link ItemStatus} transition table.
 *
 * <p>Maps to the {@code document_items} table managed by Flyway migrations.
 */
@Entity
@Table(name = "document_items")
public class DocumentItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "source_path", nullable = false)
  private String sourcePath;

  @Column(name = "original_filename", nullable = false)
  private String originalFilename;

  @Column(name = "extracted_text")
  private String extractedText;

  @Column(name = "proposed_workspace", nullable = false)
  private String proposedWorkspace;

  @Column(name = "proposed_subpath")
  private String proposedSubpath;

  @Column(name = "proposed_filename", nullable = false)
  private String proposedFilename;

  @Column(nullable = false)
  private int confidence;

  private String description;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ItemStatus status = ItemStatus.PENDING;

  @Column(name = "file_size")
  private Long fileSize;

  @Column(name = "file_extension")
  private String fileExtension;

  @Column(name = "content_hash")
  private String contentHash;

  @Column(name = "migrated_path")
  private String migratedPath;

  @Column(name = "migrated_at")
  private Instant migratedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected DocumentItem() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates a pending proposal.
   *
   * @param sourcePath path of the original file
   * @param originalFilename name of the original file
   * @param proposedWorkspace workspace id proposed by classification
   * @param proposedSubpath optional folder inside the workspace
   * @param proposedFilename generated filename without extension
   * @param confidence classifier confidence 0..5
   * @param description one-sentence description
   */
  public DocumentItem(
      String sourcePath,
      String originalFilename,
      String proposedWorkspace,
      String proposedSubpath,
      String proposedFilename,
      int confidence,
      String description) {
    this.sourcePath = sourcePath;
    this.originalFilename = originalFilename;
    this.proposedWorkspace = proposedWorkspace;
    this.proposedSubpath = proposedSubpath == null ? "" : proposedSubpath;
    this.proposedFilename = proposedFilename;
    this.confidence = confidence;
    this.description = description == null ? "" : description;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Resets a new item to {@code PENDING} and truncates the stored text excerpt. */
  void prepareForCreate(int maxStoredTextChars) {
    status = ItemStatus.PENDING;
    migratedPath = null;
    migratedAt = null;
    if (extractedText != null && extractedText.length() > maxStoredTextChars) {
      extractedText = extractedText.substring(0, maxStoredTextChars);
    }
  }

  /** Applies {@code target} if the transition table allows it. */
  boolean transitionTo(ItemStatus target) {
    if (!status.canTransitionTo(target)) {
      return false;
    }
    status = target;
    return true;
  }

  void recordMigration(String destination, Instant at) {
    this.migratedPath = destination;
    this.migratedAt = at;
  }

  /** Points the item at the file's new location after it was moved out of the scan root. */
  void relocateTo(String newSourcePath) {
    this.sourcePath = newSourcePath;
  }

  void setProposedWorkspace(String proposedWorkspace) {
    this.proposedWorkspace = proposedWorkspace;
  }

  void setProposedSubpath(String proposedSubpath) {
    this.proposedSubpath = proposedSubpath;
  }

  void setProposedFilename(String proposedFilename) {
    this.proposedFilename = proposedFilename;
  }

  public UUID getId() {
    return id;
  }

  public String getSourcePath() {
    return sourcePath;
  }

  public String getOriginalFilename() {
    return originalFilename;
  }

  public String getExtractedText() {
    return extractedText;
  }

  public void setExtractedText(String extractedText) {
    this.extractedText = extractedText;
  }

  public String getProposedWorkspace() {
    return proposedWorkspace;
  }

  public String getProposedSubpath() {
    return proposedSubpath;
  }

  public String getProposedFilename() {
    return proposedFilename;
  }

  public int getConfidence() {
    return confidence;
  }

  public String getDescription() {
    return description;
  }

  public ItemStatus getStatus() {
    return status;
  }

  public Long getFileSize() {
    return fileSize;
  }

  public void setFileSize(Long fileSize) {
    this.fileSize = fileSize;
  }

  public String getFileExtension() {
    return fileExtension;
  }

  public void setFileExtension(String fileExtension) {
    this.fileExtension = fileExtension;
  }

  public String getContentHash() {
    return contentHash;
  }

  public void setContentHash(String contentHash) {
    this.contentHash = contentHash;
  }

  public String getMigratedPath() {
    return migratedPath;
  }

  public Instant getMigratedAt() {
    return migratedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
