package dev.librarian.fixture;

import dev.librarian.item.DocumentItem;
import dev.librarian.item.ItemStatus;
import java.lang.reflect.Field;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for the {@link DocumentItem} JPA entity. Provides sensible defaults so
 * tests only override what they care about.
 *
 * <pre>{@code
 * DocumentItem item = new DocumentItemBuilder().status(ItemStatus.APPROVED).build();
 * }</pre>
 */
public final class DocumentItemBuilder {

  private @Nullable UUID id = UUID.randomUUID();
  private String sourcePath = "/scan/taxes/2024/return.pdf";
  private String originalFilename = "return.pdf";
  private String workspace = "KB.Finance.Taxes";
  private String subpath = "";
  private String filename = "TAX-2024-federal";
  private int confidence = 4;
  private String description = "Federal tax return";
  private ItemStatus status = ItemStatus.PENDING;
  private @Nullable String extension = ".pdf";
  private @Nullable String extractedText;

  public DocumentItemBuilder id(@Nullable UUID id) {
    this.id = id;
    return this;
  }

  public DocumentItemBuilder sourcePath(String sourcePath) {
    this.sourcePath = sourcePath;
    return this;
  }

  public DocumentItemBuilder originalFilename(String originalFilename) {
    this.originalFilename = originalFilename;
    return this;
  }

  public DocumentItemBuilder workspace(String workspace) {
    this.workspace = workspace;
    return this;
  }

  public DocumentItemBuilder subpath(String subpath) {
    this.subpath = subpath;
    return this;
  }

  public DocumentItemBuilder filename(String filename) {
    this.filename = filename;
    return this;
  }

  public DocumentItemBuilder confidence(int confidence) {
    this.confidence = confidence;
    return this;
  }

  public DocumentItemBuilder description(String description) {
    this.description = description;
    return this;
  }

  public DocumentItemBuilder status(ItemStatus status) {
    this.status = status;
    return this;
  }

  public DocumentItemBuilder extension(@Nullable String extension) {
    this.extension = extension;
    return this;
  }

  public DocumentItemBuilder extractedText(String extractedText) {
    this.extractedText = extractedText;
    return this;
  }

  public DocumentItem build() {
    DocumentItem item =
        new DocumentItem(
            sourcePath, originalFilename, workspace, subpath, filename, confidence, description);
    if (id != null) {
      setField(item, "id", id);
    }
    setField(item, "status", status);
    item.setFileExtension(extension);
    if (extractedText != null) {
      item.setExtractedText(extractedText);
    }
    return item;
  }

  private static void setField(DocumentItem item, String fieldName, Object value) {
    try {
      Field field = DocumentItem.class.getDeclaredField(fieldName);
      field.setAccessible(true);
      field.set(item, value);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to set field " + fieldName, e);
    }
  }
}
