package dev.librarian.item;

import static org.assertj.core.api.Assertions.assertThat;

import dev.librarian.BaseIntegrationTest;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.annotation.Transactional;

/**
 * Verifies the entity can be persisted and read back against the Flyway schema, catching entity
 * and migration drift at test time rather than runtime.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  @Test
  void documentItemRoundtripsAgainstFlywaySchema() {
    DocumentItem item =
        new DocumentItem(
            "/scan/taxes/2024/return.pdf",
            "return.pdf",
            "KB.Finance.Taxes",
            "Federal/2024",
            "TAX-2024-federal",
            4,
            "Federal tax return");
    item.setExtractedText("Form 1040");
    item.setFileSize(1234L);
    item.setFileExtension(".pdf");
    item.setContentHash("a".repeat(64));
    item.transitionTo(ItemStatus.APPROVED);
    Instant migratedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    item.transitionTo(ItemStatus.MIGRATED);
    item.recordMigration("/out/KB.Finance.Taxes/Federal/2024/TAX-2024-federal.pdf", migratedAt);

    DocumentItem saved = documentItemRepository.saveAndFlush(item);
    DocumentItem found = documentItemRepository.findById(saved.getId()).orElseThrow();

    assertThat(found.getId()).isNotNull();
    assertThat(found.getProposedSubpath()).isEqualTo("Federal/2024");
    assertThat(found.getConfidence()).isEqualTo(4);
    assertThat(found.getStatus()).isEqualTo(ItemStatus.MIGRATED);
    assertThat(found.getFileSize()).isEqualTo(1234L);
    assertThat(found.getContentHash()).hasSize(64);
    assertThat(found.getMigratedAt()).isEqualTo(migratedAt);
    assertThat(found.getCreatedAt()).isNotNull();
    assertThat(found.getUpdatedAt()).isNotNull();
  }
}
