package dev.librarian.session;

import static org.assertj.core.api.Assertions.assertThat;

import dev.librarian.BaseIntegrationTest;
import dev.librarian.item.DocumentItem;
import dev.librarian.item.ItemFilter;
import dev.librarian.item.ItemLifecycleService;
import dev.librarian.item.ItemStatus;
import dev.librarian.llm.LanguageModelBackend;
import dev.librarian.migration.MigrationReport;
import dev.librarian.migration.MigrationService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/** Scan, classify, approve and migrate a small directory with a canned model reply. */
class ReviewWorkflowIT extends BaseIntegrationTest {

  @TestConfiguration
  static class CannedModel {

    @Bean
    @Primary
    LanguageModelBackend cannedBackend() {
      return new LanguageModelBackend() {
        @Override
        public String complete(String prompt) {
          return """
              {"workspace": "KB.Finance.Taxes", "subpath": "Federal",
               "description": "Federal tax return", "confidence": 4,
               "suggested_name": "federal"}
              """;
        }

        @Override
        public String name() {
          return "canned";
        }
      };
    }
  }

  @Autowired ScanSessionService sessionService;
  @Autowired BatchClassificationService batchService;
  @Autowired ClassificationProgressTracker progressTracker;
  @Autowired ItemLifecycleService lifecycleService;
  @Autowired MigrationService migrationService;

  @TempDir Path tempDir;

  @Test
  void scannedFileEndsUpCopiedIntoItsWorkspace() throws Exception {
    Path input = Files.createDirectories(tempDir.resolve("scan/taxes/2024"));
    Path source = Files.writeString(input.resolve("return.txt"), "Form 1040 income tax return");
    Path output = tempDir.resolve("organized");

    ScanSession session =
        sessionService.scan(tempDir.resolve("scan").toString(), output.toString());
    assertThat(session.fileCount()).isEqualTo(1);

    OptionalLong runId = progressTracker.tryStart(session.fileCount());
    assertThat(runId).isPresent();
    batchService.run(session, runId.getAsLong());
    assertThat(batchService.progress().status()).isEqualTo(ClassificationProgress.Status.COMPLETED);
    assertThat(batchService.progress().processed()).isEqualTo(1);

    List<DocumentItem> items = lifecycleService.list(ItemFilter.all(), 0, 10).getContent();
    assertThat(items).hasSize(1);
    DocumentItem item = items.get(0);
    assertThat(item.getProposedWorkspace()).isEqualTo("KB.Finance.Taxes");
    assertThat(item.getProposedFilename()).startsWith("TAX-2024");
    assertThat(item.getContentHash()).hasSize(64);

    lifecycleService.bulkTransition(List.of(item.getId()), ItemStatus.APPROVED);
    MigrationReport report = migrationService.migrate(output);

    assertThat(report.migratedCount()).isEqualTo(1);
    assertThat(report.reportPath()).isNotNull().exists();
    DocumentItem migrated = lifecycleService.get(item.getId()).orElseThrow();
    assertThat(migrated.getStatus()).isEqualTo(ItemStatus.MIGRATED);
    Path destination = Path.of(migrated.getMigratedPath());
    assertThat(destination)
        .startsWith(output.resolve("KB.Finance.Taxes"))
        .hasContent("Form 1040 income tax return");
    assertThat(source).exists();
  }
}
