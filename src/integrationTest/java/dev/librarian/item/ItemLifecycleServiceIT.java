package dev.librarian.item;

import static org.assertj.core.api.Assertions.assertThat;

import dev.librarian.BaseIntegrationTest;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;

class ItemLifecycleServiceIT extends BaseIntegrationTest {

  @Autowired ItemLifecycleService lifecycleService;

  private DocumentItem create(String filename, String workspace, int confidence) {
    return lifecycleService.create(
        new DocumentItem(
            "/scan/" + filename, filename, workspace, "", "NAME-" + filename, confidence, "d"));
  }

  @Test
  void listingIsLeastConfidentFirstThenByFilename() {
    create("c.pdf", "KB.Finance.Taxes", 4);
    create("b.pdf", "KB.Finance.Taxes", 1);
    create("a.pdf", "KB.Personal.Misc", 1);

    Page<DocumentItem> page = lifecycleService.list(ItemFilter.all(), 0, 10);

    assertThat(page.getContent())
        .extracting(DocumentItem::getOriginalFilename)
        .containsExactly("a.pdf", "b.pdf", "c.pdf");
  }

  @Test
  void listingFiltersByStatusWorkspaceAndConfidence() {
    DocumentItem low = create("low.pdf", "KB.Finance.Taxes", 2);
    create("high.pdf", "KB.Finance.Taxes", 5);
    create("misc.pdf", "KB.Personal.Misc", 1);
    lifecycleService.bulkTransition(List.of(low.getId()), ItemStatus.APPROVED);

    assertThat(lifecycleService.list(ItemFilter.byStatus(ItemStatus.APPROVED), 0, 10).getContent())
        .extracting(DocumentItem::getOriginalFilename)
        .containsExactly("low.pdf");
    assertThat(
            lifecycleService
                .list(new ItemFilter(null, "KB.Finance.Taxes", null, 3), 0, 10)
                .getContent())
        .extracting(DocumentItem::getOriginalFilename)
        .containsExactly("low.pdf");
  }

  @Test
  void listingFiltersByConfidenceRange() {
    create("zero.pdf", "KB.Personal.Misc", 0);
    create("two.pdf", "KB.Personal.Misc", 2);
    create("three.pdf", "KB.Personal.Misc", 3);
    create("five.pdf", "KB.Personal.Misc", 5);

    assertThat(lifecycleService.list(new ItemFilter(null, null, 2, 3), 0, 10).getContent())
        .extracting(DocumentItem::getOriginalFilename)
        .containsExactly("two.pdf", "three.pdf");
    assertThat(lifecycleService.list(new ItemFilter(null, null, 3, null), 0, 10).getContent())
        .extracting(DocumentItem::getOriginalFilename)
        .containsExactly("three.pdf", "five.pdf");
  }

  @Test
  void bulkApproveWithUnknownIdUpdatesExistingOnly() {
    DocumentItem first = create("1.pdf", "KB.Finance.Taxes", 3);
    DocumentItem second = create("2.pdf", "KB.Finance.Taxes", 3);

    BulkTransitionResult result =
        lifecycleService.bulkTransition(
            List.of(first.getId(), second.getId(), UUID.randomUUID()), ItemStatus.APPROVED);

    assertThat(result.updated()).isEqualTo(2);
    assertThat(lifecycleService.listApproved()).hasSize(2);
  }

  @Test
  void statisticsAggregateByStatusAndWorkspace() {
    DocumentItem taxes = create("t.pdf", "KB.Finance.Taxes", 4);
    create("m.pdf", "KB.Personal.Misc", 1);
    lifecycleService.bulkTransition(List.of(taxes.getId()), ItemStatus.IGNORED);

    ItemStatistics stats = lifecycleService.statistics();

    assertThat(stats.total()).isEqualTo(2);
    assertThat(stats.count(ItemStatus.IGNORED)).isEqualTo(1);
    assertThat(stats.count(ItemStatus.PENDING)).isEqualTo(1);
    assertThat(stats.byWorkspace()).containsKeys("KB.Finance.Taxes", "KB.Personal.Misc");
    assertThat(stats.averageConfidence()).isEqualTo(2.5);
  }

  @Test
  void clearAllEmptiesTheStore() {
    create("x.pdf", "KB.Personal.Misc", 1);

    assertThat(lifecycleService.clearAll()).isEqualTo(1);
    assertThat(lifecycleService.statistics().total()).isZero();
  }
}
