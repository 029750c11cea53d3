package dev.librarian.item;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Review progress summary.
 *
 * @param total number of items
 * @param byStatus counts per status, every status present
 * @param byWorkspace counts per proposed workspace, sorted by id
 * @param averageConfidence mean confidence, 0 when there are no items
 */
public record ItemStatistics(
    long total,
    Map<ItemStatus, Long> byStatus,
    Map<String, Long> byWorkspace,
    double averageConfidence) {

  public ItemStatistics {
    EnumMap<ItemStatus, Long> statuses = new EnumMap<>(ItemStatus.class);
    for (ItemStatus status : ItemStatus.values()) {
      statuses.put(status, byStatus.getOrDefault(status, 0L));
    }
    byStatus = Collections.unmodifiableMap(statuses);
    byWorkspace = Collections.unmodifiableMap(new TreeMap<>(byWorkspace));
  }

  public long count(ItemStatus status) {
    return byStatus.getOrDefault(status, 0L);
  }
}
