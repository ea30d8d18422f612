package dev.harvest.infrastructure.store;

import dev.harvest.application.port.ClockPort;
import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.VariantStatus;
import java.util.Map;

/**
 * Content store held only in memory; used by tests and dry runs.
 *
 * @since 0.1.0
 */
public final class InMemoryContentStore extends AbstractContentStore {

  public InMemoryContentStore(ClockPort clock) {
    super(clock);
  }

  @Override
  protected void persistVariants(Map<RecordVariant, Map<String, ContentRecord>> changed) {
    // held in memory only
  }

  @Override
  protected void persistMetadata(String lastBuildId, Map<RecordVariant, VariantStatus> variantStatuses) {
    // held in memory only
  }
}
