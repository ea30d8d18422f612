package dev.harvest.domain.content;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized entity stored in the content store and read by the site generator.
 *
 * @param variant record variant
 * @param naturalKey key unique within the variant
 * @param attributes normalized attribute map (see {@link Attributes#normalize(Map)})
 * @param sourceStage stage that last wrote or affirmed the record
 * @param lastSeenAt instant of the last upsert or affirmation
 * @param lastSeenBuild id of the build that last affirmed the record; empty for migrated data
 * @since 0.1.0
 */
public record ContentRecord(
    RecordVariant variant,
    String naturalKey,
    Map<String, Object> attributes,
    String sourceStage,
    Instant lastSeenAt,
    String lastSeenBuild) {

  public ContentRecord {
    Objects.requireNonNull(variant, "variant");
    Objects.requireNonNull(naturalKey, "naturalKey");
    attributes = Attributes.normalize(attributes);
    Objects.requireNonNull(sourceStage, "sourceStage");
    Objects.requireNonNull(lastSeenAt, "lastSeenAt");
    lastSeenBuild = Objects.requireNonNullElse(lastSeenBuild, "");
  }

  public RecordKey key() {
    return new RecordKey(variant, naturalKey);
  }

  /**
   * Looks up a string attribute.
   *
   * @param name attribute name
   * @return value as text, or {@code null} when absent
   */
  public String text(String name) {
    Object value = attributes.get(name);
    return value == null ? null : value.toString();
  }

  /**
   * Returns whether this record was affirmed during the given build.
   *
   * @param buildId build identifier
   * @return {@code true} when {@link #lastSeenBuild()} equals {@code buildId}
   */
  public boolean seenIn(String buildId) {
    return lastSeenBuild.equals(buildId);
  }

  /**
   * Returns a copy carrying new attributes and affirmation metadata.
   *
   * @param newAttributes replacement attributes
   * @param stage writing stage
   * @param at write instant
   * @param buildId current build id
   * @return updated record
   */
  public ContentRecord rewrite(Map<String, ?> newAttributes, String stage, Instant at, String buildId) {
    return new ContentRecord(variant, naturalKey, Attributes.normalize(newAttributes), stage, at, buildId);
  }

  /**
   * Returns a copy carrying new affirmation metadata with unchanged attributes.
   *
   * @param stage affirming stage
   * @param at affirmation instant
   * @param buildId current build id
   * @return affirmed record
   */
  public ContentRecord affirm(String stage, Instant at, String buildId) {
    return new ContentRecord(variant, naturalKey, attributes, stage, at, buildId);
  }
}
