package dev.harvest.application.pipeline;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-invocation build settings.
 *
 * @param forceStages stages to run regardless of staleness
 * @param forceAll run every stage regardless of staleness
 * @param timeout global deadline after which no new stage starts
 * @param dryRun compute the execution plan without running anything
 * @param clearCacheTags cache tags evicted before the build starts
 * @param abort external abort signal
 * @since 0.1.0
 */
public record BuildOptions(
    Set<String> forceStages,
    boolean forceAll,
    Optional<Duration> timeout,
    boolean dryRun,
    Set<String> clearCacheTags,
    AbortSignal abort) {

  public BuildOptions {
    forceStages = Set.copyOf(Objects.requireNonNullElse(forceStages, Set.of()));
    timeout = Objects.requireNonNullElse(timeout, Optional.empty());
    timeout.ifPresent(value -> {
      if (value.isNegative() || value.isZero()) {
        throw new IllegalArgumentException("timeout must be positive");
      }
    });
    clearCacheTags = Set.copyOf(Objects.requireNonNullElse(clearCacheTags, Set.of()));
    abort = Objects.requireNonNullElseGet(abort, AbortSignal::new);
  }

  /** Options for a plain incremental build. */
  public static BuildOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Whether {@code stage} is forced by name or globally.
   *
   * @param stage stage name
   * @return {@code true} when the stage must run
   */
  public boolean isForced(String stage) {
    return forceAll || forceStages.contains(stage);
  }

  /** Fluent builder. */
  public static final class Builder {
    private final Set<String> force = new TreeSet<>();
    private boolean forceAll;
    private Duration timeout;
    private boolean dryRun;
    private final Set<String> clearCacheTags = new TreeSet<>();
    private AbortSignal abort;

    private Builder() {}

    public Builder force(String... stages) {
      force.addAll(Set.of(stages));
      return this;
    }

    public Builder force(Collection<String> stages) {
      force.addAll(stages);
      return this;
    }

    public Builder forceAll(boolean value) {
      this.forceAll = value;
      return this;
    }

    public Builder timeout(Duration value) {
      this.timeout = value;
      return this;
    }

    public Builder dryRun(boolean value) {
      this.dryRun = value;
      return this;
    }

    public Builder clearCache(Collection<String> tags) {
      clearCacheTags.addAll(tags);
      return this;
    }

    public Builder abort(AbortSignal signal) {
      this.abort = signal;
      return this;
    }

    public BuildOptions build() {
      return new BuildOptions(force, forceAll, Optional.ofNullable(timeout), dryRun, clearCacheTags, abort);
    }
  }
}
