package dev.harvest.domain.stage;

import dev.harvest.domain.content.RecordVariant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Static description of a pipeline stage.
 * <p><strong>Why:</strong> The dependency graph and the scheduler reason about stages purely through
 * descriptors; the run function is supplied separately by the stage plugin.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share across worker threads.</p>
 *
 * @param name unique stage name ({@code [a-z0-9_.-]+})
 * @param dependencies upstream stage names, de-duplicated in declaration order
 * @param version opaque version tag; bump it when the stage's logic changes
 * @param ownedVariants record variants this stage is the single writer of
 * @param refreshPolicy staleness policy; {@code null} defaults to {@link RefreshPolicy#ON_INPUT_CHANGE}
 * @since 0.1.0
 */
public record StageDescriptor(
    String name,
    List<String> dependencies,
    String version,
    Set<RecordVariant> ownedVariants,
    RefreshPolicy refreshPolicy) {

  private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9_.-]*$");

  /**
   * Validates and normalizes descriptor fields.
   *
   * @throws IllegalArgumentException when the name or version is malformed
   */
  public StageDescriptor {
    name = requireName("name", name);
    Objects.requireNonNull(version, "version");
    version = version.trim();
    if (version.isEmpty()) {
      throw new IllegalArgumentException("version must not be blank for stage " + name);
    }
    List<String> deps = new ArrayList<>();
    for (String dependency : new LinkedHashSet<>(Objects.requireNonNull(dependencies, "dependencies"))) {
      deps.add(requireName("dependency", dependency));
    }
    dependencies = List.copyOf(deps);
    ownedVariants = Collections.unmodifiableSet(
        new TreeSet<>(Objects.requireNonNull(ownedVariants, "ownedVariants")));
    refreshPolicy = Objects.requireNonNullElse(refreshPolicy, RefreshPolicy.ON_INPUT_CHANGE);
  }

  /**
   * Starts a fluent builder for the named stage.
   *
   * @param name stage name
   * @return builder with no dependencies, no owned variants and version {@code "1"}
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Indicates whether the stage declares a direct dependency on {@code other}.
   *
   * @param other stage name
   * @return {@code true} when {@code other} is a direct upstream
   */
  public boolean dependsOn(String other) {
    return dependencies.contains(other);
  }

  /**
   * Returns a copy of this descriptor with a different version tag.
   *
   * @param newVersion replacement version
   * @return new descriptor
   */
  public StageDescriptor withVersion(String newVersion) {
    return new StageDescriptor(name, dependencies, newVersion, ownedVariants, refreshPolicy);
  }

  private static String requireName(String label, String value) {
    Objects.requireNonNull(value, label);
    String trimmed = value.trim();
    if (!NAME_PATTERN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(label + " must match [a-z0-9_.-]+ (was '" + value + "')");
    }
    return trimmed;
  }

  /** Fluent builder used by stage plugins to declare their descriptor. */
  public static final class Builder {
    private final String name;
    private final List<String> dependencies = new ArrayList<>();
    private final Set<RecordVariant> owned = new LinkedHashSet<>();
    private String version = "1";
    private RefreshPolicy refreshPolicy = RefreshPolicy.ON_INPUT_CHANGE;

    private Builder(String name) {
      this.name = name;
    }

    public Builder dependsOn(String... upstream) {
      dependencies.addAll(List.of(upstream));
      return this;
    }

    public Builder version(String value) {
      this.version = value;
      return this;
    }

    public Builder owns(RecordVariant... variants) {
      owned.addAll(List.of(variants));
      return this;
    }

    public Builder refreshPolicy(RefreshPolicy policy) {
      this.refreshPolicy = policy;
      return this;
    }

    public StageDescriptor build() {
      return new StageDescriptor(name, dependencies, version, owned, refreshPolicy);
    }
  }
}
