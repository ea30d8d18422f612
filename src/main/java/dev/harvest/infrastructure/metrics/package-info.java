/**
 * OpenTelemetry metrics adapter and its meter provider bootstrap.
 * <p>Published names: {@code build.stage.<outcome>}, {@code build.stage.duration.ms},
 * {@code cache.hit}, {@code cache.miss}, {@code cache.error}, {@code store.commit.records} and
 * {@code store.prune.removed}.</p>
 *
 * @since 0.1.0
 */
package dev.harvest.infrastructure.metrics;
