/**
 * <strong>Purpose:</strong> Stage-facing fetch cache: request fingerprints, a failure-absorbing
 * decorator and the per-stage cache handle.
 * <p><strong>Observability:</strong> {@code cache.hit}, {@code cache.miss}, {@code cache.error}.</p>
 *
 * @since 0.1.0
 */
package dev.harvest.application.cache;
