/**
 * <strong>Purpose:</strong> Ports the build pipeline depends on: cache, content store, run history,
 * clock and metrics.
 * <p><strong>Concurrency:</strong> Implementations are shared by stage worker threads and must be
 * thread-safe unless a port states otherwise.</p>
 *
 * @since 0.1.0
 */
package dev.harvest.application.port;
