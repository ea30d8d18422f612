/**
 * <strong>Purpose:</strong> Stage dependency graph: registration, validation and deterministic
 * topological ordering.
 * <p><strong>Concurrency:</strong> The graph is mutable while stages register on the startup thread
 * and immutable once validated.</p>
 *
 * @since 0.1.0
 */
package dev.harvest.application.graph;
