/**
 * Executor construction for stage workers.
 *
 * @since 0.1.0
 */
package dev.harvest.infrastructure.exec;
