/**
 * Durable file-writing helpers shared by the file-backed adapters.
 *
 * @since 0.1.0
 */
package dev.harvest.infrastructure.io;
