/**
 * Fetch cache adapters: file-system backed and in-memory.
 *
 * @since 0.1.0
 */
package dev.harvest.infrastructure.cache;
