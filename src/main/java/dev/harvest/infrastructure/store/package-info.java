/**
 * Content store adapters.
 * <p>{@link dev.harvest.infrastructure.store.AbstractContentStore} implements transactions, build
 * lifecycle and visibility; {@link dev.harvest.infrastructure.store.FileContentStore} persists it as
 * journaled JSON documents, {@link dev.harvest.infrastructure.store.InMemoryContentStore} keeps it in
 * memory for tests and dry runs.</p>
 *
 * @since 0.1.0
 */
package dev.harvest.infrastructure.store;
