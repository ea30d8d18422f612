/**
 * Run history adapters: append-only NDJSON log and an in-memory variant.
 *
 * @since 0.1.0
 */
package dev.harvest.infrastructure.history;
