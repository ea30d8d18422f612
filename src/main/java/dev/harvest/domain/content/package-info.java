/**
 * Content store values: record variants, natural keys, normalized records and commit outcomes.
 *
 * <p>Records are immutable; the store replaces them wholesale when a stage commits.</p>
 *
 * @since 0.1.0
 */
package dev.harvest.domain.content;
