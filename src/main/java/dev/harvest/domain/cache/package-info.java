/**
 * Fetch cache values: request fingerprints, fetch requests and cached payload entries.
 *
 * @since 0.1.0
 */
package dev.harvest.domain.cache;
