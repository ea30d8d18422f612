/**
 * Build history values: stage run records, outcomes, staleness reasons and failure detail.
 *
 * @since 0.1.0
 */
package dev.harvest.domain.run;
