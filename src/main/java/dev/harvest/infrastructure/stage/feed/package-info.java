/**
 * Built-in feed pipeline: {@code fetch_feeds -> normalize_postings -> publish_site_data}.
 *
 * @since 0.1.0
 */
package dev.harvest.infrastructure.stage.feed;
