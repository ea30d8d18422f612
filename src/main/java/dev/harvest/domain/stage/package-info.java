/**
 * Stage descriptors: names, upstream edges, version tags and owned record variants.
 *
 * @since 0.1.0
 */
package dev.harvest.domain.stage;
