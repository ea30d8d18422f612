/**
 * Time source adapters.
 *
 * @since 0.1.0
 */
package dev.harvest.infrastructure.time;
