/**
 * Stage plugin contract: descriptor plus a run function returning a typed result.
 *
 * @since 0.1.0
 */
package dev.harvest.application.port.stage;
