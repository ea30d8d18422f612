/**
 * Jackson streaming helpers shared by fingerprints and the file-backed adapters.
 *
 * @since 0.1.0
 */
package dev.harvest.application.json;
