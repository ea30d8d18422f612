/**
 * Configuration loading (defaults, YAML, CLI merge), the built-in stage catalog and the composition
 * root wiring adapters into the build use case.
 *
 * @since 0.1.0
 */
package dev.harvest.config;
