/**
 * Command-line entry points. Arguments are {@code key=value} pairs plus a few flags; output for the
 * user goes through {@link dev.harvest.api.CliPrinter}, diagnostics through SLF4J.
 *
 * @since 0.1.0
 */
package dev.harvest.api;
