/**
 * Logging utilities: verbosity control and bounded, redacted log text.
 * <p>MDC keys {@code build.id} and {@code stage} are set by the scheduler and rendered by the bundled
 * Logback pattern.</p>
 *
 * @since 0.1.0
 */
package dev.harvest.logging;
