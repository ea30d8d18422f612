/**
 * Input validation helpers shared by configuration parsing and the CLI.
 *
 * @since 0.1.0
 */
package dev.harvest.validation;
