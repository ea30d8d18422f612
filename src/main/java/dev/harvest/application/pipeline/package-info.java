/**
 * Build scheduling: staleness evaluation, stage execution, dry-run planning and build reports.
 * <p>Entry point is {@link dev.harvest.application.pipeline.BuildUseCase}.</p>
 *
 * @since 0.1.0
 */
package dev.harvest.application.pipeline;
