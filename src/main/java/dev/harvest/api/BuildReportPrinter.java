package dev.harvest.api;

import dev.harvest.application.pipeline.BuildReport;
import dev.harvest.application.pipeline.ExecutionPlan;
import dev.harvest.application.pipeline.PlanEntry;
import dev.harvest.domain.content.CommitSummary;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.VariantStatus;
import dev.harvest.domain.run.RunOutcome;
import dev.harvest.domain.run.StageRun;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Renders build reports and plans as plain text lines for the terminal. */
final class BuildReportPrinter {

  private BuildReportPrinter() {}

  static List<String> format(BuildReport report) {
    if (report.isDryRun()) {
      return formatPlan(report.buildId(), report.plan().orElseThrow());
    }
    List<String> lines = new ArrayList<>();
    lines.add(String.format(Locale.ROOT, "Build %s %s in %d ms",
        report.buildId(), report.succeeded() ? "succeeded" : "FAILED", report.duration().toMillis()));
    for (StageRun run : report.runs()) {
      lines.add(formatRun(run));
      run.failure().ifPresent(failure -> lines.add("      error: " + failure));
      run.blockedBy().ifPresent(upstream -> lines.add("      blocked by: " + upstream));
    }
    for (Map.Entry<RecordVariant, VariantStatus> entry : report.variantStatuses().entrySet()) {
      int pruned = report.pruned().getOrDefault(entry.getKey(), 0);
      lines.add(String.format(Locale.ROOT, "  variant %-16s %s%s",
          entry.getKey().name(), entry.getValue(), pruned > 0 ? " (pruned " + pruned + ")" : ""));
    }
    for (String error : report.storeErrors()) {
      lines.add("  store error: " + error);
    }
    return lines;
  }

  private static String formatRun(StageRun run) {
    CommitSummary commit = run.commit();
    String detail = run.outcome() == RunOutcome.SUCCESS
        ? String.format(Locale.ROOT, " items=%d hits=%d misses=%d +%d ~%d =%d",
            run.stats().itemsProcessed(), run.stats().cacheHits(), run.stats().cacheMisses(),
            commit.inserted(), commit.updated(), commit.unchanged())
        : "";
    return String.format(Locale.ROOT, "  %-24s %-15s %-24s %6d ms%s",
        run.stage(), run.outcome(), run.reason(), run.duration().toMillis(), detail);
  }

  static List<String> formatPlan(String buildId, ExecutionPlan plan) {
    List<String> lines = new ArrayList<>();
    lines.add(String.format(Locale.ROOT, "Dry run %s: %d to run, %d to skip, %d if upstream changes",
        buildId,
        plan.count(PlanEntry.Action.RUN),
        plan.count(PlanEntry.Action.SKIP),
        plan.count(PlanEntry.Action.RUN_IF_UPSTREAM_CHANGES)));
    for (PlanEntry entry : plan.entries()) {
      String reason = entry.action() == PlanEntry.Action.RUN ? " (" + entry.reason() + ")" : "";
      lines.add(String.format(Locale.ROOT, "  %-24s %s%s", entry.stage(), entry.action(), reason));
    }
    return lines;
  }
}
