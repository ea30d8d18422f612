package dev.harvest.config;

import dev.harvest.application.graph.DependencyGraph;
import dev.harvest.application.graph.GraphException;
import dev.harvest.application.port.stage.Stage;
import dev.harvest.infrastructure.stage.feed.FeedClient;
import dev.harvest.infrastructure.stage.feed.FeedFetchStage;
import dev.harvest.infrastructure.stage.feed.FeedParser;
import dev.harvest.infrastructure.stage.feed.PostingNormalizeStage;
import dev.harvest.infrastructure.stage.feed.SiteDataExportStage;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Static registry of the stages shipped with the tool.
 * <p>The graph is assembled once per process from configuration; stages are not discovered at
 * runtime.</p>
 *
 * @since 0.1.0
 */
public final class StageCatalog {

  private StageCatalog() {}

  /**
   * Instantiates the built-in stages in declaration order.
   *
   * @param config build configuration supplying feeds and export directory
   * @param feedClient client used by the fetch stage
   * @return stages {@code fetch_feeds}, {@code normalize_postings}, {@code publish_site_data}
   */
  public static List<Stage> builtInStages(BuildConfig config, FeedClient feedClient) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(feedClient, "feedClient");
    return List.of(
        new FeedFetchStage(config.feeds(), feedClient, new FeedParser()),
        new PostingNormalizeStage(),
        new SiteDataExportStage(config.exportDir()));
  }

  /**
   * Registers and validates stages.
   *
   * @param stages stage plugins
   * @return validated, sealed graph
   * @throws GraphException when names collide, a dependency is missing, variants overlap or a cycle exists
   */
  public static DependencyGraph graphOf(List<? extends Stage> stages) throws GraphException {
    DependencyGraph graph = new DependencyGraph();
    for (Stage stage : stages) {
      graph.register(stage);
    }
    graph.validate();
    return graph;
  }
}
