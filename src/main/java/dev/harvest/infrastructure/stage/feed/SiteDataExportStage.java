package dev.harvest.infrastructure.stage.feed;

import dev.harvest.application.cache.Fingerprints;
import dev.harvest.application.cache.StageCache;
import dev.harvest.application.json.JsonSupport;
import dev.harvest.application.port.StoreTransaction;
import dev.harvest.application.port.stage.Stage;
import dev.harvest.application.port.stage.StageResult;
import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.run.StageErrorKind;
import dev.harvest.domain.stage.StageDescriptor;
import dev.harvest.infrastructure.io.AtomicFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes postings for the static-site generator as {@code <exportDir>/postings.json}.
 * <p>The file is a JSON array sorted by URL and replaced atomically. A {@code site_file} record keyed
 * by file name holds its digest and entry count.</p>
 *
 * @since 0.1.0
 */
public final class SiteDataExportStage implements Stage {
  private static final Logger log = LoggerFactory.getLogger(SiteDataExportStage.class);
  public static final String NAME = "publish_site_data";
  public static final RecordVariant SITE_FILE = RecordVariant.of("site_file");
  static final String POSTINGS_FILE = "postings.json";

  private final StageDescriptor descriptor = StageDescriptor.builder(NAME)
      .dependsOn(PostingNormalizeStage.NAME)
      .version("1")
      .owns(SITE_FILE)
      .build();
  private final Path exportDir;
  private final JsonSupport json = JsonSupport.shared();

  public SiteDataExportStage(Path exportDir) {
    this.exportDir = Objects.requireNonNull(exportDir, "exportDir");
  }

  @Override
  public StageDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public StageResult run(StageCache cache, StoreTransaction store) {
    List<ContentRecord> postings = new ArrayList<>(store.query(RecordVariant.POSTING, record -> true));
    postings.sort(Comparator.comparing(ContentRecord::naturalKey));
    List<Object> rows = new ArrayList<>(postings.size());
    for (ContentRecord posting : postings) {
      rows.add(posting.attributes());
    }
    byte[] document = json.writePretty(rows);
    Path target = exportDir.resolve(POSTINGS_FILE);
    try {
      Files.createDirectories(exportDir);
      AtomicFiles.write(target, document);
    } catch (IOException ex) {
      return StageResult.failed(StageErrorKind.TRANSFORM, "cannot write " + target, ex);
    }
    Map<String, Object> file = new LinkedHashMap<>();
    file.put("path", target.toString());
    file.put("sha256", Fingerprints.ofBytes(document).hex());
    file.put("entries", postings.size());
    store.upsert(SITE_FILE, POSTINGS_FILE, file);
    log.info("Published {} postings to {}", postings.size(), target);
    return StageResult.ok(postings.size());
  }
}
