package dev.harvest.application.cache;

import dev.harvest.application.json.JsonSupport;
import dev.harvest.domain.cache.FetchRequest;
import dev.harvest.domain.cache.Fingerprint;
import dev.harvest.domain.content.ContentRecord;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * SHA-256 fingerprints over canonical JSON.
 *
 * <p>Every fingerprint hashes a key-sorted compact JSON document so that map ordering never changes
 * the digest. The {@code kind} member keeps request keys, input digests and output digests in
 * disjoint spaces.</p>
 *
 * @since 0.1.0
 */
public final class Fingerprints {
  private static final HexFormat HEX = HexFormat.of();
  private static final Comparator<ContentRecord> RECORD_ORDER =
      Comparator.comparing(ContentRecord::variant).thenComparing(ContentRecord::naturalKey);

  private Fingerprints() {
    // Utility
  }

  /**
   * Cache key of an external request made by a stage. A new stage version yields new keys.
   *
   * @param stage stage name
   * @param version stage version
   * @param request request target and parameters
   * @return request fingerprint
   */
  public static Fingerprint forRequest(String stage, String version, FetchRequest request) {
    Objects.requireNonNull(request, "request");
    Map<String, Object> document = new TreeMap<>();
    document.put("kind", "fetch");
    document.put("stage", Objects.requireNonNull(stage, "stage"));
    document.put("version", Objects.requireNonNull(version, "version"));
    document.put("target", request.target());
    document.put("parameters", request.parameters());
    return digest(document);
  }

  /**
   * Digest of everything a stage's output depends on besides external sources: its identity,
   * version and the current output fingerprint of each upstream stage.
   *
   * @param stage stage name
   * @param version stage version
   * @param upstreamOutputs upstream stage name to its output fingerprint
   * @return input fingerprint
   */
  public static Fingerprint forInputs(String stage, String version, Map<String, Fingerprint> upstreamOutputs) {
    Map<String, Object> upstream = new TreeMap<>();
    upstreamOutputs.forEach((name, fingerprint) -> upstream.put(name, fingerprint.hex()));
    Map<String, Object> document = new TreeMap<>();
    document.put("kind", "input");
    document.put("stage", stage);
    document.put("version", version);
    document.put("upstream", upstream);
    return digest(document);
  }

  /**
   * Digest of record contents (variant, key and attributes). Last-seen metadata is excluded so that
   * re-affirming identical data yields the same fingerprint.
   *
   * @param records records in any order
   * @return output fingerprint
   */
  public static Fingerprint forRecords(Collection<ContentRecord> records) {
    List<ContentRecord> sorted = new ArrayList<>(records);
    sorted.sort(RECORD_ORDER);
    List<Object> rows = new ArrayList<>(sorted.size());
    for (ContentRecord record : sorted) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("attributes", record.attributes());
      row.put("key", record.naturalKey());
      row.put("variant", record.variant().name());
      rows.add(row);
    }
    Map<String, Object> document = new TreeMap<>();
    document.put("kind", "output");
    document.put("records", rows);
    return digest(document);
  }

  /**
   * Digest of raw bytes.
   *
   * @param bytes content
   * @return fingerprint
   */
  public static Fingerprint ofBytes(byte[] bytes) {
    return new Fingerprint(HEX.formatHex(sha256().digest(bytes)));
  }

  private static Fingerprint digest(Object document) {
    String canonical = JsonSupport.shared().writeCanonical(document);
    return ofBytes(canonical.getBytes(StandardCharsets.UTF_8));
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
