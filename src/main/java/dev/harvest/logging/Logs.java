package dev.harvest.logging;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep log lines and build reports bounded and free of secrets.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate error details to a UTF-8 byte budget.</li>
 *   <li>Strip credentials and query strings from source URLs before they are logged.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {}

  /**
   * Truncates a string to at most {@code maxBytes} UTF-8 bytes, noting the original length.
   *
   * @param value text; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the original value when it fits, otherwise a shortened copy with a suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer kept = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return kept + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  /**
   * Returns a URL safe to log: scheme, host, port and path only.
   *
   * @param url source URL
   * @return redacted form, or {@code "<invalid url>"} when it cannot be parsed
   */
  public static String safeUrl(String url) {
    if (url == null) {
      return NULL_PLACEHOLDER;
    }
    try {
      URI uri = new URI(url);
      if (uri.getHost() == null) {
        return uri.getScheme() == null ? "<invalid url>" : uri.getScheme() + ":...";
      }
      String port = uri.getPort() < 0 ? "" : ":" + uri.getPort();
      String path = uri.getRawPath() == null ? "" : uri.getRawPath();
      String suffix = uri.getRawQuery() == null ? "" : "?...";
      return uri.getScheme() + "://" + uri.getHost() + port + path + suffix;
    } catch (URISyntaxException ex) {
      return "<invalid url>";
    }
  }
}
