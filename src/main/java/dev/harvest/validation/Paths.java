package dev.harvest.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Filesystem checks for directories the tool writes to (data, cache, export, history).
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {}

  /**
   * Normalizes a directory path and checks that it is, or can become, a writable directory.
   *
   * @param name setting name used in messages
   * @param path directory path
   * @param createIfMissing create the directory (and parents) when absent
   * @return absolute, normalized path
   * @throws IllegalArgumentException when the path is malformed, not a directory or not writable
   */
  public static Path validateWritableDir(String name, Path path, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          Path parent = nearestExistingAncestor(normalized);
          if (!Files.isWritable(parent)) {
            throw new IllegalArgumentException(name + " cannot be created under " + parent);
          }
          return normalized;
        }
        Files.createDirectories(normalized);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException(name + " is not writable: " + normalized);
    }
    return normalized;
  }

  private static Path nearestExistingAncestor(Path start) {
    Path current = start.getParent();
    while (current != null && !Files.exists(current)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current;
  }
}
