package dev.harvest.infrastructure.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * File helpers that never expose half-written files to readers.
 *
 * <p>Content is written to a sibling temporary file, forced to disk and moved into place with
 * {@link StandardCopyOption#ATOMIC_MOVE}. Filesystems without atomic rename fall back to a replacing
 * move.</p>
 *
 * @since 0.1.0
 */
public final class AtomicFiles {
  private AtomicFiles() {
    // Utility
  }

  /**
   * Atomically replaces {@code target} with {@code content}.
   *
   * @param target destination file; parent directories are created
   * @param content bytes to write
   * @throws IOException when writing or moving fails; {@code target} is then left untouched
   */
  public static void write(Path target, byte[] content) throws IOException {
    Path temp = writeSibling(target, content, ".tmp");
    try {
      move(temp, target);
    } catch (IOException ex) {
      Files.deleteIfExists(temp);
      throw ex;
    }
  }

  /**
   * Writes {@code content} durably to {@code target} without any rename, replacing existing content.
   * Used for staging files whose final move happens later.
   *
   * @param target file to write
   * @param content bytes
   * @throws IOException when the write fails
   */
  public static void writeDurably(Path target, byte[] content) throws IOException {
    Objects.requireNonNull(target, "target");
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (FileChannel channel = FileChannel.open(
        target,
        StandardOpenOption.CREATE,
        StandardOpenOption.WRITE,
        StandardOpenOption.TRUNCATE_EXISTING)) {
      ByteBuffer buffer = ByteBuffer.wrap(content);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    }
  }

  /**
   * Moves {@code source} over {@code target}, atomically when the filesystem supports it.
   *
   * @param source existing file
   * @param target destination
   * @throws IOException when the move fails
   */
  public static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static Path writeSibling(Path target, byte[] content, String suffix) throws IOException {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(content, "content");
    Path parent = target.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    Path temp = Files.createTempFile(parent, target.getFileName().toString() + ".", suffix);
    try {
      writeDurably(temp, content);
    } catch (IOException ex) {
      Files.deleteIfExists(temp);
      throw ex;
    }
    return temp;
  }
}
