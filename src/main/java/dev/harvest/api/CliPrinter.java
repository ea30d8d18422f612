package dev.harvest.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes build reports, history listings and usage text to stdout.
 *
 * <p>Output goes through the stdout file descriptor rather than {@code System.out}, so report lines
 * stay separate from log output on stderr and tests can capture them.</p>
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints one line of report or usage text.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a formatted report, one entry per line, and flushes once at the end.
   *
   * @param lines report lines; {@code null} prints nothing
   */
  public static void printLines(List<String> lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  /**
   * Redirects CLI output, used by command tests to capture reports.
   *
   * @param writer capturing writer
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  /** Restores stdout after {@link #setWriterForTesting(PrintWriter)}. */
  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
