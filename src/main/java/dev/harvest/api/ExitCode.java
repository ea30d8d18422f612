package dev.harvest.api;

/**
 * Process exit codes returned by the CLI commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed; for {@code build} every stage ended usable. */
  SUCCESS(0),
  /** The build ran but at least one stage failed, was blocked or was cancelled. */
  BUILD_FAILED(1),
  INVALID_ARGS(2),
  IO_ERROR(3),
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
