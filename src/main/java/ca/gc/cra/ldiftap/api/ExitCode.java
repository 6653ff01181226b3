package ca.gc.cra.ldiftap.api;

/**
 * Process exit codes returned by the {@code ldif-tap} commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run completed; lenient runs may still report abandoned files. */
  SUCCESS(0),
  /** Invalid arguments or configuration. */
  INVALID_ARGS(2),
  /** Input or output could not be read or written. */
  IO_ERROR(3),
  /** Malformed LDIF in strict mode, or another unexpected failure. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
