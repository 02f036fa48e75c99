package de.example.monthy;

/**
 * Failure of a single {@link MonthyCompiler#compile} run. The run is aborted, no partial output is kept.
 */
public class CompileException extends RuntimeException {

  public enum Kind {
    /** {@code end} with no open block. */
    UNEXPECTED_END("UnexpectedEnd"),
    /** Input ended while blocks were still open. */
    MISSING_END("MissingEnd"),
    /** A keyword line that matched its prefix but broke the rule's constraints. */
    MALFORMED_LINE("MalformedLine");

    private final String label;

    Kind(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }
  }

  private final Kind kind;
  private final String reason;
  private final String filename;
  private final int lineNumber;

  public CompileException(Kind kind, String reason) {
    super(reason);
    this.kind = kind;
    this.reason = reason;
    this.filename = null;
    this.lineNumber = 0;
  }

  private CompileException(CompileException cause, String filename, int lineNumber) {
    super(cause.reason + " (at " + filename + ":" + lineNumber + ")", cause);
    this.kind = cause.kind;
    this.reason = cause.reason;
    this.filename = filename;
    this.lineNumber = lineNumber;
  }

  /** Same kind and reason, message decorated with {@code (at <filename>:<line>)}. */
  public CompileException at(String filename, int lineNumber) {
    return new CompileException(this, filename, lineNumber);
  }

  public Kind kind() {
    return kind;
  }

  /** Message without location. */
  public String reason() {
    return reason;
  }

  /** Filename label, or {@code null} when the failure is not tied to a line. */
  public String filename() {
    return filename;
  }

  /** 1-based line number, 0 when the failure is not tied to a line. */
  public int lineNumber() {
    return lineNumber;
  }
}
