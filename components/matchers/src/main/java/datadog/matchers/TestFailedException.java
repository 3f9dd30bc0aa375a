package datadog.matchers;

import javax.annotation.Nullable;

/**
 * Raised when an assertion does not hold. Carries the position of the code that made the failing
 * assertion, when it could be determined.
 */
public class TestFailedException extends AssertionError {
  private static final long serialVersionUID = 1L;

  @Nullable private final transient MatchOutcome outcome;
  @Nullable private final StackTraceElement position;

  public TestFailedException(
      String message, @Nullable MatchOutcome outcome, @Nullable StackTraceElement position) {
    super(message);
    this.outcome = outcome;
    this.position = position;
  }

  public TestFailedException(
      String message, Throwable cause, @Nullable StackTraceElement position) {
    super(message, cause);
    this.outcome = null;
    this.position = position;
  }

  /** The outcome that failed the assertion, {@code null} for inspection failures */
  public @Nullable MatchOutcome outcome() {
    return outcome;
  }

  public @Nullable String failedCodeFileName() {
    return position == null ? null : position.getFileName();
  }

  /** Line of the failing assertion, {@code -1} if unknown */
  public int failedCodeLineNumber() {
    return position == null ? -1 : position.getLineNumber();
  }

  /** {@code <file>:<line>}, or {@code null} if the position is unknown */
  public @Nullable String failedCodeLocation() {
    String fileName = failedCodeFileName();
    return fileName == null ? null : fileName + ":" + failedCodeLineNumber();
  }
}
