package datadog.matchers;

/** Exception raised when a matcher or an inspection is configured with invalid arguments */
public class InvalidMatcherException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidMatcherException(String message) {
    super(message);
  }
}
