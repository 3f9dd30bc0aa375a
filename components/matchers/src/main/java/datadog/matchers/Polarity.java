package datadog.matchers;

/** Whether an assertion expects containment or the absence of containment. */
public enum Polarity {
  POSITIVE,
  NEGATED;

  public Polarity flip() {
    return this == POSITIVE ? NEGATED : POSITIVE;
  }
}
