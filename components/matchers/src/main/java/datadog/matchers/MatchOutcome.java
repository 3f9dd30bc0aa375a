package datadog.matchers;

/** Result of evaluating a container against a list of candidates. */
public final class MatchOutcome {
  static final String DID_NOT_CONTAIN_ONE_OF = "%s did not contain one of (%s)";
  static final String CONTAINED_ONE_OF = "%s contained one of (%s)";

  private final boolean matched;
  private final Polarity polarity;
  private final String containerRepr;
  private final String candidatesRepr;

  MatchOutcome(boolean matched, Polarity polarity, String containerRepr, String candidatesRepr) {
    this.matched = matched;
    this.polarity = polarity;
    this.containerRepr = containerRepr;
    this.candidatesRepr = candidatesRepr;
  }

  /** Whether the container held a value equal to one of the candidates */
  public boolean matched() {
    return matched;
  }

  public Polarity polarity() {
    return polarity;
  }

  public boolean negated() {
    return polarity == Polarity.NEGATED;
  }

  /** Whether the outcome is the one expected by the polarity */
  public boolean succeeded() {
    return matched != negated();
  }

  public String containerRepr() {
    return containerRepr;
  }

  public String candidatesRepr() {
    return candidatesRepr;
  }

  /**
   * Message describing why an assertion of this polarity fails: {@code <container> did not contain
   * one of (<candidates>)} when positive, {@code <container> contained one of (<candidates>)} when
   * negated. Only meaningful if {@link #succeeded()} is {@code false}.
   */
  public String failureMessage() {
    return String.format(
        negated() ? CONTAINED_ONE_OF : DID_NOT_CONTAIN_ONE_OF, containerRepr, candidatesRepr);
  }

  /** Same inputs, opposite polarity. */
  public MatchOutcome negate() {
    return new MatchOutcome(matched, polarity.flip(), containerRepr, candidatesRepr);
  }

  @Override
  public String toString() {
    return "MatchOutcome{"
        + "matched="
        + matched
        + ", polarity="
        + polarity
        + ", container="
        + containerRepr
        + ", candidates=("
        + candidatesRepr
        + ")}";
  }
}
