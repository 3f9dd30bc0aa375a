package datadog.matchers;

import java.util.Objects;

public final class ContainerMatchers {
  private ContainerMatchers() {}

  /**
   * Matches a container holding a value equal to one of {@code candidates}, under the default
   * equality.
   */
  @SafeVarargs
  public static <T> ContainerMatcher<T> containOneOf(T... candidates) {
    return containOneOf(Candidates.of(candidates));
  }

  public static <T> ContainerMatcher<T> containOneOf(Candidates<? extends T> candidates) {
    return new ContainOneOfMatcher<T>(
        Objects.requireNonNull(candidates, "candidates"),
        Equalities.defaultEquality(),
        Polarity.POSITIVE);
  }

  /** Matches a container for which {@code matcher} does not match. */
  public static <T> ContainerMatcher<T> not(ContainerMatcher<T> matcher) {
    return matcher.not();
  }

  static final class ContainOneOfMatcher<T> implements ContainerMatcher<T> {
    private final Candidates<? extends T> candidates;
    private final Equality<? super T> equality;
    private final Polarity polarity;

    ContainOneOfMatcher(
        Candidates<? extends T> candidates, Equality<? super T> equality, Polarity polarity) {
      this.candidates = candidates;
      this.equality = equality;
      this.polarity = polarity;
    }

    @Override
    public MatchOutcome apply(Container<T> container) {
      return ContainOneOf.evaluate(container, candidates, equality, polarity);
    }

    @Override
    public ContainerMatcher<T> not() {
      return new ContainOneOfMatcher<>(candidates, equality, polarity.flip());
    }

    @Override
    public ContainerMatcher<T> decidedBy(Equality<? super T> equality) {
      return new ContainOneOfMatcher<>(
          candidates, Objects.requireNonNull(equality, "equality"), polarity);
    }

    @Override
    public String toString() {
      return (polarity == Polarity.NEGATED ? "not contain oneOf " : "contain oneOf ") + candidates;
    }
  }
}
