package datadog.matchers;

import java.util.Objects;

/** Decides whether a container holds a value equal to at least one candidate. */
public final class ContainOneOf {
  private ContainOneOf() {}

  public static <T> MatchOutcome evaluate(
      Container<T> container, Candidates<? extends T> candidates, Equality<? super T> equality) {
    return evaluate(container, candidates, equality, Polarity.POSITIVE);
  }

  /**
   * Evaluates {@code container} against {@code candidates}.
   *
   * <p>An empty container never matches and {@code equality} is not consulted. Otherwise
   * candidates are scanned in order until {@code equality} accepts one. Exceptions thrown by
   * {@code equality} are propagated as is.
   */
  public static <T> MatchOutcome evaluate(
      Container<T> container,
      Candidates<? extends T> candidates,
      Equality<? super T> equality,
      Polarity polarity) {
    Objects.requireNonNull(container, "container");
    Objects.requireNonNull(candidates, "candidates");
    Objects.requireNonNull(equality, "equality");
    Objects.requireNonNull(polarity, "polarity");
    return new MatchOutcome(
        matches(container, candidates, equality),
        polarity,
        container.toString(),
        candidates.render());
  }

  static <T> boolean matches(
      Container<T> container, Iterable<?> candidates, Equality<? super T> equality) {
    if (container.isEmpty()) {
      return false;
    }
    T value = container.get();
    for (Object candidate : candidates) {
      if (equality.areEqual(value, candidate)) {
        return true;
      }
    }
    return false;
  }
}
