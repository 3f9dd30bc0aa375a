package datadog.matchers;

/**
 * Reusable predicate over a {@link Container}, producing a {@link MatchOutcome}.
 *
 * @param <T> the container value type
 * @see ContainerMatchers
 */
public interface ContainerMatcher<T> {
  MatchOutcome apply(Container<T> container);

  /** Returns a matcher with the opposite polarity */
  ContainerMatcher<T> not();

  /** Returns a matcher that uses {@code equality} instead of its current equality */
  ContainerMatcher<T> decidedBy(Equality<? super T> equality);
}
