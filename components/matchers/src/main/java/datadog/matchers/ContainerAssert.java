package datadog.matchers;

import java.util.Objects;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fluent assertions over a {@link Container}. Instances are immutable: {@link #decidedBy} and
 * {@link #afterBeing} return new assertions.
 *
 * <pre>{@code
 * assertThat(fumSome).containsOneOf("fee", "fie", "foe", "fum");
 * assertThat(toSome).doesNotContainOneOf("happy", "birthday", "to", "you");
 * assertThat(fumSome).afterBeing(lowerCased(), trimmed()).containsOneOf(" FEE ", " FUM ");
 * }</pre>
 *
 * @param <T> the container value type
 * @see MatcherAssertions
 */
public final class ContainerAssert<T> {
  private static final Logger log = LoggerFactory.getLogger(ContainerAssert.class);

  private final Container<T> actual;
  // null when the default equality applies
  @Nullable private final Equality<? super T> equality;

  ContainerAssert(Container<T> actual, @Nullable Equality<? super T> equality) {
    this.actual = Objects.requireNonNull(actual, "actual");
    this.equality = equality;
  }

  /** Uses {@code equality} instead of the current one for the assertions that follow. */
  public ContainerAssert<T> decidedBy(Equality<? super T> equality) {
    return new ContainerAssert<>(actual, Objects.requireNonNull(equality, "equality"));
  }

  /**
   * Normalizes both operands with {@code normalizations} before applying the current equality (the
   * default one unless {@link #decidedBy} was called).
   */
  @SafeVarargs
  public final ContainerAssert<T> afterBeing(Normalization<T>... normalizations) {
    return new ContainerAssert<>(
        actual, Equalities.afterBeing(effectiveEquality(), normalizations));
  }

  /**
   * Asserts that the container holds a value equal to at least one of {@code candidates}.
   *
   * @throws TestFailedException with message {@code <container> did not contain one of
   *     (<candidates>)} otherwise
   * @throws InvalidMatcherException if {@code candidates} is rejected
   */
  @SafeVarargs
  public final ContainerAssert<T> containsOneOf(T... candidates) {
    return check(
        ContainOneOf.evaluate(
            actual, Candidates.of(candidates), effectiveEquality(), Polarity.POSITIVE));
  }

  /**
   * Asserts that the container does not hold a value equal to any of {@code candidates}.
   *
   * @throws TestFailedException with message {@code <container> contained one of (<candidates>)}
   *     otherwise
   * @throws InvalidMatcherException if {@code candidates} is rejected
   */
  @SafeVarargs
  public final ContainerAssert<T> doesNotContainOneOf(T... candidates) {
    return check(
        ContainOneOf.evaluate(
            actual, Candidates.of(candidates), effectiveEquality(), Polarity.NEGATED));
  }

  /**
   * Asserts that {@code matcher} succeeds. An equality set on this assertion overrides the one of
   * the matcher.
   */
  public ContainerAssert<T> should(ContainerMatcher<T> matcher) {
    ContainerMatcher<T> effective = equality == null ? matcher : matcher.decidedBy(equality);
    return check(effective.apply(actual));
  }

  public ContainerAssert<T> shouldNot(ContainerMatcher<T> matcher) {
    return should(matcher.not());
  }

  public Container<T> actual() {
    return actual;
  }

  private Equality<? super T> effectiveEquality() {
    return equality == null ? Equalities.<T>defaultEquality() : equality;
  }

  private ContainerAssert<T> check(MatchOutcome outcome) {
    if (!outcome.succeeded()) {
      StackTraceElement position = SourcePosition.current();
      String message = outcome.failureMessage();
      log.debug("Assertion failed at {}: {}", position, message);
      throw new TestFailedException(message, outcome, position);
    }
    return this;
  }
}
