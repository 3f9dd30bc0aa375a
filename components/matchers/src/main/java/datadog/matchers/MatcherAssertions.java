package datadog.matchers;

import java.util.Objects;
import java.util.Optional;

/** Entry points of the assertion API. */
public final class MatcherAssertions {
  private MatcherAssertions() {}

  public static <T> ContainerAssert<T> assertThat(Container<T> actual) {
    return new ContainerAssert<>(actual, null);
  }

  public static <T> ContainerAssert<T> assertThat(Optional<T> actual) {
    return new ContainerAssert<>(
        Container.fromOptional(Objects.requireNonNull(actual, "actual")), null);
  }

  /**
   * Returns assertions that all use {@code equality} unless told otherwise, for suites that compare
   * many values the same way.
   */
  public static <T> EqualityScope<T> withEquality(Equality<? super T> equality) {
    return new EqualityScope<>(Objects.requireNonNull(equality, "equality"));
  }

  public static final class EqualityScope<T> {
    private final Equality<? super T> equality;

    EqualityScope(Equality<? super T> equality) {
      this.equality = equality;
    }

    public ContainerAssert<T> assertThat(Container<T> actual) {
      return new ContainerAssert<>(actual, equality);
    }

    public ContainerAssert<T> assertThat(Optional<T> actual) {
      return new ContainerAssert<>(
          Container.fromOptional(Objects.requireNonNull(actual, "actual")), equality);
    }
  }
}
