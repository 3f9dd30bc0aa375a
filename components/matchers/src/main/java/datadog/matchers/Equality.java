package datadog.matchers;

/**
 * Equality relation used to compare a container's value with a candidate.
 *
 * <p>Implementations must be stateless and free of side effects: a single instance may be shared
 * by concurrent evaluations and may be invoked any number of times per evaluation.
 *
 * @param <T> the type of the left-hand side
 * @see Equalities
 */
@FunctionalInterface
public interface Equality<T> {
  boolean areEqual(T a, Object candidate);
}
