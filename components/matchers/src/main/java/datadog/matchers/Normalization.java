package datadog.matchers;

/**
 * Pure unary transform applied to both operands before an equality is consulted.
 *
 * @param <T> the type this normalization applies to
 * @see StringNormalizations
 * @see Equalities#afterBeing(Equality, Normalization[])
 */
public interface Normalization<T> {
  T normalized(T value);

  /** Indicates whether {@code candidate} is of a type this normalization can be applied to */
  boolean canNormalize(Object candidate);

  @SuppressWarnings("unchecked")
  default Object normalizedOrSame(Object candidate) {
    return canNormalize(candidate) ? normalized((T) candidate) : candidate;
  }

  /** Returns a normalization applying this one first, then {@code next}. */
  default Normalization<T> and(Normalization<T> next) {
    Normalization<T> first = this;
    return new Normalization<T>() {
      @Override
      public T normalized(T value) {
        return next.normalized(first.normalized(value));
      }

      @Override
      public boolean canNormalize(Object candidate) {
        return first.canNormalize(candidate);
      }

      @Override
      public String toString() {
        return first + " and " + next;
      }
    };
  }
}
