package datadog.matchers;

import java.util.Arrays;
import java.util.Objects;

public final class Equalities {
  private static final Equality<Object> DEFAULT = new DefaultEquality();

  private Equalities() {}

  /**
   * Structural equality: {@link Objects#equals(Object, Object)}, comparing arrays element by
   * element.
   */
  @SuppressWarnings("unchecked")
  public static <T> Equality<T> defaultEquality() {
    return (Equality<T>) DEFAULT;
  }

  /** Normalizes both operands through {@code normalizations}, then applies the default equality. */
  @SafeVarargs
  public static <T> Equality<T> afterBeing(Normalization<T>... normalizations) {
    return afterBeing(Equalities.<T>defaultEquality(), normalizations);
  }

  /**
   * Builds an equality that normalizes both operands through {@code normalizations}, in order,
   * before delegating to {@code base}.
   *
   * @throws InvalidMatcherException if no normalization is given
   */
  @SafeVarargs
  public static <T> Equality<T> afterBeing(
      Equality<? super T> base, Normalization<T>... normalizations) {
    Objects.requireNonNull(base, "base");
    if (normalizations == null || normalizations.length == 0) {
      throw new InvalidMatcherException("At least one normalization is required");
    }
    Normalization<T> composed = normalizations[0];
    for (int i = 1; i < normalizations.length; i++) {
      composed = composed.and(normalizations[i]);
    }
    return new NormalizingEquality<>(base, composed);
  }

  static final class DefaultEquality implements Equality<Object> {
    @Override
    public boolean areEqual(Object a, Object candidate) {
      if (a != null
          && candidate != null
          && a.getClass().isArray()
          && candidate.getClass().isArray()) {
        return Arrays.deepEquals(new Object[] {a}, new Object[] {candidate});
      }
      return Objects.equals(a, candidate);
    }

    @Override
    public String toString() {
      return "defaultEquality";
    }
  }

  static final class NormalizingEquality<T> implements Equality<T> {
    private final Equality<? super T> base;
    private final Normalization<T> normalization;

    NormalizingEquality(Equality<? super T> base, Normalization<T> normalization) {
      this.base = base;
      this.normalization = normalization;
    }

    @Override
    public boolean areEqual(T a, Object candidate) {
      return base.areEqual(normalization.normalized(a), normalization.normalizedOrSame(candidate));
    }

    @Override
    public String toString() {
      return base + " after being " + normalization;
    }
  }
}
