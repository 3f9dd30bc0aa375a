package datadog.matchers;

import static java.util.Collections.unmodifiableList;

import datadog.matchers.MatchersConfig.EmptyCandidatesPolicy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, immutable list of values a container is checked against. Duplicates are kept and the
 * declared order is only used for rendering.
 *
 * @param <T> the candidate type
 */
public final class Candidates<T> implements Iterable<T> {
  private final List<T> values;
  private final String rendered;

  private Candidates(List<T> values) {
    this.values = values;
    this.rendered = render(values);
  }

  /**
   * @throws InvalidMatcherException if no candidate is given and the configured {@link
   *     EmptyCandidatesPolicy} is {@code reject}
   */
  @SafeVarargs
  public static <T> Candidates<T> of(T... values) {
    if (values == null) {
      throw new InvalidMatcherException("Candidates must not be null");
    }
    return copyOf(Arrays.asList(values), MatchersConfig.get());
  }

  public static <T> Candidates<T> copyOf(Collection<? extends T> values) {
    return copyOf(values, MatchersConfig.get());
  }

  public static <T> Candidates<T> copyOf(Collection<? extends T> values, MatchersConfig config) {
    if (values == null) {
      throw new InvalidMatcherException("Candidates must not be null");
    }
    if (values.isEmpty() && config.getEmptyCandidatesPolicy() == EmptyCandidatesPolicy.REJECT) {
      throw new InvalidMatcherException("oneOf requires at least one candidate");
    }
    return new Candidates<>(unmodifiableList(new ArrayList<T>(values)));
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public List<T> asList() {
    return values;
  }

  @Override
  public Iterator<T> iterator() {
    return values.iterator();
  }

  /** Renders the candidates as {@code "a", "b", "c"}, in declared order. */
  public String render() {
    return rendered;
  }

  private static String render(List<?> values) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(Prettifier.prettify(values.get(i)));
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Candidates && values.equals(((Candidates<?>) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "(" + rendered + ")";
  }
}
