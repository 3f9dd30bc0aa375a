package datadog.matchers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an assertion block against each element of a collection and checks how many elements
 * satisfied it.
 *
 * <pre>{@code
 * forAll(somes, x -> assertThat(x).containsOneOf(1));
 * forAtLeast(2, somes, x -> assertThat(x).containsOneOf(1));
 * forNo(nones, x -> assertThat(x).containsOneOf(1));
 * }</pre>
 *
 * <p>Only a {@link TestFailedException} thrown by the block marks an element as not satisfying it;
 * any other exception aborts the inspection.
 */
public final class Inspectors {
  private static final Logger log = LoggerFactory.getLogger(Inspectors.class);

  private Inspectors() {}

  public static <E> void forAll(Collection<E> xs, Consumer<? super E> block) {
    check(xs, block);
    int index = 0;
    for (E x : xs) {
      try {
        block.accept(x);
      } catch (TestFailedException e) {
        throw failure(
            "'all' inspection failed, because: \n  at index "
                + index
                + ", "
                + e.getMessage()
                + location(e)
                + " \nin "
                + render(xs),
            e);
      }
      index++;
    }
  }

  public static <E> void forAtLeast(int min, Collection<E> xs, Consumer<? super E> block) {
    checkBound("atLeast", min);
    check(xs, block);
    int passed = 0;
    for (E x : xs) {
      if (passes(x, block) && ++passed == min) {
        return;
      }
    }
    throw failure(
        "'atLeast("
            + min
            + ")' inspection failed, because only "
            + elements(passed)
            + " satisfied the assertion block in "
            + render(xs),
        null);
  }

  public static <E> void forAtMost(int max, Collection<E> xs, Consumer<? super E> block) {
    checkBound("atMost", max);
    check(xs, block);
    List<Integer> passedIndexes = new ArrayList<>();
    int index = 0;
    for (E x : xs) {
      if (passes(x, block)) {
        passedIndexes.add(index);
        if (passedIndexes.size() > max) {
          throw failure(
              "'atMost("
                  + max
                  + ")' inspection failed, because "
                  + elements(passedIndexes.size())
                  + " satisfied the assertion block at index "
                  + renderIndexes(passedIndexes)
                  + " in "
                  + render(xs),
              null);
        }
      }
      index++;
    }
  }

  public static <E> void forExactly(int count, Collection<E> xs, Consumer<? super E> block) {
    checkBound("exactly", count);
    check(xs, block);
    int passed = 0;
    for (E x : xs) {
      if (passes(x, block)) {
        passed++;
      }
    }
    if (passed != count) {
      throw failure(
          "'exactly("
              + count
              + ")' inspection failed, because "
              + elements(passed)
              + " satisfied the assertion block in "
              + render(xs),
          null);
    }
  }

  public static <E> void forNo(Collection<E> xs, Consumer<? super E> block) {
    check(xs, block);
    int index = 0;
    for (E x : xs) {
      if (passes(x, block)) {
        throw failure(
            "'no' inspection failed, because: \n  at index "
                + index
                + ", the assertion block passed for "
                + Prettifier.prettify(x)
                + " \nin "
                + render(xs),
            null);
      }
      index++;
    }
  }

  private static <E> boolean passes(E x, Consumer<? super E> block) {
    try {
      block.accept(x);
      return true;
    } catch (TestFailedException e) {
      return false;
    }
  }

  private static void check(Collection<?> xs, Consumer<?> block) {
    Objects.requireNonNull(xs, "xs");
    Objects.requireNonNull(block, "block");
  }

  private static void checkBound(String inspection, int bound) {
    if (bound < 1) {
      throw new InvalidMatcherException(
          "'" + inspection + "' requires a positive bound, got " + bound);
    }
  }

  private static TestFailedException failure(
      String message, @Nullable TestFailedException cause) {
    StackTraceElement position = SourcePosition.current();
    log.debug("Inspection failed at {}: {}", position, message);
    return cause == null
        ? new TestFailedException(message, (MatchOutcome) null, position)
        : new TestFailedException(message, cause, position);
  }

  private static String location(TestFailedException e) {
    String location = e.failedCodeLocation();
    return location == null ? "" : " (" + location + ")";
  }

  private static String render(Collection<?> xs) {
    return Prettifier.prettifyAll(xs, MatchersConfig.get().getInspectorMaxRenderedElements());
  }

  static String elements(int count) {
    return count == 1 ? "1 element" : count + " elements";
  }

  static String renderIndexes(List<Integer> indexes) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < indexes.size(); i++) {
      if (i > 0) {
        sb.append(i == indexes.size() - 1 ? " and " : ", ");
      }
      sb.append(indexes.get(i));
    }
    return sb.toString();
  }
}
