package datadog.matchers;

import java.lang.reflect.Array;
import java.util.Iterator;
import javax.annotation.Nullable;

/** Renders values the way they appear in failure messages. */
public final class Prettifier {
  private Prettifier() {}

  public static String prettify(@Nullable Object value) {
    StringBuilder sb = new StringBuilder();
    append(sb, value, Integer.MAX_VALUE);
    return sb.toString();
  }

  /**
   * Renders an {@link Iterable} as {@code [e1, e2, ...]}, prettifying each element.
   *
   * @param maxElements number of elements rendered before the rest is elided with {@code ...}
   */
  public static String prettifyAll(Iterable<?> values, int maxElements) {
    StringBuilder sb = new StringBuilder();
    appendAll(sb, values.iterator(), maxElements);
    return sb.toString();
  }

  static void append(StringBuilder sb, @Nullable Object value, int maxElements) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof String) {
      sb.append('"').append((String) value).append('"');
    } else if (value instanceof Character) {
      sb.append('\'').append((char) (Character) value).append('\'');
    } else if (value instanceof Iterable) {
      appendAll(sb, ((Iterable<?>) value).iterator(), maxElements);
    } else if (value.getClass().isArray()) {
      sb.append("Array(");
      int length = Array.getLength(value);
      for (int i = 0; i < length; i++) {
        if (i > 0) {
          sb.append(", ");
        }
        append(sb, Array.get(value, i), maxElements);
      }
      sb.append(')');
    } else {
      // Container renders its own value through prettify
      sb.append(value);
    }
  }

  private static void appendAll(StringBuilder sb, Iterator<?> it, int maxElements) {
    sb.append('[');
    int count = 0;
    while (it.hasNext()) {
      if (count > 0) {
        sb.append(", ");
      }
      if (count == maxElements) {
        sb.append("...");
        break;
      }
      append(sb, it.next(), maxElements);
      count++;
    }
    sb.append(']');
  }
}
