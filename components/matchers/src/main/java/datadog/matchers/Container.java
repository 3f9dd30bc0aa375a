package datadog.matchers;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Holder of zero or one value. A container is either {@link #empty() empty} or {@link #of present}
 * and never changes after construction.
 *
 * <p>The display form is {@code None} for the empty container and {@code Some(<value>)} for a
 * present one, the value being rendered by {@link Prettifier}.
 *
 * @param <T> the value type
 */
public abstract class Container<T> {
  private static final Container<?> EMPTY = new Empty<>();

  private Container() {}

  @SuppressWarnings("unchecked")
  public static <T> Container<T> empty() {
    return (Container<T>) EMPTY;
  }

  /**
   * Creates a present container.
   *
   * @param value the held value, must not be {@code null}
   * @return a container holding {@code value}
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public static <T> Container<T> of(T value) {
    return new Present<>(Objects.requireNonNull(value, "value"));
  }

  /** Creates a present container, or the empty one when {@code value} is {@code null}. */
  public static <T> Container<T> ofNullable(@Nullable T value) {
    return value == null ? empty() : new Present<>(value);
  }

  public static <T> Container<T> fromOptional(Optional<T> optional) {
    return optional.isPresent() ? new Present<>(optional.get()) : empty();
  }

  public abstract boolean isPresent();

  public final boolean isEmpty() {
    return !isPresent();
  }

  /**
   * @return the held value
   * @throws NoSuchElementException if the container is empty
   */
  public abstract T get();

  public abstract Optional<T> toOptional();

  static final class Empty<T> extends Container<T> {
    @Override
    public boolean isPresent() {
      return false;
    }

    @Override
    public T get() {
      throw new NoSuchElementException("None.get");
    }

    @Override
    public Optional<T> toOptional() {
      return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Empty;
    }

    @Override
    public int hashCode() {
      return 0;
    }

    @Override
    public String toString() {
      return "None";
    }
  }

  static final class Present<T> extends Container<T> {
    private final T value;

    Present(T value) {
      this.value = value;
    }

    @Override
    public boolean isPresent() {
      return true;
    }

    @Override
    public T get() {
      return value;
    }

    @Override
    public Optional<T> toOptional() {
      return Optional.of(value);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof Present)) {
        return false;
      }
      return Objects.equals(value, ((Present<?>) o).value);
    }

    @Override
    public int hashCode() {
      return 31 + value.hashCode();
    }

    @Override
    public String toString() {
      return "Some(" + Prettifier.prettify(value) + ")";
    }
  }
}
