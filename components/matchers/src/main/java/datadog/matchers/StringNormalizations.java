package datadog.matchers;

import java.util.Locale;

public final class StringNormalizations {
  private static final Normalization<String> LOWER_CASED =
      new StringNormalization("lowerCased") {
        @Override
        public String normalized(String value) {
          return value.toLowerCase(Locale.ROOT);
        }
      };

  private static final Normalization<String> UPPER_CASED =
      new StringNormalization("upperCased") {
        @Override
        public String normalized(String value) {
          return value.toUpperCase(Locale.ROOT);
        }
      };

  private static final Normalization<String> TRIMMED =
      new StringNormalization("trimmed") {
        @Override
        public String normalized(String value) {
          return value.trim();
        }
      };

  private StringNormalizations() {}

  public static Normalization<String> lowerCased() {
    return LOWER_CASED;
  }

  public static Normalization<String> upperCased() {
    return UPPER_CASED;
  }

  public static Normalization<String> trimmed() {
    return TRIMMED;
  }

  abstract static class StringNormalization implements Normalization<String> {
    private final String name;

    StringNormalization(String name) {
      this.name = name;
    }

    @Override
    public boolean canNormalize(Object candidate) {
      return candidate instanceof String;
    }

    @Override
    public String toString() {
      return name;
    }
  }
}
