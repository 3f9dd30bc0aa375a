package datadog.matchers;

import java.util.Locale;
import java.util.function.Function;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of the matchers library.
 *
 * <p>Each setting is looked up as the system property {@code dd.matchers.<key>}, then as the
 * environment variable {@code DD_MATCHERS_<KEY>} (upper-cased, dots and dashes replaced by
 * underscores), then falls back to its default. Lookups that are denied by a security manager are
 * treated as missing.
 */
public final class MatchersConfig {
  private static final Logger log = LoggerFactory.getLogger(MatchersConfig.class);

  static final String PROPERTY_PREFIX = "dd.matchers.";
  static final String ENV_PREFIX = "DD_MATCHERS_";

  static final String EMPTY_CANDIDATES = "oneof.empty.candidates";
  static final String INSPECTOR_MAX_RENDERED_ELEMENTS = "inspector.max.rendered.elements";

  static final int DEFAULT_INSPECTOR_MAX_RENDERED_ELEMENTS = 32;

  /** What to do with a candidate list that holds no candidate */
  public enum EmptyCandidatesPolicy {
    /** Reject the list with an {@link InvalidMatcherException} */
    REJECT("reject"),
    /** Accept the list; it never matches any container */
    NEVER_MATCH("never-match");

    private final String value;

    EmptyCandidatesPolicy(String value) {
      this.value = value;
    }

    static @Nullable EmptyCandidatesPolicy parse(String value) {
      for (EmptyCandidatesPolicy policy : values()) {
        if (policy.value.equalsIgnoreCase(value.trim())) {
          return policy;
        }
      }
      return null;
    }

    @Override
    public String toString() {
      return value;
    }
  }

  private static final class Holder {
    static final MatchersConfig INSTANCE =
        from(MatchersConfig::systemProperty, MatchersConfig::environmentVariable);
  }

  private final EmptyCandidatesPolicy emptyCandidatesPolicy;
  private final int inspectorMaxRenderedElements;

  MatchersConfig(EmptyCandidatesPolicy emptyCandidatesPolicy, int inspectorMaxRenderedElements) {
    this.emptyCandidatesPolicy = emptyCandidatesPolicy;
    this.inspectorMaxRenderedElements = inspectorMaxRenderedElements;
  }

  /** Returns the process-wide settings, resolved on first use. */
  public static MatchersConfig get() {
    return Holder.INSTANCE;
  }

  /**
   * Resolves settings from the given sources.
   *
   * @param properties lookup by full property name, e.g. {@code dd.matchers.oneof.empty.candidates}
   * @param environment lookup by environment variable name, e.g. {@code
   *     DD_MATCHERS_ONEOF_EMPTY_CANDIDATES}
   */
  public static MatchersConfig from(
      Function<String, String> properties, Function<String, String> environment) {
    EmptyCandidatesPolicy policy = EmptyCandidatesPolicy.REJECT;
    String rawPolicy = lookup(properties, environment, EMPTY_CANDIDATES);
    if (rawPolicy != null) {
      EmptyCandidatesPolicy parsed = EmptyCandidatesPolicy.parse(rawPolicy);
      if (parsed == null) {
        log.warn(
            "Invalid value '{}' for {}, falling back to '{}'", rawPolicy, EMPTY_CANDIDATES, policy);
      } else {
        policy = parsed;
      }
    }

    int maxRendered = DEFAULT_INSPECTOR_MAX_RENDERED_ELEMENTS;
    String rawMax = lookup(properties, environment, INSPECTOR_MAX_RENDERED_ELEMENTS);
    if (rawMax != null) {
      try {
        int parsed = Integer.parseInt(rawMax.trim());
        if (parsed > 0) {
          maxRendered = parsed;
        } else {
          log.warn(
              "Invalid value '{}' for {}, falling back to {}",
              rawMax,
              INSPECTOR_MAX_RENDERED_ELEMENTS,
              maxRendered);
        }
      } catch (NumberFormatException e) {
        log.warn(
            "Invalid value '{}' for {}, falling back to {}",
            rawMax,
            INSPECTOR_MAX_RENDERED_ELEMENTS,
            maxRendered);
      }
    }
    log.debug(
        "Matchers config resolved: {}={}, {}={}",
        EMPTY_CANDIDATES,
        policy,
        INSPECTOR_MAX_RENDERED_ELEMENTS,
        maxRendered);
    return new MatchersConfig(policy, maxRendered);
  }

  public EmptyCandidatesPolicy getEmptyCandidatesPolicy() {
    return emptyCandidatesPolicy;
  }

  public int getInspectorMaxRenderedElements() {
    return inspectorMaxRenderedElements;
  }

  static String propertyName(String key) {
    return PROPERTY_PREFIX + key;
  }

  static String environmentVariableName(String key) {
    return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }

  private static @Nullable String lookup(
      Function<String, String> properties, Function<String, String> environment, String key) {
    String value = properties.apply(propertyName(key));
    if (value == null) {
      value = environment.apply(environmentVariableName(key));
    }
    return value;
  }

  private static @Nullable String systemProperty(String name) {
    try {
      return System.getProperty(name);
    } catch (SecurityException e) {
      log.debug("Unable to read system property {}", name, e);
      return null;
    }
  }

  private static @Nullable String environmentVariable(String name) {
    try {
      return System.getenv(name);
    } catch (SecurityException e) {
      log.debug("Unable to read environment variable {}", name, e);
      return null;
    }
  }

  @Override
  public String toString() {
    return "MatchersConfig{"
        + "emptyCandidatesPolicy="
        + emptyCandidatesPolicy
        + ", inspectorMaxRenderedElements="
        + inspectorMaxRenderedElements
        + '}';
  }
}
