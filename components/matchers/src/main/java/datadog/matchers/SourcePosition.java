package datadog.matchers;

import javax.annotation.Nullable;

/** Locates the caller of the assertion API in a stack trace. */
final class SourcePosition {
  private static final String[] API_CLASSES = {
    SourcePosition.class.getName(),
    ContainerAssert.class.getName(),
    MatcherAssertions.class.getName(),
    Inspectors.class.getName()
  };

  private SourcePosition() {}

  static @Nullable StackTraceElement current() {
    return callerOf(new Throwable().getStackTrace());
  }

  /** First frame below the topmost run of assertion API frames */
  static @Nullable StackTraceElement callerOf(StackTraceElement[] stack) {
    boolean seenApi = false;
    for (StackTraceElement frame : stack) {
      if (isApiFrame(frame)) {
        seenApi = true;
      } else if (seenApi) {
        return frame;
      }
    }
    return null;
  }

  static boolean isApiFrame(StackTraceElement frame) {
    String className = frame.getClassName();
    for (String apiClass : API_CLASSES) {
      if (className.equals(apiClass)
          || (className.startsWith(apiClass) && className.charAt(apiClass.length()) == '$')) {
        return true;
      }
    }
    return false;
  }
}
