package tally.core.internal;

/** Thread identification used in gate diagnostics. */
public final class ThreadUtils {

  private ThreadUtils() {}

  public static String getCurrentThreadId() {
    return String.format("%s-%d", Thread.currentThread().getName(), Thread.currentThread().getId());
  }
}
