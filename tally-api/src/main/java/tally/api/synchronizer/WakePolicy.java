package tally.api.synchronizer;

import java.util.Locale;

/**
 * Selects how a {@link CountingGate} resumes its waiters when the counter is driven to zero or
 * below. The policy is fixed when the gate is constructed.
 */
public enum WakePolicy {

  /**
   * Each draining {@code decrement}/{@code subtract} wakes exactly one waiter. A waiter leaving its
   * wait call wakes one more if any remain, so a single event ripples through all waiters one lock
   * handoff at a time.
   */
  WAKE_ONE_RELAY,

  /** Each draining {@code decrement}/{@code subtract} wakes every waiter at once. */
  WAKE_ALL;

  /** The policy used when none is configured. */
  public static final WakePolicy DEFAULT = WAKE_ONE_RELAY;

  /**
   * Parses a policy name. Matching ignores case and treats {@code '-'} like {@code '_'}, so {@code
   * "wake-all"} and {@code "WAKE_ALL"} name the same policy.
   *
   * @param value the configured name
   * @return the matching policy
   * @throws IllegalArgumentException if {@code value} is null, blank or names no policy
   */
  public static WakePolicy fromProperty(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Wake policy must not be blank");
    }
    String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    for (WakePolicy policy : values()) {
      if (policy.name().equals(normalized)) {
        return policy;
      }
    }
    throw new IllegalArgumentException("Unknown wake policy: " + value);
  }
}
