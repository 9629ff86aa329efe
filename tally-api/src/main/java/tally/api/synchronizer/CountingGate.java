package tally.api.synchronizer;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import tally.api.Resourceful;

/**
 * A signed counter of outstanding work paired with a blocking wait that releases threads once the
 * counter is <em>drained</em>, that is, zero or below.
 *
 * <p>Producers {@link #increment()} when work is handed out and {@link #decrement()} when it
 * completes; idle threads sleep in {@link #waitUntilZero()} or {@link #waitOneWakeup()} instead of
 * spinning. The counter may go negative when increments and decrements race in a
 * non-deterministic order. No bound is enforced in either direction and a negative value is not
 * an error.
 *
 * <p>Only {@link #decrement()} and {@link #subtract(int)} wake waiters, and only when they leave
 * the counter drained. How many waiters each such call resumes depends on the gate's {@link
 * WakePolicy}.
 *
 * <p><b>Waits cannot be cancelled.</b> There is no timed variant, and interrupting a waiting thread
 * does not release it; its interrupt status is still set when the wait returns.
 *
 * <p><b>Lifetime contract.</b> The owner of a gate must not discard it, or tear down the state it
 * guards, while any thread may still be inside a wait call. A returning waiter may have to relay a
 * wake to a sibling under the gate's lock, and that obligation is part of the wait call. The gate
 * does not enforce this; it is the caller's responsibility.
 */
@ThreadSafe
public interface CountingGate extends Resourceful {

  /**
   * Adds one to the counter. Never wakes waiters.
   *
   * @return the new counter value
   */
  @CanIgnoreReturnValue
  int increment();

  /**
   * Subtracts one from the counter, waking waiters if the result is zero or below.
   *
   * @return the new counter value, possibly negative
   */
  @CanIgnoreReturnValue
  int decrement();

  /**
   * Adds {@code count} to the counter. Never wakes waiters, even when {@code count} is negative.
   *
   * <p>The counter is an {@code int} with no bound checks: a sum past {@link Integer#MAX_VALUE} or
   * {@link Integer#MIN_VALUE} wraps around silently.
   *
   * @param count the signed delta
   * @return the new counter value
   */
  @CanIgnoreReturnValue
  int add(int count);

  /**
   * Subtracts {@code count} from the counter, waking waiters if the result is zero or below.
   *
   * <p>Like {@link #add(int)}, the result wraps around silently on overflow. For example, {@code
   * subtract(Integer.MIN_VALUE)} on a counter of zero leaves {@link Integer#MIN_VALUE} and wakes
   * waiters.
   *
   * @param count the signed delta
   * @return the new counter value, possibly negative
   */
  @CanIgnoreReturnValue
  int subtract(int count);

  /**
   * Sleeps while the counter is positive. Wakes that arrive while the counter is still positive
   * put the caller back to sleep.
   *
   * @return {@code true} if the caller slept at least once, {@code false} if the gate was already
   *     drained
   */
  @CanIgnoreReturnValue
  boolean waitUntilZero();

  /**
   * If the counter is positive, sleeps until the next wake and returns, whatever the counter's
   * value is by then. Meant for a worker that goes back to spinning after each wake rather than
   * sleeping repeatedly.
   *
   * @return {@code true} if the caller slept, {@code false} if the gate was already drained
   */
  @CanIgnoreReturnValue
  boolean waitOneWakeup();

  /**
   * @return a snapshot of the counter
   */
  int getCount();

  /**
   * @return a snapshot of the number of threads currently asleep in a wait call
   */
  int getWaiterCount();

  /**
   * Reads the counter and the waiter count together under the gate's lock. A thread that was
   * signalled but has not yet left its wait call still counts as a waiter.
   *
   * @return {@code true} if the gate is drained and no thread is inside a wait call
   */
  boolean isIdle();

  /**
   * @return the policy fixed at construction
   */
  WakePolicy getWakePolicy();
}
