package tally.core.internal.synchronizer;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tally.api.synchronizer.CountingGate;
import tally.api.synchronizer.WakePolicy;
import tally.core.internal.ThreadUtils;

/**
 * The default {@link CountingGate}, built on a single {@link ReentrantLock} and one {@link
 * Condition}.
 *
 * <h3>Implementation Details</h3>
 *
 * <p>Every operation takes the same lock, and both the counter and the waiter count are only read
 * or written while it is held. Mutations never wait for anything but the lock itself.
 *
 * <p>A waiting thread registers itself in {@code waiterCount} before calling {@link
 * Condition#awaitUninterruptibly()} and deregisters after it reacquires the lock, so whenever the
 * lock is held {@code waiterCount} equals the number of threads parked on the condition or queued
 * to reacquire the lock after a signal.
 *
 * <h4>Waking</h4>
 *
 * <p>A {@code decrement} or {@code subtract} that leaves the counter at or below zero signals the
 * condition before releasing the lock: {@link Condition#signalAll()} under {@link
 * WakePolicy#WAKE_ALL}, a single {@link Condition#signal()} under {@link
 * WakePolicy#WAKE_ONE_RELAY}. In the relay mode a waiter that leaves its wait call signals once
 * more if {@code waiterCount} is still positive, while it holds the lock. The wake therefore walks
 * through all waiters one at a time for as long as the gate stays drained.
 *
 * <p>All state is touched before the lock is released, so a woken thread that returns and drops
 * the owner of the gate never races a signalling thread still reading the gate's fields.
 */
@ThreadSafe
public class DefaultCountingGate implements CountingGate {

  private static final Logger log = LoggerFactory.getLogger(DefaultCountingGate.class);

  private final String resourceId;
  private final WakePolicy wakePolicy;

  private final ReentrantLock lock;
  private final Condition drained;

  @GuardedBy("lock")
  private int counter;

  @GuardedBy("lock")
  private int waiterCount;

  public DefaultCountingGate(String resourceId) {
    this(resourceId, WakePolicy.DEFAULT);
  }

  public DefaultCountingGate(String resourceId, WakePolicy wakePolicy) {
    this(resourceId, wakePolicy, new ReentrantLock());
  }

  @VisibleForTesting
  DefaultCountingGate(String resourceId, WakePolicy wakePolicy, ReentrantLock lock) {
    checkArgument(
        resourceId != null && !resourceId.isBlank(), "Resource id must not be null or blank.");
    checkArgument(wakePolicy != null, "Wake policy must not be null.");
    checkArgument(lock != null, "Lock must not be null.");
    this.resourceId = resourceId;
    this.wakePolicy = wakePolicy;
    this.lock = lock;
    this.drained = lock.newCondition();
  }

  @Override
  public String getResourceId() {
    return resourceId;
  }

  @Override
  public WakePolicy getWakePolicy() {
    return wakePolicy;
  }

  @CanIgnoreReturnValue
  @Override
  public int increment() {
    return add(1);
  }

  @CanIgnoreReturnValue
  @Override
  public int decrement() {
    return subtract(1);
  }

  @CanIgnoreReturnValue
  @Override
  public int add(int count) {
    lock.lock();
    try {
      counter += count;
      return counter;
    } finally {
      lock.unlock();
    }
  }

  @CanIgnoreReturnValue
  @Override
  public int subtract(int count) {
    lock.lock();
    try {
      counter -= count;
      if (counter <= 0) {
        wakeOnDrain();
      }
      return counter;
    } finally {
      lock.unlock();
    }
  }

  @CanIgnoreReturnValue
  @Override
  public boolean waitUntilZero() {
    lock.lock();
    try {
      boolean didWait = false;
      while (counter > 0) {
        park();
        didWait = true;
      }
      relay();
      return didWait;
    } finally {
      lock.unlock();
    }
  }

  @CanIgnoreReturnValue
  @Override
  public boolean waitOneWakeup() {
    lock.lock();
    try {
      boolean didWait = false;
      if (counter > 0) {
        park();
        didWait = true;
      }
      relay();
      return didWait;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getCount() {
    lock.lock();
    try {
      return counter;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getWaiterCount() {
    lock.lock();
    try {
      return waiterCount;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isIdle() {
    lock.lock();
    try {
      return counter <= 0 && waiterCount == 0;
    } finally {
      lock.unlock();
    }
  }

  @GuardedBy("lock")
  private void park() {
    waiterCount++;
    if (log.isTraceEnabled()) {
      log.trace(
          "{} parking on gate {}, count={}, waiters={}",
          ThreadUtils.getCurrentThreadId(),
          resourceId,
          counter,
          waiterCount);
    }
    drained.awaitUninterruptibly();
    waiterCount--;
    if (log.isTraceEnabled()) {
      log.trace(
          "{} woke on gate {}, count={}, waiters={}",
          ThreadUtils.getCurrentThreadId(),
          resourceId,
          counter,
          waiterCount);
    }
  }

  @GuardedBy("lock")
  private void wakeOnDrain() {
    if (waiterCount == 0) {
      return;
    }
    if (wakePolicy == WakePolicy.WAKE_ALL) {
      drained.signalAll();
    } else {
      drained.signal();
    }
    if (log.isDebugEnabled()) {
      log.debug(
          "Gate {} drained to {} by {}, woke {} of {} waiter(s).",
          resourceId,
          counter,
          ThreadUtils.getCurrentThreadId(),
          wakePolicy == WakePolicy.WAKE_ALL ? waiterCount : 1,
          waiterCount);
    }
  }

  // Forwards one wake to the next sleeper before the lock is released.
  @GuardedBy("lock")
  private void relay() {
    if (wakePolicy == WakePolicy.WAKE_ONE_RELAY && waiterCount > 0) {
      drained.signal();
      if (log.isTraceEnabled()) {
        log.trace(
            "{} relayed a wake on gate {}, waiters={}",
            ThreadUtils.getCurrentThreadId(),
            resourceId,
            waiterCount);
      }
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return "DefaultCountingGate{"
          + "resourceId='"
          + resourceId
          + '\''
          + ", count="
          + counter
          + ", waiters="
          + waiterCount
          + ", wakePolicy="
          + wakePolicy
          + '}';
    } finally {
      lock.unlock();
    }
  }
}
