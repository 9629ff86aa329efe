package tally.client;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Table;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tally.api.Resourceful;
import tally.api.TallyStateException;
import tally.api.synchronizer.CountingGate;
import tally.api.synchronizer.WakePolicy;
import tally.core.internal.synchronizer.DefaultCountingGate;

/**
 * Owns a set of named {@link CountingGate}s.
 *
 * <p>A task system typically keeps one client for its lifetime and looks gates up by name. The
 * client only forgets a gate through {@link #removeCountingGate(String)}, which refuses while the
 * gate still has sleepers or outstanding work, so a gate handed out here is never dropped from
 * under a thread that is waiting on it.
 *
 * <p>Gates created without an explicit policy use the client's default policy. It is taken from
 * the constructor, or from the {@value #WAKE_POLICY_PROPERTY} system property when the no-argument
 * constructor is used.
 */
@ThreadSafe
public class TallyClient implements AutoCloseable {

  /** System property naming the default {@link WakePolicy}, e.g. {@code wake-all}. */
  public static final String WAKE_POLICY_PROPERTY = "tally.gate.wake-policy";

  private static final Logger log = LoggerFactory.getLogger(TallyClient.class);

  private final WakePolicy defaultWakePolicy;

  @GuardedBy("this")
  private final Table<Class<? extends Resourceful>, String, Resourceful> tallyResources =
      HashBasedTable.create();

  @GuardedBy("this")
  private boolean closed;

  public TallyClient() {
    this(resolveDefaultWakePolicy(System.getProperty(WAKE_POLICY_PROPERTY)));
  }

  public TallyClient(WakePolicy defaultWakePolicy) {
    checkArgument(defaultWakePolicy != null, "Default wake policy must not be null.");
    this.defaultWakePolicy = defaultWakePolicy;
  }

  @VisibleForTesting
  static WakePolicy resolveDefaultWakePolicy(String configured) {
    if (configured == null || configured.isBlank()) {
      return WakePolicy.DEFAULT;
    }
    return WakePolicy.fromProperty(configured);
  }

  public WakePolicy getDefaultWakePolicy() {
    return defaultWakePolicy;
  }

  /** Returns the gate named {@code resourceId}, creating it with the default policy if absent. */
  public synchronized CountingGate getCountingGate(String resourceId) {
    return getCountingGate(resourceId, defaultWakePolicy);
  }

  /**
   * Returns the gate named {@code resourceId}, creating it with {@code wakePolicy} if absent.
   *
   * @throws IllegalArgumentException if a gate with the same id already exists but was created with
   *     a different policy
   * @throws TallyStateException if this client is closed
   */
  public synchronized CountingGate getCountingGate(String resourceId, WakePolicy wakePolicy) {
    ensureOpen();
    checkArgument(
        resourceId != null && !resourceId.isBlank(), "Resource id must not be null or blank.");
    checkArgument(wakePolicy != null, "Wake policy must not be null.");

    CountingGate gate = (CountingGate) tallyResources.get(CountingGate.class, resourceId);
    if (gate == null) {
      gate = new DefaultCountingGate(resourceId, wakePolicy);
      tallyResources.put(CountingGate.class, resourceId, gate);
      log.debug("Created counting gate {} with policy {}.", resourceId, wakePolicy);
      return gate;
    }
    if (gate.getWakePolicy() != wakePolicy) {
      log.warn(
          "Counting gate {} requested with policy {} but exists with {}.",
          resourceId,
          wakePolicy,
          gate.getWakePolicy());
      throw new IllegalArgumentException(
          "A counting gate with the same ID already exists but with a different wake policy. "
              + "Expected: "
              + wakePolicy
              + ", Found: "
              + gate.getWakePolicy());
    }
    return gate;
  }

  /**
   * Forgets the gate named {@code resourceId} if it is drained and nobody sleeps on it.
   *
   * <p>Holders of the gate can keep using it; a later {@link #getCountingGate(String)} with the
   * same id creates a fresh gate.
   *
   * @return {@code true} if the gate was removed, {@code false} if it is unknown or still busy
   * @throws TallyStateException if this client is closed
   */
  @CanIgnoreReturnValue
  public synchronized boolean removeCountingGate(String resourceId) {
    ensureOpen();
    CountingGate gate = (CountingGate) tallyResources.get(CountingGate.class, resourceId);
    if (gate == null) {
      return false;
    }
    if (!gate.isIdle()) {
      log.debug("Keeping counting gate {}, it is still busy: {}", resourceId, gate);
      return false;
    }
    tallyResources.remove(CountingGate.class, resourceId);
    log.debug("Removed counting gate {}.", resourceId);
    return true;
  }

  /** Returns the ids of the gates currently owned by this client. */
  public synchronized ImmutableSet<String> getCountingGateIds() {
    ensureOpen();
    return ImmutableSet.copyOf(tallyResources.row(CountingGate.class).keySet());
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  /**
   * Releases every gate this client owns. Idempotent. Gates already handed out stay usable by
   * their holders.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    int owned = tallyResources.size();
    tallyResources.clear();
    log.info("Tally client closed, released {} resource(s).", owned);
  }

  @GuardedBy("this")
  private void ensureOpen() {
    if (closed) {
      throw new TallyStateException("Tally client is closed.");
    }
  }
}
