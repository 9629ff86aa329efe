package tally.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tally.api.TallyStateException;
import tally.api.synchronizer.CountingGate;
import tally.api.synchronizer.WakePolicy;

public class TallyClientTest {

  private TallyClient client;

  @BeforeEach
  void setUp() {
    client = new TallyClient(WakePolicy.WAKE_ONE_RELAY);
  }

  @AfterEach
  void tearDown() {
    client.close();
  }

  @Test
  @DisplayName("the same id yields the same gate")
  void getOrCreateReturnsSameGate() {
    CountingGate first = client.getCountingGate("work");
    CountingGate second = client.getCountingGate("work");

    assertThat(second).isSameAs(first);
    assertThat(first.getResourceId()).isEqualTo("work");
    assertThat(first.getWakePolicy()).isEqualTo(WakePolicy.WAKE_ONE_RELAY);
    assertThat(client.getCountingGateIds()).containsExactly("work");
  }

  @Test
  @DisplayName("an explicit policy overrides the client default")
  void explicitPolicy() {
    CountingGate gate = client.getCountingGate("broadcast", WakePolicy.WAKE_ALL);

    assertThat(gate.getWakePolicy()).isEqualTo(WakePolicy.WAKE_ALL);
    assertThat(client.getCountingGate("broadcast", WakePolicy.WAKE_ALL)).isSameAs(gate);
  }

  @Test
  @DisplayName("requesting an existing gate with another policy fails")
  void policyMismatchIsRejected() {
    client.getCountingGate("work", WakePolicy.WAKE_ALL);

    assertThatThrownBy(() -> client.getCountingGate("work", WakePolicy.WAKE_ONE_RELAY))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("WAKE_ONE_RELAY")
        .hasMessageContaining("WAKE_ALL");
  }

  @Test
  @DisplayName("blank ids are rejected")
  void blankIdIsRejected() {
    assertThatThrownBy(() -> client.getCountingGate(""))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> client.getCountingGate(null, WakePolicy.WAKE_ALL))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("a drained idle gate can be removed, then recreated fresh")
  void removeDrainedGate() {
    CountingGate gate = client.getCountingGate("work");
    gate.add(2);
    gate.subtract(2);

    assertThat(client.removeCountingGate("work")).isTrue();
    assertThat(client.getCountingGateIds()).isEmpty();
    assertThat(client.removeCountingGate("work")).isFalse();

    CountingGate fresh = client.getCountingGate("work");
    assertThat(fresh).isNotSameAs(gate);
    assertThat(fresh.getCount()).isZero();
  }

  @Test
  @DisplayName("a gate with outstanding work is kept")
  void removeKeepsBusyGate() {
    CountingGate gate = client.getCountingGate("work");
    gate.increment();

    assertThat(client.removeCountingGate("work")).isFalse();
    assertThat(client.getCountingGate("work")).isSameAs(gate);
  }

  @Test
  @Timeout(10)
  @DisplayName("a gate with a sleeping waiter is kept")
  void removeKeepsGateWithWaiters() throws Exception {
    CountingGate gate = client.getCountingGate("work");
    gate.increment();

    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<Boolean> waiter = pool.submit(gate::waitUntilZero);
      while (gate.getWaiterCount() == 0) {
        TimeUnit.MILLISECONDS.sleep(1);
      }
      // add() never wakes, so the waiter stays registered on a drained gate.
      gate.add(-5);

      assertThat(client.removeCountingGate("work")).isFalse();

      gate.decrement();
      assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
      assertThat(client.removeCountingGate("work")).isTrue();
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  @DisplayName("close is idempotent and rejects further use; handed-out gates keep working")
  void closeRejectsFurtherUse() {
    CountingGate gate = client.getCountingGate("work");

    client.close();
    client.close();

    assertThat(client.isClosed()).isTrue();
    assertThatThrownBy(() -> client.getCountingGate("work"))
        .isInstanceOf(TallyStateException.class);
    assertThatThrownBy(() -> client.removeCountingGate("work"))
        .isInstanceOf(TallyStateException.class);
    assertThatThrownBy(() -> client.getCountingGateIds())
        .isInstanceOf(TallyStateException.class);

    assertThat(gate.increment()).isEqualTo(1);
    assertThat(gate.decrement()).isZero();
  }

  @Test
  @DisplayName("the default policy is resolved from configuration")
  void resolvesDefaultPolicy() {
    assertThat(TallyClient.resolveDefaultWakePolicy(null)).isEqualTo(WakePolicy.WAKE_ONE_RELAY);
    assertThat(TallyClient.resolveDefaultWakePolicy("")).isEqualTo(WakePolicy.WAKE_ONE_RELAY);
    assertThat(TallyClient.resolveDefaultWakePolicy("wake-all")).isEqualTo(WakePolicy.WAKE_ALL);
    assertThatThrownBy(() -> TallyClient.resolveDefaultWakePolicy("broadcast"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("the no-arg client reads the wake policy system property")
  void readsSystemProperty() {
    String previous = System.getProperty(TallyClient.WAKE_POLICY_PROPERTY);
    System.setProperty(TallyClient.WAKE_POLICY_PROPERTY, "WAKE_ALL");
    try (TallyClient configured = new TallyClient()) {
      assertThat(configured.getDefaultWakePolicy()).isEqualTo(WakePolicy.WAKE_ALL);
      assertThat(configured.getCountingGate("work").getWakePolicy())
          .isEqualTo(WakePolicy.WAKE_ALL);
    } finally {
      if (previous == null) {
        System.clearProperty(TallyClient.WAKE_POLICY_PROPERTY);
      } else {
        System.setProperty(TallyClient.WAKE_POLICY_PROPERTY, previous);
      }
    }
  }
}
