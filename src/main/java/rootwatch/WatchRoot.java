package rootwatch;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import rootwatch.backend.BackendHandle;

/**
 * A watched directory and its lifecycle state.
 *
 * All mutable state is guarded by this root's own monitor, and nothing else:
 * two roots never share a lock, so one root's slow teardown can't hold up another
 * root or a new watch. Callers that need several fields to change together
 * (e.g. a trigger map entry and its counter) synchronize on the root themselves.
 */
public class WatchRoot {

  private final Path path;
  private final RootConfig config;
  private final Instant createdAt;
  private final Map<String, Trigger> triggers = new LinkedHashMap<>();
  private final Map<Long, Subscription> subscriptions = new LinkedHashMap<>();
  private Instant lastActivityAt;
  private RootState state = RootState.ACTIVE;
  // false until the backend's initial crawl is done, so other callers wait for it
  private boolean started = false;
  private BackendHandle backend;
  int triggerCount;
  int subscriptionCount;
  int inFlightCount;

  WatchRoot(Path path, RootConfig config, Instant createdAt) {
    this.path = path;
    this.config = config;
    this.createdAt = createdAt;
    this.lastActivityAt = createdAt;
  }

  public Path getPath() {
    return path;
  }

  public RootConfig getConfig() {
    return config;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public synchronized Instant getLastActivityAt() {
    return lastActivityAt;
  }

  synchronized void setLastActivityAt(Instant lastActivityAt) {
    this.lastActivityAt = lastActivityAt;
  }

  public synchronized RootState getState() {
    return state;
  }

  /** @return whether the root is fully started and not being torn down */
  public synchronized boolean isLive() {
    return started && state == RootState.ACTIVE;
  }

  synchronized boolean isStarted() {
    return started;
  }

  synchronized BackendHandle getBackend() {
    return backend;
  }

  public synchronized RootStatus getStatus() {
    return new RootStatus(
      path,
      state,
      createdAt,
      lastActivityAt,
      config.getIdleReapAge(),
      triggerCount,
      subscriptionCount,
      inFlightCount);
  }

  /** Compare-and-set of the lifecycle state; wakes anyone waiting for the root to settle. */
  synchronized boolean transition(RootState expected, RootState next) {
    if (state != expected) {
      return false;
    }
    state = next;
    notifyAll();
    return true;
  }

  synchronized void markStarted(BackendHandle backend) {
    this.backend = backend;
    started = true;
    notifyAll();
  }

  synchronized void markTornDown() {
    state = RootState.TORN_DOWN;
    notifyAll();
  }

  /**
   * Blocks while the root is still starting or has a teardown in progress.
   *
   * @return the settled state, either {@link RootState#ACTIVE} or {@link RootState#TORN_DOWN}
   */
  synchronized RootState awaitSettled() {
    while ((!started && state == RootState.ACTIVE) || state == RootState.REAP_PENDING) {
      Utils.resetIfInterrupted(() -> wait());
    }
    return state;
  }

  /**
   * Waits for the root to settle and, if it survived, records {@code now} as activity
   * in the same critical section, so a reaper can't take it between the two.
   */
  synchronized boolean activateIfLive(Instant now) {
    if (awaitSettled() != RootState.ACTIVE) {
      return false;
    }
    lastActivityAt = now;
    return true;
  }

  /** The live trigger map; callers must hold this root's monitor. */
  Map<String, Trigger> triggers() {
    return triggers;
  }

  /** The live subscription map; callers must hold this root's monitor. */
  Map<Long, Subscription> subscriptions() {
    return subscriptions;
  }

  /** Drops every trigger and subscription, returning the subscriptions so their clients can be told. */
  synchronized List<Subscription> flushHolders() {
    List<Subscription> flushed = new ArrayList<>(subscriptions.values());
    subscriptions.clear();
    triggers.clear();
    triggerCount = 0;
    subscriptionCount = 0;
    return flushed;
  }

  @Override
  public String toString() {
    return "WatchRoot[" + path + "]";
  }

}
