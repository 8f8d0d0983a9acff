package rootwatch;

import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rootwatch.backend.BackendHandle;
import rootwatch.backend.FileWatcherBackend;

/**
 * Tears down a single root: stops its backend watch, cancels its subscriptions,
 * marks it {@link RootState#TORN_DOWN} and removes it from the registry.
 *
 * Only roots that someone has already moved to {@link RootState#REAP_PENDING} are
 * torn down, which guarantees at most one teardown per root. Nothing here locks
 * more than the one root, and the backend I/O happens with no lock held at all.
 */
public class RootTeardown {

  public enum Cause {
    /** The idle reaper found the root idle; re-validated before committing. */
    IDLE_REAP,
    /** A client asked to unwatch the root; holders are cancelled. */
    UNWATCH,
    /** The daemon is shutting down. */
    SHUTDOWN
  }

  private static final Logger log = LoggerFactory.getLogger(RootTeardown.class);
  private final RootRegistry registry;
  private final LivenessTracker tracker;
  private final FileWatcherBackend backend;
  private final ClientSessions sessions;
  private final Clock clock;

  RootTeardown(RootRegistry registry, LivenessTracker tracker, FileWatcherBackend backend, ClientSessions sessions, Clock clock) {
    this.registry = registry;
    this.tracker = tracker;
    this.backend = backend;
    this.sessions = sessions;
    this.clock = clock;
  }

  /**
   * @return true if this call tore the root down, false if it wasn't pending teardown or
   * (for idle reaps) it became active again and was returned to {@link RootState#ACTIVE}
   */
  public boolean teardown(WatchRoot root, Cause cause) {
    BackendHandle handle;
    synchronized (root) {
      if (root.getState() != RootState.REAP_PENDING) {
        return false;
      }
      if (cause == Cause.IDLE_REAP && !tracker.isIdle(root, clock.instant())) {
        log.debug("{} became active before its reap committed, keeping it", root.getPath());
        root.transition(RootState.REAP_PENDING, RootState.ACTIVE);
        return false;
      }
      handle = root.getBackend();
    }

    Utils.time(log, "stopping watch of " + root.getPath(), () -> stopBackend(root, handle));
    commit(root);
    log.info("{} {} ({})", describe(cause), root.getPath(), root.getConfig());
    return true;
  }

  /**
   * Finishes a teardown that failed part way, so the root's watch doesn't leak and
   * waiters aren't left stuck on {@link RootState#REAP_PENDING}. Stopping an already
   * stopped backend watch is harmless.
   */
  void abandon(WatchRoot root) {
    BackendHandle handle;
    synchronized (root) {
      if (root.getState() != RootState.REAP_PENDING) {
        return;
      }
      handle = root.getBackend();
    }
    stopBackend(root, handle);
    commit(root);
    log.warn("Abandoned teardown of {}", root.getPath());
  }

  private void commit(WatchRoot root) {
    List<Subscription> cancelled = root.flushHolders();
    root.markTornDown();
    for (Subscription subscription : cancelled) {
      if (sessions.remove(subscription)) {
        log.info("Cancelled subscription {} of client {} on {}", subscription.getName(), subscription.getClientId(), root.getPath());
      }
    }
    registry.remove(root);
  }

  private void stopBackend(WatchRoot root, BackendHandle handle) {
    if (handle == null) {
      return;
    }
    try {
      backend.stopWatching(handle);
    } catch (Exception e) {
      // still remove the root, otherwise it would be stuck half torn down forever
      log.warn("Watch of " + root.getPath() + " did not stop cleanly, removing it anyway", e);
    }
  }

  private static String describe(Cause cause) {
    switch (cause) {
      case IDLE_REAP:
        return "Reaped idle root";
      case UNWATCH:
        return "Unwatched";
      default:
        return "Closed";
    }
  }

}
