package rootwatch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rootwatch.tasks.TaskLogic;

/**
 * Periodically finds idle roots and tears them down.
 *
 * Each sweep walks a snapshot of the registry, re-reads every root's counters under
 * that root's monitor, and moves eligible roots from ACTIVE to REAP_PENDING. Each
 * pending root's teardown is then handed to {@code teardownExecutor} as its own job,
 * so a slow teardown of one root never delays another root, the next sweep, or a
 * new watch.
 */
public class IdleReaper implements TaskLogic {

  private static final Logger log = LoggerFactory.getLogger(IdleReaper.class);
  private final RootRegistry registry;
  private final LivenessTracker tracker;
  private final RootTeardown teardown;
  private final Executor teardownExecutor;
  private final Clock clock;
  private final Duration sweepInterval;
  private final AtomicLong reapCount = new AtomicLong();

  public IdleReaper(
    RootRegistry registry,
    LivenessTracker tracker,
    RootTeardown teardown,
    Executor teardownExecutor,
    Clock clock,
    Duration sweepInterval) {
    this.registry = registry;
    this.tracker = tracker;
    this.teardown = teardown;
    this.teardownExecutor = teardownExecutor;
    this.clock = clock;
    this.sweepInterval = sweepInterval;
  }

  @Override
  public Duration runOneLoop() {
    sweep();
    return sweepInterval;
  }

  /**
   * Runs one pass over every registered root.
   *
   * @return the roots whose teardown this sweep started
   */
  public List<WatchRoot> sweep() {
    Instant now = clock.instant();
    List<WatchRoot> pending = new ArrayList<>();
    for (WatchRoot root : registry.listRoots()) {
      try {
        if (beginReap(root, now)) {
          pending.add(root);
          dispatch(root);
        }
      } catch (Exception e) {
        log.error("Error checking " + root.getPath() + " for reaping", e);
      }
    }
    if (!pending.isEmpty()) {
      log.debug("Sweep started teardown of {} roots", pending.size());
    }
    return pending;
  }

  public long getReapCount() {
    return reapCount.get();
  }

  private boolean beginReap(WatchRoot root, Instant now) {
    synchronized (root) {
      return tracker.isEligibleForReap(root, now) && root.transition(RootState.ACTIVE, RootState.REAP_PENDING);
    }
  }

  private void dispatch(WatchRoot root) {
    try {
      teardownExecutor.execute(() -> reap(root));
    } catch (RejectedExecutionException e) {
      // shutting down; leave the root for the shutdown path to close
      log.warn("Could not schedule teardown of {}: {}", root.getPath(), e.getMessage());
      root.transition(RootState.REAP_PENDING, RootState.ACTIVE);
    }
  }

  private void reap(WatchRoot root) {
    try {
      if (teardown.teardown(root, RootTeardown.Cause.IDLE_REAP)) {
        reapCount.incrementAndGet();
      }
    } catch (Exception e) {
      log.error("Error reaping " + root.getPath(), e);
      // a committed teardown always completes, so don't leave waiters stuck on REAP_PENDING
      teardown.abandon(root);
    }
  }

  @Override
  public String getName() {
    return "IdleReaper";
  }

}
