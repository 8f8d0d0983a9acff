package rootwatch;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains each root's holder counters (triggers, subscriptions, in-flight requests)
 * and its last activity time, which together decide whether the root may be reaped.
 *
 * Every update happens under the root's own monitor, so updates to one root are
 * linearizable and updates to different roots never contend.
 */
public class LivenessTracker {

  private static final Logger log = LoggerFactory.getLogger(LivenessTracker.class);
  private final Clock clock;

  public LivenessTracker(Clock clock) {
    this.clock = clock;
  }

  /** Records client activity on {@code root}; a no-op once the root is torn down. */
  public void touch(WatchRoot root) {
    synchronized (root) {
      if (root.getState() != RootState.TORN_DOWN) {
        root.setLastActivityAt(clock.instant());
      }
    }
  }

  public void addTrigger(WatchRoot root) {
    synchronized (root) {
      requireActive(root);
      root.triggerCount++;
      touch(root);
    }
  }

  public void removeTrigger(WatchRoot root) {
    synchronized (root) {
      root.triggerCount = decrement(root, root.triggerCount, "removeTrigger");
      touch(root);
    }
  }

  public void addSubscription(WatchRoot root) {
    synchronized (root) {
      requireActive(root);
      root.subscriptionCount++;
      touch(root);
    }
  }

  public void removeSubscription(WatchRoot root) {
    synchronized (root) {
      root.subscriptionCount = decrement(root, root.subscriptionCount, "removeSubscription");
      touch(root);
    }
  }

  /**
   * Marks a request as running against {@code root} until the returned scope is closed,
   * e.g. {@code try (RequestScope s = tracker.beginRequest(root)) { ... }}.
   */
  public RequestScope beginRequest(WatchRoot root) {
    synchronized (root) {
      requireActive(root);
      root.inFlightCount++;
      touch(root);
    }
    return new RequestScope(this, root);
  }

  public void endRequest(WatchRoot root) {
    synchronized (root) {
      root.inFlightCount = decrement(root, root.inFlightCount, "endRequest");
      touch(root);
    }
  }

  /** @return whether {@code root} is active, started, and {@link #isIdle idle} at {@code now} */
  public boolean isEligibleForReap(WatchRoot root, Instant now) {
    synchronized (root) {
      return root.isLive() && isIdle(root, now);
    }
  }

  /**
   * @return whether {@code root} has reaping enabled, no holders, and no activity for at
   * least its idle reap age, regardless of its lifecycle state
   */
  boolean isIdle(WatchRoot root, Instant now) {
    synchronized (root) {
      if (!root.getConfig().isReapEnabled() || hasHolders(root)) {
        return false;
      }
      Instant threshold = root.getLastActivityAt().plus(root.getConfig().getIdleReapAge());
      return !now.isBefore(threshold);
    }
  }

  private static boolean hasHolders(WatchRoot root) {
    return root.triggerCount > 0 || root.subscriptionCount > 0 || root.inFlightCount > 0;
  }

  private static void requireActive(WatchRoot root) {
    if (root.getState() != RootState.ACTIVE) {
      throw new RootGoneException(root.getPath());
    }
  }

  /** Decrements {@code count}, clamping at zero and failing loudly if it was already zero. */
  private static int decrement(WatchRoot root, int count, String operation) {
    if (count <= 0) {
      String message = operation + " on " + root.getPath() + " without a matching attach";
      log.error(message);
      throw new InvariantViolationException(root.getPath(), message);
    }
    return count - 1;
  }

}
