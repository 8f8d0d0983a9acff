package rootwatch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps a request counted as in-flight on its root until closed; closing twice is harmless.
 */
public class RequestScope implements AutoCloseable {

  private final LivenessTracker tracker;
  private final WatchRoot root;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  RequestScope(LivenessTracker tracker, WatchRoot root) {
    this.tracker = tracker;
    this.root = root;
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      tracker.endRequest(root);
    }
  }
}
