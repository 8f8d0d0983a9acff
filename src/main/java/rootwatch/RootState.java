package rootwatch;

/** Lifecycle of a {@link WatchRoot}; transitions only move forward, except an abandoned reap. */
public enum RootState {
  ACTIVE, REAP_PENDING, TORN_DOWN
}
