package rootwatch;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import rootwatch.backend.BackendHandle;
import rootwatch.backend.FileWatcherBackend;

/**
 * Maps canonical root paths to their {@link WatchRoot}, and is the only thing that
 * decides whether a path is watched.
 *
 * The map is the only structure shared across roots; it's only held for single-key
 * inserts/lookups/removes, never while starting or stopping a backend watch.
 *
 * When {@link #watch(Path)} finds a root that is mid-teardown, it waits for that one
 * root to finish and then creates a fresh root, so callers never get a handle that is
 * about to disappear.
 */
public class RootRegistry {

  private static final Logger log = LoggerFactory.getLogger(RootRegistry.class);
  private final ConcurrentHashMap<Path, WatchRoot> roots = new ConcurrentHashMap<>();
  private final FileWatcherBackend backend;
  private final DaemonConfig config;
  private final Clock clock;

  public RootRegistry(FileWatcherBackend backend, DaemonConfig config, Clock clock) {
    this.backend = backend;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Returns the live root for {@code path}, creating and starting one if needed.
   *
   * Concurrent calls for the same path create exactly one root; the losers wait for
   * the winner's backend to start and then return the same root.
   *
   * @throws BackendStartException if the path can't be resolved or the backend can't watch it
   */
  public WatchRoot watch(Path path) {
    Path canonical;
    try {
      canonical = path.toRealPath();
    } catch (IOException e) {
      throw new BackendStartException(path, e);
    }
    while (true) {
      WatchRoot existing = roots.get(canonical);
      if (existing == null) {
        WatchRoot created = new WatchRoot(canonical, RootConfig.load(canonical, config), clock.instant());
        existing = roots.putIfAbsent(canonical, created);
        if (existing == null) {
          start(created);
          return created;
        }
      }
      if (existing.activateIfLive(clock.instant())) {
        return existing;
      }
      // torn down or failed to start; free the slot if its teardown hasn't yet, then retry
      roots.remove(canonical, existing);
    }
  }

  private void start(WatchRoot root) {
    BackendHandle handle;
    try {
      handle = backend.startWatching(root.getPath());
    } catch (Exception e) {
      // remove before waking the waiters, so no one sees a half-created root
      roots.remove(root.getPath(), root);
      root.markTornDown();
      throw new BackendStartException(root.getPath(), e);
    }
    root.markStarted(handle);
    log.info("Watching {} ({})", root.getPath(), root.getConfig());
  }

  /** @return the live root for {@code path}, or empty if it isn't watched (or is being torn down) */
  public Optional<WatchRoot> lookup(Path path) {
    WatchRoot root = roots.get(Utils.canonicalize(path));
    return Optional.ofNullable(root).filter(WatchRoot::isLive);
  }

  /**
   * Like {@link #lookup(Path)}, but if the root is still starting or is mid-teardown, waits
   * for that to settle first: a root whose reap was abandoned is returned, a torn down one isn't.
   */
  public Optional<WatchRoot> resolve(Path path) {
    WatchRoot root = roots.get(Utils.canonicalize(path));
    if (root == null || root.awaitSettled() != RootState.ACTIVE) {
      return Optional.empty();
    }
    return Optional.of(root);
  }

  /** @return the registered root for {@code path} in whatever state it's in */
  public Optional<WatchRoot> find(Path path) {
    return Optional.ofNullable(roots.get(Utils.canonicalize(path)));
  }

  /**
   * Removes {@code root} if it is still the registered root for its path. A no-op if it
   * was already removed, or the path has since been re-watched by a new root.
   */
  public boolean remove(WatchRoot root) {
    return roots.remove(root.getPath(), root);
  }

  /** @return a snapshot of every registered root, in any state */
  public List<WatchRoot> listRoots() {
    return ImmutableList.copyOf(roots.values());
  }

  public int size() {
    return roots.size();
  }

}
