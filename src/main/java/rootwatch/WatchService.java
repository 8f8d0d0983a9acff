package rootwatch;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import rootwatch.backend.FileWatcherBackend;
import rootwatch.backend.WatchServiceBackend;
import rootwatch.tasks.TaskFactory;
import rootwatch.tasks.ThreadBasedTaskFactory;

/**
 * The daemon's entry point for client requests: watching/unwatching roots,
 * registering triggers and subscriptions, and releasing a client's holds when
 * it disconnects.
 *
 * Roots with no holders are reaped by the {@link IdleReaper} once they've been
 * idle for their configured age.
 */
public class WatchService implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(WatchService.class);
  private final AtomicLong nextSubscriptionId = new AtomicLong(1);
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final ClientSessions sessions = new ClientSessions();
  private final DaemonConfig config;
  private final TaskFactory taskFactory;
  private final ExecutorService ownedExecutor;
  private final RootRegistry registry;
  private final LivenessTracker tracker;
  private final RootTeardown teardown;
  private final IdleReaper reaper;

  /** Creates a service with a {@link WatchServiceBackend} and a dedicated teardown thread pool. */
  public static WatchService create(DaemonConfig config) {
    TaskFactory taskFactory = new ThreadBasedTaskFactory();
    ExecutorService teardownPool = Executors.newCachedThreadPool(new ThreadFactoryBuilder() //
      .setDaemon(true)
      .setNameFormat("RootTeardown-%s")
      .build());
    return new WatchService(config, new WatchServiceBackend(taskFactory), taskFactory, teardownPool, teardownPool, Clock.systemUTC());
  }

  public WatchService(DaemonConfig config, FileWatcherBackend backend, TaskFactory taskFactory, Executor teardownExecutor, Clock clock) {
    this(config, backend, taskFactory, teardownExecutor, null, clock);
  }

  private WatchService(
    DaemonConfig config,
    FileWatcherBackend backend,
    TaskFactory taskFactory,
    Executor teardownExecutor,
    ExecutorService ownedExecutor,
    Clock clock) {
    this.config = config;
    this.taskFactory = taskFactory;
    this.ownedExecutor = ownedExecutor;
    this.registry = new RootRegistry(backend, config, clock);
    this.tracker = new LivenessTracker(clock);
    this.teardown = new RootTeardown(registry, tracker, backend, sessions, clock);
    this.reaper = new IdleReaper(registry, tracker, teardown, teardownExecutor, clock, config.getReapSweepInterval());
  }

  /** Starts the idle reaper's sweep task. */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Already started");
    }
    taskFactory.runTask(reaper);
    log.info("Started with {}", config);
  }

  /** Watches {@code path}, or returns the existing root if it's already watched. */
  public WatchRoot watch(Path path) {
    return registry.watch(path);
  }

  /**
   * Stops watching {@code path}, cancelling any triggers and subscriptions on it.
   *
   * @return false if the path wasn't watched (including when a reap got there first)
   */
  public boolean unwatch(Path path) {
    while (true) {
      Optional<WatchRoot> found = registry.resolve(path);
      if (!found.isPresent()) {
        return false;
      }
      WatchRoot root = found.get();
      if (root.transition(RootState.ACTIVE, RootState.REAP_PENDING)) {
        return teardown.teardown(root, RootTeardown.Cause.UNWATCH);
      }
      // lost a race with the reaper; resolve again to see whether the root survived
    }
  }

  /**
   * Registers {@code trigger} on the root, replacing any trigger with the same name.
   *
   * @return false if an identical trigger was already registered
   */
  public boolean addTrigger(Path path, Trigger trigger) {
    return withLiveRoot(path, root -> {
      synchronized (root) {
        Trigger previous = root.triggers().get(trigger.getName());
        if (trigger.equals(previous)) {
          tracker.touch(root);
          return false;
        }
        if (previous == null) {
          tracker.addTrigger(root);
        } else if (root.getState() != RootState.ACTIVE) {
          throw new RootGoneException(root.getPath());
        } else {
          tracker.touch(root);
        }
        root.triggers().put(trigger.getName(), trigger);
      }
      log.info("Registered trigger {} on {}", trigger.getName(), path);
      return true;
    });
  }

  /** @return whether a trigger named {@code name} existed and was removed */
  public boolean removeTrigger(Path path, String name) {
    Optional<WatchRoot> found = registry.resolve(path);
    if (!found.isPresent()) {
      return false;
    }
    WatchRoot root = found.get();
    synchronized (root) {
      if (root.triggers().remove(name) == null) {
        tracker.touch(root);
        return false;
      }
      tracker.removeTrigger(root);
    }
    log.info("Removed trigger {} from {}", name, path);
    return true;
  }

  public List<Trigger> listTriggers(Path path) {
    return withLiveRoot(path, root -> {
      synchronized (root) {
        tracker.touch(root);
        return ImmutableList.copyOf(root.triggers().values());
      }
    });
  }

  /**
   * Subscribes {@code clientId} to changes on the root; re-using a name the client
   * already has on this root replaces that subscription.
   *
   * @throws RootNotFoundException if the path isn't watched
   */
  public Subscription subscribe(String clientId, Path path, String name, Map<String, Object> spec) {
    return withLiveRoot(path, root -> {
      Subscription replaced;
      Subscription created;
      synchronized (root) {
        replaced = Seq
          .seq(root.subscriptions().values())
          .filter(s -> s.getClientId().equals(clientId) && s.getName().equals(name))
          .findFirst()
          .orElse(null);
        if (replaced == null) {
          tracker.addSubscription(root);
        } else if (root.getState() != RootState.ACTIVE) {
          throw new RootGoneException(root.getPath());
        } else {
          root.subscriptions().remove(replaced.getId());
          tracker.touch(root);
        }
        created = new Subscription(nextSubscriptionId.getAndIncrement(), name, clientId, root, spec);
        root.subscriptions().put(created.getId(), created);
        // under the root's monitor, so a teardown flushing this root always sees it in the session
        if (replaced != null) {
          sessions.remove(replaced);
        }
        sessions.add(created);
      }
      log.debug("Client {} subscribed {} on {}", clientId, name, path);
      return created;
    });
  }

  /** @return whether the subscription existed and was deleted */
  public boolean unsubscribe(Path path, long subscriptionId) {
    Optional<WatchRoot> found = registry.resolve(path);
    if (!found.isPresent()) {
      return false;
    }
    WatchRoot root = found.get();
    Subscription subscription;
    synchronized (root) {
      subscription = root.subscriptions().get(subscriptionId);
      if (subscription == null) {
        tracker.touch(root);
        return false;
      }
    }
    return release(subscription);
  }

  /** Unsubscribes by the name the client used when subscribing. */
  public boolean unsubscribe(String clientId, Path path, String name) {
    Optional<WatchRoot> found = registry.resolve(path);
    if (!found.isPresent()) {
      return false;
    }
    WatchRoot root = found.get();
    Optional<Subscription> subscription = Seq
      .seq(sessions.get(clientId))
      .filter(s -> s.getName().equals(name) && s.getRoot() == root)
      .findFirst();
    if (!subscription.isPresent()) {
      tracker.touch(root);
      return false;
    }
    return release(subscription.get());
  }

  /**
   * Releases every subscription {@code clientId} still holds; called by the connection
   * layer on both clean and abrupt disconnects.
   *
   * @return how many subscriptions were released
   */
  public int onClientDisconnect(String clientId) {
    int released = 0;
    for (Subscription subscription : sessions.disconnect(clientId)) {
      if (release(subscription)) {
        released++;
      }
    }
    if (released > 0) {
      log.info("Client {} disconnected, released {} subscriptions", clientId, released);
    }
    return released;
  }

  /** Records activity on the root from outside a client request, e.g. a trigger firing. */
  public boolean recordActivity(Path path) {
    Optional<WatchRoot> root = registry.lookup(path);
    root.ifPresent(tracker::touch);
    return root.isPresent();
  }

  /** @return the root's current files, relative to the root; counts as activity */
  public List<String> listFiles(Path path) {
    return withLiveRoot(path, root -> {
      try (RequestScope scope = tracker.beginRequest(root)) {
        return root.getBackend().getFiles();
      }
    });
  }

  public boolean isWatched(Path path) {
    return registry.lookup(path).isPresent();
  }

  /** @return the paths of every live root, sorted */
  public List<Path> watchList() {
    return Seq.seq(registry.listRoots()).filter(WatchRoot::isLive).map(WatchRoot::getPath).sorted().toList();
  }

  public Optional<RootStatus> rootStatus(Path path) {
    return registry.find(path).map(WatchRoot::getStatus);
  }

  public long getReapCount() {
    return reaper.getReapCount();
  }

  @VisibleForTesting
  IdleReaper getReaper() {
    return reaper;
  }

  @VisibleForTesting
  LivenessTracker getTracker() {
    return tracker;
  }

  @VisibleForTesting
  ClientSessions getSessions() {
    return sessions;
  }

  /** Stops the reaper and tears down every root. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (started.get()) {
      taskFactory.stopTask(reaper);
    }
    for (WatchRoot root : registry.listRoots()) {
      try {
        if (root.transition(RootState.ACTIVE, RootState.REAP_PENDING)) {
          teardown.teardown(root, RootTeardown.Cause.SHUTDOWN);
        }
      } catch (Exception e) {
        log.error("Error closing " + root.getPath(), e);
      }
    }
    if (ownedExecutor != null) {
      ownedExecutor.shutdown();
      Utils.resetIfInterrupted(() -> {
        if (!ownedExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
          log.warn("Teardowns still running after 30 seconds");
        }
      });
    }
    log.info("Closed");
  }

  /**
   * Resolves {@code path} to a live root and applies {@code op}, starting over if the
   * root was moved to teardown in between.
   */
  private <T> T withLiveRoot(Path path, Function<WatchRoot, T> op) {
    while (true) {
      WatchRoot root = registry.resolve(path).orElseThrow(() -> new RootNotFoundException(path));
      try {
        return op.apply(root);
      } catch (RootGoneException e) {
        log.debug("{} went away mid-request, resolving again", path);
      }
    }
  }

  /** Releases one subscription exactly once, however many paths try to. */
  private boolean release(Subscription subscription) {
    WatchRoot root = subscription.getRoot();
    boolean released;
    synchronized (root) {
      released = root.subscriptions().remove(subscription.getId()) != null;
      if (released) {
        tracker.removeSubscription(root);
      }
    }
    sessions.remove(subscription);
    return released;
  }

}
