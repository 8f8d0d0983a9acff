package rootwatch;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.util.concurrent.MoreExecutors;

import rootwatch.tasks.StubTaskFactory;

public class IdleReaperTest {

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private final MutableClock clock = new MutableClock();
  private final StubBackend backend = new StubBackend();
  private final StubTaskFactory taskFactory = new StubTaskFactory();
  private final DaemonConfig config = new DaemonConfig(3, Duration.ofSeconds(1));
  private WatchService service;
  private Path a;
  private Path b;

  @Before
  public void before() throws Exception {
    service = new WatchService(config, backend, taskFactory, MoreExecutors.directExecutor(), clock);
    a = TestUtils.realPath(temp.newFolder("a"));
    b = TestUtils.realPath(temp.newFolder("b"));
  }

  @After
  public void after() {
    service.close();
  }

  @Test
  public void shouldReapARootOnceItHasBeenIdleLongEnough() {
    service.watch(a);
    clock.advance(Duration.ofSeconds(2));
    sweep();
    assertThat(service.isWatched(a), is(true));

    clock.advance(Duration.ofSeconds(1));
    sweep();
    assertThat(service.isWatched(a), is(false));
    assertThat(backend.stopped, is(Arrays.asList(a)));
    assertThat(service.getReapCount(), is(1L));
  }

  @Test
  public void shouldNotReapARootWithATrigger() {
    service.watch(a);
    service.addTrigger(a, new Trigger("t", Arrays.asList("true")));
    clock.advance(Duration.ofSeconds(6));
    sweep();
    assertThat(service.isWatched(a), is(true));

    service.removeTrigger(a, "t");
    clock.advance(Duration.ofSeconds(3));
    sweep();
    assertThat(service.isWatched(a), is(false));
  }

  @Test
  public void shouldNotReapARootWithASubscription() {
    service.watch(a);
    Subscription s = service.subscribe("client-1", a, "s", Collections.singletonMap("fields", Arrays.asList("name")));
    clock.advance(Duration.ofSeconds(6));
    sweep();
    assertThat(service.isWatched(a), is(true));

    assertThat(service.unsubscribe(a, s.getId()), is(true));
    // unsubscribing is activity, so the idle age starts over
    clock.advance(Duration.ofSeconds(2));
    sweep();
    assertThat(service.isWatched(a), is(true));
    clock.advance(Duration.ofSeconds(1));
    sweep();
    assertThat(service.isWatched(a), is(false));
  }

  @Test
  public void shouldNotReapARootWithARequestInFlight() {
    WatchRoot root = service.watch(a);
    RequestScope scope = service.getTracker().beginRequest(root);
    clock.advance(Duration.ofSeconds(6));
    sweep();
    assertThat(service.isWatched(a), is(true));

    scope.close();
    clock.advance(Duration.ofSeconds(3));
    sweep();
    assertThat(service.isWatched(a), is(false));
  }

  @Test
  public void shouldNeverReapARootWithAZeroAge() throws Exception {
    TestUtils.writeRootConfig(a.toFile(), 0);
    service.watch(a);
    clock.advance(Duration.ofDays(10));
    sweep();
    assertThat(service.isWatched(a), is(true));
  }

  @Test
  public void shouldUseTheRootsOwnAgeOverTheDaemonDefault() throws Exception {
    TestUtils.writeRootConfig(a.toFile(), 10);
    service.watch(a);
    service.watch(b);
    clock.advance(Duration.ofSeconds(3));
    sweep();
    assertThat(service.watchList(), is(Arrays.asList(a)));
    clock.advance(Duration.ofSeconds(7));
    sweep();
    assertThat(service.watchList().isEmpty(), is(true));
  }

  @Test
  public void shouldSweepFromItsTask() {
    service.start();
    service.watch(a);
    clock.advance(Duration.ofSeconds(3));
    taskFactory.tick();
    assertThat(service.isWatched(a), is(false));
    assertThat(taskFactory.getLastDuration(service.getReaper()), is(Duration.ofSeconds(1)));
  }

  @Test
  public void shouldCreateAFreshRootWhenWatchedAfterAReap() {
    WatchRoot first = service.watch(a);
    clock.advance(Duration.ofSeconds(3));
    sweep();
    WatchRoot second = service.watch(a);
    assertThat(second, is(not(sameInstance(first))));
    assertThat(second.getCreatedAt(), is(clock.instant()));
    assertThat(first.getState(), is(RootState.TORN_DOWN));
  }

  @Test
  public void shouldReapTwoRootsWithoutOneWaitingOnTheOther() throws Exception {
    ExecutorService pool = Executors.newCachedThreadPool();
    WatchService concurrent = new WatchService(config, backend, taskFactory, pool, clock);
    try {
      // a's teardown will hang until we let it go
      CountDownLatch releaseA = new CountDownLatch(1);
      backend.blockStop.put(a, releaseA);
      concurrent.watch(a);
      concurrent.watch(b);
      clock.advance(Duration.ofSeconds(3));
      assertThat(concurrent.getReaper().sweep().size(), is(2));

      // b is reaped while a is still stuck
      TestUtils.waitFor(() -> !concurrent.rootStatus(b).isPresent(), Duration.ofSeconds(5));
      assertThat(concurrent.rootStatus(a).get().getState(), is(RootState.REAP_PENDING));
      // and a new root can still be watched meanwhile
      Path c = TestUtils.realPath(temp.newFolder("c"));
      assertThat(concurrent.watch(c).isLive(), is(true));

      releaseA.countDown();
      TestUtils.waitFor(() -> concurrent.getReapCount() == 2, Duration.ofSeconds(5));
      assertThat(concurrent.watchList(), is(Arrays.asList(c)));
    } finally {
      concurrent.close();
      pool.shutdownNow();
    }
  }

  @Test
  public void shouldNotStartASecondTeardownForAPendingRoot() throws Exception {
    ExecutorService pool = Executors.newCachedThreadPool();
    WatchService concurrent = new WatchService(config, backend, taskFactory, pool, clock);
    try {
      CountDownLatch releaseA = new CountDownLatch(1);
      backend.blockStop.put(a, releaseA);
      concurrent.watch(a);
      clock.advance(Duration.ofSeconds(3));
      assertThat(concurrent.getReaper().sweep().size(), is(1));
      assertThat(concurrent.getReaper().sweep().size(), is(0));
      releaseA.countDown();
      TestUtils.waitFor(() -> concurrent.getReapCount() == 1, Duration.ofSeconds(5));
      assertThat(backend.stopped, is(Arrays.asList(a)));
    } finally {
      concurrent.close();
      pool.shutdownNow();
    }
  }

  private void sweep() {
    service.getReaper().sweep();
  }

}
