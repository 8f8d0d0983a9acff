package rootwatch;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.collect.ImmutableMap;

/**
 * Runs the idle reaper for real, with real threads, a real clock and the
 * {@link rootwatch.backend.WatchServiceBackend}.
 */
public class IdleReapIntegrationTest {

  static {
    LoggingConfig.init();
  }

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private WatchService service;

  @Before
  public void before() {
    service = WatchService.create(new DaemonConfig(0, Duration.ofMillis(100)));
    service.start();
  }

  @After
  public void after() {
    service.close();
  }

  @Test
  public void shouldReapOnlyOnceTheLastHolderIsGone() throws Exception {
    Path root = makeRootAndConfig("root");
    service.watch(root);

    // not reaped while there is a trigger
    service.addTrigger(root, new Trigger("t", Arrays.asList("true")));
    Thread.sleep(2500);
    assertThat(service.isWatched(root), is(true));

    assertThat(service.removeTrigger(root, "t"), is(true));

    // nor while we hold a subscription
    Subscription s = service.subscribe("client-1", root, "s", ImmutableMap.of("fields", Arrays.asList("name")));
    Thread.sleep(2500);
    assertThat(service.isWatched(root), is(true));

    // a second root is fully watched, without waiting on the first
    Path second = makeRootAndConfig("second");
    service.watch(second);
    assertThat(service.listFiles(second), is(Arrays.asList(RootConfig.fileName)));

    // and now both can be reaped
    assertThat(service.unsubscribe(root, s.getId()), is(true));
    TestUtils.waitFor(() -> !service.isWatched(root) && !service.isWatched(second), Duration.ofSeconds(10));
    assertThat(service.getReapCount(), is(2L));
  }

  @Test
  public void shouldReapAfterAnAbruptDisconnect() throws Exception {
    Path root = makeRootAndConfig("root");
    service.watch(root);
    service.subscribe("client-1", root, "s", ImmutableMap.of());
    Thread.sleep(1500);
    assertThat(service.isWatched(root), is(true));

    service.onClientDisconnect("client-1");
    TestUtils.waitFor(() -> !service.isWatched(root), Duration.ofSeconds(10));
  }

  @Test
  public void shouldWatchAgainAfterAReap() throws Exception {
    Path root = makeRootAndConfig("root");
    WatchRoot first = service.watch(root);
    TestUtils.waitFor(() -> !service.isWatched(root), Duration.ofSeconds(10));

    WatchRoot second = service.watch(root);
    assertThat(second == first, is(false));
    assertThat(service.listFiles(root), is(Arrays.asList(RootConfig.fileName)));
  }

  private Path makeRootAndConfig(String name) throws Exception {
    File dir = temp.newFolder(name);
    TestUtils.writeRootConfig(dir, 1);
    return TestUtils.realPath(dir);
  }

}
