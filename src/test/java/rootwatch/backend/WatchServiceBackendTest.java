package rootwatch.backend;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import rootwatch.LoggingConfig;
import rootwatch.TestUtils;
import rootwatch.tasks.ThreadBasedTaskFactory;

/**
 * Tests {@link WatchServiceBackend} against a real directory.
 */
public class WatchServiceBackendTest {

  static {
    LoggingConfig.init();
  }

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();
  private final ThreadBasedTaskFactory taskFactory = new ThreadBasedTaskFactory();
  private final WatchServiceBackend backend = new WatchServiceBackend(taskFactory);
  private File dir;
  private Path root;

  @Before
  public void before() throws Exception {
    dir = temp.newFolder("root");
    root = TestUtils.realPath(dir);
  }

  @Test
  public void shouldListFilesFoundByTheInitialCrawl() throws Exception {
    FileUtils.writeStringToFile(new File(dir, "foo.txt"), "abc", UTF_8);
    FileUtils.writeStringToFile(new File(dir, "dir1/bar.txt"), "abc", UTF_8);
    BackendHandle handle = backend.startWatching(root);
    try {
      assertThat(handle.getRoot(), is(root));
      assertThat(handle.getFiles(), hasItems("foo.txt", "dir1", "dir1/bar.txt"));
      assertThat(handle.getFiles().size(), is(3));
    } finally {
      backend.stopWatching(handle);
    }
  }

  @Test
  public void shouldTrackCreatesAndDeletes() throws Exception {
    BackendHandle handle = backend.startWatching(root);
    try {
      FileUtils.writeStringToFile(new File(dir, "dir1/foo.txt"), "abc", UTF_8);
      TestUtils.waitFor(() -> handle.getFiles().contains("dir1/foo.txt"), Duration.ofSeconds(10));

      FileUtils.deleteDirectory(new File(dir, "dir1"));
      TestUtils.waitFor(() -> handle.getFiles().isEmpty(), Duration.ofSeconds(10));
    } finally {
      backend.stopWatching(handle);
    }
  }

  @Test
  public void shouldStopTheRootsTask() throws Exception {
    BackendHandle handle = backend.startWatching(root);
    assertThat(taskFactory.runningTasks(), is(1));
    backend.stopWatching(handle);
    assertThat(taskFactory.runningTasks(), is(0));
  }

  @Test
  public void shouldFailForAMissingRoot() {
    assertThrows(IOException.class, () -> backend.startWatching(root.resolve("missing")));
    assertThat(taskFactory.runningTasks(), is(0));
  }

}
