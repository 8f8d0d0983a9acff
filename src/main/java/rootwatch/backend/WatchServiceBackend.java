package rootwatch.backend;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rootwatch.tasks.TaskFactory;

/**
 * A {@link FileWatcherBackend} on top of {@link java.nio.file.WatchService}, running
 * one {@link WatchServiceRootWatcher} task per root.
 */
public class WatchServiceBackend implements FileWatcherBackend {

  private static final Logger log = LoggerFactory.getLogger(WatchServiceBackend.class);
  private final TaskFactory taskFactory;

  public WatchServiceBackend(TaskFactory taskFactory) {
    this.taskFactory = taskFactory;
  }

  @Override
  public BackendHandle startWatching(Path root) throws IOException {
    WatchServiceRootWatcher watcher = new WatchServiceRootWatcher(FileSystems.getDefault().newWatchService(), root);
    try {
      watcher.performInitialScan();
    } catch (IOException | RuntimeException e) {
      watcher.close();
      throw e;
    }
    taskFactory.runTask(watcher);
    log.debug("Started watching {} with {} files", root, watcher.getFiles().size());
    return watcher;
  }

  @Override
  public void stopWatching(BackendHandle handle) throws IOException {
    if (!(handle instanceof WatchServiceRootWatcher)) {
      throw new IllegalArgumentException("Not a handle from this backend: " + handle);
    }
    WatchServiceRootWatcher watcher = (WatchServiceRootWatcher) handle;
    taskFactory.stopTask(watcher);
    // onStop already closed it if the task ran, but be sure for never-started tasks
    watcher.close();
  }

}
