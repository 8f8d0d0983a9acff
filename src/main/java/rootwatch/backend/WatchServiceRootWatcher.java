package rootwatch.backend;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import java.io.File;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import rootwatch.tasks.TaskLogic;

/**
 * Recursively watches one root directory and keeps its file list current.
 *
 * Paths in the file list are relative to the root, e.g. if we're watching
 * {@code /home/user/code/} and {@code project-a/foo.txt} is created, the
 * list gets {@code project-a/foo.txt}.
 *
 * WatchKey.watchable() goes stale when a directory is renamed (JDK-7057783),
 * so we keep our own key to path maps and re-register on create.
 */
class WatchServiceRootWatcher implements TaskLogic, BackendHandle {

  private static final Logger log = LoggerFactory.getLogger(WatchServiceRootWatcher.class);
  private final Map<WatchKey, Path> keyToPath = new ConcurrentHashMap<>();
  private final Map<Path, WatchKey> pathToKey = new ConcurrentHashMap<>();
  private final NavigableSet<String> files = new ConcurrentSkipListSet<>();
  private final WatchService watchService;
  private final Path root;

  WatchServiceRootWatcher(WatchService watchService, Path root) {
    this.watchService = watchService;
    this.root = root;
  }

  /** Registers watches on the whole tree and records the files found; blocks until complete. */
  void performInitialScan() throws IOException {
    if (!Files.isDirectory(root)) {
      throw new NoSuchFileException(root.toString(), null, "not a directory");
    }
    onChangedDirectory(root);
  }

  @Override
  public Path getRoot() {
    return root;
  }

  @Override
  public List<String> getFiles() {
    return ImmutableList.copyOf(files);
  }

  @Override
  public String getName() {
    return "RootWatcher";
  }

  @Override
  public void onInterrupt() {
    // wakes up the take() in runOneLoop
    close();
  }

  @Override
  public void onStop() {
    close();
  }

  void close() {
    try {
      watchService.close();
    } catch (IOException e) {
      log.warn("Exception when shutting down the watch service for " + root, e);
    }
  }

  @Override
  public Duration runOneLoop() throws InterruptedException {
    WatchKey watchKey;
    try {
      watchKey = watchService.take();
    } catch (ClosedWatchServiceException e) {
      // shutting down
      return Duration.ofMillis(-1);
    }
    Path parentDir = keyToPath.get(watchKey);
    for (WatchEvent<?> watchEvent : watchKey.pollEvents()) {
      WatchEvent.Kind<?> eventKind = watchEvent.kind();
      if (log.isTraceEnabled()) {
        log.trace("WatchEvent {} {}", eventKind, watchEvent.context());
      }
      if (eventKind == OVERFLOW) {
        log.warn("Watcher overflow for {}, re-crawling", root);
        recrawl();
        continue;
      }
      if (parentDir == null) {
        log.debug("Missing parentDir for {}: {}", watchKey.watchable(), watchEvent.context());
        continue;
      }
      Path child = parentDir.resolve((Path) watchEvent.context());
      try {
        if (eventKind == ENTRY_CREATE || eventKind == ENTRY_MODIFY) {
          onChangedPath(child);
        } else if (eventKind == ENTRY_DELETE) {
          onRemovedPath(child);
        }
      } catch (IOException e) {
        log.warn("Could not process " + eventKind + " of " + child, e);
      }
    }
    watchKey.reset();
    return null;
  }

  private void recrawl() {
    keyToPath.keySet().forEach(WatchKey::cancel);
    keyToPath.clear();
    pathToKey.clear();
    files.clear();
    try {
      onChangedDirectory(root);
    } catch (IOException e) {
      log.error("Could not re-crawl " + root, e);
    }
  }

  private void onChangedPath(Path path) throws IOException {
    try {
      if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
        onChangedDirectory(path);
      } else {
        files.add(toRelativePath(path));
      }
    } catch (NoSuchFileException e) {
      // deleted while we were looking at it, the delete event will follow
    }
  }

  private void onRemovedPath(Path path) {
    String relative = toRelativePath(path);
    files.remove(relative);
    // if it was a directory, drop its children and stop watching it
    files.subSet(relative + "/", relative + "0").clear();
    WatchKey key = pathToKey.remove(path);
    if (key != null) {
      keyToPath.remove(key);
      key.cancel();
    }
  }

  private void onChangedDirectory(Path directory) throws IOException {
    if (pathToKey.containsKey(directory)) {
      return;
    }
    Files.walkFileTree(directory, new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
        if (!dir.equals(root)) {
          files.add(toRelativePath(dir));
        }
        watchDirectory(dir);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        files.add(toRelativePath(file));
        return FileVisitResult.CONTINUE;
      }
    });
  }

  private void watchDirectory(Path directory) throws IOException {
    WatchKey key = directory.register(watchService, ENTRY_CREATE, ENTRY_DELETE, ENTRY_MODIFY);
    keyToPath.put(key, directory);
    pathToKey.put(directory, key);
  }

  private String toRelativePath(Path path) {
    return root.relativize(path).toString().replace(File.separator, "/");
  }

  @Override
  public String toString() {
    return "WatchServiceRootWatcher[" + root + "]";
  }

}
