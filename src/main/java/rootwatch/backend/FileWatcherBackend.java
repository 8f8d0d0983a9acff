package rootwatch.backend;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The file-notification layer that does the actual watching of a root.
 *
 * The root lifecycle code only starts and stops watches; how changes are
 * detected and delivered is up to the implementation.
 */
public interface FileWatcherBackend {

  /**
   * Starts watching {@code root}, blocking until the initial crawl is complete.
   *
   * @throws IOException if the root is missing, unreadable, or we're out of watches
   */
  BackendHandle startWatching(Path root) throws IOException;

  /** Stops a watch started by {@link #startWatching(Path)}; may block on I/O. */
  void stopWatching(BackendHandle handle) throws IOException;

}
