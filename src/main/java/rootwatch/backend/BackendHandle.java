package rootwatch.backend;

import java.nio.file.Path;
import java.util.List;

/**
 * A started watch on one root, returned by {@link FileWatcherBackend#startWatching(Path)}.
 */
public interface BackendHandle {

  Path getRoot();

  /** @return the root's current files, relative to the root, using forward slashes */
  List<String> getFiles();

}
