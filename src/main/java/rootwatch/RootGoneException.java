package rootwatch;

import java.nio.file.Path;

/**
 * Thrown when attaching a holder to a root that has already left {@link RootState#ACTIVE};
 * {@link WatchService} catches it and re-resolves the path.
 */
class RootGoneException extends RootwatchException {

  private static final long serialVersionUID = 1L;

  RootGoneException(Path path) {
    super(path, "root " + path + " is being torn down");
  }
}
