package rootwatch;

import java.nio.file.Path;

/**
 * Base class for failures surfaced to callers of {@link WatchService}.
 */
public class RootwatchException extends RuntimeException {

  private static final long serialVersionUID = 1L;
  private final Path path;

  public RootwatchException(Path path, String message) {
    super(message);
    this.path = path;
  }

  public RootwatchException(Path path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  /** @return the root path the failed operation referenced, may be null */
  public Path getPath() {
    return path;
  }
}
