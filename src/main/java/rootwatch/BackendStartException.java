package rootwatch;

import java.nio.file.Path;

/** The file watching backend could not start watching a root; nothing was registered. */
public class BackendStartException extends RootwatchException {

  private static final long serialVersionUID = 1L;

  public BackendStartException(Path path, Throwable cause) {
    super(path, "unable to watch " + path + ": " + cause.getMessage(), cause);
  }
}
