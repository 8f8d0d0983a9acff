package rootwatch;

import java.nio.file.Path;

/** An operation referenced a path that is not currently watched. */
public class RootNotFoundException extends RootwatchException {

  private static final long serialVersionUID = 1L;

  public RootNotFoundException(Path path) {
    super(path, "unable to resolve root " + path + ": directory is not watched");
  }
}
