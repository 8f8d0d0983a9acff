package rootwatch;

import java.nio.file.Path;

/**
 * A detach call exceeded the matching attach count. This is a bookkeeping bug in the
 * caller, the counter has already been clamped at zero by the time this is thrown.
 */
public class InvariantViolationException extends RootwatchException {

  private static final long serialVersionUID = 1L;

  public InvariantViolationException(Path path, String message) {
    super(path, message);
  }
}
