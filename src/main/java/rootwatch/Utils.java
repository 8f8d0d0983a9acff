package rootwatch;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;

public class Utils {

  @FunctionalInterface
  public interface InterruptedRunnable {
    void run() throws InterruptedException;
  }

  public static void resetIfInterrupted(InterruptedRunnable r) {
    try {
      r.run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    }
  }

  public static void time(Logger log, String action, Runnable r) {
    log.debug("Starting " + action);
    long start = System.currentTimeMillis();
    r.run();
    long stop = System.currentTimeMillis();
    log.info("Completed " + action + ": " + (stop - start) + "ms");
  }

  /**
   * Resolves symlinks and relative segments so that /home/foo/./bar and a symlink
   * to it both key the same root; falls back to the normalized absolute path when
   * the directory no longer exists (e.g. looking up a root whose directory was deleted).
   */
  public static Path canonicalize(Path path) {
    try {
      return path.toRealPath();
    } catch (IOException e) {
      return path.toAbsolutePath().normalize();
    }
  }

}
