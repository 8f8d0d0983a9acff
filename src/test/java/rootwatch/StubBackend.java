package rootwatch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

import com.google.common.collect.ImmutableList;

import rootwatch.backend.BackendHandle;
import rootwatch.backend.FileWatcherBackend;

/** Records start/stop calls, and can be told to fail or block for a given root. */
public class StubBackend implements FileWatcherBackend {

  final List<Path> started = new CopyOnWriteArrayList<>();
  final List<Path> stopped = new CopyOnWriteArrayList<>();
  final Map<Path, CountDownLatch> blockStart = new ConcurrentHashMap<>();
  final Map<Path, CountDownLatch> blockStop = new ConcurrentHashMap<>();
  volatile IOException failStart;

  private static class StubHandle implements BackendHandle {
    private final Path root;

    private StubHandle(Path root) {
      this.root = root;
    }

    @Override
    public Path getRoot() {
      return root;
    }

    @Override
    public List<String> getFiles() {
      return ImmutableList.of(RootConfig.fileName);
    }
  }

  @Override
  public BackendHandle startWatching(Path root) throws IOException {
    await(blockStart.get(root));
    if (failStart != null) {
      throw failStart;
    }
    started.add(root);
    return new StubHandle(root);
  }

  @Override
  public void stopWatching(BackendHandle handle) throws IOException {
    await(blockStop.get(handle.getRoot()));
    stopped.add(handle.getRoot());
  }

  private static void await(CountDownLatch latch) {
    if (latch != null) {
      Utils.resetIfInterrupted(() -> latch.await());
    }
  }
}
