package rootwatch.tasks;

/** A handle to a running task, so the caller can stop it without holding onto the factory. */
@FunctionalInterface
public interface TaskHandle {

  void stop();

}
