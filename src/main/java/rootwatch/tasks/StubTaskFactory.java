package rootwatch.tasks;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import rootwatch.Utils;

/**
 * A {@link TaskFactory} for unit tests that never starts threads; tests call
 * {@link #tick()} to run one loop of every task.
 */
public class StubTaskFactory implements TaskFactory {

  private final Map<TaskLogic, StubTask> tasks = new ConcurrentHashMap<>();

  @Override
  public TaskHandle runTask(TaskLogic logic, Runnable onFailure) {
    StubTask task = new StubTask(logic, onFailure);
    tasks.put(logic, task);
    return () -> stopTask(logic);
  }

  @Override
  public void stopTask(TaskLogic logic) {
    StubTask task = tasks.remove(logic);
    if (task != null) {
      Utils.resetIfInterrupted(() -> task.stop());
    }
  }

  public void tick() {
    tasks.values().forEach(t -> Utils.resetIfInterrupted(() -> t.tick()));
  }

  public boolean isRunning(TaskLogic logic) {
    return tasks.containsKey(logic);
  }

  public Duration getLastDuration(TaskLogic logic) {
    return tasks.get(logic).lastDuration;
  }
}
