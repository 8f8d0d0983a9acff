package rootwatch.tasks;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs each task on a dedicated thread.
 */
public class ThreadBasedTaskFactory implements TaskFactory {

  private final ConcurrentHashMap<TaskLogic, ThreadBasedTask> tasks = new ConcurrentHashMap<>();

  @Override
  public TaskHandle runTask(TaskLogic logic, Runnable onFailure) {
    ThreadBasedTask task = new ThreadBasedTask(logic, onFailure, () -> {
      // the task is already stopping, we just need to drop our entry to avoid leaking it
      tasks.remove(logic);
    });
    tasks.put(logic, task);
    task.start();
    return () -> stopTask(logic);
  }

  // Not synchronized: stopping one root's watcher blocks until its thread exits,
  // and other roots must be able to start/stop their own watchers meanwhile.
  @Override
  public void stopTask(TaskLogic logic) {
    ThreadBasedTask task = tasks.remove(logic);
    if (task != null) {
      task.stop();
    }
  }

  public int runningTasks() {
    return tasks.size();
  }

}
