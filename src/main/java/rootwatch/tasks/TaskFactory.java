package rootwatch.tasks;

/**
 * An abstraction for running tasks on dedicated threads, e.g. the reaper's
 * periodic sweep and each watched root's event loop.
 *
 * Each task gets its own thread, so it can block on I/O (a root's watch
 * service, a slow teardown) without starving the other tasks.
 */
public interface TaskFactory {

  default TaskHandle runTask(TaskLogic logic) {
    return runTask(logic, null);
  }

  TaskHandle runTask(TaskLogic logic, Runnable onFailure);

  void stopTask(TaskLogic logic);

}
