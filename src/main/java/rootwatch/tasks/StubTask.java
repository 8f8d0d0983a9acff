package rootwatch.tasks;

import java.time.Duration;

class StubTask {

  final TaskLogic logic;
  final Runnable onFailure;
  Duration lastDuration;
  boolean started;

  StubTask(TaskLogic logic, Runnable onFailure) {
    this.logic = logic;
    this.onFailure = onFailure;
  }

  void tick() throws InterruptedException {
    if (!started) {
      started = true;
      logic.onStart();
    }
    try {
      lastDuration = logic.runOneLoop();
    } catch (RuntimeException e) {
      if (onFailure != null) {
        onFailure.run();
      }
      throw e;
    }
  }

  void stop() throws InterruptedException {
    logic.onStop();
  }
}
