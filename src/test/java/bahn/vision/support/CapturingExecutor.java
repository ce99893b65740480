package bahn.vision.support;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/** 제출된 작업을 실행하지 않고 보관하는 Executor (runAll로 수동 실행) */
public class CapturingExecutor implements Executor {

  private final List<Runnable> tasks = new ArrayList<>();

  @Override
  public synchronized void execute(Runnable command) {
    tasks.add(command);
  }

  public synchronized int size() {
    return tasks.size();
  }

  public void runAll() {
    List<Runnable> pending;
    synchronized (this) {
      pending = new ArrayList<>(tasks);
      tasks.clear();
    }
    pending.forEach(Runnable::run);
  }
}
