package bahn.vision.global.executor.function;

@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
