package com.gruelbox.dispatchbridge;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link HostLoop} which runs drains on an {@link Executor}. The executor must be
 * single-threaded and ordered: the whole point of a host loop is that callbacks never run
 * concurrently.
 *
 * <p>If no executor is supplied, a dedicated daemon thread is created and owned by this instance,
 * and shut down by {@link #close()}.
 */
@Slf4j
public final class ExecutorHostLoop implements HostLoop, Validatable {

  private final Executor executor;
  private final boolean shutdownExecutorOnClose;
  private final BooleanSupplier hostThreadCheck;
  private final ThreadLocal<Boolean> draining = ThreadLocal.withInitial(() -> false);
  private volatile Thread hostThread;

  private ExecutorHostLoop(Executor executor, BooleanSupplier hostThreadCheck, String threadName) {
    if (executor != null) {
      this.executor = executor;
      this.shutdownExecutorOnClose = false;
      this.hostThreadCheck = hostThreadCheck;
    } else {
      this.executor =
          Executors.newSingleThreadExecutor(
              runnable -> {
                Thread thread = new Thread(runnable, threadName);
                thread.setDaemon(true);
                hostThread = thread;
                return thread;
              });
      this.shutdownExecutorOnClose = true;
      this.hostThreadCheck =
          hostThreadCheck == null ? () -> Thread.currentThread() == hostThread : hostThreadCheck;
    }
  }

  public static ExecutorHostLoopBuilder builder() {
    return new ExecutorHostLoopBuilder();
  }

  @Override
  public void wake(Runnable drain) {
    try {
      executor.execute(
          () -> {
            draining.set(true);
            try {
              drain.run();
            } finally {
              draining.remove();
            }
          });
    } catch (RejectedExecutionException e) {
      log.error("Host loop rejected a wake-up. Is it shut down?", e);
      throw e;
    }
  }

  @Override
  public boolean isHostThread() {
    if (hostThreadCheck != null) {
      return hostThreadCheck.getAsBoolean();
    }
    return draining.get();
  }

  @Override
  public void validate(Validator validator) {
    validator.notNull("executor", executor);
  }

  @Override
  public void close() {
    if (!shutdownExecutorOnClose) {
      return;
    }
    log.debug("Shutting down host loop thread");
    Utils.shutdown((ExecutorService) executor);
  }

  public static class ExecutorHostLoopBuilder {
    private Executor executor;
    private BooleanSupplier hostThreadCheck;
    private String threadName;

    ExecutorHostLoopBuilder() {}

    /**
     * @param executor The single-threaded executor to run drains on. If not provided, a dedicated
     *     daemon thread is created.
     * @return Builder.
     */
    public ExecutorHostLoopBuilder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * @param hostThreadCheck Answers whether the calling thread is the executor's thread, e.g.
     *     {@code SwingUtilities::isEventDispatchThread}. If not provided for a supplied executor,
     *     only threads currently running a drain are recognised as the host thread.
     * @return Builder.
     */
    public ExecutorHostLoopBuilder hostThreadCheck(BooleanSupplier hostThreadCheck) {
      this.hostThreadCheck = hostThreadCheck;
      return this;
    }

    /**
     * @param threadName The name of the dedicated thread, when no executor is supplied. Defaults to
     *     {@code dispatchbridge-host-loop}.
     * @return Builder.
     */
    public ExecutorHostLoopBuilder threadName(String threadName) {
      this.threadName = threadName;
      return this;
    }

    public ExecutorHostLoop build() {
      Validator validator = new Validator();
      validator.nullOrNotBlank("threadName", threadName);
      ExecutorHostLoop hostLoop =
          new ExecutorHostLoop(
              executor,
              hostThreadCheck,
              Utils.firstNonNull(threadName, () -> "dispatchbridge-host-loop"));
      validator.validate(hostLoop);
      return hostLoop;
    }
  }
}
