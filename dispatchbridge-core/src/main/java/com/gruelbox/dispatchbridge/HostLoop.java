package com.gruelbox.dispatchbridge;

import java.util.concurrent.Executor;

/**
 * The wake mechanism of a single-threaded host loop. A {@link CrossThreadNotifier} is attached to
 * exactly one {@code HostLoop} and uses it to get its drain step run on the host loop thread.
 *
 * <p>Any single-threaded event loop can act as a host loop, for example:
 *
 * <pre>HostLoop swing = ExecutorHostLoop.builder()
 *     .executor(SwingUtilities::invokeLater)
 *     .hostThreadCheck(SwingUtilities::isEventDispatchThread)
 *     .build();</pre>
 */
public interface HostLoop extends AutoCloseable {

  /**
   * Wraps an existing single-threaded {@link Executor}. Shortcut for {@code
   * ExecutorHostLoop.builder().executor(executor).build()}.
   *
   * @param executor The executor. It must run tasks one at a time, in submission order.
   * @return The host loop.
   */
  static HostLoop withExecutor(Executor executor) {
    return ExecutorHostLoop.builder().executor(executor).build();
  }

  /**
   * Creates a host loop backed by a dedicated, daemon thread. Closing it stops the thread.
   *
   * @return The host loop.
   */
  static HostLoop singleThreaded() {
    return ExecutorHostLoop.builder().build();
  }

  /**
   * Requests that {@code drain} be run on the host loop thread. Callable from any thread; must not
   * run {@code drain} on the calling thread unless that is the host loop thread.
   *
   * @param drain The work to schedule.
   */
  void wake(Runnable drain);

  /**
   * @return true if the calling thread is the host loop thread.
   */
  boolean isHostThread();

  @Override
  default void close() {
    // No-op
  }
}
