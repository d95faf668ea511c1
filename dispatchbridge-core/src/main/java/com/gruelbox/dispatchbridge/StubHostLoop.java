package com.gruelbox.dispatchbridge;

import java.util.ArrayDeque;
import java.util.Deque;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link HostLoop} with no thread of its own. Wake-ups are queued and only run when a test calls
 * {@link #runPending()}, on the calling thread, which is treated as the host thread for the
 * duration. Intended for tests which need to control exactly when the host loop runs.
 */
@Slf4j
public final class StubHostLoop implements HostLoop {

  private final Deque<Runnable> pending = new ArrayDeque<>();
  private volatile Thread runningThread;

  @Override
  public synchronized void wake(Runnable drain) {
    pending.add(drain);
  }

  /**
   * Runs queued wake-ups, including any queued while running, until none remain.
   *
   * @return The number of wake-ups run.
   */
  public int runPending() {
    int count = 0;
    Runnable next;
    while ((next = poll()) != null) {
      runningThread = Thread.currentThread();
      try {
        next.run();
      } finally {
        runningThread = null;
      }
      count++;
    }
    log.debug("Ran {} pending wake-up(s)", count);
    return count;
  }

  public synchronized int pendingCount() {
    return pending.size();
  }

  @Override
  public boolean isHostThread() {
    return Thread.currentThread() == runningThread;
  }

  private synchronized Runnable poll() {
    return pending.poll();
  }
}
