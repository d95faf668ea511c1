package com.gruelbox.dispatchbridge;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * A one-shot "wait until done" primitive. A worker thread calls {@link #await()} and blocks until
 * another thread (usually a handler running on the host loop) calls {@link #done()}.
 *
 * <p>{@link #done()} sets a flag rather than firing an event, so a {@code done()} which arrives
 * before the matching {@code await()} is not lost. The flag is not a counter: two {@code done()}
 * calls with no {@code await()} in between release a single {@code await()}.
 *
 * <p>Only one waiter per instance is supported. Concurrent waiters race for the same flag.
 */
@Slf4j
public final class WaitSignal {

  /** The state of the flag. */
  public enum State {
    IDLE,
    WAITING,
    SIGNALED
  }

  private final Lock lock = new ReentrantLock();
  private final Condition condition = lock.newCondition();
  private State state = State.IDLE;

  /**
   * Blocks, with no timeout and ignoring interrupts, until {@link #done()} has been called, then
   * resets the flag. Returns immediately if {@code done()} was already called.
   *
   * <p>If nothing ever calls {@code done()}, this never returns.
   */
  public void await() {
    lock.lock();
    try {
      while (state != State.SIGNALED) {
        state = State.WAITING;
        condition.awaitUninterruptibly();
      }
      state = State.IDLE;
    } finally {
      lock.unlock();
    }
  }

  /**
   * As {@link #await()}, but gives up after {@code timeout}. On timeout the flag is reset to {@link
   * State#IDLE}, so a late {@link #done()} is absorbed and releases the next {@code await}.
   *
   * @param timeout The maximum time to wait. Durations too long to express in nanoseconds wait
   *     as long as the platform allows.
   * @return true if {@link #done()} was observed, false if the timeout elapsed first.
   * @throws InterruptedException If the waiting thread is interrupted.
   */
  public boolean await(Duration timeout) throws InterruptedException {
    if (timeout == null) {
      throw new IllegalArgumentException("timeout may not be null");
    }
    lock.lockInterruptibly();
    try {
      if (state == State.SIGNALED) {
        state = State.IDLE;
        return true;
      }
      long remaining = toNanosSaturated(timeout);
      while (state != State.SIGNALED) {
        if (remaining <= 0L) {
          state = State.IDLE;
          log.debug("Gave up waiting for completion after {}", timeout);
          return false;
        }
        state = State.WAITING;
        try {
          remaining = condition.awaitNanos(remaining);
        } catch (InterruptedException e) {
          if (state == State.WAITING) {
            state = State.IDLE;
          }
          throw e;
        }
      }
      state = State.IDLE;
      return true;
    } finally {
      lock.unlock();
    }
  }

  private static long toNanosSaturated(Duration timeout) {
    try {
      return timeout.toNanos();
    } catch (ArithmeticException e) {
      return timeout.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  /** Marks completion, releasing the current or next {@link #await()}. */
  public void done() {
    lock.lock();
    try {
      state = State.SIGNALED;
      condition.signal();
    } finally {
      lock.unlock();
    }
  }

  public State state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }
}
