package com.gruelbox.dispatchbridge;

import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;

/**
 * Hands single {@link DispatchDescriptor}s from worker threads to the host loop. One notifier is
 * shared by every {@link DispatchBridge} in the process and is owned by a {@link BridgeRuntime}.
 *
 * <p>The notifier has a single slot, not a queue. {@link #post(DispatchDescriptor)} moves a
 * descriptor into the slot and wakes the {@link HostLoop}; the host loop moves it out again and
 * invokes its callback. Callers must not post again until the previous descriptor has been drained;
 * what happens if they do is governed by the {@link SlotPolicy}.
 */
@Slf4j
public final class CrossThreadNotifier implements Validatable {

  private final AtomicReference<DispatchDescriptor> slot = new AtomicReference<>();
  private final SlotPolicy slotPolicy;
  private final DispatchListener listener;
  private final Level logLevelOverwrite;
  private final boolean propagateMdc;
  private volatile HostLoop hostLoop;
  private volatile boolean closed;

  private CrossThreadNotifier(
      SlotPolicy slotPolicy,
      DispatchListener listener,
      Level logLevelOverwrite,
      boolean propagateMdc) {
    this.slotPolicy = slotPolicy;
    this.listener = listener;
    this.logLevelOverwrite = logLevelOverwrite;
    this.propagateMdc = propagateMdc;
  }

  public static CrossThreadNotifierBuilder builder() {
    return new CrossThreadNotifierBuilder();
  }

  /**
   * Binds the notifier to the host loop it will wake. Must happen before any post.
   *
   * @param hostLoop The host loop.
   */
  public synchronized void attach(HostLoop hostLoop) {
    if (hostLoop == null) {
      throw new IllegalArgumentException("hostLoop may not be null");
    }
    if (closed) {
      throw new IllegalStateException("Notifier has been closed");
    }
    if (this.hostLoop != null && this.hostLoop != hostLoop) {
      throw new IllegalStateException("Notifier is already attached to another host loop");
    }
    this.hostLoop = hostLoop;
    log.debug("Attached to host loop {}", hostLoop);
  }

  public boolean isAttached() {
    return hostLoop != null && !closed;
  }

  HostLoop hostLoop() {
    return hostLoop;
  }

  DispatchListener listener() {
    return listener;
  }

  boolean propagatesMdc() {
    return propagateMdc;
  }

  /**
   * @return true if a descriptor has been posted but not yet drained by the host loop.
   */
  public boolean isSlotOccupied() {
    return slot.get() != null;
  }

  /**
   * Moves {@code descriptor} into the slot and wakes the host loop. Callable from any thread. The
   * listener hears of the post before the host loop is woken; its failures are logged, not thrown.
   *
   * @param descriptor The call to make on the host loop.
   * @throws NotifierNotAttachedException If the notifier is not attached to a live host loop.
   * @throws SlotBusyException Under {@link SlotPolicy#REJECT}, if the previous descriptor has not
   *     been drained.
   */
  public void post(DispatchDescriptor descriptor) {
    HostLoop target = hostLoop;
    if (target == null || closed) {
      log.error(
          "Cannot dispatch {}: notifier is not attached to a host loop", descriptor.description());
      throw new NotifierNotAttachedException(
          "Cannot dispatch "
              + descriptor.description()
              + ". The notifier must be attached to a host loop before any dispatch");
    }
    fill(descriptor);
    log.debug("Posted {}", descriptor.description());
    Utils.safelyRun("notifying listener of post", () -> listener.posted(descriptor));
    try {
      target.wake(this::drain);
    } catch (RuntimeException e) {
      slot.compareAndSet(descriptor, null);
      throw e;
    }
  }

  private void fill(DispatchDescriptor descriptor) {
    if (slotPolicy == SlotPolicy.REJECT) {
      if (!slot.compareAndSet(null, descriptor)) {
        DispatchDescriptor pending = slot.get();
        if (pending != null) {
          throw new SlotBusyException(descriptor, pending);
        }
        // Drained between the two reads
        fill(descriptor);
      }
      return;
    }
    DispatchDescriptor discarded = slot.getAndSet(descriptor);
    if (discarded != null) {
      Utils.logAtLevel(
          log,
          logLevelOverwrite,
          "Overwrote undrained {} with {}; it will not be invoked",
          discarded.description(),
          descriptor.description());
      Utils.safelyRun(
          "notifying listener of overwrite", () -> listener.overwritten(discarded, descriptor));
    }
  }

  /** Runs on the host loop thread. Coalesced wake-ups find the slot empty and do nothing. */
  void drain() {
    DispatchDescriptor descriptor = slot.getAndSet(null);
    if (descriptor == null) {
      log.trace("Woken with an empty slot");
      return;
    }
    Utils.withinMdc(descriptor.getMdc(), () -> invoke(descriptor));
  }

  private void invoke(DispatchDescriptor descriptor) {
    log.debug("Invoking {}", descriptor.description());
    try {
      listener.wrapInvocation(
          descriptor, () -> descriptor.getCallback().invoke(descriptor.getOrigin()));
    } catch (Exception e) {
      log.error("Callback {} failed", descriptor.description(), e);
      Utils.safelyRun("notifying listener of failure", () -> listener.failure(descriptor, e));
      return;
    }
    Utils.safelyRun("notifying listener of success", () -> listener.success(descriptor));
  }

  /** Detaches from the host loop. Any later post is a {@link NotifierNotAttachedException}. */
  public synchronized void close() {
    closed = true;
    DispatchDescriptor abandoned = slot.getAndSet(null);
    if (abandoned != null) {
      log.warn("Closed with {} still undrained", abandoned.description());
    }
  }

  @Override
  public void validate(Validator validator) {
    validator.notNull("slotPolicy", slotPolicy);
    validator.notNull("listener", listener);
    validator.notNull("logLevelOverwrite", logLevelOverwrite);
  }

  public static class CrossThreadNotifierBuilder {
    private SlotPolicy slotPolicy;
    private DispatchListener listener;
    private Level logLevelOverwrite;
    private Boolean propagateMdc;

    CrossThreadNotifierBuilder() {}

    /**
     * @param slotPolicy What to do when posting into an undrained slot. Defaults to {@link
     *     SlotPolicy#REJECT}.
     * @return Builder.
     */
    public CrossThreadNotifierBuilder slotPolicy(SlotPolicy slotPolicy) {
      this.slotPolicy = slotPolicy;
      return this;
    }

    /**
     * @param listener Receives dispatch events. Defaults to {@link DispatchListener#EMPTY}.
     * @return Builder.
     */
    public CrossThreadNotifierBuilder listener(DispatchListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * @param logLevelOverwrite The level at which {@link SlotPolicy#OVERWRITE} logs discarded
     *     descriptors. Defaults to {@code WARN}.
     * @return Builder.
     */
    public CrossThreadNotifierBuilder logLevelOverwrite(Level logLevelOverwrite) {
      this.logLevelOverwrite = logLevelOverwrite;
      return this;
    }

    /**
     * @param propagateMdc Whether the dispatching thread's {@link org.slf4j.MDC} is captured and
     *     restored around the callback on the host loop. Defaults to true.
     * @return Builder.
     */
    public CrossThreadNotifierBuilder propagateMdc(boolean propagateMdc) {
      this.propagateMdc = propagateMdc;
      return this;
    }

    public CrossThreadNotifier build() {
      CrossThreadNotifier notifier =
          new CrossThreadNotifier(
              Utils.firstNonNull(slotPolicy, () -> SlotPolicy.REJECT),
              Utils.firstNonNull(listener, () -> DispatchListener.EMPTY),
              Utils.firstNonNull(logLevelOverwrite, () -> Level.WARN),
              propagateMdc == null || propagateMdc);
      new Validator().validate(notifier);
      return notifier;
    }
  }
}
