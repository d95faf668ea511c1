package com.gruelbox.dispatchbridge;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Lets worker threads call named {@link Callback}s which live on the host loop, and optionally
 * block until the host loop reports back.
 *
 * <p>Each bridge owns a {@link CallbackRegistry}, falling back to the class-wide registry of its
 * kind, and a {@link WaitSignal}. All bridges share the process-wide {@link CrossThreadNotifier},
 * which they reference but do not own.
 *
 * <p>The usual round trip, from a worker thread:
 *
 * <pre>bridge.dispatch("loaded");   // runs the "loaded" callback on the host loop
 * bridge.await();              // blocks until that callback calls bridge.done()</pre>
 *
 * <p>which {@link #dispatchAndAwait(String)} does in one step.
 */
@Slf4j
public final class DispatchBridge implements Validatable {

  /**
   * @return The label used to describe this bridge in logs.
   */
  @SuppressWarnings("JavaDoc")
  @Getter
  private final String label;

  /**
   * @return The kind of object bridged, which selects the class-wide fallback callbacks.
   */
  @SuppressWarnings("JavaDoc")
  @Getter
  private final Class<?> kind;

  private final CallbackRegistry callbacks;
  private final WaitSignal waitSignal = new WaitSignal();
  private final CrossThreadNotifier notifier;
  private final HostObjectFactory hostObjectFactory;
  private volatile Object hostObject;

  private DispatchBridge(
      String label,
      Class<?> kind,
      CallbackRegistry classCallbacks,
      CrossThreadNotifier notifier,
      HostObjectFactory hostObjectFactory) {
    this.kind = kind;
    this.label =
        label == null
            ? kind.getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(this))
            : label;
    this.callbacks = new CallbackRegistry(classCallbacks);
    this.notifier = notifier;
    this.hostObjectFactory = hostObjectFactory;
  }

  public static DispatchBridgeBuilder builder() {
    return new DispatchBridgeBuilder();
  }

  /**
   * Registers {@code callback} under {@code name} on this bridge only, replacing any callback
   * previously registered on this bridge under that name. Call on the host loop thread.
   *
   * @param name The name.
   * @param callback The callback.
   */
  public void registerCallback(String name, Callback callback) {
    callbacks.register(name, callback);
  }

  /**
   * Removes the callback registered on this bridge under {@code name}. Class-wide callbacks are not
   * affected. Call on the host loop thread.
   *
   * @param name The name.
   * @return The number of callbacks removed, 0 or 1.
   */
  public int unregisterCallback(String name) {
    return callbacks.unregister(name);
  }

  /**
   * @return The callbacks registered on this bridge, with the class-wide callbacks as fallback.
   */
  public CallbackRegistry callbacks() {
    return callbacks;
  }

  /**
   * Requests that the callback registered under {@code name} be run on the host loop. Returns
   * immediately. If no callback is registered, on this bridge or its kind, nothing happens.
   *
   * @param name The callback name.
   * @return true if a callback was found and posted to the host loop.
   * @throws NotifierNotAttachedException If the shared notifier has no host loop.
   * @throws SlotBusyException If a previous dispatch has not yet been drained and the notifier
   *     rejects overlapping dispatches.
   */
  public boolean dispatch(String name) {
    Optional<Callback> callback = callbacks.resolve(name);
    if (callback.isEmpty()) {
      log.debug("No callback for {}.{}, ignoring", label, name);
      Utils.safelyRun(
          "notifying listener of ignored dispatch", () -> notifier.listener().ignored(this, name));
      return false;
    }
    notifier.post(
        new DispatchDescriptor(
            this,
            name,
            callback.get(),
            notifier.propagatesMdc() ? capturedMdc() : null));
    return true;
  }

  private static Map<String, String> capturedMdc() {
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    return mdc == null ? Map.of() : mdc;
  }

  /**
   * Dispatches {@code name} and, if a callback was found, blocks until {@link #done()} is called.
   * Never blocks if nobody is listening.
   *
   * @param name The callback name.
   * @return true if the callback was dispatched and completion observed.
   */
  public boolean dispatchAndAwait(String name) {
    requireNotHostThread();
    if (!dispatch(name)) {
      return false;
    }
    waitSignal.await();
    return true;
  }

  /**
   * Blocks until {@link #done()} is called, with no timeout. Returns immediately if {@code done()}
   * was called since the last wait. Must not be called on the host loop thread.
   */
  public void await() {
    requireNotHostThread();
    waitSignal.await();
  }

  /**
   * As {@link #await()} but gives up after {@code timeout}.
   *
   * @param timeout The maximum time to wait.
   * @return true if completion was observed, false on timeout.
   * @throws InterruptedException If interrupted while waiting.
   */
  public boolean await(Duration timeout) throws InterruptedException {
    requireNotHostThread();
    boolean completed = waitSignal.await(timeout);
    if (!completed) {
      log.warn("Timed out after {} waiting for {} to report completion", timeout, label);
    }
    return completed;
  }

  /** Reports completion to the worker thread blocked in (or about to call) {@link #await()}. */
  public void done() {
    waitSignal.done();
  }

  /**
   * @return The host-visible representation of this bridge, created by the {@link
   *     HostObjectFactory} on first use and reused thereafter.
   */
  public Object getHostObject() {
    Object result = hostObject;
    if (result == null) {
      synchronized (this) {
        result = hostObject;
        if (result == null) {
          log.debug("Creating host object for {}", label);
          result = hostObjectFactory.create(this);
          if (result == null) {
            throw new IllegalStateException("Host object factory returned null for " + label);
          }
          hostObject = result;
        }
      }
    }
    return result;
  }

  WaitSignal waitSignal() {
    return waitSignal;
  }

  private void requireNotHostThread() {
    HostLoop hostLoop = notifier.hostLoop();
    if (hostLoop != null && hostLoop.isHostThread()) {
      throw new IllegalStateException(
          "Cannot wait on the host loop thread for "
              + label
              + "; the host loop would never run the callback that releases it");
    }
  }

  @Override
  public void validate(Validator validator) {
    validator.notBlank("label", label);
    validator.notNull("kind", kind);
    validator.attached("notifier", notifier);
    validator.notNull("hostObjectFactory", hostObjectFactory);
  }

  @Override
  public String toString() {
    return "DispatchBridge(" + label + ")";
  }

  /** Builder for {@link DispatchBridge}. */
  public static class DispatchBridgeBuilder {
    private String label;
    private Class<?> kind;
    private CallbackRegistry classCallbacks;
    private CrossThreadNotifier notifier;
    private HostObjectFactory hostObjectFactory;

    DispatchBridgeBuilder() {}

    /**
     * @param notifier The process-wide notifier. Required, and must already be attached to a host
     *     loop.
     * @return Builder.
     */
    public DispatchBridgeBuilder notifier(CrossThreadNotifier notifier) {
      this.notifier = notifier;
      return this;
    }

    /**
     * @param kind The kind of object bridged. Defaults to {@link DispatchBridge}.
     * @return Builder.
     */
    public DispatchBridgeBuilder kind(Class<?> kind) {
      this.kind = kind;
      return this;
    }

    /**
     * @param classCallbacks Callbacks shared by all bridges of this kind, consulted when a name is
     *     not registered on the bridge itself. Defaults to none.
     * @return Builder.
     */
    public DispatchBridgeBuilder classCallbacks(CallbackRegistry classCallbacks) {
      this.classCallbacks = classCallbacks;
      return this;
    }

    /**
     * @param hostObjectFactory Creates the host-visible representation of the bridge. Defaults to
     *     {@link HostObjectFactory#identity()}.
     * @return Builder.
     */
    public DispatchBridgeBuilder hostObjectFactory(HostObjectFactory hostObjectFactory) {
      this.hostObjectFactory = hostObjectFactory;
      return this;
    }

    /**
     * @param label Describes the bridge in logs. Defaults to the kind's simple name and an identity
     *     hash.
     * @return Builder.
     */
    public DispatchBridgeBuilder label(String label) {
      this.label = label;
      return this;
    }

    public DispatchBridge build() {
      Validator validator = new Validator();
      validator.nullOrNotBlank("label", label);
      DispatchBridge bridge =
          new DispatchBridge(
              label,
              Utils.firstNonNull(kind, () -> DispatchBridge.class),
              classCallbacks,
              notifier,
              Utils.firstNonNull(hostObjectFactory, HostObjectFactory::identity));
      validator.validate(bridge);
      return bridge;
    }
  }
}
