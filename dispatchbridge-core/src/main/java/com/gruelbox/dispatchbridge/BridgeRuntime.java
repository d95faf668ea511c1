package com.gruelbox.dispatchbridge;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.event.Level;

/**
 * The process-level context which owns the shared {@link CrossThreadNotifier} and the class-wide
 * callback registries. Create one per host loop, before any {@link DispatchBridge}, and keep it
 * for as long as any bridge created from it is in use.
 *
 * <p>Usage:
 *
 * <pre>BridgeRuntime runtime = BridgeRuntime.builder()
 *     .hostLoop(HostLoop.withExecutor(SwingUtilities::invokeLater))
 *     .build();
 * runtime.classCallbacks(Player.class).register("endOfTrack", origin -&gt; ...);
 * DispatchBridge bridge = runtime.newBridge(Player.class).label("player-1").build();</pre>
 */
@Slf4j
public final class BridgeRuntime implements AutoCloseable, Validatable {

  private final HostLoop hostLoop;
  private final boolean closeHostLoopOnClose;
  private final CrossThreadNotifier notifier;
  private final ConcurrentMap<Class<?>, CallbackRegistry> classCallbacks =
      new ConcurrentHashMap<>();

  private BridgeRuntime(
      HostLoop hostLoop, boolean closeHostLoopOnClose, CrossThreadNotifier notifier) {
    this.hostLoop = hostLoop;
    this.closeHostLoopOnClose = closeHostLoopOnClose;
    this.notifier = notifier;
  }

  public static BridgeRuntimeBuilder builder() {
    return new BridgeRuntimeBuilder();
  }

  /** Attaches the notifier to the host loop. Idempotent. */
  public void attach() {
    notifier.attach(hostLoop);
  }

  public CrossThreadNotifier notifier() {
    return notifier;
  }

  public HostLoop hostLoop() {
    return hostLoop;
  }

  /**
   * @param kind The kind of bridged object.
   * @return The callbacks shared by every bridge of that kind, created on first request and kept
   *     for the life of the runtime.
   */
  public CallbackRegistry classCallbacks(Class<?> kind) {
    if (kind == null) {
      throw new IllegalArgumentException("kind may not be null");
    }
    return classCallbacks.computeIfAbsent(
        kind,
        k -> {
          log.debug("Created class-wide callbacks for {}", k.getName());
          return new CallbackRegistry();
        });
  }

  /**
   * @param kind The kind of bridged object.
   * @return A bridge builder already wired to this runtime's notifier and the class-wide callbacks
   *     for {@code kind}.
   */
  public DispatchBridge.DispatchBridgeBuilder newBridge(Class<?> kind) {
    return DispatchBridge.builder()
        .notifier(notifier)
        .kind(kind)
        .classCallbacks(classCallbacks(kind));
  }

  @Override
  public void validate(Validator validator) {
    validator.notNull("hostLoop", hostLoop);
    validator.valid("notifier", notifier);
  }

  /**
   * Detaches the notifier, so that further dispatches fail, and closes the host loop if this
   * runtime created it.
   */
  @Override
  public void close() {
    notifier.close();
    if (closeHostLoopOnClose) {
      Utils.safelyRun("closing host loop", hostLoop::close);
    }
    log.debug("Closed");
  }

  /** Builder for {@link BridgeRuntime}. */
  public static class BridgeRuntimeBuilder {
    private HostLoop hostLoop;
    private SlotPolicy slotPolicy;
    private DispatchListener listener;
    private Level logLevelOverwrite;
    private Boolean propagateMdc;
    private Boolean attachImmediately;

    BridgeRuntimeBuilder() {}

    /**
     * @param hostLoop The host loop callbacks run on. If not provided, {@link
     *     HostLoop#singleThreaded()} is used and closed along with the runtime.
     * @return Builder.
     */
    public BridgeRuntimeBuilder hostLoop(HostLoop hostLoop) {
      this.hostLoop = hostLoop;
      return this;
    }

    /**
     * @param slotPolicy See {@link CrossThreadNotifier.CrossThreadNotifierBuilder#slotPolicy}.
     * @return Builder.
     */
    public BridgeRuntimeBuilder slotPolicy(SlotPolicy slotPolicy) {
      this.slotPolicy = slotPolicy;
      return this;
    }

    /**
     * @param listener See {@link CrossThreadNotifier.CrossThreadNotifierBuilder#listener}.
     * @return Builder.
     */
    public BridgeRuntimeBuilder listener(DispatchListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * @param logLevelOverwrite See {@link
     *     CrossThreadNotifier.CrossThreadNotifierBuilder#logLevelOverwrite}.
     * @return Builder.
     */
    public BridgeRuntimeBuilder logLevelOverwrite(Level logLevelOverwrite) {
      this.logLevelOverwrite = logLevelOverwrite;
      return this;
    }

    /**
     * @param propagateMdc See {@link CrossThreadNotifier.CrossThreadNotifierBuilder#propagateMdc}.
     * @return Builder.
     */
    public BridgeRuntimeBuilder propagateMdc(boolean propagateMdc) {
      this.propagateMdc = propagateMdc;
      return this;
    }

    /**
     * @param attachImmediately If true, the default, the notifier is attached to the host loop
     *     when the runtime is built. Otherwise {@link #attach()} must be called before any bridge
     *     is created.
     * @return Builder.
     */
    public BridgeRuntimeBuilder attachImmediately(boolean attachImmediately) {
      this.attachImmediately = attachImmediately;
      return this;
    }

    public BridgeRuntime build() {
      CrossThreadNotifier.CrossThreadNotifierBuilder notifierBuilder =
          CrossThreadNotifier.builder()
              .slotPolicy(slotPolicy)
              .listener(listener)
              .logLevelOverwrite(logLevelOverwrite);
      if (propagateMdc != null) {
        notifierBuilder.propagateMdc(propagateMdc);
      }
      BridgeRuntime runtime =
          new BridgeRuntime(
              Utils.firstNonNull(hostLoop, HostLoop::singleThreaded),
              hostLoop == null,
              notifierBuilder.build());
      new Validator().validate(runtime);
      if (attachImmediately == null || attachImmediately) {
        runtime.attach();
      }
      return runtime;
    }
  }
}
