package com.gruelbox.dispatchbridge;

/** A listener for events fired by a {@link CrossThreadNotifier} and its bridges. */
public interface DispatchListener {

  DispatchListener EMPTY = new DispatchListener() {};

  /**
   * Fired on the dispatching thread once a descriptor is in the slot and the host loop has been
   * woken.
   *
   * @param descriptor The descriptor posted.
   */
  default void posted(DispatchDescriptor descriptor) {
    // No-op
  }

  /**
   * Fired on the dispatching thread when {@link DispatchBridge#dispatch(String)} finds no callback
   * for the name, either on the bridge or its kind.
   *
   * @param bridge The bridge.
   * @param name The unresolved name.
   */
  default void ignored(DispatchBridge bridge, String name) {
    // No-op
  }

  /**
   * Fired on the dispatching thread when {@link SlotPolicy#OVERWRITE} discards an undrained
   * descriptor.
   *
   * @param discarded The descriptor that will never be invoked.
   * @param replacement The descriptor that replaced it.
   */
  default void overwritten(DispatchDescriptor discarded, DispatchDescriptor replacement) {
    // No-op
  }

  /**
   * Intercepts and decorates every callback invocation, on the host loop thread. Implementations
   * should generally call {@code invocator.run()} unless deliberately suppressing the call.
   *
   * @param descriptor The descriptor being drained.
   * @param invocator Performs the invocation.
   * @throws Exception If thrown by the callback.
   */
  default void wrapInvocation(DispatchDescriptor descriptor, Invocator invocator)
      throws Exception {
    invocator.run();
  }

  /**
   * Fired on the host loop thread when a callback returns normally.
   *
   * @param descriptor The descriptor drained.
   */
  default void success(DispatchDescriptor descriptor) {
    // No-op
  }

  /**
   * Fired on the host loop thread when a callback throws. The failure has already been logged.
   *
   * @param descriptor The descriptor drained.
   * @param cause The exception thrown.
   */
  default void failure(DispatchDescriptor descriptor, Throwable cause) {
    // No-op
  }

  @FunctionalInterface
  interface Invocator {
    void run() throws Exception;
  }
}
