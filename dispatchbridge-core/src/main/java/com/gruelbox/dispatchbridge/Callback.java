package com.gruelbox.dispatchbridge;

/**
 * A handler registered on a {@link DispatchBridge} under a name. Always invoked on the host loop
 * thread.
 *
 * <p>Handlers are compared by identity: the registry hands back exactly the reference it was given,
 * and the host loop invokes that same reference.
 */
@FunctionalInterface
public interface Callback {

  /**
   * @param origin The bridge whose {@link DispatchBridge#dispatch(String)} triggered the call.
   * @throws Exception Any failure. It is logged and reported to {@link
   *     DispatchListener#failure(DispatchDescriptor, Throwable)}; it never escapes into the host
   *     loop.
   */
  void invoke(DispatchBridge origin) throws Exception;
}
