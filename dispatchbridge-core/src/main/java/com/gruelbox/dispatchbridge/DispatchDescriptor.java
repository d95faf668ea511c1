package com.gruelbox.dispatchbridge;

import java.util.Map;
import lombok.ToString;
import lombok.Value;

/**
 * A single pending call, handed from a worker thread to the host loop through the {@link
 * CrossThreadNotifier} slot. Immutable; the slot owns it from {@link
 * CrossThreadNotifier#post(DispatchDescriptor)} until the host loop drains it.
 */
@Value
public class DispatchDescriptor {

  /**
   * @return The bridge which dispatched the call. Passed to the callback as its origin.
   */
  @SuppressWarnings("JavaDoc")
  @ToString.Exclude
  DispatchBridge origin;

  /**
   * @return The name under which the callback was resolved.
   */
  @SuppressWarnings("JavaDoc")
  String name;

  /**
   * @return The resolved callback.
   */
  @SuppressWarnings("JavaDoc")
  @ToString.Exclude
  Callback callback;

  /**
   * @return The dispatching thread's MDC, restored around the invocation, replacing
   *     whatever the host loop thread carries. Null if MDC propagation is disabled.
   */
  @SuppressWarnings("JavaDoc")
  Map<String, String> mdc;

  /**
   * @return A textual description of the call, for logging.
   */
  public String description() {
    return origin.getLabel() + "." + name + "()";
  }
}
