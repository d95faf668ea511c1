package com.gruelbox.dispatchbridge;

/**
 * What {@link CrossThreadNotifier#post(DispatchDescriptor)} does when the previous descriptor has
 * not yet been drained by the host loop.
 */
public enum SlotPolicy {

  /** Throw {@link SlotBusyException}, leaving the undrained descriptor in place. */
  REJECT,

  /**
   * Replace the undrained descriptor, which is then never invoked. The replacement is logged and
   * reported to {@link DispatchListener#overwritten(DispatchDescriptor, DispatchDescriptor)}.
   */
  OVERWRITE
}
