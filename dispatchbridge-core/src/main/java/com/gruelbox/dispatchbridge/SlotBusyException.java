package com.gruelbox.dispatchbridge;

import lombok.Getter;

/**
 * Thrown when posting into a {@link CrossThreadNotifier} whose slot still holds an undrained
 * descriptor, under {@link SlotPolicy#REJECT}.
 */
public class SlotBusyException extends IllegalStateException {

  @Getter private final transient DispatchDescriptor pending;

  SlotBusyException(DispatchDescriptor rejected, DispatchDescriptor pending) {
    super(
        "Cannot dispatch "
            + rejected.description()
            + ": "
            + pending.description()
            + " has not yet been drained by the host loop");
    this.pending = pending;
  }
}
