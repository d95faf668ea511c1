package com.gruelbox.dispatchbridge;

import java.util.function.Function;

/**
 * Creates the representation of a {@link DispatchBridge} that is visible to code on the host loop
 * (for example a script object or a UI model wrapping it). Called lazily, at most once per bridge,
 * by {@link DispatchBridge#getHostObject()}.
 */
@FunctionalInterface
public interface HostObjectFactory {

  /**
   * @return A factory which uses the bridge itself as its host object. The default.
   */
  static HostObjectFactory identity() {
    return bridge -> bridge;
  }

  /**
   * @param fn Creates a host object for a bridge.
   * @return The factory.
   */
  static HostObjectFactory using(Function<DispatchBridge, Object> fn) {
    return fn::apply;
  }

  /**
   * @param bridge The bridge.
   * @return Its host-visible representation. May not be null.
   */
  Object create(DispatchBridge bridge);
}
