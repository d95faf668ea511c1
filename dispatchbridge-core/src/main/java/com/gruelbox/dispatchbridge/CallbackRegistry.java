package com.gruelbox.dispatchbridge;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps names to {@link Callback}s. Every {@link DispatchBridge} owns one, whose fallback is the
 * class-wide registry shared by all bridges of the same kind (see {@link
 * BridgeRuntime#classCallbacks(Class)}).
 *
 * <p>Only the host loop thread should mutate a registry. Worker threads read it indirectly via
 * {@link DispatchBridge#dispatch(String)}.
 */
@Slf4j
public final class CallbackRegistry {

  private final ConcurrentMap<String, Callback> callbacks = new ConcurrentHashMap<>();
  private final CallbackRegistry fallback;

  /** Creates a registry with no fallback, as used for class-wide registries. */
  public CallbackRegistry() {
    this(null);
  }

  /**
   * @param fallback Consulted by {@link #resolve(String)} for names not registered here. May be
   *     null.
   */
  public CallbackRegistry(CallbackRegistry fallback) {
    if (fallback == this) {
      throw new IllegalArgumentException("A registry may not be its own fallback");
    }
    this.fallback = fallback;
  }

  /**
   * Stores {@code callback} under {@code name}, replacing (but never invoking) any callback
   * previously registered under that name.
   *
   * @param name The name. May not be null or empty.
   * @param callback The callback.
   */
  public void register(String name, Callback callback) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Callback name may not be null or empty");
    }
    if (callback == null) {
      throw new IllegalArgumentException("Callback for " + name + " may not be null");
    }
    Callback previous = callbacks.put(name, callback);
    if (previous != null) {
      log.debug("Replaced callback for [{}]", name);
    } else {
      log.debug("Registered callback for [{}]", name);
    }
  }

  /**
   * @param name The name.
   * @return The number of callbacks removed: 1 if one was registered under {@code name}, otherwise
   *     0.
   */
  public int unregister(String name) {
    if (name == null) {
      return 0;
    }
    int removed = callbacks.remove(name) == null ? 0 : 1;
    log.debug("Unregistered {} callback(s) for [{}]", removed, name);
    return removed;
  }

  /**
   * @param name The name.
   * @return The callback registered in this registry only, ignoring the fallback.
   */
  public Optional<Callback> lookup(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(callbacks.get(name));
  }

  /**
   * Looks up {@code name} here and then in the fallback registry. An empty result means nobody is
   * listening, which is not an error.
   *
   * @param name The name.
   * @return The callback, if any.
   */
  public Optional<Callback> resolve(String name) {
    Optional<Callback> local = lookup(name);
    if (local.isPresent() || fallback == null) {
      return local;
    }
    return fallback.lookup(name);
  }

  public Set<String> names() {
    return Set.copyOf(callbacks.keySet());
  }

  public int size() {
    return callbacks.size();
  }
}
