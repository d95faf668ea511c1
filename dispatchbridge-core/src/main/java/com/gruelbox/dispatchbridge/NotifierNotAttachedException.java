package com.gruelbox.dispatchbridge;

/**
 * Thrown when a {@link CrossThreadNotifier} is asked to wake a host loop it has not been attached
 * to, or after it has been closed. This is a configuration error: the notifier must be attached
 * before any bridge dispatches through it.
 */
public class NotifierNotAttachedException extends IllegalStateException {

  NotifierNotAttachedException(String message) {
    super(message);
  }
}
