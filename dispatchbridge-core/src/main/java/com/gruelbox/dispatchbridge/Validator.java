package com.gruelbox.dispatchbridge;

/**
 * Checks the settings of {@link Validatable} components, reporting the first problem found as an
 * {@link IllegalArgumentException} naming the offending property path (e.g. {@code
 * DispatchBridge.notifier}).
 */
public final class Validator {

  private final String path;

  Validator() {
    this.path = "";
  }

  private Validator(String path) {
    this.path = path;
  }

  public void validate(Validatable validatable) {
    validatable.validate(new Validator(validatable.getClass().getSimpleName()));
  }

  public void valid(String propertyName, Object object) {
    notNull(propertyName, object);
    if (!(object instanceof Validatable)) {
      return;
    }
    ((Validatable) object)
        .validate(new Validator(path.isEmpty() ? propertyName : (path + "." + propertyName)));
  }

  public void notNull(String propertyName, Object object) {
    if (object == null) {
      error(propertyName, "may not be null");
    }
  }

  /** A notifier bridges can post to: present, attached to a host loop and not yet closed. */
  public void attached(String propertyName, CrossThreadNotifier notifier) {
    valid(propertyName, notifier);
    if (!notifier.isAttached()) {
      error(propertyName, "must be attached to a host loop before bridges are created");
    }
  }

  public void nullOrNotBlank(String propertyName, String object) {
    if (object != null && object.isBlank()) {
      error(propertyName, "may be either null or non-blank");
    }
  }

  public void notBlank(String propertyName, String object) {
    notNull(propertyName, object);
    if (object.isBlank()) {
      error(propertyName, "may not be blank");
    }
  }

  private void error(String propertyName, String message) {
    throw new IllegalArgumentException(
        (path.isEmpty() ? "" : path + ".") + propertyName + " " + message);
  }
}
