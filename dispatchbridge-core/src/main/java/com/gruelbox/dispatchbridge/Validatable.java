package com.gruelbox.dispatchbridge;

/** Implemented by configured components which can check their own settings at build time. */
public interface Validatable {

  void validate(Validator validator);
}
