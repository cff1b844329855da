package org.servekit;

/** Base class for the unchecked errors raised by the model store, codecs and runners. */
public class ServekitException extends RuntimeException {
  public ServekitException(String message) {
    super(message);
  }

  public ServekitException(String message, Throwable cause) {
    super(message, cause);
  }
}
