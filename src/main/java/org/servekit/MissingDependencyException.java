package org.servekit;

/**
 * Raised when a third-party library required by an adapter is absent from the classpath. This is
 * detected when the adapter class is initialized and cannot be recovered from at call time.
 */
public class MissingDependencyException extends ServekitException {
  public MissingDependencyException(String message) {
    super(message);
  }

  public MissingDependencyException(String message, Throwable cause) {
    super(message, cause);
  }
}
