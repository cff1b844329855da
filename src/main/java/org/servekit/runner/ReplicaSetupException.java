package org.servekit.runner;

import org.servekit.ServekitException;

/**
 * Thrown by a batch call on a replica whose setup already failed. The replica does not retry;
 * the original setup failure is available as the cause.
 */
public class ReplicaSetupException extends ServekitException {
  public ReplicaSetupException(String message, Throwable cause) {
    super(message, cause);
  }
}
