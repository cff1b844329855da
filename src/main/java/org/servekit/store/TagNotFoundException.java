package org.servekit.store;

import org.servekit.ServekitException;

/** Thrown when a model store has no model registered under the requested tag */
public class TagNotFoundException extends ServekitException {
  public TagNotFoundException(String message) {
    super(message);
  }
}
