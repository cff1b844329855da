package org.servekit.tabular;

import org.servekit.ServekitException;

/** Thrown when a model was saved by a different adapter module than the one loading it */
public class ModuleMismatchException extends ServekitException {
  public ModuleMismatchException(String message) {
    super(message);
  }
}
