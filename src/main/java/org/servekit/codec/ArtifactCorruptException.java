package org.servekit.codec;

import org.servekit.ServekitException;

/**
 * Thrown when a model artifact cannot be written or read back: the file is missing, truncated,
 * malformed, or was produced by an incompatible codec format
 */
public class ArtifactCorruptException extends ServekitException {
  /**
   * Constructs an exception
   *
   * @param message The user-readable error message associated with this exception
   */
  public ArtifactCorruptException(String message) {
    super(message);
  }

  /**
   * Constructs an exception with contents from a causal exception
   *
   * @param message The user-readable error message associated with this exception
   * @param cause The causal exception
   */
  public ArtifactCorruptException(String message, Throwable cause) {
    super(message, cause);
  }
}
