package org.servekit.scoring;

/** Exception indicating that tabular input does not have the shape or types a predictor expects */
public class InvalidSchemaException extends RuntimeException {
  InvalidSchemaException(String message) {
    super(message);
  }
}
