package org.servekit.utils;

import java.util.Optional;

/**
 * Interface defining functions that should be implemented by an environment consisting of keys and
 * values
 */
public interface Environment {
  /** @return The value of the specified variable, if it is set */
  Optional<String> getValue(String varName);
}
