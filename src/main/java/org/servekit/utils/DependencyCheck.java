package org.servekit.utils;

import org.servekit.MissingDependencyException;

/** Verifies that optional libraries an adapter relies on can be loaded. */
public class DependencyCheck {
  private DependencyCheck() {}

  /**
   * @param className Fully qualified name of a class from the required library
   * @param hint Installation hint included in the error message
   * @throws MissingDependencyException If the class cannot be loaded
   */
  public static void require(String className, String hint) {
    try {
      Class.forName(className, false, DependencyCheck.class.getClassLoader());
    } catch (ClassNotFoundException | LinkageError e) {
      throw new MissingDependencyException(
          String.format("`%s` could not be loaded. %s", className, hint), e);
    }
  }
}
