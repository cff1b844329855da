package org.servekit.utils;

import java.util.Optional;

/** Utilities for reading from the system environment */
public class SystemEnvironment implements Environment {
  private static final SystemEnvironment systemEnvironment = new SystemEnvironment();

  private SystemEnvironment() {}

  /** Obtains the system environment */
  public static SystemEnvironment get() {
    return systemEnvironment;
  }

  @Override
  public Optional<String> getValue(String varName) {
    return Optional.ofNullable(System.getenv(varName));
  }
}
