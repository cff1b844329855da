package org.servekit.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Versioned identifier of a persisted model, written as {@code name:version}. The name is chosen
 * by the user and must be a valid identifier; the version is allocated by the model store.
 */
public final class Tag {
  public static final String LATEST = "latest";

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern VERSION = Pattern.compile("[A-Za-z0-9_.\\-]+");

  private final String name;
  private final String version;

  private Tag(String name, String version) {
    this.name = name;
    this.version = version;
  }

  /** Creates a tag from its components, validating both */
  public static Tag of(String name, String version) {
    validateName(name);
    Preconditions.checkArgument(
        version != null && VERSION.matcher(version).matches(),
        "Invalid model version: `%s`",
        version);
    return new Tag(name, version);
  }

  /**
   * Parses {@code name:version}. A bare {@code name} is interpreted as {@code name:latest}, which
   * model stores resolve to the newest registered version
   */
  @JsonCreator
  public static Tag parse(String tag) {
    Preconditions.checkArgument(tag != null && !tag.isEmpty(), "Model tag must not be empty");
    int separator = tag.indexOf(':');
    if (separator < 0) {
      return of(tag, LATEST);
    }
    return of(tag.substring(0, separator), tag.substring(separator + 1));
  }

  /**
   * @throws IllegalArgumentException If the name is not a valid identifier
   */
  public static void validateName(String name) {
    Preconditions.checkArgument(
        name != null && IDENTIFIER.matcher(name).matches(),
        "Model name `%s` is not a valid identifier",
        name);
  }

  public String getName() {
    return name;
  }

  public String getVersion() {
    return version;
  }

  /** @return Whether this tag refers to the newest version rather than a specific one */
  public boolean isLatest() {
    return LATEST.equals(version);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Tag)) {
      return false;
    }
    Tag other = (Tag) o;
    return name.equals(other.name) && version.equals(other.version);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, version);
  }

  @JsonValue
  @Override
  public String toString() {
    return name + ':' + version;
  }
}
