package org.servekit.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.servekit.utils.FileUtils;
import org.servekit.utils.SerializationUtils;

/**
 * Metadata of a registered model: the adapter module that owns it, where its files live, and the
 * framework context it was produced with. Instances are written once by the model store (as
 * {@code model.yaml} in the model directory) and are read-only afterwards.
 */
public class ModelInfo {
  public static final String CONFIG_FILE_NAME = "model.yaml";

  @JsonProperty("tag")
  private Tag tag;

  @JsonProperty("module")
  private String module;

  @JsonProperty("creation_time")
  private String creationTime;

  @JsonProperty("metadata")
  private Map<String, Object> metadata;

  @JsonProperty("context")
  private Map<String, String> frameworkContext;

  @JsonIgnore private Path path;

  // Used by Jackson
  private ModelInfo() {}

  public ModelInfo(
      Tag tag,
      String module,
      Path path,
      String creationTime,
      Map<String, Object> metadata,
      Map<String, String> frameworkContext) {
    this.tag = tag;
    this.module = module;
    this.path = path;
    this.creationTime = creationTime;
    // Metadata values are user supplied and may be null
    this.metadata = metadata == null ? Collections.emptyMap() : new LinkedHashMap<>(metadata);
    this.frameworkContext =
        frameworkContext == null ? Collections.emptyMap() : ImmutableMap.copyOf(frameworkContext);
  }

  /**
   * Reads the metadata stored in the specified model directory
   *
   * @param modelPath The directory containing {@code model.yaml}
   */
  public static ModelInfo fromPath(Path modelPath) throws IOException {
    File configFile = new File(FileUtils.join(modelPath.toString(), CONFIG_FILE_NAME));
    ModelInfo info = SerializationUtils.parseYamlFromFile(configFile, ModelInfo.class);
    info.path = modelPath.toAbsolutePath();
    if (info.metadata == null) {
      info.metadata = Collections.emptyMap();
    }
    if (info.frameworkContext == null) {
      info.frameworkContext = Collections.emptyMap();
    }
    return info;
  }

  /** Writes this metadata into its model directory */
  public void writeTo(Path modelPath) throws IOException {
    File configFile = new File(FileUtils.join(modelPath.toString(), CONFIG_FILE_NAME));
    SerializationUtils.writeYamlToFile(configFile, this);
  }

  public Tag getTag() {
    return tag;
  }

  /** @return The identity of the adapter module that saved the model */
  public String getModule() {
    return module;
  }

  /** @return The directory holding the model artifact */
  public Path getPath() {
    return path;
  }

  /** @return The UTC creation time in ISO-8601 format */
  public String getCreationTime() {
    return creationTime;
  }

  public Map<String, Object> getMetadata() {
    return Collections.unmodifiableMap(metadata);
  }

  /** @return Library versions and format identifiers recorded when the artifact was produced */
  public Map<String, String> getFrameworkContext() {
    return Collections.unmodifiableMap(frameworkContext);
  }

  @Override
  public String toString() {
    return String.format("ModelInfo(tag=%s, module=%s, path=%s)", tag, module, path);
  }
}
