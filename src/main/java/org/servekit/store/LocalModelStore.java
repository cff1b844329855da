package org.servekit.store;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.servekit.ServekitException;
import org.servekit.models.ModelInfo;
import org.servekit.models.Tag;
import org.servekit.utils.Environment;
import org.servekit.utils.FileUtils;
import org.servekit.utils.SystemEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link ModelStore} backed by the local filesystem. Each model version lives in
 * {@code <home>/<name>/<version>/} next to a {@code model.yaml} holding its {@link ModelInfo}.
 * Versions are allocated sequentially ({@code v1}, {@code v2}, ...). New versions are staged in
 * {@code <home>/.staging/} and moved into place when their registration commits.
 */
public class LocalModelStore implements ModelStore {
  public static final String HOME_ENV_VAR = "SERVEKIT_HOME";

  private static final Logger logger = LoggerFactory.getLogger(LocalModelStore.class);

  private static final String STAGING_DIR_NAME = ".staging";
  private static final Pattern SEQUENTIAL_VERSION = Pattern.compile("v(\\d+)");

  private final Path home;

  // Versions handed out to registrations that have not committed or closed yet
  private final Set<Tag> reservedTags = new HashSet<>();

  public LocalModelStore(Path home) {
    this.home = Preconditions.checkNotNull(home, "Model store home must not be null");
  }

  /** Creates a store from the process environment, see {@link #fromEnvironment(Environment)} */
  public static LocalModelStore fromEnvironment() {
    return fromEnvironment(SystemEnvironment.get());
  }

  /**
   * Creates a store rooted at {@code $SERVEKIT_HOME}, or at {@code ~/servekit/models} when the
   * variable is not set
   */
  public static LocalModelStore fromEnvironment(Environment environment) {
    Path home =
        environment
            .getValue(HOME_ENV_VAR)
            .map(Paths::get)
            .orElseGet(() -> Paths.get(System.getProperty("user.home"), "servekit", "models"));
    return new LocalModelStore(home);
  }

  @Override
  public ModelInfo get(String tag) {
    Tag resolved = resolve(Tag.parse(tag));
    Path modelPath = versionPath(resolved);
    try {
      return ModelInfo.fromPath(modelPath);
    } catch (IOException e) {
      logger.error("Failed to read the metadata of model {} at {}", resolved, modelPath, e);
      throw new ServekitException(
          String.format("Failed to read the metadata of model %s at %s", resolved, modelPath), e);
    }
  }

  @Override
  public synchronized Registration register(
      String name,
      String module,
      Map<String, Object> metadata,
      Map<String, String> frameworkContext) {
    Tag.validateName(name);
    Preconditions.checkNotNull(module, "Module must not be null");
    Tag tag = Tag.of(name, "v" + (highestVersionNumber(name) + 1));
    Path stagingPath = home.resolve(STAGING_DIR_NAME).resolve(name + "-" + UUID.randomUUID());
    try {
      Files.createDirectories(stagingPath);
    } catch (IOException e) {
      throw new ServekitException(
          String.format("Failed to create the staging directory %s", stagingPath), e);
    }
    reservedTags.add(tag);
    logger.debug("Registering {} in staging directory {}", tag, stagingPath);
    return new LocalRegistration(tag, stagingPath, module, metadata, frameworkContext);
  }

  @Override
  public List<Tag> list(String name) {
    Tag.validateName(name);
    List<Tag> tags = new ArrayList<>();
    File[] versionDirs = home.resolve(name).toFile().listFiles(File::isDirectory);
    if (versionDirs == null) {
      return tags;
    }
    for (File versionDir : versionDirs) {
      if (new File(versionDir, ModelInfo.CONFIG_FILE_NAME).isFile()) {
        tags.add(Tag.of(name, versionDir.getName()));
      }
    }
    tags.sort(Comparator.comparingLong(LocalModelStore::versionNumber)
        .thenComparing(Tag::getVersion));
    return tags;
  }

  @Override
  public void delete(String tag) {
    Tag resolved = resolve(Tag.parse(tag));
    Path modelPath = versionPath(resolved);
    try {
      FileUtils.deleteRecursively(modelPath);
    } catch (IOException e) {
      throw new ServekitException(String.format("Failed to delete model %s", resolved), e);
    }
    logger.info("Deleted model {}", resolved);
  }

  @VisibleForTesting
  Path getHome() {
    return home;
  }

  private Tag resolve(Tag tag) {
    if (tag.isLatest()) {
      List<Tag> versions = list(tag.getName());
      if (versions.isEmpty()) {
        throw new TagNotFoundException(
            String.format("No versions of model `%s` exist in %s", tag.getName(), home));
      }
      return versions.get(versions.size() - 1);
    }
    if (!versionPath(tag).resolve(ModelInfo.CONFIG_FILE_NAME).toFile().isFile()) {
      throw new TagNotFoundException(String.format("Model %s does not exist in %s", tag, home));
    }
    return tag;
  }

  private Path versionPath(Tag tag) {
    return home.resolve(tag.getName()).resolve(tag.getVersion());
  }

  private long highestVersionNumber(String name) {
    long highest = 0;
    for (Tag tag : list(name)) {
      highest = Math.max(highest, versionNumber(tag));
    }
    for (Tag tag : reservedTags) {
      if (tag.getName().equals(name)) {
        highest = Math.max(highest, versionNumber(tag));
      }
    }
    return highest;
  }

  private static long versionNumber(Tag tag) {
    Matcher matcher = SEQUENTIAL_VERSION.matcher(tag.getVersion());
    return matcher.matches() ? Long.parseLong(matcher.group(1)) : 0;
  }

  private synchronized void release(Tag tag) {
    reservedTags.remove(tag);
  }

  private class LocalRegistration implements Registration {
    private final Tag tag;
    private final Path stagingPath;
    private final String module;
    private final Map<String, Object> metadata;
    private final Map<String, String> frameworkContext;
    private boolean finished = false;

    LocalRegistration(
        Tag tag,
        Path stagingPath,
        String module,
        Map<String, Object> metadata,
        Map<String, String> frameworkContext) {
      this.tag = tag;
      this.stagingPath = stagingPath;
      this.module = module;
      this.metadata = metadata;
      this.frameworkContext = frameworkContext;
    }

    @Override
    public Tag getTag() {
      return tag;
    }

    @Override
    public Path getPath() {
      return stagingPath;
    }

    @Override
    public synchronized void commit() {
      Preconditions.checkState(!finished, "Registration of %s has already finished", tag);
      Path finalPath = versionPath(tag);
      ModelInfo info =
          new ModelInfo(
              tag, module, finalPath, Instant.now().toString(), metadata, frameworkContext);
      try {
        info.writeTo(stagingPath);
        Files.createDirectories(finalPath.getParent());
        try {
          Files.move(stagingPath, finalPath, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
          Files.move(stagingPath, finalPath);
        }
      } catch (IOException e) {
        throw new ServekitException(String.format("Failed to commit model %s", tag), e);
      }
      finished = true;
      release(tag);
      logger.info("Registered model {} at {}", tag, finalPath);
    }

    @Override
    public synchronized void close() {
      if (finished) {
        return;
      }
      finished = true;
      release(tag);
      logger.warn("Registration of {} did not commit, discarding {}", tag, stagingPath);
      try {
        FileUtils.deleteRecursively(stagingPath);
      } catch (IOException e) {
        logger.error("Failed to remove the staging directory {}", stagingPath, e);
      }
    }
  }
}
