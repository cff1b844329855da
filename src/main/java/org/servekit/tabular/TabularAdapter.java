package org.servekit.tabular;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.Map;
import org.servekit.codec.ArtifactCodec;
import org.servekit.models.ModelInfo;
import org.servekit.models.Tag;
import org.servekit.runner.BatchOptions;
import org.servekit.runner.ResourceQuota;
import org.servekit.scoring.Predictor;
import org.servekit.store.ModelStore;
import org.servekit.store.Registration;
import org.servekit.utils.DependencyCheck;
import org.servekit.utils.ServekitVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves tabular {@link Predictor Predictors} to a {@link ModelStore}, loads them back, and wraps
 * them in {@link TabularRunner TabularRunners} for serving.
 *
 * <pre>
 *   TabularAdapter adapter = new TabularAdapter(store, new JsonPredictorCodec());
 *   Tag tag = adapter.save("iris", predictor, metadata);
 *   TabularRunner runner = adapter.loadRunner(tag.toString(), ResourceQuota.ofCpu(4), null);
 *   double[] predictions = runner.runBatch(rows);
 * </pre>
 */
public class TabularAdapter {
  /** Identity recorded as the owning module of every model this adapter saves */
  public static final String MODULE_NAME = "servekit.tabular";

  /** Name of the artifact file inside a model directory */
  public static final String ARTIFACT_FILE_NAME = "saved_model.json";

  private static final Logger logger = LoggerFactory.getLogger(TabularAdapter.class);

  // Model metadata is persisted as YAML
  static final String YAML_FACTORY_CLASS = "com.fasterxml.jackson.dataformat.yaml.YAMLFactory";

  private final ModelStore modelStore;
  private final ArtifactCodec<Predictor> codec;

  /**
   * @throws org.servekit.MissingDependencyException If {@code jackson-dataformat-yaml} is not on
   *     the classpath
   */
  public TabularAdapter(ModelStore modelStore, ArtifactCodec<Predictor> codec) {
    this(modelStore, codec, YAML_FACTORY_CLASS);
  }

  @VisibleForTesting
  TabularAdapter(
      ModelStore modelStore, ArtifactCodec<Predictor> codec, String metadataFormatClass) {
    DependencyCheck.require(
        metadataFormatClass,
        "The tabular adapter requires `com.fasterxml.jackson.dataformat:jackson-dataformat-yaml`"
            + " on the classpath.");
    this.modelStore = Preconditions.checkNotNull(modelStore, "Model store must not be null");
    this.codec = Preconditions.checkNotNull(codec, "Artifact codec must not be null");
  }

  /**
   * Saves a predictor as a new version of the model {@code name}. Nothing is registered if writing
   * the artifact fails.
   *
   * @param name Model name; must be a valid identifier
   * @param model The predictor to save
   * @param metadata Custom metadata stored with the model, may be null
   * @return The tag of the new version, {@code name:version}
   */
  public Tag save(String name, Predictor model, Map<String, Object> metadata) {
    Preconditions.checkNotNull(model, "Model must not be null");
    try (Registration registration =
        modelStore.register(name, MODULE_NAME, metadata, frameworkContext())) {
      codec.dump(model, registration.getPath().resolve(ARTIFACT_FILE_NAME));
      registration.commit();
      logger.info("Saved {} as {}", model.getClass().getSimpleName(), registration.getTag());
      return registration.getTag();
    }
  }

  /**
   * Loads a saved predictor
   *
   * @throws org.servekit.store.TagNotFoundException If the tag is unknown
   * @throws ModuleMismatchException If the model was saved by another adapter module
   * @throws org.servekit.codec.ArtifactCorruptException If the artifact cannot be read
   */
  public Predictor load(String tag) {
    ModelInfo modelInfo = getModelInfo(tag);
    return codec.load(artifactPath(modelInfo));
  }

  /**
   * Creates a runner for a saved predictor. The tag is resolved immediately; the artifact is only
   * read when the runner serves its first batch.
   *
   * @param resourceQuota Resources available to the runner; required
   * @param batchOptions Batching options; defaults are used when null
   * @throws org.servekit.store.TagNotFoundException If the tag is unknown
   * @throws ModuleMismatchException If the model was saved by another adapter module
   */
  public TabularRunner loadRunner(
      String tag, ResourceQuota resourceQuota, BatchOptions batchOptions) {
    Preconditions.checkNotNull(resourceQuota, "A resource quota is required to load a runner");
    ModelInfo modelInfo = getModelInfo(tag);
    return new TabularRunner(
        modelInfo, artifactPath(modelInfo), codec, resourceQuota, batchOptions);
  }

  private ModelInfo getModelInfo(String tag) {
    ModelInfo modelInfo = modelStore.get(tag);
    if (!MODULE_NAME.equals(modelInfo.getModule())) {
      throw new ModuleMismatchException(
          String.format(
              "Model %s was saved with module %s, failed loading with %s.",
              tag, modelInfo.getModule(), MODULE_NAME));
    }
    return modelInfo;
  }

  private Map<String, String> frameworkContext() {
    return ImmutableMap.of(
        "servekit", ServekitVersion.getVersion(),
        "jackson", com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION.toString(),
        "codec_format", codec.getFormatVersion());
  }

  private static Path artifactPath(ModelInfo modelInfo) {
    return modelInfo.getPath().resolve(ARTIFACT_FILE_NAME);
  }
}
