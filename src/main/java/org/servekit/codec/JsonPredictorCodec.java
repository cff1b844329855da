package org.servekit.codec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import org.servekit.scoring.Predictor;
import org.servekit.utils.SerializationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link ArtifactCodec} that stores {@link Predictor Predictors} as JSON documents. The concrete
 * predictor family is recorded as a type id, so loading reconstructs the same implementation that
 * was saved. Only the families registered on {@link Predictor} can be stored, since no other
 * implementation could be reconstructed.
 */
public class JsonPredictorCodec implements ArtifactCodec<Predictor> {
  public static final int FORMAT_VERSION = 1;

  private static final Logger logger = LoggerFactory.getLogger(JsonPredictorCodec.class);

  private static final Set<Class<?>> registeredFamilies = findRegisteredFamilies();

  static class Envelope {
    @JsonProperty("format_version")
    int formatVersion;

    @JsonProperty("predictor")
    Predictor predictor;
  }

  @Override
  public void dump(Predictor model, Path path) {
    if (model == null) {
      throw new ArtifactCorruptException("Cannot serialize a null predictor");
    }
    if (!registeredFamilies.contains(model.getClass())) {
      throw new ArtifactCorruptException(
          String.format(
              "Cannot serialize predictor of class %s: it is not a registered predictor family %s",
              model.getClass().getName(), registeredFamilies));
    }
    Envelope envelope = new Envelope();
    envelope.formatVersion = FORMAT_VERSION;
    envelope.predictor = model;
    try {
      SerializationUtils.writeJsonToFile(path.toFile(), envelope);
    } catch (IOException e) {
      logger.error("Failed to write predictor artifact to {}", path, e);
      throw new ArtifactCorruptException(
          String.format("Failed to write predictor artifact to %s", path), e);
    }
  }

  @Override
  public Predictor load(Path path) {
    if (!path.toFile().isFile()) {
      throw new ArtifactCorruptException(
          String.format("Predictor artifact %s does not exist", path));
    }
    Envelope envelope;
    try {
      envelope = SerializationUtils.parseJsonFromFile(path.toFile(), Envelope.class);
    } catch (IOException e) {
      logger.error("Failed to parse predictor artifact {}", path, e);
      throw new ArtifactCorruptException(
          String.format("Predictor artifact %s is malformed", path), e);
    }
    if (envelope.formatVersion != FORMAT_VERSION) {
      throw new ArtifactCorruptException(
          String.format(
              "Predictor artifact %s uses format version %d, but only version %d is supported",
              path, envelope.formatVersion, FORMAT_VERSION));
    }
    if (envelope.predictor == null) {
      throw new ArtifactCorruptException(
          String.format("Predictor artifact %s does not contain a predictor", path));
    }
    return envelope.predictor;
  }

  @Override
  public String getFormatVersion() {
    return Integer.toString(FORMAT_VERSION);
  }

  private static Set<Class<?>> findRegisteredFamilies() {
    ImmutableSet.Builder<Class<?>> families = ImmutableSet.builder();
    JsonSubTypes subTypes = Predictor.class.getAnnotation(JsonSubTypes.class);
    if (subTypes != null) {
      for (JsonSubTypes.Type type : subTypes.value()) {
        families.add(type.value());
      }
    }
    return families.build();
  }
}
