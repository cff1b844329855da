package org.servekit.codec;

import java.nio.file.Path;

/**
 * Serializes model objects of type {@code T} to files and reconstructs them.
 *
 * <p>Implementations must be safe to call from multiple threads.
 */
public interface ArtifactCodec<T> {
  /**
   * Writes {@code model} to {@code path}
   *
   * @throws ArtifactCorruptException If the model cannot be serialized or written
   */
  void dump(T model, Path path);

  /**
   * Reads the model stored at {@code path}
   *
   * @throws ArtifactCorruptException If the artifact is missing, malformed or incompatible
   */
  T load(Path path);

  /** @return An identifier of the on-disk format, recorded in the model's framework context */
  String getFormatVersion();
}
