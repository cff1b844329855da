package org.servekit.store;

import java.nio.file.Path;
import org.servekit.models.Tag;

/**
 * A scoped registration of a new model version. Artifacts are written below {@link #getPath()}
 * and become visible under {@link #getTag()} only once {@link #commit()} succeeds. Closing a
 * registration that was never committed discards everything written to it, so callers should
 * open registrations in a try-with-resources block:
 *
 * <pre>
 *   try (Registration registration = store.register(name, module, metadata, context)) {
 *     codec.dump(model, registration.getPath().resolve("saved_model.json"));
 *     registration.commit();
 *     return registration.getTag();
 *   }
 * </pre>
 */
public interface Registration extends AutoCloseable {
  /** @return The tag allocated for the model being registered */
  Tag getTag();

  /** @return The directory into which the model's artifacts should be written */
  Path getPath();

  /**
   * Publishes the registered model under its tag.
   *
   * @throws IllegalStateException If the registration was already committed or closed
   */
  void commit();

  /** Discards the registration if it has not been committed; a no-op otherwise */
  @Override
  void close();
}
