package org.servekit.store;

import java.util.List;
import java.util.Map;
import org.servekit.models.ModelInfo;
import org.servekit.models.Tag;

/** Maps model tags to stored model metadata and the location of their artifacts. */
public interface ModelStore {
  /**
   * Resolves a tag to the metadata of a registered model. A tag without a version, or with the
   * version {@code latest}, resolves to the newest version of that name
   *
   * @throws TagNotFoundException If no model is registered under the tag
   */
  ModelInfo get(String tag);

  /**
   * Starts the registration of a new version of the model {@code name}
   *
   * @param name Model name; must be a valid identifier
   * @param module Identity of the adapter module saving the model
   * @param metadata Custom user metadata, may be null
   * @param frameworkContext Library versions and format identifiers of the artifact
   */
  Registration register(
      String name,
      String module,
      Map<String, Object> metadata,
      Map<String, String> frameworkContext);

  /** @return The tags of every registered version of {@code name}, oldest first */
  List<Tag> list(String name);

  /**
   * Removes a registered model and its artifacts
   *
   * @throws TagNotFoundException If no model is registered under the tag
   */
  void delete(String tag);
}
