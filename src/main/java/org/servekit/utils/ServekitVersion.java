package org.servekit.utils;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import java.io.InputStream;
import java.util.Properties;

/** Returns the version of the servekit project this library was compiled as. */
public class ServekitVersion {
  // Read pom.properties lazily on first access and cache the result.
  private static Supplier<String> versionSupplier = Suppliers.memoize(() -> {
    try (InputStream is = ServekitVersion.class.getResourceAsStream(
        "/META-INF/maven/org.servekit/servekit-scoring/pom.properties")) {
      if (is == null) {
        return "";
      }
      Properties p = new Properties();
      p.load(is);
      return p.getProperty("version", "");
    } catch (Exception e) {
      return "";
    }
  });

  private ServekitVersion() {}

  /** @return servekit version (e.g., 0.3.0) or an empty string if detection fails. */
  public static String getVersion() {
    return versionSupplier.get();
  }
}
