package org.servekit.utils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Utilities for manipulating files and file paths */
public class FileUtils {
  /** Concatenates file paths together and returns the result as a string */
  public static String join(String basePath, String... morePaths) {
    Path filePath = Paths.get(basePath, morePaths);
    return filePath.toString();
  }

  /** Deletes a directory and everything below it. Missing directories are ignored */
  public static void deleteRecursively(Path directory) throws IOException {
    File file = directory.toFile();
    if (file.exists()) {
      org.apache.commons.io.FileUtils.deleteDirectory(file);
    }
  }
}
