package org.servekit.models;

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/** Unit tests for reading and writing {@link ModelInfo} model metadata */
public class ModelInfoTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Test
  public void testModelInfoIsLoadedFromYamlCorrectly() throws IOException {
    Path modelPath = Paths.get(getClass().getResource("sample_model").getFile());
    ModelInfo info = ModelInfo.fromPath(modelPath);

    Assert.assertEquals(Tag.parse("iris:v3"), info.getTag());
    Assert.assertEquals("servekit.tabular", info.getModule());
    Assert.assertEquals("2021-06-14T09:21:07.512Z", info.getCreationTime());
    Assert.assertEquals(modelPath.toAbsolutePath(), info.getPath());
    Assert.assertEquals(0.97, (Double) info.getMetadata().get("accuracy"), 1e-9);
    Assert.assertEquals("iris", info.getMetadata().get("dataset"));
    Assert.assertTrue(info.getMetadata().containsKey("owner"));
    Assert.assertNull(info.getMetadata().get("owner"));
    Assert.assertEquals("1", info.getFrameworkContext().get("codec_format"));
  }

  @Test
  public void testModelInfoIsLoadedCorrectlyWhenMetadataAndContextDoNotExist()
      throws IOException {
    Path modelPath = Paths.get(getClass().getResource("bare_model").getFile());
    ModelInfo info = ModelInfo.fromPath(modelPath);

    Assert.assertEquals(Tag.parse("iris:v4"), info.getTag());
    Assert.assertTrue(info.getMetadata().isEmpty());
    Assert.assertTrue(info.getFrameworkContext().isEmpty());
  }

  @Test
  public void testWrittenModelInfoIsReadBackWithTheSameContents() throws IOException {
    Path modelPath = temporaryFolder.newFolder("v7").toPath();
    Map<String, Object> metadata = new HashMap<>();
    metadata.put("acc", 0.97);
    metadata.put("notes", null);
    ModelInfo written =
        new ModelInfo(
            Tag.of("iris", "v7"),
            "servekit.tabular",
            modelPath,
            "2021-06-14T09:21:07Z",
            metadata,
            ImmutableMap.of("codec_format", "1"));
    written.writeTo(modelPath);

    ModelInfo read = ModelInfo.fromPath(modelPath);
    Assert.assertEquals(written.getTag(), read.getTag());
    Assert.assertEquals(written.getModule(), read.getModule());
    Assert.assertEquals(written.getCreationTime(), read.getCreationTime());
    Assert.assertEquals(written.getMetadata(), read.getMetadata());
    Assert.assertEquals(written.getFrameworkContext(), read.getFrameworkContext());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testMetadataCannotBeModified() throws IOException {
    Path modelPath = Paths.get(getClass().getResource("sample_model").getFile());
    ModelInfo.fromPath(modelPath).getMetadata().put("accuracy", 1.0);
  }
}
