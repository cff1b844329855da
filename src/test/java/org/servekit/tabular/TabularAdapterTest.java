package org.servekit.tabular;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.servekit.MissingDependencyException;
import org.servekit.codec.ArtifactCodec;
import org.servekit.codec.ArtifactCorruptException;
import org.servekit.codec.JsonPredictorCodec;
import org.servekit.models.ModelInfo;
import org.servekit.models.Tag;
import org.servekit.runner.ResourceQuota;
import org.servekit.scoring.LinearRegressor;
import org.servekit.scoring.NearestCentroidClassifier;
import org.servekit.scoring.Predictor;
import org.servekit.scoring.PredictorEvaluationException;
import org.servekit.scoring.RowwisePredictor;
import org.servekit.store.LocalModelStore;
import org.servekit.store.ModelStore;
import org.servekit.store.Registration;
import org.servekit.store.TagNotFoundException;

/** Unit tests for saving, loading and creating runners with the {@link TabularAdapter} */
public class TabularAdapterTest {
  static final double[][] IRIS_SAMPLES = {
    {5.1, 3.5, 1.4, 0.2}, {4.9, 3.0, 1.4, 0.2}, {4.7, 3.2, 1.3, 0.2},
    {7.0, 3.2, 4.7, 1.4}, {6.4, 3.2, 4.5, 1.5}, {6.9, 3.1, 4.9, 1.5},
    {6.3, 3.3, 6.0, 2.5}, {5.8, 2.7, 5.1, 1.9}, {7.1, 3.0, 5.9, 2.1}
  };
  static final double[] IRIS_TARGETS = {0, 0, 0, 1, 1, 1, 2, 2, 2};

  /** A predictor family that is not registered with the artifact codec */
  public static class Doubler extends RowwisePredictor {
    @Override
    public int getNumFeatures() {
      return 1;
    }

    @Override
    protected double predictRow(double[] row) {
      return 2 * row[0];
    }
  }

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private LocalModelStore store;
  private ArtifactCodec<Predictor> codec;
  private TabularAdapter adapter;

  @Before
  public void setUp() throws IOException {
    store = new LocalModelStore(temporaryFolder.newFolder("models").toPath());
    codec = spy(new JsonPredictorCodec());
    adapter = new TabularAdapter(store, codec);
  }

  @Test
  public void testIrisModelIsSavedAndLoadedThroughTheModelStore()
      throws IOException, PredictorEvaluationException {
    ModelStore mockStore = mock(ModelStore.class);
    Registration registration = mock(Registration.class);
    Path modelPath = temporaryFolder.newFolder("iris", "v1").toPath();
    Map<String, Object> metadata = ImmutableMap.of("acc", 0.97);
    when(registration.getTag()).thenReturn(Tag.of("iris", "v1"));
    when(registration.getPath()).thenReturn(modelPath);
    when(mockStore.register(eq("iris"), eq(TabularAdapter.MODULE_NAME), eq(metadata), anyMap()))
        .thenReturn(registration);
    when(mockStore.get("iris:v1"))
        .thenReturn(
            new ModelInfo(
                Tag.of("iris", "v1"),
                TabularAdapter.MODULE_NAME,
                modelPath,
                "2021-06-14T09:21:07Z",
                metadata,
                null));

    TabularAdapter irisAdapter = new TabularAdapter(mockStore, new JsonPredictorCodec());
    NearestCentroidClassifier model = NearestCentroidClassifier.fit(IRIS_SAMPLES, IRIS_TARGETS);
    Tag tag = irisAdapter.save("iris", model, metadata);

    Assert.assertEquals("iris:v1", tag.toString());
    verify(registration).commit();
    verify(registration).close();

    double[][] row = {{5.1, 3.5, 1.4, 0.2}};
    Predictor loaded = irisAdapter.load("iris:v1");
    Assert.assertArrayEquals(model.predict(row), loaded.predict(row), 0.0);
    Assert.assertArrayEquals(new double[] {0}, loaded.predict(row), 0.0);
  }

  @Test
  public void testLoadedPredictorIsBitIdenticalToTheSavedOne()
      throws PredictorEvaluationException {
    LinearRegressor model =
        new LinearRegressor(new double[] {0.1, 1.0 / 3.0, -2.718281828459045, 1e-17}, Math.PI);
    Tag tag = adapter.save("regressor", model, null);

    Predictor loaded = adapter.load(tag.toString());
    for (double[] row : IRIS_SAMPLES) {
      double[][] batch = {row};
      Assert.assertEquals(
          Double.doubleToRawLongBits(model.predict(batch)[0]),
          Double.doubleToRawLongBits(loaded.predict(batch)[0]));
    }
  }

  @Test
  public void testSavedModelRecordsModuleMetadataAndFrameworkContext() {
    Tag tag = adapter.save("iris", NearestCentroidClassifier.fit(IRIS_SAMPLES, IRIS_TARGETS),
        ImmutableMap.of("acc", 0.97));

    ModelInfo info = store.get(tag.toString());
    Assert.assertEquals(TabularAdapter.MODULE_NAME, info.getModule());
    Assert.assertEquals(0.97, (Double) info.getMetadata().get("acc"), 1e-9);
    Assert.assertEquals(
        Integer.toString(JsonPredictorCodec.FORMAT_VERSION),
        info.getFrameworkContext().get("codec_format"));
    Assert.assertTrue(info.getFrameworkContext().containsKey("jackson"));
    Assert.assertTrue(
        info.getPath().resolve(TabularAdapter.ARTIFACT_FILE_NAME).toFile().isFile());
  }

  @Test
  public void testEachSaveCreatesANewVersion() {
    Predictor model = new LinearRegressor(new double[] {1.0}, 0.0);
    Assert.assertEquals("iris:v1", adapter.save("iris", model, null).toString());
    Assert.assertEquals("iris:v2", adapter.save("iris", model, null).toString());
  }

  @Test
  public void testFailedSerializationDoesNotRegisterATag() {
    Predictor model = new LinearRegressor(new double[] {1.0}, 0.0);
    doThrow(new ArtifactCorruptException("disk full")).when(codec).dump(eq(model), any());

    try {
      adapter.save("iris", model, null);
      Assert.fail("Expected the serialization failure to propagate");
    } catch (ArtifactCorruptException e) {
      // Succeed
    }
    Assert.assertTrue(store.list("iris").isEmpty());
  }

  @Test
  public void testUnregisteredPredictorFamilyIsNotSaved() {
    try {
      adapter.save("doubler", new Doubler(), null);
      Assert.fail("Expected a predictor of an unregistered family to be rejected");
    } catch (ArtifactCorruptException e) {
      Assert.assertTrue(e.getMessage().contains(Doubler.class.getName()));
    }
    Assert.assertTrue(store.list("doubler").isEmpty());
  }

  @Test
  public void testMissingMetadataFormatLibraryIsReportedOnConstruction() {
    try {
      new TabularAdapter(store, codec, "org.example.absent.YamlFactory");
      Assert.fail("Expected the missing library to be reported");
    } catch (MissingDependencyException e) {
      Assert.assertTrue(e.getMessage().contains("jackson-dataformat-yaml"));
    }
  }

  @Test(expected = ModuleMismatchException.class)
  public void testLoadingModelSavedByAnotherModuleFails() {
    try (Registration registration = store.register("iris", "servekit.other", null, null)) {
      registration.commit();
    }
    adapter.load("iris:v1");
  }

  @Test
  public void testRunnerForModelSavedByAnotherModuleIsNotCreated() {
    try (Registration registration = store.register("iris", "servekit.other", null, null)) {
      registration.commit();
    }
    try {
      adapter.loadRunner("iris:v1", ResourceQuota.ofCpu(1), null);
      Assert.fail("Expected a module mismatch");
    } catch (ModuleMismatchException e) {
      Assert.assertTrue(e.getMessage().contains("servekit.other"));
    }
    verify(codec, never()).load(any());
  }

  @Test(expected = TagNotFoundException.class)
  public void testLoadingUnknownTagFails() {
    adapter.load("iris:v1");
  }

  @Test
  public void testRunnerCreationResolvesTagEagerly() {
    try {
      adapter.loadRunner("iris:v1", ResourceQuota.ofCpu(1), null);
      Assert.fail("Expected an unknown tag to fail runner creation");
    } catch (TagNotFoundException e) {
      // Succeed
    }
    verify(codec, never()).load(any());
  }

  @Test(expected = NullPointerException.class)
  public void testRunnerCreationRequiresAQuota() {
    Tag tag = adapter.save("iris", new LinearRegressor(new double[] {1.0}, 0.0), null);
    adapter.loadRunner(tag.toString(), null, null);
  }

  @Test
  public void testLatestVersionIsLoadedForBareName() throws PredictorEvaluationException {
    adapter.save("iris", new LinearRegressor(new double[] {1.0}, 0.0), null);
    adapter.save("iris", new LinearRegressor(new double[] {1.0}, 5.0), null);

    Assert.assertArrayEquals(
        new double[] {6.0}, adapter.load("iris").predict(new double[][] {{1.0}}), 0.0);
  }
}
