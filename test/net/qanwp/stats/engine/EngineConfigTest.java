package net.qanwp.stats.engine;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.*;

public class EngineConfigTest {
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testClasspathResource() {
    EngineConfig config = EngineConfig.load();
    assertEquals(10, config.getMinimumSeriesLength());
    assertEquals(7, config.getSyntheticHorizon());
    assertEquals(42L, config.getBiasNoiseSeed());
  }

  @Test
  public void testFileOverridesSomeKeys() throws IOException {
    File file = folder.newFile("engine.properties");
    Files.write(file.toPath(),
        "engine.synthetic.horizon = 5\n".getBytes(StandardCharsets.UTF_8));
    EngineConfig config = EngineConfig.load(file.toPath());
    assertEquals(5, config.getSyntheticHorizon());
    assertEquals(10, config.getMinimumSeriesLength());
  }

  @Test
  public void testMissingFileFallsBackToDefaults() {
    EngineConfig config = EngineConfig.load(folder.getRoot().toPath().resolve("absent.properties"));
    assertEquals(10, config.getMinimumSeriesLength());
    assertEquals(42L, config.getBiasNoiseSeed());
  }

  @Test
  public void testMalformedValueFallsBackToDefaults() throws IOException {
    File file = folder.newFile("bad.properties");
    Files.write(file.toPath(),
        "engine.minimum.series.length=ten\nengine.synthetic.horizon=3\n"
            .getBytes(StandardCharsets.UTF_8));
    EngineConfig config = EngineConfig.load(file.toPath());
    assertEquals(10, config.getMinimumSeriesLength());
    assertEquals(7, config.getSyntheticHorizon());
  }
}
