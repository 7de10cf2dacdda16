/*
 * Copyright (c) 2026 QANWP Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.qanwp.stats.engine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine-wide settings. Missing keys keep their defaults; an unreadable file
 * keeps all of them.
 */
public class EngineConfig {
  private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

  public static final String RESOURCE = "qanwp-engine.properties";

  private int minimumSeriesLength = 10;
  private int syntheticHorizon = 7;
  private long biasNoiseSeed = 42L;

  public static EngineConfig defaults() {
    return new EngineConfig();
  }

  /** Loads {@value #RESOURCE} from the classpath. */
  public static EngineConfig load() {
    try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.warn("{} not found on the classpath, using defaults", RESOURCE);
        return defaults();
      }
      return fromStream(in, RESOURCE);
    } catch (IOException e) {
      log.warn("Failed to read {} from the classpath, using defaults: {}", RESOURCE,
          e.getMessage());
      return defaults();
    }
  }

  public static EngineConfig load(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      return fromStream(in, path.toString());
    } catch (IOException e) {
      log.warn("Failed to load config from {}, using defaults: {}", path, e.getMessage());
      return defaults();
    }
  }

  private static EngineConfig fromStream(InputStream in, String source) throws IOException {
    Properties props = new Properties();
    props.load(in);
    EngineConfig config = new EngineConfig();
    try {
      config.minimumSeriesLength = Integer.parseInt(
          props.getProperty("engine.minimum.series.length", "10").trim());
      config.syntheticHorizon = Integer.parseInt(
          props.getProperty("engine.synthetic.horizon", "7").trim());
      config.biasNoiseSeed = Long.parseLong(
          props.getProperty("engine.bias.noise.seed", "42").trim());
    } catch (NumberFormatException e) {
      log.warn("Malformed value in {}, using defaults: {}", source, e.getMessage());
      return defaults();
    }
    log.debug("Loaded {} from {}", config, source);
    return config;
  }

  /** Shortest primary series the dispatcher accepts. */
  public int getMinimumSeriesLength() {
    return minimumSeriesLength;
  }

  /** Horizon of the synthetic ensemble and of the split bias-correction set. */
  public int getSyntheticHorizon() {
    return syntheticHorizon;
  }

  public long getBiasNoiseSeed() {
    return biasNoiseSeed;
  }

  @Override
  public String toString() {
    return "EngineConfig{minimumSeriesLength=" + minimumSeriesLength
        + ", syntheticHorizon=" + syntheticHorizon
        + ", biasNoiseSeed=" + biasNoiseSeed + "}";
  }
}
