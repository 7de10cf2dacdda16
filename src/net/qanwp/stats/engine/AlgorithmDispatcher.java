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

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Random;
import net.qanwp.stats.algorithms.AnomalyDetector;
import net.qanwp.stats.algorithms.ArimaForecaster;
import net.qanwp.stats.algorithms.BayesianEnsembleAverager;
import net.qanwp.stats.algorithms.KalmanEstimator;
import net.qanwp.stats.algorithms.QuantileMappingCorrector;
import net.qanwp.stats.algorithms.QuantileMappingCorrector.TrainingSet;
import net.qanwp.stats.algorithms.TrendAnalyzer;
import net.qanwp.stats.exception.AnalysisException;
import net.qanwp.stats.exception.InsufficientDataException;
import net.qanwp.stats.helper.ArgsBase;
import net.qanwp.stats.timeseries.ModelPrediction;
import net.qanwp.stats.timeseries.SeriesPreparer;
import net.qanwp.stats.timeseries.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a request to exactly one algorithm and wraps its output.
 *
 * <p>Instances hold no mutable state and may be shared between threads.
 */
public class AlgorithmDispatcher {
  private static final Logger log = LoggerFactory.getLogger(AlgorithmDispatcher.class);

  private final EngineConfig config;
  private final Clock clock;

  public AlgorithmDispatcher() {
    this(EngineConfig.load(), Clock.systemUTC());
  }

  public AlgorithmDispatcher(EngineConfig config, Clock clock) {
    this.config = config;
    this.clock = clock;
  }

  public AnalysisResult run(String algorithmId, double[] series, Map<String, ?> params) {
    return run(AlgorithmRequest.builder(algorithmId).series(series).params(params).build());
  }

  /**
   * Runs the requested algorithm.
   *
   * @throws AnalysisException if the request is invalid or its data too short
   */
  public AnalysisResult run(AlgorithmRequest request) {
    Algorithm algorithm = Algorithm.fromId(request.getAlgorithmId());
    try {
      AnalysisResult result = dispatch(algorithm, request);
      log.debug("Ran {} on {} data points", algorithm.getId(), result.getDataPoints());
      return result;
    } catch (AnalysisException e) {
      log.warn("{} failed: {}", algorithm.getId(), e.getMessage());
      throw e;
    }
  }

  private AnalysisResult dispatch(Algorithm algorithm, AlgorithmRequest request) {
    switch (algorithm) {
      case KALMAN: {
        KalmanEstimator.Args args = bind(new KalmanEstimator.Args(), request);
        TimeSeries series = primarySeries(request, algorithm);
        return wrap(algorithm, series.size(), new KalmanEstimator(args).filter(series));
      }
      case ARIMA: {
        ArimaForecaster.Args args = bind(new ArimaForecaster.Args(), request);
        TimeSeries series = primarySeries(request, algorithm);
        return wrap(algorithm, series.size(), new ArimaForecaster(args).analyze(series));
      }
      case ENSEMBLE_BAYESIAN: {
        ignoreAll(algorithm, request.getParams());
        List<ModelPrediction> models = request.getModels();
        int dataPoints;
        if (models == null) {
          TimeSeries series = primarySeries(request, algorithm);
          models = BayesianEnsembleAverager.syntheticMembers(series, config.getSyntheticHorizon());
          dataPoints = series.size();
        } else {
          dataPoints = models.isEmpty() ? 0 : models.get(0).getPredictions().size();
        }
        return wrap(algorithm, dataPoints, new BayesianEnsembleAverager().combine(models));
      }
      case BIAS_CORRECTION: {
        QuantileMappingCorrector.Args args = bind(new QuantileMappingCorrector.Args(), request);
        TrainingSet training;
        int dataPoints;
        if (request.hasTrainingPairs()) {
          training = new TrainingSet(SeriesPreparer.prepare(request.getTrainForecasts()),
              SeriesPreparer.prepare(request.getTrainObservations()),
              SeriesPreparer.prepare(request.getNewForecasts()));
          dataPoints = training.getForecasts().size();
        } else {
          TimeSeries series = primarySeries(request, algorithm);
          training = QuantileMappingCorrector.splitSeries(series, config.getSyntheticHorizon(),
              new Random(config.getBiasNoiseSeed()));
          dataPoints = series.size();
        }
        return wrap(algorithm, dataPoints,
            new QuantileMappingCorrector(args).fitAndApply(training));
      }
      case ANOMALY_DETECTION: {
        AnomalyDetector.Args args = bind(new AnomalyDetector.Args(), request);
        TimeSeries series = primarySeries(request, algorithm);
        return wrap(algorithm, series.size(), new AnomalyDetector(args).detect(series));
      }
      case TREND_ANALYSIS: {
        TrendAnalyzer.Args args = bind(new TrendAnalyzer.Args(), request);
        TimeSeries series = primarySeries(request, algorithm);
        return wrap(algorithm, series.size(), new TrendAnalyzer(args).analyze(series));
      }
      default:
        throw new IllegalStateException("No handler for " + algorithm);
    }
  }

  private <A extends ArgsBase> A bind(A args, AlgorithmRequest request) {
    List<String> ignored = args.apply(request.getParams());
    if (!ignored.isEmpty()) {
      log.warn("Ignoring unknown parameters for {}: {}", request.getAlgorithmId(), ignored);
    }
    return args;
  }

  private static void ignoreAll(Algorithm algorithm, Map<String, Object> params) {
    if (!params.isEmpty()) {
      log.warn("{} takes no parameters, ignoring {}", algorithm.getId(), params.keySet());
    }
  }

  private TimeSeries primarySeries(AlgorithmRequest request, Algorithm algorithm) {
    TimeSeries series = SeriesPreparer.prepare(request.getSeries());
    if (series.size() < config.getMinimumSeriesLength()) {
      throw InsufficientDataException.forAlgorithm(algorithm.getDisplayName(),
          config.getMinimumSeriesLength(), series.size());
    }
    return series;
  }

  private AnalysisResult wrap(Algorithm algorithm, int dataPoints, Object output) {
    return new AnalysisResult(algorithm, dataPoints, clock.instant(), output);
  }
}
