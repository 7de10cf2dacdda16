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
package net.qanwp.stats.algorithms;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.qanwp.stats.exception.LengthMismatchException;
import net.qanwp.stats.exception.NoModelsProvidedException;
import net.qanwp.stats.timeseries.ModelPrediction;
import net.qanwp.stats.timeseries.SeriesPreparer;
import net.qanwp.stats.timeseries.TimeSeries;
import org.apache.commons.math.stat.descriptive.moment.Mean;

/**
 * Bayesian model averaging of forecast ensembles, after
 * Raftery, A. E., Gneiting, T., Balabdaoui, F., Polakowski, M. (2005). Using
 * Bayesian Model Averaging to Calibrate Forecast Ensembles. Monthly Weather
 * Review, 133, 1155-1174.
 *
 * <p>The prior weight of a member is proportional to the inverse of its
 * historical error (floored at 0.1). The likelihood rewards agreement with the
 * rest of the ensemble: the mean over the horizon of exp(-|pred - others| / 2),
 * where others is the mean prediction of all other members. A lone member has
 * no one to disagree with and gets likelihood 1.
 *
 * <p>Likelihoods and posteriors are computed in log space, so members that
 * disagree by thousands of units still get finite weights summing to 1.
 */
public final class BayesianEnsembleAverager {
  private static final double MIN_ERROR = 0.1;

  /** Prior, likelihood and posterior of one member. */
  public static final class MemberWeight {
    private final String name;
    private final double priorWeight;
    private final double likelihood;
    private final double posteriorWeight;
    private final double historicalError;

    MemberWeight(String name, double priorWeight, double likelihood, double posteriorWeight,
        double historicalError) {
      this.name = name;
      this.priorWeight = priorWeight;
      this.likelihood = likelihood;
      this.posteriorWeight = posteriorWeight;
      this.historicalError = historicalError;
    }

    public String getName() {
      return name;
    }

    public double getPriorWeight() {
      return priorWeight;
    }

    public double getLikelihood() {
      return likelihood;
    }

    public double getPosteriorWeight() {
      return posteriorWeight;
    }

    public double getHistoricalError() {
      return historicalError;
    }
  }

  /** Combined forecast with per-point spread and ensemble quality metrics. */
  public static final class Ensemble {
    private final List<MemberWeight> members;
    private final double[] predictions;
    private final double[] uncertainties;
    private final double avgUncertainty;
    private final double spreadSkillRatio;
    private final double effectiveModelCount;

    Ensemble(List<MemberWeight> members, double[] predictions, double[] uncertainties,
        double avgUncertainty, double spreadSkillRatio, double effectiveModelCount) {
      this.members = members;
      this.predictions = predictions;
      this.uncertainties = uncertainties;
      this.avgUncertainty = avgUncertainty;
      this.spreadSkillRatio = spreadSkillRatio;
      this.effectiveModelCount = effectiveModelCount;
    }

    public List<MemberWeight> getMembers() {
      return members;
    }

    public double[] getPredictions() {
      return predictions.clone();
    }

    public double[] getUncertainties() {
      return uncertainties.clone();
    }

    public double getAvgUncertainty() {
      return avgUncertainty;
    }

    /** Mean ensemble spread over the mean historical error of the members. */
    public double getSpreadSkillRatio() {
      return spreadSkillRatio;
    }

    /** Inverse Simpson index of the posterior weights. */
    public double getEffectiveModelCount() {
      return effectiveModelCount;
    }
  }

  /**
   * Combines the members into one posterior-weighted forecast.
   *
   * @param models ensemble members, all with the same horizon
   */
  public Ensemble combine(List<ModelPrediction> models) {
    if (models == null || models.isEmpty()) {
      throw new NoModelsProvidedException();
    }
    int numModels = models.size();
    int horizon = models.get(0).getPredictions().size();
    double[][] preds = new double[numModels][];
    double[] errors = new double[numModels];
    for (int m = 0; m < numModels; m++) {
      ModelPrediction model = models.get(m);
      if (model.getPredictions().size() != horizon) {
        throw new LengthMismatchException(model.getName(), horizon,
            model.getPredictions().size());
      }
      preds[m] = model.getPredictions().toArray();
      errors[m] = model.getHistoricalError();
    }
    SeriesPreparer.requireNonEmpty(models.get(0).getPredictions(),
        "Predictions of model '" + models.get(0).getName() + "'");

    double[] prior = new double[numModels];
    double totalInverse = 0;
    for (int m = 0; m < numModels; m++) {
      prior[m] = 1 / Math.max(MIN_ERROR, errors[m]);
      totalInverse += prior[m];
    }
    for (int m = 0; m < numModels; m++) {
      prior[m] /= totalInverse;
    }

    double[] logPosterior = new double[numModels];
    double[] likelihood = new double[numModels];
    double maxLogPosterior = Double.NEGATIVE_INFINITY;
    for (int m = 0; m < numModels; m++) {
      double logLikelihood = logConsistency(preds, m, horizon);
      likelihood[m] = Math.exp(logLikelihood);
      logPosterior[m] = Math.log(prior[m]) + logLikelihood;
      maxLogPosterior = Math.max(maxLogPosterior, logPosterior[m]);
    }

    double[] posterior = new double[numModels];
    double totalPosterior = 0;
    for (int m = 0; m < numModels; m++) {
      posterior[m] = Math.exp(logPosterior[m] - maxLogPosterior);
      totalPosterior += posterior[m];
    }
    for (int m = 0; m < numModels; m++) {
      posterior[m] /= totalPosterior;
    }

    double[] ensemble = new double[horizon];
    double[] uncertainties = new double[horizon];
    for (int i = 0; i < horizon; i++) {
      double weightedSum = 0;
      for (int m = 0; m < numModels; m++) {
        weightedSum += posterior[m] * preds[m][i];
      }
      double weightedVariance = 0;
      for (int m = 0; m < numModels; m++) {
        double diff = preds[m][i] - weightedSum;
        weightedVariance += posterior[m] * diff * diff;
      }
      ensemble[i] = weightedSum;
      uncertainties[i] = Math.sqrt(weightedVariance);
    }

    double sumSquaredWeights = 0;
    ImmutableList.Builder<MemberWeight> members = ImmutableList.builder();
    for (int m = 0; m < numModels; m++) {
      sumSquaredWeights += posterior[m] * posterior[m];
      members.add(new MemberWeight(models.get(m).getName(), prior[m], likelihood[m],
          posterior[m], errors[m]));
    }

    double avgUncertainty = new Mean().evaluate(uncertainties);
    double spreadSkillRatio = avgUncertainty / new Mean().evaluate(errors);
    return new Ensemble(members.build(), ensemble, uncertainties, avgUncertainty,
        spreadSkillRatio, 1 / sumSquaredWeights);
  }

  /**
   * Log of the mean agreement of member {@code m} with the average of the
   * other members: log(sum_i exp(-|d_i| / 2)) - log(horizon).
   */
  private static double logConsistency(double[][] preds, int m, int horizon) {
    int numModels = preds.length;
    if (numModels == 1) {
      return 0;
    }
    double[] terms = new double[horizon];
    double maxTerm = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < horizon; i++) {
      double sumOthers = 0;
      for (int k = 0; k < numModels; k++) {
        if (k != m) {
          sumOthers += preds[k][i];
        }
      }
      double avgOthers = sumOthers / (numModels - 1);
      terms[i] = -Math.abs(preds[m][i] - avgOthers) / 2;
      maxTerm = Math.max(maxTerm, terms[i]);
    }
    double sum = 0;
    for (double term : terms) {
      sum += Math.exp(term - maxTerm);
    }
    return maxTerm + Math.log(sum) - Math.log(horizon);
  }

  /**
   * Demonstration ensemble built from the most recent observations, used when
   * a request carries no model predictions: IFS follows the observations, GFS
   * runs 0.5 warm and ICON 0.3 cold, with historical errors 1.2, 1.5 and 1.8.
   *
   * @param series observed series
   * @param horizon number of most recent observations to use
   */
  public static List<ModelPrediction> syntheticMembers(TimeSeries series, int horizon) {
    TimeSeries recent = series.tail(horizon);
    return ImmutableList.of(
        new ModelPrediction("IFS", recent, 1.2),
        new ModelPrediction("GFS", recent.shift(0.5), 1.5),
        new ModelPrediction("ICON", recent.shift(-0.3), 1.8));
  }
}
