// ******************************************************************************
//
// Title:       Electron Diffraction X.
// Description: Electron Diffraction X - Software for Serial Electron Crystallography.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2025.
//
// This file is part of Electron Diffraction X.
//
// Electron Diffraction X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Electron Diffraction X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Electron Diffraction X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package edx.indexing;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.hypot;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.PowellOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;

/**
 * The Refiner improves a candidate orientation by maximizing the score over continuous parameters.
 * <p>
 * The lattice is re-projected at each trial orientation. Parameters are optimized in reduced units
 * (one pixel for the center, 1% of the scale, half an angular step for the angles). The
 * Nelder-Mead simplex starts with edges of half a unit and is restarted once from the best point
 * with the mirrored simplex. Trial points
 * that move the center more than two pixels, leave the detector, or change the scale by more than
 * 20% are rejected. If the best accepted point does not improve the score, the original
 * parameters are returned flagged as refined but not improved.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Refiner {

  private static final Logger logger = Logger.getLogger(Refiner.class.getName());

  private static final double MAX_CENTER_SHIFT = 2.0;
  private static final double MIN_SCALE_RATIO = 0.8;
  private static final double MAX_SCALE_RATIO = 1.2;
  /**
   * Edge of the starting Nelder-Mead simplex in reduced units.
   */
  private static final double SIMPLEX_STEP = 0.5;

  private final Indexer indexer;
  private final Projector projector;
  private final double angleUnit;

  /**
   * Constructor for Refiner.
   *
   * @param indexer the indexer whose library and scoring options are used.
   */
  public Refiner(Indexer indexer) {
    this.indexer = indexer;
    this.projector = indexer.getLibrary().getProjector();
    this.angleUnit = 0.5 * indexer.getLibrary().getParameters().angularStep;
  }

  /**
   * Refine the top candidates of an indexed pattern and re-rank them.
   *
   * @param pattern       the observed pattern.
   * @param imageIndexing the indexing outcome.
   * @param options       the refinement options.
   * @return a new ImageIndexing (unchanged if the image is not indexed).
   */
  public ImageIndexing refine(ObservedPattern pattern, ImageIndexing imageIndexing, RefinementOptions options) {
    if (!imageIndexing.isIndexed()) {
      return imageIndexing;
    }
    List<IndexingResult> results = new ArrayList<>(imageIndexing.getResults());
    int n = (options.nRefine <= 0) ? results.size() : Math.min(options.nRefine, results.size());
    for (int i = 0; i < n; i++) {
      results.set(i, refine(pattern.getImage(), results.get(i), options.vary, options.method,
          options.tolerance, options.maxEvaluations));
    }
    results.sort(Indexer.RANKING);
    return new ImageIndexing(imageIndexing.getName(), imageIndexing.getStatus(), results);
  }

  /**
   * Refine one result with at most 2000 score evaluations.
   *
   * @param image     the image.
   * @param initial   the starting result.
   * @param vary      the parameter groups to vary.
   * @param method    the optimizer.
   * @param tolerance the relative convergence tolerance.
   * @return a new result whose score is not below the initial score.
   */
  public IndexingResult refine(DiffractionImage image, IndexingResult initial, Set<RefinementParameter> vary,
      RefinementMethod method, double tolerance) {
    return refine(image, initial, vary, method, tolerance, 2000);
  }

  /**
   * Refine one result.
   *
   * @param image          the image.
   * @param initial        the starting result.
   * @param vary           the parameter groups to vary.
   * @param method         the optimizer.
   * @param tolerance      the relative convergence tolerance.
   * @param maxEvaluations the maximum number of score evaluations.
   * @return a new result whose score is not below the initial score.
   */
  public IndexingResult refine(DiffractionImage image, IndexingResult initial, Set<RefinementParameter> vary,
      RefinementMethod method, double tolerance, int maxEvaluations) {
    if (vary == null || vary.isEmpty()) {
      return initial.notImproved(vary, method);
    }

    ScoreFunction function = new ScoreFunction(image, initial, vary);
    double[] x0 = new double[function.nParameters];
    try {
      switch (method) {
        case POWELL -> {
          PowellOptimizer optimizer = new PowellOptimizer(tolerance, 1.0e-10);
          optimizer.optimize(new MaxEval(maxEvaluations), new ObjectiveFunction(function),
              GoalType.MAXIMIZE, new InitialGuess(x0));
        }
        case NELDER_MEAD -> {
          int n = function.nParameters;
          double[] steps = new double[n];
          for (int i = 0; i < n; i++) {
            steps[i] = (i % 2 == 0) ? SIMPLEX_STEP : -SIMPLEX_STEP;
          }
          SimplexOptimizer optimizer = new SimplexOptimizer(tolerance, 1.0e-10);
          double[] guess = x0;
          // The second pass restarts from the best point with the mirrored simplex.
          for (int pass = 0; pass < 2; pass++) {
            int remaining = maxEvaluations - function.evaluations;
            if (remaining <= n + 1) {
              break;
            }
            optimizer.optimize(new MaxEval(remaining), new ObjectiveFunction(function),
                GoalType.MAXIMIZE, new InitialGuess(guess), new NelderMeadSimplex(steps));
            if (function.bestPoint != null) {
              guess = function.bestPoint.clone();
            }
            for (int i = 0; i < n; i++) {
              steps[i] = -steps[i];
            }
          }
        }
      }
    } catch (TooManyEvaluationsException e) {
      logger.fine(format(" Refinement stopped after %d evaluations.", maxEvaluations));
    }

    double[] best = function.bestParameters;
    if (best == null || !(function.bestScore > initial.getScore())) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Refinement did not improve orientation %d (%12.4f).",
            initial.getNumber(), initial.getScore()));
      }
      return initial.notImproved(vary, method);
    }
    IndexingResult refined = new IndexingResult(function.bestScore, initial.getNumber(), best[3], best[4],
        best[5], best[0], best[1], best[2], initial.getPhase(), true, true, vary, method);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Refined score %12.4f -> %12.4f after %d evaluations.",
          initial.getScore(), refined.getScore(), function.evaluations));
    }
    return refined;
  }

  /**
   * Check whether trial parameters stay within the accepted range.
   *
   * @param image   the image.
   * @param initial the starting result.
   * @param cx      the trial center column.
   * @param cy      the trial center row.
   * @param scale   the trial scale.
   * @return true if the trial point is accepted.
   */
  static boolean accepted(DiffractionImage image, IndexingResult initial, double cx, double cy, double scale) {
    if (!(scale > 0.0)) {
      return false;
    }
    double ratio = scale / initial.getScale();
    if (ratio < MIN_SCALE_RATIO || ratio > MAX_SCALE_RATIO) {
      return false;
    }
    if (hypot(cx - initial.getCenterX(), cy - initial.getCenterY()) > MAX_CENTER_SHIFT) {
      return false;
    }
    return cx >= 0.0 && cy >= 0.0 && cx < image.getWidth() && cy < image.getHeight();
  }

  /**
   * Score as a function of the varied parameters in reduced units, tracking the best accepted point.
   */
  private class ScoreFunction implements MultivariateFunction {

    private final DiffractionImage image;
    private final IndexingResult initial;
    /**
     * Maps each optimizer variable onto {cx, cy, scale, alpha, beta, gamma}.
     */
    private final int[] parameterIndex;
    private final double[] unit;
    private final double[] start;
    final int nParameters;
    double[] bestParameters = null;
    /**
     * The best accepted point in reduced units.
     */
    double[] bestPoint = null;
    double bestScore = Double.NEGATIVE_INFINITY;
    int evaluations = 0;

    ScoreFunction(DiffractionImage image, IndexingResult initial, Set<RefinementParameter> vary) {
      this.image = image;
      this.initial = initial;
      start = new double[]{initial.getCenterX(), initial.getCenterY(), initial.getScale(),
          initial.getAlpha(), initial.getBeta(), initial.getGamma()};
      double[] units = {1.0, 1.0, 0.01 * abs(initial.getScale()), angleUnit, angleUnit, angleUnit};
      List<Integer> indices = new ArrayList<>();
      if (vary.contains(RefinementParameter.CENTER)) {
        indices.add(0);
        indices.add(1);
      }
      if (vary.contains(RefinementParameter.SCALE)) {
        indices.add(2);
      }
      if (vary.contains(RefinementParameter.ZONE_AXIS)) {
        indices.add(3);
        indices.add(4);
      }
      if (vary.contains(RefinementParameter.IN_PLANE)) {
        indices.add(5);
      }
      nParameters = indices.size();
      parameterIndex = new int[nParameters];
      unit = new double[nParameters];
      for (int i = 0; i < nParameters; i++) {
        parameterIndex[i] = indices.get(i);
        unit[i] = units[parameterIndex[i]];
      }
    }

    @Override
    public double value(double[] x) {
      evaluations++;
      double[] p = start.clone();
      for (int i = 0; i < nParameters; i++) {
        p[parameterIndex[i]] += x[i] * unit[i];
      }
      if (!accepted(image, initial, p[0], p[1], p[2])) {
        return -1.0;
      }
      ProjectedSpots spots = projector.project(p[3], p[4], p[5]);
      double score = indexer.score(image, spots, p[2], p[0], p[1]);
      if (score > bestScore) {
        bestScore = score;
        bestParameters = p;
        bestPoint = x.clone();
      }
      return score;
    }
  }
}
