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
package edx.merge;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;

import java.util.Arrays;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Maximum likelihood Bradley-Terry strengths from pairwise comparisons.
 * <p>
 * The minorization-maximization update
 * <pre>
 *   p_i = (W_i + 1) / (sum_j n_ij / (p_i + p_j) + 2 / (p_i + 1))
 * </pre>
 * includes a virtual reference item of strength 1 against which every item has one win and one
 * loss, so strengths stay finite and have a fixed scale. All strengths are updated from the
 * previous iterate.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class BradleyTerry {

  private static final Logger logger = Logger.getLogger(BradleyTerry.class.getName());

  private final int maxIterations;
  private final double convergence;
  private int iterations = 0;
  private boolean converged = false;

  /**
   * Constructor for BradleyTerry.
   *
   * @param maxIterations the maximum number of iterations.
   * @param convergence   stop once the largest relative change is below this value.
   */
  public BradleyTerry(int maxIterations, double convergence) {
    this.maxIterations = maxIterations;
    this.convergence = convergence;
  }

  /**
   * Estimate strengths.
   *
   * @param comparisons the pairwise comparisons.
   * @return the strength of each item.
   */
  public double[] fit(PairwiseComparisons comparisons) {
    int n = comparisons.size();
    double[] p = new double[n];
    Arrays.fill(p, 1.0);
    double[] next = new double[n];
    iterations = 0;
    converged = (n == 0);
    double change = 0.0;
    while (!converged && iterations < maxIterations) {
      change = 0.0;
      for (int i = 0; i < n; i++) {
        double denominator = 2.0 / (p[i] + 1.0);
        for (Map.Entry<Integer, Integer> entry : comparisons.getNeighbors(i).entrySet()) {
          denominator += entry.getValue() / (p[i] + p[entry.getKey()]);
        }
        next[i] = (comparisons.getWins(i) + 1.0) / denominator;
        change = max(change, abs(next[i] - p[i]) / p[i]);
      }
      double[] swap = p;
      p = next;
      next = swap;
      iterations++;
      converged = change < convergence;
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest(format(" Iteration %4d: maximum relative change %12.4e", iterations, change));
      }
    }
    if (!converged) {
      logger.info(format(" Bradley-Terry strengths did not converge in %d iterations (change %10.3e).",
          iterations, change));
    } else if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Bradley-Terry strengths converged in %d iterations.", iterations));
    }
    return p;
  }

  /**
   * The number of iterations of the last fit.
   *
   * @return the iteration count.
   */
  public int getIterations() {
    return iterations;
  }

  /**
   * Whether the last fit met the convergence criterion.
   *
   * @return true if converged.
   */
  public boolean isConverged() {
    return converged;
  }
}
