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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * Options that control orientation refinement.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class RefinementOptions {

  /**
   * The optimizer.
   */
  public final RefinementMethod method;
  /**
   * The parameter groups that are varied.
   */
  public final Set<RefinementParameter> vary;
  /**
   * Relative convergence tolerance on the score.
   */
  public final double tolerance;
  /**
   * Maximum number of score evaluations.
   */
  public final int maxEvaluations;
  /**
   * Number of top ranked candidates refined per image.
   */
  public final int nRefine;

  /**
   * Constructor for RefinementOptions.
   *
   * @param method         the optimizer.
   * @param vary           the parameter groups to vary.
   * @param tolerance      the relative convergence tolerance.
   * @param maxEvaluations the maximum number of score evaluations.
   * @param nRefine        the number of candidates refined per image.
   */
  public RefinementOptions(RefinementMethod method, Set<RefinementParameter> vary, double tolerance,
      int maxEvaluations, int nRefine) {
    if (!(tolerance > 0.0)) {
      throw new IllegalArgumentException(format(" The refinement tolerance must be positive: %s", tolerance));
    }
    if (maxEvaluations < 1) {
      throw new IllegalArgumentException(format(" At least one evaluation is required: %d", maxEvaluations));
    }
    this.method = method;
    EnumSet<RefinementParameter> set = EnumSet.noneOf(RefinementParameter.class);
    if (vary != null) {
      set.addAll(vary);
    }
    this.vary = Collections.unmodifiableSet(set);
    this.tolerance = tolerance;
    this.maxEvaluations = maxEvaluations;
    this.nRefine = nRefine;
  }

  /**
   * Default options: Powell refinement of every parameter group for the best candidate.
   */
  public RefinementOptions() {
    this(RefinementMethod.POWELL, EnumSet.allOf(RefinementParameter.class), 1.0e-4, 2000, 1);
  }

  /**
   * Read the "refine-method", "refine-vary", "refine-tolerance", "refine-evaluations" and
   * "refine-top" properties.
   *
   * @param properties a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @return a {@link RefinementOptions} object.
   */
  public static RefinementOptions checkProperties(CompositeConfiguration properties) {
    RefinementMethod method = RefinementMethod.parse(properties.getString("refine-method", "powell"));
    Set<RefinementParameter> vary = RefinementParameter.parse(
        properties.getString("refine-vary", "center+scale+zone-axis+in-plane"));
    double tolerance = properties.getDouble("refine-tolerance", 1.0e-4);
    int maxEvaluations = properties.getInt("refine-evaluations", 2000);
    int nRefine = properties.getInt("refine-top", 1);
    return new RefinementOptions(method, vary, tolerance, maxEvaluations, nRefine);
  }

  @Override
  public String toString() {
    return format(" Refinement options:\n  %-22s %s\n  %-22s %s\n  %-22s %8.2e\n  %-22s %8d\n  %-22s %8d",
        "Method", method, "Vary", RefinementParameter.toString(vary), "Tolerance", tolerance,
        "Max evaluations", maxEvaluations, "Refined candidates", nRefine);
  }
}
