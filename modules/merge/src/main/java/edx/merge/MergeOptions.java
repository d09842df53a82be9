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

import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * Settings of a rank aggregation merge.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MergeOptions {

  /**
   * Number of top scoring images merged; 0 or less merges every image.
   */
  public final int topN;
  /**
   * Fewer selected images than this flags the merge as low confidence.
   */
  public final int minImages;
  /**
   * Maximum number of Bradley-Terry iterations.
   */
  public final int maxIterations;
  /**
   * Convergence criterion on the largest relative change of a strength.
   */
  public final double convergence;

  /**
   * Constructor for MergeOptions.
   *
   * @param topN          number of images to merge (0 or less for all).
   * @param minImages     minimum number of images for a confident merge.
   * @param maxIterations maximum number of iterations.
   * @param convergence   convergence criterion.
   */
  public MergeOptions(int topN, int minImages, int maxIterations, double convergence) {
    if (maxIterations <= 0) {
      throw new IllegalArgumentException(format(" The number of merge iterations must be positive (%d).", maxIterations));
    }
    if (!(convergence > 0.0)) {
      throw new IllegalArgumentException(format(" The merge convergence criterion must be positive (%s).", convergence));
    }
    this.topN = topN;
    this.minImages = minImages;
    this.maxIterations = maxIterations;
    this.convergence = convergence;
  }

  /**
   * Merge every image with the default settings.
   */
  public MergeOptions() {
    this(0, 3, 1000, 1.0e-9);
  }

  /**
   * Read the "top-n", "min-images", "merge-iterations" and "merge-convergence" properties.
   *
   * @param properties a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @return a {@link MergeOptions} object.
   */
  public static MergeOptions checkProperties(CompositeConfiguration properties) {
    int topN = properties.getInt("top-n", 0);
    int minImages = properties.getInt("min-images", 3);
    int maxIterations = properties.getInt("merge-iterations", 1000);
    double convergence = properties.getDouble("merge-convergence", 1.0e-9);
    return new MergeOptions(topN, minImages, maxIterations, convergence);
  }

  /**
   * A copy with a different number of merged images.
   *
   * @param n the number of top scoring images.
   * @return new options.
   */
  public MergeOptions withTopN(int n) {
    return new MergeOptions(n, minImages, maxIterations, convergence);
  }

  @Override
  public String toString() {
    return format(" Merge options:\n  %-22s %8d\n  %-22s %8d\n  %-22s %8d\n  %-22s %8.1e",
        "Top images", topN, "Min images", minImages, "Max iterations", maxIterations,
        "Convergence", convergence);
  }
}
