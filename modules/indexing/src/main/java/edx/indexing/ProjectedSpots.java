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

import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

import java.util.Arrays;

/**
 * The diffraction spots that are excited in one orientation.
 * <p>
 * Detector plane coordinates are in inverse Angstroms; multiplying by the scale (1 / pixel size)
 * gives pixels relative to the beam center. Instances are immutable.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ProjectedSpots {

  private final double[] x;
  private final double[] y;
  private final double[] weight;
  private final double[] excitationError;
  private final int[] reflectionIndex;
  private final int[][] hkl;

  /**
   * Constructor for ProjectedSpots. The arrays are copied.
   *
   * @param x               detector x coordinates.
   * @param y               detector y coordinates.
   * @param weight          visibility weights in (0, 1].
   * @param excitationError excitation errors.
   * @param reflectionIndex the index of each spot's unique reflection.
   * @param hkl             the lattice point of each spot.
   */
  public ProjectedSpots(double[] x, double[] y, double[] weight, double[] excitationError,
      int[] reflectionIndex, int[][] hkl) {
    int n = x.length;
    if (y.length != n || weight.length != n || excitationError.length != n
        || reflectionIndex.length != n || hkl.length != n) {
      throw new IllegalArgumentException(" Projected spot arrays must have equal lengths.");
    }
    this.x = Arrays.copyOf(x, n);
    this.y = Arrays.copyOf(y, n);
    this.weight = Arrays.copyOf(weight, n);
    this.excitationError = Arrays.copyOf(excitationError, n);
    this.reflectionIndex = Arrays.copyOf(reflectionIndex, n);
    this.hkl = new int[n][];
    for (int i = 0; i < n; i++) {
      this.hkl[i] = Arrays.copyOf(hkl[i], 3);
    }
  }

  /**
   * Rotate the spots in the detector plane.
   *
   * @param gamma rotation angle in radians.
   * @return new spots with x' = c x - s y and y' = s x + c y.
   */
  public ProjectedSpots rotate(double gamma) {
    double c = cos(gamma);
    double s = sin(gamma);
    int n = x.length;
    double[] xr = new double[n];
    double[] yr = new double[n];
    for (int i = 0; i < n; i++) {
      xr[i] = c * x[i] - s * y[i];
      yr[i] = s * x[i] + c * y[i];
    }
    return new ProjectedSpots(xr, yr, weight, excitationError, reflectionIndex, hkl);
  }

  public int size() {
    return x.length;
  }

  public double getX(int i) {
    return x[i];
  }

  public double getY(int i) {
    return y[i];
  }

  public double getWeight(int i) {
    return weight[i];
  }

  public double getExcitationError(int i) {
    return excitationError[i];
  }

  /**
   * The index of the spot's unique reflection in the ReflectionList.
   *
   * @param i the spot.
   * @return the reflection index.
   */
  public int getReflectionIndex(int i) {
    return reflectionIndex[i];
  }

  /**
   * The diffracting lattice point.
   *
   * @param i the spot.
   * @return a copy of {h, k, l}.
   */
  public int[] getHKL(int i) {
    return Arrays.copyOf(hkl[i], 3);
  }
}
