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

import static edx.numerics.math.MatrixMath.mat3Vec3;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import edx.crystal.Crystal;
import edx.crystal.HKL;
import edx.crystal.ReflectionList;

/**
 * The Projector computes which reciprocal lattice points are excited for a crystal orientation.
 * <p>
 * A lattice point g (in the Cartesian frame of the crystal) is rotated into the laboratory frame,
 * g' = R g, and its excitation error is s = -g'z - |g'|^2 / (2k) with k = 1 / lambda. Points with
 * |s| below 1 / thickness are kept with weight 1 - |s| / smax.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Projector {

  private static final Logger logger = Logger.getLogger(Projector.class.getName());

  private final ReflectionList reflectionList;
  private final LibraryParameters parameters;
  private final double k;
  private final double maxExcitationError;
  /**
   * Cartesian lattice points, one row per Laue mate of every unique reflection.
   */
  private final double[][] latticePoints;
  private final int[][] latticeHKL;
  private final int[] latticeIndex;

  /**
   * Constructor for Projector.
   *
   * @param reflectionList the unique reflections.
   * @param parameters     the library parameters (thickness and voltage are used).
   */
  public Projector(ReflectionList reflectionList, LibraryParameters parameters) {
    this.reflectionList = reflectionList;
    this.parameters = parameters;
    this.k = 1.0 / parameters.getWavelength();
    this.maxExcitationError = parameters.getMaxExcitationError();

    Crystal crystal = reflectionList.crystal;
    int n = 0;
    for (HKL hkl : reflectionList.hklList) {
      n += reflectionList.equivalents(hkl).size();
    }
    latticePoints = new double[n][];
    latticeHKL = new int[n][];
    latticeIndex = new int[n];
    int i = 0;
    for (HKL hkl : reflectionList.hklList) {
      List<int[]> mates = reflectionList.equivalents(hkl);
      for (int[] mate : mates) {
        latticePoints[i] = crystal.reciprocalVector(mate[0], mate[1], mate[2]);
        latticeHKL[i] = mate;
        latticeIndex[i] = hkl.getIndex();
        i++;
      }
    }
    logger.fine(format(" Projector with %d lattice points for %d unique reflections.",
        n, reflectionList.size()));
  }

  /**
   * Project the lattice for an orientation.
   *
   * @param orientation the orientation.
   * @return the excited spots.
   */
  public ProjectedSpots project(Orientation orientation) {
    return project(orientation.alpha, orientation.beta, orientation.gamma);
  }

  /**
   * Project the lattice for an orientation.
   *
   * @param alpha the polar angle of the zone axis.
   * @param beta  the azimuth of the zone axis.
   * @param gamma the in-plane rotation.
   * @return the excited spots.
   */
  public ProjectedSpots project(double alpha, double beta, double gamma) {
    double[][] r = Orientation.rotationMatrix(alpha, beta, gamma);
    int n = latticePoints.length;
    double[] x = new double[n];
    double[] y = new double[n];
    double[] w = new double[n];
    double[] s = new double[n];
    int[] index = new int[n];
    int[][] hkl = new int[n][];
    int count = 0;
    double twoK = 2.0 * k;
    double[] g = new double[3];
    for (int i = 0; i < n; i++) {
      mat3Vec3(r, latticePoints[i], g);
      double gx = g[0];
      double gy = g[1];
      double gz = g[2];
      double excitation = -gz - (gx * gx + gy * gy + gz * gz) / twoK;
      if (abs(excitation) < maxExcitationError) {
        x[count] = gx;
        y[count] = gy;
        w[count] = 1.0 - abs(excitation) / maxExcitationError;
        s[count] = excitation;
        index[count] = latticeIndex[i];
        hkl[count] = latticeHKL[i];
        count++;
      }
    }
    return new ProjectedSpots(Arrays.copyOf(x, count), Arrays.copyOf(y, count),
        Arrays.copyOf(w, count), Arrays.copyOf(s, count),
        Arrays.copyOf(index, count), Arrays.copyOf(hkl, count));
  }

  /**
   * The number of lattice points (all Laue mates of the unique reflections).
   *
   * @return the number of lattice points.
   */
  public int getLatticePointCount() {
    return latticePoints.length;
  }

  public ReflectionList getReflectionList() {
    return reflectionList;
  }

  public LibraryParameters getParameters() {
    return parameters;
  }
}
