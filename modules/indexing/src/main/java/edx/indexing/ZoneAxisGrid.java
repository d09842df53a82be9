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
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sin;

import java.util.Arrays;

import edx.crystal.LaueSystem;

/**
 * Zone axis directions on the upper hemisphere, restricted to the asymmetric region of a Laue class.
 * <p>
 * Rings of constant polar angle theta_i = i * step are sampled with round(2 PI sin(theta_i) / step)
 * azimuths each, so that neighboring directions are roughly one step apart.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ZoneAxisGrid {

  private static final double TOLERANCE = 1.0e-9;

  private final LaueSystem laueSystem;
  private final double step;
  private final double[] theta;
  private final double[] phi;

  private ZoneAxisGrid(LaueSystem laueSystem, double step, double[] theta, double[] phi) {
    this.laueSystem = laueSystem;
    this.step = step;
    this.theta = theta;
    this.phi = phi;
  }

  /**
   * Generate the zone axis grid.
   *
   * @param laueSystem the Laue class whose asymmetric region is sampled.
   * @param step       the angular step in radians.
   * @return the grid.
   * @throws IllegalArgumentException if the step is not positive.
   */
  public static ZoneAxisGrid generate(LaueSystem laueSystem, double step) {
    if (!(step > 0.0)) {
      throw new IllegalArgumentException(format(" The angular step must be positive: %s", step));
    }
    int nTheta = (int) floor(PI / 2.0 / step + 0.5);
    double[] thetas = new double[16];
    double[] phis = new double[16];
    int n = 0;
    for (int i = 0; i <= nTheta; i++) {
      double t = i * step;
      if (t > PI / 2.0 + TOLERANCE) {
        break;
      }
      int nPhi = (i == 0) ? 1 : max(1, (int) floor(2.0 * PI * sin(t) / step + 0.5));
      for (int j = 0; j < nPhi; j++) {
        double p = j * 2.0 * PI / nPhi;
        if (laueSystem.inAsymmetricRegion(t, p)) {
          if (n == thetas.length) {
            thetas = Arrays.copyOf(thetas, 2 * n);
            phis = Arrays.copyOf(phis, 2 * n);
          }
          thetas[n] = t;
          phis[n] = p;
          n++;
        }
      }
    }
    return new ZoneAxisGrid(laueSystem, step, Arrays.copyOf(thetas, n), Arrays.copyOf(phis, n));
  }

  public int size() {
    return theta.length;
  }

  /**
   * The polar angle of a zone axis.
   *
   * @param i the zone axis index.
   * @return theta in radians.
   */
  public double getTheta(int i) {
    return theta[i];
  }

  /**
   * The azimuth of a zone axis.
   *
   * @param i the zone axis index.
   * @return phi in radians.
   */
  public double getPhi(int i) {
    return phi[i];
  }

  public LaueSystem getLaueSystem() {
    return laueSystem;
  }

  public double getStep() {
    return step;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" %d zone axes for Laue class %s with a step of %6.4f rad", theta.length, laueSystem, step);
  }
}
