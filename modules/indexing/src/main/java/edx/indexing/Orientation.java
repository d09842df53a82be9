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

import static edx.numerics.math.MatrixMath.mat3Mat3Multiply;
import static edx.numerics.math.MatrixMath.rotationY;
import static edx.numerics.math.MatrixMath.rotationZ;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

/**
 * A crystal orientation relative to the electron beam.
 * <p>
 * The zone axis u = (sin(alpha) cos(beta), sin(alpha) sin(beta), cos(alpha)) is given in the
 * Cartesian frame of the crystal; gamma is the in-plane rotation about the beam. The rotation
 * R = Rz(gamma) Ry(-alpha) Rz(-beta) maps u onto the beam direction +z.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Orientation {

  /**
   * Polar angle of the zone axis in radians.
   */
  public final double alpha;
  /**
   * Azimuth of the zone axis in radians.
   */
  public final double beta;
  /**
   * In-plane rotation about the beam in radians.
   */
  public final double gamma;

  /**
   * Constructor for Orientation.
   *
   * @param alpha the polar angle of the zone axis.
   * @param beta  the azimuth of the zone axis.
   * @param gamma the in-plane rotation.
   */
  public Orientation(double alpha, double beta, double gamma) {
    this.alpha = alpha;
    this.beta = beta;
    this.gamma = gamma;
  }

  /**
   * The rotation from the crystal Cartesian frame into the laboratory frame.
   *
   * @return a 3x3 rotation matrix.
   */
  public double[][] getRotationMatrix() {
    return rotationMatrix(alpha, beta, gamma);
  }

  /**
   * The rotation R = Rz(gamma) Ry(-alpha) Rz(-beta).
   *
   * @param alpha the polar angle of the zone axis.
   * @param beta  the azimuth of the zone axis.
   * @param gamma the in-plane rotation.
   * @return a 3x3 rotation matrix.
   */
  public static double[][] rotationMatrix(double alpha, double beta, double gamma) {
    return mat3Mat3Multiply(rotationZ(gamma), mat3Mat3Multiply(rotationY(-alpha), rotationZ(-beta)));
  }

  /**
   * The zone axis unit vector in the crystal Cartesian frame.
   *
   * @return the zone axis.
   */
  public double[] getZoneAxis() {
    return new double[]{sin(alpha) * cos(beta), sin(alpha) * sin(beta), cos(alpha)};
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format("(%8.5f, %8.5f, %8.5f)", alpha, beta, gamma);
  }
}
