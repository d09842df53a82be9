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
package edx.crystal;

import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.toDegrees;

/**
 * Enumeration of the eleven Laue classes (with the trigonal -3m class split into its two settings).
 * <p>
 * Each Laue class defines the asymmetric region of zone-axis directions. Directions are given in the
 * Cartesian frame of {@link Crystal}, where <b>a</b> lies along x, <b>b</b> lies in the xy-plane and
 * the unique axis of tetragonal, trigonal and hexagonal cells lies along z.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum LaueSystem {
  /**
   * Laue class -1.
   */
  L_1("-1", 2),
  /**
   * Laue class 2/m with unique axis b.
   */
  L_2M("2/m", 4),
  /**
   * Laue class mmm.
   */
  L_MMM("mmm", 8),
  /**
   * Laue class 4/m.
   */
  L_4M("4/m", 8),
  /**
   * Laue class 4/mmm.
   */
  L_4MMM("4/mmm", 16),
  /**
   * Laue class -3.
   */
  L_3("-3", 6),
  /**
   * Laue class -3m1 (two-fold axes along the a axes).
   */
  L_3M1("-3m1", 12),
  /**
   * Laue class -31m (two-fold axes perpendicular to the a axes).
   */
  L_31M("-31m", 12),
  /**
   * Laue class 6/m.
   */
  L_6M("6/m", 12),
  /**
   * Laue class 6/mmm.
   */
  L_6MMM("6/mmm", 24),
  /**
   * Laue class m-3.
   */
  L_M3("m-3", 24),
  /**
   * Laue class m-3m.
   */
  L_M3M("m-3m", 48);

  /**
   * Tolerance for directions lying on a boundary of the asymmetric region.
   */
  private static final double TOLERANCE = 1.0e-9;

  /**
   * The Hermann-Mauguin symbol of the Laue class.
   */
  public final String symbol;
  /**
   * The number of operators in the Laue group.
   */
  public final int order;

  LaueSystem(String symbol, int order) {
    this.symbol = symbol;
    this.order = order;
  }

  /**
   * Check if a zone-axis direction lies in the asymmetric region of this Laue class.
   *
   * @param theta polar angle from the z axis, in radians, within [0, PI/2].
   * @param phi   azimuthal angle from the x axis, in radians, within [0, 2 PI).
   * @return true if the direction is kept.
   */
  public boolean inAsymmetricRegion(double theta, double phi) {
    double x = sin(theta) * cos(phi);
    double y = sin(theta) * sin(phi);
    double z = cos(theta);
    double deg = toDegrees(phi);
    double t = TOLERANCE;
    if (sin(theta) < t) {
      // The pole has no azimuth.
      return true;
    }
    return switch (this) {
      case L_1 -> z >= -t;
      case L_2M -> z >= -t && y >= -t;
      case L_MMM, L_4M -> x >= -t && y >= -t && z >= -t;
      case L_4MMM -> z >= -t && x >= y - t && y >= -t;
      case L_3 -> deg <= 120.0 + t;
      case L_3M1 -> deg >= 30.0 - t && deg <= 90.0 + t;
      case L_31M, L_6M -> deg <= 60.0 + t;
      case L_6MMM -> deg <= 30.0 + t;
      case L_M3 -> x >= -t && y >= -t && z >= x - t && z >= y - t;
      case L_M3M -> z >= x - t && x >= y - t && y >= -t;
    };
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return symbol;
  }
}
