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

import static org.apache.commons.math3.util.FastMath.abs;

/**
 * Enumeration of the lattice systems.
 * <p>
 * Rhombohedral space groups are described in the hexagonal setting, so RHOMBOHEDRAL_LATTICE is only
 * used for cells given with a = b = c and alpha = beta = gamma.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum LatticeSystem {
  TRICLINIC_LATTICE,
  MONOCLINIC_LATTICE,
  ORTHORHOMBIC_LATTICE,
  TETRAGONAL_LATTICE,
  RHOMBOHEDRAL_LATTICE,
  HEXAGONAL_LATTICE,
  CUBIC_LATTICE;

  /**
   * Tolerance for checking if the lattice system restrictions are satisfied.
   * <p>
   * Cell parameters read from text files rarely carry more than five significant digits.
   */
  private static final double tolerance = 1.0e-4;

  /**
   * If the two passed values are the same, within the tolerance, return true.
   *
   * @param x1 First value.
   * @param x2 Second value.
   * @return Return true if the two values are the same within specified tolerance.
   */
  public static boolean check(double x1, double x2) {
    return abs(x1 - x2) < tolerance;
  }

  /**
   * The lattice system used by a crystal system.
   *
   * @param crystalSystem the crystal system.
   * @return the lattice system.
   */
  public static LatticeSystem forCrystalSystem(CrystalSystem crystalSystem) {
    return switch (crystalSystem) {
      case TRICLINIC -> TRICLINIC_LATTICE;
      case MONOCLINIC -> MONOCLINIC_LATTICE;
      case ORTHORHOMBIC -> ORTHORHOMBIC_LATTICE;
      case TETRAGONAL -> TETRAGONAL_LATTICE;
      case TRIGONAL, HEXAGONAL -> HEXAGONAL_LATTICE;
      case CUBIC -> CUBIC_LATTICE;
    };
  }

  /**
   * Check that the lattice parameters satisfy the restrictions of the lattice systems.
   *
   * @param a     the a-axis length.
   * @param b     the b-axis length.
   * @param c     the c-axis length.
   * @param alpha the alpha angle.
   * @param beta  the beta angle.
   * @param gamma the gamma angle.
   * @return True if the restrictions are satisfied, false otherwise.
   */
  public boolean validParameters(double a, double b, double c, double alpha, double beta, double gamma) {
    return switch (this) {
      // No restrictions.
      case TRICLINIC_LATTICE -> true;
      // alpha = gamma = 90
      case MONOCLINIC_LATTICE -> check(alpha, 90.0) && check(gamma, 90.0);
      // alpha = beta = gamma = 90
      case ORTHORHOMBIC_LATTICE -> check(alpha, 90.0) && check(beta, 90.0) && check(gamma, 90.0);
      // a = b, alpha = beta = gamma = 90
      case TETRAGONAL_LATTICE -> check(a, b) && check(alpha, 90.0) && check(beta, 90.0) && check(gamma, 90.0);
      // a = b = c, alpha = beta = gamma.
      case RHOMBOHEDRAL_LATTICE -> check(a, b) && check(b, c) && check(alpha, beta) && check(beta, gamma);
      // a = b, alpha = beta = 90, gamma = 120
      case HEXAGONAL_LATTICE -> check(a, b) && check(alpha, 90.0) && check(beta, 90.0) && check(gamma, 120.0);
      // a = b = c; alpha = beta = gamma = 90
      case CUBIC_LATTICE -> check(a, b) && check(b, c)
          && check(alpha, 90.0) && check(beta, 90.0) && check(gamma, 90.0);
    };
  }
}
