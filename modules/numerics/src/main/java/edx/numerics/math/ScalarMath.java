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
package edx.numerics.math;

import static org.apache.commons.math3.util.FastMath.abs;

/**
 * The ScalarMath class contains a few simple scalar functions.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ScalarMath {

  private ScalarMath() {
    // Prevent instantiation.
  }

  /**
   * This is an atypical mod function used by crystallography methods.
   *
   * @param a Value to mod.
   * @param b Value to mod by.
   * @return Positive a % b.
   */
  public static double mod(double a, double b) {
    var res = a % b;
    if (res < 0.0) {
      res += b;
    }
    return res;
  }

  /**
   * Reduce a fractional coordinate into [0, 1), snapping values within tolerance of 1 to 0.
   *
   * @param value     the fractional coordinate.
   * @param tolerance snap tolerance.
   * @return the reduced coordinate.
   */
  public static double reduceFraction(double value, double tolerance) {
    double f = mod(value, 1.0);
    if (abs(f - 1.0) < tolerance || abs(f) < tolerance) {
      return 0.0;
    }
    return f;
  }
}
