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

import static edx.numerics.math.ScalarMath.reduceFraction;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.rint;

import java.util.Arrays;

/**
 * The SymOp class defines the rotation and translation of a single symmetry operator.
 * <p>
 * Operators act on fractional coordinates as x' = rot.x + tr, with the translation reduced into [0, 1).
 *
 * @author Michael J. Schnieders
 * @see SpaceGroup
 * @since 1.0
 */
public class SymOp {

  /**
   * Tolerance used when comparing translations.
   */
  private static final double TOLERANCE = 1.0e-6;

  /**
   * Constant <code>IDENTITY_ROTATION</code>
   */
  private static final double[][] IDENTITY_ROTATION = {
      {1.0, 0.0, 0.0},
      {0.0, 1.0, 0.0},
      {0.0, 0.0, 1.0}};

  /**
   * The rotation matrix in fractional coordinates.
   */
  public final double[][] rot;
  /**
   * The translation vector in fractional coordinates.
   */
  public final double[] tr;

  /**
   * The SymOp constructor using a rotation matrix and translation vector.
   *
   * @param rot The rotation matrix.
   * @param tr  The translation vector.
   */
  public SymOp(double[][] rot, double[] tr) {
    this.rot = new double[3][3];
    this.tr = new double[3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        // Adding zero clears negative zero.
        this.rot[i][j] = rint(rot[i][j]) + 0.0;
      }
      this.tr[i] = reduceFraction(tr[i], TOLERANCE);
    }
  }

  /**
   * The identity operator.
   *
   * @return a new identity SymOp.
   */
  public static SymOp identity() {
    return new SymOp(IDENTITY_ROTATION, new double[3]);
  }

  /**
   * A pure translation, such as a lattice centering vector.
   *
   * @param tr The translation.
   * @return the SymOp.
   */
  public static SymOp translation(double[] tr) {
    return new SymOp(IDENTITY_ROTATION, tr);
  }

  /**
   * The phase shift introduced by the translation for the given reflection.
   *
   * @param h the h index.
   * @param k the k index.
   * @param l the l index.
   * @return -2 PI (h.tr)
   */
  public double symPhaseShift(int h, int k, int l) {
    return -2.0 * PI * (h * tr[0] + k * tr[1] + l * tr[2]);
  }

  /**
   * symPhaseShift
   *
   * @param hkl a {@link HKL} object.
   * @return a double.
   */
  public double symPhaseShift(HKL hkl) {
    return symPhaseShift(hkl.getH(), hkl.getK(), hkl.getL());
  }

  /**
   * Return the combined SymOp that is equivalent to first applying symOp1 and then SymOp2.
   * <p>
   * <code>X' = S_2(S_1(X))</code>
   *
   * @param symOp1 The fist SymOp.
   * @param symOp2 The second SymOp.
   * @return The combined SymOp.
   */
  public static SymOp combineSymOps(SymOp symOp1, SymOp symOp2) {
    double[][] r1 = symOp1.rot;
    double[][] r2 = symOp2.rot;
    double[][] rot = new double[3][3];
    double[] tr = new double[3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        rot[i][j] = r2[i][0] * r1[0][j] + r2[i][1] * r1[1][j] + r2[i][2] * r1[2][j];
      }
      tr[i] = r2[i][0] * symOp1.tr[0] + r2[i][1] * symOp1.tr[1] + r2[i][2] * symOp1.tr[2] + symOp2.tr[i];
    }
    return new SymOp(rot, tr);
  }

  /**
   * Apply the transpose of the rotation to a reflection, which maps h onto its symmetry mate.
   *
   * @param h the h index.
   * @param k the k index.
   * @param l the l index.
   * @return the mate {h', k', l'}.
   */
  public int[] applyTransSymRot(int h, int k, int l) {
    int hs = (int) rint(rot[0][0] * h + rot[1][0] * k + rot[2][0] * l);
    int ks = (int) rint(rot[0][1] * h + rot[1][1] * k + rot[2][1] * l);
    int ls = (int) rint(rot[0][2] * h + rot[1][2] * k + rot[2][2] * l);
    return new int[]{hs, ks, ls};
  }

  /**
   * Apply a transpose rotation symmetry operator to one HKL.
   *
   * @param hkl  Input HKL.
   * @param mate Symmetry mate HKL.
   * @param symOp The symmetry operator.
   */
  public static void applyTransSymRot(HKL hkl, HKL mate, SymOp symOp) {
    int[] m = symOp.applyTransSymRot(hkl.getH(), hkl.getK(), hkl.getL());
    mate.setH(m[0]);
    mate.setK(m[1]);
    mate.setL(m[2]);
  }

  /**
   * True if the rotation part is the identity.
   *
   * @return true for a pure translation.
   */
  public boolean isPureTranslation() {
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        if (rot[i][j] != IDENTITY_ROTATION[i][j]) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Create a SymOp from a coordinate triplet such as "-y+1/2,x,z+1/4".
   *
   * @param s Input <code>String</code> with three comma separated components.
   * @return The SymOp.
   * @throws IllegalArgumentException if the String cannot be parsed.
   */
  public static SymOp parse(String s) {
    String[] tokens = s.replace(" ", "").toLowerCase().split(",");
    if (tokens.length != 3) {
      throw new IllegalArgumentException(format(" Symmetry operator %s must have three components.", s));
    }
    double[][] rot = new double[3][3];
    double[] tr = new double[3];
    for (int i = 0; i < 3; i++) {
      String component = tokens[i];
      if (component.isEmpty()) {
        throw new IllegalArgumentException(format(" Empty component in symmetry operator %s.", s));
      }
      int start = 0;
      for (int pos = 1; pos <= component.length(); pos++) {
        if (pos == component.length() || component.charAt(pos) == '+' || component.charAt(pos) == '-') {
          parseTerm(component.substring(start, pos), rot[i], tr, i, s);
          start = pos;
        }
      }
    }
    return new SymOp(rot, tr);
  }

  private static void parseTerm(String term, double[] row, double[] tr, int i, String op) {
    double sign = 1.0;
    String t = term;
    if (t.startsWith("+")) {
      t = t.substring(1);
    } else if (t.startsWith("-")) {
      sign = -1.0;
      t = t.substring(1);
    }
    switch (t) {
      case "x" -> row[0] += sign;
      case "y" -> row[1] += sign;
      case "z" -> row[2] += sign;
      default -> {
        try {
          int slash = t.indexOf('/');
          if (slash > 0) {
            tr[i] += sign * Double.parseDouble(t.substring(0, slash))
                / Double.parseDouble(t.substring(slash + 1));
          } else {
            tr[i] += sign * Double.parseDouble(t);
          }
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(format(" Could not parse term %s of symmetry operator %s.", term, op), e);
        }
      }
    }
  }

  /**
   * {@inheritDoc}
   * <p>
   * Two operators are equal when their rotations match and translations agree modulo a lattice vector.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SymOp other)) {
      return false;
    }
    for (int i = 0; i < 3; i++) {
      if (!Arrays.equals(rot[i], other.rot[i])) {
        return false;
      }
      double d = abs(tr[i] - other.tr[i]);
      if (d > TOLERANCE && abs(d - 1.0) > TOLERANCE) {
        return false;
      }
    }
    return true;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public int hashCode() {
    // Translations are excluded so that lattice-equivalent operators share a bucket.
    return Arrays.deepHashCode(rot);
  }

  /**
   * toXYZString
   *
   * @return The operator in coordinate triplet notation.
   */
  public String toXYZString() {
    StringBuilder sb = new StringBuilder();
    String[] axes = {"x", "y", "z"};
    for (int i = 0; i < 3; i++) {
      boolean first = true;
      for (int j = 0; j < 3; j++) {
        if (rot[i][j] < 0.0) {
          sb.append("-").append(axes[j]);
          first = false;
        } else if (rot[i][j] > 0.0) {
          sb.append(first ? "" : "+").append(axes[j]);
          first = false;
        }
      }
      if (tr[i] > 0.0) {
        sb.append(trToString(tr[i]));
      }
      if (i < 2) {
        sb.append(",");
      }
    }
    return sb.toString();
  }

  private static String trToString(double t) {
    for (int d : new int[]{2, 3, 4, 6, 8, 12}) {
      double n = t * d;
      if (abs(n - rint(n)) < TOLERANCE) {
        return format("+%d/%d", (int) rint(n), d);
      }
    }
    return format("+%.4f", t);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return toXYZString();
  }
}
