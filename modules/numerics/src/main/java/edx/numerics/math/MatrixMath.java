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

import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * The MatrixMath class is a simple 3x3 matrix math library used by the crystal and indexing packages.
 * <p>
 * All methods are thread-safe and static.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MatrixMath {

  private MatrixMath() {
    // Prevent instantiation.
  }

  /**
   * Calculated the determinant for a 3x3 matrix.
   *
   * @param m input matrix.
   * @return The determinant.
   */
  public static double mat3Determinant(double[][] m) {
    return m[0][0] * m[1][1] * m[2][2] - m[0][0] * m[1][2] * m[2][1]
        + m[0][1] * m[1][2] * m[2][0] - m[0][1] * m[1][0] * m[2][2]
        + m[0][2] * m[1][0] * m[2][1] - m[0][2] * m[1][1] * m[2][0];
  }

  /**
   * Compute the inverse of 3x3 matrix. The result is returned in a newly
   * allocated matrix.
   *
   * @param m The input 3x3 matrix.
   * @return Returns the inverse of the input matrix m.
   */
  public static double[][] mat3Inverse(double[][] m) {
    double det = mat3Determinant(m);
    if (det == 0.0) {
      throw new ArithmeticException(" The 3x3 matrix is singular.");
    }
    double inverseDet = 1.0 / det;
    double[][] output = new double[3][3];
    output[0][0] = (m[1][1] * m[2][2] - m[1][2] * m[2][1]) * inverseDet;
    output[0][1] = (m[0][2] * m[2][1] - m[0][1] * m[2][2]) * inverseDet;
    output[0][2] = (m[0][1] * m[1][2] - m[0][2] * m[1][1]) * inverseDet;
    output[1][0] = (m[1][2] * m[2][0] - m[1][0] * m[2][2]) * inverseDet;
    output[1][1] = (m[0][0] * m[2][2] - m[0][2] * m[2][0]) * inverseDet;
    output[1][2] = (m[0][2] * m[1][0] - m[0][0] * m[1][2]) * inverseDet;
    output[2][0] = (m[1][0] * m[2][1] - m[1][1] * m[2][0]) * inverseDet;
    output[2][1] = (m[0][1] * m[2][0] - m[0][0] * m[2][1]) * inverseDet;
    output[2][2] = (m[0][0] * m[1][1] - m[0][1] * m[1][0]) * inverseDet;
    return output;
  }

  /**
   * Multiple a 3x3 matrix m and a 3x3 matrix n. The output is returned in a newly allocated
   * 3x3 matrix.
   *
   * @param m an input 3x3 matrix.
   * @param n an input 3x3 matrix
   * @return Returns the 3x3 matrix result.
   */
  public static double[][] mat3Mat3Multiply(double[][] m, double[][] n) {
    double[][] result = new double[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        result[i][j] = m[i][0] * n[0][j] + m[i][1] * n[1][j] + m[i][2] * n[2][j];
      }
    }
    return result;
  }

  /**
   * Multiply a 3x3 matrix and a 3x1 column vector.
   *
   * @param m input 3x3 matrix.
   * @param v input 3x1 vector.
   * @return Returns a newly allocated vector.
   */
  public static double[] mat3Vec3(double[][] m, double[] v) {
    return mat3Vec3(m, v, new double[3]);
  }

  /**
   * Multiply a 3x3 matrix and a 3x1 column vector. The output may be the same array as v.
   *
   * @param m      input 3x3 matrix.
   * @param v      input 3x1 vector.
   * @param output output 3x1 vector.
   * @return Returns the output vector.
   */
  public static double[] mat3Vec3(double[][] m, double[] v, double[] output) {
    double r0 = m[0][0] * v[0] + m[0][1] * v[1] + m[0][2] * v[2];
    double r1 = m[1][0] * v[0] + m[1][1] * v[1] + m[1][2] * v[2];
    double r2 = m[2][0] * v[0] + m[2][1] * v[1] + m[2][2] * v[2];
    output[0] = r0;
    output[1] = r1;
    output[2] = r2;
    return output;
  }

  /**
   * Dot product of two 3-vectors.
   *
   * @param a first vector.
   * @param b second vector.
   * @return a.b
   */
  public static double dot(double[] a, double[] b) {
    return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
  }

  /**
   * Euclidean length of a 3-vector.
   *
   * @param a the vector.
   * @return |a|
   */
  public static double length(double[] a) {
    return sqrt(dot(a, a));
  }

  /**
   * Right-handed rotation about the y axis.
   *
   * @param angle rotation angle in radians.
   * @return the rotation matrix.
   */
  public static double[][] rotationY(double angle) {
    double c = cos(angle);
    double s = sin(angle);
    return new double[][]{
        {c, 0.0, s},
        {0.0, 1.0, 0.0},
        {-s, 0.0, c}};
  }

  /**
   * Right-handed rotation about the z axis.
   *
   * @param angle rotation angle in radians.
   * @return the rotation matrix.
   */
  public static double[][] rotationZ(double angle) {
    double c = cos(angle);
    double s = sin(angle);
    return new double[][]{
        {c, -s, 0.0},
        {s, c, 0.0},
        {0.0, 0.0, 1.0}};
  }
}
