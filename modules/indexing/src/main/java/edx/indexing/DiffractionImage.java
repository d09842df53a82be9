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
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import java.util.Arrays;

/**
 * A diffraction image stored row-major: pixel (i, j) is column i (detector x) of row j (detector y).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class DiffractionImage {

  private final int nx;
  private final int ny;
  private final double[] data;

  /**
   * Constructor for DiffractionImage. The pixel array is copied.
   *
   * @param nx   the number of columns.
   * @param ny   the number of rows.
   * @param data nx * ny pixel values in row-major order.
   */
  public DiffractionImage(int nx, int ny, double[] data) {
    if (nx <= 0 || ny <= 0) {
      throw new IllegalArgumentException(format(" Image dimensions must be positive: %d x %d", nx, ny));
    }
    if (data == null || data.length != nx * ny) {
      throw new IllegalArgumentException(format(" Expected %d pixel values for a %d x %d image.", nx * ny, nx, ny));
    }
    this.nx = nx;
    this.ny = ny;
    this.data = Arrays.copyOf(data, data.length);
  }

  /**
   * An image with every pixel set to zero.
   *
   * @param nx the number of columns.
   * @param ny the number of rows.
   * @return the blank image.
   */
  public static DiffractionImage blank(int nx, int ny) {
    return new DiffractionImage(nx, ny, new double[nx * ny]);
  }

  public int getWidth() {
    return nx;
  }

  public int getHeight() {
    return ny;
  }

  /**
   * Check a pixel is on the detector.
   *
   * @param i the column.
   * @param j the row.
   * @return true if 0 &lt;= i &lt; nx and 0 &lt;= j &lt; ny.
   */
  public boolean inBounds(int i, int j) {
    return i >= 0 && j >= 0 && i < nx && j < ny;
  }

  /**
   * The value of a pixel.
   *
   * @param i the column.
   * @param j the row.
   * @return the pixel value.
   */
  public double get(int i, int j) {
    return data[j * nx + i];
  }

  /**
   * The largest value in a disk of pixels around (i, j). A radius of zero samples the pixel itself.
   *
   * @param i      the column (must be in bounds).
   * @param j      the row (must be in bounds).
   * @param radius the disk radius in pixels.
   * @return the maximum pixel value in the disk.
   */
  public double sample(int i, int j, int radius) {
    if (radius <= 0) {
      return data[j * nx + i];
    }
    double value = Double.NEGATIVE_INFINITY;
    int r2 = radius * radius;
    for (int jj = max(0, j - radius); jj <= min(ny - 1, j + radius); jj++) {
      int dj = jj - j;
      for (int ii = max(0, i - radius); ii <= min(nx - 1, i + radius); ii++) {
        int di = ii - i;
        if (di * di + dj * dj <= r2) {
          value = max(value, data[jj * nx + ii]);
        }
      }
    }
    return value;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" Diffraction image %d x %d", nx, ny);
  }
}
