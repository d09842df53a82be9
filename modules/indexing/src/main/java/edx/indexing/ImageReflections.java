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

import java.util.Arrays;

/**
 * Reflection intensities read from one indexed image.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ImageReflections {

  private final String name;
  private final double score;
  private final int[][] hkl;
  private final double[] intensity;

  /**
   * Constructor for ImageReflections. The arrays are copied.
   *
   * @param name      the image name.
   * @param score     the indexing score of the image.
   * @param hkl       the observed lattice points.
   * @param intensity the intensity of each lattice point.
   */
  public ImageReflections(String name, double score, int[][] hkl, double[] intensity) {
    if (hkl.length != intensity.length) {
      throw new IllegalArgumentException(format(" Image %s has %d reflections but %d intensities.",
          name, hkl.length, intensity.length));
    }
    this.name = name;
    this.score = score;
    this.hkl = new int[hkl.length][];
    for (int i = 0; i < hkl.length; i++) {
      this.hkl[i] = Arrays.copyOf(hkl[i], 3);
    }
    this.intensity = Arrays.copyOf(intensity, intensity.length);
  }

  public String getName() {
    return name;
  }

  public double getScore() {
    return score;
  }

  public int size() {
    return hkl.length;
  }

  /**
   * The lattice point of an observation.
   *
   * @param i the observation.
   * @return a copy of {h, k, l}.
   */
  public int[] getHKL(int i) {
    return Arrays.copyOf(hkl[i], 3);
  }

  public double getIntensity(int i) {
    return intensity[i];
  }

  @Override
  public String toString() {
    return format(" %-24s %6d reflections, score %12.4f", name, hkl.length, score);
  }
}
