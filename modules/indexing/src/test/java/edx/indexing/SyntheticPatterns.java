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

import static org.apache.commons.math3.util.FastMath.floor;

import java.util.ArrayList;
import java.util.List;

import edx.crystal.Crystal;

/**
 * Noise-free patterns generated from a small primitive cubic library.
 */
final class SyntheticPatterns {

  static final int SIZE = 256;
  static final double CENTER = 128.0;
  static final double PIXEL_SIZE = 0.005;
  /**
   * Zone axis 56 and in-plane rotation 17 of the cubic library.
   */
  static final int TRUE_ZONE = 56;
  static final int TRUE_GAMMA = 17;

  private static OrientationLibrary cubic = null;

  private SyntheticPatterns() {
  }

  /**
   * Pm-3m, a = 10 A, d from 1 to 10 A, 200 A thick, 0.05 rad step.
   *
   * @return the shared library.
   */
  static synchronized OrientationLibrary cubicLibrary() {
    if (cubic == null) {
      Crystal crystal = new Crystal(10.0, 10.0, 10.0, 90.0, 90.0, 90.0, "Pm-3m");
      cubic = OrientationLibrary.build(crystal, 1.0, 10.0, 200.0, 0.05);
    }
    return cubic;
  }

  static int trueOrientation() {
    return cubicLibrary().getOrientationNumber(TRUE_ZONE, TRUE_GAMMA);
  }

  /**
   * An image with 1.0 at every spot of an orientation and 0.0 elsewhere.
   */
  static DiffractionImage image(OrientationLibrary library, int number) {
    ProjectedSpots spots = library.getSpots(number);
    double scale = 1.0 / PIXEL_SIZE;
    double[] data = new double[SIZE * SIZE];
    for (int k = 0; k < spots.size(); k++) {
      int i = (int) floor(spots.getX(k) * scale + CENTER);
      int j = (int) floor(spots.getY(k) * scale + CENTER);
      if (i >= 0 && j >= 0 && i < SIZE && j < SIZE) {
        data[j * SIZE + i] = 1.0;
      }
    }
    return new DiffractionImage(SIZE, SIZE, data);
  }

  static ObservedPattern pattern(String name, DiffractionImage image) {
    List<Peak> peaks = new ArrayList<>();
    for (int j = 0; j < image.getHeight(); j++) {
      for (int i = 0; i < image.getWidth(); i++) {
        if (image.get(i, j) > 0.0) {
          peaks.add(new Peak(i, j, image.get(i, j)));
        }
      }
    }
    return new ObservedPattern(name, image, CENTER, CENTER, peaks);
  }
}
