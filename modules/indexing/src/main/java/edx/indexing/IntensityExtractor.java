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
import static org.apache.commons.math3.util.FastMath.floor;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read reflection intensities from an image at an indexed orientation.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class IntensityExtractor {

  private static final Logger logger = Logger.getLogger(IntensityExtractor.class.getName());

  private final Projector projector;
  private final int sampleRadius;

  /**
   * Constructor for IntensityExtractor.
   *
   * @param projector    the projector of the phase.
   * @param sampleRadius the maximum pixel value within this radius is read for each spot.
   */
  public IntensityExtractor(Projector projector, int sampleRadius) {
    this.projector = projector;
    this.sampleRadius = sampleRadius;
  }

  /**
   * Read the intensities of the spots that fall on the detector.
   *
   * @param pattern the observed pattern.
   * @param result  the orientation, center and scale.
   * @return the reflections of the image.
   */
  public ImageReflections extract(ObservedPattern pattern, IndexingResult result) {
    DiffractionImage image = pattern.getImage();
    ProjectedSpots spots = projector.project(result.getAlpha(), result.getBeta(), result.getGamma());
    int n = spots.size();
    int[][] hkl = new int[n][];
    double[] intensity = new double[n];
    int count = 0;
    double scale = result.getScale();
    for (int k = 0; k < n; k++) {
      int i = (int) floor(spots.getX(k) * scale + result.getCenterX());
      int j = (int) floor(spots.getY(k) * scale + result.getCenterY());
      if (!image.inBounds(i, j)) {
        continue;
      }
      hkl[count] = spots.getHKL(k);
      intensity[count] = image.sample(i, j, sampleRadius);
      count++;
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" %s: %d of %d excited reflections on the detector.", pattern.getName(), count, n));
    }
    return new ImageReflections(pattern.getName(), result.getScore(), Arrays.copyOf(hkl, count),
        Arrays.copyOf(intensity, count));
  }
}
