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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One observed diffraction pattern: an image, its beam center and the peaks found on it.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ObservedPattern {

  private final String name;
  private final DiffractionImage image;
  private final double centerX;
  private final double centerY;
  private final List<Peak> peaks;

  /**
   * Constructor for ObservedPattern.
   *
   * @param name    the image name (unique within a batch).
   * @param image   the intensity field.
   * @param centerX the beam center column in pixels.
   * @param centerY the beam center row in pixels.
   * @param peaks   the peak list (may be empty).
   */
  public ObservedPattern(String name, DiffractionImage image, double centerX, double centerY, List<Peak> peaks) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException(" An image name is required.");
    }
    if (image == null) {
      throw new IllegalArgumentException(format(" Image %s has no pixel data.", name));
    }
    this.name = name;
    this.image = image;
    this.centerX = centerX;
    this.centerY = centerY;
    this.peaks = (peaks == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(peaks));
  }

  public String getName() {
    return name;
  }

  public DiffractionImage getImage() {
    return image;
  }

  public double getCenterX() {
    return centerX;
  }

  public double getCenterY() {
    return centerY;
  }

  public List<Peak> getPeaks() {
    return peaks;
  }

  @Override
  public String toString() {
    return format(" %s:%s, center (%8.2f, %8.2f), %d peaks", name, image, centerX, centerY, peaks.size());
  }
}
