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

import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * Options that control scoring and candidate selection.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class IndexerOptions {

  /**
   * Detector pixel size in inverse Angstroms per pixel.
   */
  public final double pixelSize;
  /**
   * Number of candidate orientations returned per image (0 or less returns all).
   */
  public final int nSolutions;
  /**
   * Orientations that excite fewer spots are skipped.
   */
  public final int minReflections;
  /**
   * Each spot samples the maximum pixel within this radius.
   */
  public final int sampleRadius;
  /**
   * Pixel values above this threshold count a spot as present.
   */
  public final double presenceThreshold;
  /**
   * Images whose best score is below this value are unindexed.
   */
  public final double minScore;

  /**
   * Constructor for IndexerOptions.
   *
   * @param pixelSize         the pixel size in inverse Angstroms.
   * @param nSolutions        the number of candidates per image.
   * @param minReflections    the minimum number of excited spots.
   * @param sampleRadius      the sampling radius in pixels.
   * @param presenceThreshold the presence threshold.
   * @param minScore          the minimum score of an indexed image.
   */
  public IndexerOptions(double pixelSize, int nSolutions, int minReflections, int sampleRadius,
      double presenceThreshold, double minScore) {
    if (!(pixelSize > 0.0)) {
      throw new IllegalArgumentException(format(" The pixel size must be positive: %s", pixelSize));
    }
    if (sampleRadius < 0) {
      throw new IllegalArgumentException(format(" The sample radius cannot be negative: %d", sampleRadius));
    }
    this.pixelSize = pixelSize;
    this.nSolutions = nSolutions;
    this.minReflections = minReflections;
    this.sampleRadius = sampleRadius;
    this.presenceThreshold = presenceThreshold;
    this.minScore = minScore;
  }

  /**
   * Default options for a pixel size.
   *
   * @param pixelSize the pixel size in inverse Angstroms.
   */
  public IndexerOptions(double pixelSize) {
    this(pixelSize, 25, 10, 0, 0.0, 0.0);
  }

  /**
   * Read the "pixel-size", "nsolutions", "min-reflections", "sample-radius", "presence-threshold"
   * and "min-score" properties.
   *
   * @param properties a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @return an {@link IndexerOptions} object.
   */
  public static IndexerOptions checkProperties(CompositeConfiguration properties) {
    double pixelSize = properties.getDouble("pixel-size", 0.005);
    int nSolutions = properties.getInt("nsolutions", 25);
    int minReflections = properties.getInt("min-reflections", 10);
    int sampleRadius = properties.getInt("sample-radius", 0);
    double presenceThreshold = properties.getDouble("presence-threshold", 0.0);
    double minScore = properties.getDouble("min-score", 0.0);
    return new IndexerOptions(pixelSize, nSolutions, minReflections, sampleRadius, presenceThreshold, minScore);
  }

  /**
   * A copy with a different number of solutions.
   *
   * @param n the number of candidates per image.
   * @return new options.
   */
  public IndexerOptions withSolutions(int n) {
    return new IndexerOptions(pixelSize, n, minReflections, sampleRadius, presenceThreshold, minScore);
  }

  /**
   * The detector scale.
   *
   * @return pixels per inverse Angstrom.
   */
  public double getScale() {
    return 1.0 / pixelSize;
  }

  @Override
  public String toString() {
    return format(" Indexer options:\n  %-22s %8.5f\n  %-22s %8d\n  %-22s %8d\n  %-22s %8d\n  %-22s %8.3f\n  %-22s %8.3f",
        "Pixel size", pixelSize, "Solutions", nSolutions, "Min reflections", minReflections,
        "Sample radius", sampleRadius, "Presence threshold", presenceThreshold, "Min score", minScore);
  }
}
