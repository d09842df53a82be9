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
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.sin;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The Indexer finds the library orientations that best explain a diffraction image.
 * <p>
 * A projected spot at (x, y) maps to pixel (floor(x * scale + cx), floor(y * scale + cy)). For the
 * in-bounds spots of an orientation, with sampled pixel values v and weights w, the score is
 * <pre>
 *   S * f,  S = sum(w v),  f = sum(w | v &gt; threshold) / sum(w)
 * </pre>
 * and zero when no spot falls on the detector. Only the best in-plane rotation of each zone axis
 * is retained as a candidate.
 * <p>
 * An Indexer only reads its library and may be shared between threads.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Indexer implements PatternIndexer {

  private static final Logger logger = Logger.getLogger(Indexer.class.getName());

  /**
   * Candidates are ranked by descending score, then ascending orientation number.
   */
  public static final Comparator<IndexingResult> RANKING =
      Comparator.comparingDouble(IndexingResult::getScore).reversed()
          .thenComparingInt(IndexingResult::getNumber);

  private final OrientationLibrary library;
  private final IndexerOptions options;
  private final String phase;
  private final double scoreScale;
  private final double[] cosGamma;
  private final double[] sinGamma;

  /**
   * Constructor for Indexer. The phase is named after the space group.
   *
   * @param library the orientation library.
   * @param options the indexer options.
   */
  public Indexer(OrientationLibrary library, IndexerOptions options) {
    this(library, options, library.getCrystal().spaceGroup.shortName, 1.0);
  }

  /**
   * Constructor for Indexer.
   *
   * @param library    the orientation library.
   * @param options    the indexer options.
   * @param phase      the phase name recorded on results.
   * @param scoreScale every score is multiplied by this factor.
   */
  public Indexer(OrientationLibrary library, IndexerOptions options, String phase, double scoreScale) {
    if (library == null || options == null) {
      throw new IllegalArgumentException(" An orientation library and options are required.");
    }
    this.library = library;
    this.options = options;
    this.phase = phase;
    this.scoreScale = scoreScale;
    int nGamma = library.getGammaCount();
    cosGamma = new double[nGamma];
    sinGamma = new double[nGamma];
    for (int g = 0; g < nGamma; g++) {
      double gamma = library.getGamma(g);
      cosGamma[g] = cos(gamma);
      sinGamma[g] = sin(gamma);
    }
  }

  /**
   * Index a pattern at its own beam center.
   *
   * @param pattern the observed pattern.
   * @return INDEXED with the ranked candidates, or UNINDEXED if there are no peaks or the best
   * score is zero or below the minimum score.
   */
  @Override
  public ImageIndexing index(ObservedPattern pattern) {
    String name = pattern.getName();
    if (pattern.getPeaks().isEmpty()) {
      logger.info(format(" %-24s no peaks; not indexed.", name));
      return ImageIndexing.unindexed(name);
    }
    List<IndexingResult> results = findOrientation(pattern.getImage(), pattern.getCenterX(),
        pattern.getCenterY(), options.nSolutions);
    ImageIndexing imageIndexing = classify(name, results, options.minScore);
    logger.info(imageIndexing.toString());
    return imageIndexing;
  }

  /**
   * Assign a status to a ranked candidate list.
   *
   * @param name     the image name.
   * @param results  the ranked candidates.
   * @param minScore the minimum score of an indexed image.
   * @return the ImageIndexing.
   */
  static ImageIndexing classify(String name, List<IndexingResult> results, double minScore) {
    if (results.isEmpty()) {
      return ImageIndexing.unindexed(name);
    }
    double best = results.get(0).getScore();
    if (!(best > 0.0) || best < minScore) {
      return ImageIndexing.unindexed(name);
    }
    return new ImageIndexing(name, ImageIndexing.Status.INDEXED, results);
  }

  /**
   * Rank the library orientations against an image.
   *
   * @param image      the image.
   * @param centerX    the beam center column.
   * @param centerY    the beam center row.
   * @param nSolutions the number of candidates to return (0 or less returns all).
   * @return candidates ranked by descending score.
   */
  public List<IndexingResult> findOrientation(DiffractionImage image, double centerX, double centerY,
      int nSolutions) {
    double scale = options.getScale();
    int nZones = library.getZoneCount();
    int nGamma = library.getGammaCount();
    List<IndexingResult> candidates = new ArrayList<>(nZones);
    for (int zone = 0; zone < nZones; zone++) {
      ProjectedSpots spots = library.getZoneSpots(zone);
      if (spots.size() < options.minReflections) {
        continue;
      }
      double bestScore = -1.0;
      int bestGamma = -1;
      for (int g = 0; g < nGamma; g++) {
        double score = score(image, spots, cosGamma[g], sinGamma[g], scale, centerX, centerY);
        if (score > bestScore) {
          bestScore = score;
          bestGamma = g;
        }
      }
      int number = library.getOrientationNumber(zone, bestGamma);
      Orientation orientation = library.getOrientation(number);
      candidates.add(new IndexingResult(bestScore * scoreScale, number, orientation.alpha,
          orientation.beta, orientation.gamma, centerX, centerY, scale, phase));
    }
    candidates.sort(RANKING);
    if (logger.isLoggable(Level.FINE) && !candidates.isEmpty()) {
      logger.fine(format(" %d candidate zone axes, best:%s", candidates.size(), candidates.get(0)));
    }
    if (nSolutions > 0 && candidates.size() > nSolutions) {
      return new ArrayList<>(candidates.subList(0, nSolutions));
    }
    return candidates;
  }

  /**
   * Score projected spots against an image.
   *
   * @param image   the image.
   * @param spots   the spots.
   * @param scale   pixels per inverse Angstrom.
   * @param centerX the beam center column.
   * @param centerY the beam center row.
   * @return the score, including the phase score scale.
   */
  public double score(DiffractionImage image, ProjectedSpots spots, double scale, double centerX, double centerY) {
    return score(image, spots, 1.0, 0.0, scale, centerX, centerY) * scoreScale;
  }

  private double score(DiffractionImage image, ProjectedSpots spots, double c, double s, double scale,
      double centerX, double centerY) {
    double sum = 0.0;
    double weightSum = 0.0;
    double presentWeight = 0.0;
    int nx = image.getWidth();
    int ny = image.getHeight();
    int radius = options.sampleRadius;
    double threshold = options.presenceThreshold;
    int n = spots.size();
    for (int k = 0; k < n; k++) {
      double x = spots.getX(k);
      double y = spots.getY(k);
      double xr = c * x - s * y;
      double yr = s * x + c * y;
      int i = (int) floor(xr * scale + centerX);
      int j = (int) floor(yr * scale + centerY);
      if (i < 0 || j < 0 || i >= nx || j >= ny) {
        continue;
      }
      double v = image.sample(i, j, radius);
      double w = spots.getWeight(k);
      sum += w * v;
      weightSum += w;
      if (v > threshold) {
        presentWeight += w;
      }
    }
    if (weightSum <= 0.0) {
      return 0.0;
    }
    return sum * presentWeight / weightSum;
  }

  public OrientationLibrary getLibrary() {
    return library;
  }

  public IndexerOptions getOptions() {
    return options;
  }

  public String getPhase() {
    return phase;
  }

  /**
   * The factor applied to every score.
   *
   * @return the score scale.
   */
  public double getScoreScale() {
    return scoreScale;
  }
}
