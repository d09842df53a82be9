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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Index patterns against several crystal phases at once.
 * <p>
 * Larger cells excite more spots, so each phase's scores are multiplied by (cell volume / 5000)
 * before the candidates of all phases are ranked together.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MultiPhaseIndexer implements PatternIndexer {

  private static final Logger logger = Logger.getLogger(MultiPhaseIndexer.class.getName());

  /**
   * The reference cell volume in cubic Angstroms.
   */
  public static final double REFERENCE_VOLUME = 5000.0;

  private static final Comparator<IndexingResult> PHASE_RANKING =
      Comparator.comparingDouble(IndexingResult::getScore).reversed()
          .thenComparing(IndexingResult::getPhase)
          .thenComparingInt(IndexingResult::getNumber);

  private final Map<String, Indexer> indexers = new LinkedHashMap<>();
  private final IndexerOptions options;

  /**
   * Constructor for MultiPhaseIndexer.
   *
   * @param libraries the libraries keyed by phase name.
   * @param options   the indexer options shared by all phases.
   */
  public MultiPhaseIndexer(Map<String, OrientationLibrary> libraries, IndexerOptions options) {
    if (libraries == null || libraries.isEmpty()) {
      throw new IllegalArgumentException(" At least one phase is required.");
    }
    this.options = options;
    for (Map.Entry<String, OrientationLibrary> entry : libraries.entrySet()) {
      OrientationLibrary library = entry.getValue();
      double factor = library.getCrystal().volume / REFERENCE_VOLUME;
      indexers.put(entry.getKey(), new Indexer(library, options, entry.getKey(), factor));
      logger.info(format(" Phase %-12s score scale %8.4f", entry.getKey(), factor));
    }
  }

  /**
   * Index a pattern against every phase.
   *
   * @param pattern the observed pattern.
   * @return the combined ranking.
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
    ImageIndexing imageIndexing = Indexer.classify(name, results, options.minScore);
    logger.info(imageIndexing.toString());
    return imageIndexing;
  }

  /**
   * Rank the orientations of every phase against an image.
   *
   * @param image      the image.
   * @param centerX    the beam center column.
   * @param centerY    the beam center row.
   * @param nSolutions the number of candidates to return (0 or less returns all).
   * @return the combined candidates, each carrying its phase name.
   */
  public List<IndexingResult> findOrientation(DiffractionImage image, double centerX, double centerY,
      int nSolutions) {
    List<IndexingResult> results = new ArrayList<>();
    for (Indexer indexer : indexers.values()) {
      results.addAll(indexer.findOrientation(image, centerX, centerY, nSolutions));
    }
    results.sort(PHASE_RANKING);
    if (nSolutions > 0 && results.size() > nSolutions) {
      return new ArrayList<>(results.subList(0, nSolutions));
    }
    return results;
  }

  /**
   * The Indexer of a phase.
   *
   * @param phase the phase name.
   * @return the Indexer, or null for an unknown phase.
   */
  public Indexer getIndexer(String phase) {
    return indexers.get(phase);
  }

  public Map<String, Indexer> getIndexers() {
    return Collections.unmodifiableMap(indexers);
  }
}
