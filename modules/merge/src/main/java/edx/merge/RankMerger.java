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
package edx.merge;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import edx.crystal.HKL;
import edx.crystal.ReflectionList;
import edx.indexing.ImageReflections;
import org.apache.commons.math3.stat.correlation.KendallsCorrelation;

/**
 * Merge the reflection rankings of many images into one consensus ranking.
 * <p>
 * Within each image only the relative order of reflection intensities is used. Every pair of
 * reflections observed on the same image is one comparison, and Bradley-Terry strengths fitted to
 * all comparisons define the consensus order. The result does not depend on the order of the input
 * images.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class RankMerger {

  private static final Logger logger = Logger.getLogger(RankMerger.class.getName());

  /**
   * Images ordered by descending indexing score, then by name.
   */
  public static final Comparator<ImageReflections> SELECTION =
      Comparator.comparingDouble(ImageReflections::getScore).reversed()
          .thenComparing(ImageReflections::getName);

  private final ReflectionList reflectionList;
  private final MergeOptions options;

  /**
   * Constructor for RankMerger.
   *
   * @param reflectionList the unique reflections of the phase.
   * @param options        the merge settings.
   */
  public RankMerger(ReflectionList reflectionList, MergeOptions options) {
    this.reflectionList = reflectionList;
    this.options = options;
  }

  /**
   * Merge using the number of images given by the options.
   *
   * @param images the extracted reflections of each indexed image.
   * @return the merged table.
   */
  public MergedReflectionTable merge(List<ImageReflections> images) {
    return merge(images, options.topN);
  }

  /**
   * Merge the top scoring images.
   *
   * @param images the extracted reflections of each indexed image.
   * @param topN   the number of images to merge (0 or less for all).
   * @return the merged table.
   */
  public MergedReflectionTable merge(List<ImageReflections> images, int topN) {
    List<ImageReflections> selected = select(images, topN);

    // Unique reflection -> mean intensity for each selected image.
    List<TreeMap<HKL, Double>> observations = new ArrayList<>(selected.size());
    TreeMap<HKL, Integer> redundancy = new TreeMap<>();
    for (ImageReflections image : selected) {
      TreeMap<HKL, Double> observed = standardize(image);
      observations.add(observed);
      for (HKL hkl : observed.keySet()) {
        redundancy.merge(hkl, 1, Integer::sum);
      }
    }

    // Items are numbered in canonical (h, k, l) order.
    int n = redundancy.size();
    HKL[] items = redundancy.keySet().toArray(new HKL[0]);
    Map<HKL, Integer> itemIndex = new HashMap<>();
    for (int i = 0; i < n; i++) {
      itemIndex.put(items[i], i);
    }

    PairwiseComparisons comparisons = new PairwiseComparisons(n);
    for (TreeMap<HKL, Double> observed : observations) {
      int m = observed.size();
      int[] index = new int[m];
      double[] intensity = new double[m];
      int c = 0;
      for (Map.Entry<HKL, Double> entry : observed.entrySet()) {
        index[c] = itemIndex.get(entry.getKey());
        intensity[c++] = entry.getValue();
      }
      for (int a = 0; a < m; a++) {
        for (int b = a + 1; b < m; b++) {
          if (intensity[a] > intensity[b]) {
            comparisons.addWin(index[a], index[b]);
          } else if (intensity[b] > intensity[a]) {
            comparisons.addWin(index[b], index[a]);
          } else {
            comparisons.addTie(index[a], index[b]);
          }
        }
      }
    }

    BradleyTerry bradleyTerry = new BradleyTerry(options.maxIterations, options.convergence);
    double[] strength = bradleyTerry.fit(comparisons);

    // Strongest first; equal strengths keep canonical order.
    Integer[] order = new Integer[n];
    for (int i = 0; i < n; i++) {
      order[i] = i;
    }
    Arrays.sort(order, (i, j) -> {
      int cmp = Double.compare(strength[j], strength[i]);
      return (cmp != 0) ? cmp : Integer.compare(i, j);
    });

    List<MergedReflection> consensus = new ArrayList<>(n);
    for (int position = 1; position <= n; position++) {
      int i = order[position - 1];
      int r = redundancy.get(items[i]);
      double surrogate = n - position + 1;
      consensus.add(new MergedReflection(items[i], position, surrogate, surrogate / sqrt(r + 1.0), r,
          comparisons.getPairRedundancy(i), strength[i]));
    }

    double tau = selfConsistency(observations, itemIndex, strength);
    boolean lowConfidence = selected.size() < options.minImages;
    if (lowConfidence) {
      logger.warning(format(" Only %d images were merged (at least %d are needed for reliable pairwise statistics).",
          selected.size(), options.minImages));
    }
    MergeStatistics statistics = statistics(images.size(), selected.size(), items, comparisons.getTotal(), tau,
        bradleyTerry, lowConfidence);
    logger.info(statistics.toString());
    return new MergedReflectionTable(consensus, statistics);
  }

  /**
   * Choose the images to merge.
   *
   * @param images the candidate images.
   * @param topN   the number to keep (0 or less for all).
   * @return the selected images, highest score first.
   */
  static List<ImageReflections> select(List<ImageReflections> images, int topN) {
    List<ImageReflections> sorted = new ArrayList<>(images);
    sorted.sort(SELECTION);
    if (topN > 0 && topN < sorted.size()) {
      return new ArrayList<>(sorted.subList(0, topN));
    }
    return sorted;
  }

  /**
   * Map the observations of an image to unique reflections. Zero intensities, absences and
   * reflections outside the resolution shell are dropped and symmetry mates are averaged.
   */
  private TreeMap<HKL, Double> standardize(ImageReflections image) {
    TreeMap<HKL, double[]> sums = new TreeMap<>();
    int dropped = 0;
    for (int i = 0; i < image.size(); i++) {
      double intensity = image.getIntensity(i);
      if (intensity == 0.0 || Double.isNaN(intensity)) {
        continue;
      }
      int[] hkl = image.getHKL(i);
      HKL unique = reflectionList.findSymHKL(hkl[0], hkl[1], hkl[2]);
      if (unique == null) {
        dropped++;
        continue;
      }
      double[] sum = sums.computeIfAbsent(unique, key -> new double[2]);
      sum[0] += intensity;
      sum[1] += 1.0;
    }
    if (dropped > 0 && logger.isLoggable(Level.FINE)) {
      logger.fine(format(" %s: %d observations are not in the reflection list.", image.getName(), dropped));
    }
    TreeMap<HKL, Double> means = new TreeMap<>();
    for (Map.Entry<HKL, double[]> entry : sums.entrySet()) {
      double[] sum = entry.getValue();
      means.put(entry.getKey(), sum[0] / sum[1]);
    }
    return means;
  }

  /**
   * Kendall's tau-b between each image and the consensus strengths, averaged with each image
   * weighted by its number of pairs.
   */
  private static double selfConsistency(List<TreeMap<HKL, Double>> observations, Map<HKL, Integer> itemIndex,
      double[] strength) {
    KendallsCorrelation kendall = new KendallsCorrelation();
    double sum = 0.0;
    double weights = 0.0;
    for (TreeMap<HKL, Double> observed : observations) {
      int m = observed.size();
      if (m < 2) {
        continue;
      }
      double[] x = new double[m];
      double[] y = new double[m];
      int c = 0;
      for (Map.Entry<HKL, Double> entry : observed.entrySet()) {
        x[c] = entry.getValue();
        y[c++] = strength[itemIndex.get(entry.getKey())];
      }
      double tau = kendall.correlation(x, y);
      if (Double.isNaN(tau)) {
        continue;
      }
      double pairs = 0.5 * m * (m - 1);
      sum += pairs * tau;
      weights += pairs;
    }
    return (weights > 0.0) ? sum / weights : Double.NaN;
  }

  private MergeStatistics statistics(int nImages, int nSelected, HKL[] observed, long nComparisons, double tau,
      BradleyTerry bradleyTerry, boolean lowConfidence) {
    int nBins = reflectionList.nBins;
    int[] binObserved = new int[nBins];
    for (HKL hkl : observed) {
      binObserved[hkl.getBin()]++;
    }
    double[][] binResolution = new double[nBins][2];
    for (int i = 0; i < nBins; i++) {
      binResolution[i][0] = Double.NEGATIVE_INFINITY;
      binResolution[i][1] = Double.POSITIVE_INFINITY;
    }
    for (HKL hkl : reflectionList.hklList) {
      int b = hkl.getBin();
      double d = hkl.getD();
      if (d > binResolution[b][0]) {
        binResolution[b][0] = d;
      }
      if (d < binResolution[b][1]) {
        binResolution[b][1] = d;
      }
    }
    return new MergeStatistics(nImages, nSelected, observed.length, reflectionList.size(), binObserved,
        reflectionList.binCounts(), binResolution, nComparisons, tau, bradleyTerry.getIterations(),
        bradleyTerry.isConverged(), lowConfidence);
  }

  public ReflectionList getReflectionList() {
    return reflectionList;
  }

  public MergeOptions getOptions() {
    return options;
  }
}
