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

import java.util.Arrays;

/**
 * Summary statistics of a merge.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MergeStatistics {

  private final int nImages;
  private final int nSelected;
  private final int nObserved;
  private final int nExpected;
  private final int[] binObserved;
  private final int[] binExpected;
  private final double[][] binResolution;
  private final long nComparisons;
  private final double selfConsistency;
  private final int iterations;
  private final boolean converged;
  private final boolean lowConfidence;

  /**
   * Constructor for MergeStatistics.
   *
   * @param nImages         images offered to the merge.
   * @param nSelected       images merged.
   * @param nObserved       unique reflections observed.
   * @param nExpected       unique reflections in the resolution shell.
   * @param binObserved     observed reflections per resolution bin.
   * @param binExpected     expected reflections per resolution bin.
   * @param binResolution   the largest and smallest d-spacing of each bin.
   * @param nComparisons    the number of pairwise comparisons.
   * @param selfConsistency the weighted mean Kendall tau-b between images and the consensus.
   * @param iterations      Bradley-Terry iterations.
   * @param converged       whether the strengths converged.
   * @param lowConfidence   whether too few images were merged.
   */
  public MergeStatistics(int nImages, int nSelected, int nObserved, int nExpected, int[] binObserved,
      int[] binExpected, double[][] binResolution, long nComparisons,
      double selfConsistency, int iterations, boolean converged, boolean lowConfidence) {
    this.nImages = nImages;
    this.nSelected = nSelected;
    this.nObserved = nObserved;
    this.nExpected = nExpected;
    this.binObserved = Arrays.copyOf(binObserved, binObserved.length);
    this.binExpected = Arrays.copyOf(binExpected, binExpected.length);
    this.binResolution = new double[binResolution.length][];
    for (int i = 0; i < binResolution.length; i++) {
      this.binResolution[i] = Arrays.copyOf(binResolution[i], 2);
    }
    this.nComparisons = nComparisons;
    this.selfConsistency = selfConsistency;
    this.iterations = iterations;
    this.converged = converged;
    this.lowConfidence = lowConfidence;
  }

  public int getImageCount() {
    return nImages;
  }

  public int getSelectedCount() {
    return nSelected;
  }

  public int getObservedCount() {
    return nObserved;
  }

  public int getExpectedCount() {
    return nExpected;
  }

  /**
   * Completeness of the merged table.
   *
   * @return observed / expected unique reflections, or 0 if none are expected.
   */
  public double getCompleteness() {
    return (nExpected == 0) ? 0.0 : (double) nObserved / nExpected;
  }

  public int getBinCount() {
    return binExpected.length;
  }

  /**
   * Completeness of a resolution bin.
   *
   * @param bin the bin.
   * @return observed / expected, or 0 for an empty bin.
   */
  public double getBinCompleteness(int bin) {
    return (binExpected[bin] == 0) ? 0.0 : (double) binObserved[bin] / binExpected[bin];
  }

  public int getBinObserved(int bin) {
    return binObserved[bin];
  }

  public int getBinExpected(int bin) {
    return binExpected[bin];
  }

  public long getComparisonCount() {
    return nComparisons;
  }

  /**
   * The pair count weighted mean of Kendall's tau-b between each image and the consensus.
   *
   * @return a value in [-1, 1], or NaN if no image has two distinct intensities.
   */
  public double getSelfConsistency() {
    return selfConsistency;
  }

  public int getIterations() {
    return iterations;
  }

  public boolean isConverged() {
    return converged;
  }

  public boolean isLowConfidence() {
    return lowConfidence;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("\n Merge Statistics\n");
    sb.append(format("  %-28s %8d of %d\n", "Images merged", nSelected, nImages));
    sb.append(format("  %-28s %8d\n", "Pairwise comparisons", nComparisons));
    sb.append(format("  %-28s %8d (converged: %b)\n", "Bradley-Terry iterations", iterations, converged));
    sb.append(format("  %-28s %8.4f\n", "Self-consistency (tau-b)", selfConsistency));
    if (lowConfidence) {
      sb.append("  Too few images were merged; these statistics are low confidence.\n");
    }
    sb.append(format("\n %15s | %8s | %8s | %s\n", "Res. Range", "Observed", "Expected", "Complete (%)"));
    for (int i = 0; i < binExpected.length; i++) {
      sb.append(format(" %7.3f %7.3f | %8d | %8d | %6.2f\n", binResolution[i][0], binResolution[i][1],
          binObserved[i], binExpected[i], getBinCompleteness(i) * 100.0));
    }
    sb.append(format(" %15s | %8d | %8d | %6.2f", "All", nObserved, nExpected, getCompleteness() * 100.0));
    return sb.toString();
  }
}
