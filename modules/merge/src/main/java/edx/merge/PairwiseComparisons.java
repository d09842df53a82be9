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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sparse counts of pairwise comparisons between reflections.
 * <p>
 * Items are numbered 0 to n-1. Each comparison adds one to the symmetric count n_ij and one win to
 * the winner, or half a win to each item of a tie. Neighbors are kept in ascending order so sums
 * over them are accumulated deterministically.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PairwiseComparisons {

  private final double[] wins;
  private final List<TreeMap<Integer, Integer>> counts;
  private long total = 0;

  /**
   * Constructor for PairwiseComparisons.
   *
   * @param n the number of items.
   */
  public PairwiseComparisons(int n) {
    if (n < 0) {
      throw new IllegalArgumentException(format(" Invalid number of items %d.", n));
    }
    wins = new double[n];
    counts = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      counts.add(new TreeMap<>());
    }
  }

  /**
   * Record that one item beat another.
   *
   * @param winner the brighter item.
   * @param loser  the weaker item.
   */
  public void addWin(int winner, int loser) {
    count(winner, loser);
    wins[winner] += 1.0;
  }

  /**
   * Record a tie.
   *
   * @param i the first item.
   * @param j the second item.
   */
  public void addTie(int i, int j) {
    count(i, j);
    wins[i] += 0.5;
    wins[j] += 0.5;
  }

  private void count(int i, int j) {
    if (i == j) {
      throw new IllegalArgumentException(format(" Item %d cannot be compared with itself.", i));
    }
    counts.get(i).merge(j, 1, Integer::sum);
    counts.get(j).merge(i, 1, Integer::sum);
    total++;
  }

  public int size() {
    return wins.length;
  }

  /**
   * The wins of an item; ties count one half.
   *
   * @param i the item.
   * @return the number of wins.
   */
  public double getWins(int i) {
    return wins[i];
  }

  /**
   * The number of comparisons between two items.
   *
   * @param i the first item.
   * @param j the second item.
   * @return n_ij.
   */
  public int getCount(int i, int j) {
    Integer n = counts.get(i).get(j);
    return (n == null) ? 0 : n;
  }

  /**
   * The items compared with an item, in ascending order, with their counts.
   *
   * @param i the item.
   * @return an unmodifiable view.
   */
  public Map<Integer, Integer> getNeighbors(int i) {
    return Collections.unmodifiableMap(counts.get(i));
  }

  /**
   * The number of comparisons an item took part in.
   *
   * @param i the item.
   * @return the sum of n_ij over j.
   */
  public int getPairRedundancy(int i) {
    int sum = 0;
    for (int n : counts.get(i).values()) {
      sum += n;
    }
    return sum;
  }

  /**
   * The total number of comparisons.
   *
   * @return the count.
   */
  public long getTotal() {
    return total;
  }
}
