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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import edx.crystal.HKL;

/**
 * The consensus ranking of unique reflections produced by a merge.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MergedReflectionTable {

  private final List<MergedReflection> consensus;
  private final List<MergedReflection> canonical;
  private final Map<HKL, MergedReflection> map;
  private final MergeStatistics statistics;

  /**
   * Constructor for MergedReflectionTable.
   *
   * @param consensus  the reflections in consensus order (strongest first).
   * @param statistics the merge statistics.
   */
  public MergedReflectionTable(List<MergedReflection> consensus, MergeStatistics statistics) {
    this.consensus = Collections.unmodifiableList(new ArrayList<>(consensus));
    List<MergedReflection> sorted = new ArrayList<>(consensus);
    sorted.sort((r1, r2) -> HKL.CANONICAL_ORDER.compare(r1.getHKL(), r2.getHKL()));
    this.canonical = Collections.unmodifiableList(sorted);
    map = new HashMap<>();
    for (MergedReflection reflection : consensus) {
      map.put(reflection.getHKL(), reflection);
    }
    this.statistics = statistics;
  }

  public int size() {
    return consensus.size();
  }

  /**
   * The reflections, strongest first.
   *
   * @return an unmodifiable list.
   */
  public List<MergedReflection> getConsensusOrder() {
    return consensus;
  }

  /**
   * The reflections in ascending (h, k, l) order.
   *
   * @return an unmodifiable list.
   */
  public List<MergedReflection> getCanonicalOrder() {
    return canonical;
  }

  /**
   * Look up a unique reflection.
   *
   * @param h the h index.
   * @param k the k index.
   * @param l the l index.
   * @return the merged reflection, or null if it was not observed.
   */
  public MergedReflection get(int h, int k, int l) {
    return map.get(new HKL(h, k, l));
  }

  public MergeStatistics getStatistics() {
    return statistics;
  }

  public boolean isLowConfidence() {
    return statistics.isLowConfidence();
  }
}
