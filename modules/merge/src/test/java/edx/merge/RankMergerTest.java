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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import edx.crystal.Crystal;
import edx.crystal.HKL;
import edx.crystal.ReflectionList;
import edx.crystal.Resolution;
import edx.indexing.ImageReflections;
import edx.utilities.BaseEDXTest;
import org.junit.BeforeClass;
import org.junit.Test;

/**
 * Test rank aggregation merging.
 */
public class RankMergerTest extends BaseEDXTest {

  private static ReflectionList reflectionList;

  @BeforeClass
  public static void setUpClass() {
    Crystal crystal = new Crystal(10.0, 10.0, 10.0, 90.0, 90.0, 90.0, "Pm-3m");
    reflectionList = new ReflectionList(crystal, new Resolution(2.0, 10.0));
  }

  private static ImageReflections image(String name, double score, int[][] hkl, double[] intensity) {
    return new ImageReflections(name, score, hkl, intensity);
  }

  /**
   * Three images ranking A = (1,0,0), B = (1,1,0) and C = (1,1,1) as B>A>C, A>C>B and A>B>C.
   */
  private static List<ImageReflections> conflict() {
    int[][] hkl = {{1, 0, 0}, {1, 1, 0}, {1, 1, 1}, {2, 0, 0}};
    int[][] mates = {{0, 0, -1}, {0, -1, 1}, {-1, 1, -1}, {0, 2, 0}};
    List<ImageReflections> images = new ArrayList<>();
    images.add(image("img1", 3.0, hkl, new double[]{2.0, 3.0, 1.0, 0.0}));
    images.add(image("img2", 2.0, mates, new double[]{3.0, 1.0, 2.0, 0.0}));
    images.add(image("img3", 1.0, hkl, new double[]{3.0, 2.0, 1.0, 0.0}));
    return images;
  }

  @Test
  public void rankConflictTest() {
    RankMerger merger = new RankMerger(reflectionList, new MergeOptions());
    MergedReflectionTable table = merger.merge(conflict(), 0);
    assertEquals(3, table.size());
    List<MergedReflection> consensus = table.getConsensusOrder();
    assertEquals(new HKL(1, 0, 0), consensus.get(0).getHKL());
    assertEquals(new HKL(1, 1, 0), consensus.get(1).getHKL());
    assertEquals(new HKL(1, 1, 1), consensus.get(2).getHKL());

    MergedReflection a = table.get(1, 0, 0);
    assertEquals(1, a.getPosition());
    assertEquals(3.0, a.getSurrogate(), 0.0);
    assertEquals(1.5, a.getSigma(), 1.0e-12);
    assertEquals(3, a.getRedundancy());
    assertEquals(6, a.getPairRedundancy());
    assertEquals(1.0, table.get(1, 1, 1).getSurrogate(), 0.0);

    MergeStatistics statistics = table.getStatistics();
    assertFalse(table.isLowConfidence());
    assertEquals(3, statistics.getSelectedCount());
    assertEquals(9, statistics.getComparisonCount());
    assertTrue(statistics.isConverged());
    // One image agrees with the consensus (tau 1) and two have one discordant pair (tau 1/3).
    assertEquals(5.0 / 9.0, statistics.getSelfConsistency(), 1.0e-12);
  }

  @Test
  public void splitMajorityTest() {
    // A>B>C, B>A>C and C>A>B: every pair is decided 2 to 1.
    int[][] hkl = {{1, 0, 0}, {1, 1, 0}, {1, 1, 1}};
    List<ImageReflections> images = new ArrayList<>();
    images.add(image("img1", 1.0, hkl, new double[]{3.0, 2.0, 1.0}));
    images.add(image("img2", 1.0, hkl, new double[]{2.0, 3.0, 1.0}));
    images.add(image("img3", 1.0, hkl, new double[]{2.0, 1.0, 3.0}));
    MergedReflectionTable table = new RankMerger(reflectionList, new MergeOptions()).merge(images, 0);

    List<MergedReflection> consensus = table.getConsensusOrder();
    assertEquals(new HKL(1, 0, 0), consensus.get(0).getHKL());
    assertEquals(new HKL(1, 1, 0), consensus.get(1).getHKL());
    assertEquals(new HKL(1, 1, 1), consensus.get(2).getHKL());
    assertEquals(1.4544886239, consensus.get(0).getStrength(), 1.0e-6);
    assertEquals(1.0, consensus.get(1).getStrength(), 1.0e-6);
    assertEquals(0.6875268537, consensus.get(2).getStrength(), 1.0e-6);

    MergeStatistics statistics = table.getStatistics();
    assertEquals(9, statistics.getComparisonCount());
    // Image tau-b values are 1, 1/3 and -1/3.
    assertEquals(1.0 / 3.0, statistics.getSelfConsistency(), 1.0e-12);
  }

  @Test
  public void zeroIntensityTest() {
    MergedReflectionTable table = new RankMerger(reflectionList, new MergeOptions()).merge(conflict(), 0);
    assertNull(table.get(2, 0, 0));
    for (MergedReflection reflection : table.getCanonicalOrder()) {
      assertFalse(reflection.getHKL().matches(2, 0, 0));
    }
  }

  @Test
  public void completenessTest() {
    MergedReflectionTable table = new RankMerger(reflectionList, new MergeOptions()).merge(conflict(), 0);
    MergeStatistics statistics = table.getStatistics();
    assertEquals(3, statistics.getObservedCount());
    assertEquals(reflectionList.size(), statistics.getExpectedCount());
    assertEquals(3.0 / reflectionList.size(), statistics.getCompleteness(), 1.0e-12);
    int observed = 0;
    int expected = 0;
    for (int i = 0; i < statistics.getBinCount(); i++) {
      observed += statistics.getBinObserved(i);
      expected += statistics.getBinExpected(i);
      assertTrue(statistics.getBinCompleteness(i) >= 0.0 && statistics.getBinCompleteness(i) <= 1.0);
    }
    assertEquals(3, observed);
    assertEquals(reflectionList.size(), expected);
  }

  @Test
  public void permutationInvarianceTest() {
    Random random = new Random(2718);
    List<HKL> unique = reflectionList.hklList;
    List<ImageReflections> images = new ArrayList<>();
    for (int n = 0; n < 8; n++) {
      int m = 15;
      int[][] hkl = new int[m][];
      double[] intensity = new double[m];
      for (int i = 0; i < m; i++) {
        HKL h = unique.get(random.nextInt(unique.size()));
        hkl[i] = new int[]{h.getH(), h.getK(), h.getL()};
        intensity[i] = random.nextInt(10);
      }
      images.add(image("frame_" + n, random.nextInt(3), hkl, intensity));
    }

    RankMerger merger = new RankMerger(reflectionList, new MergeOptions());
    MergedReflectionTable reference = merger.merge(images, 6);
    List<ImageReflections> shuffled = new ArrayList<>(images);
    Collections.shuffle(shuffled, new Random(31));
    MergedReflectionTable table = merger.merge(shuffled, 6);

    assertEquals(reference.size(), table.size());
    for (int i = 0; i < table.size(); i++) {
      MergedReflection expected = reference.getConsensusOrder().get(i);
      MergedReflection actual = table.getConsensusOrder().get(i);
      assertEquals(expected.getHKL(), actual.getHKL());
      assertEquals(expected.getStrength(), actual.getStrength(), 0.0);
      assertEquals(expected.getRedundancy(), actual.getRedundancy());
    }
    assertEquals(reference.getStatistics().getSelfConsistency(), table.getStatistics().getSelfConsistency(), 0.0);
  }

  @Test
  public void selectionTest() {
    List<ImageReflections> images = new ArrayList<>();
    int[][] hkl = {{1, 0, 0}, {1, 1, 0}};
    images.add(image("b", 1.0, hkl, new double[]{1.0, 2.0}));
    images.add(image("c", 5.0, hkl, new double[]{1.0, 2.0}));
    images.add(image("a", 1.0, hkl, new double[]{1.0, 2.0}));
    List<ImageReflections> selected = RankMerger.select(images, 2);
    assertEquals(2, selected.size());
    assertEquals("c", selected.get(0).getName());
    assertEquals("a", selected.get(1).getName());
    assertEquals(3, RankMerger.select(images, 0).size());
    assertEquals(3, RankMerger.select(images, 10).size());
  }

  @Test
  public void lowConfidenceTest() {
    RankMerger merger = new RankMerger(reflectionList, new MergeOptions());
    MergedReflectionTable table = merger.merge(conflict(), 2);
    assertTrue(table.isLowConfidence());
    assertEquals(2, table.getStatistics().getSelectedCount());
    assertEquals(3, table.getStatistics().getImageCount());
    assertNotNull(table.get(1, 0, 0));
  }

  @Test
  public void duplicateAverageTest() {
    // (1,0,0) and (0,1,0) are the same unique reflection with mean intensity 3.
    int[][] hkl = {{1, 0, 0}, {0, 1, 0}, {1, 1, 0}, {9, 9, 9}};
    List<ImageReflections> images = new ArrayList<>();
    images.add(image("single", 1.0, hkl, new double[]{1.0, 5.0, 2.0, 7.0}));
    MergedReflectionTable table = new RankMerger(reflectionList, new MergeOptions()).merge(images, 0);
    assertEquals(2, table.size());
    assertEquals(new HKL(1, 0, 0), table.getConsensusOrder().get(0).getHKL());
    assertEquals(1, table.get(1, 0, 0).getRedundancy());
    assertTrue(table.isLowConfidence());
  }

  @Test
  public void emptyMergeTest() {
    MergedReflectionTable table = new RankMerger(reflectionList, new MergeOptions())
        .merge(new ArrayList<>(), 0);
    assertEquals(0, table.size());
    assertTrue(table.isLowConfidence());
    assertTrue(Double.isNaN(table.getStatistics().getSelfConsistency()));
  }
}
