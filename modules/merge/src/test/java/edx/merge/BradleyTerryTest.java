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
import static org.junit.Assert.assertTrue;

import edx.utilities.BaseEDXTest;
import org.junit.Test;

/**
 * Test the Bradley-Terry strength estimates.
 */
public class BradleyTerryTest extends BaseEDXTest {

  @Test
  public void singleComparisonTest() {
    PairwiseComparisons comparisons = new PairwiseComparisons(2);
    comparisons.addWin(0, 1);
    BradleyTerry bradleyTerry = new BradleyTerry(1000, 1.0e-9);
    double[] p = bradleyTerry.fit(comparisons);
    assertTrue(bradleyTerry.isConverged());
    assertTrue(p[0] > 1.0);
    assertTrue(p[1] < 1.0);
    // Reversing the outcome inverts the strengths about the reference.
    assertEquals(1.0, p[0] * p[1], 1.0e-6);
    assertEquals(1.6956207657, p[0], 1.0e-6);
  }

  @Test
  public void majorityTest() {
    PairwiseComparisons comparisons = new PairwiseComparisons(3);
    for (int i = 0; i < 2; i++) {
      comparisons.addWin(0, 1);
      comparisons.addWin(1, 2);
    }
    comparisons.addWin(1, 0);
    comparisons.addWin(2, 1);
    for (int i = 0; i < 3; i++) {
      comparisons.addWin(0, 2);
    }
    assertEquals(5.0, comparisons.getWins(0), 0.0);
    assertEquals(3.0, comparisons.getWins(1), 0.0);
    assertEquals(1.0, comparisons.getWins(2), 0.0);
    assertEquals(3, comparisons.getCount(0, 1));
    assertEquals(6, comparisons.getPairRedundancy(2));
    assertEquals(9, comparisons.getTotal());

    double[] p = new BradleyTerry(1000, 1.0e-9).fit(comparisons);
    assertTrue(p[0] > p[1]);
    assertTrue(p[1] > p[2]);
    assertEquals(2.2902583608, p[0], 1.0e-6);
    assertEquals(1.0, p[1], 1.0e-6);
  }

  @Test
  public void tiesAndUncomparedTest() {
    PairwiseComparisons comparisons = new PairwiseComparisons(3);
    comparisons.addTie(0, 1);
    assertEquals(0.5, comparisons.getWins(0), 0.0);
    assertEquals(0, comparisons.getCount(0, 2));
    double[] p = new BradleyTerry(1000, 1.0e-9).fit(comparisons);
    for (double strength : p) {
      assertEquals(1.0, strength, 1.0e-9);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void selfComparisonTest() {
    new PairwiseComparisons(2).addWin(1, 1);
  }

  @Test
  public void iterationLimitTest() {
    PairwiseComparisons comparisons = new PairwiseComparisons(2);
    comparisons.addWin(0, 1);
    BradleyTerry bradleyTerry = new BradleyTerry(3, 1.0e-9);
    bradleyTerry.fit(comparisons);
    assertEquals(3, bradleyTerry.getIterations());
    assertTrue(!bradleyTerry.isConverged());
  }
}
