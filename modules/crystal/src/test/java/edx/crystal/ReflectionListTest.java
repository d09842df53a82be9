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
package edx.crystal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import edx.utilities.BaseEDXTest;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Test the ReflectionList against previously recorded unique reflection counts.
 */
@RunWith(Parameterized.class)
public class ReflectionListTest extends BaseEDXTest {

  private final String info;
  private final ReflectionList reflectionList;
  private final int expected;
  private final int[] first;

  public ReflectionListTest(String info, double[] cell, String spaceGroup, double dmin, double dmax,
      int expected, int[] first) {
    this.info = info;
    this.expected = expected;
    this.first = first;
    reflectionList = new ReflectionList(cell[0], cell[1], cell[2], cell[3], cell[4], cell[5],
        spaceGroup, dmin, dmax);
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][]{
        {"Fm-3c regression", new double[]{24.61, 24.61, 24.61, 90.0, 90.0, 90.0}, "Fm-3c", 1.0, 10.0,
            364, new int[]{2, 2, 0}},
        {"P212121", new double[]{10.0, 12.0, 15.0, 90.0, 90.0, 90.0}, "P212121", 2.0, 10.0,
            153, new int[]{0, 0, 2}},
        {"P63/mmc", new double[]{8.0, 8.0, 13.0, 90.0, 90.0, 120.0}, "P63/mmc", 1.5, 10.0,
            60, new int[]{0, 0, 2}},
        {"P21/c", new double[]{7.0, 9.0, 11.0, 90.0, 101.5, 90.0}, "P21/c", 1.5, 8.0,
            212, new int[]{0, 0, 2}},
        {"Ia-3d", new double[]{12.0, 12.0, 12.0, 90.0, 90.0, 90.0}, "Ia-3d", 1.2, 10.0,
            47, new int[]{2, 1, 1}},
        {"R-3m", new double[]{6.0, 6.0, 17.0, 90.0, 90.0, 120.0}, "R-3m", 1.5, 10.0,
            29, new int[]{0, 0, 3}},
        {"I41/a", new double[]{9.0, 9.0, 14.0, 90.0, 90.0, 90.0}, "I41/a", 1.5, 10.0,
            90, new int[]{0, 0, 4}}
    });
  }

  @Test
  public void countTest() {
    assertEquals(info + " unique reflection count", expected, reflectionList.size());
    HKL hkl = reflectionList.hklList.get(0);
    assertTrue(info + " first reflection " + hkl, hkl.matches(first[0], first[1], first[2]));
  }

  @Test
  public void invariantTest() {
    Resolution resolution = reflectionList.resolution;
    HKL previous = null;
    int index = 0;
    for (HKL hkl : reflectionList.hklList) {
      assertTrue(info + " d-spacing in the shell", resolution.inResolutionRange(hkl.getD()));
      assertFalse(info + " no systematic absences", hkl.sysAbs());
      int[] rep = reflectionList.standardize(hkl.getH(), hkl.getK(), hkl.getL());
      assertTrue(info + " list holds representatives", hkl.matches(rep[0], rep[1], rep[2]));
      assertEquals(info + " index", index++, hkl.getIndex());
      if (previous != null) {
        assertTrue(info + " canonical order", previous.compareTo(hkl) < 0);
      }
      previous = hkl;
      // Every symmetry mate maps back onto the same representative.
      List<int[]> mates = reflectionList.equivalents(hkl);
      for (int[] mate : mates) {
        assertEquals(info + " mate of " + hkl, hkl, reflectionList.findSymHKL(mate[0], mate[1], mate[2]));
      }
    }
    int total = Arrays.stream(reflectionList.binCounts()).sum();
    assertEquals(info + " every reflection is binned", reflectionList.size(), total);
  }

  @Test
  public void absenceTest() {
    switch (info) {
      case "Fm-3c regression" -> {
        // F centering removes mixed parity, the c-glide removes hhl with l odd.
        assertNull(reflectionList.findSymHKL(3, 2, 1));
        assertNull(reflectionList.findSymHKL(3, 3, 1));
        assertNotNull(reflectionList.findSymHKL(4, 4, 0));
        assertNotNull(reflectionList.findSymHKL(5, 3, 1));
      }
      case "P212121" -> {
        assertNull(reflectionList.findSymHKL(0, 0, 3));
        assertNotNull(reflectionList.findSymHKL(0, 0, 4));
        assertNull(reflectionList.findSymHKL(3, 0, 0));
      }
      case "P21/c" -> {
        assertNull(reflectionList.findSymHKL(0, 3, 0));
        assertNull(reflectionList.findSymHKL(1, 0, 1));
        assertNotNull(reflectionList.findSymHKL(1, 0, 2));
      }
      case "P63/mmc" -> {
        assertNull(reflectionList.findSymHKL(0, 0, 3));
        assertNotNull(reflectionList.findSymHKL(0, 0, 4));
      }
      default -> {
        // Only the counts are recorded for the remaining space groups.
      }
    }
  }
}
