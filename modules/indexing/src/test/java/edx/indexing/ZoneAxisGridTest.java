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

import static org.apache.commons.math3.util.FastMath.PI;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;

import edx.crystal.LaueSystem;
import edx.utilities.BaseEDXTest;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Zone axis grid sizes for each Laue class at a 0.03 rad step.
 */
@RunWith(Parameterized.class)
public class ZoneAxisGridTest extends BaseEDXTest {

  private final LaueSystem laueSystem;
  private final int expected;

  public ZoneAxisGridTest(LaueSystem laueSystem, int expected) {
    this.laueSystem = laueSystem;
    this.expected = expected;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][]{
        {LaueSystem.L_1, 7010},
        {LaueSystem.L_2M, 3545},
        {LaueSystem.L_MMM, 1788},
        {LaueSystem.L_4M, 1788},
        {LaueSystem.L_4MMM, 908},
        {LaueSystem.L_3, 2369},
        {LaueSystem.L_3M1, 1177},
        {LaueSystem.L_31M, 1201},
        {LaueSystem.L_6M, 1201},
        {LaueSystem.L_6MMM, 616},
        {LaueSystem.L_M3, 599},
        {LaueSystem.L_M3M, 308}
    });
  }

  @Test
  public void gridTest() {
    ZoneAxisGrid grid = ZoneAxisGrid.generate(laueSystem, 0.03);
    assertEquals(laueSystem + " zone axes", expected, grid.size());
    assertEquals(laueSystem, grid.getLaueSystem());
    assertEquals(0.03, grid.getStep(), 0.0);
    // The pole comes first.
    assertEquals(0.0, grid.getTheta(0), 0.0);
    for (int i = 0; i < grid.size(); i++) {
      double theta = grid.getTheta(i);
      double phi = grid.getPhi(i);
      assertTrue(theta >= 0.0 && theta <= PI / 2.0);
      assertTrue(phi >= 0.0 && phi < 2.0 * PI);
      assertTrue(laueSystem.inAsymmetricRegion(theta, phi));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void invalidStepTest() {
    ZoneAxisGrid.generate(laueSystem, 0.0);
  }
}
