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

import static org.apache.commons.math3.util.FastMath.abs;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import edx.crystal.Crystal;
import edx.crystal.CrystalConfigurationException;
import edx.utilities.BaseEDXTest;
import org.junit.Test;

/**
 * Test orientation library generation.
 */
public class OrientationLibraryTest extends BaseEDXTest {

  /**
   * Fm-3c with a = 24.61 A, d from 1 to 10 A, 400 A thick and a 0.03 rad step.
   */
  @Test
  public void goldenLibraryTest() {
    Crystal crystal = new Crystal(24.61, 24.61, 24.61, 90.0, 90.0, 90.0, "Fm-3c");
    OrientationLibrary library = OrientationLibrary.build(crystal, 1.0, 10.0, 400.0, 0.03);
    assertEquals(364, library.getReflectionList().size());
    assertEquals(13658, library.getProjector().getLatticePointCount());
    assertEquals(308, library.getZoneCount());
    assertEquals(209, library.getGammaCount());
    assertEquals(64372, library.size());
  }

  @Test
  public void orientationNumberTest() {
    OrientationLibrary library = SyntheticPatterns.cubicLibrary();
    assertEquals(112, library.getZoneCount());
    assertEquals(125, library.getGammaCount());
    int number = library.getOrientationNumber(56, 17);
    assertEquals(56 * 125 + 17, number);
    Orientation orientation = library.getOrientation(number);
    assertEquals(library.getZoneAxisGrid().getTheta(56), orientation.alpha, 0.0);
    assertEquals(library.getZoneAxisGrid().getPhi(56), orientation.beta, 0.0);
    assertEquals(17 * 0.05, orientation.gamma, 1.0e-15);
  }

  @Test
  public void spotsTest() {
    OrientationLibrary library = SyntheticPatterns.cubicLibrary();
    double smax = 1.0 / 200.0;
    int number = SyntheticPatterns.trueOrientation();
    ProjectedSpots spots = library.getSpots(number);
    assertTrue(spots.size() >= 10);
    // Rotating in the plane matches a direct projection at the same orientation.
    ProjectedSpots direct = library.getProjector().project(library.getOrientation(number));
    assertEquals(direct.size(), spots.size());
    for (int i = 0; i < spots.size(); i++) {
      assertTrue(abs(spots.getExcitationError(i)) < smax);
      assertTrue(spots.getWeight(i) > 0.0 && spots.getWeight(i) <= 1.0);
      assertEquals(direct.getX(i), spots.getX(i), 1.0e-12);
      assertEquals(direct.getY(i), spots.getY(i), 1.0e-12);
      int[] hkl = spots.getHKL(i);
      assertEquals(library.getReflectionList().findSymHKL(hkl[0], hkl[1], hkl[2]).getIndex(),
          spots.getReflectionIndex(i));
    }
  }

  @Test
  public void rotationTest() {
    Orientation orientation = new Orientation(0.7, 1.1, 0.3);
    double[] u = orientation.getZoneAxis();
    double[][] r = orientation.getRotationMatrix();
    for (int i = 0; i < 3; i++) {
      double v = r[i][0] * u[0] + r[i][1] * u[1] + r[i][2] * u[2];
      assertEquals(i == 2 ? 1.0 : 0.0, v, 1.0e-12);
    }
  }

  @Test
  public void wavelengthTest() {
    // 200 kV electrons.
    assertEquals(0.02508, LibraryParameters.electronWavelength(200.0), 1.0e-5);
  }

  @Test(expected = IllegalArgumentException.class)
  public void thicknessTest() {
    Crystal crystal = new Crystal(10.0, 10.0, 10.0, 90.0, 90.0, 90.0, "Pm-3m");
    OrientationLibrary.build(crystal, 1.0, 10.0, 0.0, 0.05);
  }

  @Test(expected = CrystalConfigurationException.class)
  public void emptyShellTest() {
    Crystal crystal = new Crystal(5.0, 5.0, 5.0, 90.0, 90.0, 90.0, "Pm-3m");
    OrientationLibrary.build(crystal, 6.0, 20.0, 400.0, 0.05);
  }
}
