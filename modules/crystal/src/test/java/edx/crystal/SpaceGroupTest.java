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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;

import edx.utilities.BaseEDXTest;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Check the operator closure of representative space groups.
 */
@RunWith(Parameterized.class)
public class SpaceGroupTest extends BaseEDXTest {

  private final String info;
  private final String name;
  private final int number;
  private final int nSymOps;
  private final LaueSystem laueSystem;
  private final boolean centrosymmetric;

  public SpaceGroupTest(String info, String name, int number, int nSymOps, LaueSystem laueSystem,
      boolean centrosymmetric) {
    this.info = info;
    this.name = name;
    this.number = number;
    this.nSymOps = nSymOps;
    this.laueSystem = laueSystem;
    this.centrosymmetric = centrosymmetric;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][]{
        {"Triclinic", "P1", 1, 1, LaueSystem.L_1, false},
        {"Monoclinic screw and glide", "P 21/c", 14, 4, LaueSystem.L_2M, true},
        {"C-centered monoclinic", "C2/c", 15, 8, LaueSystem.L_2M, true},
        {"Orthorhombic screws", "P 21 21 21", 19, 4, LaueSystem.L_MMM, false},
        {"Orthorhombic glides", "Pnma", 62, 8, LaueSystem.L_MMM, true},
        {"Tetragonal origin choice 2", "I41/a", 88, 16, LaueSystem.L_4M, true},
        {"Tetragonal enantiomorph", "P43212", 96, 8, LaueSystem.L_4MMM, false},
        {"Trigonal screw", "P3121", 152, 6, LaueSystem.L_3M1, false},
        {"Rhombohedral hexagonal axes", "R-3m", 166, 36, LaueSystem.L_3M1, true},
        {"Hexagonal", "P6/mmm", 191, 24, LaueSystem.L_6MMM, true},
        {"Hexagonal screw", "P63/mmc", 194, 24, LaueSystem.L_6MMM, true},
        {"Cubic m-3", "Pa-3", 205, 24, LaueSystem.L_M3, true},
        {"Face centered cubic glide", "Fm-3c", 226, 192, LaueSystem.L_M3M, true},
        {"Diamond", "Fd-3m", 227, 192, LaueSystem.L_M3M, true},
        {"Body centered cubic", "Ia-3d", 230, 96, LaueSystem.L_M3M, true}
    });
  }

  @Test
  public void closureTest() {
    SpaceGroup spaceGroup = SpaceGroupDefinitions.spaceGroupFactory(name);
    assertNotNull(info + " space group should exist.", spaceGroup);
    assertEquals(info + " number", number, spaceGroup.number);
    assertEquals(info + " operator count", nSymOps, spaceGroup.getNumberOfSymOps());
    assertEquals(info + " Laue class", laueSystem, spaceGroup.laueSystem);
    assertEquals(info + " centrosymmetric", centrosymmetric, spaceGroup.isCentrosymmetric());
    assertTrue(info + " first operator is the identity",
        spaceGroup.getSymOp(0).isPureTranslation() && spaceGroup.getSymOp(0).tr[0] == 0.0);
    // Closure: every product is already in the list.
    for (SymOp s1 : spaceGroup.symOps) {
      for (SymOp s2 : spaceGroup.symOps) {
        assertTrue(info + " should be closed", spaceGroup.symOps.contains(SymOp.combineSymOps(s1, s2)));
      }
    }
  }

  @Test
  public void lookupTest() {
    SpaceGroup byName = SpaceGroupDefinitions.spaceGroupFactory(name);
    SpaceGroup byNumber = SpaceGroupDefinitions.spaceGroupFactory(number);
    assertEquals(info + " lookup by number", byName.shortName, byNumber.shortName);
    assertNull(" Unknown symbols are not supported.", SpaceGroupDefinitions.spaceGroupFactory("X99"));
  }
}
