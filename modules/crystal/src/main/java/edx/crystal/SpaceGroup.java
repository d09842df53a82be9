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

import static java.lang.String.format;

import java.util.Collections;
import java.util.List;

/**
 * The SpaceGroup class defines the symmetry of a crystal.
 * <p>
 * The operator list is closed under composition and includes the lattice centering translations, so
 * the number of operators equals the number of general positions of the conventional cell.
 *
 * @author Michael J. Schnieders
 * @see <a href="http://it.iucr.org/Ab/" target="_blank"> International Tables for
 * Crystallography Volume A: Space-group symmetry </a>
 * @see SpaceGroupDefinitions
 * @since 1.0
 */
public class SpaceGroup {

  /**
   * Space group number.
   */
  public final int number;
  /**
   * Space group name (Hermann-Mauguin symbol without spaces).
   */
  public final String shortName;
  /**
   * Point group name.
   */
  public final String pointGroupName;
  /**
   * Crystal system.
   */
  public final CrystalSystem crystalSystem;
  /**
   * Lattice system.
   */
  public final LatticeSystem latticeSystem;
  /**
   * Laue group.
   */
  public final LaueSystem laueSystem;
  /**
   * Lattice centering symbol (P, A, C, I, F or R).
   */
  public final char centering;
  /**
   * An unmodifiable List of SymOp instances. The first operator is the identity.
   */
  public final List<SymOp> symOps;

  /**
   * SpaceGroup instances are made available through {@link SpaceGroupDefinitions}.
   *
   * @param number         Space group number.
   * @param shortName      Short name.
   * @param pointGroupName Point group name.
   * @param crystalSystem  Crystal system.
   * @param laueSystem     Laue System.
   * @param centering      Lattice centering.
   * @param symOps         Symmetry operators.
   */
  protected SpaceGroup(int number, String shortName, String pointGroupName, CrystalSystem crystalSystem,
      LaueSystem laueSystem, char centering, List<SymOp> symOps) {
    this.number = number;
    this.shortName = shortName;
    this.pointGroupName = pointGroupName;
    this.crystalSystem = crystalSystem;
    this.latticeSystem = LatticeSystem.forCrystalSystem(crystalSystem);
    this.laueSystem = laueSystem;
    this.centering = centering;
    this.symOps = Collections.unmodifiableList(symOps);
  }

  /**
   * Return the number of symmetry operators.
   *
   * @return the number of symmetry operators.
   */
  public int getNumberOfSymOps() {
    return symOps.size();
  }

  /**
   * Return the ith symmetry operator.
   *
   * @param i the symmetry operator number.
   * @return the SymOp
   */
  public SymOp getSymOp(int i) {
    return symOps.get(i);
  }

  /**
   * Check if the space group contains the inversion operator (with any translation).
   *
   * @return true for a centrosymmetric space group.
   */
  public boolean isCentrosymmetric() {
    for (SymOp symOp : symOps) {
      double[][] r = symOp.rot;
      if (r[0][0] == -1.0 && r[1][1] == -1.0 && r[2][2] == -1.0
          && r[0][1] == 0.0 && r[0][2] == 0.0 && r[1][0] == 0.0
          && r[1][2] == 0.0 && r[2][0] == 0.0 && r[2][1] == 0.0) {
        return true;
      }
    }
    return false;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" Space group %s (%d), point group %s, Laue class %s, %d operators",
        shortName, number, pointGroupName, laueSystem, symOps.size());
  }
}
