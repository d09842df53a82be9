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

import edx.crystal.HKL;

/**
 * One unique reflection of a merged table.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class MergedReflection {

  private final HKL hkl;
  private final int position;
  private final double surrogate;
  private final double sigma;
  private final int redundancy;
  private final int pairRedundancy;
  private final double strength;

  /**
   * Constructor for MergedReflection.
   *
   * @param hkl            the unique reflection.
   * @param position       the consensus position (1 is the strongest).
   * @param surrogate      the rank based intensity, n - position + 1.
   * @param sigma          the uncertainty of the surrogate.
   * @param redundancy     the number of images that observed the reflection.
   * @param pairRedundancy the number of pairwise comparisons of the reflection.
   * @param strength       the Bradley-Terry strength.
   */
  public MergedReflection(HKL hkl, int position, double surrogate, double sigma, int redundancy,
      int pairRedundancy, double strength) {
    this.hkl = hkl;
    this.position = position;
    this.surrogate = surrogate;
    this.sigma = sigma;
    this.redundancy = redundancy;
    this.pairRedundancy = pairRedundancy;
    this.strength = strength;
  }

  public HKL getHKL() {
    return hkl;
  }

  public int getPosition() {
    return position;
  }

  public double getSurrogate() {
    return surrogate;
  }

  public double getSigma() {
    return sigma;
  }

  public int getRedundancy() {
    return redundancy;
  }

  public int getPairRedundancy() {
    return pairRedundancy;
  }

  public double getStrength() {
    return strength;
  }

  @Override
  public String toString() {
    return format(" %-16s %6d %10.2f %10.3f %6d %8d %12.5f", hkl, position, surrogate, sigma,
        redundancy, pairRedundancy, strength);
  }
}
