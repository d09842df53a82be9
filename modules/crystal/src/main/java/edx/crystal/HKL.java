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

import java.util.Comparator;
import java.util.Objects;

/**
 * The HKL class represents a single reflection.
 * <p>
 * Reflections order canonically by ascending h, then k, then l.
 *
 * @author Timothy D. Fenn
 * @see ReflectionList
 * @since 1.0
 */
public class HKL implements Comparable<HKL> {

  /**
   * Canonical ascending (h, k, l) order.
   */
  public static final Comparator<HKL> CANONICAL_ORDER =
      Comparator.comparingInt(HKL::getH).thenComparingInt(HKL::getK).thenComparingInt(HKL::getL);

  /**
   * The h-index of the reflection.
   */
  protected int h;
  /**
   * The k-index of the reflection.
   */
  protected int k;
  /**
   * The l-index of the reflection.
   */
  protected int l;
  /**
   * The number of symmetry operators that leave the reflection unchanged; 0 for a systematic absence.
   */
  protected int epsilon;
  /**
   * The resolution bin of this reflection.
   */
  protected int bin;
  /**
   * The unique index of this reflection.
   */
  protected int index;
  /**
   * The d-spacing in Angstroms.
   */
  protected double d;

  /**
   * Constructor for HKL.
   */
  public HKL() {
  }

  /**
   * Constructor for HKL.
   *
   * @param h The h-index of the reflection.
   * @param k The k-index of the reflection.
   * @param l The l-index of the reflection.
   */
  public HKL(int h, int k, int l) {
    this.h = h;
    this.k = k;
    this.l = l;
  }

  /**
   * Is this reflection a systematic absence?
   *
   * @return a boolean.
   */
  public boolean sysAbs() {
    return (epsilon == 0);
  }

  /**
   * quadForm
   *
   * @param mat a symmetric 3x3 matrix.
   * @return h^T.mat.h
   */
  public double quadForm(double[][] mat) {
    return h * (h * mat[0][0] + 2 * (k * mat[0][1] + l * mat[0][2]))
        + k * (k * mat[1][1] + 2 * (l * mat[1][2]))
        + l * l * mat[2][2];
  }

  /**
   * True if the indices match.
   *
   * @param h the h index.
   * @param k the k index.
   * @param l the l index.
   * @return true if equal.
   */
  public boolean matches(int h, int k, int l) {
    return this.h == h && this.k == k && this.l == l;
  }

  public int getH() {
    return h;
  }

  public void setH(int h) {
    this.h = h;
  }

  public int getK() {
    return k;
  }

  public void setK(int k) {
    this.k = k;
  }

  public int getL() {
    return l;
  }

  public void setL(int l) {
    this.l = l;
  }

  public int getEpsilon() {
    return epsilon;
  }

  public void setEpsilon(int epsilon) {
    this.epsilon = epsilon;
  }

  public int getBin() {
    return bin;
  }

  public void setBin(int bin) {
    this.bin = bin;
  }

  public int getIndex() {
    return index;
  }

  public void setIndex(int index) {
    this.index = index;
  }

  /**
   * The d-spacing.
   *
   * @return d in Angstroms.
   */
  public double getD() {
    return d;
  }

  public void setD(double d) {
    this.d = d;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public int compareTo(HKL o) {
    return CANONICAL_ORDER.compare(this, o);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    HKL hkl = (HKL) o;
    return h == hkl.h && k == hkl.k && l == hkl.l;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public int hashCode() {
    return Objects.hash(h, k, l);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format("(%d, %d, %d)", h, k, l);
  }
}
