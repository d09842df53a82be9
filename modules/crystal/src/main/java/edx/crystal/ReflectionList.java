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
import static org.apache.commons.math3.util.FastMath.ceil;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.rint;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The ReflectionList enumerates the symmetry-unique, systematically allowed reflections of a crystal
 * within a resolution shell.
 * <p>
 * Symmetry-equivalent reflections (including Friedel mates) are represented by the lexicographically
 * greatest member of their class. The list is sorted in ascending (h, k, l) order, which is also the
 * order of {@link HKL#getIndex()}.
 *
 * @author Timothy D. Fenn
 * @see <a href="http://dx.doi.org/10.1107/S0021889802013420" target="_blank"> Cowtan, K. 2002.
 * Generic representation and evaluation of properties as a function of position in reciprocal
 * space. J. Appl. Cryst. 35:655-663. </a>
 * @since 1.0
 */
public class ReflectionList {

  private static final Logger logger = Logger.getLogger(ReflectionList.class.getName());

  /**
   * The HKL list.
   */
  public final List<HKL> hklList;
  /**
   * The Crystal instance.
   */
  public final Crystal crystal;
  /**
   * The space group.
   */
  public final SpaceGroup spaceGroup;
  /**
   * Resolution instance.
   */
  public final Resolution resolution;
  /**
   * String to HKL look-up.
   */
  private final HashMap<String, HKL> hklMap = new HashMap<>();
  /**
   * Distinct transposed rotations of the space group, used to generate symmetry mates.
   */
  private final int[][][] transposedRotations;
  /**
   * For binning reflections based on resolution
   */
  public final int nBins;
  /**
   * Cumulative histogram of 1/d^2.
   */
  private final double[] histogram = new double[1001];
  /**
   * Minimum 1/d^2.
   */
  private double minResolution;
  /**
   * Maximum 1/d^2.
   */
  private double maxResolution;

  /**
   * Constructor for ReflectionList.
   *
   * @param crystal    a {@link Crystal} object.
   * @param resolution a {@link Resolution} object.
   */
  public ReflectionList(Crystal crystal, Resolution resolution) {
    this(crystal, resolution, null);
  }

  /**
   * Constructor for ReflectionList.
   *
   * @param crystal    a {@link Crystal} object.
   * @param resolution a {@link Resolution} object.
   * @param properties the number of resolution bins is read from "resolution-bins" (default 10).
   * @throws CrystalConfigurationException if the shell contains no reflections.
   */
  public ReflectionList(Crystal crystal, Resolution resolution, CompositeConfiguration properties) {
    this.crystal = crystal;
    this.spaceGroup = crystal.spaceGroup;
    this.resolution = resolution;
    this.nBins = (properties == null) ? 10 : max(1, properties.getInt("resolution-bins", 10));
    this.transposedRotations = distinctTransposedRotations(spaceGroup);

    int hMax = (int) ceil(crystal.a / resolution.dmin);
    int kMax = (int) ceil(crystal.b / resolution.dmin);
    int lMax = (int) ceil(crystal.c / resolution.dmin);

    minResolution = Double.POSITIVE_INFINITY;
    maxResolution = Double.NEGATIVE_INFINITY;

    List<HKL> list = new ArrayList<>();
    HKL hkl = new HKL();
    for (int h = -hMax; h <= hMax; h++) {
      hkl.setH(h);
      for (int k = -kMax; k <= kMax; k++) {
        hkl.setK(k);
        for (int l = -lMax; l <= lMax; l++) {
          hkl.setL(l);
          if (h == 0 && k == 0 && l == 0) {
            continue;
          }
          double res = crystal.invressq(hkl);
          double d = 1.0 / sqrt(res);
          if (!resolution.inResolutionRange(d)) {
            continue;
          }
          int[] rep = standardize(h, k, l);
          if (!hkl.matches(rep[0], rep[1], rep[2])) {
            continue;
          }
          getEpsilon(hkl);
          if (hkl.sysAbs()) {
            continue;
          }
          minResolution = min(res, minResolution);
          maxResolution = max(res, maxResolution);
          HKL unique = new HKL(h, k, l);
          unique.setEpsilon(hkl.getEpsilon());
          unique.setD(d);
          list.add(unique);
        }
      }
    }

    if (list.isEmpty()) {
      throw new CrystalConfigurationException(format(" No reflections for %s in the%s.",
          spaceGroup.shortName, resolution));
    }

    // The loops above already visit (h, k, l) in ascending order.
    for (int i = 0; i < list.size(); i++) {
      HKL ih = list.get(i);
      ih.setIndex(i);
      hklMap.put(key(ih.getH(), ih.getK(), ih.getL()), ih);
    }
    hklList = Collections.unmodifiableList(list);

    // Set up the resolution bins first build a histogram.
    for (HKL ih : hklList) {
      double r = (maxResolution > minResolution)
          ? (crystal.invressq(ih) - minResolution) / (maxResolution - minResolution) : 0.0;
      int i = (int) (min(r, 0.999) * 1000.0);
      histogram[i + 1] += 1.0;
    }

    // Convert to cumulative histogram
    for (int i = 1; i < histogram.length; i++) {
      histogram[i] += histogram[i - 1];
    }
    for (int i = 0; i < histogram.length; i++) {
      histogram[i] /= histogram[histogram.length - 1];
    }

    // Assign each reflection to a bin in the range (0-nbins)
    for (HKL ih : hklList) {
      int bin = (int) floor(ordinal(crystal.invressq(ih)) * nBins);
      ih.setBin(min(bin, nBins - 1));
    }

    logger.info(toString());
  }

  /**
   * Constructor for ReflectionList.
   *
   * @param a     the a-axis length.
   * @param b     the b-axis length.
   * @param c     the c-axis length.
   * @param alpha the alpha angle.
   * @param beta  the beta angle.
   * @param gamma the gamma angle.
   * @param sg    the space group symbol.
   * @param dmin  the high resolution limit.
   * @param dmax  the low resolution limit.
   */
  public ReflectionList(double a, double b, double c, double alpha, double beta, double gamma,
      String sg, double dmin, double dmax) {
    this(new Crystal(a, b, c, alpha, beta, gamma, sg), new Resolution(dmin, dmax));
  }

  private static int[][][] distinctTransposedRotations(SpaceGroup spaceGroup) {
    Set<String> seen = new LinkedHashSet<>();
    List<int[][]> rotations = new ArrayList<>();
    for (SymOp symOp : spaceGroup.symOps) {
      int[][] t = new int[3][3];
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < 3; i++) {
        for (int j = 0; j < 3; j++) {
          t[i][j] = (int) rint(symOp.rot[j][i]);
          sb.append(t[i][j]).append(',');
        }
      }
      if (seen.add(sb.toString())) {
        rotations.add(t);
      }
    }
    return rotations.toArray(new int[0][][]);
  }

  private static String key(int h, int k, int l) {
    return h + "_" + k + "_" + l;
  }

  private static boolean greater(int h1, int k1, int l1, int h2, int k2, int l2) {
    if (h1 != h2) {
      return h1 > h2;
    }
    if (k1 != k2) {
      return k1 > k2;
    }
    return l1 > l2;
  }

  /**
   * Map a reflection onto the representative of its symmetry class: the lexicographically greatest
   * member of {+/- R^T h} over the rotations of the space group.
   *
   * @param h the h index.
   * @param k the k index.
   * @param l the l index.
   * @return the representative {h, k, l}.
   */
  public int[] standardize(int h, int k, int l) {
    int bh = h;
    int bk = k;
    int bl = l;
    for (int[][] r : transposedRotations) {
      int hs = r[0][0] * h + r[0][1] * k + r[0][2] * l;
      int ks = r[1][0] * h + r[1][1] * k + r[1][2] * l;
      int ls = r[2][0] * h + r[2][1] * k + r[2][2] * l;
      if (greater(hs, ks, ls, bh, bk, bl)) {
        bh = hs;
        bk = ks;
        bl = ls;
      }
      if (greater(-hs, -ks, -ls, bh, bk, bl)) {
        bh = -hs;
        bk = -ks;
        bl = -ls;
      }
    }
    return new int[]{bh, bk, bl};
  }

  /**
   * Find the unique reflection that a (possibly non-unique) reflection is equivalent to.
   *
   * @param h the h index.
   * @param k the k index.
   * @param l the l index.
   * @return the unique HKL, or null if the reflection is outside the list (absent or out of the shell).
   */
  public HKL findSymHKL(int h, int k, int l) {
    int[] rep = standardize(h, k, l);
    return getHKL(rep[0], rep[1], rep[2]);
  }

  /**
   * All distinct symmetry mates (including Friedel mates) of a reflection, in ascending order.
   *
   * @param hkl the reflection.
   * @return the list of {h, k, l} triples.
   */
  public List<int[]> equivalents(HKL hkl) {
    int h = hkl.getH();
    int k = hkl.getK();
    int l = hkl.getL();
    List<int[]> mates = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (int[][] r : transposedRotations) {
      int hs = r[0][0] * h + r[0][1] * k + r[0][2] * l;
      int ks = r[1][0] * h + r[1][1] * k + r[1][2] * l;
      int ls = r[2][0] * h + r[2][1] * k + r[2][2] * l;
      if (seen.add(key(hs, ks, ls))) {
        mates.add(new int[]{hs, ks, ls});
      }
      if (seen.add(key(-hs, -ks, -ls))) {
        mates.add(new int[]{-hs, -ks, -ls});
      }
    }
    mates.sort(Comparator.<int[]>comparingInt(x -> x[0]).thenComparingInt(x -> x[1]).thenComparingInt(x -> x[2]));
    return mates;
  }

  /**
   * getHKL
   *
   * @param h an int.
   * @param k an int.
   * @param l an int.
   * @return the unique HKL, or null.
   */
  public HKL getHKL(int h, int k, int l) {
    return hklMap.get(key(h, k, l));
  }

  /**
   * getHKL
   *
   * @param hkl a {@link HKL} object.
   * @return the unique HKL, or null.
   */
  public HKL getHKL(HKL hkl) {
    return getHKL(hkl.getH(), hkl.getK(), hkl.getL());
  }

  /**
   * The number of unique reflections.
   *
   * @return the size of the list.
   */
  public int size() {
    return hklList.size();
  }

  /**
   * Count the reflections in each resolution bin.
   *
   * @return counts indexed by bin.
   */
  public int[] binCounts() {
    int[] counts = new int[nBins];
    for (HKL hkl : hklList) {
      counts[hkl.getBin()]++;
    }
    return counts;
  }

  /**
   * The fraction of reflections with 1/d^2 below s.
   *
   * @param s a 1/d^2 value.
   * @return a value in [0, 1].
   */
  public final double ordinal(double s) {
    if (maxResolution <= minResolution) {
      return 0.0;
    }
    double r = (s - minResolution) / (maxResolution - minResolution);
    r = min(max(r, 0.0), 0.999) * 1000.0;
    int i = (int) r;
    r -= floor(r);
    return ((1.0 - r) * histogram[i] + r * histogram[i + 1]);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" Reflection list with %d unique reflections, space group %s,%s",
        hklList.size(), spaceGroup.shortName, resolution);
  }

  /**
   * Count the operators that leave the reflection unchanged. A reflection that is mapped onto itself
   * with a non-trivial phase shift is systematically absent (epsilon = 0).
   *
   * @param hkl the reflection to update.
   */
  private void getEpsilon(HKL hkl) {
    int epsilon = 0;
    HKL mate = new HKL();
    for (SymOp symOp : spaceGroup.symOps) {
      SymOp.applyTransSymRot(hkl, mate, symOp);
      if (mate.equals(hkl)) {
        double shift = symOp.symPhaseShift(hkl);
        if (cos(shift) > 0.999) {
          epsilon++;
        } else {
          epsilon = 0;
          break;
        }
      }
    }
    hkl.setEpsilon(epsilon);
  }
}
