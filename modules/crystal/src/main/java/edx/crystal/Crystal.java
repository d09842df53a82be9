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

import static edx.numerics.math.MatrixMath.mat3Inverse;
import static edx.numerics.math.MatrixMath.mat3Vec3;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.apache.commons.math3.util.FastMath.toRadians;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * The Crystal class encapsulates the lattice parameters and space group that describe the geometry
 * and symmetry of a crystal (the unit cell).
 * <p>
 * The Cartesian frame places <b>a</b> along x and <b>b</b> in the xy-plane. Instances are immutable.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Crystal {

  private static final Logger logger = Logger.getLogger(Crystal.class.getName());

  /**
   * Length of the cell edge in the direction of the <b>a</b> basis vector.
   */
  public final double a;
  /**
   * Length of the cell edge in the direction of the <b>b</b> basis vector.
   */
  public final double b;
  /**
   * Length of the cell edge in the direction of the <b>c</b> basis vector.
   */
  public final double c;
  /**
   * The interaxial lattice angle between <b>b</b> and <b>c</b>.
   */
  public final double alpha;
  /**
   * The interaxial lattice angle between <b>a</b> and <b>c</b>.
   */
  public final double beta;
  /**
   * The interaxial lattice angle between <b>a</b> and <b>b</b>.
   */
  public final double gamma;
  /**
   * The space group of the crystal.
   */
  public final SpaceGroup spaceGroup;
  /**
   * The crystal unit cell volume.
   */
  public final double volume;
  /**
   * Matrix to convert from fractional to Cartesian coordinates; its rows are the real-space basis vectors.
   */
  private final double[][] Ai = new double[3][3];
  /**
   * Matrix to convert from Cartesian to fractional coordinates; its columns are the reciprocal basis vectors.
   */
  private final double[][] A;
  /**
   * The direct space metric matrix.
   */
  private final double[][] G = new double[3][3];
  /**
   * The reciprocal space metric matrix.
   */
  private final double[][] Gstar;

  /**
   * The Crystal class encapsulates the lattice parameters and space group.
   *
   * @param a     The a-axis length.
   * @param b     The b-axis length.
   * @param c     The c-axis length.
   * @param alpha The alpha angle.
   * @param beta  The beta angle.
   * @param gamma The gamma angle.
   * @param sg    The space group symbol.
   * @throws CrystalConfigurationException if the space group is unknown or the lattice
   *                                       parameters are inconsistent with it.
   */
  public Crystal(double a, double b, double c, double alpha, double beta, double gamma, String sg) {
    this(a, b, c, alpha, beta, gamma, lookup(sg));
  }

  /**
   * Constructor for a Crystal with a known SpaceGroup.
   *
   * @param a          The a-axis length.
   * @param b          The b-axis length.
   * @param c          The c-axis length.
   * @param alpha      The alpha angle.
   * @param beta       The beta angle.
   * @param gamma      The gamma angle.
   * @param spaceGroup The space group.
   */
  public Crystal(double a, double b, double c, double alpha, double beta, double gamma, SpaceGroup spaceGroup) {
    this.a = a;
    this.b = b;
    this.c = c;
    this.alpha = alpha;
    this.beta = beta;
    this.gamma = gamma;
    this.spaceGroup = Objects.requireNonNull(spaceGroup, " The space group is required.");

    if (a <= 0.0 || b <= 0.0 || c <= 0.0) {
      throw new CrystalConfigurationException(format(" Cell lengths must be positive: %s", cellString()));
    }
    if (alpha <= 0.0 || beta <= 0.0 || gamma <= 0.0 || alpha >= 180.0 || beta >= 180.0 || gamma >= 180.0) {
      throw new CrystalConfigurationException(format(" Cell angles must lie in (0, 180): %s", cellString()));
    }
    if (!spaceGroup.latticeSystem.validParameters(a, b, c, alpha, beta, gamma)) {
      throw new CrystalConfigurationException(format(
          " The lattice parameters do not satisfy the %s restrictions of space group %s:\n%s",
          spaceGroup.crystalSystem, spaceGroup.shortName, cellString()));
    }

    double cosAlpha = cos(toRadians(alpha));
    double sinBeta = sin(toRadians(beta));
    double cosBeta = cos(toRadians(beta));
    double sinGamma = sin(toRadians(gamma));
    double cosGamma = cos(toRadians(gamma));
    double betaTerm = (cosAlpha - cosBeta * cosGamma) / sinGamma;
    double gammaTermSq = sinBeta * sinBeta - betaTerm * betaTerm;
    if (gammaTermSq <= 0.0) {
      throw new CrystalConfigurationException(format(" The cell angles do not describe a valid cell: %s", cellString()));
    }
    double gammaTerm = sqrt(gammaTermSq);
    volume = sinGamma * gammaTerm * a * b * c;

    G[0][0] = a * a;
    G[0][1] = a * b * cosGamma;
    G[0][2] = a * c * cosBeta;
    G[1][0] = G[0][1];
    G[1][1] = b * b;
    G[1][2] = b * c * cosAlpha;
    G[2][0] = G[0][2];
    G[2][1] = G[1][2];
    G[2][2] = c * c;

    // Invert G to yield Gstar.
    try {
      RealMatrix m = new Array2DRowRealMatrix(G, true);
      Gstar = new LUDecomposition(m).getSolver().getInverse().getData();
    } catch (SingularMatrixException e) {
      throw new CrystalConfigurationException(format(" Singular metric tensor for cell %s", cellString()), e);
    }

    // a is the first row of A^(-1).
    Ai[0][0] = a;
    Ai[0][1] = 0.0;
    Ai[0][2] = 0.0;
    // b is the second row of A^(-1).
    Ai[1][0] = b * cosGamma;
    Ai[1][1] = b * sinGamma;
    Ai[1][2] = 0.0;
    // c is the third row of A^(-1).
    Ai[2][0] = c * cosBeta;
    Ai[2][1] = c * betaTerm;
    Ai[2][2] = c * gammaTerm;

    A = mat3Inverse(Ai);

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(toString());
    }
  }

  private static SpaceGroup lookup(String sg) {
    SpaceGroup spaceGroup = SpaceGroupDefinitions.spaceGroupFactory(sg);
    if (spaceGroup == null) {
      throw new CrystalConfigurationException(format(" Space group %s is not supported.", sg));
    }
    return spaceGroup;
  }

  /**
   * Create a Crystal from the "a", "b", "c", "alpha", "beta", "gamma" and "spacegroup" properties.
   * <p>
   * Missing b or c default to a; missing angles default to the values implied by the lattice system.
   *
   * @param properties a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @return a {@link Crystal} object.
   * @throws CrystalConfigurationException if a required property is missing or invalid.
   */
  public static Crystal checkProperties(CompositeConfiguration properties) {
    String sg = properties.getString("spacegroup", null);
    double a = properties.getDouble("a", -1.0);
    if (sg == null || a <= 0.0) {
      throw new CrystalConfigurationException(" The spacegroup and a properties are required.");
    }
    SpaceGroup spaceGroup = lookup(sg);
    double b = properties.getDouble("b", a);
    double c = properties.getDouble("c", a);
    double defaultGamma = (spaceGroup.latticeSystem == LatticeSystem.HEXAGONAL_LATTICE) ? 120.0 : 90.0;
    double alpha = properties.getDouble("alpha", 90.0);
    double beta = properties.getDouble("beta", 90.0);
    double gamma = properties.getDouble("gamma", defaultGamma);
    return new Crystal(a, b, c, alpha, beta, gamma, spaceGroup);
  }

  /**
   * The inverse resolution squared (1/d^2) of a reflection.
   *
   * @param hkl the reflection.
   * @return 1/d^2 in inverse Angstroms squared.
   */
  public double invressq(HKL hkl) {
    return hkl.quadForm(Gstar);
  }

  /**
   * The d-spacing of a reflection.
   *
   * @param hkl the reflection.
   * @return d in Angstroms.
   */
  public double res(HKL hkl) {
    return 1.0 / sqrt(invressq(hkl));
  }

  /**
   * The Cartesian reciprocal lattice vector of (h, k, l).
   *
   * @param h the h index.
   * @param k the k index.
   * @param l the l index.
   * @return g = h a* + k b* + l c* in inverse Angstroms.
   */
  public double[] reciprocalVector(int h, int k, int l) {
    return mat3Vec3(A, new double[]{h, k, l});
  }

  private String cellString() {
    return format(" a=%8.4f b=%8.4f c=%8.4f alpha=%8.4f beta=%8.4f gamma=%8.4f", a, b, c, alpha, beta, gamma);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" Unit cell: %s\n Volume: %12.3f\n%s", cellString(), volume, spaceGroup.toString());
  }
}
