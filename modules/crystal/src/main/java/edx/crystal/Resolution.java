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
import static org.apache.commons.math3.util.FastMath.abs;

import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The Resolution class encapsulates the resolution shell dmin &lt;= d &lt;= dmax.
 *
 * @author Timothy D. Fenn
 * @since 1.0
 */
public class Resolution {

  /**
   * The high resolution limit (smallest d-spacing) in Angstroms.
   */
  public final double dmin;
  /**
   * The low resolution limit (largest d-spacing) in Angstroms.
   */
  public final double dmax;

  /**
   * Constructor for Resolution.
   *
   * @param dmin the high resolution limit.
   * @param dmax the low resolution limit.
   * @throws CrystalConfigurationException if the shell is empty or the limits are not positive.
   */
  public Resolution(double dmin, double dmax) {
    if (!(dmin > 0.0) || !(dmax > 0.0) || dmin > dmax) {
      throw new CrystalConfigurationException(format(" Invalid resolution shell dmin=%s dmax=%s.", dmin, dmax));
    }
    this.dmin = dmin;
    this.dmax = dmax;
  }

  /**
   * Create a Resolution from the "dmin" and "dmax" properties (defaults 1.0 and 10.0 Angstroms).
   *
   * @param properties a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @return a {@link Resolution} object.
   */
  public static Resolution checkProperties(CompositeConfiguration properties) {
    double dmin = properties.getDouble("dmin", 1.0);
    double dmax = properties.getDouble("dmax", 10.0);
    return new Resolution(dmin, dmax);
  }

  /**
   * Check if a d-spacing falls in the shell.
   *
   * @param d a d-spacing in Angstroms.
   * @return true if dmin &lt;= d &lt;= dmax.
   */
  public boolean inResolutionRange(double d) {
    if (abs(d - dmin) < 1.0e-8 || abs(d - dmax) < 1.0e-8) {
      return true;
    }
    return d > dmin && d < dmax;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" Resolution shell: %6.3f - %6.3f A", dmin, dmax);
  }
}
