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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.sqrt;

import edx.crystal.Resolution;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * Parameters that control how an {@link OrientationLibrary} is generated.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LibraryParameters {

  /**
   * Default crystal thickness in Angstroms.
   */
  public static final double DEFAULT_THICKNESS = 400.0;
  /**
   * Default angular step of the orientation grid in radians.
   */
  public static final double DEFAULT_ANGULAR_STEP = 0.03;
  /**
   * Default accelerating voltage in kV.
   */
  public static final double DEFAULT_VOLTAGE = 200.0;

  /**
   * The resolution shell of the reflections that are projected.
   */
  public final Resolution resolution;
  /**
   * Crystal thickness in Angstroms; the excitation error cutoff is 1 / thickness.
   */
  public final double thickness;
  /**
   * Angular step of the zone axis and in-plane grids in radians.
   */
  public final double angularStep;
  /**
   * Accelerating voltage in kV.
   */
  public final double voltage;

  /**
   * Constructor for LibraryParameters.
   *
   * @param resolution  the resolution shell.
   * @param thickness   the crystal thickness in Angstroms.
   * @param angularStep the grid step in radians.
   * @param voltage     the accelerating voltage in kV.
   * @throws IllegalArgumentException if the thickness, step or voltage is not positive.
   */
  public LibraryParameters(Resolution resolution, double thickness, double angularStep, double voltage) {
    if (resolution == null) {
      throw new IllegalArgumentException(" A resolution shell is required.");
    }
    if (!(thickness > 0.0)) {
      throw new IllegalArgumentException(format(" The thickness must be positive: %s", thickness));
    }
    if (!(angularStep > 0.0)) {
      throw new IllegalArgumentException(format(" The angular step must be positive: %s", angularStep));
    }
    if (!(voltage > 0.0)) {
      throw new IllegalArgumentException(format(" The voltage must be positive: %s", voltage));
    }
    this.resolution = resolution;
    this.thickness = thickness;
    this.angularStep = angularStep;
    this.voltage = voltage;
  }

  /**
   * Constructor for LibraryParameters at the default voltage.
   *
   * @param dmin        the high resolution limit.
   * @param dmax        the low resolution limit.
   * @param thickness   the crystal thickness in Angstroms.
   * @param angularStep the grid step in radians.
   */
  public LibraryParameters(double dmin, double dmax, double thickness, double angularStep) {
    this(new Resolution(dmin, dmax), thickness, angularStep, DEFAULT_VOLTAGE);
  }

  /**
   * Read the "dmin", "dmax", "thickness", "angular-step" and "voltage" properties.
   *
   * @param properties a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @return a {@link LibraryParameters} object.
   */
  public static LibraryParameters checkProperties(CompositeConfiguration properties) {
    Resolution resolution = Resolution.checkProperties(properties);
    double thickness = properties.getDouble("thickness", DEFAULT_THICKNESS);
    double angularStep = properties.getDouble("angular-step", DEFAULT_ANGULAR_STEP);
    double voltage = properties.getDouble("voltage", DEFAULT_VOLTAGE);
    return new LibraryParameters(resolution, thickness, angularStep, voltage);
  }

  /**
   * The relativistic electron wavelength.
   *
   * @param kiloVolts the accelerating voltage in kV.
   * @return the wavelength in Angstroms.
   */
  public static double electronWavelength(double kiloVolts) {
    double v = kiloVolts * 1000.0;
    return 12.264259 / sqrt(v * (1.0 + 0.978476e-6 * v));
  }

  /**
   * The electron wavelength at this voltage.
   *
   * @return the wavelength in Angstroms.
   */
  public double getWavelength() {
    return electronWavelength(voltage);
  }

  /**
   * The excitation error cutoff.
   *
   * @return 1 / thickness in inverse Angstroms.
   */
  public double getMaxExcitationError() {
    return 1.0 / thickness;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" Library parameters:\n  %-22s %s\n  %-22s %8.1f A\n  %-22s %8.4f rad\n  %-22s %8.1f kV (%7.5f A)",
        "Resolution", resolution, "Thickness", thickness, "Angular step", angularStep,
        "Voltage", voltage, getWavelength());
  }
}
