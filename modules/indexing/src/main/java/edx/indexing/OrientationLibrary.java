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
import static org.apache.commons.math3.util.FastMath.PI;

import java.util.logging.Logger;

import edx.crystal.Crystal;
import edx.crystal.ReflectionList;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * The OrientationLibrary holds the projected spots of a crystal over a grid of orientations.
 * <p>
 * Orientation number n corresponds to zone axis n / nGamma and in-plane rotation
 * (n % nGamma) * step. Projections are computed once per zone axis at gamma = 0 and rotated in
 * the detector plane on demand. A library is immutable once built and may be shared between threads.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class OrientationLibrary {

  private static final Logger logger = Logger.getLogger(OrientationLibrary.class.getName());

  private final Crystal crystal;
  private final LibraryParameters parameters;
  private final ReflectionList reflectionList;
  private final Projector projector;
  private final ZoneAxisGrid zoneAxisGrid;
  private final int nGamma;
  private final ProjectedSpots[] zoneSpots;

  private OrientationLibrary(Crystal crystal, LibraryParameters parameters, ReflectionList reflectionList) {
    this.crystal = crystal;
    this.parameters = parameters;
    this.reflectionList = reflectionList;
    projector = new Projector(reflectionList, parameters);
    zoneAxisGrid = ZoneAxisGrid.generate(crystal.spaceGroup.laueSystem, parameters.angularStep);
    nGamma = (int) (2.0 * PI / parameters.angularStep);
    int nZones = zoneAxisGrid.size();
    zoneSpots = new ProjectedSpots[nZones];
    for (int i = 0; i < nZones; i++) {
      zoneSpots[i] = projector.project(zoneAxisGrid.getTheta(i), zoneAxisGrid.getPhi(i), 0.0);
    }
  }

  /**
   * Build a library.
   *
   * @param crystal     the unit cell and space group.
   * @param dmin        the high resolution limit in Angstroms.
   * @param dmax        the low resolution limit in Angstroms.
   * @param thickness   the crystal thickness in Angstroms.
   * @param angularStep the grid step in radians.
   * @return the library.
   * @throws edx.crystal.CrystalConfigurationException if no reflections fall in the shell.
   * @throws IllegalArgumentException                  if the thickness or step is not positive.
   */
  public static OrientationLibrary build(Crystal crystal, double dmin, double dmax, double thickness,
      double angularStep) {
    return build(crystal, new LibraryParameters(dmin, dmax, thickness, angularStep), null);
  }

  /**
   * Build a library.
   *
   * @param crystal    the unit cell and space group.
   * @param parameters the library parameters.
   * @param properties optional properties passed to the ReflectionList (may be null).
   * @return the library.
   */
  public static OrientationLibrary build(Crystal crystal, LibraryParameters parameters,
      CompositeConfiguration properties) {
    long time = -System.nanoTime();
    ReflectionList reflectionList = new ReflectionList(crystal, parameters.resolution, properties);
    OrientationLibrary library = new OrientationLibrary(crystal, parameters, reflectionList);
    time += System.nanoTime();
    logger.info(library.toString());
    logger.info(format(" Library built in %8.3f (sec)", time * 1.0e-9));
    return library;
  }

  /**
   * The number of orientations in the library.
   *
   * @return zone axes times in-plane rotations.
   */
  public int size() {
    return zoneSpots.length * nGamma;
  }

  public int getZoneCount() {
    return zoneSpots.length;
  }

  public int getGammaCount() {
    return nGamma;
  }

  /**
   * The orientation number of a zone axis and in-plane rotation.
   *
   * @param zone       the zone axis index.
   * @param gammaIndex the in-plane rotation index.
   * @return the orientation number.
   */
  public int getOrientationNumber(int zone, int gammaIndex) {
    return zone * nGamma + gammaIndex;
  }

  /**
   * The orientation for an orientation number.
   *
   * @param number the orientation number.
   * @return the Orientation.
   */
  public Orientation getOrientation(int number) {
    checkNumber(number);
    int zone = number / nGamma;
    int g = number % nGamma;
    return new Orientation(zoneAxisGrid.getTheta(zone), zoneAxisGrid.getPhi(zone), getGamma(g));
  }

  /**
   * The in-plane rotation angle of a gamma index.
   *
   * @param gammaIndex the in-plane rotation index.
   * @return gamma in radians.
   */
  public double getGamma(int gammaIndex) {
    return gammaIndex * parameters.angularStep;
  }

  /**
   * The projected spots of an orientation.
   *
   * @param number the orientation number.
   * @return the spots.
   */
  public ProjectedSpots getSpots(int number) {
    checkNumber(number);
    return zoneSpots[number / nGamma].rotate(getGamma(number % nGamma));
  }

  /**
   * The projected spots of a zone axis at gamma = 0.
   *
   * @param zone the zone axis index.
   * @return the spots.
   */
  public ProjectedSpots getZoneSpots(int zone) {
    return zoneSpots[zone];
  }

  private void checkNumber(int number) {
    if (number < 0 || number >= size()) {
      throw new IllegalArgumentException(format(" Orientation %d is outside the library (0 to %d).", number, size() - 1));
    }
  }

  public Crystal getCrystal() {
    return crystal;
  }

  public LibraryParameters getParameters() {
    return parameters;
  }

  public ReflectionList getReflectionList() {
    return reflectionList;
  }

  public Projector getProjector() {
    return projector;
  }

  public ZoneAxisGrid getZoneAxisGrid() {
    return zoneAxisGrid;
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public String toString() {
    return format(" Orientation library for %s\n%s\n%s\n  %-22s %d\n  %-22s %d\n  %-22s %d\n  %-22s %d",
        crystal.spaceGroup.shortName, parameters, zoneAxisGrid,
        "Unique reflections", reflectionList.size(),
        "Lattice points", projector.getLatticePointCount(),
        "In-plane rotations", nGamma,
        "Orientations", size());
  }
}
