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

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * The parameter groups that may be varied during refinement.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum RefinementParameter {

  /**
   * Beam center x and y in pixels.
   */
  CENTER("center"),
  /**
   * The detector scale (pixels per inverse Angstrom).
   */
  SCALE("scale"),
  /**
   * The zone axis angles alpha and beta.
   */
  ZONE_AXIS("zone-axis"),
  /**
   * The in-plane rotation gamma.
   */
  IN_PLANE("in-plane");

  /**
   * The label used in property values and results files.
   */
  public final String label;

  RefinementParameter(String label) {
    this.label = label;
  }

  /**
   * Parse a '+' or ',' separated list of parameter labels (for example "zone-axis+in-plane").
   *
   * @param value the list; "-" or an empty value is the empty set.
   * @return the parameters.
   * @throws IllegalArgumentException for an unknown label.
   */
  public static EnumSet<RefinementParameter> parse(String value) {
    EnumSet<RefinementParameter> set = EnumSet.noneOf(RefinementParameter.class);
    if (StringUtils.isBlank(value) || value.trim().equals("-")) {
      return set;
    }
    for (String token : StringUtils.split(value, "+,")) {
      set.add(fromLabel(token.trim()));
    }
    return set;
  }

  /**
   * Look up a parameter by label or enum name.
   *
   * @param token the label.
   * @return the parameter.
   */
  public static RefinementParameter fromLabel(String token) {
    for (RefinementParameter parameter : values()) {
      if (parameter.label.equalsIgnoreCase(token) || parameter.name().equalsIgnoreCase(token)) {
        return parameter;
      }
    }
    throw new IllegalArgumentException(format(" Unknown refinement parameter: %s", token));
  }

  /**
   * Join parameters with '+'.
   *
   * @param parameters the parameters.
   * @return the joined labels, or "-" for the empty set.
   */
  public static String toString(Set<RefinementParameter> parameters) {
    if (parameters == null || parameters.isEmpty()) {
      return "-";
    }
    return parameters.stream().sorted().map(p -> p.label).collect(Collectors.joining("+"));
  }
}
