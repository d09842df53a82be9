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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The orientation, beam center and scale that explain one image, with its score.
 * <p>
 * Instances are immutable; refinement and phase scaling return new results.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class IndexingResult {

  private final double score;
  private final int number;
  private final double alpha;
  private final double beta;
  private final double gamma;
  private final double centerX;
  private final double centerY;
  private final double scale;
  private final String phase;
  private final boolean refined;
  private final boolean improved;
  private final Set<RefinementParameter> varied;
  private final RefinementMethod method;

  /**
   * Constructor for an unrefined IndexingResult.
   *
   * @param score   the score.
   * @param number  the library orientation number.
   * @param alpha   the zone axis polar angle.
   * @param beta    the zone axis azimuth.
   * @param gamma   the in-plane rotation.
   * @param centerX the beam center column.
   * @param centerY the beam center row.
   * @param scale   pixels per inverse Angstrom.
   * @param phase   the phase name.
   */
  public IndexingResult(double score, int number, double alpha, double beta, double gamma,
      double centerX, double centerY, double scale, String phase) {
    this(score, number, alpha, beta, gamma, centerX, centerY, scale, phase, false, false, null, null);
  }

  /**
   * Constructor for IndexingResult.
   *
   * @param score    the score.
   * @param number   the library orientation number.
   * @param alpha    the zone axis polar angle.
   * @param beta     the zone axis azimuth.
   * @param gamma    the in-plane rotation.
   * @param centerX  the beam center column.
   * @param centerY  the beam center row.
   * @param scale    pixels per inverse Angstrom.
   * @param phase    the phase name.
   * @param refined  true if refinement was attempted.
   * @param improved true if refinement improved the score.
   * @param varied   the varied parameter groups (may be null).
   * @param method   the refinement method (may be null).
   */
  public IndexingResult(double score, int number, double alpha, double beta, double gamma,
      double centerX, double centerY, double scale, String phase,
      boolean refined, boolean improved, Set<RefinementParameter> varied,
      RefinementMethod method) {
    this.score = score;
    this.number = number;
    this.alpha = alpha;
    this.beta = beta;
    this.gamma = gamma;
    this.centerX = centerX;
    this.centerY = centerY;
    this.scale = scale;
    this.phase = (phase == null) ? "" : phase;
    this.refined = refined;
    this.improved = improved;
    EnumSet<RefinementParameter> set = EnumSet.noneOf(RefinementParameter.class);
    if (varied != null) {
      set.addAll(varied);
    }
    this.varied = Collections.unmodifiableSet(set);
    this.method = method;
  }

  /**
   * A copy of this result with the refinement bookkeeping set and the original parameters kept.
   *
   * @param parameters the varied parameter groups.
   * @param refinementMethod the method.
   * @return a new IndexingResult with refined = true and improved = false.
   */
  public IndexingResult notImproved(Set<RefinementParameter> parameters, RefinementMethod refinementMethod) {
    return new IndexingResult(score, number, alpha, beta, gamma, centerX, centerY, scale, phase,
        true, false, parameters, refinementMethod);
  }

  public double getScore() {
    return score;
  }

  public int getNumber() {
    return number;
  }

  public double getAlpha() {
    return alpha;
  }

  public double getBeta() {
    return beta;
  }

  public double getGamma() {
    return gamma;
  }

  public double getCenterX() {
    return centerX;
  }

  public double getCenterY() {
    return centerY;
  }

  public double getScale() {
    return scale;
  }

  public String getPhase() {
    return phase;
  }

  public boolean isRefined() {
    return refined;
  }

  public boolean isImproved() {
    return improved;
  }

  public Set<RefinementParameter> getVaried() {
    return varied;
  }

  /**
   * The refinement method.
   *
   * @return the method, or null if the result was not refined.
   */
  public RefinementMethod getMethod() {
    return method;
  }

  public Orientation getOrientation() {
    return new Orientation(alpha, beta, gamma);
  }

  /**
   * {@inheritDoc}
   * <p>
   * Doubles are compared bit for bit.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    IndexingResult other = (IndexingResult) o;
    return Double.compare(score, other.score) == 0
        && number == other.number
        && Double.compare(alpha, other.alpha) == 0
        && Double.compare(beta, other.beta) == 0
        && Double.compare(gamma, other.gamma) == 0
        && Double.compare(centerX, other.centerX) == 0
        && Double.compare(centerY, other.centerY) == 0
        && Double.compare(scale, other.scale) == 0
        && phase.equals(other.phase)
        && refined == other.refined
        && improved == other.improved
        && varied.equals(other.varied)
        && method == other.method;
  }

  @Override
  public int hashCode() {
    return Objects.hash(score, number, alpha, beta, gamma, centerX, centerY, scale, phase, refined,
        improved, varied, method);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" %12.4f %8d %8.5f %8.5f %8.5f %8.2f %8.2f %10.3f %s",
        score, number, alpha, beta, gamma, centerX, centerY, scale, phase));
    if (refined) {
      sb.append(format(" refined (%s, %s, %s)", RefinementParameter.toString(varied), method,
          improved ? "improved" : "not improved"));
    }
    return sb.toString();
  }
}
