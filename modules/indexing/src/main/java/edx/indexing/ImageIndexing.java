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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The indexing outcome for one image: a status and the ranked candidate orientations.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ImageIndexing {

  /**
   * Status of an image.
   */
  public enum Status {
    /**
     * At least one candidate orientation scored above the minimum.
     */
    INDEXED,
    /**
     * No peaks, or no orientation scored above the minimum.
     */
    UNINDEXED,
    /**
     * An unexpected error occurred while processing the image.
     */
    FAILED
  }

  private final String name;
  private final Status status;
  private final List<IndexingResult> results;

  /**
   * Constructor for ImageIndexing.
   *
   * @param name    the image name.
   * @param status  the status.
   * @param results the ranked results (best first).
   */
  public ImageIndexing(String name, Status status, List<IndexingResult> results) {
    this.name = name;
    this.status = status;
    this.results = (results == null) ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(results));
  }

  /**
   * An unindexed image.
   *
   * @param name the image name.
   * @return an ImageIndexing without results.
   */
  public static ImageIndexing unindexed(String name) {
    return new ImageIndexing(name, Status.UNINDEXED, null);
  }

  /**
   * A failed image.
   *
   * @param name the image name.
   * @return an ImageIndexing without results.
   */
  public static ImageIndexing failed(String name) {
    return new ImageIndexing(name, Status.FAILED, null);
  }

  public String getName() {
    return name;
  }

  public Status getStatus() {
    return status;
  }

  public boolean isIndexed() {
    return status == Status.INDEXED;
  }

  public List<IndexingResult> getResults() {
    return results;
  }

  /**
   * The best result.
   *
   * @return the first result, or null if there are none.
   */
  public IndexingResult getBest() {
    return results.isEmpty() ? null : results.get(0);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ImageIndexing other = (ImageIndexing) o;
    return name.equals(other.name) && status == other.status && results.equals(other.results);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + status.hashCode() * 17 + results.hashCode();
  }

  @Override
  public String toString() {
    IndexingResult best = getBest();
    if (best == null) {
      return format(" %-24s %s", name, status);
    }
    return format(" %-24s %s best score %12.4f (orientation %d)", name, status, best.getScore(), best.getNumber());
  }
}
