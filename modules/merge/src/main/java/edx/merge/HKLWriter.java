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

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

import edx.crystal.HKL;

/**
 * Write a merged table as a fixed format HKL file.
 * <p>
 * Each line holds h, k and l in 4 character fields followed by the intensity and sigma in 8
 * character fields with two decimals. Reflections are written in ascending (h, k, l) order. The
 * rank based intensities are rescaled to 100 * surrogate / n, and sigma by the same factor.
 * Numbers always use a period as the decimal separator.
 *
 * @author Timothy D. Fenn
 * @since 1.0
 */
public class HKLWriter {

  private static final Logger logger = Logger.getLogger(HKLWriter.class.getName());

  private final MergedReflectionTable table;

  /**
   * Constructor for HKLWriter.
   *
   * @param table the merged table.
   */
  public HKLWriter(MergedReflectionTable table) {
    this.table = table;
  }

  /**
   * Format one reflection.
   *
   * @param reflection the merged reflection.
   * @param n          the number of reflections in the table.
   * @return the line, without a line separator.
   */
  public static String formatReflection(MergedReflection reflection, int n) {
    HKL hkl = reflection.getHKL();
    double factor = 100.0 / n;
    return format(Locale.US, "%4d%4d%4d%8.2f%8.2f", hkl.getH(), hkl.getK(), hkl.getL(),
        reflection.getSurrogate() * factor, reflection.getSigma() * factor);
  }

  /**
   * Write the table.
   *
   * @param path the output file.
   * @throws IOException if the file cannot be written.
   */
  public void write(Path path) throws IOException {
    int n = table.size();
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      for (MergedReflection reflection : table.getCanonicalOrder()) {
        writer.write(formatReflection(reflection, n));
        writer.newLine();
      }
    }
    logger.info(format(" Wrote %d merged reflections to %s.", n, path));
  }
}
