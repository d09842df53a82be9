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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Read a diffraction pattern from plain text.
 * <p>
 * Lines starting with '#' are comments. Keyword lines give the beam center ("center x y"), the
 * image size ("size nx ny") and peaks ("peak x y intensity"). All remaining tokens are the nx * ny
 * pixel values in row-major order. The image is named after the file's base name.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PatternFile {

  private static final Logger logger = Logger.getLogger(PatternFile.class.getName());

  private PatternFile() {
  }

  /**
   * Read a pattern file.
   *
   * @param file the file.
   * @return the observed pattern.
   * @throws IOException if the file cannot be read or is incomplete.
   */
  public static ObservedPattern read(File file) throws IOException {
    String name = FilenameUtils.getBaseName(file.getName());
    double centerX = Double.NaN;
    double centerY = Double.NaN;
    int nx = -1;
    int ny = -1;
    double[] pixels = null;
    int nPixels = 0;
    List<Peak> peaks = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        String[] tokens = StringUtils.split(line);
        try {
          switch (tokens[0].toLowerCase()) {
            case "center" -> {
              checkTokens(tokens, 3, file, lineNumber);
              centerX = Double.parseDouble(tokens[1]);
              centerY = Double.parseDouble(tokens[2]);
            }
            case "size" -> {
              checkTokens(tokens, 3, file, lineNumber);
              nx = Integer.parseInt(tokens[1]);
              ny = Integer.parseInt(tokens[2]);
              if (nx <= 0 || ny <= 0) {
                throw new IOException(format(" %s line %d: invalid image size.", file, lineNumber));
              }
              pixels = new double[nx * ny];
            }
            case "peak" -> {
              checkTokens(tokens, 4, file, lineNumber);
              peaks.add(new Peak(Double.parseDouble(tokens[1]), Double.parseDouble(tokens[2]),
                  Double.parseDouble(tokens[3])));
            }
            default -> {
              if (pixels == null) {
                throw new IOException(format(" %s line %d: pixel data before the image size.", file, lineNumber));
              }
              for (String token : tokens) {
                if (nPixels == pixels.length) {
                  throw new IOException(format(" %s line %d: more than %d pixel values.",
                      file, lineNumber, pixels.length));
                }
                pixels[nPixels++] = Double.parseDouble(token);
              }
            }
          }
        } catch (NumberFormatException e) {
          throw new IOException(format(" %s line %d could not be parsed: %s", file, lineNumber, line), e);
        }
      }
    }
    if (pixels == null) {
      throw new IOException(format(" %s has no image size.", file));
    }
    if (nPixels != pixels.length) {
      throw new IOException(format(" %s has %d of %d pixel values.", file, nPixels, pixels.length));
    }
    if (Double.isNaN(centerX)) {
      centerX = 0.5 * nx;
      centerY = 0.5 * ny;
      logger.fine(format(" %s has no beam center; using the image center.", file));
    }
    return new ObservedPattern(name, new DiffractionImage(nx, ny, pixels), centerX, centerY, peaks);
  }

  private static void checkTokens(String[] tokens, int n, File file, int lineNumber) throws IOException {
    if (tokens.length != n) {
      throw new IOException(format(" %s line %d: %s expects %d values.", file, lineNumber, tokens[0], n - 1));
    }
  }
}
