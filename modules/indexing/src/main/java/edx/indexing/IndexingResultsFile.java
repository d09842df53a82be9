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
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Read and write indexing results as comma separated text.
 * <p>
 * Each result is one record; an image without results is written as a single record with rank 0.
 * Doubles are written with {@link Double#toString(double)} so that a load reproduces them exactly.
 * A save writes a temporary file in the target directory and then moves it into place, so a
 * failed save leaves any previous file untouched.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class IndexingResultsFile {

  private static final Logger logger = Logger.getLogger(IndexingResultsFile.class.getName());

  /**
   * The header line.
   */
  public static final String HEADER =
      "image,status,rank,score,number,alpha,beta,gamma,center_x,center_y,scale,phase,refined,improved,varied,method";

  private static final int FIELDS = 16;
  private static final String NONE = "-";

  private IndexingResultsFile() {
  }

  /**
   * Save results.
   *
   * @param path    the results file.
   * @param indexed the image outcomes in the order they are written.
   * @throws IOException if the file cannot be written.
   */
  public static void save(Path path, Collection<ImageIndexing> indexed) throws IOException {
    Path target = path.toAbsolutePath();
    Path dir = target.getParent();
    Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
    try {
      try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        writer.write(HEADER);
        writer.newLine();
        for (ImageIndexing imageIndexing : indexed) {
          for (String record : records(imageIndexing)) {
            writer.write(record);
            writer.newLine();
          }
        }
      }
      try {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        logger.fine(format(" Atomic move is not supported for %s.", target));
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
    logger.info(format(" Saved results for %d images to %s.", indexed.size(), target));
  }

  private static List<String> records(ImageIndexing imageIndexing) {
    String name = checkText(imageIndexing.getName(), "image name");
    List<String> records = new ArrayList<>();
    List<IndexingResult> results = imageIndexing.getResults();
    if (results.isEmpty()) {
      StringBuilder sb = new StringBuilder(name).append(',').append(imageIndexing.getStatus()).append(",0");
      for (int i = 3; i < FIELDS; i++) {
        sb.append(',').append(NONE);
      }
      records.add(sb.toString());
      return records;
    }
    int rank = 1;
    for (IndexingResult r : results) {
      String phase = r.getPhase().isEmpty() ? NONE : checkText(r.getPhase(), "phase name");
      records.add(String.join(",", name, imageIndexing.getStatus().name(), Integer.toString(rank++),
          Double.toString(r.getScore()), Integer.toString(r.getNumber()),
          Double.toString(r.getAlpha()), Double.toString(r.getBeta()), Double.toString(r.getGamma()),
          Double.toString(r.getCenterX()), Double.toString(r.getCenterY()), Double.toString(r.getScale()),
          phase, Boolean.toString(r.isRefined()), Boolean.toString(r.isImproved()),
          RefinementParameter.toString(r.getVaried()),
          (r.getMethod() == null) ? NONE : r.getMethod().name()));
    }
    return records;
  }

  private static String checkText(String text, String what) {
    if (text.isEmpty() || text.indexOf(',') >= 0 || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
      throw new IllegalArgumentException(format(" The %s \"%s\" cannot be stored in a results file.", what, text));
    }
    return text;
  }

  /**
   * Load results.
   *
   * @param path the results file.
   * @return the image outcomes keyed by name, in file order.
   * @throws IOException if the file cannot be read or a record is corrupt.
   */
  public static Map<String, ImageIndexing> load(Path path) throws IOException {
    Map<String, ImageIndexing.Status> status = new LinkedHashMap<>();
    Map<String, List<IndexingResult>> results = new LinkedHashMap<>();
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line = reader.readLine();
      if (line == null || !line.trim().equals(HEADER)) {
        throw new IOException(format(" %s is not an indexing results file (line 1).", path));
      }
      int lineNumber = 1;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        String[] tokens = line.split(",", -1);
        if (tokens.length != FIELDS) {
          throw new IOException(format(" %s line %d has %d fields instead of %d: %s",
              path, lineNumber, tokens.length, FIELDS, line));
        }
        try {
          String name = tokens[0];
          ImageIndexing.Status s = ImageIndexing.Status.valueOf(tokens[1]);
          int rank = Integer.parseInt(tokens[2]);
          ImageIndexing.Status previous = status.putIfAbsent(name, s);
          if (previous != null && previous != s) {
            throw new IOException(format(" %s line %d: image %s has conflicting status.", path, lineNumber, name));
          }
          List<IndexingResult> list = results.computeIfAbsent(name, k -> new ArrayList<>());
          if (rank == 0) {
            continue;
          }
          if (rank != list.size() + 1) {
            throw new IOException(format(" %s line %d: expected rank %d for image %s.",
                path, lineNumber, list.size() + 1, name));
          }
          list.add(parse(tokens));
        } catch (IllegalArgumentException e) {
          throw new IOException(format(" %s line %d could not be parsed: %s", path, lineNumber, line), e);
        }
      }
    }
    Map<String, ImageIndexing> indexed = new LinkedHashMap<>();
    for (Map.Entry<String, ImageIndexing.Status> entry : status.entrySet()) {
      String name = entry.getKey();
      indexed.put(name, new ImageIndexing(name, entry.getValue(), results.get(name)));
    }
    logger.info(format(" Loaded results for %d images from %s.", indexed.size(), path));
    return indexed;
  }

  private static IndexingResult parse(String[] t) {
    String phase = t[11].equals(NONE) ? "" : t[11];
    RefinementMethod method = t[15].equals(NONE) ? null : RefinementMethod.valueOf(t[15]);
    return new IndexingResult(Double.parseDouble(t[3]), Integer.parseInt(t[4]),
        Double.parseDouble(t[5]), Double.parseDouble(t[6]), Double.parseDouble(t[7]),
        Double.parseDouble(t[8]), Double.parseDouble(t[9]), Double.parseDouble(t[10]), phase,
        parseBoolean(t[12]), parseBoolean(t[13]), RefinementParameter.parse(t[14]), method);
  }

  private static boolean parseBoolean(String value) {
    if (value.equals("true")) {
      return true;
    } else if (value.equals("false")) {
      return false;
    }
    throw new IllegalArgumentException(format(" Expected true or false: %s", value));
  }
}
