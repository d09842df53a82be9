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
package edx.indexing.commands;

import static org.apache.commons.math3.util.FastMath.floor;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import edx.crystal.Crystal;
import edx.indexing.ImageIndexing;
import edx.indexing.IndexingResultsFile;
import edx.indexing.OrientationLibrary;
import edx.indexing.ProjectedSpots;
import edx.utilities.BaseEDXTest;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Run the Index command on pattern files.
 */
public class IndexTest extends BaseEDXTest {

  private static final String PROPERTIES = "spacegroup = Pm-3m\n"
      + "a = 10.0\n"
      + "dmin = 1.0\n"
      + "dmax = 10.0\n"
      + "thickness = 200.0\n"
      + "angular-step = 0.05\n"
      + "pixel-size = 0.005\n"
      + "nsolutions = 5\n";

  /**
   * Write a 64 x 64 pattern with 1.0 at the spots of an orientation.
   */
  private static void writePattern(File file, OrientationLibrary library, int number) throws IOException {
    int size = 64;
    double center = 32.0;
    double[] data = new double[size * size];
    ProjectedSpots spots = library.getSpots(number);
    for (int k = 0; k < spots.size(); k++) {
      int i = (int) floor(spots.getX(k) * 200.0 + center);
      int j = (int) floor(spots.getY(k) * 200.0 + center);
      if (i >= 0 && j >= 0 && i < size && j < size) {
        data[j * size + i] = 1.0;
      }
    }
    StringBuilder sb = new StringBuilder();
    sb.append("center 32 32\nsize 64 64\npeak 40 40 1.0\n");
    for (int j = 0; j < size; j++) {
      for (int i = 0; i < size; i++) {
        sb.append(data[j * size + i]).append(i == size - 1 ? "\n" : " ");
      }
    }
    FileUtils.writeStringToFile(file, sb.toString(), StandardCharsets.UTF_8);
  }

  @Test
  public void indexTest() throws IOException {
    Path dir = registerTemporaryDirectory();
    File properties = dir.resolve("cubic.properties").toFile();
    FileUtils.writeStringToFile(properties, PROPERTIES, StandardCharsets.UTF_8);

    Crystal crystal = new Crystal(10.0, 10.0, 10.0, 90.0, 90.0, 90.0, "Pm-3m");
    OrientationLibrary library = OrientationLibrary.build(crystal, 1.0, 10.0, 200.0, 0.05);
    File pattern = dir.resolve("frame_0001.pattern").toFile();
    writePattern(pattern, library, library.getOrientationNumber(56, 17));
    File broken = dir.resolve("frame_0002.pattern").toFile();
    FileUtils.writeStringToFile(broken, "size 2 2\n1 2 3\n", StandardCharsets.UTF_8);

    String[] args = {"--threads", "2", properties.getAbsolutePath(), pattern.getAbsolutePath(),
        broken.getAbsolutePath()};
    Index index = new Index(args);
    index.run();

    Map<String, ImageIndexing> results = index.getResults();
    assertEquals(2, results.size());
    assertEquals(ImageIndexing.Status.INDEXED, results.get("frame_0001").getStatus());
    assertEquals(5, results.get("frame_0001").getResults().size());
    assertEquals(ImageIndexing.Status.FAILED, results.get("frame_0002").getStatus());

    Path saved = dir.resolve("cubic.results");
    assertEquals(saved.toAbsolutePath(), index.getResultsPath().toAbsolutePath());
    Map<String, ImageIndexing> loaded = IndexingResultsFile.load(saved);
    assertEquals(results.get("frame_0001"), loaded.get("frame_0001"));

    // Resuming keeps the saved results.
    Index resume = new Index(new String[]{"--resume", "--refine", properties.getAbsolutePath(),
        pattern.getAbsolutePath()});
    resume.run();
    assertEquals(loaded.get("frame_0001"), resume.getResults().get("frame_0001"));
    assertTrue(resume.getResults().containsKey("frame_0002"));
  }

  @Test
  public void helpTest() {
    Index index = new Index(new String[]{"-h"});
    index.run();
    assertTrue(index.getResults().isEmpty());
  }
}
