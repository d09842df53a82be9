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
package edx.merge.commands;

import static org.apache.commons.math3.util.FastMath.floor;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import edx.crystal.Crystal;
import edx.indexing.ImageIndexing;
import edx.indexing.IndexingResult;
import edx.indexing.IndexingResultsFile;
import edx.indexing.OrientationLibrary;
import edx.indexing.ProjectedSpots;
import edx.indexing.commands.Index;
import edx.merge.MergedReflectionTable;
import edx.utilities.BaseEDXTest;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Index two patterns and merge them.
 */
public class MergeTest extends BaseEDXTest {

  private static final String PROPERTIES = "spacegroup = Pm-3m\n"
      + "a = 10.0\n"
      + "dmin = 1.0\n"
      + "dmax = 10.0\n"
      + "thickness = 200.0\n"
      + "angular-step = 0.05\n"
      + "pixel-size = 0.005\n"
      + "nsolutions = 3\n";

  private static void writePattern(File file, OrientationLibrary library, int number) throws IOException {
    int size = 64;
    double center = 32.0;
    double[] data = new double[size * size];
    ProjectedSpots spots = library.getSpots(number);
    for (int k = 0; k < spots.size(); k++) {
      int i = (int) floor(spots.getX(k) * 200.0 + center);
      int j = (int) floor(spots.getY(k) * 200.0 + center);
      if (i >= 0 && j >= 0 && i < size && j < size) {
        data[j * size + i] = 1.0 + k % 3;
      }
    }
    StringBuilder sb = new StringBuilder("# Synthetic pattern\ncenter 32 32\nsize 64 64\npeak 40 40 1.0\n");
    for (int j = 0; j < size; j++) {
      for (int i = 0; i < size; i++) {
        sb.append(data[j * size + i]).append(i == size - 1 ? "\n" : " ");
      }
    }
    FileUtils.writeStringToFile(file, sb.toString(), StandardCharsets.UTF_8);
  }

  @Test
  public void mergeTest() throws IOException {
    Path dir = registerTemporaryDirectory();
    File properties = dir.resolve("cubic.properties").toFile();
    FileUtils.writeStringToFile(properties, PROPERTIES, StandardCharsets.UTF_8);

    Crystal crystal = new Crystal(10.0, 10.0, 10.0, 90.0, 90.0, 90.0, "Pm-3m");
    OrientationLibrary library = OrientationLibrary.build(crystal, 1.0, 10.0, 200.0, 0.05);
    File first = dir.resolve("frame_0001.pattern").toFile();
    writePattern(first, library, library.getOrientationNumber(56, 17));
    File second = dir.resolve("frame_0002.pattern").toFile();
    writePattern(second, library, library.getOrientationNumber(0, 3));

    Index index = new Index(new String[]{"--threads", "1", properties.getAbsolutePath(),
        first.getAbsolutePath(), second.getAbsolutePath()});
    index.run();
    Path results = index.getResultsPath();
    assertNotNull(results);

    Path hkl = dir.resolve("merged.hkl");
    Merge merge = new Merge(new String[]{"-o", hkl.toString(), properties.getAbsolutePath(),
        results.toString(), first.getAbsolutePath(), second.getAbsolutePath()});
    merge.run();

    MergedReflectionTable table = merge.getTable();
    assertNotNull(table);
    assertTrue(table.size() > 0);
    // Two images are below the default minimum of three.
    assertTrue(table.isLowConfidence());
    assertEquals(hkl, merge.getHKLPath());
    List<String> lines = Files.readAllLines(hkl, StandardCharsets.UTF_8);
    assertEquals(table.size(), lines.size());
    for (String line : lines) {
      assertEquals(28, line.length());
    }
  }

  @Test
  public void missingResultsTest() throws IOException {
    Path dir = registerTemporaryDirectory();
    File properties = dir.resolve("cubic.properties").toFile();
    FileUtils.writeStringToFile(properties, PROPERTIES, StandardCharsets.UTF_8);
    Merge merge = new Merge(new String[]{properties.getAbsolutePath(),
        dir.resolve("missing.results").toString(), dir.resolve("frame.pattern").toString()});
    merge.run();
    assertNull(merge.getTable());
    assertNull(merge.getHKLPath());
  }

  @Test
  public void otherPhaseTest() throws IOException {
    Path dir = registerTemporaryDirectory();
    File properties = dir.resolve("cubic.properties").toFile();
    FileUtils.writeStringToFile(properties, PROPERTIES, StandardCharsets.UTF_8);

    Crystal crystal = new Crystal(10.0, 10.0, 10.0, 90.0, 90.0, 90.0, "Pm-3m");
    OrientationLibrary library = OrientationLibrary.build(crystal, 1.0, 10.0, 200.0, 0.05);
    File first = dir.resolve("frame_0001.pattern").toFile();
    writePattern(first, library, library.getOrientationNumber(56, 17));
    File second = dir.resolve("frame_0002.pattern").toFile();
    writePattern(second, library, library.getOrientationNumber(0, 3));

    Index index = new Index(new String[]{"--threads", "1", properties.getAbsolutePath(),
        first.getAbsolutePath(), second.getAbsolutePath()});
    index.run();
    Map<String, ImageIndexing> indexed = IndexingResultsFile.load(index.getResultsPath());
    assertTrue(indexed.get("frame_0002").isIndexed());

    // Relabel the second image as indexed against another phase.
    List<IndexingResult> relabeled = new ArrayList<>();
    for (IndexingResult r : indexed.get("frame_0002").getResults()) {
      relabeled.add(new IndexingResult(r.getScore(), r.getNumber(), r.getAlpha(), r.getBeta(), r.getGamma(),
          r.getCenterX(), r.getCenterY(), r.getScale(), "Fm-3m"));
    }
    indexed.put("frame_0002", new ImageIndexing("frame_0002", ImageIndexing.Status.INDEXED, relabeled));
    Path results = dir.resolve("phases.results");
    IndexingResultsFile.save(results, indexed.values());

    Merge merge = new Merge(new String[]{"-o", dir.resolve("merged.hkl").toString(),
        properties.getAbsolutePath(), results.toString(), first.getAbsolutePath(), second.getAbsolutePath()});
    merge.run();
    MergedReflectionTable table = merge.getTable();
    assertNotNull(table);
    assertEquals(1, table.getStatistics().getImageCount());

    IndexingResult unnamed = new IndexingResult(1.0, 0, 0.0, 0.0, 0.0, 32.0, 32.0, 200.0, "");
    assertTrue(Merge.matchesPhase(unnamed, "Pm-3m"));
    assertTrue(Merge.matchesPhase(indexed.get("frame_0001").getBest(), "Pm-3m"));
    assertFalse(Merge.matchesPhase(relabeled.get(0), "Pm-3m"));
  }
}
