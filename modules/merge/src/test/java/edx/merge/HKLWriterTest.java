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

import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import edx.crystal.Crystal;
import edx.crystal.ReflectionList;
import edx.crystal.Resolution;
import edx.indexing.ImageReflections;
import edx.utilities.BaseEDXTest;
import org.junit.Test;

/**
 * Test the fixed format HKL output.
 */
public class HKLWriterTest extends BaseEDXTest {

  private static MergedReflectionTable table() {
    Crystal crystal = new Crystal(10.0, 10.0, 10.0, 90.0, 90.0, 90.0, "Pm-3m");
    ReflectionList reflectionList = new ReflectionList(crystal, new Resolution(2.0, 10.0));
    int[][] hkl = {{1, 1, 1}, {1, 1, 0}, {1, 0, 0}};
    List<ImageReflections> images = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      images.add(new ImageReflections("img" + i, 1.0, hkl, new double[]{1.0, 2.0, 3.0}));
    }
    return new RankMerger(reflectionList, new MergeOptions()).merge(images, 0);
  }

  @Test
  public void formatTest() {
    MergedReflectionTable table = table();
    String line = HKLWriter.formatReflection(table.get(1, 0, 0), table.size());
    assertEquals("   1   0   0  100.00   50.00", line);
    assertEquals(28, line.length());
  }

  @Test
  public void writeTest() throws IOException {
    Path dir = registerTemporaryDirectory();
    Path path = dir.resolve("merged.hkl");
    new HKLWriter(table()).write(path);
    List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertEquals("   1   0   0  100.00   50.00", lines.get(0));
    assertEquals("   1   1   0   66.67   33.33", lines.get(1));
    assertEquals("   1   1   1   33.33   16.67", lines.get(2));
  }

  @Test
  public void commaDecimalLocaleTest() {
    Locale defaultLocale = Locale.getDefault();
    try {
      Locale.setDefault(Locale.GERMANY);
      MergedReflectionTable table = table();
      String line = HKLWriter.formatReflection(table.get(1, 1, 0), table.size());
      assertEquals("   1   1   0   66.67   33.33", line);
      assertEquals(-1, line.indexOf(','));
    } finally {
      Locale.setDefault(defaultLocale);
    }
  }
}
