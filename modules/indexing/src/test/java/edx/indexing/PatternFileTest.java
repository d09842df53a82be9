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

import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import edx.utilities.BaseEDXTest;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Read plain text pattern files.
 */
public class PatternFileTest extends BaseEDXTest {

  @Test
  public void readTest() throws IOException {
    Path dir = registerTemporaryDirectory();
    File file = dir.resolve("frame_0001.pattern").toFile();
    String text = "# A 3 x 2 test pattern\n"
        + "center 1.5 0.5\n"
        + "size 3 2\n"
        + "peak 2.0 1.0 9.5\n"
        + "0 1 2\n"
        + "3 4 5\n";
    FileUtils.writeStringToFile(file, text, StandardCharsets.UTF_8);

    ObservedPattern pattern = PatternFile.read(file);
    assertEquals("frame_0001", pattern.getName());
    assertEquals(1.5, pattern.getCenterX(), 0.0);
    assertEquals(0.5, pattern.getCenterY(), 0.0);
    assertEquals(1, pattern.getPeaks().size());
    assertEquals(9.5, pattern.getPeaks().get(0).intensity, 0.0);
    DiffractionImage image = pattern.getImage();
    assertEquals(3, image.getWidth());
    assertEquals(2, image.getHeight());
    assertEquals(2.0, image.get(2, 0), 0.0);
    assertEquals(3.0, image.get(0, 1), 0.0);
  }

  @Test(expected = IOException.class)
  public void missingPixelsTest() throws IOException {
    Path dir = registerTemporaryDirectory();
    File file = dir.resolve("short.pattern").toFile();
    FileUtils.writeStringToFile(file, "size 3 2\n0 1 2\n", StandardCharsets.UTF_8);
    PatternFile.read(file);
  }

  @Test(expected = IOException.class)
  public void badValueTest() throws IOException {
    Path dir = registerTemporaryDirectory();
    File file = dir.resolve("bad.pattern").toFile();
    FileUtils.writeStringToFile(file, "size 1 1\npeak 0 0 x\n1\n", StandardCharsets.UTF_8);
    PatternFile.read(file);
  }
}
