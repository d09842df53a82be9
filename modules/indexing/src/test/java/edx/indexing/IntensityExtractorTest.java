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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import edx.crystal.ReflectionList;
import edx.utilities.BaseEDXTest;
import org.junit.Test;

/**
 * Read intensities at an indexed orientation.
 */
public class IntensityExtractorTest extends BaseEDXTest {

  @Test
  public void extractTest() {
    OrientationLibrary library = SyntheticPatterns.cubicLibrary();
    int number = SyntheticPatterns.trueOrientation();
    DiffractionImage image = SyntheticPatterns.image(library, number);
    ObservedPattern pattern = SyntheticPatterns.pattern("synthetic", image);
    Indexer indexer = new Indexer(library, new IndexerOptions(SyntheticPatterns.PIXEL_SIZE));
    IndexingResult best = indexer.index(pattern).getBest();

    ImageReflections reflections = new IntensityExtractor(library.getProjector(), 0).extract(pattern, best);
    assertEquals("synthetic", reflections.getName());
    assertEquals(best.getScore(), reflections.getScore(), 0.0);
    assertTrue(reflections.size() >= 10);
    ReflectionList reflectionList = library.getReflectionList();
    int bright = 0;
    for (int i = 0; i < reflections.size(); i++) {
      int[] hkl = reflections.getHKL(i);
      assertNotNull(reflectionList.findSymHKL(hkl[0], hkl[1], hkl[2]));
      if (reflections.getIntensity(i) == 1.0) {
        bright++;
      }
    }
    // Every projected spot was drawn into the image.
    assertEquals(reflections.size(), bright);
  }
}
