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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import edx.utilities.BaseEDXTest;
import org.junit.Test;

/**
 * Test the batch worker pool with a stand-in pattern indexer.
 */
public class BatchIndexerTest extends BaseEDXTest {

  private static List<ObservedPattern> patterns(int n) {
    List<ObservedPattern> patterns = new ArrayList<>();
    DiffractionImage image = DiffractionImage.blank(4, 4);
    for (int i = 0; i < n; i++) {
      patterns.add(new ObservedPattern("image_" + i, image, 2.0, 2.0, Collections.singletonList(new Peak(1, 1, 1))));
    }
    return patterns;
  }

  private static ImageIndexing indexed(ObservedPattern pattern) {
    IndexingResult result = new IndexingResult(1.0, 0, 0.0, 0.0, 0.0, 2.0, 2.0, 200.0, "test");
    return new ImageIndexing(pattern.getName(), ImageIndexing.Status.INDEXED, Collections.singletonList(result));
  }

  @Test
  public void orderTest() {
    List<ObservedPattern> patterns = patterns(20);
    AtomicInteger calls = new AtomicInteger();
    BatchIndexer batchIndexer = new BatchIndexer(p -> {
      calls.incrementAndGet();
      return indexed(p);
    }, 4, null);
    Map<String, ImageIndexing> results = batchIndexer.run(patterns);
    assertEquals(20, results.size());
    assertEquals(20, calls.get());
    assertEquals(20, batchIndexer.getCompleted());
    int i = 0;
    for (String name : results.keySet()) {
      assertEquals(patterns.get(i++).getName(), name);
    }
  }

  @Test
  public void cancelAndResumeTest() {
    List<ObservedPattern> patterns = patterns(6);
    AtomicReference<BatchIndexer> reference = new AtomicReference<>();
    BatchIndexer batchIndexer = new BatchIndexer(BatchIndexerTest::indexed, 1,
        (imageIndexing, completed, total) -> reference.get().cancel());
    reference.set(batchIndexer);

    Map<String, ImageIndexing> first = batchIndexer.run(patterns);
    assertTrue(batchIndexer.isCancelled());
    assertEquals(1, first.size());
    assertTrue(first.containsKey("image_0"));

    AtomicInteger calls = new AtomicInteger();
    BatchIndexer resume = new BatchIndexer(p -> {
      calls.incrementAndGet();
      return indexed(p);
    }, 2, null);
    Map<String, ImageIndexing> all = resume.run(patterns, first);
    assertEquals(6, all.size());
    assertEquals(5, calls.get());
    assertEquals(first.get("image_0"), all.get("image_0"));
  }

  @Test
  public void failedImageTest() {
    BatchIndexer batchIndexer = new BatchIndexer(p -> {
      if (p.getName().equals("image_2")) {
        throw new IllegalStateException("Simulated failure.");
      }
      return indexed(p);
    }, 2, null);
    Map<String, ImageIndexing> results = batchIndexer.run(patterns(4));
    assertEquals(4, results.size());
    assertEquals(ImageIndexing.Status.FAILED, results.get("image_2").getStatus());
    assertEquals(ImageIndexing.Status.INDEXED, results.get("image_3").getStatus());
  }

  @Test
  public void interruptTest() throws InterruptedException {
    CountDownLatch started = new CountDownLatch(1);
    BatchIndexer batchIndexer = new BatchIndexer(p -> {
      started.countDown();
      try {
        Thread.sleep(60000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return ImageIndexing.unindexed(p.getName());
    }, 1, null);

    AtomicReference<Map<String, ImageIndexing>> results = new AtomicReference<>();
    AtomicBoolean interrupted = new AtomicBoolean(false);
    Thread runner = new Thread(() -> {
      results.set(batchIndexer.run(patterns(3)));
      interrupted.set(Thread.currentThread().isInterrupted());
    });
    runner.start();
    assertTrue(started.await(30, TimeUnit.SECONDS));
    runner.interrupt();
    runner.join(30000);

    assertFalse(runner.isAlive());
    assertTrue(interrupted.get());
    assertTrue(batchIndexer.isCancelled());
    assertTrue(results.get().size() <= 1);
  }

  @Test
  public void interruptWaitsForRunningImageTest() throws InterruptedException {
    CountDownLatch started = new CountDownLatch(1);
    BatchIndexer batchIndexer = new BatchIndexer(p -> {
      if (p.getName().equals("image_0")) {
        started.countDown();
        // Ignore interrupts for a while, like an image in the middle of scoring.
        long end = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(500);
        boolean interrupted = false;
        while (System.nanoTime() < end) {
          try {
            Thread.sleep(10);
          } catch (InterruptedException e) {
            interrupted = true;
          }
        }
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
      }
      return indexed(p);
    }, 1, null);

    AtomicReference<Map<String, ImageIndexing>> first = new AtomicReference<>();
    Thread runner = new Thread(() -> first.set(batchIndexer.run(patterns(3))));
    runner.start();
    assertTrue(started.await(30, TimeUnit.SECONDS));
    runner.interrupt();
    runner.join(60000);
    assertFalse(runner.isAlive());

    // The running image finished before run returned.
    assertEquals(1, first.get().size());
    assertTrue(first.get().containsKey("image_0"));

    List<ObservedPattern> next = Collections.singletonList(new ObservedPattern("next",
        DiffractionImage.blank(4, 4), 2.0, 2.0, Collections.singletonList(new Peak(1, 1, 1))));
    Map<String, ImageIndexing> second = batchIndexer.run(next);
    assertEquals(1, second.size());
    assertTrue(second.containsKey("next"));
  }
}
