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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Index many patterns on a pool of worker threads.
 * <p>
 * Each image is an independent task. Results are stored as they complete, so a cancelled or
 * interrupted batch still returns every finished image, and a later run can resume by passing the
 * previous results.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class BatchIndexer {

  private static final Logger logger = Logger.getLogger(BatchIndexer.class.getName());

  /**
   * Seconds to wait for running images after an interrupt.
   */
  private static final long TERMINATION_TIMEOUT = 30;

  private final PatternIndexer indexer;
  private final int threads;
  private final IndexingListener listener;
  private final AtomicInteger completed = new AtomicInteger();
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  /**
   * Constructor for BatchIndexer.
   *
   * @param indexer  indexes (and optionally refines) one pattern.
   * @param threads  the number of worker threads (0 or less uses every available processor).
   * @param listener progress callback (may be null).
   */
  public BatchIndexer(PatternIndexer indexer, int threads, IndexingListener listener) {
    if (indexer == null) {
      throw new IllegalArgumentException(" A pattern indexer is required.");
    }
    this.indexer = indexer;
    this.threads = (threads <= 0) ? Runtime.getRuntime().availableProcessors() : threads;
    this.listener = listener;
  }

  /**
   * Index a batch of patterns.
   *
   * @param patterns the patterns (names must be unique).
   * @return the results keyed by image name, in input order.
   */
  public Map<String, ImageIndexing> run(List<ObservedPattern> patterns) {
    return run(patterns, Collections.emptyMap());
  }

  /**
   * Index a batch of patterns, skipping images that already have results.
   *
   * @param patterns the patterns (names must be unique).
   * @param previous results of an earlier run; these images are not indexed again.
   * @return the results keyed by image name, in input order.
   */
  public Map<String, ImageIndexing> run(List<ObservedPattern> patterns, Map<String, ImageIndexing> previous) {
    Map<String, ImageIndexing> results = new ConcurrentHashMap<>();
    completed.set(0);
    cancelled.set(false);

    List<ObservedPattern> todo = new ArrayList<>();
    for (ObservedPattern pattern : patterns) {
      ImageIndexing done = (previous == null) ? null : previous.get(pattern.getName());
      if (done != null) {
        results.put(pattern.getName(), done);
      } else {
        todo.add(pattern);
      }
    }
    int skipped = patterns.size() - todo.size();
    if (skipped > 0) {
      logger.info(format(" Resuming: %d of %d images already indexed.", skipped, patterns.size()));
    }

    int total = todo.size();
    long time = -System.nanoTime();
    ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(threads, total)));
    try {
      for (ObservedPattern pattern : todo) {
        executor.execute(() -> indexPattern(pattern, total, results));
      }
      executor.shutdown();
      while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
        if (logger.isLoggable(Level.FINE)) {
          logger.fine(format(" %d of %d images indexed.", completed.get(), total));
        }
      }
    } catch (InterruptedException e) {
      cancelled.set(true);
      executor.shutdownNow();
      awaitWorkers(executor);
      Thread.currentThread().interrupt();
      logger.warning(format(" Batch interrupted after %d of %d images.", completed.get(), total));
    }
    time += System.nanoTime();
    logger.info(format(" Indexed %d of %d images in %8.3f (sec) on %d threads.",
        completed.get(), total, time * 1.0e-9, threads));

    Map<String, ImageIndexing> ordered = new LinkedHashMap<>();
    for (ObservedPattern pattern : patterns) {
      ImageIndexing imageIndexing = results.get(pattern.getName());
      if (imageIndexing != null) {
        ordered.put(pattern.getName(), imageIndexing);
      }
    }
    return ordered;
  }

  /**
   * Wait a bounded time for images still running after shutdownNow.
   *
   * @param executor the stopped executor.
   */
  private static void awaitWorkers(ExecutorService executor) {
    try {
      if (!executor.awaitTermination(TERMINATION_TIMEOUT, TimeUnit.SECONDS)) {
        logger.warning(format(" Images still running after %d (sec) are not returned.", TERMINATION_TIMEOUT));
      }
    } catch (InterruptedException e) {
      logger.fine(" Interrupted while waiting for running images.");
    }
  }

  private void indexPattern(ObservedPattern pattern, int total, Map<String, ImageIndexing> results) {
    if (cancelled.get() || Thread.currentThread().isInterrupted()) {
      return;
    }
    ImageIndexing imageIndexing;
    try {
      imageIndexing = indexer.index(pattern);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, format(" Indexing image %s failed.", pattern.getName()), e);
      imageIndexing = ImageIndexing.failed(pattern.getName());
    }
    results.put(pattern.getName(), imageIndexing);
    int count = completed.incrementAndGet();
    if (listener != null) {
      listener.imageCompleted(imageIndexing, count, total);
    }
  }

  /**
   * Stop dispatching new images. Images already in progress complete and are kept.
   */
  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * The number of images completed by the current (or last) run.
   *
   * @return the completed count.
   */
  public int getCompleted() {
    return completed.get();
  }
}
