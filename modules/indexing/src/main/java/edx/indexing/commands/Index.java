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

import static java.lang.String.format;
import static org.apache.commons.io.FilenameUtils.removeExtension;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

import edx.crystal.Crystal;
import edx.crystal.CrystalConfigurationException;
import edx.indexing.BatchIndexer;
import edx.indexing.ImageIndexing;
import edx.indexing.Indexer;
import edx.indexing.IndexerOptions;
import edx.indexing.IndexingResultsFile;
import edx.indexing.LibraryParameters;
import edx.indexing.ObservedPattern;
import edx.indexing.OrientationLibrary;
import edx.indexing.PatternFile;
import edx.indexing.PatternIndexer;
import edx.indexing.RefinementOptions;
import edx.indexing.Refiner;
import edx.utilities.EDXCommand;
import edx.utilities.LogFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * The Index command assigns crystal orientations to a batch of diffraction patterns.
 * <br>
 * Usage:
 * <br>
 * edx Index [options] &lt;properties&gt; &lt;pattern&gt; [&lt;pattern&gt; ...]
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
@Command(name = "Index", description = " Index electron diffraction patterns against an orientation library.")
public class Index extends EDXCommand {

  /**
   * --threads Number of worker threads.
   */
  @Option(names = {"--threads"}, paramLabel = "0", defaultValue = "0",
      description = "Number of worker threads (0 uses every available processor).")
  private int threads = 0;

  /**
   * --nsolutions Number of candidate orientations kept per image.
   */
  @Option(names = {"--nsolutions"}, paramLabel = "25",
      description = "Number of candidate orientations kept per image (overrides the nsolutions property).")
  private Integer nSolutions = null;

  /**
   * --refine Refine the best candidates.
   */
  @Option(names = {"--refine"}, defaultValue = "false",
      description = "Refine the best candidates of each image.")
  private boolean refine = false;

  /**
   * --resume Skip images already present in the results file.
   */
  @Option(names = {"--resume"}, defaultValue = "false",
      description = "Skip images already present in the results file.")
  private boolean resume = false;

  /**
   * -o or --output The results file.
   */
  @Option(names = {"-o", "--output"}, paramLabel = "<properties>.results",
      description = "The indexing results file.")
  private String output = null;

  /**
   * The properties file followed by one or more pattern files.
   */
  @Parameters(arity = "1..*", paramLabel = "files",
      description = "A properties file followed by pattern files.")
  private List<String> filenames = null;

  private Map<String, ImageIndexing> results = Collections.emptyMap();
  private Path resultsPath = null;

  /**
   * Create an Index command.
   *
   * @param args the command line arguments.
   */
  public Index(String[] args) {
    super(args);
  }

  /**
   * Command line entry point.
   *
   * @param args the command line arguments.
   */
  public static void main(String[] args) {
    LogFormatter.configure();
    new Index(args).run();
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public Index run() {
    if (!init()) {
      return this;
    }
    if (filenames == null || filenames.size() < 2) {
      logger.info(helpString());
      return this;
    }

    File propertyFile = new File(filenames.get(0));
    loadProperties(propertyFile);

    OrientationLibrary library;
    IndexerOptions options;
    RefinementOptions refinementOptions;
    try {
      Crystal crystal = Crystal.checkProperties(properties);
      LibraryParameters parameters = LibraryParameters.checkProperties(properties);
      library = OrientationLibrary.build(crystal, parameters, properties);
      options = IndexerOptions.checkProperties(properties);
      if (nSolutions != null) {
        options = options.withSolutions(nSolutions);
      }
      refinementOptions = RefinementOptions.checkProperties(properties);
    } catch (CrystalConfigurationException | IllegalArgumentException e) {
      logger.log(Level.SEVERE, format(" Invalid configuration in %s.", propertyFile), e);
      return this;
    }
    logger.info(options.toString());

    String out = (output != null) ? output : removeExtension(propertyFile.getPath()) + ".results";
    resultsPath = new File(out).toPath();
    Map<String, ImageIndexing> previous = Collections.emptyMap();
    if (resume && resultsPath.toFile().exists()) {
      try {
        previous = IndexingResultsFile.load(resultsPath);
      } catch (IOException e) {
        logger.log(Level.SEVERE, format(" Could not resume from %s.", resultsPath), e);
        return this;
      }
    }

    List<ObservedPattern> patterns = new ArrayList<>();
    Map<String, ImageIndexing> unreadable = new LinkedHashMap<>();
    for (String filename : filenames.subList(1, filenames.size())) {
      File file = new File(filename);
      try {
        patterns.add(PatternFile.read(file));
      } catch (IOException e) {
        logger.warning(format(" Pattern %s could not be read:%s", file, e.getMessage()));
        ImageIndexing failed = ImageIndexing.failed(removeExtension(file.getName()));
        unreadable.put(failed.getName(), failed);
      }
    }

    Indexer indexer = new Indexer(library, options);
    PatternIndexer patternIndexer = indexer;
    if (refine) {
      logger.info(refinementOptions.toString());
      Refiner refiner = new Refiner(indexer);
      RefinementOptions ro = refinementOptions;
      patternIndexer = pattern -> refiner.refine(pattern, indexer.index(pattern), ro);
    }

    BatchIndexer batchIndexer = new BatchIndexer(patternIndexer, threads,
        (imageIndexing, completed, total) -> logger.fine(format(" %d of %d:%s", completed, total, imageIndexing)));
    results = new LinkedHashMap<>(batchIndexer.run(patterns, previous));
    results.putAll(unreadable);
    // Keep earlier outcomes for images outside this batch.
    for (Map.Entry<String, ImageIndexing> entry : previous.entrySet()) {
      results.putIfAbsent(entry.getKey(), entry.getValue());
    }

    int indexed = 0;
    for (ImageIndexing imageIndexing : results.values()) {
      if (imageIndexing.isIndexed()) {
        indexed++;
      }
    }
    logger.info(format("\n Indexed %d of %d images.", indexed, results.size()));

    try {
      IndexingResultsFile.save(resultsPath, results.values());
    } catch (IOException e) {
      logger.log(Level.SEVERE, format(" Results could not be saved to %s.", resultsPath), e);
    }
    return this;
  }

  /**
   * The results of the last run.
   *
   * @return image outcomes keyed by name.
   */
  public Map<String, ImageIndexing> getResults() {
    return Collections.unmodifiableMap(results);
  }

  /**
   * The results file of the last run.
   *
   * @return the path, or null if the command did not run.
   */
  public Path getResultsPath() {
    return resultsPath;
  }
}
