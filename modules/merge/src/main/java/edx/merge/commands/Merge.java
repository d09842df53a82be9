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

import static java.lang.String.format;
import static org.apache.commons.io.FilenameUtils.removeExtension;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;

import edx.crystal.Crystal;
import edx.crystal.CrystalConfigurationException;
import edx.crystal.ReflectionList;
import edx.indexing.ImageIndexing;
import edx.indexing.ImageReflections;
import edx.indexing.IndexerOptions;
import edx.indexing.IndexingResult;
import edx.indexing.IndexingResultsFile;
import edx.indexing.IntensityExtractor;
import edx.indexing.LibraryParameters;
import edx.indexing.ObservedPattern;
import edx.indexing.PatternFile;
import edx.indexing.Projector;
import edx.merge.HKLWriter;
import edx.merge.MergeOptions;
import edx.merge.MergedReflectionTable;
import edx.merge.RankMerger;
import edx.utilities.EDXCommand;
import edx.utilities.LogFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * The Merge command combines the reflection rankings of indexed patterns into one HKL file.
 * <br>
 * Usage:
 * <br>
 * edx Merge [options] &lt;properties&gt; &lt;results&gt; &lt;pattern&gt; [&lt;pattern&gt; ...]
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
@Command(name = "Merge", description = " Merge indexed electron diffraction patterns by rank aggregation.")
public class Merge extends EDXCommand {

  /**
   * --topN Number of top scoring images to merge.
   */
  @Option(names = {"--topN"}, paramLabel = "0",
      description = "Merge the top scoring N images (0 merges all; overrides the top-n property).")
  private Integer topN = null;

  /**
   * -o or --output The HKL file.
   */
  @Option(names = {"-o", "--output"}, paramLabel = "<properties>.hkl", description = "The merged HKL file.")
  private String output = null;

  /**
   * The properties file, the indexing results file and the pattern files.
   */
  @Parameters(arity = "1..*", paramLabel = "files",
      description = "A properties file, an indexing results file and pattern files.")
  private List<String> filenames = null;

  private MergedReflectionTable table = null;
  private Path hklPath = null;

  /**
   * Create a Merge command.
   *
   * @param args the command line arguments.
   */
  public Merge(String[] args) {
    super(args);
  }

  /**
   * Command line entry point.
   *
   * @param args the command line arguments.
   */
  public static void main(String[] args) {
    LogFormatter.configure();
    new Merge(args).run();
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public Merge run() {
    if (!init()) {
      return this;
    }
    if (filenames == null || filenames.size() < 3) {
      logger.info(helpString());
      return this;
    }

    File propertyFile = new File(filenames.get(0));
    loadProperties(propertyFile);

    ReflectionList reflectionList;
    Projector projector;
    IndexerOptions indexerOptions;
    MergeOptions mergeOptions;
    String phase;
    try {
      Crystal crystal = Crystal.checkProperties(properties);
      phase = crystal.spaceGroup.shortName;
      LibraryParameters parameters = LibraryParameters.checkProperties(properties);
      reflectionList = new ReflectionList(crystal, parameters.resolution, properties);
      projector = new Projector(reflectionList, parameters);
      indexerOptions = IndexerOptions.checkProperties(properties);
      mergeOptions = MergeOptions.checkProperties(properties);
      if (topN != null) {
        mergeOptions = mergeOptions.withTopN(topN);
      }
    } catch (CrystalConfigurationException | IllegalArgumentException e) {
      logger.log(Level.SEVERE, format(" Invalid configuration in %s.", propertyFile), e);
      return this;
    }
    logger.info(mergeOptions.toString());

    Path resultsPath = new File(filenames.get(1)).toPath();
    Map<String, ImageIndexing> results;
    try {
      results = IndexingResultsFile.load(resultsPath);
    } catch (IOException e) {
      logger.log(Level.SEVERE, format(" Indexing results could not be read from %s.", resultsPath), e);
      return this;
    }

    IntensityExtractor extractor = new IntensityExtractor(projector, indexerOptions.sampleRadius);
    List<ImageReflections> images = new ArrayList<>();
    for (String filename : filenames.subList(2, filenames.size())) {
      File file = new File(filename);
      String name = removeExtension(file.getName());
      ImageIndexing imageIndexing = results.get(name);
      if (imageIndexing == null || !imageIndexing.isIndexed()) {
        logger.info(format(" Skipping %s: not indexed.", name));
        continue;
      }
      IndexingResult best = imageIndexing.getBest();
      if (!matchesPhase(best, phase)) {
        logger.warning(format(" Skipping %s: indexed as phase %s, not %s.", name, best.getPhase(), phase));
        continue;
      }
      try {
        ObservedPattern pattern = PatternFile.read(file);
        images.add(extractor.extract(pattern, best));
      } catch (IOException e) {
        logger.warning(format(" Pattern %s could not be read:%s", file, e.getMessage()));
      }
    }
    if (images.isEmpty()) {
      logger.warning(" No indexed patterns to merge.");
      return this;
    }

    RankMerger merger = new RankMerger(reflectionList, mergeOptions);
    table = merger.merge(images);

    String out = (output != null) ? output : removeExtension(propertyFile.getPath()) + ".hkl";
    hklPath = new File(out).toPath();
    try {
      new HKLWriter(table).write(hklPath);
    } catch (IOException e) {
      logger.log(Level.SEVERE, format(" Merged reflections could not be written to %s.", hklPath), e);
    }
    return this;
  }

  /**
   * Check that a result belongs to the configured phase. Results without a phase name are accepted.
   *
   * @param result the indexing result.
   * @param phase  the configured phase name.
   * @return true if the result can be extracted with the configured projector.
   */
  static boolean matchesPhase(IndexingResult result, String phase) {
    String resultPhase = result.getPhase();
    return resultPhase == null || resultPhase.isEmpty() || resultPhase.equals(phase);
  }

  /**
   * The merged table of the last run.
   *
   * @return the table, or null if the command did not merge.
   */
  public MergedReflectionTable getTable() {
    return table;
  }

  /**
   * The HKL file of the last run.
   *
   * @return the path, or null if the command did not merge.
   */
  public Path getHKLPath() {
    return hklPath;
  }
}
