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
package edx.utilities;

import static java.lang.String.format;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Base EDX Command class.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class EDXCommand {

  /**
   * The logger for this class.
   */
  public static final Logger logger = Logger.getLogger(EDXCommand.class.getName());

  /**
   * Help output is plain text.
   */
  public final Ansi color = Ansi.OFF;

  /**
   * The array of args passed into the Command.
   */
  public String[] args;

  /**
   * Parse Result.
   */
  public ParseResult parseResult = null;

  /**
   * The layered configuration, available after {@link #loadProperties(File)}.
   */
  protected CompositeConfiguration properties;

  /**
   * -V or --version Prints the EDX version and exits.
   */
  @Option(
      names = {"-V", "--version"},
      versionHelp = true,
      defaultValue = "false",
      description = "Print the Electron Diffraction X version and exit.")
  public boolean version;

  /**
   * -h or --help Prints a help message.
   */
  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      defaultValue = "false",
      description = "Print command help and exit.")
  public boolean help;

  /**
   * Create an EDX Command using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public EDXCommand(String[] args) {
    this.args = (args == null) ? new String[0] : args;
  }

  /**
   * Default help information.
   *
   * @return String describing how to use this command.
   */
  public String helpString() {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (PrintStream printStream = new PrintStream(baos, true, StandardCharsets.UTF_8)) {
      CommandLine.usage(this, printStream, color);
    }
    return " " + baos.toString(StandardCharsets.UTF_8);
  }

  /**
   * Initialize this Command based on the specified command line arguments.
   *
   * @return boolean Returns true if the command should continue and false to exit.
   */
  public boolean init() {
    CommandLine commandLine = new CommandLine(this);
    try {
      parseResult = commandLine.parseArgs(args);
    } catch (CommandLine.UnmatchedArgumentException uae) {
      logger.warning(
          " The usual source of this exception is when long-form arguments (such as --topN) are only preceded by one dash.");
      throw uae;
    }

    // Print help info exit.
    if (help) {
      logger.info(helpString());
      return false;
    }

    if (version) {
      logger.info(format(" Electron Diffraction X %s", getClass().getPackage().getImplementationVersion()));
      return false;
    }
    return true;
  }

  /**
   * Load the layered configuration for an input file.
   *
   * @param file The input properties file.
   * @return The configuration.
   */
  protected CompositeConfiguration loadProperties(File file) {
    properties = EDXProperties.loadProperties(file);
    return properties;
  }

  /**
   * Execute this Command.
   *
   * @return The current EDXCommand.
   */
  public EDXCommand run() {
    logger.info(helpString());
    return this;
  }
}
