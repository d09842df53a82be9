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

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * Loads the layered EDX configuration.
 * <p>
 * Properties are resolved in the following order (first wins):
 * <ol>
 * <li>JVM system properties (-Dkey=value).</li>
 * <li>A properties file that shares the base name of the input file.</li>
 * <li>The user file ~/.edx/edx.properties.</li>
 * <li>The file named by the EDX_PROPERTIES environment variable.</li>
 * </ol>
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class EDXProperties {

  private static final Logger logger = Logger.getLogger(EDXProperties.class.getName());

  /**
   * Name of the environment variable that points to a site-wide properties file.
   */
  public static final String ENVIRONMENT_VARIABLE = "EDX_PROPERTIES";

  private EDXProperties() {
  }

  /**
   * Load properties for the given input file.
   *
   * @param file The input file (a properties file, or a file with a sibling properties file). May be null.
   * @return The composite configuration.
   */
  public static CompositeConfiguration loadProperties(File file) {
    CompositeConfiguration properties = new CompositeConfiguration();

    // JVM system properties take precedence.
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Input specific options are 2nd.
    if (file != null) {
      File propertyFile = file;
      if (!"properties".equalsIgnoreCase(FilenameUtils.getExtension(file.getName()))) {
        String basename = FilenameUtils.removeExtension(file.getAbsolutePath());
        propertyFile = new File(basename + ".properties");
      }
      if (propertyFile.exists() && propertyFile.canRead()) {
        PropertiesConfiguration inputConfiguration = readFile(propertyFile);
        if (inputConfiguration != null) {
          inputConfiguration.setHeader("Input properties from (" + propertyFile + ").");
          properties.addConfiguration(inputConfiguration);
          try {
            properties.addProperty("propertyFile", propertyFile.getCanonicalPath());
          } catch (IOException e) {
            logger.log(Level.INFO, " Could not resolve the canonical path of {0}.", propertyFile);
            properties.addProperty("propertyFile", propertyFile.getAbsolutePath());
          }
        }
      }
    }

    // User specific options are 3rd.
    String filename = System.getProperty("user.home") + File.separator + ".edx" + File.separator + "edx.properties";
    File userPropFile = new File(filename);
    if (userPropFile.exists() && userPropFile.canRead()) {
      PropertiesConfiguration userConfiguration = readFile(userPropFile);
      if (userConfiguration != null) {
        userConfiguration.setHeader("EDX user property file (" + filename + ").");
        properties.addConfiguration(userConfiguration);
      }
    }

    // Site wide options are last.
    filename = System.getenv(ENVIRONMENT_VARIABLE);
    if (filename != null) {
      File sitePropFile = new File(filename);
      if (sitePropFile.exists() && sitePropFile.canRead()) {
        PropertiesConfiguration envConfiguration = readFile(sitePropFile);
        if (envConfiguration != null) {
          envConfiguration.setHeader("Environment variable " + ENVIRONMENT_VARIABLE + " (" + filename + ").");
          properties.addConfiguration(envConfiguration);
        }
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        if (s.startsWith("java.") || s.startsWith("sun.") || s.startsWith("os.")) {
          continue;
        }
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Read a single properties file.
   *
   * @param file The file to read.
   * @return The configuration, or null if the file could not be parsed.
   */
  private static PropertiesConfiguration readFile(File file) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(file)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", file);
      return null;
    }
  }
}
