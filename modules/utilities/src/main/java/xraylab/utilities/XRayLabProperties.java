// ******************************************************************************
//
// Title:       XRayLab.
// Description: XRayLab - X-ray Optical Constants of Materials.
// Copyright:   Copyright (c) XRayLab Developers 2026.
//
// This file is part of XRayLab.
//
// XRayLab is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// XRayLab is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// XRayLab; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package xraylab.utilities;

import static java.lang.String.format;

import java.io.File;
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

/**
 * Loads XRayLab configuration properties.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class XRayLabProperties {

  private static final Logger logger = Logger.getLogger(XRayLabProperties.class.getName());

  /** Name of the environment variable that points at a system wide property file. */
  public static final String PROPERTIES_ENV = "XRAYLAB_PROPERTIES";

  /** Location of the user property file, relative to the user's home directory. */
  public static final String USER_PROPERTIES = ".xraylab" + File.separator + "xraylab.properties";

  private XRayLabProperties() {}

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   * <p>
   * 2.) User specific properties (~/.xraylab/xraylab.properties)
   * <p>
   * 3.) System wide properties (file defined by environment variable XRAYLAB_PROPERTIES)
   *
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @since 1.0
   */
  public static CompositeConfiguration loadProperties() {
    return loadProperties(new File(System.getProperty("user.home"), USER_PROPERTIES),
        System.getenv(PROPERTIES_ENV));
  }

  /**
   * Load properties from system properties, then the given user file, then the given system
   * wide file. Files that do not exist are skipped.
   *
   * @param userPropFile       The user property file (may be null).
   * @param systemPropFilename The system wide property file name (may be null).
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File userPropFile, String systemPropFilename) {

    // Command line options take precedence.
    CompositeConfiguration properties = new CompositeConfiguration();

    /*
      JVM system properties are read first.
      a.) -Dkey=value from the Java command line
      b.) System.setProperty("key","value") within Java code.
     */
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // User specific options are 2nd.
    if (userPropFile != null) {
      addPropertyFile(properties, userPropFile, "XRayLab user property file");
    }

    // System wide options are last.
    if (systemPropFilename != null) {
      addPropertyFile(properties, new File(systemPropFilename),
          "Environment variable " + PROPERTIES_ENV);
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys("xraylab");
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  private static void addPropertyFile(CompositeConfiguration properties, File propFile,
      String description) {
    if (!propFile.exists() || !propFile.canRead()) {
      return;
    }
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(description + " (" + propFile.getPath() + ").");
      properties.addConfiguration(configuration);
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", propFile.getPath());
    }
  }
}
