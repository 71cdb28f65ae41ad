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
package xraylab.optics;

import static java.util.Objects.requireNonNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads scattering factor tables bundled as class path resources.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class ClasspathScatteringFactorSource implements ScatteringFactorSource {

  /** Default class path folder of the tables. */
  public static final String DEFAULT_FOLDER = "AtomicScatteringFactor";

  private final String folder;
  private final ClassLoader loader;

  /** Read tables from the default folder using this class's loader. */
  public ClasspathScatteringFactorSource() {
    this(DEFAULT_FOLDER, ClasspathScatteringFactorSource.class.getClassLoader());
  }

  /**
   * Constructor for ClasspathScatteringFactorSource.
   *
   * @param folder The resource folder, without leading or trailing '/'.
   * @param loader The class loader used to find resources.
   */
  public ClasspathScatteringFactorSource(String folder, ClassLoader loader) {
    this.folder = requireNonNull(folder, "folder");
    this.loader = requireNonNull(loader, "loader");
  }

  @Override
  public ScatteringTable load(String symbol) {
    String resource = folder + "/" + ScatteringFactorSource.fileName(symbol);
    InputStream stream = loader.getResourceAsStream(resource);
    if (stream == null) {
      throw new ElementDataUnavailableException(symbol, "no resource " + resource);
    }
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      return ScatteringTableReader.read(symbol, reader);
    } catch (IOException e) {
      throw new ElementDataUnavailableException(symbol, "error reading " + resource, e);
    }
  }

  @Override
  public String describe() {
    return "classpath:" + folder;
  }
}
