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

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Reads atomic scattering factor tables (the Henke ".nff" layout).
 * <p>
 * An optional header line (for example "E(eV),f1,f2") is followed by rows of energy (eV), f1 and
 * f2 separated by commas and/or white space. Blank lines and lines beginning with '#' are skipped.
 * Extra columns are ignored.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class ScatteringTableReader {

  private static final Pattern SEPARATOR = Pattern.compile("[,\\s]+");

  private ScatteringTableReader() {}

  /**
   * Read a scattering factor table.
   *
   * @param symbol The element symbol the table belongs to.
   * @param reader The source of the table text.
   * @return the table.
   * @throws IOException                      if the text cannot be read.
   * @throws ElementDataUnavailableException if the text is not a valid table.
   */
  public static ScatteringTable read(String symbol, BufferedReader reader) throws IOException {
    int capacity = 512;
    double[] energy = new double[capacity];
    double[] f1 = new double[capacity];
    double[] f2 = new double[capacity];
    int n = 0;
    int lineNumber = 0;
    boolean headerAllowed = true;

    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      line = line.trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      String[] tokens = SEPARATOR.split(line);
      if (headerAllowed && !isNumber(tokens[0])) {
        headerAllowed = false;
        continue;
      }
      headerAllowed = false;
      if (tokens.length < 3) {
        throw new ElementDataUnavailableException(symbol,
            "line " + lineNumber + " has fewer than 3 columns");
      }
      if (n == capacity) {
        capacity *= 2;
        energy = Arrays.copyOf(energy, capacity);
        f1 = Arrays.copyOf(f1, capacity);
        f2 = Arrays.copyOf(f2, capacity);
      }
      try {
        energy[n] = Double.parseDouble(tokens[0]);
        f1[n] = Double.parseDouble(tokens[1]);
        f2[n] = Double.parseDouble(tokens[2]);
      } catch (NumberFormatException e) {
        throw new ElementDataUnavailableException(symbol,
            "line " + lineNumber + " is not numeric: " + line, e);
      }
      n++;
    }

    if (n < 2) {
      throw new ElementDataUnavailableException(symbol, "the table has " + n + " rows");
    }
    return new ScatteringTable(symbol, Arrays.copyOf(energy, n),
        Arrays.copyOf(f1, n), Arrays.copyOf(f2, n));
  }

  private static boolean isNumber(String token) {
    try {
      Double.parseDouble(token);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
