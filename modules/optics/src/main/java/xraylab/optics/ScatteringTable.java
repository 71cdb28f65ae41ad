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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Tabulated atomic scattering factors f1 and f2 of one element as a function of photon energy.
 * Rows are kept in the order they were read. Instances are immutable.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public final class ScatteringTable {

  private final String symbol;
  private final double[] energy;
  private final double[] f1;
  private final double[] f2;

  /**
   * Constructor for ScatteringTable.
   *
   * @param symbol The element symbol.
   * @param energy Photon energies (eV).
   * @param f1     Real part of the atomic scattering factor at each energy.
   * @param f2     Imaginary part of the atomic scattering factor at each energy.
   */
  public ScatteringTable(String symbol, double[] energy, double[] f1, double[] f2) {
    this.symbol = requireNonNull(symbol, "symbol");
    requireNonNull(energy, "energy");
    requireNonNull(f1, "f1");
    requireNonNull(f2, "f2");
    if (energy.length != f1.length || energy.length != f2.length) {
      throw new IllegalArgumentException(
          format(" Column lengths differ for %s: %d energies, %d f1, %d f2.", symbol,
              energy.length, f1.length, f2.length));
    }
    this.energy = energy.clone();
    this.f1 = f1.clone();
    this.f2 = f2.clone();
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * Number of tabulated energies.
   *
   * @return the number of rows.
   */
  public int size() {
    return energy.length;
  }

  /**
   * Tabulated energies (eV).
   *
   * @return a copy of the energy column.
   */
  public double[] getEnergy() {
    return energy.clone();
  }

  /**
   * Tabulated f1.
   *
   * @return a copy of the f1 column.
   */
  public double[] getF1() {
    return f1.clone();
  }

  /**
   * Tabulated f2.
   *
   * @return a copy of the f2 column.
   */
  public double[] getF2() {
    return f2.clone();
  }

  @Override
  public String toString() {
    if (energy.length == 0) {
      return format(" Scattering table for %s (empty)", symbol);
    }
    return format(" Scattering table for %s: %d rows from %.1f to %.1f eV", symbol, energy.length,
        energy[0], energy[energy.length - 1]);
  }
}
