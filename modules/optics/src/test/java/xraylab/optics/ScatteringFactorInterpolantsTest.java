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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

/**
 * Test interpolation of tabulated scattering factors.
 *
 * @author XRayLab Developers
 */
public class ScatteringFactorInterpolantsTest {

  private static final double tolerance = 1.0e-10;

  private static final ScatteringTable table = new ScatteringTable("O",
      new double[] {10.0, 100.0, 1000.0, 10000.0, 30000.0},
      new double[] {8.0001, 8.001, 8.01, 8.1, 8.3},
      new double[] {0.4999, 0.499, 0.49, 0.4, 0.2});

  @Test
  public void testLinearTable() {
    ScatteringFactorInterpolants interpolants = ScatteringFactorInterpolants.build(table);
    assertEquals("O", interpolants.getSymbol());
    assertEquals(10.0, interpolants.getMinEnergy(), 0.0);
    assertEquals(30000.0, interpolants.getMaxEnergy(), 0.0);
    for (double e : new double[] {10.0, 55.5, 100.0, 777.0, 8000.0, 12345.6, 30000.0}) {
      assertEquals(8.0 + 1.0e-5 * e, interpolants.f1(e), tolerance);
      assertEquals(0.5 - 1.0e-5 * e, interpolants.f2(e), tolerance);
    }
  }

  @Test
  public void testNoOvershoot() {
    ScatteringTable step = new ScatteringTable("Fe",
        new double[] {100.0, 200.0, 300.0, 400.0, 500.0},
        new double[] {1.0, 1.0, 5.0, 5.0, 5.0},
        new double[] {3.0, 3.0, 3.0, 2.0, 2.0});
    ScatteringFactorInterpolants interpolants = ScatteringFactorInterpolants.build(step);
    for (double e = 100.0; e <= 500.0; e += 2.5) {
      double f1 = interpolants.f1(e);
      double f2 = interpolants.f2(e);
      assertTrue(f1 >= 1.0 - tolerance && f1 <= 5.0 + tolerance);
      assertTrue(f2 >= 2.0 - tolerance && f2 <= 3.0 + tolerance);
    }
  }

  @Test
  public void testOutsideTabulatedRange() {
    ScatteringFactorInterpolants interpolants = ScatteringFactorInterpolants.build(table);
    for (double e : new double[] {9.999, 30000.001, Double.NaN}) {
      try {
        interpolants.f1(e);
        fail(" Energy " + e + " should be rejected.");
      } catch (ElementDataUnavailableException ex) {
        assertEquals("O", ex.symbol);
      }
      try {
        interpolants.f2(e);
        fail(" Energy " + e + " should be rejected.");
      } catch (ElementDataUnavailableException ex) {
        assertEquals("O", ex.symbol);
      }
    }
  }

  @Test
  public void testUnorderedEnergies() {
    ScatteringTable unordered = new ScatteringTable("N",
        new double[] {10.0, 30.0, 20.0},
        new double[] {7.0, 7.0, 7.0},
        new double[] {0.1, 0.1, 0.1});
    try {
      ScatteringFactorInterpolants.build(unordered);
      fail(" Unordered energies should be rejected.");
    } catch (ElementDataUnavailableException e) {
      assertEquals("N", e.symbol);
    }
  }
}
