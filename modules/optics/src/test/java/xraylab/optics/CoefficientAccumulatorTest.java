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

import static org.apache.commons.math3.util.FastMath.PI;
import static org.junit.Assert.assertEquals;
import static xraylab.utilities.Constants.AVOGADRO;
import static xraylab.utilities.Constants.THOMSON_SCATTERING_LENGTH;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import xraylab.optics.CoefficientAccumulator.Contribution;

/**
 * Test accumulation of optical coefficients over formula terms.
 *
 * @author XRayLab Developers
 */
public class CoefficientAccumulatorTest {

  private static final double tolerance = 1.0e-9;

  private static ScatteringFactorInterpolants constant(String symbol, double f1, double f2) {
    return ScatteringFactorInterpolants.build(new ScatteringTable(symbol,
        new double[] {10.0, 30000.0}, new double[] {f1, f1}, new double[] {f2, f2}));
  }

  @Test
  public void testScatteringFactor() {
    // r_e * N_A * 1e6 / (2 PI) in m per mole per cubic centimeter.
    assertEquals(THOMSON_SCATTERING_LENGTH * AVOGADRO * 1.0e6 / (2 * PI),
        CoefficientAccumulator.SCATTERING_FACTOR, 0.0);
    assertEquals(2.7009e14, CoefficientAccumulator.SCATTERING_FACTOR, 1.0e11);
  }

  @Test
  public void testTwoTerms() {
    ScatteringFactorInterpolants a = constant("Al", 13.0, 0.5);
    ScatteringFactorInterpolants o = constant("O", 8.0, 0.25);
    List<Contribution> contributions =
        Arrays.asList(new Contribution(2.0, a), new Contribution(3.0, o));

    double[] energy = {1000.0, 8000.0};
    double[] wavelength = {1.2398e-9, 1.5498e-10};
    double density = 3.95;
    double mw = 101.96;

    CoefficientAccumulator accumulator = new CoefficientAccumulator(2);
    accumulator.accumulate(energy, wavelength, density, mw, contributions);

    double f1 = 2.0 * 13.0 + 3.0 * 8.0;
    double f2 = 2.0 * 0.5 + 3.0 * 0.25;
    for (int i = 0; i < 2; i++) {
      double scale = wavelength[i] * wavelength[i] * CoefficientAccumulator.SCATTERING_FACTOR
          * density / mw;
      assertEquals(f1, accumulator.getF1()[i], tolerance);
      assertEquals(f2, accumulator.getF2()[i], tolerance);
      assertEquals(1.0, accumulator.getDispersion()[i] / (scale * f1), tolerance);
      assertEquals(1.0, accumulator.getAbsorption()[i] / (scale * f2), tolerance);
    }
  }

  @Test
  public void testNoTerms() {
    CoefficientAccumulator accumulator = new CoefficientAccumulator(1);
    accumulator.accumulate(new double[] {100.0}, new double[] {1.0e-10}, 1.0, 1.0,
        Collections.emptyList());
    assertEquals(0.0, accumulator.getDispersion()[0], 0.0);
    assertEquals(0.0, accumulator.getF2()[0], 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLengthMismatch() {
    new CoefficientAccumulator(2).accumulate(new double[] {100.0}, new double[] {1.0e-10}, 1.0,
        1.0, Collections.emptyList());
  }
}
