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

import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import xraylab.numerics.interpolation.MonotoneCubicInterpolator;

/**
 * Monotone cubic interpolants of f1 and f2 over an element's tabulated energy range.
 * <p>
 * Energies outside the tabulated range are rejected with an
 * {@link ElementDataUnavailableException} rather than extrapolated.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public final class ScatteringFactorInterpolants {

  private static final MonotoneCubicInterpolator interpolator = new MonotoneCubicInterpolator();

  private final String symbol;
  private final PolynomialSplineFunction f1;
  private final PolynomialSplineFunction f2;
  private final double minEnergy;
  private final double maxEnergy;

  private ScatteringFactorInterpolants(String symbol, PolynomialSplineFunction f1,
      PolynomialSplineFunction f2) {
    this.symbol = symbol;
    this.f1 = f1;
    this.f2 = f2;
    double[] knots = f1.getKnots();
    minEnergy = knots[0];
    maxEnergy = knots[knots.length - 1];
  }

  /**
   * Build interpolants for both columns of a scattering factor table.
   *
   * @param table the table.
   * @return the interpolants.
   * @throws ElementDataUnavailableException if the energies are not strictly increasing.
   */
  public static ScatteringFactorInterpolants build(ScatteringTable table) {
    double[] energy = table.getEnergy();
    try {
      return new ScatteringFactorInterpolants(table.getSymbol(),
          interpolator.interpolate(energy, table.getF1()),
          interpolator.interpolate(energy, table.getF2()));
    } catch (MathIllegalArgumentException e) {
      throw new ElementDataUnavailableException(table.getSymbol(), e.getMessage(), e);
    }
  }

  /**
   * Real part of the atomic scattering factor.
   *
   * @param energy photon energy (eV).
   * @return f1.
   */
  public double f1(double energy) {
    checkEnergy(energy);
    return f1.value(energy);
  }

  /**
   * Imaginary part of the atomic scattering factor.
   *
   * @param energy photon energy (eV).
   * @return f2.
   */
  public double f2(double energy) {
    checkEnergy(energy);
    return f2.value(energy);
  }

  private void checkEnergy(double energy) {
    if (!(energy >= minEnergy && energy <= maxEnergy)) {
      throw new ElementDataUnavailableException(symbol,
          format("%.4f eV is outside the tabulated range %.4f to %.4f eV", energy, minEnergy,
              maxEnergy));
    }
  }

  public String getSymbol() {
    return symbol;
  }

  public double getMinEnergy() {
    return minEnergy;
  }

  public double getMaxEnergy() {
    return maxEnergy;
  }
}
