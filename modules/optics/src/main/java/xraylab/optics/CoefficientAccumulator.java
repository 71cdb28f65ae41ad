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
import static xraylab.utilities.Constants.AVOGADRO;
import static xraylab.utilities.Constants.CUBIC_CM_PER_CUBIC_METER;
import static xraylab.utilities.Constants.THOMSON_SCATTERING_LENGTH;

import java.util.List;

/**
 * Accumulates the dispersion, absorption and total scattering factors of a material over an
 * energy grid.
 * <p>
 * For each element term with count n and interpolated scattering factors f1, f2:
 * <br>
 * delta += lambda^2 * r_e * N_A * rho * n * f1 / (2 * PI * M)
 * <br>
 * beta += lambda^2 * r_e * N_A * rho * n * f2 / (2 * PI * M)
 * <br>
 * where lambda is the wavelength, r_e the Thomson scattering length, N_A Avogadro's number, rho
 * the mass density and M the molecular weight. Contributions superpose linearly, so term order
 * only affects rounding.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class CoefficientAccumulator {

  /**
   * r_e * N_A * 1e6 / (2 * PI), with the 1e6 converting g/cm^3 to g/m^3.
   * <code>SCATTERING_FACTOR = THOMSON_SCATTERING_LENGTH * AVOGADRO * 1e6 / (2 * PI)</code>
   */
  public static final double SCATTERING_FACTOR =
      THOMSON_SCATTERING_LENGTH * AVOGADRO * CUBIC_CM_PER_CUBIC_METER / (2 * PI);

  /**
   * The scattering contribution of one formula term.
   *
   * @param count   Number of atoms per formula unit.
   * @param factors Interpolated scattering factors of the element.
   */
  public record Contribution(double count, ScatteringFactorInterpolants factors) {

  }

  private final double[] dispersion;
  private final double[] absorption;
  private final double[] f1;
  private final double[] f2;

  /**
   * Constructor for CoefficientAccumulator. All sums start at zero.
   *
   * @param nEnergies the number of energies.
   */
  public CoefficientAccumulator(int nEnergies) {
    dispersion = new double[nEnergies];
    absorption = new double[nEnergies];
    f1 = new double[nEnergies];
    f2 = new double[nEnergies];
  }

  /**
   * Add the contributions of formula terms at each energy.
   *
   * @param energy          Photon energies (eV).
   * @param wavelength      Photon wavelengths (m).
   * @param massDensity     Mass density (g/cm^3).
   * @param molecularWeight Molecular weight (g/mol).
   * @param contributions   The formula terms.
   */
  public void accumulate(double[] energy, double[] wavelength, double massDensity,
      double molecularWeight, List<Contribution> contributions) {
    int nEnergies = dispersion.length;
    if (energy.length != nEnergies || wavelength.length != nEnergies) {
      throw new IllegalArgumentException(" Energy and wavelength arrays must have "
          + nEnergies + " entries.");
    }

    double commonFactor = SCATTERING_FACTOR * massDensity / molecularWeight;
    for (Contribution contribution : contributions) {
      double count = contribution.count();
      ScatteringFactorInterpolants factors = contribution.factors();
      double termFactor = commonFactor * count;
      for (int i = 0; i < nEnergies; i++) {
        double f1i = factors.f1(energy[i]);
        double f2i = factors.f2(energy[i]);
        double waveSq = wavelength[i] * wavelength[i];
        dispersion[i] += waveSq * termFactor * f1i;
        absorption[i] += waveSq * termFactor * f2i;
        f1[i] += count * f1i;
        f2[i] += count * f2i;
      }
    }
  }

  /**
   * Dispersion (delta).
   *
   * @return the dispersion array (not copied).
   */
  public double[] getDispersion() {
    return dispersion;
  }

  /**
   * Absorption (beta).
   *
   * @return the absorption array (not copied).
   */
  public double[] getAbsorption() {
    return absorption;
  }

  /**
   * Sum of count * f1 over formula terms.
   *
   * @return the f1 array (not copied).
   */
  public double[] getF1() {
    return f1;
  }

  /**
   * Sum of count * f2 over formula terms.
   *
   * @return the f2 array (not copied).
   */
  public double[] getF2() {
    return f2;
  }
}
