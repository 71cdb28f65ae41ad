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
import static org.apache.commons.math3.util.FastMath.sqrt;
import static xraylab.utilities.Constants.AVOGADRO;
import static xraylab.utilities.Constants.CUBIC_ANGSTROMS_PER_CUBIC_METER;
import static xraylab.utilities.Constants.CUBIC_CM_PER_CUBIC_METER;
import static xraylab.utilities.Constants.KEV_METERS;
import static xraylab.utilities.Constants.KEV_TO_EV;
import static xraylab.utilities.Constants.METERS_TO_ANG;
import static xraylab.utilities.Constants.METERS_TO_CM;

/**
 * Static methods that derive measurable quantities from the refractive index decrement.
 * <p>
 * None of the methods guard against unphysical input. A negative dispersion gives a NaN critical
 * angle and a vanishing absorption gives an infinite attenuation length.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class DerivedQuantities {

  /** Converts a scattering length density from 1/m^2 to 1/Angstrom^2, times 2 * PI. */
  private static final double SLD_FACTOR = 2 * PI / 1e20;

  private DerivedQuantities() {}

  /**
   * Photon wavelengths.
   *
   * @param energy photon energies (keV).
   * @return wavelengths (m).
   */
  public static double[] wavelength(double[] energy) {
    double[] wavelength = new double[energy.length];
    for (int i = 0; i < energy.length; i++) {
      wavelength[i] = KEV_METERS / energy[i];
    }
    return wavelength;
  }

  /**
   * Convert energies from keV to eV.
   *
   * @param energy photon energies (keV).
   * @return photon energies (eV).
   */
  public static double[] toElectronVolts(double[] energy) {
    double[] eV = new double[energy.length];
    for (int i = 0; i < energy.length; i++) {
      eV[i] = energy[i] * KEV_TO_EV;
    }
    return eV;
  }

  /**
   * Electron density.
   *
   * @param massDensity     Mass density (g/cm^3).
   * @param molecularWeight Molecular weight (g/mol).
   * @param electronCount   Electrons per formula unit.
   * @return electrons per cubic Angstrom.
   */
  public static double electronDensity(double massDensity, double molecularWeight,
      double electronCount) {
    return CUBIC_CM_PER_CUBIC_METER * massDensity / molecularWeight * AVOGADRO * electronCount
        / CUBIC_ANGSTROMS_PER_CUBIC_METER;
  }

  /**
   * Critical angle for total external reflection, sqrt(2 * delta).
   *
   * @param dispersion the dispersion (delta).
   * @return critical angles (degrees).
   */
  public static double[] criticalAngle(double[] dispersion) {
    double[] angle = new double[dispersion.length];
    for (int i = 0; i < dispersion.length; i++) {
      angle[i] = sqrt(2 * dispersion[i]) * (180 / PI);
    }
    return angle;
  }

  /**
   * The 1/e intensity attenuation length, lambda / (4 * PI * beta).
   *
   * @param wavelength wavelengths (m).
   * @param absorption the absorption (beta).
   * @return attenuation lengths (cm).
   */
  public static double[] attenuationLength(double[] wavelength, double[] absorption) {
    double[] length = new double[wavelength.length];
    for (int i = 0; i < wavelength.length; i++) {
      length[i] = wavelength[i] / absorption[i] / (4 * PI) * METERS_TO_CM;
    }
    return length;
  }

  /**
   * Scattering length density, 2 * PI * coefficient / lambda^2. Pass the dispersion for the real
   * part or the absorption for the imaginary part.
   *
   * @param coefficient dispersion or absorption.
   * @param wavelength  wavelengths (m).
   * @return scattering length densities (1/Angstrom^2).
   */
  public static double[] scatteringLengthDensity(double[] coefficient, double[] wavelength) {
    double[] sld = new double[coefficient.length];
    for (int i = 0; i < coefficient.length; i++) {
      sld[i] = coefficient[i] * SLD_FACTOR / (wavelength[i] * wavelength[i]);
    }
    return sld;
  }

  /**
   * Wavelengths converted to Angstroms.
   *
   * @param wavelength wavelengths (m).
   * @return wavelengths (Angstrom).
   */
  public static double[] toAngstroms(double[] wavelength) {
    double[] angstroms = new double[wavelength.length];
    for (int i = 0; i < wavelength.length; i++) {
      angstroms[i] = wavelength[i] * METERS_TO_ANG;
    }
    return angstroms;
  }
}
