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

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

/**
 * X-ray optical properties of one material at a set of photon energies. All per-energy arrays
 * have the same length and order as the energies. Instances are immutable; array getters return
 * copies.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public final class MaterialResult {

  private final String formula;
  private final double molecularWeight;
  private final double electronCount;
  private final double massDensity;
  private final double electronDensity;
  private final double[] energy;
  private final double[] wavelength;
  private final double[] dispersion;
  private final double[] absorption;
  private final double[] f1;
  private final double[] f2;
  private final double[] criticalAngle;
  private final double[] attenuationLength;
  private final double[] realSLD;
  private final double[] imagSLD;

  /**
   * Constructor for MaterialResult.
   *
   * @param formula           Chemical formula.
   * @param molecularWeight   Molecular weight (g/mol).
   * @param electronCount     Electrons per formula unit.
   * @param massDensity       Mass density (g/cm^3).
   * @param electronDensity   Electron density (1/Angstrom^3).
   * @param energy            Photon energies (keV).
   * @param wavelength        Wavelengths (Angstrom).
   * @param dispersion        Dispersion (delta).
   * @param absorption        Absorption (beta).
   * @param f1                Total real scattering factor.
   * @param f2                Total imaginary scattering factor.
   * @param criticalAngle     Critical angles (degrees).
   * @param attenuationLength Attenuation lengths (cm).
   * @param realSLD           Real scattering length densities (1/Angstrom^2).
   * @param imagSLD           Imaginary scattering length densities (1/Angstrom^2).
   */
  public MaterialResult(String formula, double molecularWeight, double electronCount,
      double massDensity, double electronDensity, double[] energy, double[] wavelength,
      double[] dispersion, double[] absorption, double[] f1, double[] f2, double[] criticalAngle,
      double[] attenuationLength, double[] realSLD, double[] imagSLD) {
    this.formula = requireNonNull(formula, "formula");
    this.molecularWeight = molecularWeight;
    this.electronCount = electronCount;
    this.massDensity = massDensity;
    this.electronDensity = electronDensity;
    int n = energy.length;
    this.energy = copy(energy, n, "energy");
    this.wavelength = copy(wavelength, n, "wavelength");
    this.dispersion = copy(dispersion, n, "dispersion");
    this.absorption = copy(absorption, n, "absorption");
    this.f1 = copy(f1, n, "f1");
    this.f2 = copy(f2, n, "f2");
    this.criticalAngle = copy(criticalAngle, n, "criticalAngle");
    this.attenuationLength = copy(attenuationLength, n, "attenuationLength");
    this.realSLD = copy(realSLD, n, "realSLD");
    this.imagSLD = copy(imagSLD, n, "imagSLD");
  }

  private static double[] copy(double[] values, int n, String name) {
    if (values.length != n) {
      throw new IllegalArgumentException(
          format(" %s has %d entries but there are %d energies.", name, values.length, n));
    }
    return values.clone();
  }

  public String getFormula() {
    return formula;
  }

  /**
   * Molecular weight.
   *
   * @return g/mol.
   */
  public double getMolecularWeight() {
    return molecularWeight;
  }

  public double getElectronCount() {
    return electronCount;
  }

  /**
   * Mass density.
   *
   * @return g/cm^3.
   */
  public double getMassDensity() {
    return massDensity;
  }

  /**
   * Electron density.
   *
   * @return electrons per cubic Angstrom.
   */
  public double getElectronDensity() {
    return electronDensity;
  }

  /**
   * Number of photon energies.
   *
   * @return the length of every per-energy array.
   */
  public int size() {
    return energy.length;
  }

  /**
   * Photon energies.
   *
   * @return keV.
   */
  public double[] getEnergy() {
    return energy.clone();
  }

  /**
   * Photon wavelengths.
   *
   * @return Angstroms.
   */
  public double[] getWavelength() {
    return wavelength.clone();
  }

  public double[] getDispersion() {
    return dispersion.clone();
  }

  public double[] getAbsorption() {
    return absorption.clone();
  }

  public double[] getF1() {
    return f1.clone();
  }

  public double[] getF2() {
    return f2.clone();
  }

  /**
   * Critical angles.
   *
   * @return degrees.
   */
  public double[] getCriticalAngle() {
    return criticalAngle.clone();
  }

  /**
   * Attenuation lengths.
   *
   * @return cm.
   */
  public double[] getAttenuationLength() {
    return attenuationLength.clone();
  }

  /**
   * Real part of the scattering length density.
   *
   * @return 1/Angstrom^2.
   */
  public double[] getRealSLD() {
    return realSLD.clone();
  }

  /**
   * Imaginary part of the scattering length density.
   *
   * @return 1/Angstrom^2.
   */
  public double[] getImagSLD() {
    return imagSLD.clone();
  }

  /**
   * Format the per-energy properties as a table.
   *
   * @return the table.
   */
  public String toTable() {
    StringBuilder sb = new StringBuilder();
    sb.append(format("\n %s (MW %.4f g/mol, %.4f g/cm^3, %.5f e/A^3)\n", formula,
        molecularWeight, massDensity, electronDensity));
    sb.append(format(" %10s %10s %12s %12s %10s %10s %10s %12s\n", "E (keV)", "Lambda (A)",
        "Delta", "Beta", "f1", "f2", "Theta (deg)", "Atten (cm)"));
    for (int i = 0; i < energy.length; i++) {
      sb.append(format(" %10.4f %10.5f %12.5e %12.5e %10.4f %10.4f %10.5f %12.5e\n", energy[i],
          wavelength[i], dispersion[i], absorption[i], f1[i], f2[i], criticalAngle[i],
          attenuationLength[i]));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
        .append("formula", formula)
        .append("molecularWeight", molecularWeight)
        .append("electronCount", electronCount)
        .append("massDensity", massDensity)
        .append("electronDensity", electronDensity)
        .append("energies", energy.length)
        .toString();
  }
}
