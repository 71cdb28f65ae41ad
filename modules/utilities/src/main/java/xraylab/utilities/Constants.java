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

/**
 * Library class containing the physical constants used to convert tabulated atomic scattering
 * factors into optical constants.
 * <p>
 * The values are the CODATA 1998 set that the Henke atomic scattering factor tables were
 * published against. They differ from the 2019 SI defining constants in the last few digits, and
 * reference results depend on using exactly these values.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class Constants {

  // SI units: kg, m, s, C, mol
  // Our typical units: g/mol, g/cm^3, keV, eV, Angstrom, cm, degrees.

  /** Speed of light in m/s. <code>SPEED_OF_LIGHT_SI=299792458.0</code> */
  public static final double SPEED_OF_LIGHT_SI = 299792458.0;
  /** Planck constant in J*s (CODATA 1998). <code>PLANCK_CONSTANT_SI=6.626068e-34</code> */
  public static final double PLANCK_CONSTANT_SI = 6.626068e-34;
  /** Elementary charge in Coulombs (CODATA 1998). <code>ELEMENTARY_CHARGE_SI=1.60217646e-19</code> */
  public static final double ELEMENTARY_CHARGE_SI = 1.60217646e-19;
  /** Avogadro's number in 1/mol (CODATA 1998). <code>AVOGADRO=6.02214199e23</code> */
  public static final double AVOGADRO = 6.02214199e23;
  /**
   * Classical electron radius (Thomson scattering length) in meters.
   * <code>THOMSON_SCATTERING_LENGTH=2.8179403227e-15</code>
   */
  public static final double THOMSON_SCATTERING_LENGTH = 2.8179403227e-15;
  /** Constant <code>METERS_TO_ANG=1E10</code> */
  public static final double METERS_TO_ANG = 1E10;
  /** Constant <code>METERS_TO_CM=100</code> */
  public static final double METERS_TO_CM = 100.0;
  /** Constant <code>KEV_TO_EV=1000</code> */
  public static final double KEV_TO_EV = 1000.0;
  /** Constant <code>CUBIC_ANGSTROMS_PER_CUBIC_METER=1E30</code> */
  public static final double CUBIC_ANGSTROMS_PER_CUBIC_METER = 1E30;
  /** Constant <code>CUBIC_CM_PER_CUBIC_METER=1E6</code> */
  public static final double CUBIC_CM_PER_CUBIC_METER = 1E6;
  /**
   * Photon wavelength in meters times photon energy in keV. <code>
   * KEV_METERS = SPEED_OF_LIGHT_SI * PLANCK_CONSTANT_SI / ELEMENTARY_CHARGE_SI / KEV_TO_EV</code>
   */
  public static final double KEV_METERS =
      (SPEED_OF_LIGHT_SI * PLANCK_CONSTANT_SI / ELEMENTARY_CHARGE_SI) / KEV_TO_EV;

  // Library class: make the default constructor private to ensure it's never constructed.
  private Constants() {}
}
