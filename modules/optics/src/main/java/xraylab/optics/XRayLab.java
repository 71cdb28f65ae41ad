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

import java.util.List;
import java.util.Map;

/**
 * Static entry points that use the process wide {@link XRayLabContext}.
 * <p>
 * For example, for quartz and sapphire at three energies:
 * <pre>
 *   MaterialResult quartz = XRayLab.singleMaterial("SiO2", new double[] {8.0, 10.0, 12.0}, 2.2);
 *   Map&lt;String, MaterialResult&gt; results = XRayLab.batch(List.of("SiO2", "Al2O3"),
 *       new double[] {8.0, 10.0, 12.0}, new double[] {2.2, 3.95});
 * </pre>
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class XRayLab {

  private XRayLab() {}

  /**
   * Compute the optical properties of one material.
   *
   * @param formula     Chemical formula (case sensitive).
   * @param energy      Photon energies (keV).
   * @param massDensity Mass density (g/cm^3).
   * @return the optical properties.
   */
  public static MaterialResult singleMaterial(String formula, double[] energy,
      double massDensity) {
    return XRayLabContext.getDefault().singleMaterial(formula, energy, massDensity);
  }

  /**
   * Compute the optical properties of many materials in parallel.
   *
   * @param formulas  Chemical formulas.
   * @param energy    Photon energies (keV), each in [0.03, 30].
   * @param densities Mass densities (g/cm^3), one per formula.
   * @return results by formula; formulas that failed are absent.
   */
  public static Map<String, MaterialResult> batch(List<String> formulas, double[] energy,
      double[] densities) {
    return XRayLabContext.getDefault().batch(formulas, energy, densities);
  }

  /** Evict the process wide caches. */
  public static void clearCaches() {
    XRayLabContext.getDefault().clearCaches();
  }
}
