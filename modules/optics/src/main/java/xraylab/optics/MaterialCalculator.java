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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import xraylab.optics.CoefficientAccumulator.Contribution;

/**
 * Computes the X-ray optical properties of a single material from its chemical formula, mass
 * density and a list of photon energies.
 * <p>
 * Energies are used in the order given and are not range checked here; an energy outside an
 * element's tabulated range raises an {@link ElementDataUnavailableException}.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class MaterialCalculator {

  private static final Logger logger = Logger.getLogger(MaterialCalculator.class.getName());

  private final AtomicDataResolver atomicData;
  private final ScatteringTableProvider tables;

  public MaterialCalculator(AtomicDataResolver atomicData, ScatteringTableProvider tables) {
    this.atomicData = requireNonNull(atomicData, "atomicData");
    this.tables = requireNonNull(tables, "tables");
  }

  /**
   * Compute the optical properties of a material.
   *
   * @param formula     Chemical formula (case sensitive).
   * @param energy      Photon energies (keV).
   * @param massDensity Mass density (g/cm^3).
   * @return the optical properties.
   * @throws FormulaException                 if the formula cannot be parsed.
   * @throws ElementNotFoundException         if a symbol is not an element.
   * @throws ElementDataUnavailableException if an element has no usable scattering factors.
   */
  public MaterialResult compute(String formula, double[] energy, double massDensity) {
    requireNonNull(formula, "formula");
    requireNonNull(energy, "energy");

    List<ElementTerm> terms = FormulaParser.parse(formula);

    // Molecular weight and electrons per formula unit.
    double molecularWeight = 0.0;
    double electronCount = 0.0;
    for (ElementTerm term : terms) {
      AtomicRecord record = atomicData.resolve(term.symbol());
      molecularWeight += term.count() * record.atomicMass();
      electronCount += record.atomicNumber() * term.count();
    }

    double[] wavelength = DerivedQuantities.wavelength(energy);
    double[] energyEV = DerivedQuantities.toElectronVolts(energy);

    List<Contribution> contributions = new ArrayList<>(terms.size());
    for (ElementTerm term : terms) {
      ScatteringTable table = tables.getTable(term.symbol());
      contributions.add(new Contribution(term.count(), ScatteringFactorInterpolants.build(table)));
    }

    CoefficientAccumulator accumulator = new CoefficientAccumulator(energy.length);
    accumulator.accumulate(energyEV, wavelength, massDensity, molecularWeight, contributions);
    double[] dispersion = accumulator.getDispersion();
    double[] absorption = accumulator.getAbsorption();

    MaterialResult result = new MaterialResult(formula, molecularWeight, electronCount,
        massDensity,
        DerivedQuantities.electronDensity(massDensity, molecularWeight, electronCount),
        energy,
        DerivedQuantities.toAngstroms(wavelength),
        dispersion,
        absorption,
        accumulator.getF1(),
        accumulator.getF2(),
        DerivedQuantities.criticalAngle(dispersion),
        DerivedQuantities.attenuationLength(wavelength, absorption),
        DerivedQuantities.scatteringLengthDensity(dispersion, wavelength),
        DerivedQuantities.scatteringLengthDensity(absorption, wavelength));

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" %s: %d terms, %d energies.%s", formula, terms.size(), energy.length,
          result.toTable()));
    }
    return result;
  }
}
