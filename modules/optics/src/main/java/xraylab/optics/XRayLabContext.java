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

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.ex.ConversionException;
import xraylab.utilities.XRayLabProperties;

/**
 * Holds the atomic data and scattering table caches shared by calculations, and the batch worker
 * count.
 * <p>
 * Caches are filled lazily and may be read and filled by many threads at once. Each cache entry
 * is a pure function of its element symbol. {@link #clearCaches()} is safe between calculations;
 * calculations running while it is called may reload tables.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class XRayLabContext {

  private static final Logger logger = Logger.getLogger(XRayLabContext.class.getName());

  /** Property naming a directory of ".nff" scattering factor tables. */
  public static final String SCATTERING_FACTOR_DIR = "xraylab.sf.dir";
  /** Property giving the number of batch worker threads. */
  public static final String THREADS = "xraylab.nt";

  private final AtomicDataResolver atomicData = new AtomicDataResolver();
  private final ScatteringTableProvider tables;
  private final MaterialCalculator calculator;
  private final BatchOrchestrator orchestrator;

  /**
   * Constructor for XRayLabContext.
   *
   * @param source   where scattering factor tables are read from.
   * @param nThreads the number of batch worker threads.
   */
  public XRayLabContext(ScatteringFactorSource source, int nThreads) {
    tables = new ScatteringTableProvider(requireNonNull(source, "source"));
    calculator = new MaterialCalculator(atomicData, tables);
    orchestrator = new BatchOrchestrator(calculator, nThreads);
  }

  /**
   * Create a context from configuration properties.
   *
   * @param properties the properties.
   * @return the context.
   */
  public static XRayLabContext fromProperties(CompositeConfiguration properties) {
    String dir = properties.getString(SCATTERING_FACTOR_DIR, null);
    ScatteringFactorSource source;
    if (dir == null || dir.isBlank()) {
      source = new ClasspathScatteringFactorSource();
    } else {
      source = new DirectoryScatteringFactorSource(Paths.get(dir.trim()));
    }
    int nProcessors = Runtime.getRuntime().availableProcessors();
    int nThreads;
    try {
      nThreads = properties.getInt(THREADS, nProcessors);
    } catch (ConversionException e) {
      logger.warning(format(" Ignoring %s = %s; using %d threads.", THREADS,
          properties.getString(THREADS), nProcessors));
      nThreads = nProcessors;
    }
    if (nThreads < 1) {
      logger.warning(format(" Ignoring %s = %d; using 1 thread.", THREADS, nThreads));
      nThreads = 1;
    }
    logger.fine(format(" Scattering factors from %s, %d batch threads.", source.describe(),
        nThreads));
    return new XRayLabContext(source, nThreads);
  }

  /**
   * The process wide context, configured from {@link XRayLabProperties#loadProperties()} on first
   * use.
   *
   * @return the default context.
   */
  public static XRayLabContext getDefault() {
    return DefaultHolder.INSTANCE;
  }

  private static class DefaultHolder {

    private static final XRayLabContext INSTANCE =
        fromProperties(XRayLabProperties.loadProperties());
  }

  /**
   * Compute the optical properties of one material.
   *
   * @param formula     Chemical formula.
   * @param energy      Photon energies (keV).
   * @param massDensity Mass density (g/cm^3).
   * @return the optical properties.
   * @see MaterialCalculator#compute(String, double[], double)
   */
  public MaterialResult singleMaterial(String formula, double[] energy, double massDensity) {
    return calculator.compute(formula, energy, massDensity);
  }

  /**
   * Compute the optical properties of many materials.
   *
   * @param formulas  Chemical formulas.
   * @param energy    Photon energies (keV).
   * @param densities Mass densities (g/cm^3), one per formula.
   * @return results by formula.
   * @see BatchOrchestrator#compute(List, double[], double[])
   */
  public Map<String, MaterialResult> batch(List<String> formulas, double[] energy,
      double[] densities) {
    return orchestrator.compute(formulas, energy, densities);
  }

  /**
   * Compute the optical properties of many materials.
   *
   * @param formulas  Chemical formulas.
   * @param energy    Photon energies (keV).
   * @param densities Mass densities (g/cm^3), one per formula.
   * @return results by formula.
   */
  public Map<String, MaterialResult> batch(String[] formulas, double[] energy,
      double[] densities) {
    return batch(formulas == null ? null : Arrays.asList(formulas), energy, densities);
  }

  /** Evict the atomic data and scattering table caches. */
  public void clearCaches() {
    int nAtoms = atomicData.size();
    int nTables = tables.size();
    atomicData.clear();
    tables.clear();
    logger.info(format(" Caches cleared (%d elements, %d scattering tables).", nAtoms, nTables));
  }

  public AtomicDataResolver getAtomicDataResolver() {
    return atomicData;
  }

  public ScatteringTableProvider getScatteringTableProvider() {
    return tables;
  }

  public int getThreadCount() {
    return orchestrator.getThreadCount();
  }
}
