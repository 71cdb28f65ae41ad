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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.time.StopWatch;

/**
 * Computes the optical properties of many materials in parallel on a shared energy grid.
 * <p>
 * Arguments are validated before any work starts. The energies are sorted once and every material
 * is computed on that grid. Each (formula, density) pair is an independent task; a task that fails
 * is logged and left out of the result rather than aborting the batch. Callers can find omitted
 * formulas by comparing the result keys with the input list.
 * <p>
 * Results are merged on the calling thread in input order after all tasks finish, so if a formula
 * appears more than once the result of its last occurrence is kept.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class BatchOrchestrator {

  private static final Logger logger = Logger.getLogger(BatchOrchestrator.class.getName());

  /** Lowest supported photon energy (keV). */
  public static final double MIN_ENERGY = 0.03;
  /** Highest supported photon energy (keV). */
  public static final double MAX_ENERGY = 30.0;

  private final MaterialCalculator calculator;
  private final int nThreads;

  /**
   * Constructor for BatchOrchestrator.
   *
   * @param calculator computes each material.
   * @param nThreads   the maximum number of worker threads.
   */
  public BatchOrchestrator(MaterialCalculator calculator, int nThreads) {
    this.calculator = requireNonNull(calculator, "calculator");
    if (nThreads < 1) {
      throw new IllegalArgumentException(" The number of threads must be positive: " + nThreads);
    }
    this.nThreads = nThreads;
  }

  public int getThreadCount() {
    return nThreads;
  }

  /**
   * Compute the optical properties of each material.
   *
   * @param formulas  Chemical formulas.
   * @param energy    Photon energies (keV), each in [0.03, 30].
   * @param densities Mass density of each formula (g/cm^3).
   * @return an unmodifiable map from formula to result, in order of first appearance.
   * @throws ValidationException if a list is empty, the formula and density counts differ, or an
   *                             energy is out of range.
   */
  public Map<String, MaterialResult> compute(List<String> formulas, double[] energy,
      double[] densities) {
    validate(formulas, energy, densities);

    double[] sortedEnergy = energy.clone();
    Arrays.sort(sortedEnergy);

    int nMaterials = formulas.size();
    int poolSize = Math.min(nThreads, nMaterials);
    if (logger.isLoggable(Level.INFO)) {
      logger.info(format(" Computing %d materials at %d energies with %d threads.", nMaterials,
          sortedEnergy.length, poolSize));
    }

    StopWatch stopWatch = StopWatch.createStarted();
    ExecutorService executor = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
    List<Future<MaterialResult>> futures = new ArrayList<>(nMaterials);
    try {
      for (int i = 0; i < nMaterials; i++) {
        String formula = formulas.get(i);
        double density = densities[i];
        futures.add(executor.submit(() -> calculator.compute(formula, sortedEnergy, density)));
      }
      Map<String, MaterialResult> results = new LinkedHashMap<>();
      for (int i = 0; i < nMaterials; i++) {
        MaterialResult result = collect(formulas.get(i), futures.get(i));
        if (result != null) {
          results.put(formulas.get(i), result);
        }
      }
      stopWatch.stop();
      logger.info(format(" Computed %d of %d materials in %8.3f (sec).", results.size(),
          nMaterials, stopWatch.getNanoTime() * 1.0e-9));
      return Collections.unmodifiableMap(results);
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Wait for one material.
   *
   * @return the result, or null if the calculation failed.
   */
  private static MaterialResult collect(String formula, Future<MaterialResult> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new XRayLabException(" Interrupted while computing " + formula, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Error error) {
        throw error;
      }
      if (cause instanceof XRayLabException) {
        logger.warning(format(" Failed to process formula %s:%s", formula, cause.getMessage()));
      } else {
        logger.log(Level.WARNING, format(" Failed to process formula %s.", formula), cause);
      }
      return null;
    }
  }

  /**
   * Check the batch arguments.
   *
   * @param formulas  Chemical formulas.
   * @param energy    Photon energies (keV).
   * @param densities Mass densities.
   * @throws ValidationException if the arguments are not consistent.
   */
  public static void validate(List<String> formulas, double[] energy, double[] densities) {
    if (formulas == null || energy == null || densities == null) {
      throw new ValidationException(" Formulas, energies and densities are required.");
    }
    if (formulas.isEmpty() || energy.length == 0) {
      throw new ValidationException(" The formula list and energy list must not be empty.");
    }
    for (double e : energy) {
      if (!(e >= MIN_ENERGY && e <= MAX_ENERGY)) {
        throw new ValidationException(
            format(" Energy %s keV is out of range %.2f to %.1f keV.", e, MIN_ENERGY, MAX_ENERGY));
      }
    }
    if (formulas.size() != densities.length) {
      throw new ValidationException(
          format(" There are %d formulas but %d mass densities.", formulas.size(),
              densities.length));
    }
    for (int i = 0; i < formulas.size(); i++) {
      if (formulas.get(i) == null) {
        throw new ValidationException(format(" Formula %d is null.", i));
      }
    }
  }

  /** Named daemon worker threads. */
  private static class WorkerThreadFactory implements ThreadFactory {

    private static final AtomicInteger poolNumber = new AtomicInteger();
    private final int pool = poolNumber.incrementAndGet();
    private final AtomicInteger threadNumber = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable,
          "xraylab-batch-" + pool + "-" + threadNumber.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
