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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and caches scattering factor tables by element symbol. A table is loaded at most once
 * until {@link #clear()} is called; concurrent requests for the same symbol wait for that load.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class ScatteringTableProvider {

  private static final Logger logger = Logger.getLogger(ScatteringTableProvider.class.getName());

  private final ScatteringFactorSource source;
  private final Map<String, ScatteringTable> cache = new ConcurrentHashMap<>();

  public ScatteringTableProvider(ScatteringFactorSource source) {
    this.source = requireNonNull(source, "source");
  }

  /**
   * Get the scattering factor table of an element.
   *
   * @param symbol the element symbol.
   * @return the table.
   * @throws ElementDataUnavailableException if the table cannot be loaded.
   */
  public ScatteringTable getTable(String symbol) {
    requireNonNull(symbol, "symbol");
    ScatteringTable table = cache.get(symbol);
    if (table != null) {
      return table;
    }
    return cache.computeIfAbsent(symbol, this::load);
  }

  private ScatteringTable load(String symbol) {
    ScatteringTable table = source.load(symbol);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format("%s (from %s)", table, source.describe()));
    }
    return table;
  }

  public ScatteringFactorSource getSource() {
    return source;
  }

  /**
   * Number of cached tables.
   *
   * @return the cache size.
   */
  public int size() {
    return cache.size();
  }

  /** Evict all cached tables. */
  public void clear() {
    cache.clear();
  }
}
