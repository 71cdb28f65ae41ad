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

import static org.junit.Assert.assertEquals;
import static org.junit.Assume.assumeTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;

/**
 * Compare against reference optical constants computed from the Henke scattering factor tables.
 * <p>
 * The tables are not distributed with XRayLab; set <code>-Dxraylab.sf.dir</code> to a directory
 * containing h.nff, o.nff and si.nff to run these tests.
 *
 * @author XRayLab Developers
 */
public class HenkeReferenceTest extends XRayLabTest {

  private static final double tolerance = 1.0e-6;

  private XRayLabContext context;

  @Before
  public void before() {
    String dir = System.getProperty(XRayLabContext.SCATTERING_FACTOR_DIR);
    assumeTrue(" Henke tables are not configured.", dir != null && !dir.isBlank());
    Path path = Paths.get(dir.trim());
    for (String symbol : new String[] {"H", "O", "Si"}) {
      assumeTrue(Files.isReadable(path.resolve(ScatteringFactorSource.fileName(symbol))));
    }
    context = new XRayLabContext(new DirectoryScatteringFactorSource(path), 2);
  }

  private static void assertClose(double expected, double actual) {
    assertEquals(expected, actual, Math.abs(expected) * tolerance);
  }

  @Test
  public void testSilicaAndWater() {
    double[] energy = {5.0, 6.0, 7.0, 8.0, 9.0, 10.0};
    Map<String, MaterialResult> results =
        context.batch(Arrays.asList("SiO2", "H2O"), energy, new double[] {2.2, 1.0});
    assertEquals(2, results.size());

    MaterialResult silica = results.get("SiO2");
    assertClose(9.451484792575434e-6, silica.getDispersion()[2]);
    assertClose(5.69919201789506e-06, silica.getDispersion()[4]);
    assertClose(30.641090313037314, silica.getF1()[0]);
    assertClose(30.46419063207884, silica.getF1()[2]);
    assertClose(30.366953850108544, silica.getF1()[4]);
    assertClose(1.8929689855615698e-5, silica.getRealSLD()[2]);
    assertClose(1.886926933936152e-5, silica.getRealSLD()[4]);

    MaterialResult water = results.get("H2O");
    assertClose(4.734311949237782e-6, water.getDispersion()[2]);
    assertClose(2.8574954896752405e-6, water.getDispersion()[4]);
    assertClose(10.110775776847062, water.getF1()[0]);
    assertClose(10.065881494924541, water.getF1()[2]);
    assertClose(10.04313810715771, water.getF1()[4]);
    assertClose(9.482008260671003e-6, water.getRealSLD()[2]);
    assertClose(9.460584107129207e-6, water.getRealSLD()[4]);
  }

  @Test
  public void testSiliconAt20keV() {
    MaterialResult silicon = context.singleMaterial("Si", new double[] {20.0}, 2.33);
    assertClose(1.20966554922812e-06, silicon.getDispersion()[0]);
    assertClose(14.048053047106292, silicon.getF1()[0]);
    assertClose(0.053331074920700626, silicon.getF2()[0]);
    assertClose(1.9777910804587255e-5, silicon.getRealSLD()[0]);
    assertClose(7.508351793358633e-8, silicon.getImagSLD()[0]);
  }
}
