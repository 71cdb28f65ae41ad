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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import org.junit.Test;

/**
 * Test reading of scattering factor tables.
 *
 * @author XRayLab Developers
 */
public class ScatteringTableReaderTest {

  private static ScatteringTable read(String text) throws IOException {
    return ScatteringTableReader.read("Si", new BufferedReader(new StringReader(text)));
  }

  private static void assertUnavailable(String text, String reason) throws IOException {
    try {
      read(text);
      fail(" Expected the table to be rejected: " + reason);
    } catch (ElementDataUnavailableException e) {
      assertEquals("Si", e.symbol);
      assertTrue(e.getMessage(), e.getMessage().contains(reason));
    }
  }

  @Test
  public void testHeaderAndSeparators() throws IOException {
    String text = "E(eV),f1,f2\n"
        + "10.0,14.0,1.0\n"
        + "# comment\n"
        + "\n"
        + "100.0\t14.5\t0.5\n"
        + "  1000.0   15.0   0.25  \n";
    ScatteringTable table = read(text);
    assertEquals("Si", table.getSymbol());
    assertEquals(3, table.size());
    assertArrayEquals(new double[] {10.0, 100.0, 1000.0}, table.getEnergy(), 0.0);
    assertArrayEquals(new double[] {14.0, 14.5, 15.0}, table.getF1(), 0.0);
    assertArrayEquals(new double[] {1.0, 0.5, 0.25}, table.getF2(), 0.0);
  }

  @Test
  public void testExtraColumnsIgnored() throws IOException {
    ScatteringTable table = read("10 1 2 3\n20 4 5 6\n");
    assertArrayEquals(new double[] {1.0, 4.0}, table.getF1(), 0.0);
    assertArrayEquals(new double[] {2.0, 5.0}, table.getF2(), 0.0);
  }

  @Test
  public void testManyRows() throws IOException {
    StringBuilder sb = new StringBuilder();
    for (int i = 1; i <= 2000; i++) {
      sb.append(i).append(' ').append(2 * i).append(' ').append(0.5).append('\n');
    }
    ScatteringTable table = read(sb.toString());
    assertEquals(2000, table.size());
    assertEquals(4000.0, table.getF1()[1999], 0.0);
  }

  @Test
  public void testShortRow() throws IOException {
    assertUnavailable("10 1 2\n20 4\n", "fewer than 3 columns");
  }

  @Test
  public void testNonNumericRow() throws IOException {
    assertUnavailable("10 1 2\n20 four 5\n", "not numeric");
  }

  @Test
  public void testSecondHeaderRejected() throws IOException {
    assertUnavailable("E f1 f2\nE f1 f2\n10 1 2\n", "not numeric");
  }

  @Test
  public void testTooFewRows() throws IOException {
    assertUnavailable("E f1 f2\n10 1 2\n", "1 rows");
    assertUnavailable("", "0 rows");
  }

  @Test
  public void testTableIsCopied() {
    double[] energy = {1.0, 2.0};
    ScatteringTable table = new ScatteringTable("H", energy, new double[2], new double[2]);
    energy[0] = 5.0;
    assertEquals(1.0, table.getEnergy()[0], 0.0);
    table.getEnergy()[1] = 7.0;
    assertEquals(2.0, table.getEnergy()[1], 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testColumnLengthMismatch() {
    new ScatteringTable("H", new double[2], new double[3], new double[2]);
  }

  @Test
  public void testFileName() {
    assertEquals("si.nff", ScatteringFactorSource.fileName("Si"));
    assertEquals("h.nff", ScatteringFactorSource.fileName("H"));
  }
}
