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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

/**
 * Test rejection of malformed chemical formulae.
 *
 * @author XRayLab Developers
 */
public class InvalidFormulaTest {

  private static void assertInvalid(String formula) {
    try {
      FormulaParser.parse(formula);
      fail(" Expected a FormulaException for \"" + formula + "\"");
    } catch (FormulaException e) {
      assertEquals(formula, e.formula);
      assertTrue(e.getMessage().contains("Invalid chemical formula"));
    }
  }

  @Test
  public void testEmpty() {
    assertInvalid("");
  }

  @Test
  public void testDigitsOnly() {
    assertInvalid("123");
  }

  @Test
  public void testLowerCaseOnly() {
    assertInvalid("xyz");
    assertInvalid("abc");
  }

  @Test
  public void testBareDecimalPoint() {
    assertInvalid("C.");
  }

  @Test(expected = NullPointerException.class)
  public void testNull() {
    FormulaParser.parse(null);
  }
}
