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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Test parsing of chemical formulae.
 *
 * @author XRayLab Developers
 */
@RunWith(Parameterized.class)
public class FormulaParserTest {

  private static final double tolerance = 1.0e-12;

  @Parameters(name = "{0}")
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"C", new String[] {"C"}, new double[] {1.0}},
        {"U", new String[] {"U"}, new double[] {1.0}},
        {"CO", new String[] {"C", "O"}, new double[] {1.0, 1.0}},
        {"Co", new String[] {"Co"}, new double[] {1.0}},
        {"H0.5He0.5", new String[] {"H", "He"}, new double[] {0.5, 0.5}},
        {"H2O0.5", new String[] {"H", "O"}, new double[] {2.0, 0.5}},
        {"C.25", new String[] {"C"}, new double[] {0.25}},
        {"SiO2", new String[] {"Si", "O"}, new double[] {1.0, 2.0}},
        {"Al2O3", new String[] {"Al", "O"}, new double[] {2.0, 3.0}},
        {"CaCO3", new String[] {"Ca", "C", "O"}, new double[] {1.0, 1.0, 3.0}},
        {"C100H200", new String[] {"C", "H"}, new double[] {100.0, 200.0}},
        {"H0.123He0.876", new String[] {"H", "He"}, new double[] {0.123, 0.876}},
        {"HOH", new String[] {"H", "O", "H"}, new double[] {1.0, 1.0, 1.0}},
        {"HHeLiBeBCHNOFNeNaMg",
            new String[] {"H", "He", "Li", "Be", "B", "C", "H", "N", "O", "F", "Ne", "Na", "Mg"},
            new double[] {1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1}},
        {"H2He3Li4Be5B6C7N8O9F10Ne11",
            new String[] {"H", "He", "Li", "Be", "B", "C", "N", "O", "F", "Ne"},
            new double[] {2, 3, 4, 5, 6, 7, 8, 9, 10, 11}},
    });
  }

  private final String formula;
  private final String[] symbols;
  private final double[] counts;

  public FormulaParserTest(String formula, String[] symbols, double[] counts) {
    this.formula = formula;
    this.symbols = symbols;
    this.counts = counts;
  }

  @Test
  public void testParse() {
    List<ElementTerm> terms = FormulaParser.parse(formula);
    assertEquals(formula + " term count", symbols.length, terms.size());
    for (int i = 0; i < symbols.length; i++) {
      assertEquals(formula + " symbol " + i, symbols[i], terms.get(i).symbol());
      assertEquals(formula + " count " + i, counts[i], terms.get(i).count(), tolerance);
    }
  }
}
