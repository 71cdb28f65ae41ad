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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parse chemical formulae such as "SiO2", "CaCO3" or "H0.5He0.5".
 * <p>
 * Each term is an upper case letter followed by any number of lower case letters (the symbol),
 * then an optional count written as an integer or decimal (".25" is allowed). A missing count is
 * 1. Symbols are case sensitive, so "CO" is carbon and oxygen while "Co" is cobalt. Terms are kept
 * in order and repeated symbols are not merged. Characters that do not begin a term are skipped.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public class FormulaParser {

  private static final Pattern TERM = Pattern.compile("([A-Z][a-z]*)(\\d*\\.\\d*|\\d*)");

  private FormulaParser() {}

  /**
   * Parse a chemical formula.
   *
   * @param formula the formula.
   * @return an unmodifiable list of terms in the order they appear.
   * @throws FormulaException if the formula is empty, contains no element term, or a count
   *                          cannot be read.
   */
  public static List<ElementTerm> parse(String formula) {
    requireNonNull(formula, "formula");
    if (formula.isEmpty()) {
      throw new FormulaException(formula, "the formula is empty");
    }

    List<ElementTerm> terms = new ArrayList<>();
    Matcher matcher = TERM.matcher(formula);
    while (matcher.find()) {
      String symbol = matcher.group(1);
      String count = matcher.group(2);
      if (count.isEmpty()) {
        terms.add(new ElementTerm(symbol, 1.0));
      } else {
        try {
          terms.add(new ElementTerm(symbol, Double.parseDouble(count)));
        } catch (NumberFormatException e) {
          throw new FormulaException(formula, "bad count \"" + count + "\" for " + symbol, e);
        }
      }
    }

    if (terms.isEmpty()) {
      throw new FormulaException(formula, "no element symbols found");
    }
    return Collections.unmodifiableList(terms);
  }
}
