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

/**
 * The periodic table in order of atomic number, with standard atomic weights.
 * <p>
 * Atomic weights are from the <a href="https://iupac.qmul.ac.uk/AtWt">IUPAC Commission</a> on
 * Isotopic Abundances and Atomic Weights. Elements whose weight is given as an interval use the
 * conventional value. Elements without stable isotopes carry the mass number of their longest
 * lived isotope.
 *
 * @author XRayLab Developers
 * @since 1.0
 */
public enum Element {
  H("Hydrogen", 1.008),
  He("Helium", 4.002602),
  Li("Lithium", 6.94),
  Be("Beryllium", 9.0121831),
  B("Boron", 10.81),
  C("Carbon", 12.011),
  N("Nitrogen", 14.007),
  O("Oxygen", 15.999),
  F("Fluorine", 18.998403163),
  Ne("Neon", 20.1797),
  Na("Sodium", 22.98976928),
  Mg("Magnesium", 24.305),
  Al("Aluminium", 26.9815385),
  Si("Silicon", 28.085),
  P("Phosphorus", 30.973761998),
  S("Sulfur", 32.06),
  Cl("Chlorine", 35.45),
  Ar("Argon", 39.948),
  K("Potassium", 39.0983),
  Ca("Calcium", 40.078),
  Sc("Scandium", 44.955908),
  Ti("Titanium", 47.867),
  V("Vanadium", 50.9415),
  Cr("Chromium", 51.9961),
  Mn("Manganese", 54.938044),
  Fe("Iron", 55.845),
  Co("Cobalt", 58.933194),
  Ni("Nickel", 58.6934),
  Cu("Copper", 63.546),
  Zn("Zinc", 65.38),
  Ga("Gallium", 69.723),
  Ge("Germanium", 72.630),
  As("Arsenic", 74.921595),
  Se("Selenium", 78.971),
  Br("Bromine", 79.904),
  Kr("Krypton", 83.798),
  Rb("Rubidium", 85.4678),
  Sr("Strontium", 87.62),
  Y("Yttrium", 88.90584),
  Zr("Zirconium", 91.224),
  Nb("Niobium", 92.90637),
  Mo("Molybdenum", 95.95),
  Tc("Technetium", 98.0),
  Ru("Ruthenium", 101.07),
  Rh("Rhodium", 102.90550),
  Pd("Palladium", 106.42),
  Ag("Silver", 107.8682),
  Cd("Cadmium", 112.414),
  In("Indium", 114.818),
  Sn("Tin", 118.710),
  Sb("Antimony", 121.760),
  Te("Tellurium", 127.60),
  I("Iodine", 126.90447),
  Xe("Xenon", 131.293),
  Cs("Caesium", 132.90545196),
  Ba("Barium", 137.327),
  La("Lanthanum", 138.90547),
  Ce("Cerium", 140.116),
  Pr("Praseodymium", 140.90766),
  Nd("Neodymium", 144.242),
  Pm("Promethium", 145.0),
  Sm("Samarium", 150.36),
  Eu("Europium", 151.964),
  Gd("Gadolinium", 157.25),
  Tb("Terbium", 158.92535),
  Dy("Dysprosium", 162.500),
  Ho("Holmium", 164.93033),
  Er("Erbium", 167.259),
  Tm("Thulium", 168.93422),
  Yb("Ytterbium", 173.045),
  Lu("Lutetium", 174.9668),
  Hf("Hafnium", 178.49),
  Ta("Tantalum", 180.94788),
  W("Tungsten", 183.84),
  Re("Rhenium", 186.207),
  Os("Osmium", 190.23),
  Ir("Iridium", 192.217),
  Pt("Platinum", 195.084),
  Au("Gold", 196.966569),
  Hg("Mercury", 200.592),
  Tl("Thallium", 204.38),
  Pb("Lead", 207.2),
  Bi("Bismuth", 208.98040),
  Po("Polonium", 209.0),
  At("Astatine", 210.0),
  Rn("Radon", 222.0),
  Fr("Francium", 223.0),
  Ra("Radium", 226.0),
  Ac("Actinium", 227.0),
  Th("Thorium", 232.0377),
  Pa("Protactinium", 231.03588),
  U("Uranium", 238.02891),
  Np("Neptunium", 237.0),
  Pu("Plutonium", 244.0),
  Am("Americium", 243.0),
  Cm("Curium", 247.0),
  Bk("Berkelium", 247.0),
  Cf("Californium", 251.0),
  Es("Einsteinium", 252.0),
  Fm("Fermium", 257.0),
  Md("Mendelevium", 258.0),
  No("Nobelium", 259.0),
  Lr("Lawrencium", 266.0),
  Rf("Rutherfordium", 267.0),
  Db("Dubnium", 268.0),
  Sg("Seaborgium", 269.0),
  Bh("Bohrium", 270.0),
  Hs("Hassium", 269.0),
  Mt("Meitnerium", 278.0),
  Ds("Darmstadtium", 281.0),
  Rg("Roentgenium", 282.0),
  Cn("Copernicium", 285.0),
  Nh("Nihonium", 286.0),
  Fl("Flerovium", 289.0),
  Mc("Moscovium", 290.0),
  Lv("Livermorium", 293.0),
  Ts("Tennessine", 294.0),
  Og("Oganesson", 294.0);

  /** Element name. */
  public final String elementName;
  /** Standard atomic weight (amu, or g/mol). */
  public final double atomicMass;

  Element(String elementName, double atomicMass) {
    this.elementName = elementName;
    this.atomicMass = atomicMass;
  }

  /**
   * Case sensitive element symbol.
   *
   * @return the element symbol.
   */
  public String getSymbol() {
    return name();
  }

  /**
   * Atomic number, given by position in the periodic table.
   *
   * @return the atomic number.
   */
  public int getAtomicNumber() {
    return ordinal() + 1;
  }
}
