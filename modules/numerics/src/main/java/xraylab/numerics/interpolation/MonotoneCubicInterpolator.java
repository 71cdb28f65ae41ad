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
package xraylab.numerics.interpolation;

import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.signum;

import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NonMonotonicSequenceException;
import org.apache.commons.math3.exception.NullArgumentException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.util.MathArrays;

/**
 * Piecewise Cubic Hermite Interpolating Polynomial (PCHIP).
 * <p>
 * Node derivatives are chosen so that the interpolant is monotone wherever the data are
 * monotone, and has a flat extremum at any node where the data change direction. It never
 * overshoots the range of two neighboring nodes. Linear data are reproduced exactly.
 * <p>
 * The returned {@link PolynomialSplineFunction} is only defined on [x[0], x[n-1]]; evaluation
 * outside the knots throws an {@link org.apache.commons.math3.exception.OutOfRangeException}.
 *
 * @author XRayLab Developers
 * @see <a href="http://dx.doi.org/10.1137/0717021" target="_blank"> F. N. Fritsch and R. E.
 * Carlson, SIAM J. Numer. Anal. (1980). 17, 238-246.</a>
 * @see <a href="http://dx.doi.org/10.1137/1.9780898717952" target="_blank"> C. B. Moler,
 * Numerical Computing with MATLAB. (SIAM, 2004), Section 3.4.</a>
 * @since 1.0
 */
public class MonotoneCubicInterpolator implements UnivariateInterpolator {

  /**
   * Compute a monotone cubic interpolating function for the data set.
   *
   * @param x the arguments for the interpolation points (strictly increasing).
   * @param y the values for the interpolation points.
   * @return a function which interpolates the data set.
   * @throws DimensionMismatchException    if {@code x} and {@code y} have different sizes.
   * @throws NonMonotonicSequenceException if {@code x} is not strictly increasing.
   * @throws NumberIsTooSmallException     if the size of {@code x} is smaller than 2.
   */
  @Override
  public PolynomialSplineFunction interpolate(double[] x, double[] y)
      throws DimensionMismatchException, NumberIsTooSmallException, NonMonotonicSequenceException {
    if (x == null || y == null) {
      throw new NullArgumentException();
    }
    if (x.length != y.length) {
      throw new DimensionMismatchException(x.length, y.length);
    }
    if (x.length < 2) {
      throw new NumberIsTooSmallException(LocalizedFormats.NUMBER_OF_POINTS, x.length, 2, true);
    }
    MathArrays.checkOrder(x);

    int n = x.length;
    int nSegments = n - 1;
    double[] h = new double[nSegments];
    double[] delta = new double[nSegments];
    for (int k = 0; k < nSegments; k++) {
      h[k] = x[k + 1] - x[k];
      delta[k] = (y[k + 1] - y[k]) / h[k];
    }

    double[] d = derivatives(h, delta);

    PolynomialFunction[] polynomials = new PolynomialFunction[nSegments];
    for (int k = 0; k < nSegments; k++) {
      double hk = h[k];
      double c2 = (3.0 * delta[k] - 2.0 * d[k] - d[k + 1]) / hk;
      double c3 = (d[k] + d[k + 1] - 2.0 * delta[k]) / (hk * hk);
      polynomials[k] = new PolynomialFunction(new double[] {y[k], d[k], c2, c3});
    }

    // PolynomialSplineFunction keeps its own copy of the knots.
    return new PolynomialSplineFunction(x, polynomials);
  }

  /**
   * Shape preserving node derivatives.
   *
   * @param h     Interval widths.
   * @param delta Interval slopes.
   * @return The derivative at each node.
   */
  static double[] derivatives(double[] h, double[] delta) {
    int nSegments = h.length;
    double[] d = new double[nSegments + 1];

    // Two points: a straight line.
    if (nSegments == 1) {
      d[0] = delta[0];
      d[1] = delta[0];
      return d;
    }

    // Interior nodes use a weighted harmonic mean of the neighboring slopes.
    for (int k = 1; k < nSegments; k++) {
      double d0 = delta[k - 1];
      double d1 = delta[k];
      if (d0 * d1 <= 0.0) {
        d[k] = 0.0;
      } else {
        double w1 = 2.0 * h[k] + h[k - 1];
        double w2 = h[k] + 2.0 * h[k - 1];
        d[k] = (w1 + w2) / (w1 / d0 + w2 / d1);
      }
    }

    d[0] = endSlope(h[0], h[1], delta[0], delta[1]);
    d[nSegments] =
        endSlope(h[nSegments - 1], h[nSegments - 2], delta[nSegments - 1], delta[nSegments - 2]);
    return d;
  }

  /**
   * One-sided three point estimate of the end derivative, limited to preserve shape.
   *
   * @param h0     Width of the end interval.
   * @param h1     Width of the adjacent interval.
   * @param delta0 Slope of the end interval.
   * @param delta1 Slope of the adjacent interval.
   * @return The end derivative.
   */
  private static double endSlope(double h0, double h1, double delta0, double delta1) {
    double d = ((2.0 * h0 + h1) * delta0 - h0 * delta1) / (h0 + h1);
    if (signum(d) != signum(delta0)) {
      return 0.0;
    }
    if (signum(delta0) != signum(delta1) && abs(d) > abs(3.0 * delta0)) {
      return 3.0 * delta0;
    }
    return d;
  }
}
