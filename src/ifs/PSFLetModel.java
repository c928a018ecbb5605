/*
 * MIT License
 *
 * Copyright (c) 2022 Justin Kunimune
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ifs;

import java.util.List;

/**
 * the geometric model of the PSF-lets: given the calibration measured at a few wavelengths,
 * it can say where every lenslet's spot falls on the detector at any wavelength.  it does
 * this by fitting each geometric coefficient with a polynomial in wavelength.  once built, a
 * model never changes, so it can be shared freely between threads.
 */
public final class PSFLetModel {
	private final InterpolationArray interpolation;

	private PSFLetModel(InterpolationArray interpolation) {
		this.interpolation = interpolation;
	}

	public static PSFLetModel buildInterpolation(CalibrationTable table, int order) {
		return buildInterpolation(table.getPoints(), order);
	}

	/**
	 * fit, for each geometric coefficient independently, a polynomial in wavelength of the given
	 * degree through all of the calibration points.  if there are exactly order+1 points the
	 * polynomials pass thru them exactly; otherwise they're least-squares fits.
	 * @param points the calibration, in order of strictly increasing wavelength
	 * @param order the degree of the polynomials
	 * @return the model
	 * @throws CalibrationException if there are too few points, the wavelengths are out of
	 *                              order, or the coefficients are ragged or non-finite
	 */
	public static PSFLetModel buildInterpolation(List<CalibrationPoint> points, int order) {
		if (order < 0)
			throw new CalibrationException("the interpolation order can't be negative (" + order + ")");
		if (points.size() < order + 1)
			throw new CalibrationException(String.format(
					"an order-%d fit needs at least %d distinct wavelengths but there are only %d",
					order, order + 1, points.size()));
		int numCoefficients = points.get(0).numCoefficients();
		if (numCoefficients == 0)
			throw new CalibrationException("the calibration points have no coefficients");
		double[] λ = new double[points.size()];
		for (int i = 0; i < points.size(); i ++) {
			CalibrationPoint point = points.get(i);
			λ[i] = point.wavelength;
			if (!Double.isFinite(λ[i]))
				throw new CalibrationException("calibration wavelengths must be finite", λ[i]);
			if (i > 0 && !(λ[i] > λ[i - 1]))
				throw new CalibrationException("calibration wavelengths must strictly increase", λ[i]);
			if (point.numCoefficients() != numCoefficients)
				throw new CalibrationException(String.format(
						"this point has %d coefficients but the first has %d", point.numCoefficients(), numCoefficients), λ[i]);
			for (double coefficient: point.getCoefficients())
				if (!Double.isFinite(coefficient))
					throw new CalibrationException("calibration coefficients must be finite", λ[i]);
		}

		// set up the Vandermonde matrix in the normalized wavelength
		double[][] empty = new double[order + 1][numCoefficients];
		InterpolationArray frame = new InterpolationArray(empty, λ[0], λ[λ.length - 1]);
		double[][] vandermonde = new double[λ.length][];
		for (int i = 0; i < λ.length; i ++)
			vandermonde[i] = Math2.powers(frame.normalize(λ[i]), order);
		Matrix X = new Matrix(vandermonde);
		boolean exact = (λ.length == order + 1);
		Matrix normal = exact ? X : X.trans().matmul(X);

		double[][] values = new double[order + 1][numCoefficients];
		for (int c = 0; c < numCoefficients; c ++) {
			double[] y = new double[λ.length];
			for (int i = 0; i < λ.length; i ++)
				y[i] = points.get(i).getCoefficient(c);
			double[] fit;
			try {
				fit = normal.solve(exact ? y : X.trans().matmul(y));
			} catch (Matrix.SingularMatrixException e) {
				throw new CalibrationException("the calibration wavelengths do not determine an order-" + order + " fit");
			}
			for (int p = 0; p <= order; p ++)
				values[p][c] = fit[p];
		}
		return new PSFLetModel(new InterpolationArray(values, λ[0], λ[λ.length - 1]));
	}

	/**
	 * find all of the geometric coefficients at a given wavelength.  this has no side-effects,
	 * and it works outside the calibrated range, tho the result is flagged as an extrapolation.
	 * @param wavelength the wavelength (nm)
	 */
	public Evaluation evaluate(double wavelength) {
		boolean extrapolated = !(wavelength >= interpolation.getMinWavelength() &&
		                         wavelength <= interpolation.getMaxWavelength());
		return new Evaluation(wavelength, interpolation.evaluate(wavelength), extrapolated);
	}

	/**
	 * find where on the detector plane a point on the lenslet plane lands at a given wavelength,
	 * interpreting the coefficients as a pair of bivariate distortion polynomials.
	 * @param u the lenslet-plane x coordinate (μm)
	 * @param v the lenslet-plane y coordinate (μm)
	 * @param wavelength the wavelength (nm)
	 * @return the detector-plane x and y coordinates (μm, relative to the detector centre)
	 */
	public double[] locate(double u, double v, double wavelength) {
		return transform(evaluate(wavelength).getCoefficients(), distortionDegree(), u, v);
	}

	/**
	 * apply the distortion polynomials of degree g encoded in a coefficient vector: the first
	 * (g+1)(g+2)/2 coefficients give x and the rest give y.
	 */
	static double[] transform(double[] coefficients, int degree, double u, double v) {
		int half = Math2.numTerms2d(degree);
		return new double[] {
				Math2.polyval2d(coefficients, 0, degree, u, v),
				Math2.polyval2d(coefficients, half, degree, u, v)};
	}

	/**
	 * the total degree of the distortion polynomials the coefficient vector encodes
	 * @throws CalibrationException if the number of coefficients doesn't match any degree
	 */
	public int distortionDegree() {
		int numCoefficients = interpolation.numCoefficients();
		for (int g = 0; 2*Math2.numTerms2d(g) <= numCoefficients; g ++)
			if (2*Math2.numTerms2d(g) == numCoefficients)
				return g;
		throw new CalibrationException(String.format(
				"%d coefficients can't describe a pair of distortion polynomials", numCoefficients));
	}

	public InterpolationArray getInterpolation() {
		return interpolation;
	}

	public int order() {
		return interpolation.order();
	}

	public int numCoefficients() {
		return interpolation.numCoefficients();
	}

	/**
	 * the coefficients at one wavelength, and whether we had to extrapolate to get them
	 */
	public static final class Evaluation {
		public final double wavelength;
		private final double[] coefficients;
		private final boolean extrapolated;

		Evaluation(double wavelength, double[] coefficients, boolean extrapolated) {
			this.wavelength = wavelength;
			this.coefficients = coefficients;
			this.extrapolated = extrapolated;
		}

		public double[] getCoefficients() {
			return coefficients.clone();
		}

		public double get(int c) {
			return coefficients[c];
		}

		public boolean isExtrapolated() {
			return extrapolated;
		}
	}
}
