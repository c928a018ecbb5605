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

/**
 * the polynomial-in-wavelength fits of every geometric coefficient, stored densely: row p,
 * collum c holds the coefficient of t^p in the fit for geometric coefficient c, where
 * t = (λ - centre)/scale maps the calibrated range onto [-1, 1].  there are always order+1
 * rows.  immutable.
 */
public final class InterpolationArray {
	private final double[][] values;
	private final double centre;
	private final double scale;
	/** the calibrated wavelength range (nm) */
	private final double minWavelength, maxWavelength;

	InterpolationArray(double[][] values, double minWavelength, double maxWavelength) {
		if (values.length == 0)
			throw new IllegalArgumentException("there must be at least one row");
		for (double[] row: values)
			if (row.length != values[0].length)
				throw new IllegalArgumentException("do not accept jagged arrays.");
		this.values = Math2.deepCopy(values);
		this.minWavelength = minWavelength;
		this.maxWavelength = maxWavelength;
		this.centre = (minWavelength + maxWavelength)/2;
		this.scale = (maxWavelength > minWavelength) ? (maxWavelength - minWavelength)/2 : 1;
	}

	/**
	 * convert a wavelength in nm to the dimensionless variable the polynomials are in
	 */
	double normalize(double wavelength) {
		return (wavelength - centre)/scale;
	}

	/**
	 * @return every geometric coefficient at this wavelength
	 */
	double[] evaluate(double wavelength) {
		double[] t_powers = Math2.powers(normalize(wavelength), order());
		double[] coefficients = new double[numCoefficients()];
		for (int p = 0; p <= order(); p ++)
			for (int c = 0; c < coefficients.length; c ++)
				coefficients[c] += values[p][c]*t_powers[p];
		return coefficients;
	}

	public int order() {
		return values.length - 1;
	}

	public int numCoefficients() {
		return values[0].length;
	}

	public double get(int p, int c) {
		return values[p][c];
	}

	public double getMinWavelength() {
		return minWavelength;
	}

	public double getMaxWavelength() {
		return maxWavelength;
	}

	public double[][] getValues() {
		return Math2.deepCopy(values);
	}
}
