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

import java.util.Arrays;

/**
 * one row of the wavelength calibration: a wavelength and the geometric coefficients measured
 * there.
 */
public final class CalibrationPoint {
	/** the wavelength (nm) */
	public final double wavelength;
	private final double[] coefficients;

	public CalibrationPoint(double wavelength, double... coefficients) {
		this.wavelength = wavelength;
		this.coefficients = coefficients.clone();
	}

	public int numCoefficients() {
		return coefficients.length;
	}

	public double getCoefficient(int c) {
		return coefficients[c];
	}

	public double[] getCoefficients() {
		return coefficients.clone();
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof CalibrationPoint))
			return false;
		CalibrationPoint that = (CalibrationPoint) o;
		return Double.compare(this.wavelength, that.wavelength) == 0 &&
		       Arrays.equals(this.coefficients, that.coefficients);
	}

	@Override
	public int hashCode() {
		return Double.hashCode(wavelength)*31 + Arrays.hashCode(coefficients);
	}

	@Override
	public String toString() {
		return String.format("%.3f nm: %s", wavelength, Arrays.toString(coefficients));
	}
}
