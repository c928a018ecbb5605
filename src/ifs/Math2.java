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
 * a file with some useful numerical analysis stuff.
 */
public class Math2 {

	/**
	 * multiply a vector by a vector
	 * @return u.v scalar
	 */
	public static double dot(double[] u, double[] v) {
		if (u.length != v.length)
			throw new IllegalArgumentException("Dot a "+u.length+" vector by a "+v.length+" vector?  no.");
		double s = 0;
		for (int i = 0; i < u.length; i ++)
			s += u[i] * v[i];
		return s;
	}

	/**
	 * @return the array [1, x, x^2, ..., x^degree]
	 */
	public static double[] powers(double x, int degree) {
		double[] out = new double[degree + 1];
		out[0] = 1;
		for (int p = 1; p <= degree; p ++)
			out[p] = out[p - 1]*x;
		return out;
	}

	/**
	 * evaluate a bivariate polynomial of total degree at most g, with terms ordered as
	 * <pre>
	 *     for i in 0..g:
	 *         for j in 0..g-i:
	 *             c[offset + k++] * u^i * v^j
	 * </pre>
	 * so there are (g+1)(g+2)/2 coefficients, starting at the given offset.
	 */
	public static double polyval2d(double[] coefficients, int offset, int degree, double u, double v) {
		double[] u_powers = powers(u, degree);
		double[] v_powers = powers(v, degree);
		double value = 0;
		int k = offset;
		for (int i = 0; i <= degree; i ++)
			for (int j = 0; j <= degree - i; j ++)
				value += coefficients[k ++]*u_powers[i]*v_powers[j];
		return value;
	}

	/**
	 * the number of coefficients in a bivariate polynomial of total degree g
	 */
	public static int numTerms2d(int degree) {
		return (degree + 1)*(degree + 2)/2;
	}

	/**
	 * @return whether these values only ever go up or only ever go down (ties allowed),
	 * ignoring NaNs
	 */
	public static boolean isMonotonic(double[] values) {
		int direction = 0;
		double last = Double.NaN;
		for (double value: values) {
			if (Double.isNaN(value))
				continue;
			if (!Double.isNaN(last) && value != last) {
				int step = (value > last) ? 1 : -1;
				if (direction == 0)
					direction = step;
				else if (step != direction)
					return false;
			}
			last = value;
		}
		return true;
	}

	public static double[][] deepCopy(double[][] arr) {
		double[][] out = new double[arr.length][];
		for (int i = 0; i < arr.length; i ++)
			out[i] = arr[i].clone();
		return out;
	}
}
