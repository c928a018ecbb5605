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
 * a PSF-let that looks like an elliptical Gaussian centred on the footprint's centroid,
 * sampled at the pixel centres.
 */
public final class GaussianProfile implements ProfileModel {
	/** the standard deviations across and along the dispersion direction (pixels) */
	public final double sigmaX, sigmaY;

	public GaussianProfile(double sigmaX, double sigmaY) {
		if (!(sigmaX > 0) || !(sigmaY > 0))
			throw new IllegalArgumentException("the Gaussian widths must be positive, not " + sigmaX + " and " + sigmaY);
		this.sigmaX = sigmaX;
		this.sigmaY = sigmaY;
	}

	@Override
	public double weight(int k, Footprint footprint, int x, int y) {
		double ξ = (x - footprint.cx)/sigmaX;
		double υ = (y - footprint.cy)/sigmaY;
		return Math.exp(-(ξ*ξ + υ*υ)/2);
	}

	@Override
	public String toString() {
		return String.format("GaussianProfile(σx = %.3f, σy = %.3f)", sigmaX, sigmaY);
	}
}
