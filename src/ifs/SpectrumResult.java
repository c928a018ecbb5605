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
 * the extracted spectrum of one lenslet: a flux and a variance for every wavelength channel,
 * in channel order.  a channel with no usable data has flux NaN and infinite variance.
 */
public final class SpectrumResult {
	private final int lenslet;
	private final double[] wavelengths;
	private final double[] flux;
	private final double[] variance;

	public SpectrumResult(int lenslet, WavelengthGrid grid, double[] flux, double[] variance) {
		if (flux.length != grid.size() || variance.length != grid.size())
			throw new IllegalArgumentException(String.format(
					"there are %d channels but %d fluxes and %d variances", grid.size(), flux.length, variance.length));
		this.lenslet = lenslet;
		this.wavelengths = grid.getMidpoints();
		this.flux = flux.clone();
		this.variance = variance.clone();
	}

	/**
	 * a spectrum with no data in any channel
	 */
	public static SpectrumResult empty(int lenslet, WavelengthGrid grid) {
		double[] flux = new double[grid.size()];
		double[] variance = new double[grid.size()];
		Arrays.fill(flux, Double.NaN);
		Arrays.fill(variance, Double.POSITIVE_INFINITY);
		return new SpectrumResult(lenslet, grid, flux, variance);
	}

	public int getLenslet() {
		return lenslet;
	}

	public int size() {
		return flux.length;
	}

	public double getWavelength(int k) {
		return wavelengths[k];
	}

	public double getFlux(int k) {
		return flux[k];
	}

	public double getVariance(int k) {
		return variance[k];
	}

	public double[] getFlux() {
		return flux.clone();
	}

	public double[] getVariance() {
		return variance.clone();
	}

	/**
	 * did channel k come out empty because every pixel it needed was masked or missing?
	 */
	public boolean isNoData(int k) {
		return Double.isNaN(flux[k]) && variance[k] == Double.POSITIVE_INFINITY;
	}

	public int numNoData() {
		int count = 0;
		for (int k = 0; k < size(); k ++)
			if (isNoData(k))
				count ++;
		return count;
	}

	/**
	 * @return one row per channel: wavelength (nm), flux, variance
	 */
	public double[][] toTable() {
		double[][] table = new double[size()][];
		for (int k = 0; k < size(); k ++)
			table[k] = new double[] {wavelengths[k], flux[k], variance[k]};
		return table;
	}
}
