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

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Map;

/**
 * every lenslet's spectrum arranged as a (wavelength × iy × ix) cube, which is the image you
 * actually want to look at.  lenslets that failed or were never extracted are NaN in the flux
 * cube and infinite in the variance cube.
 */
public final class SpectralCube {
	private final WavelengthGrid grid;
	private final double[][][] flux;
	private final double[][][] variance;

	private SpectralCube(WavelengthGrid grid, double[][][] flux, double[][][] variance) {
		this.grid = grid;
		this.flux = flux;
		this.variance = variance;
	}

	/**
	 * @param outcomes the extraction outcome of each lenslet, keyed by lenslet id
	 * @param pixsol the pixel solution they were extracted with
	 */
	public static SpectralCube assemble(Map<Integer, SpectralExtraction.LensletOutcome> outcomes, PixelSolution pixsol) {
		WavelengthGrid grid = pixsol.getGrid();
		int n = pixsol.numLenslets;
		double[][][] flux = new double[grid.size()][n][n];
		double[][][] variance = new double[grid.size()][n][n];
		for (int k = 0; k < grid.size(); k ++) {
			for (int iy = 0; iy < n; iy ++) {
				Arrays.fill(flux[k][iy], Double.NaN);
				Arrays.fill(variance[k][iy], Double.POSITIVE_INFINITY);
			}
		}
		for (Map.Entry<Integer, SpectralExtraction.LensletOutcome> entry: outcomes.entrySet()) {
			if (!entry.getValue().isSuccess())
				continue;
			int id = entry.getKey();
			SpectrumResult spectrum = entry.getValue().getSpectrum();
			for (int k = 0; k < grid.size(); k ++) {
				flux[k][pixsol.iy(id)][pixsol.ix(id)] = spectrum.getFlux(k);
				variance[k][pixsol.iy(id)][pixsol.ix(id)] = spectrum.getVariance(k);
			}
		}
		return new SpectralCube(grid, flux, variance);
	}

	public int numChannels() {
		return flux.length;
	}

	public double getFlux(int k, int iy, int ix) {
		return flux[k][iy][ix];
	}

	public double getVariance(int k, int iy, int ix) {
		return variance[k][iy][ix];
	}

	/**
	 * the flux image of channel k
	 */
	public double[][] fluxSlice(int k) {
		return Math2.deepCopy(flux[k]);
	}

	public double[][] varianceSlice(int k) {
		return Math2.deepCopy(variance[k]);
	}

	public WavelengthGrid getGrid() {
		return grid;
	}

	/**
	 * save each channel as a pair of CSV files, {@code cube-flux-<k>.csv} and
	 * {@code cube-variance-<k>.csv}, along with {@code cube-wavelengths.csv}, which lists the
	 * channel midpoints and half-widths.
	 * @param directory where to put them; it must already exist
	 * @throws IOException if any of the files can't be written
	 */
	public void writeSlices(File directory) throws IOException {
		double[][] wavelengths = new double[grid.size()][];
		for (int k = 0; k < grid.size(); k ++) {
			wavelengths[k] = new double[] {grid.get(k).wavelength, grid.get(k).halfWidth};
			CSV.write(flux[k], new File(directory, String.format("cube-flux-%03d.csv", k)), ',');
			CSV.write(variance[k], new File(directory, String.format("cube-variance-%03d.csv", k)), ',');
		}
		CSV.write(wavelengths, new File(directory, "cube-wavelengths.csv"), ',',
		          new String[] {"wavelength", "half_width"});
	}
}
