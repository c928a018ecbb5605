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

import java.util.logging.Logger;

/**
 * turns the geometric model into a pixel solution: the footprint of every lenslet at every
 * wavelength channel, in detector pixels.
 */
public class Rasterizer {

	private static final Logger logger = Logger.getLogger(Logging.LOGGER_NAME);

	/**
	 * evaluate the geometric model at every channel of the wavelength grid and rasterize the
	 * PSF-let of every lenslet.  lenslet (ix, iy) sits at ((ix - n/2)·pitch, (iy - n/2)·pitch)
	 * on the lenslet plane; the coefficients map that onto the detector plane (μm from the
	 * detector centre), and dividing by the pixel size gives pixels.  footprints that hang off
	 * the edge of the detector are clipped; ones that fall off it completely become null
	 * footprints.  nothing here is random or order-dependent, so the same inputs always give
	 * the same table, bit for bit.
	 * @param model the geometric model
	 * @param grid the wavelength channels
	 * @param config the lenslet and detector geometry
	 * @return the pixel solution
	 * @throws CalibrationException if the model's coefficients don't describe a distortion
	 */
	public static PixelSolution genpixsol(PSFLetModel model, WavelengthGrid grid, InstrumentConfig config) {
		int degree = model.distortionDegree();
		int n = config.numLenslets;
		Footprint[][] footprints = new Footprint[n*n][grid.size()];

		int numExtrapolated = 0;
		for (int k = 0; k < grid.size(); k ++) {
			PSFLetModel.Evaluation evaluation = model.evaluate(grid.get(k).wavelength);
			if (evaluation.isExtrapolated())
				numExtrapolated ++;
			double[] coefficients = evaluation.getCoefficients();
			for (int iy = 0; iy < n; iy ++) {
				double v = (iy - n/2)*config.lensletPitch;
				for (int ix = 0; ix < n; ix ++) {
					double u = (ix - n/2)*config.lensletPitch;
					double[] position = PSFLetModel.transform(coefficients, degree, u, v);
					double cx = position[0]/config.pixelSize + config.detectorCols/2.;
					double cy = position[1]/config.pixelSize + config.detectorRows/2.;
					footprints[iy*n + ix][k] = rasterize(
							cx, cy, config.psfletHalfWidth, config.psfletHalfHeight,
							config.detectorRows, config.detectorCols);
				}
			}
		}
		if (numExtrapolated > 0)
			logger.warning(String.format("%d of %d channels are outside the calibrated wavelength range",
			                             numExtrapolated, grid.size()));

		PixelSolution solution = new PixelSolution(
				n, config.detectorRows, config.detectorCols, grid,
				PixelSolution.key(grid, model, config), footprints);

		int numOffDetector = 0, numScrambled = 0;
		for (int id = 0; id < solution.lensletCount(); id ++) {
			if (solution.isOffDetector(id))
				numOffDetector ++;
			else if (!solution.isMonotonic(id))
				numScrambled ++;
		}
		if (numScrambled > 0)
			logger.warning(String.format("%d lenslets have footprints that double back along the dispersion direction",
			                             numScrambled));
		logger.info(String.format("generated a pixel solution for %d lenslets × %d channels (%d entirely off the detector)",
		                          solution.lensletCount(), grid.size(), numOffDetector));
		return solution;
	}

	/**
	 * find the pixels whose centres are within the given half-extents of a centroid, clipped to
	 * the detector.
	 */
	static Footprint rasterize(double cx, double cy, double halfWidth, double halfHeight, int rows, int cols) {
		if (!Double.isFinite(cx) || !Double.isFinite(cy))
			return Footprint.none(cx, cy);
		// clamp before casting so that wildly extrapolated centroids can't overflow
		int x0 = (int) Math.max(0, Math.ceil(cx - halfWidth));
		int x1 = (int) Math.min(cols, Math.floor(cx + halfWidth) + 1);
		int y0 = (int) Math.max(0, Math.ceil(cy - halfHeight));
		int y1 = (int) Math.min(rows, Math.floor(cy + halfHeight) + 1);
		if (x1 <= x0 || y1 <= y0)
			return Footprint.none(cx, cy);
		return new Footprint(cx, cy, new Box(x0, x1, y0, y1));
	}
}
