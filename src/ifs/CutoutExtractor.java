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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * cuts a lenslet's pixels out of a detector image and reduces them to a spectrum by fitting
 * the channel templates to them.
 */
public class CutoutExtractor {

	/** how many pixels to grow a cutout by, if nobody says otherwise */
	public static final int DEFAULT_MARGIN = 2;
	/**
	 * the smallest fraction of a template's weight that may be left over once its overlap with
	 * the templates before it is projected out.  anything less and the fit is degenerate.
	 */
	public static final double DEGENERACY_TOLERANCE = 1e-10;

	/**
	 * pull out the smallest box that holds all of a lenslet's footprints, grown by a margin on
	 * every side and then clipped to the image.
	 * @param image the detector image
	 * @param pixsol the pixel solution that says where the lenslet's light goes
	 * @param lenslet the lenslet id
	 * @param margin how many pixels to add on each side
	 * @return a view of the image covering the lenslet
	 * @throws BoundsException if the lenslet doesn't land on the image at all
	 */
	public static Cutout extractCutout(DetectorImage image, PixelSolution pixsol, int lenslet, int margin) {
		if (margin < 0)
			throw new IllegalArgumentException("the margin can't be negative, but it's " + margin);
		if (lenslet < 0 || lenslet >= pixsol.lensletCount())
			throw new BoundsException("there is no such lenslet in a " + pixsol.numLenslets + "×" + pixsol.numLenslets + " array", lenslet, null);
		Box union = pixsol.union(lenslet);
		if (union == null)
			throw new BoundsException("every footprint of this lenslet is off the detector", lenslet, null);
		Box bounds = union.expand(margin).intersect(image.bounds());
		if (bounds.isEmpty())
			throw new BoundsException("this lenslet's footprints don't overlap the image", lenslet, union.expand(margin));
		return new Cutout(image, bounds, lenslet, pixsol.getGrid(), pixsol.getFootprints(lenslet));
	}

	/**
	 * fit one lenslet's spectrum using unit variance and the default margin
	 */
	public static SpectrumResult fitCutout(DetectorImage image, PixelSolution pixsol, int lenslet,
	                                       ProfileModel profile, FitMode mode) {
		return fitCutout(image, null, pixsol, lenslet, profile, mode, DEFAULT_MARGIN);
	}

	/**
	 * fit one lenslet's spectrum
	 * @param image the detector image
	 * @param variance its variance map, or null for unit variance
	 * @param pixsol the pixel solution
	 * @param lenslet the lenslet id
	 * @param profile the PSF-let profile
	 * @param mode how to do the fit
	 * @param margin how far to grow the cutout beyond the footprints
	 * @throws BoundsException if the lenslet doesn't land on the image
	 * @throws FitDegenerateException if the templates can't be told apart
	 */
	public static SpectrumResult fitCutout(DetectorImage image, DetectorImage variance, PixelSolution pixsol,
	                                       int lenslet, ProfileModel profile, FitMode mode, int margin) {
		if (variance != null && !variance.sameShapeAs(image))
			throw new IllegalArgumentException("the variance map must be the same shape as the image");
		Cutout cutout = extractCutout(image, pixsol, lenslet, margin);
		return fitCutout(cutout, profile, variance, PixelMask.compute(cutout, variance), mode);
	}

	/**
	 * fit a spectrum to a cutout that's already been extracted and masked
	 */
	public static SpectrumResult fitCutout(Cutout cutout, ProfileModel profile, DetectorImage variance,
	                                       PixelMask mask, FitMode mode) {
		if (!mask.getBounds().equals(cutout.getBounds()))
			throw new IllegalArgumentException("the mask covers " + mask.getBounds() + " but the cutout covers " + cutout.getBounds());
		double[][][] templates = new double[cutout.numChannels()][][];
		for (int k = 0; k < templates.length; k ++)
			templates[k] = profile.normalizedTemplate(k, cutout.getFootprint(k));

		switch (mode) {
			case LSTSQ:
				return leastSquares(cutout, templates, variance, mask);
			case EXT:
				return matchedFilter(cutout, templates, variance, mask);
			case APPHOT:
				return aperturePhotometry(cutout, variance, mask);
			default:
				throw new IllegalArgumentException("unrecognized fit mode: " + mode);
		}
	}

	/**
	 * solve for every channel's amplitude at once by minimizing χ² = Σ (d - Σ_k a_k p_k)²/σ²
	 * over the unmasked pixels.  channels whose templates have no unmasked pixels come out as
	 * no-data.
	 */
	private static SpectrumResult leastSquares(Cutout cutout, double[][][] templates,
	                                           DetectorImage variance, PixelMask mask) {
		Box bounds = cutout.getBounds();
		int numChannels = templates.length;

		// decide which channels can be fit at all
		List<Integer> active = new ArrayList<>();
		for (int k = 0; k < numChannels; k ++) {
			if (templates[k] == null)
				continue;
			Box box = cutout.getFootprint(k).getBox();
			search:
			for (int y = box.y0; y < box.y1; y ++) {
				for (int x = box.x0; x < box.x1; x ++) {
					if (mask.isGoodAbsolute(y, x) && templates[k][y - box.y0][x - box.x0] != 0) {
						active.add(k);
						break search;
					}
				}
			}
		}

		if (active.isEmpty())
			return SpectrumResult.empty(cutout.getLenslet(), cutout.getGrid());
		double[] flux = new double[numChannels];
		double[] fluxVariance = new double[numChannels];
		Arrays.fill(flux, Double.NaN);
		Arrays.fill(fluxVariance, Double.POSITIVE_INFINITY);

		// build the design matrix, one row per usable pixel
		int numPixels = mask.numGood();
		double[][] design = new double[numPixels][active.size()];
		double[] data = new double[numPixels];
		double[] weights = new double[numPixels];
		int r = 0;
		for (int y = bounds.y0; y < bounds.y1; y ++) {
			for (int x = bounds.x0; x < bounds.x1; x ++) {
				if (!mask.isGoodAbsolute(y, x))
					continue;
				for (int a = 0; a < active.size(); a ++) {
					int k = active.get(a);
					Box box = cutout.getFootprint(k).getBox();
					if (box.contains(x, y))
						design[r][a] = templates[k][y - box.y0][x - box.x0];
				}
				data[r] = cutout.getAbsolute(y, x);
				weights[r] = 1/PixelMask.varianceAt(variance, y, x);
				r ++;
			}
		}

		Matrix A = new Matrix(numPixels, active.size(), design);
		Matrix covariance;
		try {
			covariance = A.weighted_gram(weights).cholesky_inverse(DEGENERACY_TOLERANCE);
		} catch (Matrix.SingularMatrixException e) {
			int k = active.get(e.index);
			throw new FitDegenerateException(
					"this channel's template can't be distinguished from its neighbors'",
					cutout.getLenslet(), cutout.getGrid().get(k).wavelength, bounds);
		}
		double[] amplitudes = covariance.matmul(A.weighted_trans_times(weights, data));
		for (int a = 0; a < active.size(); a ++) {
			int k = active.get(a);
			if (!Double.isFinite(amplitudes[a]) || !(covariance.get(a, a) > 0))
				throw new FitDegenerateException("the fit came out non-finite",
				                                 cutout.getLenslet(), cutout.getGrid().get(k).wavelength, bounds);
			flux[k] = amplitudes[a];
			fluxVariance[k] = covariance.get(a, a);
		}
		return new SpectrumResult(cutout.getLenslet(), cutout.getGrid(), flux, fluxVariance);
	}

	/**
	 * project each channel onto its own template, without weights: a = Σpd/Σp²
	 */
	private static SpectrumResult matchedFilter(Cutout cutout, double[][][] templates,
	                                            DetectorImage variance, PixelMask mask) {
		int numChannels = templates.length;
		double[] flux = new double[numChannels];
		double[] fluxVariance = new double[numChannels];
		for (int k = 0; k < numChannels; k ++) {
			double pd = 0, p2 = 0, p2σ2 = 0;
			if (templates[k] != null) {
				Box box = cutout.getFootprint(k).getBox();
				for (int y = box.y0; y < box.y1; y ++) {
					for (int x = box.x0; x < box.x1; x ++) {
						if (!mask.isGoodAbsolute(y, x))
							continue;
						double p = templates[k][y - box.y0][x - box.x0];
						pd += p*cutout.getAbsolute(y, x);
						p2 += p*p;
						p2σ2 += p*p*PixelMask.varianceAt(variance, y, x);
					}
				}
			}
			if (p2 > 0) {
				flux[k] = pd/p2;
				fluxVariance[k] = p2σ2/(p2*p2);
			}
			else {
				flux[k] = Double.NaN;
				fluxVariance[k] = Double.POSITIVE_INFINITY;
			}
		}
		return new SpectrumResult(cutout.getLenslet(), cutout.getGrid(), flux, fluxVariance);
	}

	/**
	 * add up the unmasked pixels in each channel's footprint
	 */
	private static SpectrumResult aperturePhotometry(Cutout cutout,
	                                                 DetectorImage variance, PixelMask mask) {
		int numChannels = cutout.numChannels();
		double[] flux = new double[numChannels];
		double[] fluxVariance = new double[numChannels];
		for (int k = 0; k < numChannels; k ++) {
			double sum = 0, σ2 = 0;
			int count = 0;
			Footprint footprint = cutout.getFootprint(k);
			if (!footprint.isNull()) {
				Box box = footprint.getBox();
				for (int y = box.y0; y < box.y1; y ++) {
					for (int x = box.x0; x < box.x1; x ++) {
						if (!mask.isGoodAbsolute(y, x))
							continue;
						sum += cutout.getAbsolute(y, x);
						σ2 += PixelMask.varianceAt(variance, y, x);
						count ++;
					}
				}
			}
			if (count > 0) {
				flux[k] = sum;
				fluxVariance[k] = σ2;
			}
			else {
				flux[k] = Double.NaN;
				fluxVariance[k] = Double.POSITIVE_INFINITY;
			}
		}
		return new SpectrumResult(cutout.getLenslet(), cutout.getGrid(), flux, fluxVariance);
	}
}
