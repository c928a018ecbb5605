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
 * Horne-style optimal extraction.  each channel is reduced on its own: the flux estimate is
 * the inverse-variance-weighted projection of the data onto that channel's normalized profile,
 *
 *     F = Σ(p d/σ²) / Σ(p²/σ²),   Var(F) = 1 / Σ(p²/σ²),
 *
 * taken over the unmasked pixels of the channel's footprint.  the profile is normalized over
 * the whole footprint before masking, so a masked pixel costs signal to noise but does not
 * bias the flux.
 */
public class OptimalExtractor {

	/**
	 * extract a spectrum, masking out any pixel with non-finite data or a variance that isn't
	 * finite and positive.
	 * @param cutout the lenslet's cutout
	 * @param profile the PSF-let profile
	 * @param variance the variance map of the image the cutout came from
	 * @return the spectrum, with no-data channels wherever nothing usable was left
	 */
	public static SpectrumResult optimalExtract(Cutout cutout, ProfileModel profile, DetectorImage variance) {
		if (variance == null)
			throw new IllegalArgumentException("optimal extraction needs a variance map");
		return optimalExtract(cutout, profile, variance, PixelMask.compute(cutout, variance));
	}

	/**
	 * extract a spectrum using a mask that has already been computed for this cutout
	 */
	public static SpectrumResult optimalExtract(Cutout cutout, ProfileModel profile, DetectorImage variance, PixelMask mask) {
		if (variance == null)
			throw new IllegalArgumentException("optimal extraction needs a variance map");
		if (!mask.getBounds().equals(cutout.getBounds()))
			throw new IllegalArgumentException("the mask covers " + mask.getBounds() + " but the cutout covers " + cutout.getBounds());

		int numChannels = cutout.numChannels();
		double[] flux = new double[numChannels];
		double[] fluxVariance = new double[numChannels];
		for (int k = 0; k < numChannels; k ++) {
			Footprint footprint = cutout.getFootprint(k);
			double[][] p = profile.normalizedTemplate(k, footprint);
			double numerator = 0, denominator = 0;
			if (p != null) {
				Box box = footprint.getBox();
				for (int y = box.y0; y < box.y1; y ++) {
					for (int x = box.x0; x < box.x1; x ++) {
						if (!mask.isGoodAbsolute(y, x))
							continue;
						double pij = p[y - box.y0][x - box.x0];
						double w = 1/variance.get(y, x);
						numerator += w*pij*cutout.getAbsolute(y, x);
						denominator += w*pij*pij;
					}
				}
			}
			if (denominator > 0 && Double.isFinite(denominator) && Double.isFinite(numerator)) {
				flux[k] = numerator/denominator;
				fluxVariance[k] = 1/denominator;
			}
			else { // nothing left to measure this channel with
				flux[k] = Double.NaN;
				fluxVariance[k] = Double.POSITIVE_INFINITY;
			}
		}
		return new SpectrumResult(cutout.getLenslet(), cutout.getGrid(), flux, fluxVariance);
	}
}
