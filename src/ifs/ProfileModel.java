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
 * the spatial shape of a PSF-let: how much of a channel's light lands on each pixel of its
 * footprint.  the weights don't need to be normalized; the extractors scale them to unit sum
 * over the footprint themselves.  implementations must be immutable, since one profile is
 * shared by every lenslet being extracted.
 */
@FunctionalInterface
public interface ProfileModel {

	/** a profile that spreads the light evenly over the footprint */
	ProfileModel UNIFORM = (k, footprint, x, y) -> 1;

	/**
	 * @param k the index of the wavelength channel
	 * @param footprint that channel's footprint
	 * @param x the detector column of the pixel
	 * @param y the detector row of the pixel
	 * @return the relative amount of light from this channel landing on this pixel
	 */
	double weight(int k, Footprint footprint, int x, int y);

	/**
	 * the weights of one channel over its footprint, scaled to sum to one.  rows and collums
	 * are relative to the corner of the footprint's box.
	 * @return the normalized weights, or null if the footprint is null or the weights don't add
	 * up to anything positive
	 */
	default double[][] normalizedTemplate(int k, Footprint footprint) {
		if (footprint.isNull())
			return null;
		Box box = footprint.getBox();
		double[][] template = new double[box.height()][box.width()];
		double total = 0;
		for (int y = box.y0; y < box.y1; y ++) {
			for (int x = box.x0; x < box.x1; x ++) {
				double p = this.weight(k, footprint, x, y);
				template[y - box.y0][x - box.x0] = p;
				total += p;
			}
		}
		if (!(total > 0) || Double.isInfinite(total))
			return null;
		for (double[] row: template)
			for (int j = 0; j < row.length; j ++)
				row[j] /= total;
		return template;
	}
}
