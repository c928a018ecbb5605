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
 * a PSF-let profile given explicitly as one template image per wavelength channel, covering
 * some region of the detector (like the monochromatic flats a calibration run produces).
 * outside that region every weight is zero.
 */
public final class TabulatedProfile implements ProfileModel {
	private final Box region;
	private final double[][][] templates;

	/**
	 * @param region the part of the detector the templates cover
	 * @param templates one region-sized array per channel, indexed [k][row][col]
	 */
	public TabulatedProfile(Box region, double[][][] templates) {
		this.region = region;
		this.templates = new double[templates.length][][];
		for (int k = 0; k < templates.length; k ++) {
			if (templates[k].length != region.height())
				throw new IllegalArgumentException("template " + k + " doesn't match the height of " + region);
			for (double[] row: templates[k])
				if (row.length != region.width())
					throw new IllegalArgumentException("template " + k + " doesn't match the width of " + region);
			this.templates[k] = Math2.deepCopy(templates[k]);
		}
	}

	@Override
	public double weight(int k, Footprint footprint, int x, int y) {
		if (k < 0 || k >= templates.length || !region.contains(x, y))
			return 0;
		return templates[k][y - region.y0][x - region.x0];
	}

	public int numChannels() {
		return templates.length;
	}

	public Box getRegion() {
		return region;
	}
}
