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
 * which pixels of a cutout are fit to use: those with finite data and a finite, positive
 * variance.  it's computed once per cutout and then shared by whichever reductions run on it.
 */
public final class PixelMask {
	private final Box bounds;
	private final boolean[][] good;
	private final int numGood;

	private PixelMask(Box bounds, boolean[][] good, int numGood) {
		this.bounds = bounds;
		this.good = good;
		this.numGood = numGood;
	}

	/**
	 * @param cutout the cutout to check
	 * @param variance the variance map of the whole detector image the cutout came from, or null
	 *                 to treat every pixel as having unit variance
	 */
	public static PixelMask compute(Cutout cutout, DetectorImage variance) {
		Box bounds = cutout.getBounds();
		if (variance != null && !variance.bounds().intersect(bounds).equals(bounds))
			throw new IllegalArgumentException("the variance map does not cover " + bounds);
		boolean[][] good = new boolean[cutout.rows()][cutout.cols()];
		int numGood = 0;
		for (int i = 0; i < cutout.rows(); i ++) {
			for (int j = 0; j < cutout.cols(); j ++) {
				double σ2 = varianceAt(variance, bounds.y0 + i, bounds.x0 + j);
				good[i][j] = Double.isFinite(cutout.get(i, j)) && σ2 > 0 && Double.isFinite(σ2);
				if (good[i][j])
					numGood ++;
			}
		}
		return new PixelMask(bounds, good, numGood);
	}

	/**
	 * look up a pixel in a variance map, where a missing map means unit variance
	 */
	static double varianceAt(DetectorImage variance, int y, int x) {
		return (variance == null) ? 1 : variance.get(y, x);
	}

	/**
	 * is this pixel usable?  coordinates are relative to the corner of the cutout.
	 */
	public boolean isGood(int row, int col) {
		return good[row][col];
	}

	/**
	 * is this pixel usable?  coordinates are detector coordinates.
	 */
	public boolean isGoodAbsolute(int y, int x) {
		return bounds.contains(x, y) && good[y - bounds.y0][x - bounds.x0];
	}

	public int numGood() {
		return numGood;
	}

	public Box getBounds() {
		return bounds;
	}
}
