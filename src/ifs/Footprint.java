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
 * where one lenslet's PSF-let falls on the detector at one wavelength: a sub-pixel centroid
 * and the box of pixels it covers, clipped to the detector.  if nothing is left after
 * clipping, the box is absent and this is a null footprint, which extraction skips.
 */
public final class Footprint {
	/** the centroid, in detector pixels (pixel centres are at integer coordinates) */
	public final double cx, cy;
	/** the clipped pixel box, or null if this is a null footprint */
	private final Box box;

	public Footprint(double cx, double cy, Box box) {
		this.cx = cx;
		this.cy = cy;
		this.box = (box == null || box.isEmpty()) ? null : box;
	}

	/**
	 * a footprint that didn't make it onto the detector
	 */
	public static Footprint none(double cx, double cy) {
		return new Footprint(cx, cy, null);
	}

	public boolean isNull() {
		return box == null;
	}

	/**
	 * @return the pixel box, or null if this is a null footprint
	 */
	public Box getBox() {
		return box;
	}

	/**
	 * this same PSF-let, but only the part of it inside the given region
	 */
	public Footprint within(Box region) {
		if (box == null)
			return this;
		return new Footprint(cx, cy, box.intersect(region));
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Footprint))
			return false;
		Footprint that = (Footprint) o;
		return Double.compare(this.cx, that.cx) == 0 && Double.compare(this.cy, that.cy) == 0 &&
		       ((this.box == null) ? that.box == null : this.box.equals(that.box));
	}

	@Override
	public int hashCode() {
		return (Double.hashCode(cx)*31 + Double.hashCode(cy))*31 + ((box == null) ? 0 : box.hashCode());
	}

	@Override
	public String toString() {
		return String.format("(%.3f, %.3f) in %s", cx, cy, (box == null) ? "nothing" : box);
	}
}
