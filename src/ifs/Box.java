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
 * a rectangle of detector pixels, given by its 4 integer bounds.  both ranges are half-open,
 * so the box covers columns x0 ≤ x < x1 and rows y0 ≤ y < y1.  x is the detector column and
 * y is the detector row, which is also the dispersion direction.
 */
public final class Box {
	public final int x0;
	public final int x1;
	public final int y0;
	public final int y1;

	public Box(int x0, int x1, int y0, int y1) {
		this.x0 = x0;
		this.x1 = x1;
		this.y0 = y0;
		this.y1 = y1;
	}

	public int width() {
		return Math.max(0, x1 - x0);
	}

	public int height() {
		return Math.max(0, y1 - y0);
	}

	public boolean isEmpty() {
		return width() == 0 || height() == 0;
	}

	public boolean contains(int x, int y) {
		return x >= x0 && x < x1 && y >= y0 && y < y1;
	}

	/**
	 * the smallest box containing both this and that
	 */
	public Box union(Box that) {
		return new Box(Math.min(this.x0, that.x0), Math.max(this.x1, that.x1),
		               Math.min(this.y0, that.y0), Math.max(this.y1, that.y1));
	}

	/**
	 * the overlap of this and that, which may be empty
	 */
	public Box intersect(Box that) {
		return new Box(Math.max(this.x0, that.x0), Math.min(this.x1, that.x1),
		               Math.max(this.y0, that.y0), Math.min(this.y1, that.y1));
	}

	/**
	 * grow the box by the same number of pixels on all four sides
	 */
	public Box expand(int margin) {
		return new Box(x0 - margin, x1 + margin, y0 - margin, y1 + margin);
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Box))
			return false;
		Box that = (Box) o;
		return this.x0 == that.x0 && this.x1 == that.x1 && this.y0 == that.y0 && this.y1 == that.y1;
	}

	@Override
	public int hashCode() {
		return ((x0*31 + x1)*31 + y0)*31 + y1;
	}

	@Override
	public String toString() {
		return String.format("[%d, %d)×[%d, %d)", x0, x1, y0, y1);
	}
}
