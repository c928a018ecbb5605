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
import java.util.Collections;
import java.util.List;

/**
 * the part of a detector image that belongs to one lenslet.  this is a view: it holds the
 * source image and a box, not a copy of the pixels, and it never writes to the image.  it also
 * knows which part of itself each wavelength channel occupies, so it can be read as a stack of
 * (wavelength × row × col) slices.
 */
public final class Cutout {
	private final DetectorImage image;
	private final Box bounds;
	private final int lenslet;
	private final WavelengthGrid grid;
	/** the footprint of each channel, cut down to the bounds */
	private final List<Footprint> footprints;

	Cutout(DetectorImage image, Box bounds, int lenslet, WavelengthGrid grid, List<Footprint> footprints) {
		if (bounds.isEmpty() || !image.bounds().intersect(bounds).equals(bounds))
			throw new IllegalArgumentException(bounds + " is not a nonempty region of the image");
		if (footprints.size() != grid.size())
			throw new IllegalArgumentException("there must be one footprint per channel");
		this.image = image;
		this.bounds = bounds;
		this.lenslet = lenslet;
		this.grid = grid;
		List<Footprint> clipped = new ArrayList<>(footprints.size());
		for (Footprint footprint: footprints)
			clipped.add(footprint.within(bounds));
		this.footprints = Collections.unmodifiableList(clipped);
	}

	/**
	 * the value of a pixel, in coordinates relative to the corner of the cutout
	 */
	public double get(int row, int col) {
		if (row < 0 || row >= rows() || col < 0 || col >= cols())
			throw new IndexOutOfBoundsException(String.format("(%d, %d) is outside this %d×%d cutout", row, col, rows(), cols()));
		return image.get(bounds.y0 + row, bounds.x0 + col);
	}

	/**
	 * the value of a pixel in channel k's slice of the cutout: the pixel itself where channel k's
	 * footprint covers it, and zero elsewhere.
	 */
	public double get(int k, int row, int col) {
		Footprint footprint = footprints.get(k);
		if (footprint.isNull() || !footprint.getBox().contains(bounds.x0 + col, bounds.y0 + row))
			return 0;
		return get(row, col);
	}

	/**
	 * the value of a pixel in detector coordinates, which must be inside the bounds
	 */
	public double getAbsolute(int y, int x) {
		return get(y - bounds.y0, x - bounds.x0);
	}

	public int rows() {
		return bounds.height();
	}

	public int cols() {
		return bounds.width();
	}

	public int numChannels() {
		return footprints.size();
	}

	/**
	 * @return the 4 bounds of the cutout on the detector
	 */
	public Box getBounds() {
		return bounds;
	}

	public int getLenslet() {
		return lenslet;
	}

	public WavelengthGrid getGrid() {
		return grid;
	}

	public Footprint getFootprint(int k) {
		return footprints.get(k);
	}

	public List<Footprint> getFootprints() {
		return footprints;
	}

	/**
	 * copy the cutout's pixels out into their own array
	 */
	public double[][] toArray() {
		double[][] pixels = new double[rows()][cols()];
		for (int i = 0; i < rows(); i ++)
			for (int j = 0; j < cols(); j ++)
				pixels[i][j] = get(i, j);
		return pixels;
	}
}
