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

/**
 * a 2-D array of detector pixels (a raw frame, or the variance map that goes with one).  the
 * values are copied in on construction and can't be changed afterward, so any number of
 * cutouts can borrow the same image at once.
 */
public final class DetectorImage {
	private final double[][] values;
	private final int rows, cols;

	public DetectorImage(double[][] values) {
		if (values.length == 0 || values[0].length == 0)
			throw new IllegalArgumentException("an image must have at least one pixel");
		this.rows = values.length;
		this.cols = values[0].length;
		this.values = new double[rows][];
		for (int i = 0; i < rows; i ++) {
			if (values[i].length != cols)
				throw new IllegalArgumentException("do not accept jagged arrays.");
			this.values[i] = values[i].clone();
		}
	}

	/**
	 * an image where every pixel has the same value, such as a unit variance map
	 */
	public static DetectorImage constant(int rows, int cols, double value) {
		double[][] values = new double[rows][cols];
		for (double[] row: values)
			Arrays.fill(row, value);
		return new DetectorImage(values);
	}

	/**
	 * read an image from a comma-separated file with one line per detector row
	 * @throws IOException if the file can't be read or isn't a rectangular array of numbers
	 */
	public static DetectorImage load(File file) throws IOException {
		try {
			return new DetectorImage(CSV.read(file, ','));
		} catch (IllegalArgumentException e) {
			throw new IOException(file + " is not a valid image", e);
		}
	}

	public double get(int row, int col) {
		return values[row][col];
	}

	public int rows() {
		return rows;
	}

	public int cols() {
		return cols;
	}

	public Box bounds() {
		return new Box(0, cols, 0, rows);
	}

	public boolean sameShapeAs(DetectorImage that) {
		return this.rows == that.rows && this.cols == that.cols;
	}

	public double[][] getValues() {
		return Math2.deepCopy(values);
	}
}
