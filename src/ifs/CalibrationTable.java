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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * the wavelength calibration: the geometric coefficients measured at a handful of
 * wavelengths, in order of strictly increasing wavelength.
 */
public final class CalibrationTable {
	/** the shortest wavelength we believe a calibration row can have (nm) */
	public static final double MIN_WAVELENGTH = 400;
	/** the longest wavelength we believe a calibration row can have (nm) */
	public static final double MAX_WAVELENGTH = 1200;

	private final List<CalibrationPoint> points;

	/**
	 * @throws CalibrationException if the table is empty or ragged, if any wavelength is outside
	 *                              (400, 1200) nm, or if the wavelengths don't strictly increase
	 */
	public CalibrationTable(List<CalibrationPoint> points) {
		if (points.isEmpty())
			throw new CalibrationException("the calibration table is empty");
		int numCoefficients = points.get(0).numCoefficients();
		if (numCoefficients == 0)
			throw new CalibrationException("the calibration table has no coefficients");
		for (int i = 0; i < points.size(); i ++) {
			CalibrationPoint point = points.get(i);
			if (!(point.wavelength > MIN_WAVELENGTH && point.wavelength < MAX_WAVELENGTH))
				throw new CalibrationException(String.format(
						"calibration wavelengths must be in (%.0f, %.0f) nm", MIN_WAVELENGTH, MAX_WAVELENGTH),
				                               point.wavelength);
			if (point.numCoefficients() != numCoefficients)
				throw new CalibrationException(String.format(
						"this row has %d coefficients but the first has %d", point.numCoefficients(), numCoefficients),
				                               point.wavelength);
			if (i > 0 && !(point.wavelength > points.get(i - 1).wavelength))
				throw new CalibrationException("calibration wavelengths must strictly increase", point.wavelength);
		}
		this.points = Collections.unmodifiableList(new ArrayList<>(points));
	}

	/**
	 * build a table from a column of wavelengths and a matching matrix of coefficients
	 */
	public static CalibrationTable of(double[] wavelengths, double[][] coefficients) {
		if (wavelengths.length != coefficients.length)
			throw new CalibrationException(String.format(
					"%d wavelengths but %d rows of coefficients", wavelengths.length, coefficients.length));
		List<CalibrationPoint> points = new ArrayList<>(wavelengths.length);
		for (int i = 0; i < wavelengths.length; i ++)
			points.add(new CalibrationPoint(wavelengths[i], coefficients[i]));
		return new CalibrationTable(points);
	}

	/**
	 * read a calibration table (lamsol.dat) where each line is a wavelength in nm followed by
	 * that wavelength's coefficients, separated by whitespace or commas.
	 * @throws IOException if the file can't be read
	 * @throws CalibrationException if its contents don't make a valid table
	 */
	public static CalibrationTable load(File file) throws IOException {
		double[][] rows;
		try {
			rows = CSV.read(file, CSV.WHITESPACE);
		} catch (NumberFormatException e) {
			try {
				rows = CSV.read(file, ','); // it might be comma-separated instead
			} catch (NumberFormatException f) {
				throw new IOException("could not parse the calibration table " + file, f);
			}
		}
		List<CalibrationPoint> points = new ArrayList<>(rows.length);
		for (double[] row: rows) {
			if (row.length < 2)
				throw new CalibrationException("every row of " + file + " needs a wavelength and at least one coefficient");
			double[] coefficients = new double[row.length - 1];
			System.arraycopy(row, 1, coefficients, 0, coefficients.length);
			points.add(new CalibrationPoint(row[0], coefficients));
		}
		return new CalibrationTable(points);
	}

	public int size() {
		return points.size();
	}

	public int numCoefficients() {
		return points.get(0).numCoefficients();
	}

	public CalibrationPoint get(int i) {
		return points.get(i);
	}

	public List<CalibrationPoint> getPoints() {
		return points;
	}

	public double[] getWavelengths() {
		double[] wavelengths = new double[points.size()];
		for (int i = 0; i < wavelengths.length; i ++)
			wavelengths[i] = points.get(i).wavelength;
		return wavelengths;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof CalibrationTable && this.points.equals(((CalibrationTable) o).points);
	}

	@Override
	public int hashCode() {
		return points.hashCode();
	}
}
