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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CalibrationTableTest {

	@TempDir
	Path directory;

	private File write(String name, String contents) throws IOException {
		Path file = directory.resolve(name);
		Files.writeString(file, contents);
		return file.toFile();
	}

	@Test
	void loadsAWhitespaceDelimitedTable() throws IOException {
		File file = write("lamsol.dat",
		                  "# wavelength  x coefficients  y coefficients\n" +
		                  "600.0   0.0 0.0 1.0   -120.0 1.0 0.0\n" +
		                  "720.0\t0.0 0.0 1.0    120.0 1.0 0.0\n");
		CalibrationTable table = CalibrationTable.load(file);
		assertEquals(2, table.size());
		assertEquals(6, table.numCoefficients());
		assertArrayEquals(new double[] {600, 720}, table.getWavelengths());
		assertArrayEquals(new double[] {0, 0, 1, 120, 1, 0}, table.get(1).getCoefficients());
		assertEquals(SyntheticInstrument.calibration(), table);
	}

	@Test
	void loadsACommaDelimitedTable() throws IOException {
		File file = write("lamsol.csv", "650, 1.5, 2.5\n700, 1.75, 3\n");
		CalibrationTable table = CalibrationTable.load(file);
		assertEquals(2, table.size());
		assertEquals(3.0, table.get(1).getCoefficient(1));
	}

	@Test
	void rejectsGarbage() throws IOException {
		File file = write("lamsol.dat", "650 one two\n");
		assertThrows(IOException.class, () -> CalibrationTable.load(file));
	}

	@Test
	void rejectsRowsWithoutCoefficients() throws IOException {
		File file = write("lamsol.dat", "650 1 2\n700\n");
		assertThrows(CalibrationException.class, () -> CalibrationTable.load(file));
	}

	@Test
	void rejectsImplausibleWavelengths() {
		CalibrationException e = assertThrows(CalibrationException.class, () -> CalibrationTable.of(
				new double[] {350, 700}, new double[][] {{0}, {1}}));
		assertEquals(350, e.getWavelength());
		assertThrows(CalibrationException.class, () -> CalibrationTable.of(
				new double[] {700, 1200}, new double[][] {{0}, {1}}));
	}

	@Test
	void rejectsWavelengthsOutOfOrder() {
		assertThrows(CalibrationException.class, () -> CalibrationTable.of(
				new double[] {800, 700}, new double[][] {{0}, {1}}));
		assertThrows(CalibrationException.class, () -> CalibrationTable.of(
				new double[] {700, 700}, new double[][] {{0}, {1}}));
	}

	@Test
	void rejectsRaggedTables() {
		assertThrows(CalibrationException.class, () -> CalibrationTable.of(
				new double[] {700, 800}, new double[][] {{0, 1}, {1}}));
		assertThrows(CalibrationException.class, () -> CalibrationTable.of(
				new double[] {700, 800}, new double[][] {{0, 1}}));
	}

	@Test
	void pointsAreCopiedIn() {
		double[] coefficients = {1, 2};
		CalibrationPoint point = new CalibrationPoint(700, coefficients);
		coefficients[0] = 99;
		assertEquals(1, point.getCoefficient(0));
		point.getCoefficients()[1] = 99;
		assertEquals(2, point.getCoefficient(1));
	}
}
