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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * a class for reading and writing the plain text tables that go in and out of this thing.
 */
public class CSV {

	/** the delimiter to pass when any run of whitespace separates the elements */
	public static final char WHITESPACE = ' ';

	/**
	 * read a simple CSV file, with any standard line break character, and return its contents
	 * as a double matrix.  elements must be parsable as doubles.  whitespace adjacent to
	 * delimiters will be stripped, and lines starting with '#' are skipped.
	 * @param file the CSV file to open
	 * @param delimiter the delimiting character, usually ',', or {@link #WHITESPACE}
	 * @return the rows of the file, not necessarily all the same length
	 * @throws IOException if file cannot be found or permission is denied
	 * @throws NumberFormatException if elements are not parsable as doubles
	 */
	public static double[][] read(File file, char delimiter)
			throws NumberFormatException, IOException {
		return read(file, delimiter, 0);
	}

	/**
	 * read a simple CSV file, with any standard line break character, and return its contents
	 * as a double matrix.  elements must be parsable as doubles.  whitespace adjacent to
	 * delimiters will be stripped, and lines starting with '#' are skipped.  a blank line ends
	 * the table.
	 * @param file the CSV file to open
	 * @param delimiter the delimiting character, usually ',', or {@link #WHITESPACE}
	 * @param headerRows the number of initial rows to skip
	 * @return the rows of the file, not necessarily all the same length
	 * @throws IOException if file cannot be found or permission is denied
	 * @throws NumberFormatException if elements are not parsable as doubles
	 */
	public static double[][] read(File file, char delimiter, int headerRows)
			throws NumberFormatException, IOException {
		List<double[]> list = new ArrayList<>();
		try (BufferedReader in = new BufferedReader(new FileReader(file))) {
			String line;
			for (int i = 0; i < headerRows; i ++)
				in.readLine();
			while ((line = in.readLine()) != null) {
				line = line.trim();
				if (line.startsWith("#"))
					continue;
				if (line.isEmpty())
					break;
				String[] elements = split(line, delimiter);
				double[] row = new double[elements.length];
				for (int j = 0; j < elements.length; j++)
					row[j] = parse(elements[j]);
				list.add(row);
			}
		}
		return list.toArray(new double[0][]);
	}

	/**
	 * read the first few lines of a file as strings, split on the delimiter.
	 * @param file the file to open
	 * @param delimiter the delimiting character
	 * @param headerRows how many lines to read
	 * @return one array of elements per line
	 * @throws IOException if the file cannot be found, or ends before the header does
	 */
	public static String[][] readHeader(File file, char delimiter, int headerRows) throws IOException {
		String[][] header = new String[headerRows][];
		try (BufferedReader in = new BufferedReader(new FileReader(file))) {
			for (int i = 0; i < headerRows; i ++) {
				String line = in.readLine();
				if (line == null)
					throw new IOException(file + " ends before its header does");
				header[i] = split(line.trim(), delimiter);
			}
		}
		return header;
	}

	/**
	 * save the given matrix as a simple CSV file, using the given delimiter character.
	 * @param data the numbers to be written
	 * @param file the file at which to save
	 * @param delimiter the delimiter character, usually ','
	 * @throws IOException if the file cannot be found or permission is denied
	 */
	public static void write(double[][] data, File file, char delimiter)
			throws IOException {
		write(data, file, delimiter, new String[0][]);
	}

	/**
	 * save the given matrix as a simple CSV file, using the given delimiter character, under
	 * any number of header lines.
	 * @param data the numbers to be written
	 * @param file the file at which to save
	 * @param delimiter the delimiter character, usually ','
	 * @param header the lists of strings to put on top, one list per line
	 * @throws IOException if the file cannot be found or permission is denied
	 */
	public static void write(double[][] data, File file, char delimiter, String[]... header)
			throws IOException {
		try (BufferedWriter out = new BufferedWriter(new FileWriter(file))) {
			for (String[] line: header) {
				for (int j = 0; j < line.length; j++) {
					out.append(line[j]);
					if (j < line.length - 1)
						out.append(delimiter);
				}
				out.newLine();
			}
			for (double[] datum: data) {
				for (int j = 0; j < datum.length; j++) {
					out.append(Double.toString(datum[j]));
					if (j < datum.length - 1)
						out.append(delimiter);
				}
				out.newLine();
			}
		}
	}

	private static String[] split(String line, char delimiter) {
		if (delimiter == WHITESPACE)
			return line.split("\\s+");
		else
			return line.split("\\s*" + Pattern.quote(String.valueOf(delimiter)) + "\\s*");
	}

	private static double parse(String element) {
		return switch (element.toLowerCase()) {
			case "nan" -> Double.NaN;
			case "inf", "infinity" -> Double.POSITIVE_INFINITY;
			case "-inf", "-infinity" -> Double.NEGATIVE_INFINITY;
			default -> Double.parseDouble(element);
		};
	}
}
