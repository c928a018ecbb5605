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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DetectorImageTest {

	@Test
	void loadsARectangularTable(@TempDir Path directory) throws IOException {
		Path path = directory.resolve("image.csv");
		Files.writeString(path, "1,2,3\n4,nan,6\n");
		DetectorImage image = DetectorImage.load(path.toFile());
		assertEquals(2, image.rows());
		assertEquals(3, image.cols());
		assertEquals(6, image.get(1, 2));
		assertTrue(Double.isNaN(image.get(1, 1)));
	}

	@Test
	void unparseableNumbersAreIOExceptions(@TempDir Path directory) throws IOException {
		Path path = directory.resolve("image.csv");
		Files.writeString(path, "1,2,3\n4,five,6\n");
		IOException e = assertThrows(IOException.class, () -> DetectorImage.load(path.toFile()));
		assertTrue(e.getCause() instanceof NumberFormatException);
	}

	@Test
	void jaggedTablesAreIOExceptions(@TempDir Path directory) throws IOException {
		Path path = directory.resolve("image.csv");
		Files.writeString(path, "1,2,3\n4,5\n");
		IOException e = assertThrows(IOException.class, () -> DetectorImage.load(path.toFile()));
		assertTrue(e.getCause() instanceof IllegalArgumentException);
	}
}
