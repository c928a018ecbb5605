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
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InstrumentConfigTest {

	@Test
	void defaultsDescribeTheFlightInstrument() {
		InstrumentConfig config = InstrumentConfig.defaults();
		assertEquals(50, config.resolvingPower);
		assertEquals(0, config.numChannels);
		assertEquals(600, config.blue);
		assertEquals(720, config.red);
		assertEquals(108, config.numLenslets);
		assertEquals(174, config.lensletPitch);
		assertEquals(13, config.pixelSize);
		assertEquals(1024, config.detectorRows);
		assertEquals(1024, config.detectorCols);
		assertEquals(3, config.interpolationOrder);
		assertEquals(2, config.cutoutMargin);
	}

	@Test
	void theDefaultGridUsesTheNaturalChannelCount() {
		WavelengthGrid grid = InstrumentConfig.defaults().wavelengthGrid();
		assertEquals(9, grid.size());
		assertEquals(600, grid.getBlue());
		assertEquals(720, grid.getRed());
	}

	@Test
	void propertiesOverrideTheDefaults() {
		Properties properties = new Properties();
		properties.setProperty("channels", "18");
		properties.setProperty("resolving.power", " 70 ");
		properties.setProperty("detector.rows", "2048");
		properties.setProperty("profile.sigma.y", "1.25");
		properties.setProperty("lenslet.pitch", "");
		InstrumentConfig config = InstrumentConfig.fromProperties(properties);
		assertEquals(18, config.wavelengthGrid().size());
		assertEquals(70, config.resolvingPower);
		assertEquals(2048, config.detectorRows);
		assertEquals(1024, config.detectorCols);
		assertEquals(174, config.lensletPitch);
		assertEquals(1.25, config.profile().sigmaY);
		assertEquals(0.7, config.profile().sigmaX);
	}

	@Test
	void unparseableValuesAreConfigurationErrors() {
		Properties properties = new Properties();
		properties.setProperty("lenslet.count", "many");
		ConfigurationException e = assertThrows(
				ConfigurationException.class, () -> InstrumentConfig.fromProperties(properties));
		assertTrue(e.getMessage().contains("lenslet.count"));
		assertTrue(e.getCause() instanceof NumberFormatException);
	}

	@Test
	void outOfRangeValuesAreConfigurationErrors() {
		for (String[] entry: new String[][] {
				{"resolving.power", "0"}, {"channels", "-1"}, {"bandpass.red", "500"},
				{"pixel.size", "-13"}, {"interpolation.order", "-1"}, {"cutout.margin", "-2"},
				{"profile.sigma.x", "0"}, {"detector.cols", "0"}}) {
			Properties properties = new Properties();
			properties.setProperty(entry[0], entry[1]);
			assertThrows(ConfigurationException.class, () -> InstrumentConfig.fromProperties(properties), entry[0]);
		}
	}

	@Test
	void sizesTooBigToAllocateAreConfigurationErrors() {
		Properties lenslets = new Properties();
		lenslets.setProperty("lenslet.count", "46341");
		assertThrows(ConfigurationException.class, () -> InstrumentConfig.fromProperties(lenslets));

		Properties channels = new Properties();
		channels.setProperty("channels", String.valueOf(Integer.MAX_VALUE));
		assertThrows(ConfigurationException.class, () -> InstrumentConfig.fromProperties(channels));

		Properties resolution = new Properties();
		resolution.setProperty("resolving.power", "1e12");
		InstrumentConfig config = InstrumentConfig.fromProperties(resolution);
		assertThrows(ConfigurationException.class, config::wavelengthGrid);
	}

	@Test
	void loadsFromAFile(@TempDir Path directory) throws IOException {
		Path path = directory.resolve("ifs.properties");
		Files.writeString(path, "# a small test instrument\nlenslet.count = 4\nchannels = 3\npixel.size = 10\n");
		InstrumentConfig config = InstrumentConfig.load(path.toFile());
		assertEquals(4, config.numLenslets);
		assertEquals(3, config.numChannels);
		assertEquals(10, config.pixelSize);
	}

	@Test
	void missingFileIsAnIOException() {
		assertThrows(IOException.class, () -> InstrumentConfig.load(new File("no/such/ifs.properties")));
	}
}
