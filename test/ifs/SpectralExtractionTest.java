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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpectralExtractionTest {

	private static final GaussianProfile PROFILE = new GaussianProfile(0.7, 0.7);

	@Test
	void oneBadLensletDoesNotSpoilTheRest() {
		// on a 100×100 detector the left collum and top row of lenslets miss entirely
		PixelSolution pixsol = SyntheticInstrument.pixsol(SyntheticInstrument.config(100, 100));
		DetectorImage image = new DetectorImage(SyntheticInstrument.scene(pixsol, PROFILE));

		SortedMap<Integer, SpectralExtraction.LensletOutcome> outcomes = SpectralExtraction.extractAll(
				image, null, pixsol, PROFILE, ExtractionMode.OPTIMAL, 2, 3);

		assertEquals(16, outcomes.size());
		List<Integer> ids = new ArrayList<>(outcomes.keySet());
		for (int id = 0; id < 16; id ++)
			assertEquals(id, ids.get(id));

		for (int id = 0; id < 16; id ++) {
			SpectralExtraction.LensletOutcome outcome = outcomes.get(id);
			assertEquals(id, outcome.lenslet);
			if (pixsol.ix(id) == 0 || pixsol.iy(id) == 0) {
				assertFalse(outcome.isSuccess(), outcome.toString());
				assertTrue(outcome.getError() instanceof BoundsException);
				assertEquals(id, outcome.getError().getLenslet());
				assertNull(outcome.getSpectrum());
			}
			else {
				assertTrue(outcome.isSuccess(), outcome.toString());
				assertArrayEquals(SyntheticInstrument.spectrum(id, 3), outcome.getSpectrum().getFlux(), 1e-8);
			}
		}
		assertEquals(Map.of("BoundsException", 7), SpectralExtraction.summarizeFailures(outcomes));
	}

	@Test
	void degenerateFitsAreCollectedToo() {
		WavelengthGrid grid = WavelengthGrid.build(50, 2, 600, 720);
		Footprint a = new Footprint(3, 3, new Box(1, 6, 1, 6));
		Footprint b = new Footprint(3, 13, new Box(1, 6, 11, 16));
		Footprint c = new Footprint(3, 18, new Box(1, 6, 16, 21));
		// one solution has two identical channels, the other two distinct ones
		PixelSolution pixsol = new PixelSolution(
				1, 24, 8, grid, "twins", new Footprint[][] {{a, a}});
		PixelSolution healthy = new PixelSolution(
				1, 24, 8, grid, "distinct", new Footprint[][] {{b, c}});
		DetectorImage image = DetectorImage.constant(24, 8, 1.0);

		SpectralExtraction.LensletOutcome bad = SpectralExtraction.extractAll(
				image, null, pixsol, ProfileModel.UNIFORM, ExtractionMode.leastSquares(FitMode.LSTSQ), 2, 1).get(0);
		assertTrue(bad.getError() instanceof FitDegenerateException);

		SpectralExtraction.LensletOutcome good = SpectralExtraction.extractAll(
				image, null, healthy, ProfileModel.UNIFORM, ExtractionMode.leastSquares(FitMode.LSTSQ), 2, 1).get(0);
		assertTrue(good.isSuccess());
		assertArrayEquals(new double[] {25, 25}, good.getSpectrum().getFlux(), 1e-9);
	}

	@Test
	void resultsDontDependOnTheNumberOfThreads() {
		PixelSolution pixsol = SyntheticInstrument.pixsol(SyntheticInstrument.config());
		DetectorImage image = new DetectorImage(SyntheticInstrument.scene(pixsol, PROFILE));
		ExtractionMode mode = ExtractionMode.leastSquares(FitMode.LSTSQ);
		SortedMap<Integer, SpectralExtraction.LensletOutcome> serial = SpectralExtraction.extractAll(
				image, null, pixsol, PROFILE, mode, 2, 1);
		SortedMap<Integer, SpectralExtraction.LensletOutcome> parallel = SpectralExtraction.extractAll(
				image, null, pixsol, PROFILE, mode, 2, 4);
		for (int id = 0; id < pixsol.lensletCount(); id ++)
			assertArrayEquals(serial.get(id).getSpectrum().getFlux(), parallel.get(id).getSpectrum().getFlux());
	}

	@Test
	void rejectsBadArguments() {
		PixelSolution pixsol = SyntheticInstrument.pixsol(SyntheticInstrument.config());
		DetectorImage image = DetectorImage.constant(128, 128, 0);
		assertThrows(IllegalArgumentException.class, () -> SpectralExtraction.extractAll(
				image, DetectorImage.constant(64, 64, 1), pixsol, PROFILE, ExtractionMode.OPTIMAL, 2, 1));
		assertThrows(IllegalArgumentException.class, () -> SpectralExtraction.extractAll(
				image, null, pixsol, PROFILE, ExtractionMode.OPTIMAL, 2, 0));
	}

	@Test
	void cubeHasAHoleWhereverALensletFailed(@TempDir Path directory) throws IOException {
		PixelSolution pixsol = SyntheticInstrument.pixsol(SyntheticInstrument.config(100, 100));
		DetectorImage image = new DetectorImage(SyntheticInstrument.scene(pixsol, PROFILE));
		SortedMap<Integer, SpectralExtraction.LensletOutcome> outcomes = SpectralExtraction.extractAll(
				image, null, pixsol, PROFILE, ExtractionMode.OPTIMAL, 2, 2);

		SpectralCube cube = SpectralCube.assemble(outcomes, pixsol);
		assertEquals(3, cube.numChannels());
		assertTrue(Double.isNaN(cube.getFlux(1, 2, 0)));
		assertEquals(Double.POSITIVE_INFINITY, cube.getVariance(1, 2, 0));
		int id = pixsol.id(3, 2);
		assertEquals(SyntheticInstrument.spectrum(id, 3)[1], cube.getFlux(1, 2, 3), 1e-8);
		assertEquals(4, cube.fluxSlice(0).length);

		cube.writeSlices(directory.toFile());
		for (int k = 0; k < 3; k ++) {
			assertTrue(Files.exists(directory.resolve(String.format("cube-flux-%03d.csv", k))));
			assertTrue(Files.exists(directory.resolve(String.format("cube-variance-%03d.csv", k))));
		}
		double[][] slice = CSV.read(directory.resolve("cube-flux-001.csv").toFile(), ',');
		assertEquals(cube.getFlux(1, 2, 3), slice[2][3]);
		assertTrue(Double.isNaN(slice[0][0]));
		double[][] wavelengths = CSV.read(directory.resolve("cube-wavelengths.csv").toFile(), ',', 1);
		assertEquals(pixsol.getGrid().get(2).wavelength, wavelengths[2][0]);

		double[][] table = SpectralExtraction.spectraTable(outcomes, pixsol);
		assertEquals(9*3, table.length);
		assertArrayEquals(new double[] {5, 1, 1}, new double[] {table[0][0], table[0][1], table[0][2]});
	}

	@Test
	void reusesAPixelSolutionOnlyWhileItsKeyMatches(@TempDir Path directory) throws IOException {
		File file = directory.resolve("cache").resolve("pixsol.csv").toFile();
		InstrumentConfig config = SyntheticInstrument.config();
		PSFLetModel model = SyntheticInstrument.model();
		PixelSolution first = SpectralExtraction.loadOrGenerate(file, model, config.wavelengthGrid(), config);
		assertTrue(file.exists());
		long saved = file.lastModified();

		PixelSolution second = SpectralExtraction.loadOrGenerate(file, model, config.wavelengthGrid(), config);
		assertEquals(first, second);
		assertEquals(saved, file.lastModified());

		InstrumentConfig wider = SyntheticInstrument.config(128, 160);
		PixelSolution third = SpectralExtraction.loadOrGenerate(file, model, wider.wavelengthGrid(), wider);
		assertEquals(160, third.detectorCols);
		assertEquals(PixelSolution.key(wider.wavelengthGrid(), model, wider), third.getKey());
	}

	@Test
	void runsEndToEnd(@TempDir Path directory) throws IOException {
		InstrumentConfig config = SyntheticInstrument.config();
		PixelSolution pixsol = SyntheticInstrument.pixsol(config);
		File imageFile = directory.resolve("frame.csv").toFile();
		CSV.write(SyntheticInstrument.scene(pixsol, PROFILE), imageFile, ',');
		File calibrationFile = directory.resolve("lamsol.dat").toFile();
		double[][] rows = new double[2][];
		for (int i = 0; i < 2; i ++) {
			CalibrationPoint point = SyntheticInstrument.calibration().get(i);
			rows[i] = new double[1 + point.numCoefficients()];
			rows[i][0] = point.wavelength;
			System.arraycopy(point.getCoefficients(), 0, rows[i], 1, point.numCoefficients());
		}
		CSV.write(rows, calibrationFile, ' ');
		Path output = directory.resolve("out");
		Path properties = directory.resolve("run.properties");
		Files.writeString(properties, String.join("\n",
				"lenslet.count = 4",
				"lenslet.pitch = 300",
				"pixel.size = 10",
				"detector.rows = 128",
				"detector.cols = 128",
				"channels = 3",
				"interpolation.order = 1",
				"extraction.mode = lstsq",
				"threads = 2",
				"calibration.file = " + calibrationFile.getPath().replace('\\', '/'),
				"image.file = " + imageFile.getPath().replace('\\', '/'),
				"output.dir = " + output.toString().replace('\\', '/')));

		SpectralExtraction.main(new String[] {properties.toString()});

		assertTrue(Files.exists(output.resolve("pixsol.csv")));
		assertTrue(Files.exists(output.resolve("log-extraction.log")));
		double[][] spectra = CSV.read(output.resolve("spectra.csv").toFile(), ',', 1);
		assertEquals(16*3, spectra.length);
		double[] midpoints = pixsol.getGrid().getMidpoints();
		for (int r = 0; r < spectra.length; r ++) {
			double[] row = spectra[r];
			int id = (int) row[0];
			int k = r%3;
			assertEquals(r/3, id);
			assertEquals(midpoints[k], row[3], 1e-9);
			if (Double.isNaN(row[4]))
				assertEquals(0, pixsol.iy(id));
			else
				assertEquals(SyntheticInstrument.spectrum(id, 3)[k], row[4], 1e-6);
		}
	}

	@Test
	void mainNeedsAConfiguration() {
		assertThrows(IllegalArgumentException.class, () -> SpectralExtraction.main(new String[0]));
	}
}
