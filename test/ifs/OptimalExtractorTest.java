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

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OptimalExtractorTest {

	/**
	 * a single lenslet whose only channel covers the whole of a 5×5 detector
	 */
	private static PixelSolution flatPixsol() {
		WavelengthGrid grid = WavelengthGrid.build(50, 1, 600, 720);
		Footprint[][] footprints = {{new Footprint(2, 2, new Box(0, 5, 0, 5))}};
		return new PixelSolution(1, 5, 5, grid, "flat", footprints);
	}

	@Test
	void flatProfileOnFlatData() {
		PixelSolution pixsol = flatPixsol();
		DetectorImage image = DetectorImage.constant(5, 5, 1.0); // 25 counts in all
		DetectorImage variance = DetectorImage.constant(5, 5, 1.0);
		Cutout cutout = CutoutExtractor.extractCutout(image, pixsol, 0, 0);

		SpectrumResult spectrum = OptimalExtractor.optimalExtract(cutout, ProfileModel.UNIFORM, variance);
		assertEquals(1, spectrum.size());
		assertEquals(25, spectrum.getFlux(0), 1e-9);
		assertEquals(25, spectrum.getVariance(0), 1e-9);
		assertFalse(spectrum.isNoData(0));
	}

	@Test
	void tabulatedProfileMatchesTheUniformOne() {
		double[][][] templates = new double[1][5][5];
		for (double[] row: templates[0])
			Arrays.fill(row, 1/25.);
		TabulatedProfile profile = new TabulatedProfile(new Box(0, 5, 0, 5), templates);
		assertEquals(1, profile.numChannels());
		assertEquals(0, profile.weight(1, null, 2, 2));
		assertEquals(0, profile.weight(0, null, 5, 2));
		Cutout cutout = CutoutExtractor.extractCutout(
				DetectorImage.constant(5, 5, 1.0), flatPixsol(), 0, 0);
		SpectrumResult spectrum = OptimalExtractor.optimalExtract(
				cutout, profile, DetectorImage.constant(5, 5, 1.0));
		assertEquals(25, spectrum.getFlux(0), 1e-9);
		assertEquals(25, spectrum.getVariance(0), 1e-9);
	}

	@Test
	void zeroVarianceMeansNoData() {
		Cutout cutout = CutoutExtractor.extractCutout(
				DetectorImage.constant(5, 5, 1.0), flatPixsol(), 0, 0);
		SpectrumResult spectrum = OptimalExtractor.optimalExtract(
				cutout, ProfileModel.UNIFORM, DetectorImage.constant(5, 5, 0.0));
		assertTrue(Double.isNaN(spectrum.getFlux(0)));
		assertEquals(Double.POSITIVE_INFINITY, spectrum.getVariance(0));
		assertTrue(spectrum.isNoData(0));
		assertEquals(1, spectrum.numNoData());
	}

	@Test
	void varianceScalesTheUncertaintyButNotTheFlux() {
		Cutout cutout = CutoutExtractor.extractCutout(
				DetectorImage.constant(5, 5, 1.0), flatPixsol(), 0, 0);
		SpectrumResult spectrum = OptimalExtractor.optimalExtract(
				cutout, ProfileModel.UNIFORM, DetectorImage.constant(5, 5, 4.0));
		assertEquals(25, spectrum.getFlux(0), 1e-9);
		assertEquals(100, spectrum.getVariance(0), 1e-9);
	}

	@Test
	void recoversInjectedFlux() {
		PixelSolution pixsol = SyntheticInstrument.pixsol(SyntheticInstrument.config());
		GaussianProfile profile = new GaussianProfile(0.7, 0.7);
		DetectorImage image = new DetectorImage(SyntheticInstrument.scene(pixsol, profile));
		DetectorImage variance = DetectorImage.constant(image.rows(), image.cols(), 1);

		int id = pixsol.id(2, 2);
		Cutout cutout = CutoutExtractor.extractCutout(image, pixsol, id, 2);
		SpectrumResult spectrum = OptimalExtractor.optimalExtract(cutout, profile, variance);
		assertArrayEquals(SyntheticInstrument.spectrum(id, 3), spectrum.getFlux(), 1e-9);
		assertEquals(id, spectrum.getLenslet());
		assertArrayEquals(pixsol.getGrid().getMidpoints(), new double[] {
				spectrum.getWavelength(0), spectrum.getWavelength(1), spectrum.getWavelength(2)});
		for (int k = 0; k < 3; k ++)
			assertTrue(spectrum.getVariance(k) > 1 && Double.isFinite(spectrum.getVariance(k)));
	}

	@Test
	void channelsOffTheDetectorHaveNoData() {
		PixelSolution pixsol = SyntheticInstrument.pixsol(SyntheticInstrument.config());
		GaussianProfile profile = new GaussianProfile(0.7, 0.7);
		DetectorImage image = new DetectorImage(SyntheticInstrument.scene(pixsol, profile));
		DetectorImage variance = DetectorImage.constant(image.rows(), image.cols(), 1);

		int id = pixsol.id(1, 0);
		SpectrumResult spectrum = OptimalExtractor.optimalExtract(
				CutoutExtractor.extractCutout(image, pixsol, id, 2), profile, variance);
		double[] expected = SyntheticInstrument.spectrum(id, 3);
		assertTrue(spectrum.isNoData(0));
		assertEquals(expected[1], spectrum.getFlux(1), 1e-9);
		assertEquals(expected[2], spectrum.getFlux(2), 1e-9);
	}

	@Test
	void masksBadPixelsWithoutBias() {
		PixelSolution pixsol = SyntheticInstrument.pixsol(SyntheticInstrument.config());
		GaussianProfile profile = new GaussianProfile(0.7, 0.7);
		double[][] pixels = SyntheticInstrument.scene(pixsol, profile);
		int id = pixsol.id(2, 2);
		DetectorImage variance = DetectorImage.constant(pixels.length, pixels[0].length, 1);
		SpectrumResult clean = OptimalExtractor.optimalExtract(
				CutoutExtractor.extractCutout(new DetectorImage(pixels), pixsol, id, 2), profile, variance);

		Footprint footprint = pixsol.getFootprint(id, 1);
		pixels[(int) Math.round(footprint.cy)][(int) Math.round(footprint.cx)] = Double.NaN;
		DetectorImage image = new DetectorImage(pixels);
		double[][] before = image.getValues();
		SpectrumResult dirty = OptimalExtractor.optimalExtract(
				CutoutExtractor.extractCutout(image, pixsol, id, 2), profile, variance);

		assertArrayEquals(clean.getFlux(), dirty.getFlux(), 1e-9);
		assertTrue(dirty.getVariance(1) > clean.getVariance(1));
		assertEquals(clean.getVariance(0), dirty.getVariance(0));
		assertEquals(clean.getVariance(2), dirty.getVariance(2));
		assertArrayEquals(before, image.getValues());
	}

	@Test
	void insistsOnAMatchingVarianceMap() {
		Cutout cutout = CutoutExtractor.extractCutout(
				DetectorImage.constant(5, 5, 1.0), flatPixsol(), 0, 0);
		assertThrows(IllegalArgumentException.class,
		             () -> OptimalExtractor.optimalExtract(cutout, ProfileModel.UNIFORM, null));
		assertThrows(IllegalArgumentException.class,
		             () -> OptimalExtractor.optimalExtract(cutout, ProfileModel.UNIFORM, DetectorImage.constant(3, 3, 1.0)));
	}

	@Test
	void spectrumTable() {
		WavelengthGrid grid = WavelengthGrid.build(50, 2, 600, 720);
		SpectrumResult spectrum = new SpectrumResult(7, grid, new double[] {3, Double.NaN},
		                                             new double[] {0.5, Double.POSITIVE_INFINITY});
		double[][] table = spectrum.toTable();
		assertArrayEquals(new double[] {grid.get(0).wavelength, 3, 0.5}, table[0]);
		assertTrue(Double.isNaN(table[1][1]));
		assertTrue(spectrum.isNoData(1));
		assertFalse(spectrum.isNoData(0));
		assertEquals(2, SpectrumResult.empty(7, grid).numNoData());
		assertThrows(IllegalArgumentException.class,
		             () -> new SpectrumResult(7, grid, new double[1], new double[2]));
	}
}
